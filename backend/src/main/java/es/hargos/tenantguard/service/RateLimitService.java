package es.hargos.tenantguard.service;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-user rate limiting with Bucket4j for endpoints that accept guessable codes.
 *
 * Each (operation, user) pair gets its own bucket. Users do NOT share limits, and
 * coupon redemption and discount validation are counted separately.
 */
@Service
public class RateLimitService {

    private static final Logger log = LoggerFactory.getLogger(RateLimitService.class);

    private final int capacity;
    private final Duration refillPeriod;

    private final ConcurrentMap<BucketKey, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimitService(@Value("${rate-limit.redemption.capacity:10}") int capacity,
                            @Value("${rate-limit.redemption.refill-minutes:1}") long refillMinutes) {
        this.capacity = capacity;
        this.refillPeriod = Duration.ofMinutes(refillMinutes);
    }

    /**
     * @return true if the request is allowed, false if the user exhausted the bucket
     */
    public boolean tryConsume(Operation operation, Long userId) {
        Bucket bucket = buckets.computeIfAbsent(new BucketKey(operation, userId), this::newBucket);
        if (!bucket.tryConsume(1)) {
            log.warn("Rate limit exceeded for user {} on {} ({} req / {} min)",
                    userId, operation, capacity, refillPeriod.toMinutes());
            return false;
        }
        return true;
    }

    public long getAvailableTokens(Operation operation, Long userId) {
        Bucket bucket = buckets.get(new BucketKey(operation, userId));
        return bucket != null ? bucket.getAvailableTokens() : capacity;
    }

    /**
     * Drop all buckets (tests, configuration reload).
     */
    public void clear() {
        buckets.clear();
    }

    private Bucket newBucket(BucketKey key) {
        Bandwidth limit = Bandwidth.classic(capacity, Refill.intervally(capacity, refillPeriod));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    public enum Operation {
        COUPON_REDEMPTION,
        DISCOUNT_VALIDATION
    }

    private static final class BucketKey {
        private final Operation operation;
        private final Long userId;

        private BucketKey(Operation operation, Long userId) {
            this.operation = operation;
            this.userId = userId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BucketKey)) return false;
            BucketKey that = (BucketKey) o;
            return operation == that.operation && Objects.equals(userId, that.userId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operation, userId);
        }
    }
}
