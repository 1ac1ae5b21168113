package es.hargos.tenantguard.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
@EnableCaching
public class CacheConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

    public static final String SUBSCRIPTION_TIERS = "subscriptionTiers";

    @Value("${cache.tiers.ttl-minutes:10}")
    private long tiersTtlMinutes;

    @Value("${cache.tiers.max-size:100}")
    private int tiersMaxSize;

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();

        // Tier catalog is read-mostly
        cacheManager.registerCustomCache(SUBSCRIPTION_TIERS,
                Caffeine.newBuilder()
                        .expireAfterWrite(tiersTtlMinutes, TimeUnit.MINUTES)
                        .maximumSize(tiersMaxSize)
                        .recordStats()
                        .build());

        logger.info("Cache configured - subscription tiers: {} min TTL, max {} entries",
                tiersTtlMinutes, tiersMaxSize);

        return cacheManager;
    }
}
