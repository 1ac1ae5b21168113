package es.hargos.tenantguard.service;

import es.hargos.tenantguard.context.SessionContextBinder;
import es.hargos.tenantguard.dto.response.RedeemCouponResult;
import es.hargos.tenantguard.entity.CouponEntity;
import es.hargos.tenantguard.entity.TenantEntity;
import es.hargos.tenantguard.entity.TenantMembershipEntity;
import es.hargos.tenantguard.repository.CouponRepository;
import es.hargos.tenantguard.repository.TenantMembershipRepository;
import es.hargos.tenantguard.repository.TenantRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongUnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

/**
 * Many owners redeem the same coupon at once. Row locks are modeled with one
 * {@link ReentrantLock} per row, held until the simulated transaction ends.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Coupon redemption under concurrency")
class CouponRedemptionConcurrencyTest {

    private static final int THREADS = 8;
    private static final long COUPON_ID = 100L;

    @Mock
    private CouponRepository couponRepository;

    @Mock
    private TenantRepository tenantRepository;

    @Mock
    private TenantMembershipRepository membershipRepository;

    @Mock
    private SessionContextBinder contextBinder;

    @Mock
    private EntityManager entityManager;

    private final ReentrantLock couponLock = new ReentrantLock();
    private final Map<Long, ReentrantLock> tenantLocks = new ConcurrentHashMap<>();
    private final ThreadLocal<List<ReentrantLock>> heldLocks = ThreadLocal.withInitial(ArrayList::new);

    // Committed row state
    private final Object rows = new Object();
    private Long redeemedForTenantId;
    private Long redeemedByUserId;
    private LocalDateTime redeemedAt;
    private boolean couponActive = true;
    private final Map<Long, Long> balances = new HashMap<>();
    private final Map<Long, String> balanceCurrencies = new HashMap<>();

    private CouponService couponService;

    @BeforeEach
    void setUp() {
        TransactionOperations transactions = new TransactionOperations() {
            @Override
            public <T> T execute(TransactionCallback<T> action) {
                try {
                    return action.doInTransaction(new SimpleTransactionStatus());
                } finally {
                    List<ReentrantLock> held = heldLocks.get();
                    for (ReentrantLock lock : held) {
                        lock.unlock();
                    }
                    held.clear();
                }
            }
        };
        SystemOperationService systemOps = new SystemOperationService(transactions, contextBinder, entityManager);
        couponService = new CouponService(couponRepository, tenantRepository, membershipRepository, systemOps);

        when(couponRepository.findByCode("WELCOME50")).thenAnswer(inv -> Optional.of(readCoupon()));
        when(tenantRepository.findById(anyLong())).thenAnswer(inv -> Optional.of(readTenant(inv.getArgument(0))));
        when(membershipRepository.findByTenantIdAndUserId(anyLong(), any())).thenAnswer(inv ->
                Optional.of(TenantMembershipEntity.builder()
                        .tenantId(inv.getArgument(0))
                        .userId(inv.getArgument(1))
                        .role("owner")
                        .build()));

        when(entityManager.find(CouponEntity.class, COUPON_ID, LockModeType.PESSIMISTIC_WRITE)).thenAnswer(inv -> {
            lockRow(couponLock);
            return readCoupon();
        });
        doAnswer(inv -> {
            TenantEntity tenant = inv.getArgument(0);
            lockRow(tenantLocks.computeIfAbsent(tenant.getId(), id -> new ReentrantLock()));
            copyInto(tenant);
            return null;
        }).when(entityManager).refresh(any(TenantEntity.class), eq(LockModeType.PESSIMISTIC_WRITE));

        when(couponRepository.save(any(CouponEntity.class))).thenAnswer(inv -> {
            CouponEntity coupon = inv.getArgument(0);
            synchronized (rows) {
                redeemedForTenantId = coupon.getRedeemedForTenantId();
                redeemedByUserId = coupon.getRedeemedByUserId();
                redeemedAt = coupon.getRedeemedAt();
                couponActive = Boolean.TRUE.equals(coupon.getIsActive());
            }
            return coupon;
        });
        when(tenantRepository.save(any(TenantEntity.class))).thenAnswer(inv -> {
            TenantEntity tenant = inv.getArgument(0);
            synchronized (rows) {
                balances.put(tenant.getId(), tenant.getBalance());
                balanceCurrencies.put(tenant.getId(), tenant.getBalanceCurrency());
            }
            return tenant;
        });
    }

    @Test
    @DisplayName("exactly one concurrent redemption in one tenant succeeds and credit is applied once")
    void exactlyOneSucceedsWithinTenant() throws Exception {
        List<RedeemCouponResult> results = redeemConcurrently(thread -> 1L);

        RedeemCouponResult winner = singleSuccess(results);
        assertThat(winner.getNewBalance()).isEqualTo(5000);
        synchronized (rows) {
            assertThat(balances).containsOnly(Map.entry(1L, 5000L));
            assertThat(balanceCurrencies.get(1L)).isEqualTo("usd");
            assertThat(redeemedForTenantId).isEqualTo(1L);
            assertThat(redeemedByUserId).isBetween(10L, 10L + THREADS - 1);
            assertThat(redeemedAt).isNotNull();
            assertThat(couponActive).isFalse();
        }
    }

    @Test
    @DisplayName("exactly one tenant is credited when owners of different tenants race for the coupon")
    void exactlyOneTenantCredited() throws Exception {
        List<RedeemCouponResult> results = redeemConcurrently(thread -> 1L + thread);

        singleSuccess(results);
        synchronized (rows) {
            assertThat(balances).hasSize(1);
            Map.Entry<Long, Long> credited = balances.entrySet().iterator().next();
            assertThat(credited.getValue()).isEqualTo(5000L);
            assertThat(credited.getKey()).isEqualTo(redeemedForTenantId);
            assertThat(redeemedByUserId).isEqualTo(10L + redeemedForTenantId - 1);
        }
    }

    private List<RedeemCouponResult> redeemConcurrently(LongUnaryOperator tenantForThread) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RedeemCouponResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                long userId = 10L + i;
                long tenantId = tenantForThread.applyAsLong(i);
                futures.add(pool.submit(() -> {
                    start.await();
                    return couponService.redeemCouponForTenant("welcome50", tenantId, userId);
                }));
            }
            start.countDown();

            List<RedeemCouponResult> results = new ArrayList<>();
            for (Future<RedeemCouponResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static RedeemCouponResult singleSuccess(List<RedeemCouponResult> results) {
        List<RedeemCouponResult> successes = new ArrayList<>();
        for (RedeemCouponResult result : results) {
            if (result.isSuccess()) {
                successes.add(result);
            } else {
                assertThat(result.getMessage()).isEqualTo("Coupon has already been redeemed");
            }
        }
        assertThat(successes).hasSize(1);
        return successes.get(0);
    }

    private void lockRow(ReentrantLock lock) {
        if (!lock.isHeldByCurrentThread()) {
            lock.lock();
            heldLocks.get().add(lock);
        }
    }

    private CouponEntity readCoupon() {
        CouponEntity coupon = CouponEntity.builder()
                .id(COUPON_ID)
                .code("WELCOME50")
                .creditAmount(5000L)
                .currency("usd")
                .build();
        synchronized (rows) {
            coupon.setIsActive(couponActive);
            coupon.setRedeemedForTenantId(redeemedForTenantId);
            coupon.setRedeemedByUserId(redeemedByUserId);
            coupon.setRedeemedAt(redeemedAt);
        }
        return coupon;
    }

    private TenantEntity readTenant(long tenantId) {
        TenantEntity tenant = TenantEntity.builder()
                .id(tenantId)
                .name("Tenant " + tenantId)
                .slug("tenant-" + tenantId)
                .ownerId(10L)
                .build();
        copyInto(tenant);
        return tenant;
    }

    private void copyInto(TenantEntity tenant) {
        synchronized (rows) {
            tenant.setBalance(balances.getOrDefault(tenant.getId(), 0L));
            tenant.setBalanceCurrency(balanceCurrencies.get(tenant.getId()));
        }
    }
}
