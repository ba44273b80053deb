package com.shopadmin.backend.modules.permission.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

class AuthorizationCacheTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000401");

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("disabled cache reads storage on every lookup")
    void disabledCacheAlwaysLoads() {
        AuthorizationCache cache = new AuthorizationCache(false, Duration.ofMinutes(5), 100);
        AtomicInteger loads = new AtomicInteger();

        cache.userRole(USER_ID, () -> Optional.of("R" + loads.incrementAndGet()));
        Optional<String> second = cache.userRole(USER_ID, () -> Optional.of("R" + loads.incrementAndGet()));

        assertThat(loads).hasValue(2);
        assertThat(second).contains("R2");
    }

    @Test
    @DisplayName("enabled cache serves repeated lookups from memory until evicted")
    void enabledCacheServesUntilEvicted() {
        AuthorizationCache cache = new AuthorizationCache(true, Duration.ofMinutes(5), 100);
        AtomicInteger loads = new AtomicInteger();

        cache.userRole(USER_ID, () -> Optional.of("R" + loads.incrementAndGet()));
        assertThat(cache.userRole(USER_ID, () -> Optional.of("R" + loads.incrementAndGet()))).contains("R1");

        cache.evictUser(USER_ID);

        assertThat(cache.userRole(USER_ID, () -> Optional.of("R" + loads.incrementAndGet()))).contains("R2");
    }

    @Test
    @DisplayName("entries expire after the configured staleness bound")
    void entriesExpireAfterTtl() throws InterruptedException {
        AuthorizationCache cache = new AuthorizationCache(true, Duration.ofMillis(50), 100);
        cache.userRole(USER_ID, () -> Optional.of("OLD"));

        Thread.sleep(120);

        assertThat(cache.userRole(USER_ID, () -> Optional.of("NEW"))).contains("NEW");
    }

    @Test
    @DisplayName("eviction runs again when the surrounding transaction completes")
    void evictionRepeatsAfterTransactionCompletion() {
        AuthorizationCache cache = new AuthorizationCache(true, Duration.ofMinutes(5), 100);
        TransactionSynchronizationManager.initSynchronization();

        cache.evictRole("EDITOR");
        // a concurrent reader re-populates with pre-commit state
        cache.rolePermissions("EDITOR", Set::of);

        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        assertThat(synchronizations).hasSize(1);
        synchronizations.forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));

        AtomicInteger loads = new AtomicInteger();
        cache.rolePermissions("EDITOR", () -> {
            loads.incrementAndGet();
            return Set.of();
        });
        assertThat(loads).hasValue(1);
    }
}
