package com.shopadmin.backend.modules.permission.application;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Read-through caches in front of the catalog and grant stores.
 * <p>
 * Every mutation evicts the affected keys immediately and again once its transaction completes,
 * so a concurrent reader cannot re-populate a key with pre-commit data for longer than the
 * configured TTL. With {@code app.authorization.cache.enabled=false} every lookup hits storage.
 */
@Component
public class AuthorizationCache {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationCache.class);

    private final boolean enabled;
    private final Cache<CapabilityKey, Optional<Capability>> capabilities;
    private final Cache<String, Set<Capability>> rolePermissions;
    private final Cache<UUID, Map<UUID, OverrideSnapshot>> userOverrides;
    private final Cache<UUID, Optional<String>> userRoles;

    public AuthorizationCache(
            @Value("${app.authorization.cache.enabled:true}") boolean enabled,
            @Value("${app.authorization.cache.ttl:PT30S}") Duration ttl,
            @Value("${app.authorization.cache.maximum-size:10000}") long maximumSize
    ) {
        this.enabled = enabled;
        this.capabilities = newCache(ttl, maximumSize);
        this.rolePermissions = newCache(ttl, maximumSize);
        this.userOverrides = newCache(ttl, maximumSize);
        this.userRoles = newCache(ttl, maximumSize);
        log.info("Authorization cache enabled={} ttl={} maximumSize={}", enabled, ttl, maximumSize);
    }

    private static <K, V> Cache<K, V> newCache(Duration ttl, long maximumSize) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
    }

    public Optional<Capability> capability(ResourceType resourceType, ActionType actionType,
                                           Supplier<Optional<Capability>> loader) {
        return lookup(capabilities, new CapabilityKey(resourceType, actionType), loader);
    }

    public Set<Capability> rolePermissions(String roleCode, Supplier<Set<Capability>> loader) {
        return lookup(rolePermissions, roleCode, loader);
    }

    public Map<UUID, OverrideSnapshot> userOverrides(UUID userId, Supplier<Map<UUID, OverrideSnapshot>> loader) {
        return lookup(userOverrides, userId, loader);
    }

    public Optional<String> userRole(UUID userId, Supplier<Optional<String>> loader) {
        return lookup(userRoles, userId, loader);
    }

    /**
     * Catalog changes can flip the active flag seen through role permission sets too.
     */
    public void evictCatalog() {
        evictNowAndAfterCompletion(() -> {
            capabilities.invalidateAll();
            rolePermissions.invalidateAll();
        });
    }

    public void evictRole(String roleCode) {
        evictNowAndAfterCompletion(() -> rolePermissions.invalidate(roleCode));
    }

    public void evictUser(UUID userId) {
        evictNowAndAfterCompletion(() -> {
            userOverrides.invalidate(userId);
            userRoles.invalidate(userId);
        });
    }

    public void evictAll() {
        evictNowAndAfterCompletion(() -> {
            capabilities.invalidateAll();
            rolePermissions.invalidateAll();
            userOverrides.invalidateAll();
            userRoles.invalidateAll();
        });
    }

    private <K, V> V lookup(Cache<K, V> cache, K key, Supplier<V> loader) {
        if (!enabled) {
            return loader.get();
        }
        return cache.get(key, ignored -> loader.get());
    }

    private void evictNowAndAfterCompletion(Runnable eviction) {
        eviction.run();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    eviction.run();
                }
            });
        }
    }

    private record CapabilityKey(ResourceType resourceType, ActionType actionType) {
    }
}
