package com.bazaarvoice.rbac.cache;

import com.bazaarvoice.rbac.api.Decision;
import com.bazaarvoice.rbac.api.DecisionOutcome;
import com.bazaarvoice.rbac.config.CacheConfiguration;
import com.bazaarvoice.rbac.metrics.CacheMetrics;
import com.bazaarvoice.rbac.time.ClockTicker;
import com.codahale.metrics.MetricRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.cache.RemovalCause;
import com.google.common.cache.RemovalListener;
import com.google.common.cache.RemovalNotification;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.SetMultimap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.Closeable;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Multi-level cache for permission resolution.
 * <ol>
 *     <li>Decisions, keyed by {@link DecisionKey}.</li>
 *     <li>Effective permissions, keyed by {@link ScopeKey}.</li>
 *     <li>Role closures, keyed by role id.</li>
 *     <li>Super admin flags, keyed by user id, with a much longer TTL.</li>
 * </ol>
 * Secondary indexes from user id and role id to cached keys turn an invalidation into an index lookup followed by
 * a batched {@link Cache#invalidateAll(Iterable)}.  A role invalidation cascades to every user with a cached
 * decision or effective permission set that depended on the role.
 * <p>
 * A resolution that began before an invalidation must not cache its result afterward, or the invalidation would
 * be lost.  Callers read {@link #generation()} before touching the store and pass it to every put.  Invalidations
 * advance the generation under the write lock and puts compare it under the read lock, so a put from an older
 * generation is dropped.
 */
public class PermissionCache implements Closeable {

    private static final Logger _log = LoggerFactory.getLogger(PermissionCache.class);

    private static final String METRIC_GROUP = "bv.rbac";

    private final Clock _clock;
    private final Cache<DecisionKey, CachedDecision> _decisions;
    private final Cache<ScopeKey, EffectivePermissions> _effectivePermissions;
    private final Cache<String, RoleClosure> _roleClosures;
    private final Cache<String, Boolean> _superAdmins;

    private final ReadWriteLock _generationLock = new ReentrantReadWriteLock();
    private long _generation;

    // Guarded by _indexLock.  Keys by user, users by role.
    private final Object _indexLock = new Object();
    private final SetMultimap<String, Object> _keysByUser = HashMultimap.create();
    private final SetMultimap<String, String> _usersByRole = HashMultimap.create();
    private final SetMultimap<String, String> _rolesByUser = HashMultimap.create();

    private final List<CacheInvalidationListener> _listeners = Lists.newCopyOnWriteArrayList();
    private final List<CacheMetrics> _metrics;

    public PermissionCache(CacheConfiguration config, Clock clock, MetricRegistry metricRegistry) {
        checkNotNull(config, "config");
        _clock = checkNotNull(clock, "clock");
        Ticker ticker = ClockTicker.of(clock);

        _decisions = newCache(config, CacheLayer.DECISION, ticker, this::onDecisionRemoved);
        _effectivePermissions = newCache(config, CacheLayer.EFFECTIVE_PERMISSIONS, ticker, this::onEffectivePermissionsRemoved);
        _roleClosures = newCache(config, CacheLayer.ROLE_CLOSURE, ticker, null);
        _superAdmins = newCache(config, CacheLayer.SUPER_ADMIN, ticker, this::onSuperAdminRemoved);

        _metrics = ImmutableList.of(
                CacheMetrics.instrument(_decisions, metricRegistry, METRIC_GROUP, CacheLayer.DECISION.getMetricName()),
                CacheMetrics.instrument(_effectivePermissions, metricRegistry, METRIC_GROUP, CacheLayer.EFFECTIVE_PERMISSIONS.getMetricName()),
                CacheMetrics.instrument(_roleClosures, metricRegistry, METRIC_GROUP, CacheLayer.ROLE_CLOSURE.getMetricName()),
                CacheMetrics.instrument(_superAdmins, metricRegistry, METRIC_GROUP, CacheLayer.SUPER_ADMIN.getMetricName()));
    }

    private static <K, V> Cache<K, V> newCache(CacheConfiguration config, CacheLayer layer, Ticker ticker,
                                               @Nullable RemovalListener<K, V> removalListener) {
        long ttlMillis = config.getTtl(layer).toMilliseconds();
        checkArgument(ttlMillis > 0, "Cache TTL must be positive: %s", layer);
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder()
                .expireAfterWrite(ttlMillis, TimeUnit.MILLISECONDS)
                .maximumSize(config.getMaximumSize())
                .ticker(ticker)
                .recordStats();
        if (removalListener != null) {
            return builder.removalListener(removalListener).build();
        }
        return builder.build();
    }

    public void addListener(CacheInvalidationListener listener) {
        _listeners.add(checkNotNull(listener, "listener"));
    }

    /** Returns the token to pass to puts for a resolution starting now. */
    public long generation() {
        Lock lock = _generationLock.readLock();
        lock.lock();
        try {
            return _generation;
        } finally {
            lock.unlock();
        }
    }

    // Decisions

    @Nullable
    public Decision getDecision(DecisionKey key) {
        CachedDecision cached = _decisions.getIfPresent(key);
        if (cached == null) {
            return null;
        }
        if (!cached.isValidAt(_clock.instant())) {
            _decisions.invalidate(key);
            return null;
        }
        return cached.decision;
    }

    /**
     * Caches a decision.  Error decisions are never cached.  {@code source} is the effective permission set the
     * decision was computed from, if any; its roles and expiration bound the cached decision.
     *
     * @return true if the decision was cached, false if it was an error or the generation is stale
     */
    public boolean putDecision(DecisionKey key, Decision decision, @Nullable EffectivePermissions source, long generation) {
        checkNotNull(key, "key");
        checkNotNull(decision, "decision");
        if (decision.getOutcome() == DecisionOutcome.ERROR) {
            return false;
        }
        Set<String> roleIds = source != null ? source.getRoleIds() : ImmutableSet.of();
        CachedDecision cached = new CachedDecision(decision, source != null ? source.getValidUntil() : null);
        return put(generation, key.getUserId(), roleIds, () -> _decisions.put(key, cached), key);
    }

    // Effective permissions

    @Nullable
    public EffectivePermissions getEffectivePermissions(ScopeKey key) {
        EffectivePermissions permissions = _effectivePermissions.getIfPresent(key);
        if (permissions == null) {
            return null;
        }
        if (!permissions.isValidAt(_clock.instant())) {
            _effectivePermissions.invalidate(key);
            return null;
        }
        return permissions;
    }

    public boolean putEffectivePermissions(ScopeKey key, EffectivePermissions permissions, long generation) {
        checkNotNull(key, "key");
        checkNotNull(permissions, "permissions");
        return put(generation, key.getUserId(), permissions.getRoleIds(), () -> _effectivePermissions.put(key, permissions), key);
    }

    // Role closures

    @Nullable
    public RoleClosure getRoleClosure(String roleId) {
        return _roleClosures.getIfPresent(roleId);
    }

    public boolean putRoleClosure(RoleClosure closure, long generation) {
        checkNotNull(closure, "closure");
        return put(generation, null, ImmutableSet.of(), () -> _roleClosures.put(closure.getRoleId(), closure), null);
    }

    // Super admin flags

    @Nullable
    public Boolean getSuperAdmin(String userId) {
        return _superAdmins.getIfPresent(userId);
    }

    public boolean putSuperAdmin(String userId, boolean superAdmin, long generation) {
        checkNotNull(userId, "userId");
        return put(generation, null, ImmutableSet.of(), () -> _superAdmins.put(userId, superAdmin), null);
    }

    private boolean put(long generation, @Nullable String userId, Set<String> roleIds, Runnable put, @Nullable Object indexKey) {
        Lock lock = _generationLock.readLock();
        lock.lock();
        try {
            if (generation != _generation) {
                _log.debug("Dropping cache write from generation {}, current generation is {}", generation, _generation);
                return false;
            }
            put.run();
            // Index after the put so a removal notification for a replaced value cannot undo the new index entries
            if (userId != null) {
                synchronized (_indexLock) {
                    _keysByUser.put(userId, indexKey);
                    for (String roleId : roleIds) {
                        _usersByRole.put(roleId, userId);
                        _rolesByUser.put(userId, roleId);
                    }
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    // Invalidation

    /** Drops the user's decisions, effective permissions and super admin flag. */
    public void invalidateForUser(String userId) {
        checkNotNull(userId, "userId");
        int invalidated;
        Lock lock = _generationLock.writeLock();
        lock.lock();
        try {
            _generation++;
            invalidated = invalidateUsers(ImmutableSet.of(userId));
        } finally {
            lock.unlock();
        }
        _log.debug("Invalidated {} cached entries for user {}", invalidated, userId);
        notifyListeners(new CacheInvalidationEvent(this, InvalidationScope.USER, userId, ImmutableSet.of(userId), invalidated));
    }

    /**
     * Drops the role's closure and, for every user with cached entries that depended on the role, those users'
     * decisions and effective permissions.
     */
    public void invalidateForRole(String roleId) {
        checkNotNull(roleId, "roleId");
        Set<String> users;
        int invalidated;
        Lock lock = _generationLock.writeLock();
        lock.lock();
        try {
            _generation++;
            invalidated = _roleClosures.getIfPresent(roleId) != null ? 1 : 0;
            _roleClosures.invalidate(roleId);
            synchronized (_indexLock) {
                users = ImmutableSet.copyOf(_usersByRole.get(roleId));
            }
            invalidated += invalidateUsers(users);
        } finally {
            lock.unlock();
        }
        _log.debug("Invalidated {} cached entries for role {} affecting {} users", invalidated, roleId, users.size());
        notifyListeners(new CacheInvalidationEvent(this, InvalidationScope.ROLE, roleId, users, invalidated));
    }

    public void invalidateAll() {
        int invalidated;
        Lock lock = _generationLock.writeLock();
        lock.lock();
        try {
            _generation++;
            invalidated = (int) (_decisions.size() + _effectivePermissions.size() + _roleClosures.size() + _superAdmins.size());
            _decisions.invalidateAll();
            _effectivePermissions.invalidateAll();
            _roleClosures.invalidateAll();
            _superAdmins.invalidateAll();
            synchronized (_indexLock) {
                _keysByUser.clear();
                _usersByRole.clear();
                _rolesByUser.clear();
            }
        } finally {
            lock.unlock();
        }
        _log.debug("Invalidated all {} cached permission entries", invalidated);
        notifyListeners(new CacheInvalidationEvent(this, InvalidationScope.ALL, null, ImmutableSet.of(), invalidated));
    }

    /** Must be called holding the write lock. */
    private int invalidateUsers(Collection<String> userIds) {
        List<DecisionKey> decisionKeys = Lists.newArrayList();
        List<ScopeKey> scopeKeys = Lists.newArrayList();
        synchronized (_indexLock) {
            for (String userId : userIds) {
                for (Object key : _keysByUser.get(userId)) {
                    if (key instanceof DecisionKey) {
                        decisionKeys.add((DecisionKey) key);
                    } else {
                        scopeKeys.add((ScopeKey) key);
                    }
                }
            }
        }
        int superAdmins = 0;
        for (String userId : userIds) {
            if (_superAdmins.getIfPresent(userId) != null) {
                superAdmins++;
            }
        }
        _decisions.invalidateAll(decisionKeys);
        _effectivePermissions.invalidateAll(scopeKeys);
        _superAdmins.invalidateAll(userIds);
        synchronized (_indexLock) {
            for (String userId : userIds) {
                removeUserFromIndexes(userId);
            }
        }
        return decisionKeys.size() + scopeKeys.size() + superAdmins;
    }

    // Removal notifications keep the indexes from growing without bound as entries expire or are evicted.
    // Any thread may deliver a notification late, after the key was put again and re-indexed, so an entry is only
    // unindexed if the cache no longer holds a newer value for its key.

    @VisibleForTesting
    void onDecisionRemoved(RemovalNotification<DecisionKey, CachedDecision> notification) {
        DecisionKey key = notification.getKey();
        if (notification.getCause() != RemovalCause.REPLACED && key != null) {
            unindex(key.getUserId(), key, () -> isSuperseded(_decisions, key, notification.getValue()));
        }
    }

    @VisibleForTesting
    void onEffectivePermissionsRemoved(RemovalNotification<ScopeKey, EffectivePermissions> notification) {
        ScopeKey key = notification.getKey();
        if (notification.getCause() != RemovalCause.REPLACED && key != null) {
            unindex(key.getUserId(), key, () -> isSuperseded(_effectivePermissions, key, notification.getValue()));
        }
    }

    private void onSuperAdminRemoved(RemovalNotification<String, Boolean> notification) {
        if (notification.wasEvicted()) {
            _log.debug("Super admin flag for user {} expired", notification.getKey());
        }
    }

    private static <K, V> boolean isSuperseded(Cache<K, V> cache, K key, @Nullable V removed) {
        V current = cache.asMap().get(key);
        return current != null && current != removed;
    }

    private void unindex(String userId, Object key, BooleanSupplier superseded) {
        synchronized (_indexLock) {
            // Puts run before indexing, so a newer value is visible here whenever its index entry is.
            if (superseded.getAsBoolean()) {
                _log.debug("Ignoring late removal of {}, the key has been cached again", key);
                return;
            }
            _keysByUser.remove(userId, key);
            if (!_keysByUser.containsKey(userId)) {
                removeUserFromIndexes(userId);
            }
        }
    }

    /** Must be called holding the index lock. */
    private void removeUserFromIndexes(String userId) {
        _keysByUser.removeAll(userId);
        for (String roleId : _rolesByUser.removeAll(userId)) {
            _usersByRole.remove(roleId, userId);
        }
    }

    private void notifyListeners(CacheInvalidationEvent event) {
        // Propagate the first exception, log the rest.
        Throwable first = null;
        for (CacheInvalidationListener listener : _listeners) {
            try {
                listener.handleInvalidation(event);
            } catch (Throwable t) {
                if (first == null) {
                    first = t;
                } else {
                    _log.error("Exception handling permission cache invalidation: {}", event, t);
                }
            }
        }
        if (first != null) {
            Throwables.throwIfUnchecked(first);
            throw new RuntimeException(first);
        }
    }

    /** Runs pending expirations in every layer, which also prunes the user and role indexes. */
    public void cleanUp() {
        _decisions.cleanUp();
        _effectivePermissions.cleanUp();
        _roleClosures.cleanUp();
        _superAdmins.cleanUp();
    }

    // Statistics

    public Map<CacheLayer, CacheStats> getStats() {
        return ImmutableMap.of(
                CacheLayer.DECISION, _decisions.stats(),
                CacheLayer.EFFECTIVE_PERMISSIONS, _effectivePermissions.stats(),
                CacheLayer.ROLE_CLOSURE, _roleClosures.stats(),
                CacheLayer.SUPER_ADMIN, _superAdmins.stats());
    }

    /** Number of users currently reachable through the role index.  Exposed for monitoring and tests. */
    public int indexedUsersForRole(String roleId) {
        synchronized (_indexLock) {
            return _usersByRole.get(roleId).size();
        }
    }

    @Override
    public void close() {
        for (CacheMetrics metrics : _metrics) {
            metrics.close();
        }
    }

    @VisibleForTesting
    static final class CachedDecision {
        final Decision decision;
        final Instant validUntil;

        CachedDecision(Decision decision, @Nullable Instant validUntil) {
            this.decision = decision;
            this.validUntil = validUntil;
        }

        boolean isValidAt(Instant now) {
            return validUntil == null || now.isBefore(validUntil);
        }
    }
}
