package com.bazaarvoice.rbac.resolver;

import com.bazaarvoice.rbac.api.Action;
import com.bazaarvoice.rbac.api.CheckDeadline;
import com.bazaarvoice.rbac.api.CheckRequest;
import com.bazaarvoice.rbac.api.Decision;
import com.bazaarvoice.rbac.api.DecisionOutcome;
import com.bazaarvoice.rbac.api.DecisionReason;
import com.bazaarvoice.rbac.api.InvalidCheckRequestException;
import com.bazaarvoice.rbac.api.PermissionChecker;
import com.bazaarvoice.rbac.audit.AuditEmitter;
import com.bazaarvoice.rbac.audit.AuditEvent;
import com.bazaarvoice.rbac.boundary.EntityBoundaryValidator;
import com.bazaarvoice.rbac.cache.DecisionKey;
import com.bazaarvoice.rbac.cache.EffectivePermissions;
import com.bazaarvoice.rbac.cache.PermissionCache;
import com.bazaarvoice.rbac.cache.RoleClosure;
import com.bazaarvoice.rbac.cache.ScopeKey;
import com.bazaarvoice.rbac.dependency.DependencyResolver;
import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.bazaarvoice.rbac.store.PermissionStore;
import com.bazaarvoice.rbac.store.ResourceOwner;
import com.bazaarvoice.rbac.store.StoreUnavailableException;
import com.bazaarvoice.rbac.store.UserRoleAssignment;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Resolves permission checks against a {@link PermissionStore}, consulting the {@link PermissionCache} first.
 * <p>
 * Each check runs through the same steps in order:
 * <ol>
 *     <li>Super admin fast path.</li>
 *     <li>Decision cache lookup.</li>
 *     <li>Store reads, fanned out in parallel: the user's assignments and, for a resource check, the resource's
 *         owner.</li>
 *     <li>Resource ownership against the caller's tenant and entity.</li>
 *     <li>Assignment filtering by entity boundary, then the union of the eligible roles' closures.</li>
 *     <li>Direct match, then dependency match.</li>
 *     <li>Cache write, audit event, return.</li>
 * </ol>
 * Store failures and expired deadlines produce {@link Decision}s with an error outcome; nothing but malformed
 * input makes a check throw.  Every ambiguity resolves to a denial.
 */
public class DefaultPermissionChecker implements PermissionChecker {

    private static final Logger _log = LoggerFactory.getLogger(DefaultPermissionChecker.class);

    private final PermissionStore _store;
    private final PermissionCache _cache;
    private final DependencyResolver _dependencyResolver;
    private final EntityBoundaryValidator _boundaryValidator;
    private final AuditEmitter _auditEmitter;
    private final ListeningExecutorService _storeExecutor;
    private final Clock _clock;
    private final Duration _defaultTimeout;

    private final Timer _checkTimer;
    private final Meter _granted;
    private final Meter _denied;
    private final Meter _errors;

    public DefaultPermissionChecker(PermissionStore store, PermissionCache cache, DependencyResolver dependencyResolver,
                                    EntityBoundaryValidator boundaryValidator, AuditEmitter auditEmitter,
                                    ListeningExecutorService storeExecutor, Clock clock, Duration defaultTimeout,
                                    MetricRegistry metricRegistry) {
        _store = checkNotNull(store, "store");
        _cache = checkNotNull(cache, "cache");
        _dependencyResolver = checkNotNull(dependencyResolver, "dependencyResolver");
        _boundaryValidator = checkNotNull(boundaryValidator, "boundaryValidator");
        _auditEmitter = checkNotNull(auditEmitter, "auditEmitter");
        _storeExecutor = checkNotNull(storeExecutor, "storeExecutor");
        _clock = checkNotNull(clock, "clock");
        _defaultTimeout = checkNotNull(defaultTimeout, "defaultTimeout");

        _checkTimer = metricRegistry.timer(MetricRegistry.name("bv.rbac", "PermissionChecker", "check"));
        _granted = metricRegistry.meter(MetricRegistry.name("bv.rbac", "PermissionChecker", "granted"));
        _denied = metricRegistry.meter(MetricRegistry.name("bv.rbac", "PermissionChecker", "denied"));
        _errors = metricRegistry.meter(MetricRegistry.name("bv.rbac", "PermissionChecker", "errors"));
    }

    @Override
    public Decision check(CheckRequest request) {
        return check(request, newDeadline());
    }

    @Override
    public Decision check(CheckRequest request, CheckDeadline deadline) {
        checkNotNull(deadline, "deadline");
        return resolve(request, deadline, new ResolutionScope(), true);
    }

    @Override
    public List<Decision> checkBatch(List<CheckRequest> requests) {
        if (requests == null) {
            throw new InvalidCheckRequestException("requests is required");
        }
        ResolutionScope scope = new ResolutionScope();
        List<Decision> decisions = Lists.newArrayListWithCapacity(requests.size());
        for (CheckRequest request : requests) {
            decisions.add(resolve(request, newDeadline(), scope, true));
        }
        return decisions;
    }

    /**
     * Resolves the requests to populate the caches without emitting audit events, for example for a user's most
     * common checks right after login.
     *
     * @return the number of requests that resolved without error
     */
    public int warm(List<CheckRequest> requests) {
        checkNotNull(requests, "requests");
        ResolutionScope scope = new ResolutionScope();
        int warmed = 0;
        for (CheckRequest request : requests) {
            if (resolve(request, newDeadline(), scope, false).getOutcome() != DecisionOutcome.ERROR) {
                warmed++;
            }
        }
        _log.debug("Warmed permission cache with {} of {} checks", warmed, requests.size());
        return warmed;
    }

    /**
     * Returns the user's effective permissions in the tenant, narrowed to an entity when one is given.  With no
     * entity only tenant-wide assignments apply.
     *
     * @throws StoreUnavailableException if the store fails
     * @throws CheckTimeoutException if the deadline expires
     */
    public EffectivePermissions getEffectivePermissions(String userId, String tenantId, @Nullable String entityId,
                                                        CheckDeadline deadline) {
        checkNotNull(userId, "userId");
        checkNotNull(tenantId, "tenantId");
        long generation = _cache.generation();
        ResolutionScope scope = new ResolutionScope();
        ScopeKey scopeKey = new ScopeKey(userId, tenantId, entityId);
        EffectivePermissions effective = _cache.getEffectivePermissions(scopeKey);
        if (effective == null) {
            List<UserRoleAssignment> assignments = await(submit(() -> _store.getAssignmentsForUser(userId, tenantId)), deadline);
            effective = buildEffectivePermissions(assignments, tenantId, entityId, generation, true, deadline, scope);
            _cache.putEffectivePermissions(scopeKey, effective, generation);
        }
        return effective;
    }

    /**
     * @throws StoreUnavailableException if the store fails
     * @throws CheckTimeoutException if the deadline expires
     */
    public boolean isSuperAdmin(String userId, CheckDeadline deadline) {
        return lookupSuperAdmin(userId, _cache.generation(), true, deadline, new ResolutionScope()).superAdmin;
    }

    private CheckDeadline newDeadline() {
        return CheckDeadline.after(_clock, _defaultTimeout);
    }

    private Decision resolve(CheckRequest request, CheckDeadline deadline, ResolutionScope scope, boolean audit) {
        if (request == null) {
            throw new InvalidCheckRequestException("request is required");
        }
        long start = _clock.millis();
        Evaluation evaluation;
        try (Timer.Context ignore = _checkTimer.time()) {
            evaluation = evaluate(request, deadline, scope);
        }
        Decision decision = evaluation.decision.withTiming(Math.max(0, _clock.millis() - start), evaluation.cacheHit);

        switch (decision.getOutcome()) {
            case GRANTED:
                _granted.mark();
                break;
            case DENIED:
                _denied.mark();
                break;
            default:
                _errors.mark();
                break;
        }
        _log.debug("{} -> {}", request, decision);

        if (audit) {
            emitAudit(request, decision);
        }
        return decision;
    }

    private void emitAudit(CheckRequest request, Decision decision) {
        try {
            _auditEmitter.emit(AuditEvent.permissionCheck(request, decision, _clock.instant()));
        } catch (RuntimeException e) {
            // Auditing is best effort and must never affect the decision
            _log.error("Failed to emit audit event for {}", request, e);
        }
    }

    private Evaluation evaluate(CheckRequest request, CheckDeadline deadline, ResolutionScope scope) {
        // Read the generation before any store access so results computed across an invalidation are not cached
        long generation = _cache.generation();
        boolean useCache = !request.isBypassCache();

        try {
            if (deadline.isExpired()) {
                throw new CheckTimeoutException("Deadline expired before resolution started");
            }

            SuperAdminLookup superAdmin = lookupSuperAdmin(request.getUserId(), generation, useCache, deadline, scope);
            if (superAdmin.superAdmin) {
                return new Evaluation(Decision.granted(DecisionReason.SUPER_ADMIN), superAdmin.fromCache);
            }

            DecisionKey decisionKey = DecisionKey.of(request);
            Decision cached = scope.getDecision(decisionKey);
            if (cached == null && useCache) {
                cached = _cache.getDecision(decisionKey);
            }
            if (cached != null) {
                return new Evaluation(cached, true);
            }

            return resolveUncached(request, decisionKey, generation, useCache, deadline, scope);

        } catch (CheckTimeoutException e) {
            _log.debug("Check timed out: {}", request);
            return new Evaluation(Decision.error(DecisionReason.TIMEOUT), false);
        } catch (StoreUnavailableException e) {
            _log.warn("Permission store unavailable, denying {}", request, e);
            return new Evaluation(Decision.error(DecisionReason.STORE_UNAVAILABLE), false);
        }
    }

    private Evaluation resolveUncached(CheckRequest request, DecisionKey decisionKey, long generation, boolean useCache,
                                       CheckDeadline deadline, ResolutionScope scope) {
        String userId = request.getUserId();
        String tenantId = request.getTenantId();

        // For a type-level check the scope is known up front, so a cached effective set can skip the store entirely
        EffectivePermissions effective = null;
        ScopeKey scopeKey = null;
        if (!request.hasResourceId()) {
            scopeKey = new ScopeKey(userId, tenantId, request.getEntityId());
            effective = lookupEffectivePermissions(scopeKey, useCache, scope);
        }

        ListenableFuture<Optional<ResourceOwner>> ownerFuture = Futures.immediateFuture(Optional.empty());
        if (request.hasResourceId()) {
            Optional<ResourceOwner> owner = scope.getOwner(request.getResourceType(), request.getResourceId());
            ownerFuture = owner != null ? Futures.immediateFuture(owner) :
                    submit(() -> _store.getResourceOwningEntity(request.getResourceType(), request.getResourceId()));
        }
        ListenableFuture<List<UserRoleAssignment>> assignmentsFuture = Futures.immediateFuture(null);
        if (effective == null) {
            List<UserRoleAssignment> assignments = scope.getAssignments(userId, tenantId);
            assignmentsFuture = assignments != null ? Futures.immediateFuture(assignments) :
                    submit(() -> _store.getAssignmentsForUser(userId, tenantId));
        }
        awaitAll(deadline, ownerFuture, assignmentsFuture);

        String targetEntityId = request.getEntityId();
        if (request.hasResourceId()) {
            Optional<ResourceOwner> owner = Futures.getUnchecked(ownerFuture);
            scope.putOwner(request.getResourceType(), request.getResourceId(), owner);
            if (!owner.isPresent()) {
                // Not cached: the resource may be created at any moment and its creation is not a store change event
                return new Evaluation(Decision.denied(DecisionReason.RESOURCE_NOT_FOUND), false);
            }
            if (!_boundaryValidator.confirmResourceOwnership(owner.get(), tenantId, request.getEntityId())) {
                Decision decision = Decision.denied(DecisionReason.ENTITY_BOUNDARY_VIOLATION);
                putDecision(decisionKey, decision, null, generation, scope);
                return new Evaluation(decision, false);
            }
            targetEntityId = owner.get().getEntityId();
            scopeKey = new ScopeKey(userId, tenantId, targetEntityId);
            effective = lookupEffectivePermissions(scopeKey, useCache, scope);
        }

        if (effective == null) {
            List<UserRoleAssignment> assignments = Futures.getUnchecked(assignmentsFuture);
            scope.putAssignments(userId, tenantId, assignments);
            effective = buildEffectivePermissions(assignments, tenantId, targetEntityId, generation, useCache, deadline, scope);
            _cache.putEffectivePermissions(scopeKey, effective, generation);
            scope.putEffectivePermissions(scopeKey, effective);
        }

        Decision decision = decide(request, effective);
        putDecision(decisionKey, decision, effective, generation, scope);
        return new Evaluation(decision, false);
    }

    /** Only "Any" actions can be granted without a resource, so instance actions are checked as their "Any" form. */
    private Decision decide(CheckRequest request, EffectivePermissions effective) {
        switch (effective.getStatus()) {
            case NO_ASSIGNMENT_IN_TENANT:
                return Decision.denied(DecisionReason.NO_ASSIGNMENT_IN_SCOPE);
            case OUTSIDE_BOUNDARY:
                return Decision.denied(DecisionReason.ENTITY_BOUNDARY_VIOLATION);
            default:
                break;
        }

        Action action = request.hasResourceId() ? request.getAction() : request.getAction().anyVariant();
        ResourcePermission requested = new ResourcePermission(request.getResourceType(), action);

        if (effective.grantsDirectly(requested)) {
            return Decision.granted(DecisionReason.DIRECT_GRANT);
        }
        if (effective.grantsThroughDependency(requested)) {
            _log.debug("{} implied for user {} by dependency rule {}", requested, request.getUserId(),
                    effective.getDerivingRule(requested));
            return Decision.granted(DecisionReason.DEPENDENCY_IMPLIED);
        }
        return Decision.denied(DecisionReason.NOT_GRANTED);
    }

    private void putDecision(DecisionKey key, Decision decision, @Nullable EffectivePermissions source, long generation,
                             ResolutionScope scope) {
        _cache.putDecision(key, decision, source, generation);
        scope.putDecision(key, decision);
    }

    @Nullable
    private EffectivePermissions lookupEffectivePermissions(ScopeKey key, boolean useCache, ResolutionScope scope) {
        EffectivePermissions effective = scope.getEffectivePermissions(key);
        if (effective == null && useCache) {
            effective = _cache.getEffectivePermissions(key);
        }
        return effective;
    }

    private SuperAdminLookup lookupSuperAdmin(String userId, long generation, boolean useCache, CheckDeadline deadline,
                                              ResolutionScope scope) {
        Boolean superAdmin = scope.getSuperAdmin(userId);
        if (superAdmin != null) {
            return new SuperAdminLookup(superAdmin, true);
        }
        if (useCache) {
            superAdmin = _cache.getSuperAdmin(userId);
            if (superAdmin != null) {
                scope.putSuperAdmin(userId, superAdmin);
                return new SuperAdminLookup(superAdmin, true);
            }
        }
        superAdmin = await(submit(() -> _store.isSuperAdmin(userId)), deadline);
        _cache.putSuperAdmin(userId, superAdmin, generation);
        scope.putSuperAdmin(userId, superAdmin);
        return new SuperAdminLookup(superAdmin, false);
    }

    private EffectivePermissions buildEffectivePermissions(List<UserRoleAssignment> assignments, String tenantId,
                                                           @Nullable String entityId, long generation, boolean useCache,
                                                           CheckDeadline deadline, ResolutionScope scope) {
        List<UserRoleAssignment> active = _boundaryValidator.activeInTenant(assignments, tenantId);
        Instant validUntil = null;
        for (UserRoleAssignment assignment : active) {
            Instant expiresAt = assignment.getExpiresAt();
            if (expiresAt != null && (validUntil == null || expiresAt.isBefore(validUntil))) {
                validUntil = expiresAt;
            }
        }

        if (active.isEmpty()) {
            return EffectivePermissions.noAssignmentInTenant(null);
        }

        List<UserRoleAssignment> eligible = _boundaryValidator.eligible(active, tenantId, entityId);
        if (eligible.isEmpty()) {
            return EffectivePermissions.outsideBoundary(roleIds(active), validUntil);
        }

        return EffectivePermissions.union(roleClosures(roleIds(eligible), generation, useCache, deadline, scope), validUntil);
    }

    /** Returns the closure of every role, loading the uncached ones from the store in parallel. */
    private List<RoleClosure> roleClosures(Set<String> roleIds, long generation, boolean useCache,
                                           CheckDeadline deadline, ResolutionScope scope) {
        List<RoleClosure> closures = Lists.newArrayListWithCapacity(roleIds.size());
        Map<String, ListenableFuture<Set<ResourcePermission>>> pending = Maps.newLinkedHashMap();
        for (String roleId : roleIds) {
            RoleClosure closure = scope.getRoleClosure(roleId);
            if (closure == null && useCache) {
                closure = _cache.getRoleClosure(roleId);
            }
            if (closure != null) {
                closures.add(closure);
            } else {
                pending.put(roleId, submit(() -> _store.getPermissionsForRole(roleId)));
            }
        }
        if (!pending.isEmpty()) {
            awaitAll(deadline, pending.values().toArray(new ListenableFuture<?>[0]));
            for (Map.Entry<String, ListenableFuture<Set<ResourcePermission>>> entry : pending.entrySet()) {
                RoleClosure closure = new RoleClosure(entry.getKey(), _dependencyResolver.expand(Futures.getUnchecked(entry.getValue())));
                _cache.putRoleClosure(closure, generation);
                closures.add(closure);
            }
        }
        for (RoleClosure closure : closures) {
            scope.putRoleClosure(closure);
        }
        return closures;
    }

    private static Set<String> roleIds(List<UserRoleAssignment> assignments) {
        Set<String> roleIds = new LinkedHashSet<>();
        for (UserRoleAssignment assignment : assignments) {
            roleIds.add(assignment.getRoleId());
        }
        return roleIds;
    }

    // Store access

    private <T> ListenableFuture<T> submit(Callable<T> call) {
        return _storeExecutor.submit(call);
    }

    private <T> T await(ListenableFuture<T> future, CheckDeadline deadline) {
        awaitAll(deadline, future);
        return Futures.getUnchecked(future);
    }

    /**
     * Waits for all futures.  On expiry every future is cancelled and {@link CheckTimeoutException} thrown; on
     * failure the cause is rethrown as a {@link StoreUnavailableException}.
     */
    private void awaitAll(CheckDeadline deadline, ListenableFuture<?>... futures) {
        List<ListenableFuture<?>> all = Arrays.asList(futures);
        ListenableFuture<List<Object>> combined = Futures.allAsList(all);
        try {
            if (deadline.isExpired()) {
                throw new TimeoutException();
            }
            combined.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | CancellationException e) {
            cancel(all);
            throw new CheckTimeoutException("Permission store did not respond before the deadline");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(all);
            throw new CheckTimeoutException("Interrupted waiting for the permission store");
        } catch (ExecutionException e) {
            cancel(all);
            Throwable cause = e.getCause();
            if (cause instanceof StoreUnavailableException) {
                throw (StoreUnavailableException) cause;
            }
            throw new StoreUnavailableException("Permission store request failed", cause);
        }
    }

    private static void cancel(List<ListenableFuture<?>> futures) {
        for (ListenableFuture<?> future : futures) {
            future.cancel(true);
        }
    }

    private static final class Evaluation {
        final Decision decision;
        final boolean cacheHit;

        Evaluation(Decision decision, boolean cacheHit) {
            this.decision = decision;
            this.cacheHit = cacheHit;
        }
    }

    private static final class SuperAdminLookup {
        final boolean superAdmin;
        final boolean fromCache;

        SuperAdminLookup(boolean superAdmin, boolean fromCache) {
            this.superAdmin = superAdmin;
            this.fromCache = fromCache;
        }
    }
}
