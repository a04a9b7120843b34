package com.bazaarvoice.rbac.cache;

import com.bazaarvoice.rbac.permissions.Permissions;
import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A user's permissions within a scope: the union over every in-scope role of that role's direct permissions and of
 * its dependency closure.  Closures are never combined across roles, so a rule requiring several permissions only
 * fires when one role holds them all.
 * <p>
 * The value also records why it may be empty, so a cached value reproduces the same denial reason as a fresh
 * resolution, and the earliest expiration among the assignments it was built from.
 */
public final class EffectivePermissions {

    public enum Status {
        /** At least one assignment applies to the scope. */
        IN_SCOPE,
        /** The user has no active assignment in the tenant. */
        NO_ASSIGNMENT_IN_TENANT,
        /** The user has assignments in the tenant but none reach the requested entity. */
        OUTSIDE_BOUNDARY
    }

    private final Status _status;
    private final Set<String> _roleIds;
    private final Set<ResourcePermission> _direct;
    // Derived permission to the id of the rule that derived it
    private final Map<ResourcePermission, String> _derivedBy;
    private final Instant _validUntil;

    private EffectivePermissions(Status status, Set<String> roleIds, Set<ResourcePermission> direct,
                                 Map<ResourcePermission, String> derivedBy, @Nullable Instant validUntil) {
        _status = status;
        _roleIds = ImmutableSet.copyOf(roleIds);
        _direct = ImmutableSet.copyOf(direct);
        _derivedBy = ImmutableMap.copyOf(derivedBy);
        _validUntil = validUntil;
    }

    public static EffectivePermissions noAssignmentInTenant(@Nullable Instant validUntil) {
        return new EffectivePermissions(Status.NO_ASSIGNMENT_IN_TENANT, ImmutableSet.of(), ImmutableSet.of(), ImmutableMap.of(), validUntil);
    }

    public static EffectivePermissions outsideBoundary(Collection<String> roleIdsInTenant, @Nullable Instant validUntil) {
        return new EffectivePermissions(Status.OUTSIDE_BOUNDARY, ImmutableSet.copyOf(roleIdsInTenant), ImmutableSet.of(), ImmutableMap.of(), validUntil);
    }

    /** Builds the union of the given role closures. */
    public static EffectivePermissions union(Collection<RoleClosure> closures, @Nullable Instant validUntil) {
        checkNotNull(closures, "closures");
        ImmutableSet.Builder<String> roleIds = ImmutableSet.builder();
        ImmutableSet.Builder<ResourcePermission> direct = ImmutableSet.builder();
        Map<ResourcePermission, String> derivedBy = Maps.newLinkedHashMap();
        for (RoleClosure closure : closures) {
            roleIds.add(closure.getRoleId());
            direct.addAll(closure.getClosure().getHeld());
            for (ResourcePermission derived : closure.getClosure().getDerived()) {
                derivedBy.putIfAbsent(derived, closure.getClosure().getDerivingRule(derived));
            }
        }
        return new EffectivePermissions(Status.IN_SCOPE, roleIds.build(), direct.build(), derivedBy, validUntil);
    }

    public Status getStatus() {
        return _status;
    }

    /** Roles whose changes can alter this value. */
    public Set<String> getRoleIds() {
        return _roleIds;
    }

    public Set<ResourcePermission> getDirect() {
        return _direct;
    }

    /** Permissions derived through dependency rules and not held directly. */
    public Set<ResourcePermission> getExpanded() {
        return _derivedBy.keySet();
    }

    /** Returns the id of the rule behind a derived permission that implies {@code requested}, or null if there is none. */
    @Nullable
    public String getDerivingRule(ResourcePermission requested) {
        for (Map.Entry<ResourcePermission, String> entry : _derivedBy.entrySet()) {
            if (entry.getKey().implies(requested)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /** The earliest assignment expiration this value depends on, or null if none of them expire. */
    @Nullable
    public Instant getValidUntil() {
        return _validUntil;
    }

    public boolean isValidAt(Instant now) {
        return _validUntil == null || now.isBefore(_validUntil);
    }

    public boolean grantsDirectly(ResourcePermission requested) {
        return Permissions.anyImplies(_direct, requested);
    }

    public boolean grantsThroughDependency(ResourcePermission requested) {
        return Permissions.anyImplies(_derivedBy.keySet(), requested);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("status", _status)
                .add("roleIds", _roleIds)
                .add("direct", _direct)
                .add("derivedBy", _derivedBy)
                .add("validUntil", _validUntil)
                .toString();
    }
}
