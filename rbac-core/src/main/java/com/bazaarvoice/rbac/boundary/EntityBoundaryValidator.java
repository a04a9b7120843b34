package com.bazaarvoice.rbac.boundary;

import com.bazaarvoice.rbac.store.ResourceOwner;
import com.bazaarvoice.rbac.store.UserRoleAssignment;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decides whether role assignments and resources fall within a tenant and entity scope.
 * <ul>
 *     <li>A tenant-wide assignment applies to every entity in its tenant, and to the tenant itself.</li>
 *     <li>An entity assignment applies only to that entity.</li>
 *     <li>Nothing applies across tenants.</li>
 *     <li>An expired assignment applies nowhere.</li>
 * </ul>
 * Super admins bypass this class entirely.
 */
public class EntityBoundaryValidator {

    private final Clock _clock;

    public EntityBoundaryValidator(Clock clock) {
        _clock = checkNotNull(clock, "clock");
    }

    /**
     * Returns true if the assignment applies when acting on {@code targetEntityId} in {@code targetTenantId}.
     * A null target entity means the tenant itself, which only tenant-wide assignments cover.
     */
    public boolean inScope(UserRoleAssignment assignment, String targetTenantId, @Nullable String targetEntityId) {
        checkNotNull(assignment, "assignment");
        checkNotNull(targetTenantId, "targetTenantId");

        if (!assignment.getTenantId().equals(targetTenantId) || assignment.isExpiredAt(_clock.instant())) {
            return false;
        }
        return assignment.isTenantWide() || assignment.getEntityId().equals(targetEntityId);
    }

    /** Returns the unexpired assignments in the tenant, ignoring entity scope. */
    public List<UserRoleAssignment> activeInTenant(List<UserRoleAssignment> assignments, String tenantId) {
        return assignments.stream()
                .filter(assignment -> assignment.getTenantId().equals(tenantId))
                .filter(assignment -> !assignment.isExpiredAt(_clock.instant()))
                .collect(Collectors.toList());
    }

    /** Returns the assignments which apply to the target scope. */
    public List<UserRoleAssignment> eligible(List<UserRoleAssignment> assignments, String tenantId, @Nullable String entityId) {
        return assignments.stream()
                .filter(assignment -> inScope(assignment, tenantId, entityId))
                .collect(Collectors.toList());
    }

    /**
     * Confirms a resource can be acted on from the caller's scope.  The resource must belong to the caller's tenant
     * and, when the caller is acting within an entity, to that entity or to the tenant itself.
     */
    public boolean confirmResourceOwnership(ResourceOwner owner, String tenantId, @Nullable String callerEntityId) {
        checkNotNull(owner, "owner");
        if (!owner.getTenantId().equals(tenantId)) {
            return false;
        }
        return callerEntityId == null || owner.getEntityId() == null || Objects.equals(owner.getEntityId(), callerEntityId);
    }
}
