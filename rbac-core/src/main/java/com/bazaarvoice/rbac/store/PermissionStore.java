package com.bazaarvoice.rbac.store;

import com.bazaarvoice.rbac.dependency.PermissionDependencyRule;
import com.bazaarvoice.rbac.permissions.ResourcePermission;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to roles, permissions and assignments.  Any method may throw {@link StoreUnavailableException} when
 * the backing store cannot be reached; callers fail closed.
 */
public interface PermissionStore {

    /**
     * Returns every assignment the user has in the tenant, regardless of entity scope or expiration.  Filtering
     * for the entity boundary is the caller's responsibility so that "no assignment" can be told apart from
     * "assignment outside the boundary".
     */
    List<UserRoleAssignment> getAssignmentsForUser(String userId, String tenantId);

    /** Returns the permissions assigned directly to the role, empty if the role has none or does not exist. */
    Set<ResourcePermission> getPermissionsForRole(String roleId);

    List<PermissionDependencyRule> getDependencyRules();

    boolean isSuperAdmin(String userId);

    Optional<ResourceOwner> getResourceOwningEntity(String resourceType, String resourceId);
}
