package com.bazaarvoice.rbac.resolver;

import com.bazaarvoice.rbac.api.Decision;
import com.bazaarvoice.rbac.cache.DecisionKey;
import com.bazaarvoice.rbac.cache.EffectivePermissions;
import com.bazaarvoice.rbac.cache.RoleClosure;
import com.bazaarvoice.rbac.cache.ScopeKey;
import com.bazaarvoice.rbac.store.ResourceOwner;
import com.bazaarvoice.rbac.store.UserRoleAssignment;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Memo of store results and intermediate values shared by the checks in one batch, so a batch touches the store
 * at most once per user, role and resource no matter how many of its checks need them.  Not thread safe; a scope
 * belongs to the thread running the batch.
 */
class ResolutionScope {

    private final Map<String, Boolean> _superAdmins = Maps.newHashMap();
    private final Map<String, List<UserRoleAssignment>> _assignments = Maps.newHashMap();
    private final Map<String, Optional<ResourceOwner>> _owners = Maps.newHashMap();
    private final Map<String, RoleClosure> _roleClosures = Maps.newHashMap();
    private final Map<ScopeKey, EffectivePermissions> _effectivePermissions = Maps.newHashMap();
    private final Map<DecisionKey, Decision> _decisions = Maps.newHashMap();

    Boolean getSuperAdmin(String userId) {
        return _superAdmins.get(userId);
    }

    void putSuperAdmin(String userId, boolean superAdmin) {
        _superAdmins.put(userId, superAdmin);
    }

    List<UserRoleAssignment> getAssignments(String userId, String tenantId) {
        return _assignments.get(userId + "/" + tenantId);
    }

    void putAssignments(String userId, String tenantId, List<UserRoleAssignment> assignments) {
        _assignments.put(userId + "/" + tenantId, assignments);
    }

    Optional<ResourceOwner> getOwner(String resourceType, String resourceId) {
        return _owners.get(resourceType + "/" + resourceId);
    }

    void putOwner(String resourceType, String resourceId, Optional<ResourceOwner> owner) {
        _owners.put(resourceType + "/" + resourceId, owner);
    }

    RoleClosure getRoleClosure(String roleId) {
        return _roleClosures.get(roleId);
    }

    void putRoleClosure(RoleClosure closure) {
        _roleClosures.put(closure.getRoleId(), closure);
    }

    EffectivePermissions getEffectivePermissions(ScopeKey key) {
        return _effectivePermissions.get(key);
    }

    void putEffectivePermissions(ScopeKey key, EffectivePermissions permissions) {
        _effectivePermissions.put(key, permissions);
    }

    Decision getDecision(DecisionKey key) {
        return _decisions.get(key);
    }

    void putDecision(DecisionKey key, Decision decision) {
        _decisions.put(key, decision);
    }
}
