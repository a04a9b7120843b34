package com.bazaarvoice.rbac.cache;

import com.bazaarvoice.rbac.dependency.PermissionClosure;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A role's directly assigned permissions together with their dependency closure.
 */
public final class RoleClosure {
    private final String _roleId;
    private final PermissionClosure _closure;

    public RoleClosure(String roleId, PermissionClosure closure) {
        _roleId = checkNotNull(roleId, "roleId");
        _closure = checkNotNull(closure, "closure");
    }

    public String getRoleId() {
        return _roleId;
    }

    public PermissionClosure getClosure() {
        return _closure;
    }

    @Override
    public String toString() {
        return "RoleClosure{" + _roleId + "=" + _closure + "}";
    }
}
