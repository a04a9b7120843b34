package com.bazaarvoice.rbac.dependency;

import com.bazaarvoice.rbac.permissions.Permissions;
import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Set;

/**
 * A set of held permissions together with everything the dependency rules derive from them.  For each derived
 * permission the closure remembers which rule first produced it.
 */
public class PermissionClosure {

    private final Set<ResourcePermission> _held;
    private final Map<ResourcePermission, String> _derivedBy;

    PermissionClosure(Set<ResourcePermission> held, Map<ResourcePermission, String> derivedBy) {
        _held = ImmutableSet.copyOf(held);
        _derivedBy = ImmutableMap.copyOf(derivedBy);
    }

    static PermissionClosure ofHeld(Set<ResourcePermission> held) {
        return new PermissionClosure(held, ImmutableMap.of());
    }

    /** The permissions the closure was computed from. */
    public Set<ResourcePermission> getHeld() {
        return _held;
    }

    /** The permissions derived through rules, not including those held directly. */
    public Set<ResourcePermission> getDerived() {
        return _derivedBy.keySet();
    }

    public boolean implies(ResourcePermission requested) {
        return Permissions.anyImplies(_held, requested) || Permissions.anyImplies(_derivedBy.keySet(), requested);
    }

    /** Returns the id of the rule that derived the permission, or null if it was held or is not in the closure. */
    @Nullable
    public String getDerivingRule(ResourcePermission permission) {
        return _derivedBy.get(permission);
    }

    @Override
    public String toString() {
        return "PermissionClosure{held=" + _held + ", derived=" + _derivedBy + "}";
    }
}
