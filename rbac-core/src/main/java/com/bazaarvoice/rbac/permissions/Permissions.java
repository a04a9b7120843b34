package com.bazaarvoice.rbac.permissions;

import org.apache.shiro.authz.Permission;

/**
 * Helpers for testing a requested permission against a set of held permissions.
 */
public final class Permissions {

    private Permissions() {
        // empty
    }

    /** Returns true if any held permission implies {@code requested}. */
    public static boolean anyImplies(Iterable<? extends Permission> held, Permission requested) {
        for (Permission permission : held) {
            if (permission.implies(requested)) {
                return true;
            }
        }
        return false;
    }
}
