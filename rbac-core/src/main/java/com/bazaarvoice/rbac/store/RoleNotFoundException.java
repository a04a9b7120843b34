package com.bazaarvoice.rbac.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Exception thrown when attempting to utilize a role which does not exist.
 */
@JsonIgnoreProperties({"cause", "localizedMessage", "stackTrace"})
public class RoleNotFoundException extends RuntimeException {
    private final String _roleId;

    public RoleNotFoundException(String roleId) {
        super("Role not found: " + roleId);
        _roleId = roleId;
    }

    public String getRoleId() {
        return _roleId;
    }
}
