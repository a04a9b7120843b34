package com.bazaarvoice.rbac.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Exception thrown when attempting to create a role which already exists.
 */
@JsonIgnoreProperties({"cause", "localizedMessage", "stackTrace"})
public class RoleExistsException extends RuntimeException {
    private final String _roleId;

    public RoleExistsException(String roleId) {
        super("Role exists: " + roleId);
        _roleId = roleId;
    }

    public String getRoleId() {
        return _roleId;
    }
}
