package com.bazaarvoice.rbac.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Thrown when a tenant role is assigned in a tenant other than its own.
 */
@JsonIgnoreProperties({"cause", "localizedMessage", "stackTrace"})
public class RoleTenantMismatchException extends RuntimeException {
    private final String _roleId;
    private final String _tenantId;

    public RoleTenantMismatchException(String roleId, String tenantId) {
        super(String.format("Role %s cannot be assigned in tenant %s", roleId, tenantId));
        _roleId = roleId;
        _tenantId = tenantId;
    }

    public String getRoleId() {
        return _roleId;
    }

    public String getTenantId() {
        return _tenantId;
    }
}
