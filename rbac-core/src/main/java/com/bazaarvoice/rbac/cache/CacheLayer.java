package com.bazaarvoice.rbac.cache;

/** The separately sized and timed layers of the {@link PermissionCache}. */
public enum CacheLayer {
    /** Final decision per check. */
    DECISION("decisions"),
    /** Union of role closures per user, tenant and entity. */
    EFFECTIVE_PERMISSIONS("effective-permissions"),
    /** Dependency closure per role. */
    ROLE_CLOSURE("role-closures"),
    /** Super admin flag per user. */
    SUPER_ADMIN("super-admins");

    private final String _metricName;

    CacheLayer(String metricName) {
        _metricName = metricName;
    }

    public String getMetricName() {
        return _metricName;
    }
}
