package com.bazaarvoice.rbac.store;

/** The kind of record a {@link StoreChangeEvent} describes. */
public enum StoreChangeType {
    USER_ROLE_ASSIGNMENT,
    ROLE_PERMISSION,
    DEPENDENCY_RULES,
    SUPER_ADMIN,
    RESOURCE_OWNER
}
