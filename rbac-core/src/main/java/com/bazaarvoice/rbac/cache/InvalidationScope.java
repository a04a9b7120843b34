package com.bazaarvoice.rbac.cache;

public enum InvalidationScope {
    /** Entries belonging to one user. */
    USER,
    /** One role's closure and the entries of every user that depended on it. */
    ROLE,
    /** Everything. */
    ALL
}
