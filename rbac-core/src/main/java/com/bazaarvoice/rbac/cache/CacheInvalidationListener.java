package com.bazaarvoice.rbac.cache;

public interface CacheInvalidationListener {

    void handleInvalidation(CacheInvalidationEvent event);
}
