package com.bazaarvoice.rbac.store;

/**
 * Receives write notifications from a store.  Listeners run synchronously inside the write, so a write is not
 * acknowledged until every listener has returned.
 */
public interface StoreChangeListener {

    void storeChanged(StoreChangeEvent event);
}
