package com.bazaarvoice.rbac.store;

/**
 * Implemented by stores which publish their writes.
 */
public interface StoreChangeNotifier {

    void addListener(StoreChangeListener listener);
}
