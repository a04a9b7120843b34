package com.bazaarvoice.rbac.cache;

import com.bazaarvoice.rbac.dependency.DependencyResolver;
import com.bazaarvoice.rbac.dependency.DependencyRulesLoader;
import com.bazaarvoice.rbac.store.StoreChangeEvent;
import com.bazaarvoice.rbac.store.StoreChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Applies store writes to the {@link PermissionCache} before the write returns:
 * <ul>
 *     <li>an assignment or super admin change invalidates the user's entries</li>
 *     <li>a role permission change invalidates the role and cascades to its users</li>
 *     <li>a dependency rule change reloads the rule table and drops everything, since every closure may change</li>
 *     <li>a resource moving or disappearing drops everything, since decisions are not indexed by resource</li>
 * </ul>
 */
public class StoreChangeInvalidator implements StoreChangeListener {

    private static final Logger _log = LoggerFactory.getLogger(StoreChangeInvalidator.class);

    private final PermissionCache _cache;
    private final DependencyResolver _dependencyResolver;
    private final DependencyRulesLoader _rulesLoader;

    public StoreChangeInvalidator(PermissionCache cache, DependencyResolver dependencyResolver,
                                  DependencyRulesLoader rulesLoader) {
        _cache = checkNotNull(cache, "cache");
        _dependencyResolver = checkNotNull(dependencyResolver, "dependencyResolver");
        _rulesLoader = checkNotNull(rulesLoader, "rulesLoader");
    }

    @Override
    public void storeChanged(StoreChangeEvent event) {
        _log.debug("Store changed: {}", event);
        switch (event.getType()) {
            case USER_ROLE_ASSIGNMENT:
            case SUPER_ADMIN:
                _cache.invalidateForUser(event.getUserId());
                break;
            case ROLE_PERMISSION:
                _cache.invalidateForRole(event.getRoleId());
                break;
            case DEPENDENCY_RULES:
                // Reload first; if the new table is rejected the old table and the cache remain consistent
                _dependencyResolver.reload(_rulesLoader.load());
                _cache.invalidateAll();
                break;
            case RESOURCE_OWNER:
                _cache.invalidateAll();
                break;
            default:
                throw new UnsupportedOperationException(String.valueOf(event.getType()));
        }
    }
}
