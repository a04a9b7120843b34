package com.bazaarvoice.rbac.dependency;

import com.bazaarvoice.rbac.store.PermissionStore;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Chooses the dependency rule table: the store's rules when it has any, otherwise the configured fallback rules,
 * otherwise {@link StandardDependencyRules}.
 */
public class DependencyRulesLoader {

    private static final Logger _log = LoggerFactory.getLogger(DependencyRulesLoader.class);

    private final PermissionStore _store;
    private final List<PermissionDependencyRule> _fallback;

    public DependencyRulesLoader(PermissionStore store, @Nullable List<PermissionDependencyRule> fallback) {
        _store = checkNotNull(store, "store");
        _fallback = fallback != null ? ImmutableList.copyOf(fallback) : StandardDependencyRules.rules();
    }

    public List<PermissionDependencyRule> load() {
        List<PermissionDependencyRule> rules = _store.getDependencyRules();
        if (rules == null || rules.isEmpty()) {
            _log.debug("Store has no dependency rules, using {} fallback rules", _fallback.size());
            return _fallback;
        }
        return rules;
    }

    /** Loads and compiles the initial rule table; a broken table prevents startup. */
    public DependencyResolver newResolver() {
        return new DependencyResolver(DependencyRuleSet.compile(load()));
    }
}
