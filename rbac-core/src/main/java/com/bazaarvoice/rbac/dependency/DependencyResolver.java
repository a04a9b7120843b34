package com.bazaarvoice.rbac.dependency;

import com.bazaarvoice.rbac.permissions.ResourcePermission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Answers whether held permissions imply a requested one under the current dependency rule table.
 * <p>
 * The table is immutable and replaced wholesale by {@link #reload(Collection)}; checks in flight keep using the
 * table they started with.  A table that fails to compile is rejected and the current one stays in effect.
 */
public class DependencyResolver {

    private static final Logger _log = LoggerFactory.getLogger(DependencyResolver.class);

    private final AtomicReference<DependencyRuleSet> _ruleSet;

    public DependencyResolver(DependencyRuleSet ruleSet) {
        _ruleSet = new AtomicReference<>(checkNotNull(ruleSet, "ruleSet"));
    }

    public static DependencyResolver withStandardRules() {
        return new DependencyResolver(DependencyRuleSet.compile(StandardDependencyRules.rules()));
    }

    public DependencyRuleSet getRuleSet() {
        return _ruleSet.get();
    }

    /**
     * Compiles and installs a new rule table.
     *
     * @throws DependencyConfigurationException if the table is malformed or cyclic, in which case the current
     *         table is kept
     */
    public void reload(Collection<PermissionDependencyRule> rules) {
        DependencyRuleSet ruleSet;
        try {
            ruleSet = DependencyRuleSet.compile(rules);
        } catch (DependencyConfigurationException e) {
            _log.error("Rejected dependency rule table, keeping the current {} rules", _ruleSet.get().getRules().size(), e);
            throw e;
        }
        _ruleSet.set(ruleSet);
        _log.info("Loaded {} permission dependency rules", ruleSet.getRules().size());
    }

    public PermissionClosure expand(Set<ResourcePermission> held) {
        return _ruleSet.get().expand(held);
    }

    public boolean implies(Set<ResourcePermission> held, ResourcePermission requested) {
        checkNotNull(requested, "requested");
        return expand(held).implies(requested);
    }
}
