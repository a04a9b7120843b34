package com.bazaarvoice.rbac.dependency;

import com.bazaarvoice.rbac.api.Action;
import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable, validated dependency rule table.  Use {@link #compile(Collection)} to build one; compilation fails
 * with {@link DependencyConfigurationException} if the table is malformed or its rules form a cycle.
 * <p>
 * Rules are indexed by the permissions that trigger them so {@link #expand(Set)} only visits rules reachable from
 * the held permissions.
 */
public final class DependencyRuleSet {

    private static final DependencyRuleSet EMPTY = new DependencyRuleSet(ImmutableList.of());

    // Highest priority first, ties broken by id so expansion is deterministic
    private static final Comparator<PermissionDependencyRule> RULE_ORDER =
            Comparator.comparingInt(PermissionDependencyRule::getPriority).reversed()
                    .thenComparing(PermissionDependencyRule::getId);

    private final List<PermissionDependencyRule> _rules;
    private final ListMultimap<Action, PermissionDependencyRule> _templatesByTriggerAction;
    private final ListMultimap<ResourcePermission, PermissionDependencyRule> _concreteByTrigger;
    private final ListMultimap<Action, PermissionDependencyRule> _concreteByTriggerAction;

    private DependencyRuleSet(List<PermissionDependencyRule> rules) {
        _rules = Ordering.from(RULE_ORDER).immutableSortedCopy(rules);

        ImmutableListMultimap.Builder<Action, PermissionDependencyRule> templates = ImmutableListMultimap.builder();
        ImmutableListMultimap.Builder<ResourcePermission, PermissionDependencyRule> concrete = ImmutableListMultimap.builder();
        ImmutableListMultimap.Builder<Action, PermissionDependencyRule> concreteByAction = ImmutableListMultimap.builder();
        for (PermissionDependencyRule rule : _rules) {
            for (ResourcePermission trigger : rule.getWhen()) {
                if (rule.isTemplate()) {
                    templates.put(trigger.getAction(), rule);
                } else {
                    concrete.put(trigger, rule);
                    concreteByAction.put(trigger.getAction(), rule);
                }
            }
        }
        _templatesByTriggerAction = templates.build();
        _concreteByTrigger = concrete.build();
        _concreteByTriggerAction = concreteByAction.build();
    }

    public static DependencyRuleSet empty() {
        return EMPTY;
    }

    /**
     * Validates and indexes a rule table.
     *
     * @throws DependencyConfigurationException if a rule is malformed, two rules share an id or the rules contain
     *         a cycle
     */
    public static DependencyRuleSet compile(Collection<PermissionDependencyRule> rules) {
        checkNotNull(rules, "rules");
        Set<String> ids = Sets.newHashSet();
        for (PermissionDependencyRule rule : rules) {
            if (rule == null) {
                throw new DependencyConfigurationException("Dependency rule table contains a null rule");
            }
            if (!ids.add(rule.getId())) {
                throw new DependencyConfigurationException("Duplicate dependency rule id: " + rule.getId());
            }
            if (rule.getWhen().isEmpty() || rule.getImplies().isEmpty()) {
                throw new DependencyConfigurationException(
                        "Dependency rule must have at least one 'when' and one 'implies' permission: " + rule.getId());
            }
            if (rule.isMixed()) {
                throw new DependencyConfigurationException(
                        "Dependency rule cannot mix '*' and concrete resource types: " + rule.getId());
            }
        }
        checkAcyclic(rules);
        return rules.isEmpty() ? EMPTY : new DependencyRuleSet(ImmutableList.copyOf(rules));
    }

    public List<PermissionDependencyRule> getRules() {
        return _rules;
    }

    public boolean isEmpty() {
        return _rules.isEmpty();
    }

    /**
     * Computes the forward closure of {@code held}: every permission reachable from it, honoring ALL and ANY
     * conditions.
     */
    public PermissionClosure expand(Set<ResourcePermission> held) {
        checkNotNull(held, "held");
        if (_rules.isEmpty() || held.isEmpty()) {
            return PermissionClosure.ofHeld(held);
        }

        Set<ResourcePermission> reached = Sets.newHashSet(held);
        Map<ResourcePermission, String> derivedBy = new LinkedHashMap<>();
        // Legs satisfied so far for each ALL rule instance, keyed by rule id and bound resource type
        Map<String, Set<ResourcePermission>> satisfiedLegs = Maps.newHashMap();
        Deque<ResourcePermission> worklist = new ArrayDeque<>(held);

        while (!worklist.isEmpty()) {
            ResourcePermission permission = worklist.poll();
            for (Triggered triggered : triggeredBy(permission)) {
                PermissionDependencyRule rule = triggered.rule;
                boolean fires;
                if (rule.getCondition() == PermissionDependencyRule.Condition.ANY) {
                    fires = true;
                } else {
                    Set<ResourcePermission> legs = satisfiedLegs.computeIfAbsent(
                            rule.getId() + ResourcePermission.SEPARATOR + triggered.boundType, key -> Sets.newHashSet());
                    legs.add(triggered.leg);
                    fires = legs.size() == rule.getWhen().size();
                }
                if (fires) {
                    for (ResourcePermission implied : rule.getImplies()) {
                        if (reached.add(implied)) {
                            derivedBy.put(implied, rule.getId());
                            worklist.add(implied);
                        }
                    }
                }
            }
        }
        return new PermissionClosure(held, derivedBy);
    }

    /** Returns the rule instances, in priority order, that have {@code permission} as a trigger leg. */
    private List<Triggered> triggeredBy(ResourcePermission permission) {
        List<Triggered> triggered = ImmutableList.of();
        List<PermissionDependencyRule> templates = _templatesByTriggerAction.get(permission.getAction());
        List<PermissionDependencyRule> concrete = permission.isAnyResourceType() ?
                _concreteByTriggerAction.get(permission.getAction()) :
                _concreteByTrigger.get(permission);

        if (!templates.isEmpty() || !concrete.isEmpty()) {
            ImmutableList.Builder<Triggered> builder = ImmutableList.builder();
            for (PermissionDependencyRule template : templates) {
                builder.add(new Triggered(template.bind(permission.getResourceType()), permission, permission.getResourceType()));
            }
            for (PermissionDependencyRule rule : concrete) {
                for (ResourcePermission leg : rule.getWhen()) {
                    if (permission.implies(leg)) {
                        builder.add(new Triggered(rule, leg, ""));
                    }
                }
            }
            triggered = Ordering.from(RULE_ORDER).onResultOf((Triggered t) -> t.rule).immutableSortedCopy(builder.build());
        }
        return triggered;
    }

    /**
     * Kahn's algorithm over the permission graph.  Template rules are instantiated for every concrete resource type
     * named in the table plus {@code *} itself, which covers every type that only template rules apply to.
     */
    private static void checkAcyclic(Collection<PermissionDependencyRule> rules) {
        Set<String> resourceTypes = Sets.newHashSet(ResourcePermission.ANY_RESOURCE_TYPE);
        for (PermissionDependencyRule rule : rules) {
            if (!rule.isTemplate()) {
                rule.getWhen().forEach(p -> resourceTypes.add(p.getResourceType()));
                rule.getImplies().forEach(p -> resourceTypes.add(p.getResourceType()));
            }
        }

        SetMultimap<ResourcePermission, ResourcePermission> edges = HashMultimap.create();
        for (PermissionDependencyRule rule : rules) {
            Collection<PermissionDependencyRule> instances = rule.isTemplate() ?
                    resourceTypes.stream().map(rule::bind).collect(ImmutableList.toImmutableList()) :
                    ImmutableList.of(rule);
            for (PermissionDependencyRule instance : instances) {
                for (ResourcePermission from : instance.getWhen()) {
                    for (ResourcePermission to : instance.getImplies()) {
                        if (from.equals(to)) {
                            throw new DependencyConfigurationException(
                                    "Dependency rule implies its own trigger " + from + ": " + rule.getId());
                        }
                        edges.put(from, to);
                    }
                }
            }
        }

        Map<ResourcePermission, Integer> inDegree = Maps.newHashMap();
        for (Map.Entry<ResourcePermission, ResourcePermission> edge : edges.entries()) {
            inDegree.putIfAbsent(edge.getKey(), 0);
            inDegree.merge(edge.getValue(), 1, Integer::sum);
        }
        Deque<ResourcePermission> ready = new ArrayDeque<>();
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                ready.add(node);
            }
        });
        int visited = 0;
        while (!ready.isEmpty()) {
            ResourcePermission node = ready.poll();
            visited++;
            for (ResourcePermission next : edges.get(node)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (visited < inDegree.size()) {
            List<ResourcePermission> cyclic = Lists.newArrayList();
            inDegree.forEach((node, degree) -> {
                if (degree > 0) {
                    cyclic.add(node);
                }
            });
            throw new DependencyConfigurationException("Dependency rules contain a cycle through " +
                    Ordering.usingToString().sortedCopy(cyclic));
        }
    }

    private static final class Triggered {
        final PermissionDependencyRule rule;
        final ResourcePermission leg;
        final String boundType;

        Triggered(PermissionDependencyRule rule, ResourcePermission leg, String boundType) {
            this.rule = rule;
            this.leg = leg;
            this.boundType = boundType;
        }
    }
}
