package com.bazaarvoice.rbac.dependency;

import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * States that holding the {@code when} permissions implies holding the {@code implies} permissions.  With
 * {@link Condition#ALL} every {@code when} permission must be held; with {@link Condition#ANY} one suffices.
 * <p>
 * A rule whose permissions all use the resource type {@code *} is a template: it applies to every resource type,
 * binding all of its permissions to the same type.  A rule may not mix {@code *} and concrete resource types.
 * <p>
 * Rules with a higher priority are applied first when several rules derive the same permission, which decides the
 * rule reported as the source of a derived permission.
 */
public class PermissionDependencyRule {

    public enum Condition {
        ALL,
        ANY
    }

    private final String _id;
    private final Condition _condition;
    private final List<ResourcePermission> _when;
    private final Set<ResourcePermission> _implies;
    private final int _priority;

    @JsonCreator
    public PermissionDependencyRule(@JsonProperty("id") String id,
                                    @JsonProperty("condition") @Nullable Condition condition,
                                    @JsonProperty("when") Collection<ResourcePermission> when,
                                    @JsonProperty("implies") Collection<ResourcePermission> implies,
                                    @JsonProperty("priority") int priority) {
        _id = checkNotNull(id, "id");
        _condition = condition != null ? condition : Condition.ANY;
        _when = ImmutableList.copyOf(ImmutableSet.copyOf(checkNotNull(when, "when")));
        _implies = ImmutableSet.copyOf(checkNotNull(implies, "implies"));
        _priority = priority;
    }

    public static PermissionDependencyRule any(String id, int priority, ResourcePermission when, ResourcePermission... implies) {
        return new PermissionDependencyRule(id, Condition.ANY, ImmutableList.of(when), ImmutableList.copyOf(implies), priority);
    }

    public static PermissionDependencyRule all(String id, int priority, Collection<ResourcePermission> when, ResourcePermission... implies) {
        return new PermissionDependencyRule(id, Condition.ALL, when, ImmutableList.copyOf(implies), priority);
    }

    public String getId() {
        return _id;
    }

    public Condition getCondition() {
        return _condition;
    }

    public List<ResourcePermission> getWhen() {
        return _when;
    }

    public Set<ResourcePermission> getImplies() {
        return _implies;
    }

    public int getPriority() {
        return _priority;
    }

    /** True if every permission in the rule uses the {@code *} resource type. */
    @JsonIgnore
    public boolean isTemplate() {
        return _when.stream().allMatch(ResourcePermission::isAnyResourceType) &&
                _implies.stream().allMatch(ResourcePermission::isAnyResourceType);
    }

    /** True if some but not all permissions use the {@code *} resource type. */
    @JsonIgnore
    boolean isMixed() {
        boolean anyTemplate = _when.stream().anyMatch(ResourcePermission::isAnyResourceType) ||
                _implies.stream().anyMatch(ResourcePermission::isAnyResourceType);
        return anyTemplate && !isTemplate();
    }

    /** Instantiates a template rule for a single resource type. */
    PermissionDependencyRule bind(String resourceType) {
        return new PermissionDependencyRule(_id, _condition,
                _when.stream().map(p -> p.withResourceType(resourceType)).collect(ImmutableList.toImmutableList()),
                _implies.stream().map(p -> p.withResourceType(resourceType)).collect(ImmutableList.toImmutableList()),
                _priority);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PermissionDependencyRule)) {
            return false;
        }
        PermissionDependencyRule that = (PermissionDependencyRule) o;
        return _priority == that._priority &&
                _id.equals(that._id) &&
                _condition == that._condition &&
                _when.equals(that._when) &&
                _implies.equals(that._implies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_id, _condition, _when, _implies, _priority);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", _id)
                .add("condition", _condition)
                .add("when", _when)
                .add("implies", _implies)
                .add("priority", _priority)
                .toString();
    }
}
