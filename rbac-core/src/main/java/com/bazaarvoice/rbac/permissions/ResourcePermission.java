package com.bazaarvoice.rbac.permissions;

import com.bazaarvoice.rbac.api.Action;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Splitter;
import org.apache.shiro.authz.Permission;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A permission to perform one {@link Action} on one resource type, written as {@code resourceType|Action}, for
 * example {@code projects|ViewAny}.  The resource type {@code *} matches every resource type, so
 * {@code *|Manage} implies {@code projects|Manage}.
 * <p>
 * Unlike Shiro's wildcard permissions the action part is never a wildcard and actions do not imply each other
 * here.  Relationships between actions are data, handled by the dependency resolver.
 */
public final class ResourcePermission implements Permission {

    public static final String SEPARATOR = "|";
    public static final String ANY_RESOURCE_TYPE = "*";

    private static final Splitter SPLITTER = Splitter.on(SEPARATOR).trimResults();

    private final String _resourceType;
    private final Action _action;

    public ResourcePermission(String resourceType, Action action) {
        _resourceType = checkNotNull(resourceType, "resourceType").trim();
        _action = checkNotNull(action, "action");
        checkArgument(!_resourceType.isEmpty(), "Resource type cannot be empty");
        checkArgument(!_resourceType.contains(SEPARATOR), "Resource type cannot contain '%s'", SEPARATOR);
    }

    @JsonCreator
    public static ResourcePermission parse(String permission) {
        checkNotNull(permission, "permission");
        List<String> parts = SPLITTER.splitToList(permission);
        checkArgument(parts.size() == 2, "Permission must have the form 'resourceType|Action': %s", permission);
        return new ResourcePermission(parts.get(0), Action.fromString(parts.get(1)));
    }

    public String getResourceType() {
        return _resourceType;
    }

    public Action getAction() {
        return _action;
    }

    public boolean isAnyResourceType() {
        return ANY_RESOURCE_TYPE.equals(_resourceType);
    }

    /** Returns a permission for the same action on a different resource type. */
    public ResourcePermission withResourceType(String resourceType) {
        return _resourceType.equals(resourceType) ? this : new ResourcePermission(resourceType, _action);
    }

    @Override
    public boolean implies(Permission p) {
        if (!(p instanceof ResourcePermission)) {
            return false;
        }
        ResourcePermission other = (ResourcePermission) p;
        return _action == other._action &&
                (isAnyResourceType() || _resourceType.equals(other._resourceType));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourcePermission)) {
            return false;
        }
        ResourcePermission that = (ResourcePermission) o;
        return _action == that._action && _resourceType.equals(that._resourceType);
    }

    @Override
    public int hashCode() {
        return 31 * _resourceType.hashCode() + _action.hashCode();
    }

    @JsonValue
    @Override
    public String toString() {
        return _resourceType + SEPARATOR + _action.getName();
    }
}
