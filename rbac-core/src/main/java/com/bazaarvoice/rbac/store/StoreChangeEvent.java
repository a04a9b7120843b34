package com.bazaarvoice.rbac.store;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.util.EventObject;

import static java.util.Objects.requireNonNull;

/**
 * Describes a single write to a {@link PermissionStore}.  User events carry the user id, role events carry the
 * role id, resource owner events carry the resource type and id, and dependency rule events carry none of these.
 */
public class StoreChangeEvent extends EventObject {
    private final StoreChangeType _type;
    private final String _userId;
    private final String _roleId;
    private final String _resourceType;
    private final String _resourceId;

    private StoreChangeEvent(Object source, StoreChangeType type, @Nullable String userId, @Nullable String roleId) {
        this(source, type, userId, roleId, null, null);
    }

    private StoreChangeEvent(Object source, StoreChangeType type, @Nullable String userId, @Nullable String roleId,
                             @Nullable String resourceType, @Nullable String resourceId) {
        super(source);
        _type = requireNonNull(type, "type");
        _userId = userId;
        _roleId = roleId;
        _resourceType = resourceType;
        _resourceId = resourceId;
    }

    public static StoreChangeEvent assignmentChanged(Object source, String userId, String roleId) {
        return new StoreChangeEvent(source, StoreChangeType.USER_ROLE_ASSIGNMENT,
                requireNonNull(userId, "userId"), requireNonNull(roleId, "roleId"));
    }

    public static StoreChangeEvent rolePermissionsChanged(Object source, String roleId) {
        return new StoreChangeEvent(source, StoreChangeType.ROLE_PERMISSION, null, requireNonNull(roleId, "roleId"));
    }

    public static StoreChangeEvent dependencyRulesChanged(Object source) {
        return new StoreChangeEvent(source, StoreChangeType.DEPENDENCY_RULES, null, null);
    }

    public static StoreChangeEvent superAdminChanged(Object source, String userId) {
        return new StoreChangeEvent(source, StoreChangeType.SUPER_ADMIN, requireNonNull(userId, "userId"), null);
    }

    /** An existing resource moved to another tenant or entity, or was removed. */
    public static StoreChangeEvent resourceOwnerChanged(Object source, String resourceType, String resourceId) {
        return new StoreChangeEvent(source, StoreChangeType.RESOURCE_OWNER, null, null,
                requireNonNull(resourceType, "resourceType"), requireNonNull(resourceId, "resourceId"));
    }

    public StoreChangeType getType() {
        return _type;
    }

    @Nullable
    public String getUserId() {
        return _userId;
    }

    @Nullable
    public String getRoleId() {
        return _roleId;
    }

    @Nullable
    public String getResourceType() {
        return _resourceType;
    }

    @Nullable
    public String getResourceId() {
        return _resourceId;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("type", _type)
                .add("userId", _userId)
                .add("roleId", _roleId)
                .add("resourceType", _resourceType)
                .add("resourceId", _resourceId)
                .toString();
    }
}
