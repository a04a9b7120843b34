package com.bazaarvoice.rbac.cache;

import com.bazaarvoice.rbac.api.Action;
import com.bazaarvoice.rbac.api.CheckRequest;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Key for a cached decision.  Includes everything that can change a decision for a fixed store state: user,
 * tenant, caller entity, action, resource type and resource id.  The cache bypass flag is not part of the key.
 */
public final class DecisionKey {
    private final String _userId;
    private final String _tenantId;
    private final String _entityId;
    private final Action _action;
    private final String _resourceType;
    private final String _resourceId;

    public DecisionKey(String userId, String tenantId, @Nullable String entityId, Action action,
                       String resourceType, @Nullable String resourceId) {
        _userId = checkNotNull(userId, "userId");
        _tenantId = checkNotNull(tenantId, "tenantId");
        _entityId = entityId;
        _action = checkNotNull(action, "action");
        _resourceType = checkNotNull(resourceType, "resourceType");
        _resourceId = resourceId;
    }

    public static DecisionKey of(CheckRequest request) {
        return new DecisionKey(request.getUserId(), request.getTenantId(), request.getEntityId(),
                request.getAction(), request.getResourceType(), request.getResourceId());
    }

    public String getUserId() {
        return _userId;
    }

    public String getTenantId() {
        return _tenantId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecisionKey)) {
            return false;
        }
        DecisionKey that = (DecisionKey) o;
        return _userId.equals(that._userId) &&
                _tenantId.equals(that._tenantId) &&
                Objects.equals(_entityId, that._entityId) &&
                _action == that._action &&
                _resourceType.equals(that._resourceType) &&
                Objects.equals(_resourceId, that._resourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_userId, _tenantId, _entityId, _action, _resourceType, _resourceId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("userId", _userId)
                .add("tenantId", _tenantId)
                .add("entityId", _entityId)
                .add("action", _action)
                .add("resourceType", _resourceType)
                .add("resourceId", _resourceId)
                .toString();
    }
}
