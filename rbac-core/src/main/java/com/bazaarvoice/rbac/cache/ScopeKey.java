package com.bazaarvoice.rbac.cache;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Key for a user's effective permissions within a tenant, optionally narrowed to one entity.
 */
public final class ScopeKey {
    private final String _userId;
    private final String _tenantId;
    private final String _entityId;

    public ScopeKey(String userId, String tenantId, @Nullable String entityId) {
        _userId = checkNotNull(userId, "userId");
        _tenantId = checkNotNull(tenantId, "tenantId");
        _entityId = entityId;
    }

    public String getUserId() {
        return _userId;
    }

    public String getTenantId() {
        return _tenantId;
    }

    @Nullable
    public String getEntityId() {
        return _entityId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScopeKey)) {
            return false;
        }
        ScopeKey that = (ScopeKey) o;
        return _userId.equals(that._userId) &&
                _tenantId.equals(that._tenantId) &&
                Objects.equals(_entityId, that._entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_userId, _tenantId, _entityId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("userId", _userId)
                .add("tenantId", _tenantId)
                .add("entityId", _entityId)
                .toString();
    }
}
