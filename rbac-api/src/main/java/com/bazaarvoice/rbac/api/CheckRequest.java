package com.bazaarvoice.rbac.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A single permission check: may {@code userId}, acting in {@code tenantId}, perform {@code action} on
 * {@code resourceType} (optionally a specific {@code resourceId})?
 * <p>
 * {@code entityId} is the caller's entity context within the tenant.  It is only needed for type-level checks
 * where no resource is named; when a resource is named its owning entity is looked up instead.
 * <p>
 * Instances are always valid; {@link Builder#build()} throws {@link InvalidCheckRequestException} otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CheckRequest {

    private final String _userId;
    private final String _tenantId;
    private final Action _action;
    private final String _resourceType;
    private final String _resourceId;
    private final String _entityId;
    private final boolean _bypassCache;

    private CheckRequest(String userId, String tenantId, Action action, String resourceType,
                         @Nullable String resourceId, @Nullable String entityId, boolean bypassCache) {
        _userId = userId;
        _tenantId = tenantId;
        _action = action;
        _resourceType = resourceType;
        _resourceId = resourceId;
        _entityId = entityId;
        _bypassCache = bypassCache;
    }

    @JsonCreator
    static CheckRequest fromJson(@JsonProperty("userId") String userId,
                                 @JsonProperty("tenantId") String tenantId,
                                 @JsonProperty("action") Action action,
                                 @JsonProperty("resourceType") String resourceType,
                                 @JsonProperty("resourceId") @Nullable String resourceId,
                                 @JsonProperty("entityId") @Nullable String entityId,
                                 @JsonProperty("bypassCache") boolean bypassCache) {
        return builder()
                .user(userId)
                .tenant(tenantId)
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .entity(entityId)
                .bypassCache(bypassCache)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getUserId() {
        return _userId;
    }

    public String getTenantId() {
        return _tenantId;
    }

    public Action getAction() {
        return _action;
    }

    public String getResourceType() {
        return _resourceType;
    }

    @Nullable
    public String getResourceId() {
        return _resourceId;
    }

    @Nullable
    public String getEntityId() {
        return _entityId;
    }

    public boolean hasResourceId() {
        return _resourceId != null;
    }

    public boolean isBypassCache() {
        return _bypassCache;
    }

    /** Returns the same request with the cache bypass flag changed. */
    public CheckRequest withBypassCache(boolean bypassCache) {
        return bypassCache == _bypassCache ? this :
                new CheckRequest(_userId, _tenantId, _action, _resourceType, _resourceId, _entityId, bypassCache);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CheckRequest)) {
            return false;
        }
        CheckRequest that = (CheckRequest) o;
        return _bypassCache == that._bypassCache &&
                _userId.equals(that._userId) &&
                _tenantId.equals(that._tenantId) &&
                _action == that._action &&
                _resourceType.equals(that._resourceType) &&
                Objects.equals(_resourceId, that._resourceId) &&
                Objects.equals(_entityId, that._entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_userId, _tenantId, _action, _resourceType, _resourceId, _entityId, _bypassCache);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("userId", _userId)
                .add("tenantId", _tenantId)
                .add("action", _action)
                .add("resourceType", _resourceType)
                .add("resourceId", _resourceId)
                .add("entityId", _entityId)
                .add("bypassCache", _bypassCache ? Boolean.TRUE : null)
                .toString();
    }

    public static class Builder {
        private String _userId;
        private String _tenantId;
        private Action _action;
        private String _resourceType;
        private String _resourceId;
        private String _entityId;
        private boolean _bypassCache;

        private Builder() {
            // empty
        }

        public Builder user(String userId) {
            _userId = userId;
            return this;
        }

        public Builder tenant(String tenantId) {
            _tenantId = tenantId;
            return this;
        }

        public Builder action(Action action) {
            _action = action;
            return this;
        }

        public Builder resourceType(String resourceType) {
            _resourceType = resourceType;
            return this;
        }

        public Builder resourceId(@Nullable String resourceId) {
            _resourceId = resourceId;
            return this;
        }

        public Builder entity(@Nullable String entityId) {
            _entityId = entityId;
            return this;
        }

        public Builder bypassCache(boolean bypassCache) {
            _bypassCache = bypassCache;
            return this;
        }

        public CheckRequest build() {
            requireNonEmpty(_userId, "userId");
            requireNonEmpty(_tenantId, "tenantId");
            requireNonEmpty(_resourceType, "resourceType");
            if (_action == null) {
                throw new InvalidCheckRequestException("action is required");
            }
            // An empty resource or entity id means "not specified"
            return new CheckRequest(_userId.trim(), _tenantId.trim(), _action, _resourceType.trim(),
                    Strings.emptyToNull(_resourceId), Strings.emptyToNull(_entityId), _bypassCache);
        }

        private static void requireNonEmpty(String value, String name) {
            if (value == null || value.trim().isEmpty()) {
                throw new InvalidCheckRequestException(name + " must be a non-empty string");
            }
        }
    }
}
