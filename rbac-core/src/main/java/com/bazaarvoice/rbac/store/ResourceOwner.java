package com.bazaarvoice.rbac.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The tenant, and optionally the entity within it, which owns a resource instance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceOwner {

    private final String _tenantId;
    private final String _entityId;

    @JsonCreator
    public ResourceOwner(@JsonProperty("tenantId") String tenantId,
                         @JsonProperty("entityId") @Nullable String entityId) {
        _tenantId = checkNotNull(tenantId, "tenantId");
        _entityId = entityId;
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
        if (!(o instanceof ResourceOwner)) {
            return false;
        }
        ResourceOwner that = (ResourceOwner) o;
        return _tenantId.equals(that._tenantId) && Objects.equals(_entityId, that._entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_tenantId, _entityId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("tenantId", _tenantId)
                .add("entityId", _entityId)
                .toString();
    }
}
