package com.bazaarvoice.rbac.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named bundle of permissions.  A role without a tenant is a global template which may be assigned in any
 * tenant; a tenant role may only be assigned within its own tenant.  Roles do not inherit from one another.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Role {

    private final String _id;
    private final String _name;
    private final String _tenantId;

    @JsonCreator
    public Role(@JsonProperty("id") String id,
                @JsonProperty("name") String name,
                @JsonProperty("tenantId") @Nullable String tenantId) {
        _id = checkNotNull(id, "id");
        _name = checkNotNull(name, "name");
        _tenantId = tenantId;
    }

    public String getId() {
        return _id;
    }

    public String getName() {
        return _name;
    }

    @Nullable
    public String getTenantId() {
        return _tenantId;
    }

    @JsonIgnore
    public boolean isGlobal() {
        return _tenantId == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Role)) {
            return false;
        }
        Role role = (Role) o;
        return _id.equals(role._id) &&
                _name.equals(role._name) &&
                Objects.equals(_tenantId, role._tenantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_id, _name, _tenantId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("id", _id)
                .add("name", _name)
                .add("tenantId", _tenantId)
                .toString();
    }
}
