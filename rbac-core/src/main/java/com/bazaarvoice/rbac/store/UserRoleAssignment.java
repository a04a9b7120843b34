package com.bazaarvoice.rbac.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Assignment of a role to a user within a tenant.  Without an entity the assignment is tenant-wide; with one it
 * applies only to resources owned by that entity.  An assignment with an expiration stops applying once that
 * instant is reached.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserRoleAssignment {

    private final String _userId;
    private final String _roleId;
    private final String _tenantId;
    private final String _entityId;
    private final Instant _expiresAt;

    public UserRoleAssignment(String userId, String roleId, String tenantId, @Nullable String entityId) {
        this(userId, roleId, tenantId, entityId, null);
    }

    @JsonCreator
    public UserRoleAssignment(@JsonProperty("userId") String userId,
                              @JsonProperty("roleId") String roleId,
                              @JsonProperty("tenantId") String tenantId,
                              @JsonProperty("entityId") @Nullable String entityId,
                              @JsonProperty("expiresAt") @Nullable Instant expiresAt) {
        _userId = checkNotNull(userId, "userId");
        _roleId = checkNotNull(roleId, "roleId");
        _tenantId = checkNotNull(tenantId, "tenantId");
        _entityId = entityId;
        _expiresAt = expiresAt;
    }

    public String getUserId() {
        return _userId;
    }

    public String getRoleId() {
        return _roleId;
    }

    public String getTenantId() {
        return _tenantId;
    }

    @Nullable
    public String getEntityId() {
        return _entityId;
    }

    @Nullable
    public Instant getExpiresAt() {
        return _expiresAt;
    }

    @JsonIgnore
    public boolean isTenantWide() {
        return _entityId == null;
    }

    public boolean isExpiredAt(Instant now) {
        return _expiresAt != null && !now.isBefore(_expiresAt);
    }

    /** Two assignments are the same grant if they differ only by expiration. */
    public boolean isSameGrant(UserRoleAssignment other) {
        return _userId.equals(other._userId) &&
                _roleId.equals(other._roleId) &&
                _tenantId.equals(other._tenantId) &&
                Objects.equals(_entityId, other._entityId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UserRoleAssignment)) {
            return false;
        }
        UserRoleAssignment that = (UserRoleAssignment) o;
        return isSameGrant(that) && Objects.equals(_expiresAt, that._expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_userId, _roleId, _tenantId, _entityId, _expiresAt);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("userId", _userId)
                .add("roleId", _roleId)
                .add("tenantId", _tenantId)
                .add("entityId", _entityId)
                .add("expiresAt", _expiresAt)
                .toString();
    }
}
