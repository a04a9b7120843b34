package com.bazaarvoice.rbac.config;

import com.bazaarvoice.rbac.cache.CacheLayer;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

/**
 * Time-to-live and size limits for each layer of the permission cache.  Invalidation on write keeps the cache
 * correct; the TTLs only bound how long a missed invalidation could linger, so keep them short.
 */
public class CacheConfiguration {

    @NotNull
    @JsonProperty("decisionTtl")
    private Duration _decisionTtl = Duration.seconds(5);

    @NotNull
    @JsonProperty("effectivePermissionsTtl")
    private Duration _effectivePermissionsTtl = Duration.seconds(5);

    @NotNull
    @JsonProperty("roleClosureTtl")
    private Duration _roleClosureTtl = Duration.seconds(5);

    // Super admin status changes rarely and is invalidated on write, so it is held much longer
    @NotNull
    @JsonProperty("superAdminTtl")
    private Duration _superAdminTtl = Duration.minutes(10);

    @Min(1)
    @JsonProperty("maximumSize")
    private long _maximumSize = 100_000;

    public Duration getDecisionTtl() {
        return _decisionTtl;
    }

    public CacheConfiguration setDecisionTtl(Duration decisionTtl) {
        _decisionTtl = decisionTtl;
        return this;
    }

    public Duration getEffectivePermissionsTtl() {
        return _effectivePermissionsTtl;
    }

    public CacheConfiguration setEffectivePermissionsTtl(Duration effectivePermissionsTtl) {
        _effectivePermissionsTtl = effectivePermissionsTtl;
        return this;
    }

    public Duration getRoleClosureTtl() {
        return _roleClosureTtl;
    }

    public CacheConfiguration setRoleClosureTtl(Duration roleClosureTtl) {
        _roleClosureTtl = roleClosureTtl;
        return this;
    }

    public Duration getSuperAdminTtl() {
        return _superAdminTtl;
    }

    public CacheConfiguration setSuperAdminTtl(Duration superAdminTtl) {
        _superAdminTtl = superAdminTtl;
        return this;
    }

    public long getMaximumSize() {
        return _maximumSize;
    }

    public CacheConfiguration setMaximumSize(long maximumSize) {
        _maximumSize = maximumSize;
        return this;
    }

    public Duration getTtl(CacheLayer layer) {
        switch (layer) {
            case DECISION:
                return _decisionTtl;
            case EFFECTIVE_PERMISSIONS:
                return _effectivePermissionsTtl;
            case ROLE_CLOSURE:
                return _roleClosureTtl;
            case SUPER_ADMIN:
                return _superAdminTtl;
            default:
                throw new UnsupportedOperationException(String.valueOf(layer));
        }
    }
}
