package com.bazaarvoice.rbac.config;

import com.bazaarvoice.rbac.dependency.PermissionDependencyRule;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;

import javax.annotation.Nullable;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.util.List;

/**
 * Configuration for the permission engine.
 */
public class PermissionEngineConfiguration {

    @Valid
    @NotNull
    @JsonProperty("cache")
    private CacheConfiguration _cache = new CacheConfiguration();

    @Valid
    @NotNull
    @JsonProperty("audit")
    private AuditConfiguration _audit = new AuditConfiguration();

    // Deadline applied to checks made without an explicit one
    @NotNull
    @JsonProperty("checkTimeout")
    private Duration _checkTimeout = Duration.milliseconds(250);

    // Threads used to fan out store reads within a check
    @Min(1)
    @JsonProperty("storeThreads")
    private int _storeThreads = 8;

    // Rules used when the store has none.  If also absent the standard action hierarchy is used.
    @Valid
    @JsonProperty("dependencyRules")
    private List<PermissionDependencyRule> _dependencyRules;

    public CacheConfiguration getCache() {
        return _cache;
    }

    public PermissionEngineConfiguration setCache(CacheConfiguration cache) {
        _cache = cache;
        return this;
    }

    public AuditConfiguration getAudit() {
        return _audit;
    }

    public PermissionEngineConfiguration setAudit(AuditConfiguration audit) {
        _audit = audit;
        return this;
    }

    public Duration getCheckTimeout() {
        return _checkTimeout;
    }

    public PermissionEngineConfiguration setCheckTimeout(Duration checkTimeout) {
        _checkTimeout = checkTimeout;
        return this;
    }

    public int getStoreThreads() {
        return _storeThreads;
    }

    public PermissionEngineConfiguration setStoreThreads(int storeThreads) {
        _storeThreads = storeThreads;
        return this;
    }

    @Nullable
    public List<PermissionDependencyRule> getDependencyRules() {
        return _dependencyRules;
    }

    public PermissionEngineConfiguration setDependencyRules(@Nullable List<PermissionDependencyRule> dependencyRules) {
        _dependencyRules = dependencyRules;
        return this;
    }
}
