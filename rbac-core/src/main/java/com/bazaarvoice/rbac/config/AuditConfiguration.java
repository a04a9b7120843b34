package com.bazaarvoice.rbac.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.validation.constraints.Min;

public class AuditConfiguration {

    // When disabled events are discarded without being queued
    @JsonProperty("enabled")
    private boolean _enabled = true;

    // Events beyond this many pending are dropped rather than blocking a check
    @Min(1)
    @JsonProperty("queueCapacity")
    private int _queueCapacity = 4096;

    public boolean isEnabled() {
        return _enabled;
    }

    public AuditConfiguration setEnabled(boolean enabled) {
        _enabled = enabled;
        return this;
    }

    public int getQueueCapacity() {
        return _queueCapacity;
    }

    public AuditConfiguration setQueueCapacity(int queueCapacity) {
        _queueCapacity = queueCapacity;
        return this;
    }
}
