package com.bazaarvoice.rbac.audit;

import com.bazaarvoice.rbac.api.CheckRequest;
import com.bazaarvoice.rbac.api.Decision;
import com.bazaarvoice.rbac.cache.CacheInvalidationEvent;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Structured audit record.  Permission checks produce {@value #PERMISSION_CHECK} events and cache invalidations
 * produce {@value #CACHE_INVALIDATION} events; fields that do not apply to an event type are null and omitted
 * from the JSON form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEvent {

    public static final String PERMISSION_CHECK = "permission_check";
    public static final String CACHE_INVALIDATION = "cache_invalidation";

    private final String _eventType;
    private final Instant _timestamp;

    // Permission check fields
    private final String _userId;
    private final String _tenantId;
    private final String _entityId;
    private final String _resourceType;
    private final String _action;
    private final String _resourceId;
    private final Boolean _granted;
    private final String _outcome;
    private final String _reason;
    private final Long _latencyMs;
    private final Boolean _cacheHit;

    // Cache invalidation fields
    private final String _scope;
    private final String _subjectId;
    private final Set<String> _affectedUsers;
    private final Integer _entriesInvalidated;

    @JsonCreator
    public AuditEvent(@JsonProperty("eventType") String eventType,
                      @JsonProperty("timestamp") Instant timestamp,
                      @JsonProperty("userId") @Nullable String userId,
                      @JsonProperty("tenantId") @Nullable String tenantId,
                      @JsonProperty("entityId") @Nullable String entityId,
                      @JsonProperty("resourceType") @Nullable String resourceType,
                      @JsonProperty("action") @Nullable String action,
                      @JsonProperty("resourceId") @Nullable String resourceId,
                      @JsonProperty("granted") @Nullable Boolean granted,
                      @JsonProperty("outcome") @Nullable String outcome,
                      @JsonProperty("reason") @Nullable String reason,
                      @JsonProperty("latencyMs") @Nullable Long latencyMs,
                      @JsonProperty("cacheHit") @Nullable Boolean cacheHit,
                      @JsonProperty("scope") @Nullable String scope,
                      @JsonProperty("subjectId") @Nullable String subjectId,
                      @JsonProperty("affectedUsers") @Nullable Set<String> affectedUsers,
                      @JsonProperty("entriesInvalidated") @Nullable Integer entriesInvalidated) {
        _eventType = checkNotNull(eventType, "eventType");
        _timestamp = checkNotNull(timestamp, "timestamp");
        _userId = userId;
        _tenantId = tenantId;
        _entityId = entityId;
        _resourceType = resourceType;
        _action = action;
        _resourceId = resourceId;
        _granted = granted;
        _outcome = outcome;
        _reason = reason;
        _latencyMs = latencyMs;
        _cacheHit = cacheHit;
        _scope = scope;
        _subjectId = subjectId;
        _affectedUsers = affectedUsers != null ? ImmutableSet.copyOf(affectedUsers) : null;
        _entriesInvalidated = entriesInvalidated;
    }

    public static AuditEvent permissionCheck(CheckRequest request, Decision decision, Instant timestamp) {
        return new AuditEvent(PERMISSION_CHECK, timestamp,
                request.getUserId(), request.getTenantId(), request.getEntityId(), request.getResourceType(),
                request.getAction().getName(), request.getResourceId(),
                decision.isGranted(), decision.getOutcome().name(), decision.getReason().name(),
                decision.getLatencyMs(), decision.isCacheHit(),
                null, null, null, null);
    }

    public static AuditEvent cacheInvalidation(CacheInvalidationEvent event, Instant timestamp) {
        return new AuditEvent(CACHE_INVALIDATION, timestamp,
                null, null, null, null, null, null, null, null, null, null, null,
                event.getScope().name(), event.getSubjectId(), event.getAffectedUsers(), event.getEntriesInvalidated());
    }

    public String getEventType() {
        return _eventType;
    }

    public Instant getTimestamp() {
        return _timestamp;
    }

    public String getUserId() {
        return _userId;
    }

    public String getTenantId() {
        return _tenantId;
    }

    public String getEntityId() {
        return _entityId;
    }

    public String getResourceType() {
        return _resourceType;
    }

    public String getAction() {
        return _action;
    }

    public String getResourceId() {
        return _resourceId;
    }

    public Boolean getGranted() {
        return _granted;
    }

    public String getOutcome() {
        return _outcome;
    }

    public String getReason() {
        return _reason;
    }

    public Long getLatencyMs() {
        return _latencyMs;
    }

    public Boolean getCacheHit() {
        return _cacheHit;
    }

    public String getScope() {
        return _scope;
    }

    public String getSubjectId() {
        return _subjectId;
    }

    public Set<String> getAffectedUsers() {
        return _affectedUsers;
    }

    public Integer getEntriesInvalidated() {
        return _entriesInvalidated;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("eventType", _eventType)
                .add("timestamp", _timestamp)
                .add("userId", _userId)
                .add("tenantId", _tenantId)
                .add("entityId", _entityId)
                .add("resourceType", _resourceType)
                .add("action", _action)
                .add("resourceId", _resourceId)
                .add("outcome", _outcome)
                .add("reason", _reason)
                .add("latencyMs", _latencyMs)
                .add("cacheHit", _cacheHit)
                .add("scope", _scope)
                .add("subjectId", _subjectId)
                .add("entriesInvalidated", _entriesInvalidated)
                .toString();
    }
}
