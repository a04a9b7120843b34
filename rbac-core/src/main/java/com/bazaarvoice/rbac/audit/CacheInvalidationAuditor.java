package com.bazaarvoice.rbac.audit;

import com.bazaarvoice.rbac.cache.CacheInvalidationEvent;
import com.bazaarvoice.rbac.cache.CacheInvalidationListener;

import java.time.Clock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Emits an audit event for every permission cache invalidation.
 */
public class CacheInvalidationAuditor implements CacheInvalidationListener {

    private final AuditEmitter _emitter;
    private final Clock _clock;

    public CacheInvalidationAuditor(AuditEmitter emitter, Clock clock) {
        _emitter = checkNotNull(emitter, "emitter");
        _clock = checkNotNull(clock, "clock");
    }

    @Override
    public void handleInvalidation(CacheInvalidationEvent event) {
        _emitter.emit(AuditEvent.cacheInvalidation(event, _clock.instant()));
    }
}
