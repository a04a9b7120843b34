package com.bazaarvoice.rbac.audit;

import com.bazaarvoice.rbac.cache.PermissionCache;
import com.bazaarvoice.rbac.config.CacheConfiguration;
import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableSet;
import org.mockito.ArgumentCaptor;
import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.assertEquals;

public class CacheInvalidationAuditorTest {

    @Test
    public void testRoleInvalidationIsAudited() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        AuditEmitter emitter = mock(AuditEmitter.class);
        PermissionCache cache = new PermissionCache(new CacheConfiguration(), clock, new MetricRegistry());
        cache.addListener(new CacheInvalidationAuditor(emitter, clock));

        cache.invalidateForRole("editor");

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(emitter).emit(event.capture());
        assertEquals(event.getValue().getEventType(), AuditEvent.CACHE_INVALIDATION);
        assertEquals(event.getValue().getScope(), "ROLE");
        assertEquals(event.getValue().getSubjectId(), "editor");
        assertEquals(event.getValue().getAffectedUsers(), ImmutableSet.of());
        assertEquals(event.getValue().getTimestamp(), clock.instant());
        cache.close();
    }
}
