package com.bazaarvoice.rbac.audit;

import com.bazaarvoice.rbac.api.Action;
import com.bazaarvoice.rbac.api.CheckRequest;
import com.bazaarvoice.rbac.api.Decision;
import com.bazaarvoice.rbac.api.DecisionReason;
import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.Lists;
import org.testng.annotations.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class AsyncAuditEmitterTest {

    @Test
    public void testDropsWhenQueueIsFull() throws Exception {
        AuditSink sink = mock(AuditSink.class);
        MetricRegistry metricRegistry = new MetricRegistry();
        AsyncAuditEmitter emitter = new AsyncAuditEmitter(sink, 2, metricRegistry);

        // Not started, so nothing drains the queue
        for (int i = 0; i < 5; i++) {
            emitter.emit(event("user" + i));
        }

        assertEquals(emitter.getPendingCount(), 2);
        assertEquals(emitter.getDroppedCount(), 3);
        assertEquals(metricRegistry.meter("bv.rbac.AsyncAuditEmitter.dropped").getCount(), 3);
        verify(sink, never()).write(any(AuditEvent.class));
    }

    @Test
    public void testDeliversEvents() throws Exception {
        List<AuditEvent> written = Lists.newCopyOnWriteArrayList();
        CountDownLatch delivered = new CountDownLatch(3);
        AuditSink sink = event -> {
            written.add(event);
            delivered.countDown();
        };
        AsyncAuditEmitter emitter = new AsyncAuditEmitter(sink, 16, new MetricRegistry());
        emitter.start();
        try {
            emitter.emit(event("alice"));
            emitter.emit(event("bob"));
            emitter.emit(event("carol"));
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        } finally {
            emitter.stop();
        }
        assertEquals(written.get(0).getUserId(), "alice");
        assertEquals(written.get(2).getUserId(), "carol");
    }

    @Test
    public void testStopFlushesPendingEvents() throws Exception {
        AuditSink sink = mock(AuditSink.class);
        AsyncAuditEmitter emitter = new AsyncAuditEmitter(sink, 16, new MetricRegistry());
        emitter.emit(event("alice"));
        emitter.emit(event("bob"));

        emitter.start();
        emitter.stop();

        verify(sink, times(2)).write(any(AuditEvent.class));
        assertEquals(emitter.getPendingCount(), 0);
    }

    @Test
    public void testSinkFailureIsCountedNotPropagated() throws Exception {
        AuditSink sink = mock(AuditSink.class);
        CountDownLatch attempted = new CountDownLatch(2);
        doAnswer(invocation -> {
            attempted.countDown();
            throw new IOException("disk full");
        }).when(sink).write(any(AuditEvent.class));
        AsyncAuditEmitter emitter = new AsyncAuditEmitter(sink, 16, new MetricRegistry());
        emitter.start();
        try {
            emitter.emit(event("alice"));
            emitter.emit(event("bob"));
            assertTrue(attempted.await(5, TimeUnit.SECONDS));
        } finally {
            emitter.stop();
        }
        assertEquals(emitter.getFailedCount(), 2);
    }

    @Test
    public void testNullEventIgnored() {
        AsyncAuditEmitter emitter = new AsyncAuditEmitter(mock(AuditSink.class), 1, new MetricRegistry());
        emitter.emit(null);
        assertEquals(emitter.getPendingCount(), 0);
        assertEquals(emitter.getDroppedCount(), 0);
    }

    private static AuditEvent event(String userId) {
        CheckRequest request = CheckRequest.builder()
                .user(userId)
                .tenant("acme")
                .action(Action.VIEW)
                .resourceType("projects")
                .resourceId("p1")
                .build();
        return AuditEvent.permissionCheck(request, Decision.granted(DecisionReason.DIRECT_GRANT).withTiming(2, false),
                Instant.parse("2024-03-01T12:00:00Z"));
    }
}
