package com.bazaarvoice.rbac.audit;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.dropwizard.lifecycle.Managed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Non-blocking {@link AuditEmitter}.  Events go onto a bounded in-memory queue which a single background thread
 * drains into an {@link AuditSink}.
 * <p>
 * This implementation does not guarantee 100% audit retention: when the queue is full new events are dropped and
 * counted, and sink failures are logged and counted without being retried.  Neither ever reaches the caller.
 */
public class AsyncAuditEmitter implements AuditEmitter, Managed {

    private static final Logger _log = LoggerFactory.getLogger(AsyncAuditEmitter.class);

    private static final long POLL_MILLIS = 100;

    private final AuditSink _sink;
    private final BlockingQueue<AuditEvent> _queue;
    private final Meter _emitted;
    private final Meter _dropped;
    private final Meter _failed;
    private volatile boolean _running;
    private ExecutorService _drainService;

    public AsyncAuditEmitter(AuditSink sink, int queueCapacity, MetricRegistry metricRegistry) {
        _sink = checkNotNull(sink, "sink");
        checkArgument(queueCapacity > 0, "Queue capacity must be positive");
        _queue = new ArrayBlockingQueue<>(queueCapacity);
        _emitted = metricRegistry.meter(MetricRegistry.name("bv.rbac", "AsyncAuditEmitter", "emitted"));
        _dropped = metricRegistry.meter(MetricRegistry.name("bv.rbac", "AsyncAuditEmitter", "dropped"));
        _failed = metricRegistry.meter(MetricRegistry.name("bv.rbac", "AsyncAuditEmitter", "failed"));
    }

    @Override
    public void emit(AuditEvent event) {
        if (event == null) {
            return;
        }
        if (_queue.offer(event)) {
            _emitted.mark();
        } else {
            _dropped.mark();
            // Avoid flooding the log while the queue stays full
            if (_dropped.getCount() % 1000 == 1) {
                _log.warn("Audit queue is full, dropped {} events so far", _dropped.getCount());
            }
        }
    }

    @Override
    public synchronized void start() {
        if (_running) {
            return;
        }
        _running = true;
        _drainService = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("permission-audit-%d").setDaemon(true).build());
        _drainService.submit(this::drain);
    }

    @Override
    public synchronized void stop() throws Exception {
        if (!_running) {
            return;
        }
        _running = false;
        _drainService.shutdown();
        if (!_drainService.awaitTermination(5, TimeUnit.SECONDS)) {
            _log.warn("Audit service did not shutdown cleanly.");
            _drainService.shutdownNow();
        }
        // Flush whatever the drain thread left behind
        AuditEvent event;
        while ((event = _queue.poll()) != null) {
            write(event);
        }
    }

    /** Number of events waiting to be written. */
    public int getPendingCount() {
        return _queue.size();
    }

    public long getDroppedCount() {
        return _dropped.getCount();
    }

    public long getFailedCount() {
        return _failed.getCount();
    }

    private void drain() {
        while (_running) {
            try {
                AuditEvent event = _queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    write(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void write(AuditEvent event) {
        try {
            _sink.write(event);
        } catch (Exception e) {
            _failed.mark();
            _log.error("Failed to write audit event: {}", event, e);
        }
    }
}
