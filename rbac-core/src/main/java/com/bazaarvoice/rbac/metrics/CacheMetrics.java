package com.bazaarvoice.rbac.metrics;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.google.common.cache.Cache;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;

/**
 * Registers gauges over a Guava {@link Cache}'s statistics with a {@link MetricRegistry}.  The cache must be built
 * with {@code recordStats()}.  Closing the returned object removes the gauges again.
 * <p>
 * Gauge names are per cache name, so a second cache instrumented under the same name on the same registry is
 * logged and left uninstrumented; closing it leaves the first cache's gauges in place.
 */
public class CacheMetrics implements Closeable {

    private static final Logger _log = LoggerFactory.getLogger(CacheMetrics.class);

    private final MetricRegistry _registry;
    private final List<String> _names = Lists.newArrayList();

    private CacheMetrics(MetricRegistry registry) {
        _registry = registry;
    }

    public static CacheMetrics instrument(Cache<?, ?> cache, MetricRegistry registry, String group, String cacheName) {
        CacheMetrics metrics = new CacheMetrics(registry);
        metrics.gauge(group, cacheName, "size", (Gauge<Long>) cache::size);
        metrics.gauge(group, cacheName, "requests", (Gauge<Long>) () -> cache.stats().requestCount());
        metrics.gauge(group, cacheName, "hits", (Gauge<Long>) () -> cache.stats().hitCount());
        metrics.gauge(group, cacheName, "hit-rate", (Gauge<Double>) () -> cache.stats().hitRate());
        metrics.gauge(group, cacheName, "misses", (Gauge<Long>) () -> cache.stats().missCount());
        metrics.gauge(group, cacheName, "evictions", (Gauge<Long>) () -> cache.stats().evictionCount());
        return metrics;
    }

    private synchronized void gauge(String group, String cacheName, String metric, Gauge<?> gauge) {
        String name = MetricRegistry.name(group, "cache", cacheName, metric);
        try {
            _registry.register(name, gauge);
            _names.add(name);
        } catch (IllegalArgumentException e) {
            // The first cache registered under this name keeps reporting; this one goes unmonitored
            _log.warn("Cache gauge {} is already registered, not instrumenting this cache", name);
        }
    }

    @Override
    public synchronized void close() {
        for (String name : _names) {
            _registry.remove(name);
        }
        _names.clear();
    }
}
