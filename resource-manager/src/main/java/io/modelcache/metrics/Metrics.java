package io.modelcache.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over a {@link MetricRegistry} holding the metric names the resource manager reports.
 */
public class Metrics {
    public static final String CACHE_HITS = "resources.cache.hits";
    public static final String CACHE_MISSES = "resources.cache.misses";
    public static final String EVICTIONS = "resources.evictions";
    public static final String LOAD_TIME = "resources.load.time";
    public static final String LOAD_FAILURES = "resources.load.failures";
    public static final String UNLOAD_FAILURES = "resources.unload.failures";
    public static final String BYTES_USED = "resources.bytes.used";
    public static final String BYTES_RESERVED = "resources.bytes.reserved";
    public static final String LOADED_COUNT = "resources.loaded.count";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /**
     * Registers the gauge unless one is already registered under that name. Managers sharing a registry
     * therefore report the gauges of whichever registered first; give each manager its own registry.
     */
    public <T> void gauge(String name, Gauge<T> gauge) { registry.gauge(name, () -> gauge); }
}
