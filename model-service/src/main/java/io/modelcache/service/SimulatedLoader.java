package io.modelcache.service;

import io.modelcache.loader.LoadResult;
import io.modelcache.loader.ResourceLoader;
import io.modelcache.spec.ResourceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Loader for deployments without a real inference backend: waits a fixed delay and reports the declared size
 * as the measured one.
 */
public class SimulatedLoader implements ResourceLoader<Object> {
    private static final Logger log = LoggerFactory.getLogger(SimulatedLoader.class);

    private final long delayMillis;
    private final AtomicLong sequence = new AtomicLong();

    public SimulatedLoader(long delayMillis) {
        if (delayMillis < 0) throw new IllegalArgumentException("delayMillis must be >= 0: " + delayMillis);
        this.delayMillis = delayMillis;
    }

    @Override
    public LoadResult<Object> load(ResourceSpec spec) throws InterruptedException {
        if (delayMillis > 0) Thread.sleep(delayMillis);
        Handle handle = new Handle(spec.backend(), spec.modelId(), sequence.incrementAndGet());
        log.debug("Simulated load of {}", handle);
        return new LoadResult<>(handle, spec.declaredBytes());
    }

    @Override
    public void unload(Object handle) {
        if (!(handle instanceof Handle)) {
            throw new IllegalArgumentException("Not a simulated handle: " + handle);
        }
        log.debug("Simulated unload of {}", handle);
    }

    /** What a simulated load hands back. */
    public record Handle(String backend, String modelId, long sequence) {
        @Override
        public String toString() { return backend + ":" + modelId + "#" + sequence; }
    }
}
