package io.modelcache.loader;

import com.codahale.metrics.MetricRegistry;
import io.modelcache.spec.ResourceSpec;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Dispatches loads to the loader registered for a spec's backend tag, and unloads back to whichever loader
 * produced the handle.
 */
public class BackendRoutingLoader<H> implements ResourceLoader<H> {
    private final Map<String, ResourceLoader<H>> routes = new HashMap<>();
    private final Map<H, ResourceLoader<H>> owners = new IdentityHashMap<>();
    private ResourceLoader<H> defaultRoute;
    private MetricRegistry metrics;

    public BackendRoutingLoader<H> route(String backend, ResourceLoader<H> loader) {
        routes.put(backend, loader); return this;
    }
    public BackendRoutingLoader<H> defaultRoute(ResourceLoader<H> loader) { this.defaultRoute = loader; return this; }
    public BackendRoutingLoader<H> withMetrics(MetricRegistry registry) { this.metrics = registry; return this; }

    @Override
    public LoadResult<H> load(ResourceSpec spec) throws Exception {
        ResourceLoader<H> loader = routes.getOrDefault(spec.backend(), defaultRoute);
        if (loader == null) {
            if (metrics != null) metrics.counter("loader.route." + spec.backend() + ".missing").inc();
            throw new IllegalArgumentException("No loader registered for backend " + spec.backend());
        }
        if (metrics != null) metrics.counter("loader.route." + spec.backend() + ".load").inc();
        LoadResult<H> result = loader.load(spec);
        synchronized (owners) {
            owners.put(result.handle(), loader);
        }
        return result;
    }

    @Override
    public void unload(H handle) throws Exception {
        ResourceLoader<H> loader;
        synchronized (owners) {
            loader = owners.remove(handle);
        }
        if (loader == null) throw new IllegalStateException("Handle was not produced by this loader: " + handle);
        loader.unload(handle);
    }
}
