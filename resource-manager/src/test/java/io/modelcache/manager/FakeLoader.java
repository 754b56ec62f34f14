package io.modelcache.manager;

import io.modelcache.loader.LoadResult;
import io.modelcache.loader.ResourceLoader;
import io.modelcache.spec.ResourceSpec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loader that records every call. Handles are {@code modelId#n}.
 */
class FakeLoader implements ResourceLoader<String> {
    final AtomicInteger loads = new AtomicInteger();
    final AtomicInteger unloads = new AtomicInteger();
    final List<String> events = Collections.synchronizedList(new ArrayList<>());
    final Set<String> failLoad = ConcurrentHashMap.newKeySet();
    final Set<String> failUnload = ConcurrentHashMap.newKeySet();
    final Map<String, Long> actualBytes = new ConcurrentHashMap<>();
    volatile CountDownLatch gate;
    final CountDownLatch started = new CountDownLatch(1);
    volatile long delayMillis;

    @Override
    public LoadResult<String> load(ResourceSpec spec) throws Exception {
        int n = loads.incrementAndGet();
        events.add("load:" + spec.modelId());
        started.countDown();
        CountDownLatch g = gate;
        if (g != null && !g.await(10, TimeUnit.SECONDS)) throw new IllegalStateException("gate never opened");
        if (delayMillis > 0) Thread.sleep(delayMillis);
        if (failLoad.contains(spec.modelId())) throw new IOException("cannot load " + spec.modelId());
        long bytes = actualBytes.getOrDefault(spec.modelId(), spec.declaredBytes());
        return new LoadResult<>(spec.modelId() + "#" + n, bytes);
    }

    @Override
    public void unload(String handle) throws Exception {
        unloads.incrementAndGet();
        String modelId = handle.substring(0, handle.indexOf('#'));
        events.add("unload:" + modelId);
        if (failUnload.contains(modelId)) throw new IOException("device refused to free " + handle);
    }

    List<String> unloadedModels() {
        List<String> out = new ArrayList<>();
        synchronized (events) {
            for (String e : events) if (e.startsWith("unload:")) out.add(e.substring("unload:".length()));
        }
        return out;
    }
}
