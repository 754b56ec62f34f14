package io.modelcache.admin;

import com.codahale.metrics.MetricRegistry;
import io.modelcache.config.InferenceSettings;
import io.modelcache.loader.BackendRoutingLoader;
import io.modelcache.manager.ResourceManager;
import io.modelcache.manager.ResourceManagerBuilder;
import io.modelcache.service.SimulatedLoader;
import io.modelcache.spec.ResourceSpec;
import io.modelcache.spec.SpecTable;
import io.modelcache.spec.SpeedClass;
import io.modelcache.spec.TaskConfig;

import java.net.ServerSocket;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A small deployment: 16 GiB device, detection (4 or 8 GiB), summarization (6 GiB) and a 32 GiB task that never fits.
 */
public final class AdminFixtures {
    public static final long GIB = ResourceSpec.BYTES_PER_GIB;
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    private AdminFixtures() {}

    public static SpecTable specTable() {
        Map<String, ResourceSpec> detection = new LinkedHashMap<>();
        detection.put("small", new ResourceSpec("yolo-n", "pytorch", 4 * GIB, SpeedClass.FAST, "nano", 120, null));
        detection.put("large", new ResourceSpec("yolo-x", "pytorch", 8 * GIB, SpeedClass.SLOW, "extra large", 20, "4bit"));
        return SpecTable.of(
                new TaskConfig("detection", "small", detection),
                new TaskConfig("summarization", "base", Map.of("base", new ResourceSpec("llm-base", "vllm", 6 * GIB))),
                new TaskConfig("giant", "huge", Map.of("huge", new ResourceSpec("llm-huge", "vllm", 32 * GIB))));
    }

    public static ResourceManager<Object> manager(MetricRegistry registry) {
        return new ResourceManagerBuilder<Object>()
                .specTable(specTable())
                .loader(new BackendRoutingLoader<Object>().defaultRoute(new SimulatedLoader(0)).withMetrics(registry))
                .capacityBytes(16 * GIB)
                .clock(CLOCK)
                .metrics(registry)
                .build();
    }

    public static ModelAdmin admin(ResourceManager<Object> manager) {
        return new ModelAdmin(manager, InferenceSettings.defaults(), CLOCK);
    }

    public static int freePort() throws Exception {
        try (ServerSocket s = new ServerSocket(0)) { return s.getLocalPort(); }
    }
}
