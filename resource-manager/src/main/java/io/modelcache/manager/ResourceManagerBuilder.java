package io.modelcache.manager;

import com.codahale.metrics.MetricRegistry;
import io.modelcache.budget.DeviceMemory;
import io.modelcache.budget.FixedDeviceMemory;
import io.modelcache.loader.ResourceLoader;
import io.modelcache.metrics.Metrics;
import io.modelcache.spec.GlobalBudget;
import io.modelcache.spec.SpecTable;

import java.time.Clock;
import java.util.Objects;

public class ResourceManagerBuilder<H> {
    private SpecTable specTable;
    private ResourceLoader<H> loader;
    private DeviceMemory device;
    private GlobalBudget budget = GlobalBudget.defaults();
    private Clock clock = Clock.systemUTC();
    private MetricRegistry metricRegistry = new MetricRegistry();

    public ResourceManagerBuilder<H> specTable(SpecTable t) { this.specTable = t; return this; }
    public ResourceManagerBuilder<H> loader(ResourceLoader<H> l) { this.loader = l; return this; }
    public ResourceManagerBuilder<H> device(DeviceMemory d) { this.device = d; return this; }
    public ResourceManagerBuilder<H> capacityBytes(long bytes) { this.device = new FixedDeviceMemory(bytes); return this; }
    public ResourceManagerBuilder<H> budget(GlobalBudget b) { this.budget = b; return this; }
    public ResourceManagerBuilder<H> clock(Clock c) { this.clock = c; return this; }
    public ResourceManagerBuilder<H> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public ResourceManager<H> build() {
        Objects.requireNonNull(specTable, "specTable");
        Objects.requireNonNull(loader, "loader");
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(budget, "budget");
        return new ResourceManager<>(specTable, loader, device, budget, clock, new Metrics(metricRegistry));
    }
}
