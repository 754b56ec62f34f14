package io.modelcache.service;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.modelcache.admin.ModelAdmin;
import io.modelcache.budget.DeviceMemory;
import io.modelcache.budget.FixedDeviceMemory;
import io.modelcache.config.ModelsConfig;
import io.modelcache.config.ModelsConfigLoader;
import io.modelcache.config.ServiceConfig;
import io.modelcache.error.ConfigInvalidException;
import io.modelcache.loader.BackendRoutingLoader;
import io.modelcache.loader.ResourceLoader;
import io.modelcache.manager.ResourceManager;
import io.modelcache.manager.ResourceManagerBuilder;

import java.time.Clock;

public class ModelServiceModule extends AbstractModule {
    static final String BUNDLED_CONFIG = "models.yaml";

    private final ServiceConfig config;

    public ModelServiceModule(ServiceConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(ServiceConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton ModelsConfig modelsConfig() throws ConfigInvalidException {
        return config.modelsConfig() == null
                ? ModelsConfigLoader.loadResource(BUNDLED_CONFIG)
                : ModelsConfigLoader.load(config.modelsConfig());
    }

    @Provides @Singleton DeviceMemory deviceMemory() { return new FixedDeviceMemory(config.deviceBytes()); }

    // real backends register routes here; everything else is simulated
    @Provides @Singleton ResourceLoader<Object> loader(MetricRegistry registry) {
        return new BackendRoutingLoader<Object>()
                .defaultRoute(new SimulatedLoader(config.loaderDelayMillis()))
                .withMetrics(registry);
    }

    @Provides @Singleton ResourceManager<Object> resourceManager(ModelsConfig models, ResourceLoader<Object> loader,
                                                                 DeviceMemory device, Clock clock, MetricRegistry registry) {
        return new ResourceManagerBuilder<Object>()
                .specTable(models.specTable())
                .loader(loader)
                .device(device)
                .budget(models.inference().toGlobalBudget())
                .clock(clock)
                .metrics(registry)
                .build();
    }

    @Provides @Singleton ModelAdmin modelAdmin(ResourceManager<Object> manager, ModelsConfig models, Clock clock) {
        return new ModelAdmin(manager, models.inference(), clock);
    }
}
