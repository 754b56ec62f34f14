package io.modelcache.service;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import io.modelcache.admin.AdminServer;
import io.modelcache.admin.ModelAdmin;
import io.modelcache.budget.BudgetReport;
import io.modelcache.config.ServiceConfig;
import io.modelcache.grpc.ModelAdminServer;
import io.modelcache.manager.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class ModelServiceMain {
    private static final Logger log = LoggerFactory.getLogger(ModelServiceMain.class);

    public static void main(String[] args) throws Exception {
        ServiceConfig cfg = ServiceConfig.fromEnv();
        Injector injector = Guice.createInjector(new ModelServiceModule(cfg));
        ResourceManager<Object> manager = injector.getInstance(Key.get(new TypeLiteral<ResourceManager<Object>>() {}));
        ModelAdmin admin = injector.getInstance(ModelAdmin.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        BudgetReport budget = manager.validateBudget();
        if (!budget.valid()) {
            log.warn("Selected models need {} bytes but only {} of {} are allowed (threshold {})",
                    budget.totalRequiredBytes(), budget.maxAllowedBytes(), budget.totalCapacityBytes(), budget.threshold());
        }
        List<String> failed = manager.warmup();
        if (!failed.isEmpty()) log.warn("Warmup failed for {}", failed);

        try (ModelAdminServer grpc = new ModelAdminServer(cfg.grpcPort(), admin);
             AdminServer http = new AdminServer(cfg.httpPort(), admin, registry)) {
            grpc.start();
            http.start();
            Runtime.getRuntime().addShutdownHook(new Thread(manager::shutdown, "resource-manager-shutdown"));
            Thread.currentThread().join();
        }
    }
}
