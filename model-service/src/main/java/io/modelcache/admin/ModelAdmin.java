package io.modelcache.admin;

import io.modelcache.budget.BudgetReport;
import io.modelcache.budget.TaskRequirement;
import io.modelcache.config.InferenceSettings;
import io.modelcache.error.InvalidTaskException;
import io.modelcache.error.ResourceException;
import io.modelcache.grpc.ActionResponse;
import io.modelcache.grpc.BudgetValidation;
import io.modelcache.grpc.HealthStatus;
import io.modelcache.grpc.InferenceConfig;
import io.modelcache.grpc.LoadedModel;
import io.modelcache.grpc.ModelConfig;
import io.modelcache.grpc.ModelOption;
import io.modelcache.grpc.ModelRequirement;
import io.modelcache.grpc.ModelStatus;
import io.modelcache.grpc.SelectResponse;
import io.modelcache.grpc.TaskOptions;
import io.modelcache.manager.ManagerStatus;
import io.modelcache.manager.ResourceManager;
import io.modelcache.manager.ResourceStatus;
import io.modelcache.spec.ResourceSpec;
import io.modelcache.spec.SpecTable;
import io.modelcache.spec.TaskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Operator operations over a {@link ResourceManager}, answered as the admin proto messages so the gRPC and HTTP
 * front ends render the same data. Failures stay typed {@link ResourceException}s; the transports map them.
 */
public class ModelAdmin {
    private static final Logger log = LoggerFactory.getLogger(ModelAdmin.class);
    private static final double GIB = ResourceSpec.BYTES_PER_GIB;

    private final ResourceManager<?> manager;
    private final InferenceSettings inference;
    private final Clock clock;

    public ModelAdmin(ResourceManager<?> manager, InferenceSettings inference, Clock clock) {
        this.manager = manager;
        this.inference = inference;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public ModelConfig config() {
        SpecTable.Snapshot snapshot = manager.specTable().snapshot();
        ModelConfig.Builder b = ModelConfig.newBuilder().setRevision(snapshot.revision());
        for (TaskConfig task : snapshot.tasks().values()) {
            TaskOptions.Builder tb = TaskOptions.newBuilder().setSelected(task.selectedOption());
            for (Map.Entry<String, ResourceSpec> e : task.options().entrySet()) {
                tb.putOptions(e.getKey(), toOption(e.getValue()));
            }
            b.putModels(task.taskId(), tb.build());
        }
        b.setInference(InferenceConfig.newBuilder()
                .setMaxMemoryPerModel(inference.maxMemoryPerModel())
                .setOffloadThreshold(inference.offloadThreshold())
                .setWarmupOnStartup(inference.warmupOnStartup())
                .setDefaultBatchSize(inference.defaultBatchSize())
                .setMaxBatchSize(inference.maxBatchSize())
                .build());
        return b.build();
    }

    private static ModelOption toOption(ResourceSpec spec) {
        ModelOption.Builder o = ModelOption.newBuilder()
                .setModelId(spec.modelId())
                .setFramework(spec.backend())
                .setVramGb(spec.declaredGib())
                .setSpeed(spec.speedClass().label())
                .setDescription(spec.description());
        if (spec.quantization() != null) o.setQuantization(spec.quantization());
        if (spec.throughputHint() != null) o.setFps(spec.throughputHint());
        return o.build();
    }

    public ModelStatus status() {
        ManagerStatus s = manager.status();
        SpecTable.Snapshot snapshot = manager.specTable().snapshot();
        ModelStatus.Builder b = ModelStatus.newBuilder();
        for (ResourceStatus r : s.loaded()) {
            LoadedModel.Builder lm = LoadedModel.newBuilder()
                    .setTaskType(r.taskId())
                    .setModelId(r.modelId())
                    .setModelName(r.option())
                    .setFramework(r.backend())
                    .setVramAllocatedGb(r.actualBytes() / GIB)
                    .setActualBytes(r.actualBytes())
                    .setLoadedAt(r.loadedAt().toString());
            TaskConfig task = snapshot.tasks().get(r.taskId());
            ResourceSpec spec = task == null ? null : task.options().get(r.option());
            if (spec != null && spec.quantization() != null) lm.setQuantization(spec.quantization());
            b.addLoadedModels(lm.build());
        }
        return b.addAllLoadingTasks(s.loadingTasks())
                .setTotalVramAllocatedGb(s.usedBytes() / GIB)
                .setTotalVramAvailableGb(s.totalCapacityBytes() / GIB)
                .setCapacityBytes(s.totalCapacityBytes())
                .setUsedBytes(s.usedBytes())
                .setReservedBytes(s.reservedBytes())
                .setTimestamp(clock.instant().toString())
                .build();
    }

    public SelectResponse select(String taskId, String option) throws ResourceException, InterruptedException {
        String previous = manager.reselect(taskId, option);
        log.info("Operator selected {} for {}", option, taskId);
        return SelectResponse.newBuilder()
                .setStatus("success")
                .setTaskType(taskId)
                .setSelectedModel(option)
                .setPreviousModel(previous)
                .build();
    }

    public BudgetValidation validateBudget() {
        BudgetReport r = manager.validateBudget();
        BudgetValidation.Builder b = BudgetValidation.newBuilder()
                .setValid(r.valid())
                .setTotalVramGb(r.totalCapacityBytes() / GIB)
                .setTotalRequiredGb(r.totalRequiredBytes() / GIB)
                .setThreshold(r.threshold())
                .setMaxAllowedGb(r.maxAllowedBytes() / GIB)
                .setHeadroomGb(r.headroomBytes() / GIB);
        for (TaskRequirement req : r.requirements()) {
            b.putModelRequirements(req.taskId(), ModelRequirement.newBuilder()
                    .setModelName(req.option())
                    .setModelId(req.modelId())
                    .setVramGb(req.declaredBytes() / GIB)
                    .build());
        }
        return b.build();
    }

    public ActionResponse load(String taskId) throws ResourceException, InterruptedException {
        manager.load(taskId);
        return action(taskId, "Model loaded successfully");
    }

    public ActionResponse unload(String taskId) throws InvalidTaskException {
        boolean unloaded = manager.unload(taskId);
        return action(taskId, unloaded ? "Model unloaded successfully" : "Model was not loaded");
    }

    public HealthStatus health() {
        ManagerStatus s = manager.status();
        return HealthStatus.newBuilder()
                .setReady(manager.isOpen())
                .setTaskCount(manager.specTable().taskIds().size())
                .setLoadedCount(s.loaded().size())
                .build();
    }

    private static ActionResponse action(String taskId, String message) {
        return ActionResponse.newBuilder().setStatus("success").setTaskType(taskId).setMessage(message).build();
    }
}
