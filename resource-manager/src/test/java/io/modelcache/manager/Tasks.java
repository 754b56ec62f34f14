package io.modelcache.manager;

import io.modelcache.spec.ResourceSpec;
import io.modelcache.spec.SpeedClass;
import io.modelcache.spec.TaskConfig;

import java.util.LinkedHashMap;
import java.util.Map;

final class Tasks {
    static final long GIB = ResourceSpec.BYTES_PER_GIB;

    private Tasks() {}

    /** A task with a single option named {@code default} whose model id equals the task id. */
    static TaskConfig single(String taskId, long declaredBytes) {
        return new TaskConfig(taskId, "default", Map.of("default", spec(taskId, declaredBytes)));
    }

    /** A task with options {@code small} and {@code large}, model ids {@code <task>-small} and {@code <task>-large}. */
    static TaskConfig twoOptions(String taskId, long smallBytes, long largeBytes) {
        Map<String, ResourceSpec> options = new LinkedHashMap<>();
        options.put("small", spec(taskId + "-small", smallBytes));
        options.put("large", spec(taskId + "-large", largeBytes));
        return new TaskConfig(taskId, "small", options);
    }

    static ResourceSpec spec(String modelId, long declaredBytes) {
        return new ResourceSpec(modelId, "pytorch", declaredBytes, SpeedClass.MEDIUM, "", null, null);
    }
}
