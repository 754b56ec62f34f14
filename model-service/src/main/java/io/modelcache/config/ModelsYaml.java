package io.modelcache.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Raw shape of {@code models.yaml}, bound by Jackson before validation.
 */
final class ModelsYaml {
    private ModelsYaml() {}

    record Document(Map<String, TaskYaml> models, InferenceYaml inference) {}

    record TaskYaml(String selected, Map<String, OptionYaml> options) {}

    record OptionYaml(
            @JsonProperty("model_id") String modelId,
            String framework,
            @JsonProperty("vram_gb") Double vramGb,
            String quantization,
            String speed,
            String description,
            Integer fps
    ) {}

    record InferenceYaml(
            @JsonProperty("max_memory_per_model") String maxMemoryPerModel,
            @JsonProperty("offload_threshold") Double offloadThreshold,
            @JsonProperty("warmup_on_startup") Boolean warmupOnStartup,
            @JsonProperty("default_batch_size") Integer defaultBatchSize,
            @JsonProperty("max_batch_size") Integer maxBatchSize
    ) {}
}
