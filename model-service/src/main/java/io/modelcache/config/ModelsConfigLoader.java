package io.modelcache.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.modelcache.error.ConfigInvalidException;
import io.modelcache.spec.ResourceSpec;
import io.modelcache.spec.SpecTable;
import io.modelcache.spec.SpeedClass;
import io.modelcache.spec.TaskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code models.yaml} into a validated {@link ModelsConfig}. Every structural problem is reported as a
 * {@link ConfigInvalidException} naming the offending task or option.
 */
public final class ModelsConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ModelsConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ModelsConfigLoader() {}

    public static ModelsConfig load(Path path) throws ConfigInvalidException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigInvalidException("Model config not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            ModelsConfig cfg = load(in);
            log.info("Loaded {} tasks from {}", cfg.specTable().taskIds().size(), path);
            return cfg;
        } catch (IOException e) {
            throw new ConfigInvalidException("Cannot read model config " + path + ": " + e.getMessage(), e);
        }
    }

    /** Loads {@code models.yaml} bundled on the classpath under the given resource name. */
    public static ModelsConfig loadResource(String resource) throws ConfigInvalidException {
        try (InputStream in = ModelsConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new ConfigInvalidException("Model config resource not found: " + resource);
            return load(in);
        } catch (IOException e) {
            throw new ConfigInvalidException("Cannot read model config resource " + resource, e);
        }
    }

    public static ModelsConfig load(InputStream in) throws ConfigInvalidException {
        ModelsYaml.Document doc;
        try {
            doc = YAML_MAPPER.readValue(in, ModelsYaml.Document.class);
        } catch (JsonProcessingException e) {
            throw new ConfigInvalidException("Malformed model config: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigInvalidException("Cannot read model config: " + e.getMessage(), e);
        }
        if (doc == null) throw new ConfigInvalidException("Model config is empty");
        return toConfig(doc);
    }

    static ModelsConfig toConfig(ModelsYaml.Document doc) throws ConfigInvalidException {
        if (doc.models() == null || doc.models().isEmpty()) {
            throw new ConfigInvalidException("Model config defines no 'models'");
        }
        List<TaskConfig> tasks = new ArrayList<>(doc.models().size());
        for (Map.Entry<String, ModelsYaml.TaskYaml> e : doc.models().entrySet()) {
            tasks.add(toTask(e.getKey(), e.getValue()));
        }
        return new ModelsConfig(new SpecTable(tasks), toInference(doc.inference()));
    }

    private static TaskConfig toTask(String taskId, ModelsYaml.TaskYaml task) throws ConfigInvalidException {
        if (task == null || task.options() == null || task.options().isEmpty()) {
            throw new ConfigInvalidException("Task " + taskId + " has no options");
        }
        if (task.selected() == null || task.selected().isBlank()) {
            throw new ConfigInvalidException("Task " + taskId + " has no 'selected' option");
        }
        if (!task.options().containsKey(task.selected())) {
            throw new ConfigInvalidException("Task " + taskId + " selects " + task.selected()
                    + " which is not one of " + task.options().keySet());
        }
        Map<String, ResourceSpec> options = new LinkedHashMap<>();
        for (Map.Entry<String, ModelsYaml.OptionYaml> e : task.options().entrySet()) {
            options.put(e.getKey(), toSpec(taskId, e.getKey(), e.getValue()));
        }
        return new TaskConfig(taskId, task.selected(), options);
    }

    private static ResourceSpec toSpec(String taskId, String option, ModelsYaml.OptionYaml o) throws ConfigInvalidException {
        String where = taskId + "." + option;
        if (o == null) throw new ConfigInvalidException("Option " + where + " is empty");
        if (o.modelId() == null || o.modelId().isBlank()) throw new ConfigInvalidException("Option " + where + " has no model_id");
        if (o.framework() == null || o.framework().isBlank()) throw new ConfigInvalidException("Option " + where + " has no framework");
        double gb = o.vramGb() == null ? 0.0 : o.vramGb();
        if (!Double.isFinite(gb) || gb < 0) throw new ConfigInvalidException("Option " + where + " has invalid vram_gb " + gb);
        SpeedClass speed;
        try {
            speed = SpeedClass.parse(o.speed());
        } catch (IllegalArgumentException e) {
            throw new ConfigInvalidException("Option " + where + " has unknown speed " + o.speed(), e);
        }
        return new ResourceSpec(o.modelId(), o.framework(), ResourceSpec.gibToBytes(gb), speed,
                o.description(), o.fps(), o.quantization());
    }

    private static InferenceSettings toInference(ModelsYaml.InferenceYaml in) throws ConfigInvalidException {
        InferenceSettings d = InferenceSettings.defaults();
        if (in == null) return d;
        double threshold = in.offloadThreshold() == null ? d.offloadThreshold() : in.offloadThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new ConfigInvalidException("offload_threshold must be within [0,1]: " + threshold);
        }
        int defaultBatch = in.defaultBatchSize() == null ? d.defaultBatchSize() : in.defaultBatchSize();
        int maxBatch = in.maxBatchSize() == null ? d.maxBatchSize() : in.maxBatchSize();
        if (defaultBatch < 1 || maxBatch < 1) {
            throw new ConfigInvalidException("Batch sizes must be >= 1 (default=" + defaultBatch + ", max=" + maxBatch + ")");
        }
        if (defaultBatch > maxBatch) {
            throw new ConfigInvalidException("default_batch_size " + defaultBatch + " exceeds max_batch_size " + maxBatch);
        }
        return new InferenceSettings(
                in.maxMemoryPerModel() == null ? d.maxMemoryPerModel() : in.maxMemoryPerModel(),
                threshold,
                in.warmupOnStartup() == null ? d.warmupOnStartup() : in.warmupOnStartup(),
                defaultBatch,
                maxBatch);
    }
}
