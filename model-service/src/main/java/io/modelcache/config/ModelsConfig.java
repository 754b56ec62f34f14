package io.modelcache.config;

import io.modelcache.spec.SpecTable;

public record ModelsConfig(SpecTable specTable, InferenceSettings inference) {
}
