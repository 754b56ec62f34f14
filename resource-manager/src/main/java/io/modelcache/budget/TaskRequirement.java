package io.modelcache.budget;

/**
 * Declared requirement of one task's selected option.
 */
public record TaskRequirement(String taskId, String option, String modelId, long declaredBytes) {
}
