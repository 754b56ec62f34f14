package io.modelcache.budget;

import java.util.List;

/**
 * Outcome of comparing the selected options' declared sizes against the allowed share of device memory.
 */
public record BudgetReport(
        boolean valid,
        long totalCapacityBytes,
        long totalRequiredBytes,
        double threshold,
        long maxAllowedBytes,
        List<TaskRequirement> requirements
) {
    public BudgetReport {
        requirements = List.copyOf(requirements);
    }

    public long headroomBytes() { return maxAllowedBytes - totalRequiredBytes; }
}
