package io.modelcache.budget;

import io.modelcache.spec.ResourceSpec;
import io.modelcache.spec.SpecTable;
import io.modelcache.spec.TaskConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks whether every task's selected option fits in {@code capacity * threshold} at once.
 * A pure function of one spec table revision and the measured capacity; it never looks at what is loaded.
 */
public final class BudgetValidator {
    private BudgetValidator() {}

    public static BudgetReport validate(SpecTable.Snapshot snapshot, DeviceMemory device, double threshold) {
        long capacity = device.totalCapacityBytes();
        long total = 0;
        List<TaskRequirement> reqs = new ArrayList<>(snapshot.tasks().size());
        for (TaskConfig t : snapshot.tasks().values()) {
            ResourceSpec spec = t.selectedSpec();
            reqs.add(new TaskRequirement(t.taskId(), t.selectedOption(), spec.modelId(), spec.declaredBytes()));
            total += spec.declaredBytes();
        }
        long maxAllowed = (long) (capacity * threshold);
        return new BudgetReport(total <= maxAllowed, capacity, total, threshold, maxAllowed, reqs);
    }
}
