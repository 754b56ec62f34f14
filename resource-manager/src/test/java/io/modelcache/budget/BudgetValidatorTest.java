package io.modelcache.budget;

import io.modelcache.spec.ResourceSpec;
import io.modelcache.spec.SpecTable;
import io.modelcache.spec.TaskConfig;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BudgetValidatorTest {
    private static final long GIB = ResourceSpec.BYTES_PER_GIB;

    private static TaskConfig task(String id, long bytes) {
        return new TaskConfig(id, "default", Map.of("default", new ResourceSpec(id + "-model", "pytorch", bytes)));
    }

    @Test
    void selections_above_threshold_are_invalid() {
        SpecTable table = SpecTable.of(task("vision", 10 * GIB), task("speech", 5 * GIB));
        BudgetReport report = BudgetValidator.validate(table.snapshot(), new FixedDeviceMemory(16 * GIB), 0.85);

        assertFalse(report.valid());
        assertEquals(15 * GIB, report.totalRequiredBytes());
        assertEquals(16 * GIB, report.totalCapacityBytes());
        assertEquals((long) (16 * GIB * 0.85), report.maxAllowedBytes());
        assertTrue(report.headroomBytes() < 0);
        assertEquals(List.of("vision", "speech"), report.requirements().stream().map(TaskRequirement::taskId).toList());
    }

    @Test
    void selections_at_or_below_threshold_are_valid() {
        SpecTable table = SpecTable.of(task("vision", 8 * GIB), task("speech", 4 * GIB));
        BudgetReport report = BudgetValidator.validate(table.snapshot(), new FixedDeviceMemory(16 * GIB), 0.85);

        assertTrue(report.valid());
        assertEquals(12 * GIB, report.totalRequiredBytes());

        BudgetReport exact = BudgetValidator.validate(table.snapshot(), new FixedDeviceMemory(12 * GIB), 1.0);
        assertTrue(exact.valid());
        assertEquals(0, exact.headroomBytes());
    }

    @Test
    void reflects_current_selection_after_reselect() throws Exception {
        Map<String, ResourceSpec> options = new LinkedHashMap<>();
        options.put("small", new ResourceSpec("llm-7b", "vllm", 6 * GIB));
        options.put("large", new ResourceSpec("llm-70b", "vllm", 40 * GIB));
        SpecTable table = SpecTable.of(new TaskConfig("chat", "small", options));
        DeviceMemory device = new FixedDeviceMemory(24 * GIB);

        assertTrue(BudgetValidator.validate(table.snapshot(), device, 0.85).valid());
        table.reselect("chat", "large");
        BudgetReport report = BudgetValidator.validate(table.snapshot(), device, 0.85);
        assertFalse(report.valid());
        assertEquals("large", report.requirements().get(0).option());
        assertEquals("llm-70b", report.requirements().get(0).modelId());
    }

    @Test
    void zero_threshold_admits_only_empty_requirements() {
        SpecTable table = SpecTable.of(task("vision", 1));
        assertFalse(BudgetValidator.validate(table.snapshot(), new FixedDeviceMemory(16 * GIB), 0.0).valid());
        assertTrue(BudgetValidator.validate(SpecTable.of(task("noop", 0)).snapshot(), new FixedDeviceMemory(GIB), 0.0).valid());
    }
}
