package io.modelcache.spec;

import io.modelcache.error.InvalidOptionException;
import io.modelcache.error.InvalidTaskException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maps task ids to their options and current selection.
 * <p>
 * Each revision is immutable. {@link #reselect} publishes a new revision atomically, so readers that take a
 * {@link #snapshot()} always see one consistent set of selections without any locking.
 */
public class SpecTable {
    private final AtomicReference<Snapshot> current;

    public SpecTable(Collection<TaskConfig> tasks) {
        Map<String, TaskConfig> byId = new LinkedHashMap<>();
        for (TaskConfig t : tasks) {
            if (byId.put(t.taskId(), t) != null) {
                throw new IllegalArgumentException("duplicate task id " + t.taskId());
            }
        }
        this.current = new AtomicReference<>(new Snapshot(0, Collections.unmodifiableMap(byId)));
    }

    public static SpecTable of(TaskConfig... tasks) {
        return new SpecTable(List.of(tasks));
    }

    public Snapshot snapshot() { return current.get(); }

    public long revision() { return current.get().revision(); }

    public Set<String> taskIds() { return current.get().tasks().keySet(); }

    public boolean contains(String taskId) { return taskId != null && current.get().tasks().containsKey(taskId); }

    public TaskConfig task(String taskId) throws InvalidTaskException {
        return current.get().task(taskId);
    }

    public ResourceSpec selectedSpec(String taskId) throws InvalidTaskException {
        return task(taskId).selectedSpec();
    }

    /**
     * Validates the task and option, then publishes a revision with the new selection.
     * Nothing changes when validation fails.
     *
     * @return the task as it was before the change
     */
    public TaskConfig reselect(String taskId, String option) throws InvalidTaskException, InvalidOptionException {
        while (true) {
            Snapshot before = current.get();
            TaskConfig old = before.task(taskId);
            TaskConfig updated = old.withSelection(option);
            if (updated == old) return old;
            Map<String, TaskConfig> next = new LinkedHashMap<>(before.tasks());
            next.put(taskId, updated);
            if (current.compareAndSet(before, new Snapshot(before.revision() + 1, Collections.unmodifiableMap(next)))) {
                return old;
            }
        }
    }

    /**
     * One revision of the table.
     */
    public record Snapshot(long revision, Map<String, TaskConfig> tasks) {
        public TaskConfig task(String taskId) throws InvalidTaskException {
            TaskConfig t = taskId == null ? null : tasks.get(taskId);
            if (t == null) throw new InvalidTaskException(taskId);
            return t;
        }
    }
}
