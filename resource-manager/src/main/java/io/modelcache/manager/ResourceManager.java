package io.modelcache.manager;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import io.modelcache.budget.BudgetReport;
import io.modelcache.budget.BudgetValidator;
import io.modelcache.budget.DeviceMemory;
import io.modelcache.cache.LoadedResource;
import io.modelcache.cache.LruIndex;
import io.modelcache.error.InvalidOptionException;
import io.modelcache.error.InvalidTaskException;
import io.modelcache.error.LoadFailureException;
import io.modelcache.error.ResourceException;
import io.modelcache.error.ResourceExhaustedException;
import io.modelcache.error.UnloadFailureException;
import io.modelcache.loader.LoadResult;
import io.modelcache.loader.ResourceLoader;
import io.modelcache.metrics.Metrics;
import io.modelcache.spec.GlobalBudget;
import io.modelcache.spec.ResourceSpec;
import io.modelcache.spec.SpecTable;
import io.modelcache.spec.TaskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cache of device-resident resources with LRU eviction under a hard memory ceiling.
 * <p>
 * One lock guards the recency index, the in-flight loads, the byte totals and spec table reselection.
 * Loader calls always run with the lock released, on a pool owned by the manager: the first caller reserves a
 * placeholder and the declared bytes under the lock, evicts what must go and hands the load to the pool, which
 * re-acquires the lock to commit. Every caller, the first included, waits on the placeholder, so a task is never
 * loaded twice at once and a caller that gives up never stops a load already started.
 * <p>
 * Admission uses the selected option's declared bytes; accounting of resident resources uses the bytes the
 * loader measured.
 */
public class ResourceManager<H> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private final SpecTable specTable;
    private final ResourceLoader<H> loader;
    private final DeviceMemory device;
    private final GlobalBudget budget;
    private final Clock clock;

    private final ExecutorService loadPool;
    private final ReentrantLock lock = new ReentrantLock();
    private final LruIndex<String, LoadedResource<H>> cache = new LruIndex<>();
    private final Map<String, PendingLoad<H>> inFlight = new HashMap<>();
    private long usedBytes;
    private long reservedBytes;
    private boolean closed;

    private final Counter hits;
    private final Counter misses;
    private final Counter evictions;
    private final Counter loadFailures;
    private final Counter unloadFailures;
    private final Timer loadTimer;

    public ResourceManager(SpecTable specTable,
                           ResourceLoader<H> loader,
                           DeviceMemory device,
                           GlobalBudget budget,
                           Clock clock,
                           Metrics metrics) {
        this.specTable = Objects.requireNonNull(specTable);
        this.loader = Objects.requireNonNull(loader);
        this.device = Objects.requireNonNull(device);
        this.budget = Objects.requireNonNull(budget);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        AtomicInteger threads = new AtomicInteger();
        this.loadPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "resource-loader-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        Objects.requireNonNull(metrics);
        this.hits = metrics.counter(Metrics.CACHE_HITS);
        this.misses = metrics.counter(Metrics.CACHE_MISSES);
        this.evictions = metrics.counter(Metrics.EVICTIONS);
        this.loadFailures = metrics.counter(Metrics.LOAD_FAILURES);
        this.unloadFailures = metrics.counter(Metrics.UNLOAD_FAILURES);
        this.loadTimer = metrics.timer(Metrics.LOAD_TIME);
        metrics.gauge(Metrics.BYTES_USED, () -> withLock(() -> usedBytes));
        metrics.gauge(Metrics.BYTES_RESERVED, () -> withLock(() -> reservedBytes));
        metrics.gauge(Metrics.LOADED_COUNT, () -> withLock(cache::size));
    }

    public SpecTable specTable() { return specTable; }
    public DeviceMemory device() { return device; }

    /**
     * Returns the handle for the task's selected resource, loading it if it is not resident.
     * A resident resource becomes the most recently used one.
     */
    public H get(String taskId) throws ResourceException, InterruptedException {
        return obtain(taskId);
    }

    /**
     * Loads the task's selected resource, used for warmup and by operators. If it is already resident the
     * cached handle is returned and touched; a load never runs twice for the same task.
     */
    public H load(String taskId) throws ResourceException, InterruptedException {
        return obtain(taskId);
    }

    /**
     * Evicts least recently used resources until {@code requiredBytes} more fit.
     *
     * @return the evicted task ids, oldest first
     */
    public List<String> ensureCapacity(long requiredBytes) throws ResourceExhaustedException {
        List<LoadedResource<H>> evicted = new ArrayList<>();
        lock.lock();
        try {
            ensureCapacityLocked("(capacity request)", requiredBytes, evicted);
        } finally {
            lock.unlock();
            unloadAll(evicted, "evicted");
        }
        List<String> ids = new ArrayList<>(evicted.size());
        for (LoadedResource<H> r : evicted) ids.add(r.taskId());
        return ids;
    }

    /**
     * Removes the least recently used resource and frees it.
     *
     * @return the evicted task, or empty when nothing is resident
     */
    public Optional<String> evictLru() {
        LoadedResource<H> victim;
        lock.lock();
        try {
            victim = cache.removeEldest();
            if (victim == null) {
                log.warn("No resources to evict");
                return Optional.empty();
            }
            usedBytes -= victim.actualBytes();
            evictions.inc();
        } finally {
            lock.unlock();
        }
        log.info("Evicting LRU resource {}", victim.taskId());
        unloadQuietly(victim, "evicted");
        return Optional.of(victim.taskId());
    }

    /**
     * Unloads the task's resource if it is resident.
     *
     * @return whether anything was unloaded
     */
    public boolean unload(String taskId) throws InvalidTaskException {
        LoadedResource<H> removed;
        lock.lock();
        try {
            specTable.task(taskId);
            removed = cache.remove(taskId);
            if (removed == null) {
                log.warn("Resource {} not loaded", taskId);
                return false;
            }
            usedBytes -= removed.actualBytes();
        } finally {
            lock.unlock();
        }
        unloadQuietly(removed, "unloaded");
        return true;
    }

    /**
     * Changes the task's selected option. A resident resource is unloaded and the new option loaded in its
     * place; if that load fails the task is left with nothing resident. Validation happens before any change.
     *
     * @return the option that was selected before the change
     */
    public String reselect(String taskId, String option) throws ResourceException, InterruptedException {
        LoadedResource<H> previous;
        String before;
        while (true) {
            PendingLoad<H> pending;
            lock.lock();
            try {
                ensureOpen();
                TaskConfig task = specTable.task(taskId);
                if (!task.options().containsKey(option)) throw new InvalidOptionException(taskId, option);
                if (task.selectedOption().equals(option)) {
                    log.info("Task {} already selects {}", taskId, option);
                    return option;
                }
                pending = inFlight.get(taskId);
                if (pending == null) {
                    before = specTable.reselect(taskId, option).selectedOption();
                    previous = cache.remove(taskId);
                    if (previous != null) usedBytes -= previous.actualBytes();
                    log.info("Changed {} selection from {} to {}", taskId, before, option);
                    break;
                }
            } finally {
                lock.unlock();
            }
            // a load of the old selection is in flight; let it land before switching
            pending.awaitSettled();
        }
        if (previous != null) {
            unloadQuietly(previous, "reselected");
            obtain(taskId);
        }
        return before;
    }

    /** Compares the selected options against the allowed share of device memory. Never touches the cache. */
    public BudgetReport validateBudget() {
        return BudgetValidator.validate(specTable.snapshot(), device, budget.offloadThreshold());
    }

    /**
     * Loads every task when warmup is enabled. A task that fails is logged and skipped.
     *
     * @return the tasks that failed to load
     */
    public List<String> warmup() throws InterruptedException {
        if (!budget.warmupEnabled()) {
            log.info("Warmup disabled, skipping resource loading");
            return List.of();
        }
        log.info("Warming up {} tasks", specTable.taskIds().size());
        List<String> failed = new ArrayList<>();
        for (String taskId : specTable.taskIds()) {
            try {
                load(taskId);
            } catch (ResourceException e) {
                log.error("Failed to warm up {}: {}", taskId, e.getMessage(), e);
                failed.add(taskId);
            }
        }
        return failed;
    }

    /**
     * Unloads every resident resource, each exactly once, and refuses further loads.
     * Loads still in flight run to completion and are freed as soon as they commit.
     */
    public void shutdown() {
        List<LoadedResource<H>> drained;
        lock.lock();
        try {
            closed = true;
            drained = cache.drain();
            usedBytes = 0;
        } finally {
            lock.unlock();
        }
        loadPool.shutdown();
        log.info("Shutting down resource manager, unloading {} resources", drained.size());
        unloadAll(drained, "shutdown");
    }

    @Override
    public void close() { shutdown(); }

    public ManagerStatus status() {
        lock.lock();
        try {
            List<ResourceStatus> loaded = new ArrayList<>(cache.size());
            for (LoadedResource<H> r : cache.valuesLruFirst()) {
                loaded.add(new ResourceStatus(r.taskId(), r.optionName(), r.spec().modelId(), r.spec().backend(),
                        r.actualBytes(), r.loadedAt()));
            }
            return new ManagerStatus(loaded, new ArrayList<>(inFlight.keySet()), device.totalCapacityBytes(),
                    usedBytes, reservedBytes);
        } finally {
            lock.unlock();
        }
    }

    /** False once {@link #shutdown()} has been called. */
    public boolean isOpen() {
        return withLock(() -> !closed);
    }

    public boolean isLoaded(String taskId) {
        return withLock(() -> cache.containsKey(taskId));
    }

    private H obtain(String taskId) throws ResourceException, InterruptedException {
        PendingLoad<H> pending;
        ResourceExhaustedException exhausted = null;
        List<LoadedResource<H>> evicted = new ArrayList<>();
        lock.lock();
        try {
            ensureOpen();
            TaskConfig task = specTable.task(taskId);
            LoadedResource<H> hit = cache.touch(taskId);
            if (hit != null) {
                hits.inc();
                log.debug("Cache hit for {}", taskId);
                return hit.handle();
            }
            misses.inc();
            pending = inFlight.get(taskId);
            if (pending == null) {
                ResourceSpec spec = task.selectedSpec();
                try {
                    ensureCapacityLocked(taskId, spec.declaredBytes(), evicted);
                    pending = new PendingLoad<>(taskId, task.selectedOption(), spec);
                    inFlight.put(taskId, pending);
                    reservedBytes += spec.declaredBytes();
                    PendingLoad<H> started = pending;
                    List<LoadedResource<H>> toFree = List.copyOf(evicted);
                    evicted.clear();
                    // submitted under the lock so shutdown cannot close the pool in between
                    loadPool.execute(() -> runLoad(started, toFree));
                } catch (ResourceExhaustedException e) {
                    exhausted = e;
                }
            }
        } finally {
            lock.unlock();
        }
        unloadAll(evicted, "evicted");
        if (exhausted != null) throw exhausted;
        return await(pending);
    }

    // frees the evicted handles first so the device has room before the loader runs
    private void runLoad(PendingLoad<H> pending, List<LoadedResource<H>> evicted) {
        unloadAll(evicted, "evicted");
        String taskId = pending.taskId;
        log.info("Loading {} for {}: {} ({} declared bytes)", pending.spec.backend(), taskId,
                pending.spec.modelId(), pending.spec.declaredBytes());
        LoadResult<H> result;
        try (Timer.Context ignored = loadTimer.time()) {
            result = Objects.requireNonNull(loader.load(pending.spec), "loader returned no result");
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            abandon(pending, new LoadFailureException(taskId, e));
            return;
        } catch (Error e) {
            abandon(pending, new LoadFailureException(taskId, e));
            throw e;
        }

        boolean discard;
        lock.lock();
        try {
            inFlight.remove(taskId, pending);
            reservedBytes -= pending.spec.declaredBytes();
            discard = closed;
            if (!discard) {
                cache.putMostRecent(taskId, new LoadedResource<>(taskId, pending.option, pending.spec,
                        result.handle(), result.actualBytes(), clock.instant()));
                usedBytes += result.actualBytes();
            }
        } finally {
            lock.unlock();
        }
        if (discard) {
            unloadQuietly(new LoadedResource<>(taskId, pending.option, pending.spec, result.handle(),
                    result.actualBytes(), clock.instant()), "shutdown");
            pending.result.completeExceptionally(
                    new IllegalStateException("Resource manager shut down while loading " + taskId));
            return;
        }
        log.info("Resource {} loaded (actual bytes: {})", taskId, result.actualBytes());
        pending.result.complete(result.handle());
    }

    private void abandon(PendingLoad<H> pending, LoadFailureException failure) {
        lock.lock();
        try {
            inFlight.remove(pending.taskId, pending);
            reservedBytes -= pending.spec.declaredBytes();
        } finally {
            lock.unlock();
        }
        loadFailures.inc();
        log.warn("Load of {} failed: {}", pending.taskId, failure.getCause().toString());
        pending.result.completeExceptionally(failure);
    }

    private H await(PendingLoad<H> pending) throws ResourceException, InterruptedException {
        log.debug("Waiting for in-flight load of {}", pending.taskId);
        try {
            return pending.result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ResourceException re) throw re;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new LoadFailureException(pending.taskId, cause);
        }
    }

    // caller holds the lock
    private void ensureCapacityLocked(String taskId, long requiredBytes, List<LoadedResource<H>> evicted)
            throws ResourceExhaustedException {
        long capacity = device.totalCapacityBytes();
        if (reservedBytes + requiredBytes > capacity) {
            // would not fit even with everything evicted; keep the cache as it is
            throw new ResourceExhaustedException(taskId, requiredBytes, Math.max(0, capacity - usedBytes - reservedBytes));
        }
        while (usedBytes + reservedBytes + requiredBytes > capacity) {
            LoadedResource<H> victim = cache.removeEldest();
            if (victim == null) {
                throw new ResourceExhaustedException(taskId, requiredBytes, Math.max(0, capacity - usedBytes - reservedBytes));
            }
            usedBytes -= victim.actualBytes();
            evictions.inc();
            evicted.add(victim);
            log.info("Insufficient memory for {} (used={}, reserved={}, required={}, capacity={}), evicting LRU resource {}",
                    taskId, usedBytes + victim.actualBytes(), reservedBytes, requiredBytes, capacity, victim.taskId());
        }
    }

    private void unloadAll(List<LoadedResource<H>> resources, String reason) {
        for (LoadedResource<H> r : resources) unloadQuietly(r, reason);
    }

    private void unloadQuietly(LoadedResource<H> resource, String reason) {
        try {
            loader.unload(resource.handle());
            log.info("Resource {} unloaded ({}), freed {} bytes", resource.taskId(), reason, resource.actualBytes());
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            unloadFailures.inc();
            UnloadFailureException failure = new UnloadFailureException(resource.taskId(), e);
            log.warn("{} ({}); bookkeeping removed regardless", failure.getMessage(), reason, failure);
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Resource manager is shut down");
    }

    private <T> T withLock(java.util.function.Supplier<T> read) {
        lock.lock();
        try {
            return read.get();
        } finally {
            lock.unlock();
        }
    }
}
