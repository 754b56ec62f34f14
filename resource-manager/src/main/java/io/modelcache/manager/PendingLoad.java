package io.modelcache.manager;

import io.modelcache.spec.ResourceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Placeholder for a load in flight. Every caller for the task, including the one that started the load, waits
 * on {@link #result}; the load itself runs on the manager's pool.
 */
final class PendingLoad<H> {
    private static final Logger log = LoggerFactory.getLogger(PendingLoad.class);

    final String taskId;
    final String option;
    final ResourceSpec spec;
    final CompletableFuture<H> result = new CompletableFuture<>();

    PendingLoad(String taskId, String option, ResourceSpec spec) {
        this.taskId = taskId;
        this.option = option;
        this.spec = spec;
    }

    /** Blocks until the load has either committed or failed. */
    void awaitSettled() throws InterruptedException {
        try {
            result.get();
        } catch (ExecutionException e) {
            log.debug("In-flight load of {} settled with failure: {}", taskId, e.getCause().toString());
        }
    }
}
