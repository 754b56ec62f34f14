package io.modelcache.loader;

import io.modelcache.spec.ResourceSpec;

/**
 * Produces and frees resources for one model family. Calls are slow and may block for seconds.
 * Timeouts are the loader's business; it reports them by throwing.
 */
public interface ResourceLoader<H> {
    LoadResult<H> load(ResourceSpec spec) throws Exception;

    void unload(H handle) throws Exception;
}
