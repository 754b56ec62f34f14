package io.modelcache.loader;

/**
 * What a loader hands back: the opaque handle and the memory it measured after loading.
 */
public record LoadResult<H>(H handle, long actualBytes) {
    public LoadResult {
        if (actualBytes < 0) throw new IllegalArgumentException("actualBytes must be >= 0: " + actualBytes);
    }
}
