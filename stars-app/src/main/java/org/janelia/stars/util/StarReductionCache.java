package org.janelia.stars.util;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;

import java.util.concurrent.ExecutionException;

import org.janelia.stars.StarReducer;
import org.janelia.stars.StarReductionParameters;
import org.janelia.stars.StarReductionResult;
import org.janelia.stars.image.SampleArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache of {@link StarReductionResult} instances so that repeated requests for the same sources and
 * parameters (e.g. while comparing settings) do not rerun the pipeline.
 * <p>
 * Sources are matched by identity (they are immutable values), parameters by their JSON form.
 * Once the cache holds the maximum number of entries, least recently used results are removed to make room.
 * Cache instances are thread safe.
 * <p>
 * Cached results are shared, so callers must not modify their images.
 */
public class StarReductionCache {

    public static final long DEFAULT_MAX_ENTRIES = 10;

    private final StarReducer reducer;
    private final long maximumNumberOfEntries;
    private final boolean recordStats;

    private final Cache<CacheKey, StarReductionResult> cache;

    public StarReductionCache(final StarReducer reducer) {
        this(reducer, DEFAULT_MAX_ENTRIES, false);
    }

    /**
     * @param  reducer                 reducer used when cache misses occur.
     * @param  maximumNumberOfEntries  maximum number of results to keep.
     * @param  recordStats             if true, hit and miss counts are maintained.
     */
    public StarReductionCache(final StarReducer reducer,
                              final long maximumNumberOfEntries,
                              final boolean recordStats) {

        this.reducer = reducer;
        this.maximumNumberOfEntries = maximumNumberOfEntries;
        this.recordStats = recordStats;

        if (recordStats) {
            this.cache = CacheBuilder.newBuilder()
                    .maximumSize(maximumNumberOfEntries)
                    .recordStats()
                    .build();
        } else {
            this.cache = CacheBuilder.newBuilder()
                    .maximumSize(maximumNumberOfEntries)
                    .build();
        }
    }

    /**
     * @return the cached result for the specified sources and parameters,
     *         reducing (and caching) it first if necessary.
     *
     * @throws IllegalArgumentException
     *   if the reduction fails (the reducer's exception is rethrown unchanged).
     */
    public StarReductionResult get(final SampleArray rawLuminanceSource,
                                   final SampleArray normalizedDisplaySource,
                                   final StarReductionParameters parameters)
            throws IllegalArgumentException {

        final CacheKey key = new CacheKey(rawLuminanceSource, normalizedDisplaySource, parameters.toJson());

        try {
            return cache.get(key, () -> {
                LOG.debug("get: cache miss for {}", key);
                return reducer.reduceStars(rawLuminanceSource, normalizedDisplaySource, parameters);
            });
        } catch (final UncheckedExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        } catch (final ExecutionError e) {
            throw (Error) e.getCause();
        } catch (final ExecutionException e) {
            throw new IllegalStateException("failed to reduce stars for " + key, e.getCause());
        }
    }

    /**
     * @return the number of entries currently in this cache.
     */
    public long size() {
        return cache.size();
    }

    /**
     * Discards all entries in the cache.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * @return a current snapshot of this cache's cumulative statistics
     *         (will be all zeros if stat recording is not enabled for this cache).
     */
    public CacheStats getStats() {
        return cache.stats();
    }

    @Override
    public String toString() {
        return "{numberOfEntries: " + size() +
               ", maximumNumberOfEntries: " + maximumNumberOfEntries +
               ", recordStats: " + recordStats +
               '}';
    }

    /**
     * Key that combines source identities with the serialized parameters.
     */
    private static class CacheKey {

        private final SampleArray rawSource;
        private final SampleArray displaySource;
        private final String parametersJson;

        CacheKey(final SampleArray rawSource,
                 final SampleArray displaySource,
                 final String parametersJson) {
            this.rawSource = rawSource;
            this.displaySource = displaySource;
            this.parametersJson = parametersJson;
        }

        @Override
        public String toString() {
            return "{rawSource: " + rawSource + ", displaySource: " + displaySource + '}';
        }

        @Override
        public boolean equals(final Object o) {
            boolean result = true;
            if (this != o) {
                if (o instanceof CacheKey) {
                    final CacheKey that = (CacheKey) o;
                    result = (this.rawSource == that.rawSource) &&
                             (this.displaySource == that.displaySource) &&
                             this.parametersJson.equals(that.parametersJson);
                } else {
                    result = false;
                }
            }
            return result;
        }

        @Override
        public int hashCode() {
            int result = System.identityHashCode(rawSource);
            result = 31 * result + System.identityHashCode(displaySource);
            result = 31 * result + parametersJson.hashCode();
            return result;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StarReductionCache.class);
}
