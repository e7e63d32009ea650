package org.asymptote.pipeline;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.typesafe.config.Config;
import org.asymptote.compiler.api.AnalysisOptions;

import java.time.Duration;
import java.util.Optional;

/**
 * Cross-request memoization of analysis reports, keyed by the SHA-256 fingerprint of the
 * source text together with the options it was analyzed with. Entries are only evicted
 * by size or idle time, never invalidated.
 */
public class AnalysisCache {

    /**
     * Cache key: an immutable snapshot of the request input.
     */
    record Key(String fingerprint, AnalysisOptions options) {
    }

    private final Cache<Key, AnalysisReport> reports;

    public AnalysisCache(long maximumSize, Duration expireAfterAccess) {
        this.reports = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireAfterAccess)
                .recordStats()
                .build();
    }

    /**
     * Builds a cache from the {@code asymptote.cache} block:
     * <ul>
     *   <li>{@code maximum-size} - Maximum number of cached reports (default: 1000)</li>
     *   <li>{@code expire-after-access} - Idle time before an entry is evicted (default: 10m)</li>
     * </ul>
     */
    public static AnalysisCache fromConfig(Config options) {
        long maxSize = options.hasPath("maximum-size") ? options.getLong("maximum-size") : 1000;
        Duration expireAfterAccess = options.hasPath("expire-after-access")
                ? options.getDuration("expire-after-access")
                : Duration.ofMinutes(10);
        return new AnalysisCache(maxSize, expireAfterAccess);
    }

    Optional<AnalysisReport> get(Key key) {
        return Optional.ofNullable(reports.getIfPresent(key));
    }

    void put(Key key, AnalysisReport report) {
        reports.put(key, report);
    }

    public long size() {
        return reports.estimatedSize();
    }

    public CacheStats stats() {
        return reports.stats();
    }
}
