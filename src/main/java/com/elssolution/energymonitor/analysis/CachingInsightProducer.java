package com.elssolution.energymonitor.analysis;

import com.elssolution.energymonitor.domain.AnalysisReport;
import com.elssolution.energymonitor.domain.AnalysisScope;
import com.elssolution.energymonitor.domain.Insight;
import com.elssolution.energymonitor.domain.TimeRange;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Serves a report unchanged for its (scope, period) until the TTL runs out, then asks the
 * delegate again. Empty reports are not kept, so data arriving later is picked up at once.
 */
@Slf4j
public class CachingInsightProducer implements InsightProducer {

    private record Key(AnalysisScope scope, TimeRange period) {}

    private final InsightProducer delegate;
    private final Cache<Key, AnalysisReport> cache;
    private final Duration ttl;
    private final Clock clock;

    public CachingInsightProducer(InsightProducer delegate, Duration ttl, long maxEntries, Clock clock) {
        this.delegate = delegate;
        this.ttl = ttl;
        this.clock = clock;
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(ttl.toMillis(), TimeUnit.MILLISECONDS)
                .maximumSize(maxEntries)
                .ticker(clockTicker(clock))
                .recordStats()
                .build();
        log.info("analysis_cache_ready ttl={} maxEntries={}", ttl, maxEntries);
    }

    @Override
    public AnalysisReport analyze(AnalysisScope scope, TimeRange period) {
        Key key = new Key(scope, period);
        AnalysisReport cached = cache.getIfPresent(key);
        if (cached != null) {
            if (clock.instant().isBefore(validUntil(cached))) {
                log.debug("analysis_cache_hit scope={} from={} to={}", scope.label(), period.from(), period.to());
                return cached;
            }
            // entries are written one analysis run after generation
            cache.invalidate(key);
            log.debug("analysis_cache_stale scope={} generatedAt={}", scope.label(), cached.getGeneratedAt());
        }
        AnalysisReport fresh = delegate.analyze(scope, period);
        if (!fresh.getInsights().isEmpty() || !fresh.getDevices().isEmpty()) {
            cache.put(key, fresh);
        }
        return fresh;
    }

    /** Earliest validity end among the report's insights; {@code generatedAt + ttl} when it has none. */
    private Instant validUntil(AnalysisReport r) {
        Instant until = r.getGeneratedAt().plus(ttl);
        for (Insight i : r.getInsights()) {
            if (i.getValidUntil() != null && i.getValidUntil().isBefore(until)) until = i.getValidUntil();
        }
        return until;
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("analysis_cache_cleared");
    }

    public CacheStats stats() {
        return cache.stats();
    }

    /** Expiry follows the injected clock so a test clock can age entries. */
    private static Ticker clockTicker(Clock clock) {
        return new Ticker() {
            @Override
            public long read() {
                return TimeUnit.MILLISECONDS.toNanos(clock.millis());
            }
        };
    }
}
