package com.iksanov.querycache.cache.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collector for the tiered cache using Micrometer.
 * Exposes per-tier hit/miss statistics to Prometheus.
 */
public class CacheMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter fastHits;
    private final Counter durableHits;
    private final Counter misses;
    private final Counter durableFailures;
    private final Counter computes;
    private final Counter invalidations;
    private final Counter sweepEvictions;
    private final Timer getLatency;
    private final Timer putLatency;
    private final AtomicLong fastSize = new AtomicLong(0);

    public CacheMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.fastHits = Counter.builder("cache.hits")
                .tag("tier", "fast")
                .description("Lookups answered by the in-process tier")
                .register(registry);

        this.durableHits = Counter.builder("cache.hits")
                .tag("tier", "durable")
                .description("Lookups answered by the durable tier and promoted")
                .register(registry);

        this.misses = Counter.builder("cache.misses")
                .description("Lookups absent from both tiers")
                .register(registry);

        this.durableFailures = Counter.builder("cache.durable.failures")
                .description("Durable tier operations that failed and were absorbed")
                .register(registry);

        this.computes = Counter.builder("cache.computes")
                .description("Read-through loader invocations")
                .register(registry);

        this.invalidations = Counter.builder("cache.invalidations")
                .description("Namespace and full invalidations")
                .register(registry);

        this.sweepEvictions = Counter.builder("cache.sweep.evictions")
                .description("Expired entries removed by the background sweep")
                .register(registry);

        this.getLatency = Timer.builder("cache.get.duration")
                .description("GET operation duration")
                .publishPercentileHistogram()
                .serviceLevelObjectives(
                    Duration.ofMillis(1),
                    Duration.ofMillis(5),
                    Duration.ofMillis(10),
                    Duration.ofMillis(50),
                    Duration.ofMillis(100)
                )
                .register(registry);

        this.putLatency = Timer.builder("cache.put.duration")
                .description("PUT operation duration")
                .publishPercentileHistogram()
                .serviceLevelObjectives(
                    Duration.ofMillis(1),
                    Duration.ofMillis(5),
                    Duration.ofMillis(10),
                    Duration.ofMillis(50),
                    Duration.ofMillis(100)
                )
                .register(registry);

        Gauge.builder("cache.fast.size", fastSize, AtomicLong::get)
                .description("Entries currently held by the in-process tier")
                .register(registry);

        Gauge.builder("cache.hit.rate", this, CacheMetrics::calculateHitRate)
                .description("Cache hit rate percentage across both tiers")
                .register(registry);
    }

    public void recordFastHit() {
        fastHits.increment();
    }

    public void recordDurableHit() {
        durableHits.increment();
    }

    public void recordMiss() {
        misses.increment();
    }

    public void recordDurableFailure() {
        durableFailures.increment();
    }

    public void recordCompute() {
        computes.increment();
    }

    public void recordInvalidation() {
        invalidations.increment();
    }

    public void recordSweepEvictions(int count) {
        if (count > 0) sweepEvictions.increment(count);
    }

    public void updateFastSize(int size) {
        fastSize.set(size);
    }

    public Timer.Sample startGetTimer() {
        return Timer.start(registry);
    }

    public void stopGetTimer(Timer.Sample sample) {
        sample.stop(getLatency);
    }

    public Timer.Sample startPutTimer() {
        return Timer.start(registry);
    }

    public void stopPutTimer(Timer.Sample sample) {
        sample.stop(putLatency);
    }

    public double fastHits() {
        return fastHits.count();
    }

    public double durableHits() {
        return durableHits.count();
    }

    public double misses() {
        return misses.count();
    }

    public double durableFailures() {
        return durableFailures.count();
    }

    public double computes() {
        return computes.count();
    }

    public double sweepEvictions() {
        return sweepEvictions.count();
    }

    private double calculateHitRate() {
        double hits = fastHits.count() + durableHits.count();
        double total = hits + misses.count();
        return total == 0 ? 0.0 : (hits / total) * 100.0;
    }

    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
