package com.iksanov.querycache.cache.fast;

import com.iksanov.querycache.cache.metrics.CacheMetrics;
import com.iksanov.querycache.common.exception.CacheException;
import com.iksanov.querycache.common.util.TtlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Thread-safe in-memory store with per-key TTL.
 * <p>
 * Expiry is lazy: {@link #get(String)} treats an expired entry as absent and removes it.
 * A background sweep started by {@link #start()} removes expired entries that are never
 * read again, bounding memory independent of read traffic.
 */
public class InMemoryFastStore implements FastStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFastStore.class);
    private final ConcurrentMap<String, FastEntry> store = new ConcurrentHashMap<>();
    private final long sweepIntervalMillis;
    private final Clock clock;
    private final CacheMetrics metrics;
    private ScheduledExecutorService sweeper;
    private volatile boolean running = false;

    public InMemoryFastStore(long sweepIntervalMillis) {
        this(sweepIntervalMillis, Clock.systemUTC(), new CacheMetrics());
    }

    public InMemoryFastStore(long sweepIntervalMillis, Clock clock, CacheMetrics metrics) {
        if (sweepIntervalMillis <= 0) throw new CacheException("sweepIntervalMillis must be > 0");
        this.sweepIntervalMillis = sweepIntervalMillis;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        log.info("InMemoryFastStore initialized: sweepInterval={}ms", sweepIntervalMillis);
    }

    public synchronized void start() {
        if (running) {
            log.warn("InMemoryFastStore sweeper already running");
            return;
        }

        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("fast-store-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        sweeper.scheduleAtFixedRate(() -> {
            try {
                sweepExpired();
            } catch (Exception e) {
                log.error("Fast store sweep failed: {}", e.getMessage(), e);
            }
        }, sweepIntervalMillis, sweepIntervalMillis, TimeUnit.MILLISECONDS);

        running = true;
        log.info("InMemoryFastStore sweeper started");
    }

    @Override
    public Object get(String key) {
        Objects.requireNonNull(key, "key");
        FastEntry entry = store.get(key);
        if (entry == null) return null;

        if (entry.isExpired(clock.millis())) {
            store.remove(key, entry);
            metrics.updateFastSize(store.size());
            return null;
        }
        return entry.value;
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        TtlUtils.requirePositive(ttl);

        store.put(key, new FastEntry(value, expiryFor(ttl)));
        metrics.updateFastSize(store.size());
    }

    @Override
    public void delete(String key) {
        Objects.requireNonNull(key, "key");
        store.remove(key);
        metrics.updateFastSize(store.size());
    }

    @Override
    public void deleteWhere(Predicate<String> keyPredicate) {
        Objects.requireNonNull(keyPredicate, "keyPredicate");
        int removed = 0;
        for (String key : store.keySet()) {
            if (keyPredicate.test(key) && store.remove(key) != null) removed++;
        }
        metrics.updateFastSize(store.size());
        if (removed > 0) log.debug("Removed {} entries by predicate", removed);
    }

    @Override
    public void clear() {
        store.clear();
        metrics.updateFastSize(0);
        log.info("Fast store cleared");
    }

    @Override
    public int size() {
        return store.size();
    }

    /**
     * Removes every entry whose TTL has elapsed.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        long now = clock.millis();
        int cleaned = 0;
        Iterator<Map.Entry<String, FastEntry>> iterator = store.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, FastEntry> entry = iterator.next();
            FastEntry fastEntry = entry.getValue();
            if (fastEntry != null && fastEntry.isExpired(now)) {
                if (store.remove(entry.getKey(), fastEntry)) cleaned++;
            }
        }
        metrics.recordSweepEvictions(cleaned);
        metrics.updateFastSize(store.size());
        if (cleaned > 0) log.debug("Sweep removed {} expired entries", cleaned);
        return cleaned;
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void shutdown() {
        if (running) {
            running = false;
            sweeper.shutdown();
            try {
                if (!sweeper.awaitTermination(2, TimeUnit.SECONDS)) sweeper.shutdownNow();
            } catch (InterruptedException e) {
                sweeper.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        clear();
        log.info("Fast store shutdown");
    }

    private long expiryFor(Duration ttl) {
        long now = clock.millis();
        long ttlMillis = Math.max(1, ttl.toMillis());
        long expireAt = now + ttlMillis;
        return expireAt < now ? Long.MAX_VALUE : expireAt;
    }
}
