package com.iksanov.querycache.cache.durable;

import com.iksanov.querycache.common.exception.PersistenceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically purges expired rows from the durable tier.
 * Read-time reaping keeps lookups correct on its own; this only bounds table growth.
 */
public class DurableReaper {

    private static final Logger log = LoggerFactory.getLogger(DurableReaper.class);
    private final DurableStore durableStore;
    private final long intervalMillis;
    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public DurableReaper(DurableStore durableStore, long intervalMillis) {
        this.durableStore = Objects.requireNonNull(durableStore, "durableStore cannot be null");
        if (intervalMillis <= 0) throw new IllegalArgumentException("intervalMillis must be > 0");
        this.intervalMillis = intervalMillis;
    }

    public synchronized void start() {
        if (running) {
            log.warn("DurableReaper already running");
            return;
        }

        scheduler = Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("durable-reaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::reapOnce, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

        running = true;
        log.info("DurableReaper started (interval={}ms)", intervalMillis);
    }

    public synchronized void stop() {
        if (!running) return;

        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) scheduler.shutdownNow();
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("DurableReaper stopped");
    }

    public boolean isRunning() {
        return running;
    }

    int reapOnce() {
        try {
            int removed = durableStore.deleteExpired();
            if (removed > 0) log.debug("Reaped {} expired durable entries", removed);
            return removed;
        } catch (PersistenceUnavailableException e) {
            log.warn("Durable reaper skipped run, store unavailable: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Durable reaper failed: {}", e.getMessage(), e);
        }
        return 0;
    }
}
