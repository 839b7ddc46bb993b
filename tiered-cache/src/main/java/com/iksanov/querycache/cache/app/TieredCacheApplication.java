package com.iksanov.querycache.cache.app;

import com.iksanov.querycache.cache.config.CacheConfig;
import com.iksanov.querycache.cache.config.DurableStoreConfig;
import com.iksanov.querycache.cache.core.CacheCoordinator;
import com.iksanov.querycache.cache.durable.DataSourceFactory;
import com.iksanov.querycache.cache.durable.DurableReaper;
import com.iksanov.querycache.cache.durable.DurableStore;
import com.iksanov.querycache.cache.durable.NoopDurableStore;
import com.iksanov.querycache.cache.durable.PostgresDurableStore;
import com.iksanov.querycache.cache.fast.InMemoryFastStore;
import com.iksanov.querycache.cache.metrics.CacheMetrics;
import com.iksanov.querycache.common.codec.JsonValueCodec;
import com.iksanov.querycache.common.exception.PersistenceUnavailableException;
import com.iksanov.querycache.common.key.KeyDeriver;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Owns the cache lifecycle for one process: builds both tiers and the coordinator,
 * runs the fast-tier sweep and the durable reaper, and tears everything down on shutdown.
 * <p>
 * One instance per process is the expected deployment; nothing here is static.
 */
public class TieredCacheApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TieredCacheApplication.class);
    private final CacheConfig config;
    private final Clock clock;
    private CacheMetrics metrics;
    private InMemoryFastStore fastStore;
    private HikariDataSource dataSource;
    private DurableStore durableStore;
    private DurableReaper reaper;
    private CacheCoordinator coordinator;
    private volatile boolean running = false;

    public TieredCacheApplication(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    public TieredCacheApplication(CacheConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public synchronized CacheCoordinator start() {
        if (running) {
            log.warn("Tiered cache already started");
            return coordinator;
        }

        log.info("========================================");
        log.info("Starting tiered cache: {}", config);
        log.info("========================================");

        try {
            metrics = new CacheMetrics();

            fastStore = new InMemoryFastStore(config.sweepInterval().toMillis(), clock, metrics);
            fastStore.start();
            log.info("[OK] Fast tier started");

            durableStore = initDurable(config.durable());

            JsonValueCodec codec = new JsonValueCodec();
            coordinator = new CacheCoordinator(new KeyDeriver(), fastStore, durableStore, codec, clock, config.defaultTtl(), metrics);
            running = true;
            log.info("[SUCCESS] Tiered cache ready (durable={})", config.durable().enabled());
            return coordinator;
        } catch (RuntimeException e) {
            log.error("Tiered cache startup failed", e);
            shutdown();
            throw e;
        }
    }

    public CacheCoordinator coordinator() {
        if (!running) throw new IllegalStateException("Tiered cache is not running");
        return coordinator;
    }

    public CacheMetrics metrics() {
        return metrics;
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void shutdown() {
        log.info("Shutting down tiered cache...");
        running = false;
        try {
            if (reaper != null) {
                reaper.stop();
                reaper = null;
            }
            if (fastStore != null) {
                fastStore.shutdown();
                fastStore = null;
            }
            if (dataSource != null) {
                dataSource.close();
                dataSource = null;
                log.info("Durable tier connection pool closed");
            }
            durableStore = null;
        } catch (Exception e) {
            log.error("Error during shutdown", e);
        }
        log.info("Tiered cache stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    private DurableStore initDurable(DurableStoreConfig durableConfig) {
        if (!durableConfig.enabled()) {
            log.info("[OK] Durable tier disabled, running fast tier only");
            return new NoopDurableStore();
        }

        dataSource = DataSourceFactory.create(durableConfig);
        PostgresDurableStore store = new PostgresDurableStore(dataSource, durableConfig.tableName(), new JsonValueCodec(), clock);
        try {
            store.initSchema();
        } catch (PersistenceUnavailableException e) {
            log.warn("Durable tier unavailable at startup, continuing with fast tier: {}", e.getMessage());
        }

        reaper = new DurableReaper(store, durableConfig.reaperIntervalMillis());
        reaper.start();
        log.info("[OK] Durable tier ready (table={})", durableConfig.tableName());
        return store;
    }
}
