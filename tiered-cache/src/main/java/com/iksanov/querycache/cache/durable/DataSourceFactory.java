package com.iksanov.querycache.cache.durable;

import com.iksanov.querycache.cache.config.DurableStoreConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public class DataSourceFactory {
    public static HikariDataSource create(DurableStoreConfig config) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(config.jdbcUrl());
        cfg.setUsername(config.username());
        cfg.setPassword(config.password());
        cfg.setMaximumPoolSize(config.maxPoolSize());
        cfg.setConnectionTimeout(config.connectionTimeoutMillis());
        cfg.setPoolName("query-cache-ds");
        // start even when the database is down; the cache runs fast-tier only until it is back
        cfg.setInitializationFailTimeout(-1);
        cfg.addDataSourceProperty("cachePrepStmts", "true");
        return new HikariDataSource(cfg);
    }
}
