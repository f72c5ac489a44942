package com.di.querybench.util;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;

/**
 * Logs HikariCP connection pool statistics around loads and benchmark sessions, so a
 * latency outlier can be told apart from a starved pool.
 */
@Slf4j
public final class ConnectionPoolLogger {

    /** Separator line to segregate pool logs from the rest of the log output. */
    public static final String CONNECTION_LOG_SEPARATOR =
            "================================================================================";

    private ConnectionPoolLogger() {}

    /**
     * Logs pool statistics if the DataSource is a HikariCP pool.
     *
     * @param dataSource the DataSource (stats only for {@code com.zaxxer.hikari.HikariDataSource})
     * @param phase      when this is being logged (e.g. "before benchmark")
     */
    public static void logPoolStats(DataSource dataSource, String phase) {
        if (dataSource == null) {
            return;
        }
        if (!(dataSource instanceof com.zaxxer.hikari.HikariDataSource hikari)) {
            log.debug("Pool stats not available (not HikariCP): phase={}", phase);
            return;
        }
        if (hikari.getHikariPoolMXBean() == null) {
            log.debug("Pool not started yet: phase={}", phase);
            return;
        }
        int active  = hikari.getHikariPoolMXBean().getActiveConnections();
        int idle    = hikari.getHikariPoolMXBean().getIdleConnections();
        int total   = hikari.getHikariPoolMXBean().getTotalConnections();
        int waiting = hikari.getHikariPoolMXBean().getThreadsAwaitingConnection();
        log.info("[POOL] {} | pool={} | maxSize={}, minIdle={} | active={}, idle={}, total={}, waiting={}",
                phase, hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle(),
                active, idle, total, waiting);
    }

    /** Logs the start of a pool section (separator + title). */
    public static void logSectionStart(String title) {
        log.info(CONNECTION_LOG_SEPARATOR);
        log.info("[POOL] DATASOURCE / CONNECTION POOL  |  {}", title != null ? title : "");
        log.info(CONNECTION_LOG_SEPARATOR);
    }
}
