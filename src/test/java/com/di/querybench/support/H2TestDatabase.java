package com.di.querybench.support;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

/**
 * Private in-memory H2 database (PostgreSQL mode) with both schema variants created from
 * {@code schema-h2.sql}. One instance per test class; {@link #close()} drops it.
 */
public final class H2TestDatabase implements AutoCloseable {

    /** H2 has no {@code TEXT} type name that compares with {@code VARCHAR}; the queries cast ids to this instead. */
    public static final String ID_CAST_TYPE = "VARCHAR";

    private final HikariDataSource    dataSource;
    private final JdbcTemplate        jdbc;
    private final TransactionTemplate tx;

    public H2TestDatabase() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:qb_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE");
        config.setUsername("sa");
        config.setPassword("");
        config.setPoolName("h2-test-pool");
        config.setMaximumPoolSize(2);
        this.dataSource = new HikariDataSource(config);

        new ResourceDatabasePopulator(new ClassPathResource("schema-h2.sql")).execute(dataSource);

        this.jdbc = new JdbcTemplate(dataSource);
        this.tx   = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    public HikariDataSource dataSource() {
        return dataSource;
    }

    public JdbcTemplate jdbc() {
        return jdbc;
    }

    public TransactionTemplate tx() {
        return tx;
    }

    public long count(String table) {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return n == null ? 0L : n;
    }

    @Override
    public void close() {
        jdbc.execute("SHUTDOWN");
        dataSource.close();
    }
}
