package com.example.litestream.timetravel;

import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A replica pinned to a point in time, registered under a temporary alias until closed.
 * Use with try-with-resources; closing releases the connection and the alias.
 */
public final class TimeTravelSession implements AutoCloseable {

    private final TimeTravel owner;
    private final String baseAlias;
    private final String alias;
    private final String timePoint;
    private final DataSource dataSource;
    private final AtomicBoolean closed = new AtomicBoolean();

    TimeTravelSession(TimeTravel owner, String baseAlias, String alias, String timePoint, DataSource dataSource) {
        this.owner = owner;
        this.baseAlias = baseAlias;
        this.alias = alias;
        this.timePoint = timePoint;
        this.dataSource = dataSource;
    }

    /**
     * Temporary alias the pinned connection is registered under.
     */
    public String alias() {
        return alias;
    }

    public String baseAlias() {
        return baseAlias;
    }

    public String timePoint() {
        return timePoint;
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public JdbcTemplate jdbcTemplate() {
        return new JdbcTemplate(dataSource);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            owner.release(alias);
        }
    }
}
