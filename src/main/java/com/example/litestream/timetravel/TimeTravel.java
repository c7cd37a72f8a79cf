package com.example.litestream.timetravel;

import com.example.litestream.config.DatabaseRegistry;
import com.example.litestream.config.DatabaseSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Opens read-only views of a VFS replica as it was at an earlier point in time.
 *
 * <pre>
 * try (TimeTravelSession session = timeTravel.open("prod_replica", "1 hour ago")) {
 *     List&lt;String&gt; names = session.jdbcTemplate().queryForList("SELECT name FROM users", String.class);
 * }
 * </pre>
 *
 * The time point is passed to the extension verbatim: absolute timestamps such as
 * {@code 2024-12-20 15:00:00} and relative expressions such as {@code 5 minutes ago} both work.
 * Only one session per replica may be open at a time.
 */
public class TimeTravel {

    private static final Logger log = LoggerFactory.getLogger(TimeTravel.class);

    static final String ALIAS_PREFIX = "_litestream_timetravel_";

    private final DatabaseRegistry registry;

    public TimeTravel(DatabaseRegistry registry) {
        this.registry = registry;
    }

    public static String temporaryAlias(String baseAlias) {
        return ALIAS_PREFIX + baseAlias;
    }

    /**
     * Open a session on {@code alias} pinned to {@code timePoint}.
     *
     * @throws com.example.litestream.config.ReplicaConfigurationException if the alias is
     *         missing, not a VFS replica, or already has a session open
     * @throws TimeTravelException if the replica rejects the time point
     */
    public TimeTravelSession open(String alias, String timePoint) {
        DatabaseSettings base = registry.replicaSettings(alias);
        String tempAlias = temporaryAlias(alias);
        registry.register(base.timeTravelCopy(tempAlias));

        boolean opened = false;
        try {
            DataSource dataSource = registry.dataSource(tempAlias);
            setTimePoint(dataSource, tempAlias, timePoint);
            TimeTravelSession session = new TimeTravelSession(this, alias, tempAlias, timePoint, dataSource);
            opened = true;
            log.debug("Opened time-travel session {} at '{}'", tempAlias, timePoint);
            return session;
        } finally {
            if (!opened) {
                release(tempAlias);
            }
        }
    }

    /**
     * Run {@code callback} inside a session; the session is closed however the callback exits.
     */
    public <T> T execute(String alias, String timePoint, TimeTravelCallback<T> callback) {
        try (TimeTravelSession session = open(alias, timePoint)) {
            return callback.doInSession(session);
        }
    }

    private static void setTimePoint(DataSource dataSource, String tempAlias, String timePoint) {
        String pragma = "PRAGMA litestream_time='" + timePoint.replace("'", "''") + "'";
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(pragma);
        } catch (SQLException e) {
            throw new TimeTravelException("Failed to set time-travel to '" + timePoint + "' on " + tempAlias
                + ". Make sure the VFS extension supports time-travel and the time point is valid. Error: "
                + e.getMessage(), e);
        }
    }

    void release(String tempAlias) {
        try {
            registry.close(tempAlias);
        } finally {
            registry.unregister(tempAlias);
            log.debug("Closed time-travel session {}", tempAlias);
        }
    }
}
