package com.example.litestream.replica;

import com.example.litestream.config.DatabaseRegistry;
import com.example.litestream.config.DatabaseSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;

/**
 * Reads the transaction id and replication lag a VFS replica reports about itself.
 *
 * <p>The two pragmas are queried independently: when one fails, only its field becomes
 * unknown. Nothing is retried here.
 */
public class ReplicaStatusProber {

    private static final Logger log = LoggerFactory.getLogger(ReplicaStatusProber.class);

    static final String TXID_PRAGMA = "PRAGMA litestream_txid";
    static final String LAG_PRAGMA = "PRAGMA litestream_lag";

    private final DatabaseRegistry registry;
    private final Clock clock;

    public ReplicaStatusProber(DatabaseRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public ReplicaStatusProber(DatabaseRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Probe the replica registered under {@code alias}.
     *
     * @throws com.example.litestream.config.ReplicaConfigurationException if the alias is
     *         missing or not a VFS replica
     */
    public ReplicaStatus probe(String alias) {
        DatabaseSettings settings = registry.replicaSettings(alias);
        String sourceUrl = settings.replica().sourceUrl();

        String txid = null;
        Double lag = null;
        try (Connection conn = registry.dataSource(alias).getConnection()) {
            txid = queryTxid(conn, alias);
            lag = queryLag(conn, alias);
        } catch (SQLException e) {
            log.debug("Could not connect to replica {}: {}", alias, e.getMessage());
        }
        return new ReplicaStatus(alias, sourceUrl, txid, lag, clock.instant());
    }

    private static String queryTxid(Connection conn, String alias) {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(TXID_PRAGMA)) {
            return rs.next() ? rs.getString(1) : null;
        } catch (SQLException e) {
            log.debug("{} failed on {}: {}", TXID_PRAGMA, alias, e.getMessage());
            return null;
        }
    }

    private static Double queryLag(Connection conn, String alias) {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(LAG_PRAGMA)) {
            if (!rs.next()) {
                return null;
            }
            Object value = rs.getObject(1);
            if (value == null) {
                return null;
            }
            if (value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            return Double.parseDouble(value.toString().trim());
        } catch (SQLException | NumberFormatException e) {
            log.debug("{} failed on {}: {}", LAG_PRAGMA, alias, e.getMessage());
            return null;
        }
    }
}
