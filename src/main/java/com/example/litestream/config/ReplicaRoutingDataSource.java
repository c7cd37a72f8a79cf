package com.example.litestream.config;

import com.example.litestream.routing.DatabaseRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.lookup.AbstractRoutingDataSource;

import javax.sql.DataSource;
import java.util.Collections;

/**
 * Routing datasource that asks the {@link DatabaseRouter} for an alias on every connection
 * request and hands out a connection of that alias from the {@link DatabaseRegistry}.
 * Writes always go to the primary; reads go to a healthy replica, or the primary when none is.
 */
public class ReplicaRoutingDataSource extends AbstractRoutingDataSource {

    private static final Logger log = LoggerFactory.getLogger(ReplicaRoutingDataSource.class);

    private final DatabaseRouter router;
    private final DatabaseRegistry registry;

    public ReplicaRoutingDataSource(DatabaseRouter router, DatabaseRegistry registry) {
        this.router = router;
        this.registry = registry;
        // targets are resolved through the registry, which also knows temporary aliases
        setTargetDataSources(Collections.emptyMap());
        setLenientFallback(false);
    }

    @Override
    protected Object determineCurrentLookupKey() {
        DataSourceContext context = DataSourceContext.get();
        if (context != null && context.getAlias() != null) {
            return context.getAlias();
        }
        if (context != null && context.isReadOnly()) {
            return router.dbForRead();
        }
        return router.dbForWrite();
    }

    @Override
    protected DataSource determineTargetDataSource() {
        String alias = (String) determineCurrentLookupKey();
        log.debug("Routing connection to {}", alias);
        return registry.dataSource(alias);
    }
}
