package com.example.litestream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Alias to connection settings, plus the lazily created {@link DataSource} of each alias.
 * Aliases keep their registration order. Datasources are only created on first use, so a
 * replica costs nothing until something reads from it.
 */
public class DatabaseRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatabaseRegistry.class);

    private final Map<String, DatabaseSettings> settings = new LinkedHashMap<>();
    private final Map<String, DataSource> dataSources = new ConcurrentHashMap<>();
    private final DataSourceFactory dataSourceFactory;

    public DatabaseRegistry(DataSourceFactory dataSourceFactory) {
        this.dataSourceFactory = dataSourceFactory;
    }

    /**
     * Register settings under their alias.
     *
     * @throws ReplicaConfigurationException if the alias is already registered
     */
    public void register(DatabaseSettings databaseSettings) {
        synchronized (settings) {
            if (settings.putIfAbsent(databaseSettings.alias(), databaseSettings) != null) {
                throw new ReplicaConfigurationException(ReplicaConfigurationException.Reason.ALIAS_IN_USE,
                    "Database alias '" + databaseSettings.alias() + "' is already registered");
            }
        }
        log.debug("Registered {}", databaseSettings);
    }

    /**
     * Remove an alias and close its datasource, if one was created. A datasource still being
     * created for the alias is closed once its creation completes.
     */
    public void unregister(String alias) {
        synchronized (settings) {
            settings.remove(alias);
        }
        close(alias);
        log.debug("Unregistered database alias {}", alias);
    }

    public boolean contains(String alias) {
        synchronized (settings) {
            return settings.containsKey(alias);
        }
    }

    public Optional<DatabaseSettings> find(String alias) {
        synchronized (settings) {
            return Optional.ofNullable(settings.get(alias));
        }
    }

    /**
     * @throws ReplicaConfigurationException if the alias is not registered
     */
    public DatabaseSettings settings(String alias) {
        return find(alias).orElseThrow(() -> ReplicaConfigurationException.notFound(alias));
    }

    /**
     * @throws ReplicaConfigurationException if the alias is missing or not a VFS replica
     */
    public DatabaseSettings replicaSettings(String alias) {
        DatabaseSettings found = settings(alias);
        if (!found.isReplica()) {
            throw ReplicaConfigurationException.notReplica(alias);
        }
        return found;
    }

    public List<String> aliases() {
        synchronized (settings) {
            return new ArrayList<>(settings.keySet());
        }
    }

    /**
     * Aliases of all configured VFS replicas, in registration order.
     */
    public List<String> replicaAliases() {
        List<String> replicas = new ArrayList<>();
        synchronized (settings) {
            for (DatabaseSettings candidate : settings.values()) {
                if (candidate.isReplica()) {
                    replicas.add(candidate.alias());
                }
            }
        }
        return replicas;
    }

    /**
     * The datasource of an alias, created on first request.
     *
     * @throws ReplicaConfigurationException if the alias is not registered
     */
    public DataSource dataSource(String alias) {
        // settings are read inside the mapping so an alias unregistered meanwhile is never created
        return dataSources.computeIfAbsent(alias, key -> dataSourceFactory.create(settings(key)));
    }

    /**
     * Whether a datasource has been created for the alias and not closed since.
     */
    public boolean isOpen(String alias) {
        return dataSources.containsKey(alias);
    }

    /**
     * Close the datasource of an alias, keeping its registration.
     */
    public void close(String alias) {
        DataSource dataSource = dataSources.remove(alias);
        if (dataSource != null) {
            dataSourceFactory.close(dataSource);
        }
    }

    @Override
    public void close() {
        for (String alias : new ArrayList<>(dataSources.keySet())) {
            close(alias);
        }
    }
}
