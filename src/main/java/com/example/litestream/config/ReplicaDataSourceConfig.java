package com.example.litestream.config;

import com.example.litestream.replica.ReplicaHealthEvaluator;
import com.example.litestream.replica.ReplicaStatusProber;
import com.example.litestream.routing.DatabaseRouterChain;
import com.example.litestream.routing.LitestreamRouter;
import com.example.litestream.timetravel.TimeTravel;
import com.example.litestream.vfs.ExtensionBootstrap;
import com.example.litestream.vfs.ExtensionPlatform;
import com.example.litestream.vfs.HttpExtensionInstaller;
import com.example.litestream.vfs.SqliteExtensionRegistrar;
import com.example.litestream.vfs.VfsExtensionLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.List;

/**
 * Wires the primary database, the configured VFS replicas and the routing datasource that
 * splits reads and writes between them.
 */
@Configuration
public class ReplicaDataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(ReplicaDataSourceConfig.class);

    @Bean
    public VfsExtensionLoader vfsExtensionLoader(LitestreamProperties properties) {
        String configuredPath = properties.getVfs().getExtensionPath();
        Path extensionPath = configuredPath == null || configuredPath.isBlank()
            ? ExtensionPlatform.defaultExtensionPath(System.getProperty("os.name", ""))
            : Path.of(configuredPath);
        return new VfsExtensionLoader(extensionPath,
            new HttpExtensionInstaller(properties.getVfs().getDownloadUrl()),
            new SqliteExtensionRegistrar());
    }

    @Bean
    public DataSourceFactory dataSourceFactory(LitestreamProperties properties, VfsExtensionLoader loader) {
        return new DataSourceFactory(properties.getPool(), loader);
    }

    /**
     * Registry holding the primary under its alias and one entry per configured replica.
     */
    @Bean
    public DatabaseRegistry databaseRegistry(LitestreamProperties properties, DataSourceFactory dataSourceFactory) {
        DatabaseRegistry registry = new DatabaseRegistry(dataSourceFactory);
        LitestreamProperties.Primary primary = properties.getPrimary();
        registry.register(DatabaseSettings.primary(primary.getAlias(), primary.getPath()));
        for (ReplicaEndpoint endpoint : ReplicaEndpoint.fromProperties(properties.getVfs())) {
            registry.register(DatabaseSettings.replica(endpoint));
        }
        return registry;
    }

    @Bean
    public ExtensionBootstrap extensionBootstrap(VfsExtensionLoader loader, DatabaseRegistry registry) {
        return new ExtensionBootstrap(loader, !registry.replicaAliases().isEmpty());
    }

    @Bean
    public ReplicaStatusProber replicaStatusProber(DatabaseRegistry registry) {
        return new ReplicaStatusProber(registry);
    }

    @Bean
    public ReplicaHealthEvaluator replicaHealthEvaluator(ReplicaStatusProber prober, DatabaseRegistry registry) {
        return new ReplicaHealthEvaluator(prober, registry);
    }

    @Bean
    public LitestreamRouter litestreamRouter(DatabaseRegistry registry, ReplicaHealthEvaluator healthEvaluator,
                                             LitestreamProperties properties) {
        return new LitestreamRouter(registry, healthEvaluator, properties.getPrimary().getAlias());
    }

    @Bean
    public DatabaseRouterChain databaseRouterChain(LitestreamRouter litestreamRouter, LitestreamProperties properties) {
        return new DatabaseRouterChain(List.of(litestreamRouter), properties.getPrimary().getAlias());
    }

    @Bean
    public TimeTravel timeTravel(DatabaseRegistry registry) {
        return new TimeTravel(registry);
    }

    @Bean
    public LitestreamConfigGenerator litestreamConfigGenerator(LitestreamProperties properties) {
        return new LitestreamConfigGenerator(properties);
    }

    /**
     * Routing datasource that switches between primary and replicas.
     */
    @Bean
    @Primary
    public DataSource dataSource(DatabaseRouterChain routerChain, DatabaseRegistry registry) {
        ReplicaRoutingDataSource routingDataSource = new ReplicaRoutingDataSource(routerChain, registry);
        log.info("Routing DataSource configured: writes -> {}, reads -> healthy replicas of {}",
            routerChain.dbForWrite(), registry.replicaAliases());
        return routingDataSource;
    }
}
