package com.example.litestream.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Enables AOP for {@code @ReadReplica} / {@code @PrimaryDatabase} routing and binds the
 * {@code litestream.*} properties. {@link ReplicaDataSourceConfig} creates the routing datasource.
 */
@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(LitestreamProperties.class)
public class DataSourceRouterConfig {
}
