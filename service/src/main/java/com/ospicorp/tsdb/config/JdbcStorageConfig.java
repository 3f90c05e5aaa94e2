package com.ospicorp.tsdb.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * PostgreSQL storage. The data source auto-configuration is excluded so the in-memory store
 * runs without a database; this configuration brings it back under {@code tsdb.storage.type=jdbc}
 * and Flyway, {@code JdbcTemplate} and the transaction manager follow from it.
 */
@Configuration
@ConditionalOnProperty(name = "tsdb.storage.type", havingValue = "jdbc")
public class JdbcStorageConfig {

  @Bean
  @ConfigurationProperties("spring.datasource")
  DataSourceProperties dataSourceProperties() {
    return new DataSourceProperties();
  }

  @Bean
  @ConfigurationProperties("spring.datasource.hikari")
  HikariDataSource dataSource(DataSourceProperties properties) {
    return properties.initializeDataSourceBuilder().type(HikariDataSource.class).build();
  }
}
