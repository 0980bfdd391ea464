package com.example.dataaccess.core.registry;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;

/** {@link DataSourceFactory} that builds HikariCP pools. */
public final class HikariDataSourceFactory implements DataSourceFactory {

  private final String poolNamePrefix;

  public HikariDataSourceFactory() {
    this("data-access");
  }

  /**
   * @param poolNamePrefix prefix for pool names, shown in HikariCP logs and thread names
   */
  public HikariDataSourceFactory(final String poolNamePrefix) {
    this.poolNamePrefix = poolNamePrefix;
  }

  @Override
  public DataSource create(final ConnectionSettings settings) {
    return new HikariDataSource(config(settings));
  }

  HikariConfig config(final ConnectionSettings settings) {
    final var config = new HikariConfig();
    config.setJdbcUrl(settings.jdbcUrl());
    config.setUsername(settings.username());
    config.setPassword(settings.password());
    config.setMaximumPoolSize(settings.maximumPoolSize());
    config.setPoolName(poolNamePrefix + "-" + Integer.toHexString(settings.jdbcUrl().hashCode()));
    return config;
  }
}
