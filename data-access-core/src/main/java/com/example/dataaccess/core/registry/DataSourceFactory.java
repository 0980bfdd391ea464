package com.example.dataaccess.core.registry;

import javax.sql.DataSource;

/**
 * Functional factory that creates a {@link DataSource} from {@link ConnectionSettings}.
 * Implementations typically configure a connection pool.
 */
@FunctionalInterface
public interface DataSourceFactory {
  /**
   * Creates a new {@link DataSource} for the given settings.
   *
   * @param settings connection parameters
   * @return a new {@link DataSource}
   */
  DataSource create(final ConnectionSettings settings);
}
