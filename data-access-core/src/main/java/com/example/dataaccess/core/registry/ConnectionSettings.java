package com.example.dataaccess.core.registry;

/**
 * Connection parameters for one pooled data source.
 *
 * @param jdbcUrl JDBC URL
 * @param username database user
 * @param password database password
 * @param maximumPoolSize maximum number of pooled connections, must be >= 1
 */
public record ConnectionSettings(
    String jdbcUrl, String username, String password, int maximumPoolSize) {

  static final int DEFAULT_POOL_SIZE = 10;

  public ConnectionSettings {
    if (jdbcUrl == null || jdbcUrl.isBlank())
      throw new IllegalArgumentException("jdbcUrl must not be blank");
    if (maximumPoolSize < 1) throw new IllegalArgumentException("maximumPoolSize must be >= 1");
  }

  public static ConnectionSettings of(
      final String jdbcUrl, final String username, final String password) {
    return new ConnectionSettings(jdbcUrl, username, password, DEFAULT_POOL_SIZE);
  }

  @Override
  public String toString() {
    return "ConnectionSettings[jdbcUrl="
        + jdbcUrl
        + ", username="
        + username
        + ", maximumPoolSize="
        + maximumPoolSize
        + "]";
  }
}
