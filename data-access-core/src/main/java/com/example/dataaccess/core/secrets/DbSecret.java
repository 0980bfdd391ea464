package com.example.dataaccess.core.secrets;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;

/**
 * Database secret payload as stored in AWS Secrets Manager. Fields follow the RDS secret JSON
 * structure; other fields are ignored.
 *
 * @param username database username
 * @param password database password
 * @param engine database engine identifier (e.g., postgres, mysql)
 * @param host database host name or address
 * @param port database port number
 * @param dbname database name/schema
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DbSecret(
    String username, String password, String engine, String host, int port, String dbname) {

  /**
   * Builds the JDBC URL for this secret. The {@code postgres} engine maps to the {@code
   * postgresql} JDBC subprotocol.
   *
   * @return JDBC URL
   * @throws IllegalStateException if engine or host is missing
   */
  public String jdbcUrl() {
    if (engine == null || engine.isBlank())
      throw new IllegalStateException("Secret has no engine");
    if (host == null || host.isBlank()) throw new IllegalStateException("Secret has no host");
    final var protocol =
        "postgres".equalsIgnoreCase(engine) ? "postgresql" : engine.toLowerCase(Locale.ROOT);
    final var url = "jdbc:%s://%s:%d".formatted(protocol, host, port);
    return dbname == null || dbname.isBlank() ? url : url + "/" + dbname;
  }

  @Override
  public String toString() {
    return "DbSecret[username=%s, engine=%s, host=%s, port=%d, dbname=%s]"
        .formatted(username, engine, host, port, dbname);
  }
}
