package com.example.dataaccess.core.registry;

import com.example.dataaccess.core.retry.Retry;
import com.example.dataaccess.core.sql.DataSet;
import com.example.dataaccess.core.sql.DataSetQuery;
import com.example.dataaccess.core.sql.ResultSetKey;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * Executes database work against one {@link DataSource}, on a fresh connection per attempt, under a
 * retry policy.
 *
 * @param dataSource data source to open connections from
 * @param policy retry policy applied to every call
 */
public record Repository(DataSource dataSource, Retry.Policy policy) {

  public Repository {
    if (dataSource == null) throw new IllegalArgumentException("dataSource must not be null");
    if (policy == null) throw new IllegalArgumentException("policy must not be null");
  }

  /**
   * Runs {@code operation} with an open connection, retrying per the policy.
   *
   * @param operation the database operation to run with an open {@link Connection}
   * @param <T> the operation result type
   * @return the value returned by the operation
   * @throws SQLException the failure of the last attempt
   */
  public <T> T execute(final DbOperation<T> operation) throws SQLException {
    if (operation == null) throw new IllegalArgumentException("operation must not be null");
    return Retry.invoke(() -> run(operation), policy);
  }

  /**
   * Executes a multi-result-set query, retrying per the policy.
   *
   * @param query the query
   * @param keys result sets to decode
   * @return decoded result sets
   * @throws SQLException the failure of the last attempt
   */
  public DataSet query(final DataSetQuery query, final ResultSetKey<?>... keys)
      throws SQLException {
    return execute(conn -> query.execute(conn, keys));
  }

  private <T> T run(final DbOperation<T> operation) throws SQLException {
    try (final var conn = dataSource.getConnection()) {
      return operation.execute(conn);
    }
  }

  /**
   * Database operation executed against an open {@link Connection}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface DbOperation<T> {
    /**
     * Executes the operation with the provided connection.
     *
     * @param conn an open JDBC connection
     * @return operation result
     * @throws SQLException on database errors
     */
    T execute(final Connection conn) throws SQLException;
  }
}
