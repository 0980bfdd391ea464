package com.example.dataaccess.core.sql;

import static java.lang.System.Logger.Level.DEBUG;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.sql.DataSource;

/**
 * A statement that yields several independent result sets, each decoded into its own typed list.
 *
 * <p>Result sets are numbered from zero in the order the driver returns them; update counts are
 * skipped and take no position. Only result sets named by a {@link ResultSetKey} are decoded, the
 * others are closed unread.
 *
 * <pre>{@code
 * var users = ResultSetKey.of(0, RowMapper.bean(User.class));
 * var orders = ResultSetKey.of(1, RowMapper.bean(Order.class));
 *
 * var dataSet = DataSetQuery.text(
 *         "SELECT id, name FROM users WHERE id = ?; SELECT id, total FROM orders WHERE uid = ?",
 *         7, 7)
 *     .execute(dataSource, users, orders);
 *
 * List<User> u = dataSet.get(users);
 * List<Order> o = dataSet.get(orders);
 * }</pre>
 *
 * @param sql statement text, or procedure name for {@link CommandType#STORED_PROCEDURE}
 * @param commandType how {@code sql} is interpreted
 * @param parameters positional parameters, may contain nulls
 */
public record DataSetQuery(String sql, CommandType commandType, List<Object> parameters) {

  private static final System.Logger LOGGER = System.getLogger(DataSetQuery.class.getName());

  /** SQLState for "no data", used when a requested result set was never produced. */
  static final String NO_DATA = "02000";

  public DataSetQuery {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql must not be blank");
    if (commandType == null) throw new IllegalArgumentException("commandType must not be null");
    parameters =
        parameters == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  /**
   * Creates a query from statement text.
   *
   * @param sql statement text
   * @param parameters positional parameters
   * @return query
   */
  public static DataSetQuery text(final String sql, final Object... parameters) {
    return new DataSetQuery(sql, CommandType.TEXT, asList(parameters));
  }

  /**
   * Creates a stored procedure call.
   *
   * @param procedure procedure name
   * @param parameters positional parameters
   * @return query
   */
  public static DataSetQuery procedure(final String procedure, final Object... parameters) {
    return new DataSetQuery(procedure, CommandType.STORED_PROCEDURE, asList(parameters));
  }

  /**
   * Opens a connection from {@code dataSource}, executes the query and closes the connection.
   *
   * @param dataSource source of the connection
   * @param keys result sets to decode
   * @return decoded result sets
   * @throws SQLException on database errors, or if a key names a result set that was not produced
   */
  public DataSet execute(final DataSource dataSource, final ResultSetKey<?>... keys)
      throws SQLException {
    try (final var conn = dataSource.getConnection()) {
      return execute(conn, keys);
    }
  }

  /**
   * Executes the query on an open connection. The connection is left open.
   *
   * @param conn open connection
   * @param keys result sets to decode
   * @return decoded result sets
   * @throws SQLException on database errors, or if a key names a result set that was not produced
   */
  public DataSet execute(final Connection conn, final ResultSetKey<?>... keys)
      throws SQLException {
    final var byPosition = indexByPosition(keys);
    final var tables = new HashMap<ResultSetKey<?>, List<?>>();
    var position = 0;

    try (final var stmt = prepare(conn)) {
      for (var i = 0; i < parameters.size(); i++) stmt.setObject(i + 1, parameters.get(i));

      var hasResultSet = stmt.execute();
      while (true) {
        if (hasResultSet) {
          try (final var rs = stmt.getResultSet()) {
            final var key = byPosition.get(position);
            if (key != null) tables.put(key, read(rs, key.mapper()));
          }
          position++;
        } else if (stmt.getUpdateCount() == -1) {
          break;
        }
        hasResultSet = stmt.getMoreResults();
      }
    }

    for (final var key : byPosition.values()) {
      if (key.position() >= position)
        throw new SQLException(
            "Statement produced "
                + position
                + " result set(s), no result set at position "
                + key.position(),
            NO_DATA);
    }

    LOGGER.log(DEBUG, "Read {0} of {1} result set(s)", tables.size(), position);
    return new DataSet(tables, position);
  }

  String statementText() {
    if (commandType == CommandType.TEXT) return sql;
    final var placeholders =
        parameters.stream().map(p -> "?").collect(Collectors.joining(", ", "(", ")"));
    return "{call " + sql.trim() + placeholders + "}";
  }

  private PreparedStatement prepare(final Connection conn) throws SQLException {
    return commandType == CommandType.TEXT
        ? conn.prepareStatement(statementText())
        : conn.prepareCall(statementText());
  }

  private static <T> List<T> read(final ResultSet rs, final RowMapper<T> mapper)
      throws SQLException {
    final var rows = new ArrayList<T>();
    var rowNum = 0;
    while (rs.next()) rows.add(mapper.map(rs, rowNum++));
    return Collections.unmodifiableList(rows);
  }

  private static Map<Integer, ResultSetKey<?>> indexByPosition(final ResultSetKey<?>... keys) {
    final var byPosition = new HashMap<Integer, ResultSetKey<?>>();
    if (keys == null) return byPosition;
    for (final var key : keys) {
      if (key == null) throw new IllegalArgumentException("keys must not contain null");
      if (byPosition.putIfAbsent(key.position(), key) != null)
        throw new IllegalArgumentException("Duplicate result set position " + key.position());
    }
    return byPosition;
  }

  private static List<Object> asList(final Object... parameters) {
    return parameters == null ? List.of() : Arrays.asList(parameters);
  }
}
