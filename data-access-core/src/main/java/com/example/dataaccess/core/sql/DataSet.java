package com.example.dataaccess.core.sql;

import java.util.List;
import java.util.Map;

/** Decoded result sets of one {@link DataSetQuery} execution, addressed by {@link ResultSetKey}. */
public final class DataSet {

  private final Map<ResultSetKey<?>, List<?>> tables;
  private final int resultSetCount;

  DataSet(final Map<ResultSetKey<?>, List<?>> tables, final int resultSetCount) {
    this.tables = Map.copyOf(tables);
    this.resultSetCount = resultSetCount;
  }

  /**
   * Returns the rows decoded for {@code key}.
   *
   * @param key one of the keys the query was executed with
   * @param <T> row type
   * @return unmodifiable list of rows, in result set order
   * @throws IllegalArgumentException if the query was not executed with this key
   */
  @SuppressWarnings("unchecked")
  public <T> List<T> get(final ResultSetKey<T> key) {
    final var rows = tables.get(key);
    if (rows == null)
      throw new IllegalArgumentException("No result set was read for position " + key.position());
    return (List<T>) rows;
  }

  /**
   * Number of result sets the statement produced, read or not.
   *
   * @return result set count
   */
  public int size() {
    return resultSetCount;
  }
}
