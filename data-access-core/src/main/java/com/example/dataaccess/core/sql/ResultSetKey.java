package com.example.dataaccess.core.sql;

/**
 * Typed handle on one result set of a {@link DataSetQuery}: its zero-based position among the
 * result sets the statement produces, and the mapper that decodes its rows.
 *
 * <pre>{@code
 * static final ResultSetKey<User> USERS = ResultSetKey.of(0, RowMapper.bean(User.class));
 * static final ResultSetKey<Long> IDS = ResultSetKey.of(1, RowMapper.singleColumn(Long.class));
 * }</pre>
 *
 * @param position zero-based result set position, update counts excluded
 * @param mapper row mapper for that result set
 * @param <T> row type
 */
public record ResultSetKey<T>(int position, RowMapper<T> mapper) {

  public ResultSetKey {
    if (position < 0) throw new IllegalArgumentException("position must be >= 0");
    if (mapper == null) throw new IllegalArgumentException("mapper must not be null");
  }

  public static <T> ResultSetKey<T> of(final int position, final RowMapper<T> mapper) {
    return new ResultSetKey<>(position, mapper);
  }
}
