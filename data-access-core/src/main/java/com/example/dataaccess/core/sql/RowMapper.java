package com.example.dataaccess.core.sql;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the current row of a {@link ResultSet} to a value.
 *
 * @param <T> row type
 */
@FunctionalInterface
public interface RowMapper<T> {

  /**
   * Maps the row the result set is positioned on. Implementations must not advance the cursor.
   *
   * @param rs result set positioned on a row
   * @param rowNum zero-based row number within the result set
   * @return the mapped value
   * @throws SQLException if a column cannot be read
   */
  T map(final ResultSet rs, final int rowNum) throws SQLException;

  /**
   * Maps each row to an insertion-ordered map of column label to value.
   *
   * @return column map mapper
   */
  static RowMapper<Map<String, Object>> columnMap() {
    return (rs, rowNum) -> {
      final var meta = rs.getMetaData();
      final var row = new LinkedHashMap<String, Object>();
      for (var i = 1; i <= meta.getColumnCount(); i++)
        row.put(meta.getColumnLabel(i), rs.getObject(i));
      return row;
    };
  }

  /**
   * Maps each row to the value of its first column.
   *
   * @param type column value type
   * @param <T> column value type
   * @return single column mapper
   */
  static <T> RowMapper<T> singleColumn(final Class<T> type) {
    return (rs, rowNum) -> rs.getObject(1, type);
  }

  /**
   * Maps each row to a bean or record by column label, using Jackson. Labels match property names
   * case-insensitively; columns without a matching property are ignored.
   *
   * @param type target type
   * @param <T> target type
   * @return bean mapper
   */
  static <T> RowMapper<T> bean(final Class<T> type) {
    return bean(type, BeanMappers.DEFAULT_MAPPER);
  }

  /**
   * Maps each row to a bean or record by column label, using the given {@link ObjectMapper}.
   *
   * @param type target type
   * @param mapper object mapper used to convert the column map
   * @param <T> target type
   * @return bean mapper
   */
  static <T> RowMapper<T> bean(final Class<T> type, final ObjectMapper mapper) {
    final var columns = columnMap();
    return (rs, rowNum) -> {
      final var row = columns.map(rs, rowNum);
      try {
        return mapper.convertValue(row, type);
      } catch (final IllegalArgumentException e) {
        throw new SQLDataException(
            "Cannot map row " + rowNum + " to " + type.getName() + ": " + e.getMessage(), e);
      }
    };
  }
}
