package com.example.devicestore.core.filter;

import java.util.List;

/**
 * Piece of SQL with {@code ?} placeholders and the values bound to them, in order.
 *
 * @param sql statement text
 * @param params values for the placeholders
 */
public record SqlFragment(String sql, List<Object> params) {

  public SqlFragment {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql cannot be blank");
    params = List.copyOf(params);
  }

  public static SqlFragment of(final String sql, final Object... params) {
    return new SqlFragment(sql, List.of(params));
  }
}
