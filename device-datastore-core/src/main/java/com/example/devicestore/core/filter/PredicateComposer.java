package com.example.devicestore.core.filter;

import static java.lang.System.Logger.Level.DEBUG;

import java.util.ArrayList;
import java.util.StringJoiner;

/**
 * Appends a {@code WHERE} clause built from {@link DeviceFilter} arguments to a base query.
 *
 * <p>Arguments that are not filters are skipped, so callers may pass auxiliary values without
 * affecting the result. Conditions are joined with {@code AND}.
 */
public final class PredicateComposer {

  private static final System.Logger LOGGER = System.getLogger(PredicateComposer.class.getName());

  private PredicateComposer() {}

  /**
   * Composes {@code baseQuery} with every filter found in {@code params}.
   *
   * @param baseQuery query without a {@code WHERE} clause
   * @param params filters, possibly mixed with other values
   * @return the base query unchanged when no filter is present, otherwise the filtered query with
   *     its bound values in argument order
   */
  public static SqlFragment compose(final String baseQuery, final Object... params) {
    final var conditions = new StringJoiner(" AND ");
    final var values = new ArrayList<Object>();
    var filters = 0;

    if (params != null) {
      for (final var param : params) {
        if (param instanceof DeviceFilter filter) {
          final var fragment = filter.toSql();
          conditions.add(fragment.sql());
          values.addAll(fragment.params());
          filters++;
        } else {
          LOGGER.log(DEBUG, "Ignoring non-filter argument: {0}", param);
        }
      }
    }

    if (filters == 0) return new SqlFragment(baseQuery, values);
    return new SqlFragment(baseQuery + " WHERE " + conditions, values);
  }
}
