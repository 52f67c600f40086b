package com.example.devicestore.core.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import javax.sql.DataSource;

/**
 * Thin database client that borrows one pooled connection per operation and applies the
 * configured statement timeout to everything it prepares.
 *
 * <p>The client does not retry; failures propagate to the caller unchanged.
 *
 * @param dataSource shared connection pool
 * @param queryTimeoutSeconds statement timeout, {@code 0} for the driver default
 */
public record DbClient(DataSource dataSource, int queryTimeoutSeconds) {

  public DbClient {
    if (dataSource == null) throw new IllegalArgumentException("dataSource cannot be null");
    if (queryTimeoutSeconds < 0)
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
  }

  /**
   * Opens a connection and executes the provided operation.
   *
   * @param operation unit of work using an open {@link Connection}
   * @param <T> return type
   * @return operation result
   * @throws SQLException if opening the connection or executing the work fails
   */
  public <T> T execute(final DbOperation<T> operation) throws SQLException {
    try (final var conn = dataSource.getConnection()) {
      return operation.execute(conn);
    }
  }

  /**
   * Prepares {@code sql} with the configured timeout and binds {@code params} in order.
   *
   * @param conn open connection
   * @param sql statement text with {@code ?} placeholders
   * @param params values for the placeholders
   * @return prepared statement, owned by the caller
   * @throws SQLException if preparing or binding fails
   */
  public PreparedStatement prepare(final Connection conn, final String sql, final List<?> params)
      throws SQLException {
    final var ps = conn.prepareStatement(sql);
    try {
      if (queryTimeoutSeconds > 0) ps.setQueryTimeout(queryTimeoutSeconds);
      for (var i = 0; i < params.size(); i++) ps.setObject(i + 1, params.get(i));
      return ps;
    } catch (final SQLException e) {
      ps.close();
      throw e;
    }
  }

  /** Closes the underlying pool if it is closeable. */
  public void close() throws Exception {
    if (dataSource instanceof AutoCloseable ac) ac.close();
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
