package com.example.devicestore.core.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** HikariCP-backed {@link DataSourceFactory} instances. */
public final class HikariPools {

  private HikariPools() {}

  /**
   * Builds a lazily initialised HikariCP pool. {@code initializationFailTimeout} is negative so
   * that constructing the pool never blocks on, or fails because of, an unreachable database.
   */
  public static final DataSourceFactory DEFAULT =
      config -> {
        final var connection = config.connection();
        final var hikari = new HikariConfig();
        hikari.setJdbcUrl(connection.jdbcUrl());
        if (connection.username() != null) hikari.setUsername(connection.username());
        if (connection.password() != null) hikari.setPassword(connection.password());
        hikari.setMaximumPoolSize(config.maximumPoolSize());
        hikari.setConnectionTimeout(config.connectionTimeoutMillis());
        hikari.setInitializationFailTimeout(-1);
        hikari.setPoolName("device-datastore");
        return new HikariDataSource(hikari);
      };
}
