package com.example.devicestore.core;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;

/**
 * Ensures the {@code devices} schema exists.
 *
 * <p>The DDL lives in {@code schema/devices.sql} on the classpath. Every statement uses {@code IF
 * NOT EXISTS}, so applying it on every start, against an empty or an already migrated database, is
 * a no-op when nothing is missing. The script runs in one transaction; any failure rolls it back
 * and is fatal.
 */
public final class SchemaMigrator {

  private static final System.Logger LOGGER = System.getLogger(SchemaMigrator.class.getName());

  public static final String DEFAULT_SCRIPT = "schema/devices.sql";

  private final List<String> statements;

  private SchemaMigrator(final List<String> statements) {
    this.statements = statements;
  }

  /**
   * Loads the default schema script from the classpath.
   *
   * @return migrator for the device schema
   */
  public static SchemaMigrator fromClasspath() {
    return fromClasspath(DEFAULT_SCRIPT);
  }

  /**
   * Loads a schema script from the classpath.
   *
   * @param resource classpath resource name
   * @return migrator for the script
   * @throws SchemaMigrationException if the script is missing or unreadable
   */
  public static SchemaMigrator fromClasspath(final String resource) {
    try (final var in = SchemaMigrator.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null)
        throw new SchemaMigrationException(resource + " not found on classpath", null);
      return new SchemaMigrator(statements(new String(in.readAllBytes(), StandardCharsets.UTF_8)));
    } catch (final IOException e) {
      throw new SchemaMigrationException("Failed to read " + resource, e);
    }
  }

  List<String> statements() {
    return statements;
  }

  /**
   * Applies the schema.
   *
   * @param dataSource target database
   * @throws SchemaMigrationException if any statement fails
   */
  public void migrate(final DataSource dataSource) {
    try (final var conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try (final var stmt = conn.createStatement()) {
        for (final var sql : statements) stmt.execute(sql);
        conn.commit();
      } catch (final SQLException e) {
        conn.rollback();
        throw e;
      }
      LOGGER.log(INFO, "Device schema applied ({0} statements)", statements.size());
    } catch (final SQLException e) {
      LOGGER.log(ERROR, "Device schema migration failed", e);
      throw new SchemaMigrationException("device datastore schema migration failed", e);
    }
  }

  /** Splits a script on statement-terminating semicolons and drops {@code --} comment lines. */
  static List<String> statements(final String script) {
    final var withoutComments =
        script
            .lines()
            .filter(line -> !line.trim().startsWith("--"))
            .collect(Collectors.joining("\n"));
    return Arrays.stream(withoutComments.split(";\\s*(\\r?\\n|$)"))
        .map(String::trim)
        .filter(sql -> !sql.isEmpty())
        .toList();
  }
}
