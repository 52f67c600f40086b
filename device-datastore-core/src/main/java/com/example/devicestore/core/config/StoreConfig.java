package com.example.devicestore.core.config;

import com.example.devicestore.core.Retry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.function.Supplier;

/**
 * Settings for opening a device store.
 *
 * <p>Usually read from a JSON document:
 *
 * <pre>{@code
 * {
 *   "driver": "postgres",
 *   "url": "postgres://mdm:secret@db:5432/devices?sslmode=disable",
 *   "maximumPoolSize": 10,
 *   "queryTimeoutSeconds": 30,
 *   "connectAttempts": 20,
 *   "connectBackoffMillis": 1000
 * }
 * }</pre>
 *
 * <p>Numeric settings left at zero (or absent from the JSON) take their defaults.
 *
 * @param driver store driver identifier, only {@code postgres} is supported
 * @param url connection string in any form accepted by {@link ConnectionString#parse(String)}
 * @param username user name, overrides one embedded in {@code url}
 * @param password password, overrides one embedded in {@code url}
 * @param maximumPoolSize connection pool size
 * @param connectionTimeoutMillis how long borrowing a pooled connection may block
 * @param queryTimeoutSeconds statement timeout applied to every read and write
 * @param connectAttempts reachability probes made before bootstrap gives up
 * @param connectBackoffMillis linear backoff unit between reachability probes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    String driver,
    String url,
    String username,
    String password,
    int maximumPoolSize,
    long connectionTimeoutMillis,
    int queryTimeoutSeconds,
    int connectAttempts,
    long connectBackoffMillis) {

  public static final int DEFAULT_MAXIMUM_POOL_SIZE = 10;
  public static final long DEFAULT_CONNECTION_TIMEOUT_MILLIS = 5_000L;
  public static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 30;
  public static final int DEFAULT_CONNECT_ATTEMPTS = 20;
  public static final long DEFAULT_CONNECT_BACKOFF_MILLIS = 1_000L;

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  public StoreConfig {
    if (maximumPoolSize < 0) throw new IllegalArgumentException("maximumPoolSize must be >= 0");
    if (connectionTimeoutMillis < 0)
      throw new IllegalArgumentException("connectionTimeoutMillis must be >= 0");
    if (queryTimeoutSeconds < 0)
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    if (connectAttempts < 0) throw new IllegalArgumentException("connectAttempts must be >= 0");
    if (connectBackoffMillis < 0)
      throw new IllegalArgumentException("connectBackoffMillis must be >= 0");

    if (maximumPoolSize == 0) maximumPoolSize = DEFAULT_MAXIMUM_POOL_SIZE;
    if (connectionTimeoutMillis == 0) connectionTimeoutMillis = DEFAULT_CONNECTION_TIMEOUT_MILLIS;
    if (queryTimeoutSeconds == 0) queryTimeoutSeconds = DEFAULT_QUERY_TIMEOUT_SECONDS;
    if (connectAttempts == 0) connectAttempts = DEFAULT_CONNECT_ATTEMPTS;
    if (connectBackoffMillis == 0) connectBackoffMillis = DEFAULT_CONNECT_BACKOFF_MILLIS;
  }

  /**
   * Creates a configuration with default pool, timeout and retry settings.
   *
   * @param driver store driver identifier
   * @param connectionString connection string
   * @return configuration with defaults
   */
  public static StoreConfig of(final String driver, final String connectionString) {
    return new StoreConfig(driver, connectionString, null, null, 0, 0L, 0, 0, 0L);
  }

  /**
   * Sets the supplier of the {@link ObjectMapper} used by {@link #fromJson(InputStream)}.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Reads a configuration from JSON.
   *
   * @param json JSON document
   * @return parsed configuration
   * @throws IOException if the document cannot be read or parsed
   */
  public static StoreConfig fromJson(final InputStream json) throws IOException {
    return mapperSupplier.get().readValue(json, StoreConfig.class);
  }

  /**
   * Resolves {@link #url()} and applies the explicit credential overrides.
   *
   * @return resolved connection string
   * @throws IllegalArgumentException if the URL is missing or malformed
   */
  public ConnectionString connection() {
    return ConnectionString.parse(url).withCredentials(username, password);
  }

  /**
   * Linear backoff policy for reachability probes.
   *
   * @return retry policy derived from {@link #connectAttempts()} and {@link
   *     #connectBackoffMillis()}
   */
  public Retry.Policy connectPolicy() {
    return Retry.Policy.linear(connectAttempts, connectBackoffMillis);
  }

  @Override
  public String toString() {
    final var redactedUrl = url == null ? null : ConnectionString.redact(url);
    return "StoreConfig[driver=%s, url=%s, maximumPoolSize=%d, queryTimeoutSeconds=%d]"
        .formatted(driver, redactedUrl, maximumPoolSize, queryTimeoutSeconds);
  }
}
