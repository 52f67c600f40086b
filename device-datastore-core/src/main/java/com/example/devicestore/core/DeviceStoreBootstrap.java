package com.example.devicestore.core;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.devicestore.core.config.StoreConfig;
import com.example.devicestore.core.device.DeviceStore;
import com.example.devicestore.core.device.PostgresDeviceStore;
import com.example.devicestore.core.jdbc.DataSourceFactory;
import com.example.devicestore.core.jdbc.DbClient;
import com.example.devicestore.core.jdbc.HikariPools;
import java.lang.System.Logger;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;

/**
 * Opens a ready-to-use {@link DeviceStore}.
 *
 * <p>Opening happens in three steps:
 *
 * <ol>
 *   <li>the driver is checked; anything but {@code postgres} fails at once with {@link
 *       UnknownDriverException}
 *   <li>a lazily initialised pool is created and probed until a connection is valid, waiting {@code
 *       n * backoff} after the n-th failure; every failure is logged, and running out of attempts
 *       throws {@link StoreUnavailableException}
 *   <li>the schema is ensured; a failure throws {@link SchemaMigrationException} and is not retried
 * </ol>
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * try (var store = DeviceStoreBootstrap.open("postgres", "postgres://mdm@db/devices", logger)) {
 *   var id = store.createOrMerge(FactSource.FETCH, device);
 * }
 * }</pre>
 *
 * <h2>Full Configuration</h2>
 *
 * <pre>{@code
 * var store = DeviceStoreBootstrap.builder()
 *     .config(StoreConfig.fromJson(in))
 *     .logger(System.getLogger("devices"))
 *     .retryPolicy(Retry.Policy.linear(10, 500L))
 *     .dataSourceFactory(HikariPools.DEFAULT)
 *     .build()
 *     .open();
 * }</pre>
 */
public final class DeviceStoreBootstrap {

  public static final String POSTGRES = "postgres";

  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private final StoreConfig config;
  private final Logger logger;
  private final Retry.Policy retryPolicy;
  private final Retry.Sleeper sleeper;
  private final DataSourceFactory dataSourceFactory;
  private final SchemaMigrator schemaMigrator;

  private DeviceStoreBootstrap(final Builder builder) {
    this.config = builder.config;
    this.logger = builder.logger;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : config.connectPolicy();
    this.sleeper = builder.sleeper;
    this.dataSourceFactory = builder.dataSourceFactory;
    this.schemaMigrator =
        builder.schemaMigrator != null ? builder.schemaMigrator : SchemaMigrator.fromClasspath();
  }

  /**
   * Opens a store with default pool, timeout and retry settings.
   *
   * @param driver store driver, only {@code postgres} is supported
   * @param connectionString connection string, see {@link
   *     com.example.devicestore.core.config.ConnectionString}
   * @param logger receives one message per failed connection attempt
   * @return ready store
   * @throws UnknownDriverException for an unsupported driver
   * @throws StoreUnavailableException if the store never became reachable
   * @throws SchemaMigrationException if the schema could not be ensured
   */
  public static DeviceStore open(
      final String driver, final String connectionString, final Logger logger) {
    return builder()
        .config(StoreConfig.of(driver, connectionString))
        .logger(logger)
        .build()
        .open();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link DeviceStoreBootstrap}. */
  public static class Builder {
    private StoreConfig config;
    private Logger logger = System.getLogger(DeviceStoreBootstrap.class.getName());
    private Retry.Policy retryPolicy;
    private Retry.Sleeper sleeper = Retry.Sleeper.system();
    private DataSourceFactory dataSourceFactory = HikariPools.DEFAULT;
    private SchemaMigrator schemaMigrator;

    private Builder() {}

    /**
     * Sets the store settings (required).
     *
     * @param config store settings
     * @return this builder
     */
    public Builder config(final StoreConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the logger receiving connection progress.
     *
     * <p>Default: a logger named after this class
     *
     * @param logger progress logger
     * @return this builder
     */
    public Builder logger(final Logger logger) {
      this.logger = logger;
      return this;
    }

    /**
     * Overrides the reachability retry policy.
     *
     * <p>Default: {@link StoreConfig#connectPolicy()}, linear backoff over 20 attempts
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(final Retry.Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how the bootstrapper waits between attempts.
     *
     * <p>Default: {@link Retry.Sleeper#system()}
     *
     * @param sleeper pause implementation
     * @return this builder
     */
    public Builder sleeper(final Retry.Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the connection pool factory.
     *
     * <p>Default: {@link HikariPools#DEFAULT}
     *
     * @param dataSourceFactory pool factory
     * @return this builder
     */
    public Builder dataSourceFactory(final DataSourceFactory dataSourceFactory) {
      this.dataSourceFactory = dataSourceFactory;
      return this;
    }

    /**
     * Sets the schema migrator.
     *
     * <p>Default: {@link SchemaMigrator#fromClasspath()}
     *
     * @param schemaMigrator schema migrator
     * @return this builder
     */
    public Builder schemaMigrator(final SchemaMigrator schemaMigrator) {
      this.schemaMigrator = schemaMigrator;
      return this;
    }

    /**
     * Builds the bootstrapper.
     *
     * @return configured bootstrapper
     * @throws IllegalStateException if required fields are not set
     */
    public DeviceStoreBootstrap build() {
      if (config == null) throw new IllegalStateException("config is required");
      if (logger == null) throw new IllegalStateException("logger cannot be null");
      if (sleeper == null) throw new IllegalStateException("sleeper cannot be null");
      if (dataSourceFactory == null)
        throw new IllegalStateException("dataSourceFactory cannot be null");
      return new DeviceStoreBootstrap(this);
    }
  }

  /**
   * Connects, ensures the schema and returns the store.
   *
   * @return ready store
   * @throws UnknownDriverException for an unsupported driver
   * @throws StoreUnavailableException if the store never became reachable
   * @throws SchemaMigrationException if the schema could not be ensured
   */
  public DeviceStore open() {
    if (!POSTGRES.equals(config.driver())) throw new UnknownDriverException(config.driver());

    final var dataSource = dataSourceFactory.create(config);
    final var failures = new AtomicInteger();
    try {
      Retry.withPolicy(
          () -> probe(dataSource),
          retryPolicy,
          (attempt, e) -> {
            failures.incrementAndGet();
            logger.log(
                WARNING,
                "could not connect to postgres (attempt {0} of {1}): {2}",
                attempt,
                retryPolicy.maxAttempts(),
                e.getMessage());
          },
          sleeper);
    } catch (final SQLException e) {
      closeQuietly(dataSource);
      throw new StoreUnavailableException(failures.get(), e);
    }
    logger.log(INFO, "Connected to device datastore");

    try {
      schemaMigrator.migrate(dataSource);
    } catch (final SchemaMigrationException e) {
      closeQuietly(dataSource);
      throw e;
    }

    return new PostgresDeviceStore(new DbClient(dataSource, config.queryTimeoutSeconds()));
  }

  private static Void probe(final DataSource dataSource) throws SQLException {
    try (final var conn = dataSource.getConnection()) {
      if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS))
        throw new SQLTransientConnectionException("connection failed validation", "08006");
      return null;
    }
  }

  private void closeQuietly(final DataSource dataSource) {
    if (dataSource instanceof AutoCloseable ac) {
      try {
        ac.close();
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close DataSource", e);
      }
    }
  }
}
