package com.example.devicestore.core.jdbc;

import com.example.devicestore.core.config.StoreConfig;
import javax.sql.DataSource;

/**
 * Factory that creates a {@link DataSource} from a {@link StoreConfig}. Implementations typically
 * configure a connection pool using values from the configuration.
 *
 * <p>Creating the data source must not verify that the store is reachable; the bootstrapper probes
 * reachability itself.
 */
@FunctionalInterface
public interface DataSourceFactory {
  /**
   * Creates a new {@link DataSource} configured for the provided settings.
   *
   * @param config store settings
   * @return a new {@link DataSource}
   */
  DataSource create(final StoreConfig config);
}
