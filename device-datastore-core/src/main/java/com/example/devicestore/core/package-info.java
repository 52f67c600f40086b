/**
 * Root package for the device datastore.
 *
 * <p>This package opens a pooled PostgreSQL {@link javax.sql.DataSource DataSource}, waits for the
 * server with a bounded linear backoff, applies the idempotent device schema and hands back a
 * {@link com.example.devicestore.core.device.DeviceStore DeviceStore}.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.devicestore.core.DeviceStoreBootstrap} – connects, migrates and builds
 *       the store.
 *   <li>{@link com.example.devicestore.core.Retry} – retry policy and loop used by the bootstrap.
 *   <li>{@link com.example.devicestore.core.SchemaMigrator} – runs the classpath schema script in
 *       one transaction.
 *   <li>{@link com.example.devicestore.core.config.StoreConfig} – driver, connection string and
 *       pool settings, loadable from JSON.
 *   <li>{@link com.example.devicestore.core.jdbc.DbClient} – borrows connections and prepares
 *       statements with a query timeout.
 *   <li>{@link com.example.devicestore.core.device.PostgresDeviceStore} – upserts keyed on serial
 *       number plus the lookup and list queries.
 *   <li>{@link com.example.devicestore.core.filter.PredicateComposer} – turns typed filters into a
 *       parameterised {@code WHERE} clause.
 * </ul>
 */
package com.example.devicestore.core;
