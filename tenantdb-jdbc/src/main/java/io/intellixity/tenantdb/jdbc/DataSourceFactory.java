package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.config.ConnectionDescriptor;

import javax.sql.DataSource;

/**
 * Creates the DataSource of one connection attempt.
 * <p>
 * Returned sources that implement {@link AutoCloseable} are closed when the attempt fails or the engine is
 * disposed.
 */
@FunctionalInterface
public interface DataSourceFactory {
  DataSource create(ConnectionDescriptor descriptor, String jdbcUrl, String poolName);
}
