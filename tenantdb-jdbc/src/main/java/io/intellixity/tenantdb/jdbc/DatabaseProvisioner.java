package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.config.ConnectionDescriptor;

import java.sql.SQLException;

/**
 * Creates a database that does not exist yet.\n
 *
 * Implementations must treat "created concurrently by someone else" as success.\n
 */
@FunctionalInterface
public interface DatabaseProvisioner {
  DatabaseProvisioner NONE = (descriptor, database) -> false;

  /** Returns true if the database was created by this call. */
  boolean ensureDatabase(ConnectionDescriptor descriptor, String resolvedDatabase) throws SQLException;
}
