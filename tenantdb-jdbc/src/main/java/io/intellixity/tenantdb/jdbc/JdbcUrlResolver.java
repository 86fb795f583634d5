package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.config.ConnectionDescriptor;

/** Builds the JDBC URL of a resolved database on the descriptor's server. */
@FunctionalInterface
public interface JdbcUrlResolver {
  String url(ConnectionDescriptor descriptor, String resolvedDatabase);
}
