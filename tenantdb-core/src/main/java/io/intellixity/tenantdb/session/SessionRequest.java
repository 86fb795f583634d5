package io.intellixity.tenantdb.session;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.engine.EngineKey;

/**
 * One session request after name resolution.
 *
 * @param database logical database name as requested
 * @param tenantId tenant, or null for the untenanted database
 * @param resolvedDatabase physical database name
 * @param key engine cache identity
 */
public record SessionRequest(String database, String tenantId, String resolvedDatabase, EngineKey key) {
  public static SessionRequest resolve(ConnectionDescriptor descriptor, String database, String tenantId) {
    String resolved = descriptor.resolveDatabaseName(database, tenantId);
    String tenant = (tenantId == null || tenantId.isBlank()) ? null : tenantId.trim();
    return new SessionRequest(database.trim(), tenant, resolved, EngineKey.of(descriptor, resolved));
  }
}
