package io.intellixity.tenantdb.engine;

/**
 * Live, poolable handle bound to one resolved database.\n
 *
 * Example:\n
 * - JDBC: client() is a javax.sql.DataSource (HikariCP or unpooled)\n
 *
 * Handles are owned by the engine factory that created them; callers must not close a cached handle.\n
 */
public interface EngineHandle<TClient> extends AutoCloseable {
  /** Unique identifier for this handle (useful for logging/caching). */
  String id();

  /** Native client used to open connections. */
  TClient client();

  /** Resolved (physical) database name. */
  String databaseName();

  /** Cache key this handle was created under. */
  EngineKey key();

  /** Release pooled connections; idempotent. */
  @Override
  void close();
}
