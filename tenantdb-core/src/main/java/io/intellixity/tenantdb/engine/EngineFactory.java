package io.intellixity.tenantdb.engine;

import io.intellixity.tenantdb.config.ConnectionDescriptor;

/**
 * Produces (or reuses) a live engine for a resolved database.\n
 *
 * Implementations retry transient connection failures according to the descriptor, and serialize concurrent
 * creation per {@link EngineKey} so one key never has two connection sequences in flight.\n
 */
public interface EngineFactory<H extends EngineHandle<?>> extends AutoCloseable {
  /**
   * @throws DatabaseConnectionException when no connection could be established
   */
  H getOrCreateEngine(ConnectionDescriptor descriptor, String resolvedDatabase);

  /** Close and forget the engine cached under {@code key}; returns false if none was cached. */
  boolean evict(EngineKey key);

  /** Dispose every cached engine. */
  @Override
  void close();
}
