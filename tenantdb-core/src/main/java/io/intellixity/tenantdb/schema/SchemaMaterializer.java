package io.intellixity.tenantdb.schema;

import io.intellixity.tenantdb.engine.EngineHandle;

/**
 * Creates the declared tables of a database if they are absent.\n
 *
 * Must be idempotent: running against an already materialized database is a no-op.\n
 */
@FunctionalInterface
public interface SchemaMaterializer<H extends EngineHandle<?>> {
  /**
   * @throws SchemaException on irrecoverable DDL failure
   */
  void materialize(H engine, String databaseName);

  static <H extends EngineHandle<?>> SchemaMaterializer<H> none() {
    return (engine, databaseName) -> {};
  }
}
