package io.intellixity.tenantdb.session;

/**
 * Minimal session capability handed to manual hooks.
 * <p>
 * Work runs inside one transaction that stays open until {@link #commit()} or {@link #rollback()}.
 */
public interface SessionOps {
  /** Execute one statement with positional {@code ?} parameters; returns the update count (0 for DDL). */
  int execute(String sql, Object... params);

  void commit();

  void rollback();
}
