package io.intellixity.tenantdb.session;

import java.util.List;
import java.util.Map;

/**
 * Caller-scoped session bound to a provisioned engine.\n
 *
 * Closing rolls back uncommitted work and releases the connection; the engine itself stays cached.\n
 */
public interface Session extends SessionOps, AutoCloseable {
  /** Rows as column-label to value maps, in result order. */
  List<Map<String, Object>> query(String sql, Object... params);

  boolean isOpen();

  @Override
  void close();
}
