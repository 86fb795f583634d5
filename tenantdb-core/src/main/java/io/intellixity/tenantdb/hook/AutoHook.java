package io.intellixity.tenantdb.hook;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Hook that produces SQL for a tenant; the statements run verbatim, in order, as one transaction.
 * <p>
 * Returning null or an empty list is valid and runs nothing.
 */
@FunctionalInterface
public interface AutoHook {
  List<String> statements(String tenantId);

  /** Adapt a hook that yields one statement (or null for none). */
  static AutoHook single(Function<String, String> statement) {
    Objects.requireNonNull(statement, "statement");
    return tenantId -> {
      String sql = statement.apply(tenantId);
      return (sql == null || sql.isBlank()) ? List.of() : List.of(sql);
    };
  }

  /** Tenant-independent fixed statements. */
  static AutoHook of(String... statements) {
    List<String> fixed = List.of(statements);
    return tenantId -> fixed;
  }
}
