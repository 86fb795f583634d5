package io.intellixity.tenantdb.hook;

import io.intellixity.tenantdb.TenantDbException;

/**
 * A hook failed. Identifies the hook by kind, database and 1-based position among the hooks of that kind
 * that ran for the request. Earlier hooks are not rolled back.
 */
public final class HookExecutionException extends TenantDbException {
  private final HookKind kind;
  private final String databaseName;
  private final int ordinal;

  public HookExecutionException(HookKind kind, String databaseName, int ordinal, Throwable cause) {
    super("Hook " + kind + " #" + ordinal + " failed for database '" + databaseName + "'"
            + (cause == null ? "" : ": " + cause.getMessage()),
        kind.phase().state(), cause);
    this.kind = kind;
    this.databaseName = databaseName;
    this.ordinal = ordinal;
  }

  public HookKind kind() { return kind; }
  public String databaseName() { return databaseName; }
  public int ordinal() { return ordinal; }
}
