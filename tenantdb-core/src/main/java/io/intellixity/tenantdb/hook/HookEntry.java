package io.intellixity.tenantdb.hook;

import java.util.Objects;

/** One registered hook. {@code hook} is an {@link AutoHook} for auto kinds, the manual hook type otherwise. */
public record HookEntry<T>(HookKind kind, String databaseName, T hook) {
  public HookEntry {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(databaseName, "databaseName");
    Objects.requireNonNull(hook, "hook");
  }
}
