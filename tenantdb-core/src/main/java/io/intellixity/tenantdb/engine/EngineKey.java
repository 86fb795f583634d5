package io.intellixity.tenantdb.engine;

import io.intellixity.tenantdb.config.ConnectionDescriptor;

import java.util.Objects;

/** Cache identity of an engine: the resolved database on a given server. */
public record EngineKey(String resolvedDatabase, String target) {
  public EngineKey {
    Objects.requireNonNull(resolvedDatabase, "resolvedDatabase");
    Objects.requireNonNull(target, "target");
  }

  public static EngineKey of(ConnectionDescriptor descriptor, String resolvedDatabase) {
    return new EngineKey(resolvedDatabase, descriptor.target());
  }

  @Override
  public String toString() {
    return target + "/" + resolvedDatabase;
  }
}
