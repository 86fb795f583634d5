package io.intellixity.tenantdb.jdbc.schema;

import java.util.Objects;

/**
 * A table a logical database must contain, with the DDL that creates it.
 * Presence is decided by name only; existing tables are never altered.
 */
public record TableDeclaration(String name, String createDdl) {
  public TableDeclaration {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(createDdl, "createDdl");
    if (name.isBlank()) throw new IllegalArgumentException("table name is blank");
    if (createDdl.isBlank()) throw new IllegalArgumentException("createDdl is blank for " + name);
  }

  public static TableDeclaration of(String name, String createDdl) {
    return new TableDeclaration(name, createDdl);
  }
}
