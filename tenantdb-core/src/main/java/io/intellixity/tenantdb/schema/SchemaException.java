package io.intellixity.tenantdb.schema;

import io.intellixity.tenantdb.TenantDbException;
import io.intellixity.tenantdb.session.LifecycleState;

/** Schema materialization failed. */
public final class SchemaException extends TenantDbException {
  public SchemaException(String message) {
    super(message, LifecycleState.SCHEMA_READY);
  }

  public SchemaException(String message, Throwable cause) {
    super(message, LifecycleState.SCHEMA_READY, cause);
  }
}
