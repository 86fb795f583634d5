package io.intellixity.tenantdb.session;

/**
 * States a session request moves through, strictly in declaration order.
 * <p>
 * ENGINE_READY to POSTCREATED happen once per resolved database while its engine stays cached; later
 * requests for the same database go straight to {@link #SESSION_ACTIVE}.
 */
public enum LifecycleState {
  IDLE,
  ENGINE_READY,
  PRECREATED,
  SCHEMA_READY,
  POSTCREATED,
  SESSION_ACTIVE,
  CLOSED
}
