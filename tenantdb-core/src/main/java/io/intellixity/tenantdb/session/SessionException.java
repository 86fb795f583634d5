package io.intellixity.tenantdb.session;

import io.intellixity.tenantdb.TenantDbException;

/** Session misuse after close, or a failed statement/commit/rollback on an active session. */
public final class SessionException extends TenantDbException {
  public SessionException(String message) {
    super(message, LifecycleState.SESSION_ACTIVE);
  }

  public SessionException(String message, Throwable cause) {
    super(message, LifecycleState.SESSION_ACTIVE, cause);
  }

  public SessionException(String message, LifecycleState state, Throwable cause) {
    super(message, state, cause);
  }
}
