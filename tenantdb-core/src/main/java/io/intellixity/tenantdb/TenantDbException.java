package io.intellixity.tenantdb;

import io.intellixity.tenantdb.session.LifecycleState;

/**
 * Root of the tenantdb error taxonomy.
 * <p>
 * {@link #state()} names the lifecycle state a session request failed in, so callers can tell whether
 * hooks already committed work that needs manual cleanup. It is null for errors raised outside a request
 * (for example while building a descriptor).
 */
public abstract class TenantDbException extends RuntimeException {
  private final LifecycleState state;

  protected TenantDbException(String message, LifecycleState state) {
    super(message);
    this.state = state;
  }

  protected TenantDbException(String message, LifecycleState state, Throwable cause) {
    super(message, cause);
    this.state = state;
  }

  public LifecycleState state() {
    return state;
  }
}
