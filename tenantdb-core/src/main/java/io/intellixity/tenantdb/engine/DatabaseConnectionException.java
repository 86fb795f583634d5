package io.intellixity.tenantdb.engine;

import io.intellixity.tenantdb.TenantDbException;
import io.intellixity.tenantdb.session.LifecycleState;

/**
 * No engine could be established for a database.
 * <p>
 * {@link #attempts()} counts the connection attempts made; {@link #transientFailure()} tells whether the last
 * failure was retryable (true means retries were exhausted, false means the sequence aborted early).
 */
public final class DatabaseConnectionException extends TenantDbException {
  private final EngineKey key;
  private final int attempts;
  private final boolean transientFailure;

  public DatabaseConnectionException(EngineKey key, int attempts, boolean transientFailure, Throwable cause) {
    super(message(key, attempts, transientFailure, cause), LifecycleState.ENGINE_READY, cause);
    this.key = key;
    this.attempts = attempts;
    this.transientFailure = transientFailure;
  }

  public EngineKey key() { return key; }
  public int attempts() { return attempts; }
  public boolean transientFailure() { return transientFailure; }

  private static String message(EngineKey key, int attempts, boolean transientFailure, Throwable cause) {
    String reason = transientFailure ? "retries exhausted" : "non-transient failure";
    String detail = cause == null ? "" : ": " + cause.getMessage();
    return "Could not connect to " + key + " after " + attempts + " attempt(s), " + reason + detail;
  }
}
