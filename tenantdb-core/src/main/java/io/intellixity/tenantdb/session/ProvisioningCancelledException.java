package io.intellixity.tenantdb.session;

import io.intellixity.tenantdb.TenantDbException;

/**
 * The caller cancelled (or interrupted) a request while hooks were running.
 * <p>
 * Hooks that finished before the cancellation stay committed.
 */
public final class ProvisioningCancelledException extends TenantDbException {
  public ProvisioningCancelledException(String databaseName, LifecycleState state) {
    super("Provisioning of " + databaseName + " cancelled in state " + state, state);
  }
}
