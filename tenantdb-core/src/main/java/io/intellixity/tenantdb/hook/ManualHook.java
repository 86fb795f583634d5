package io.intellixity.tenantdb.hook;

import io.intellixity.tenantdb.session.SessionOps;

/**
 * Hook that works through a session of its own (blocking model).
 * <p>
 * The session is committed after the hook returns; throwing rolls it back and fails the request.
 */
@FunctionalInterface
public interface ManualHook {
  void run(SessionOps session, String tenantId) throws Exception;
}
