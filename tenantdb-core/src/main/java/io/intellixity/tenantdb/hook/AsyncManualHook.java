package io.intellixity.tenantdb.hook;

import io.intellixity.tenantdb.session.AsyncSessionOps;

import java.util.concurrent.CompletionStage;

/** Non-blocking counterpart of {@link ManualHook}; a failed stage fails the request. */
@FunctionalInterface
public interface AsyncManualHook {
  CompletionStage<Void> run(AsyncSessionOps session, String tenantId);
}
