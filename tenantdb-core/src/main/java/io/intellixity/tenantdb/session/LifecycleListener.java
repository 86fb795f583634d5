package io.intellixity.tenantdb.session;

import io.intellixity.tenantdb.engine.EngineKey;

/** Observer of orchestration progress. Callbacks run on the thread that performs the transition. */
public interface LifecycleListener {
  LifecycleListener NOOP = new LifecycleListener() {};

  default void onTransition(EngineKey key, LifecycleState state) {}

  /** {@code failedIn} is the state the request was trying to reach. */
  default void onFailure(EngineKey key, LifecycleState failedIn, Throwable error) {}
}
