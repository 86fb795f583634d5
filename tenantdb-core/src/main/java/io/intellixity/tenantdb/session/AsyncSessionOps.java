package io.intellixity.tenantdb.session;

import java.util.concurrent.CompletionStage;

/** Non-blocking counterpart of {@link SessionOps}; each call is a suspension point. */
public interface AsyncSessionOps {
  CompletionStage<Integer> execute(String sql, Object... params);

  CompletionStage<Void> commit();

  CompletionStage<Void> rollback();
}
