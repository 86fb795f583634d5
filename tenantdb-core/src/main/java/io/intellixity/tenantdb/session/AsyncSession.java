package io.intellixity.tenantdb.session;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/** Non-blocking counterpart of {@link Session}. Operations must be chained, not issued concurrently. */
public interface AsyncSession extends AsyncSessionOps {
  CompletionStage<List<Map<String, Object>>> query(String sql, Object... params);

  boolean isOpen();

  CompletionStage<Void> close();
}
