package io.intellixity.tenantdb.jdbc.session;

import io.intellixity.tenantdb.jdbc.JdbcEngineHandle;
import io.intellixity.tenantdb.session.AsyncSession;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Non-blocking facade over a {@link JdbcSession}: every call is dispatched to the executor and the caller
 * continues from the returned stage.
 */
public final class AsyncJdbcSession implements AsyncSession {
  private final JdbcSession delegate;
  private final Executor executor;

  private AsyncJdbcSession(JdbcSession delegate, Executor executor) {
    this.delegate = delegate;
    this.executor = executor;
  }

  public static CompletableFuture<AsyncJdbcSession> open(JdbcEngineHandle engine, Executor executor, Runnable onClose) {
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(() -> new AsyncJdbcSession(JdbcSession.open(engine, onClose), executor), executor);
  }

  public JdbcEngineHandle engine() {
    return delegate.engine();
  }

  @Override
  public CompletableFuture<Integer> execute(String sql, Object... params) {
    return CompletableFuture.supplyAsync(() -> delegate.execute(sql, params), executor);
  }

  @Override
  public CompletableFuture<List<Map<String, Object>>> query(String sql, Object... params) {
    return CompletableFuture.supplyAsync(() -> delegate.query(sql, params), executor);
  }

  @Override
  public CompletableFuture<Void> commit() {
    return CompletableFuture.runAsync(delegate::commit, executor);
  }

  @Override
  public CompletableFuture<Void> rollback() {
    return CompletableFuture.runAsync(delegate::rollback, executor);
  }

  @Override
  public boolean isOpen() {
    return delegate.isOpen();
  }

  @Override
  public CompletableFuture<Void> close() {
    return CompletableFuture.runAsync(delegate::close, executor);
  }
}
