package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.hook.AsyncManualHook;
import io.intellixity.tenantdb.hook.AutoHook;
import io.intellixity.tenantdb.hook.HookKind;
import io.intellixity.tenantdb.hook.HookRegistry;
import io.intellixity.tenantdb.hook.ManualHook;
import io.intellixity.tenantdb.internal.Stages;
import io.intellixity.tenantdb.jdbc.session.AsyncJdbcSession;
import io.intellixity.tenantdb.jdbc.session.JdbcSession;
import io.intellixity.tenantdb.schema.SchemaMaterializer;
import io.intellixity.tenantdb.session.LifecycleListener;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/** Drives either session manager through one blocking-style surface so a test body runs against both. */
final class ManagerHarness implements AutoCloseable {
  /** Session view used by tests. */
  interface TestSession extends AutoCloseable {
    int execute(String sql, Object... params);
    List<Map<String, Object>> query(String sql, Object... params);
    void commit();
    boolean isOpen();
    @Override void close();
  }

  private final ExecutionModel model;
  private final JdbcSessionManager blocking;
  private final AsyncJdbcSessionManager async;
  private final ExecutorService executor;

  private ManagerHarness(ExecutionModel model,
                         JdbcSessionManager blocking,
                         AsyncJdbcSessionManager async,
                         ExecutorService executor) {
    this.model = model;
    this.blocking = blocking;
    this.async = async;
    this.executor = executor;
  }

  static ManagerHarness create(ExecutionModel model,
                               ConnectionDescriptor descriptor,
                               JdbcEngineFactory engines,
                               SchemaMaterializer<JdbcEngineHandle> schema,
                               LifecycleListener listener) {
    if (model == ExecutionModel.BLOCKING) {
      return new ManagerHarness(model,
          new JdbcSessionManager(descriptor, HookRegistry.blocking(), schema, engines, listener), null, null);
    }
    ExecutorService executor = Executors.newFixedThreadPool(4);
    return new ManagerHarness(model, null,
        new AsyncJdbcSessionManager(descriptor, HookRegistry.async(), schema, engines, executor, listener), executor);
  }

  ExecutionModel model() { return model; }
  JdbcSessionManager blocking() { return blocking; }
  AsyncJdbcSessionManager async() { return async; }

  void registerPrecreate(String database, AutoHook hook) {
    if (blocking != null) blocking.registerPrecreate(database, hook);
    else async.registerPrecreate(database, hook);
  }

  void registerPostcreate(String database, AutoHook hook) {
    if (blocking != null) blocking.registerPostcreate(database, hook);
    else async.registerPostcreate(database, hook);
  }

  /** Manual hook executing {@code sql} with the tenant id bound to its single parameter. */
  void registerManual(HookKind.Phase phase, String database, String sql) {
    if (blocking != null) {
      ManualHook h = (s, tenant) -> s.execute(sql, tenant);
      if (phase == HookKind.Phase.PRECREATE) blocking.registerPrecreateManual(database, h);
      else blocking.registerPostcreateManual(database, h);
    } else {
      AsyncManualHook h = (s, tenant) -> s.execute(sql, tenant).thenApply(n -> null);
      if (phase == HookKind.Phase.PRECREATE) async.registerPrecreateManual(database, h);
      else async.registerPostcreateManual(database, h);
    }
  }

  void registerFailingManual(HookKind.Phase phase, String database, RuntimeException failure) {
    if (blocking != null) {
      ManualHook h = (s, tenant) -> {
        throw failure;
      };
      if (phase == HookKind.Phase.PRECREATE) blocking.registerPrecreateManual(database, h);
      else blocking.registerPostcreateManual(database, h);
    } else {
      AsyncManualHook h = (s, tenant) -> Stages.failed(failure);
      if (phase == HookKind.Phase.PRECREATE) async.registerPrecreateManual(database, h);
      else async.registerPostcreateManual(database, h);
    }
  }

  TestSession open(String database, String tenantId) {
    if (blocking != null) return wrap(blocking.getSession(database, tenantId));
    return wrap(join(async.getSession(database, tenantId)));
  }

  CompletableFuture<TestSession> openAsync(String database, String tenantId) {
    if (blocking != null) {
      return CompletableFuture.supplyAsync(() -> wrap(blocking.getSession(database, tenantId)));
    }
    return async.getSession(database, tenantId).thenApply(ManagerHarness::wrap);
  }

  JdbcEngineHandle engine(String database, String tenantId) {
    if (blocking != null) return blocking.getEngine(database, tenantId);
    return join(async.getEngine(database, tenantId));
  }

  <T> T withSession(String database, String tenantId, Function<TestSession, T> work) {
    if (blocking != null) return blocking.withSession(database, tenantId, s -> work.apply(wrap(s)));
    return join(async.withSession(database, tenantId, s -> {
      try {
        return CompletableFuture.completedFuture(work.apply(wrap(s)));
      } catch (RuntimeException e) {
        return Stages.<T>failed(e);
      }
    }));
  }

  boolean evict(String database, String tenantId) {
    return blocking != null ? blocking.evict(database, tenantId) : async.evict(database, tenantId);
  }

  @Override
  public void close() {
    if (blocking != null) blocking.close();
    if (async != null) async.close();
    if (executor != null) executor.shutdownNow();
  }

  /** Join and rethrow the underlying failure, as a blocking caller would see it. */
  static <T> T join(CompletableFuture<T> f) {
    try {
      return f.join();
    } catch (CompletionException e) {
      Throwable cause = Stages.unwrap(e);
      if (cause instanceof RuntimeException re) throw re;
      throw e;
    }
  }

  private static TestSession wrap(JdbcSession s) {
    return new TestSession() {
      @Override public int execute(String sql, Object... params) { return s.execute(sql, params); }
      @Override public List<Map<String, Object>> query(String sql, Object... params) { return s.query(sql, params); }
      @Override public void commit() { s.commit(); }
      @Override public boolean isOpen() { return s.isOpen(); }
      @Override public void close() { s.close(); }
    };
  }

  private static TestSession wrap(AsyncJdbcSession s) {
    return new TestSession() {
      @Override public int execute(String sql, Object... params) { return join(s.execute(sql, params)); }
      @Override public List<Map<String, Object>> query(String sql, Object... params) { return join(s.query(sql, params)); }
      @Override public void commit() { join(s.commit()); }
      @Override public boolean isOpen() { return s.isOpen(); }
      @Override public void close() { join(s.close()); }
    };
  }
}
