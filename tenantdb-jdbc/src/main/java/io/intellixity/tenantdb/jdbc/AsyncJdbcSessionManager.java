package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.hook.AsyncManualHook;
import io.intellixity.tenantdb.hook.HookKind;
import io.intellixity.tenantdb.hook.HookRegistry;
import io.intellixity.tenantdb.internal.Stages;
import io.intellixity.tenantdb.jdbc.hook.AsyncHookPipeline;
import io.intellixity.tenantdb.jdbc.session.AsyncJdbcSession;
import io.intellixity.tenantdb.schema.SchemaMaterializer;
import io.intellixity.tenantdb.session.LifecycleListener;
import io.intellixity.tenantdb.session.LifecycleState;
import io.intellixity.tenantdb.session.ProvisioningCancelledException;
import io.intellixity.tenantdb.session.SessionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Non-blocking session manager with the same lifecycle and memoization as {@link JdbcSessionManager}.\n
 *
 * Connection attempts, hook statements and schema DDL run on the supplied executor; the calling thread never
 * blocks. Cancelling the future returned by {@link #getSession(String, String)} stops provisioning before the
 * next hook; requests that joined the same provisioning then fail with
 * {@link ProvisioningCancelledException}.\n
 */
public final class AsyncJdbcSessionManager extends AbstractJdbcSessionManager<AsyncManualHook> {
  private static final Logger log = LoggerFactory.getLogger(AsyncJdbcSessionManager.class);

  private final Executor executor;
  private final AsyncHookPipeline pipeline;

  public AsyncJdbcSessionManager(ConnectionDescriptor descriptor,
                                 HookRegistry<AsyncManualHook> hooks,
                                 SchemaMaterializer<JdbcEngineHandle> materializer,
                                 JdbcEngineFactory engines,
                                 Executor executor) {
    this(descriptor, hooks, materializer, engines, executor, LifecycleListener.NOOP);
  }

  public AsyncJdbcSessionManager(ConnectionDescriptor descriptor,
                                 HookRegistry<AsyncManualHook> hooks,
                                 SchemaMaterializer<JdbcEngineHandle> materializer,
                                 JdbcEngineFactory engines,
                                 Executor executor,
                                 LifecycleListener listener) {
    super(descriptor, hooks, materializer, engines, listener);
    this.executor = Objects.requireNonNull(executor, "executor");
    this.pipeline = new AsyncHookPipeline(this.hooks, executor);
  }

  public CompletableFuture<AsyncJdbcSession> getSession(String database) {
    return getSession(database, null);
  }

  public CompletableFuture<AsyncJdbcSession> getSession(String database, String tenantId) {
    SessionRequest req;
    try {
      req = request(database, tenantId);
    } catch (RuntimeException e) {
      return Stages.failed(e);
    }

    CompletableFuture<AsyncJdbcSession> result = new CompletableFuture<>();
    provision(req, result::isCancelled)
        .thenCompose(engine -> openSession(req, engine))
        .whenComplete((s, err) -> {
          if (err != null) {
            result.completeExceptionally(Stages.unwrap(err));
          } else if (!result.complete(s)) {
            // Caller gave up while the session was opening.
            s.close();
          }
        });
    return result;
  }

  public CompletableFuture<JdbcEngineHandle> getEngine(String database, String tenantId) {
    try {
      return provision(request(database, tenantId), () -> false)
          .handle((engine, err) -> {
            if (err != null) throw new CompletionException(Stages.unwrap(err));
            return engine;
          });
    } catch (RuntimeException e) {
      return Stages.failed(e);
    }
  }

  /** Run {@code work} in a session closed once the returned stage settles, whatever its outcome. */
  public <T> CompletableFuture<T> withSession(String database,
                                              String tenantId,
                                              Function<AsyncJdbcSession, ? extends CompletionStage<T>> work) {
    Objects.requireNonNull(work, "work");
    return getSession(database, tenantId).thenCompose(s ->
        Stages.voidFuture()
            .thenCompose(v -> work.apply(s))
            .handle((value, err) -> s.close().handle((v, closeErr) -> {
              if (err != null) throw new CompletionException(Stages.unwrap(err));
              if (closeErr != null) throw new CompletionException(Stages.unwrap(closeErr));
              return value;
            }))
            .thenCompose(Function.identity()));
  }

  private CompletableFuture<JdbcEngineHandle> provision(SessionRequest req, BooleanSupplier cancelled) {
    listener.onTransition(req.key(), LifecycleState.IDLE);
    if (!descriptor.cacheEngines()) return runLifecycle(req, cancelled);
    return provisioned.getOrComputeAsync(req.key(), k -> runLifecycle(req, cancelled));
  }

  private CompletableFuture<JdbcEngineHandle> runLifecycle(SessionRequest req, BooleanSupplier cancelled) {
    long started = System.nanoTime();
    return step(req, LifecycleState.ENGINE_READY,
        () -> engines.getOrCreateEngineAsync(descriptor, req.resolvedDatabase(), executor))
        .thenCompose(engine ->
            step(req, LifecycleState.PRECREATED,
                () -> pipeline.runPhase(HookKind.Phase.PRECREATE, engine, req, cancelled))
                .thenCompose(v -> step(req, LifecycleState.SCHEMA_READY, () -> {
                  if (cancelled.getAsBoolean()) {
                    return Stages.<Void>failed(
                        new ProvisioningCancelledException(req.resolvedDatabase(), LifecycleState.SCHEMA_READY));
                  }
                  return CompletableFuture.runAsync(() -> materialize(engine, req), executor);
                }))
                .thenCompose(v -> step(req, LifecycleState.POSTCREATED,
                    () -> pipeline.runPhase(HookKind.Phase.POSTCREATE, engine, req, cancelled)))
                .handle((v, err) -> {
                  if (err != null) {
                    if (!descriptor.cacheEngines()) engine.close();
                    throw new CompletionException(Stages.unwrap(err));
                  }
                  log.info("tenantdb.manager op=provisioned db={} tenant={} tookMs={}",
                      req.key(), req.tenantId(), (System.nanoTime() - started) / 1_000_000);
                  return engine;
                }));
  }

  private CompletableFuture<AsyncJdbcSession> openSession(SessionRequest req, JdbcEngineHandle engine) {
    return AsyncJdbcSession.open(engine, executor, () -> onSessionClosed(req, engine))
        .handle((s, err) -> {
          if (err != null) {
            if (!descriptor.cacheEngines()) engine.close();
            throw new CompletionException(failure(req, LifecycleState.SESSION_ACTIVE, Stages.unwrap(err)));
          }
          listener.onTransition(req.key(), LifecycleState.SESSION_ACTIVE);
          return s;
        });
  }

  /** Async form of {@link #transition}: the listener hears about the outcome once the stage settles. */
  private <T> CompletableFuture<T> step(SessionRequest req,
                                        LifecycleState state,
                                        Supplier<? extends CompletionStage<T>> work) {
    return Stages.voidFuture()
        .thenCompose(v -> work.get())
        .handle((value, err) -> {
          if (err != null) throw new CompletionException(failure(req, state, Stages.unwrap(err)));
          listener.onTransition(req.key(), state);
          return value;
        });
  }
}
