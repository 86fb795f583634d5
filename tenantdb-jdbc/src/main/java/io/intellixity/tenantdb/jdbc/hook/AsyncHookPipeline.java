package io.intellixity.tenantdb.jdbc.hook;

import io.intellixity.tenantdb.hook.AsyncManualHook;
import io.intellixity.tenantdb.hook.AutoHook;
import io.intellixity.tenantdb.hook.HookEntry;
import io.intellixity.tenantdb.hook.HookExecutionException;
import io.intellixity.tenantdb.hook.HookKind;
import io.intellixity.tenantdb.hook.HookRegistry;
import io.intellixity.tenantdb.internal.Stages;
import io.intellixity.tenantdb.jdbc.JdbcEngineHandle;
import io.intellixity.tenantdb.jdbc.session.AsyncJdbcSession;
import io.intellixity.tenantdb.session.ProvisioningCancelledException;
import io.intellixity.tenantdb.session.SessionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Non-blocking counterpart of {@link HookPipeline}: same ordering and transaction rules, with statement work
 * dispatched to the executor. The {@code cancelled} probe is consulted on entry and before
 * each hook.
 */
public final class AsyncHookPipeline {
  private static final Logger log = LoggerFactory.getLogger(AsyncHookPipeline.class);

  private final HookRegistry<AsyncManualHook> registry;
  private final Executor executor;

  public AsyncHookPipeline(HookRegistry<AsyncManualHook> registry, Executor executor) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public CompletableFuture<Void> runPhase(HookKind.Phase phase,
                                          JdbcEngineHandle engine,
                                          SessionRequest request,
                                          BooleanSupplier cancelled) {
    if (cancelled.getAsBoolean()) return cancelledIn(phase, request);
    HookKind autoKind = phase.autoKind();
    HookKind manualKind = phase.manualKind();
    List<HookEntry<AutoHook>> autos = registry.autoHooks(autoKind, request.database(), request.resolvedDatabase());
    List<HookEntry<AsyncManualHook>> manuals =
        registry.manualHooks(manualKind, request.database(), request.resolvedDatabase());

    return Stages.loop(autos, (e, i) -> {
          if (cancelled.getAsBoolean()) return cancelledIn(phase, request);
          CompletableFuture<Void> run = CompletableFuture.runAsync(() -> {
            try {
              StatementBatch.execute(engine, e.hook().statements(request.tenantId()));
            } catch (SQLException ex) {
              throw new CompletionException(ex);
            }
          }, executor);
          return guard(run, autoKind, e, i + 1, request);
        })
        .thenCompose(v -> Stages.loop(manuals, (e, i) -> {
          if (cancelled.getAsBoolean()) return cancelledIn(phase, request);
          return guard(runManual(e.hook(), engine, request), manualKind, e, i + 1, request);
        }))
        .thenRun(() -> {
          if (!autos.isEmpty() || !manuals.isEmpty()) {
            log.info("tenantdb.hooks phase={} db={} tenant={} auto={} manual={}",
                phase, request.key(), request.tenantId(), autos.size(), manuals.size());
          }
        });
  }

  /** Fresh session per hook: run, commit, then close (close rolls back whatever did not commit). */
  private CompletableFuture<Void> runManual(AsyncManualHook hook, JdbcEngineHandle engine, SessionRequest request) {
    return AsyncJdbcSession.open(engine, executor, null).thenCompose(s ->
        Stages.voidFuture()
            .thenCompose(v -> {
              CompletionStage<Void> stage = hook.run(s, request.tenantId());
              return stage == null ? Stages.voidFuture() : stage;
            })
            .thenCompose(v -> s.commit())
            .handle((v, err) -> err)
            .thenCompose(err -> s.close().handle((v, closeErr) -> {
              if (err != null) throw new CompletionException(Stages.unwrap(err));
              if (closeErr != null) throw new CompletionException(Stages.unwrap(closeErr));
              return (Void) null;
            })));
  }

  private static CompletableFuture<Void> guard(CompletableFuture<Void> run,
                                               HookKind kind,
                                               HookEntry<?> entry,
                                               int ordinal,
                                               SessionRequest request) {
    return run.handle((v, err) -> {
      if (err == null) return v;
      Throwable cause = Stages.unwrap(err);
      if (cause instanceof ProvisioningCancelledException) throw new CompletionException(cause);
      log.error("tenantdb.hooks op=failed kind={} db={} ordinal={} tenant={} error={}",
          kind, entry.databaseName(), ordinal, request.tenantId(), cause.toString());
      throw new HookExecutionException(kind, entry.databaseName(), ordinal, cause);
    });
  }

  private static CompletableFuture<Void> cancelledIn(HookKind.Phase phase, SessionRequest request) {
    return Stages.failed(new ProvisioningCancelledException(request.resolvedDatabase(), phase.state()));
  }
}
