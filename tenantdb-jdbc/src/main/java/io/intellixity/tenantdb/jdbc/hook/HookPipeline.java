package io.intellixity.tenantdb.jdbc.hook;

import io.intellixity.tenantdb.hook.AutoHook;
import io.intellixity.tenantdb.hook.HookEntry;
import io.intellixity.tenantdb.hook.HookExecutionException;
import io.intellixity.tenantdb.hook.HookKind;
import io.intellixity.tenantdb.hook.HookRegistry;
import io.intellixity.tenantdb.hook.ManualHook;
import io.intellixity.tenantdb.jdbc.JdbcEngineHandle;
import io.intellixity.tenantdb.jdbc.session.JdbcSession;
import io.intellixity.tenantdb.session.ProvisioningCancelledException;
import io.intellixity.tenantdb.session.SessionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Blocking hook runner for one phase.\n
 *
 * Auto hooks run first, then manual hooks, each in registration order (logical-name registrations before
 * resolved-name ones). Every hook gets its own transaction and commits before the next one starts, so a
 * failure leaves the effects of earlier hooks in place.\n
 *
 * Thread interruption is checked on entry and before each hook, and aborts the phase.\n
 */
public final class HookPipeline {
  private static final Logger log = LoggerFactory.getLogger(HookPipeline.class);

  private final HookRegistry<ManualHook> registry;

  public HookPipeline(HookRegistry<ManualHook> registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public void runPhase(HookKind.Phase phase, JdbcEngineHandle engine, SessionRequest request) {
    checkInterrupted(phase, request);
    HookKind autoKind = phase.autoKind();
    List<HookEntry<AutoHook>> autos = registry.autoHooks(autoKind, request.database(), request.resolvedDatabase());
    for (int i = 0; i < autos.size(); i++) {
      checkInterrupted(phase, request);
      HookEntry<AutoHook> e = autos.get(i);
      try {
        StatementBatch.execute(engine, e.hook().statements(request.tenantId()));
      } catch (Exception ex) {
        throw failed(autoKind, e, i + 1, request, ex);
      }
    }

    HookKind manualKind = phase.manualKind();
    List<HookEntry<ManualHook>> manuals = registry.manualHooks(manualKind, request.database(), request.resolvedDatabase());
    for (int i = 0; i < manuals.size(); i++) {
      checkInterrupted(phase, request);
      HookEntry<ManualHook> e = manuals.get(i);
      try (JdbcSession s = JdbcSession.open(engine)) {
        e.hook().run(s, request.tenantId());
        s.commit();
      } catch (Exception ex) {
        throw failed(manualKind, e, i + 1, request, ex);
      }
    }

    if (!autos.isEmpty() || !manuals.isEmpty()) {
      log.info("tenantdb.hooks phase={} db={} tenant={} auto={} manual={}",
          phase, request.key(), request.tenantId(), autos.size(), manuals.size());
    }
  }

  private static void checkInterrupted(HookKind.Phase phase, SessionRequest request) {
    if (Thread.currentThread().isInterrupted()) {
      throw new ProvisioningCancelledException(request.resolvedDatabase(), phase.state());
    }
  }

  private static RuntimeException failed(HookKind kind, HookEntry<?> entry, int ordinal, SessionRequest request, Exception ex) {
    if (ex instanceof ProvisioningCancelledException pce) return pce;
    log.error("tenantdb.hooks op=failed kind={} db={} ordinal={} tenant={} error={}",
        kind, entry.databaseName(), ordinal, request.tenantId(), ex.toString());
    return new HookExecutionException(kind, entry.databaseName(), ordinal, ex);
  }
}
