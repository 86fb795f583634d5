package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.hook.HookKind;
import io.intellixity.tenantdb.hook.HookRegistry;
import io.intellixity.tenantdb.hook.ManualHook;
import io.intellixity.tenantdb.jdbc.hook.HookPipeline;
import io.intellixity.tenantdb.jdbc.session.JdbcSession;
import io.intellixity.tenantdb.schema.SchemaMaterializer;
import io.intellixity.tenantdb.session.LifecycleListener;
import io.intellixity.tenantdb.session.LifecycleState;
import io.intellixity.tenantdb.session.ProvisioningCancelledException;
import io.intellixity.tenantdb.session.SessionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Blocking session manager.\n
 *
 * {@code getSession(db, tenant)} walks IDLE -> ENGINE_READY -> PRECREATED -> SCHEMA_READY -> POSTCREATED ->
 * SESSION_ACTIVE. Provisioning runs on the calling thread; concurrent first requests for one resolved database
 * wait for a single provisioning run. Interrupting the provisioning thread cancels it before the next hook.\n
 *
 * Example:
 * <pre>{@code
 * JdbcSessionManager sessions = new JdbcSessionManager(descriptor, HookRegistry.blocking(), schema, engines);
 * sessions.registerPrecreate("billing", AutoHook.of("CREATE EXTENSION IF NOT EXISTS pgcrypto"));
 * try (JdbcSession s = sessions.getSession("billing", "acme")) {
 *   s.execute("INSERT INTO invoices(id) VALUES (?)", 1);
 *   s.commit();
 * }
 * }</pre>
 */
public final class JdbcSessionManager extends AbstractJdbcSessionManager<ManualHook> {
  private static final Logger log = LoggerFactory.getLogger(JdbcSessionManager.class);

  private final HookPipeline pipeline;

  public JdbcSessionManager(ConnectionDescriptor descriptor,
                            HookRegistry<ManualHook> hooks,
                            SchemaMaterializer<JdbcEngineHandle> materializer,
                            JdbcEngineFactory engines) {
    this(descriptor, hooks, materializer, engines, LifecycleListener.NOOP);
  }

  public JdbcSessionManager(ConnectionDescriptor descriptor,
                            HookRegistry<ManualHook> hooks,
                            SchemaMaterializer<JdbcEngineHandle> materializer,
                            JdbcEngineFactory engines,
                            LifecycleListener listener) {
    super(descriptor, hooks, materializer, engines, listener);
    this.pipeline = new HookPipeline(this.hooks);
  }

  public JdbcSession getSession(String database) {
    return getSession(database, null);
  }

  /** Session on the tenant's database; the caller owns it and must close it. */
  public JdbcSession getSession(String database, String tenantId) {
    SessionRequest req = request(database, tenantId);
    JdbcEngineHandle engine = provision(req);
    try {
      JdbcSession s = JdbcSession.open(engine, () -> onSessionClosed(req, engine));
      listener.onTransition(req.key(), LifecycleState.SESSION_ACTIVE);
      log.debug("tenantdb.manager op=session db={} tenant={}", req.key(), req.tenantId());
      return s;
    } catch (RuntimeException e) {
      if (!descriptor.cacheEngines()) engine.close();
      throw failure(req, LifecycleState.SESSION_ACTIVE, e);
    }
  }

  /**
   * Provisioned engine for the tenant's database. With engine caching disabled the returned engine is fresh and
   * owned by the caller.
   */
  public JdbcEngineHandle getEngine(String database, String tenantId) {
    return provision(request(database, tenantId));
  }

  /** Run {@code work} in a session that is closed afterwards, also when {@code work} throws. */
  public <T> T withSession(String database, String tenantId, Function<JdbcSession, T> work) {
    Objects.requireNonNull(work, "work");
    try (JdbcSession s = getSession(database, tenantId)) {
      return work.apply(s);
    }
  }

  private JdbcEngineHandle provision(SessionRequest req) {
    listener.onTransition(req.key(), LifecycleState.IDLE);
    if (!descriptor.cacheEngines()) return runLifecycle(req);
    return provisioned.getOrCompute(req.key(), k -> runLifecycle(req),
        () -> failure(req, LifecycleState.ENGINE_READY,
            new ProvisioningCancelledException(req.resolvedDatabase(), LifecycleState.ENGINE_READY)));
  }

  private JdbcEngineHandle runLifecycle(SessionRequest req) {
    long started = System.nanoTime();
    JdbcEngineHandle engine = transition(req, LifecycleState.ENGINE_READY,
        () -> engines.getOrCreateEngine(descriptor, req.resolvedDatabase()));
    try {
      transition(req, LifecycleState.PRECREATED, () -> {
        pipeline.runPhase(HookKind.Phase.PRECREATE, engine, req);
        return null;
      });
      transition(req, LifecycleState.SCHEMA_READY, () -> {
        checkInterrupted(req, LifecycleState.SCHEMA_READY);
        materialize(engine, req);
        return null;
      });
      transition(req, LifecycleState.POSTCREATED, () -> {
        pipeline.runPhase(HookKind.Phase.POSTCREATE, engine, req);
        return null;
      });
    } catch (RuntimeException e) {
      if (!descriptor.cacheEngines()) engine.close();
      throw e;
    }
    log.info("tenantdb.manager op=provisioned db={} tenant={} tookMs={}",
        req.key(), req.tenantId(), (System.nanoTime() - started) / 1_000_000);
    return engine;
  }

  private static void checkInterrupted(SessionRequest req, LifecycleState state) {
    if (Thread.currentThread().isInterrupted()) {
      throw new ProvisioningCancelledException(req.resolvedDatabase(), state);
    }
  }
}
