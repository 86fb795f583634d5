package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.TenantDbException;
import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.engine.DatabaseConnectionException;
import io.intellixity.tenantdb.engine.EngineKey;
import io.intellixity.tenantdb.hook.AutoHook;
import io.intellixity.tenantdb.hook.HookRegistry;
import io.intellixity.tenantdb.internal.SingleFlightCache;
import io.intellixity.tenantdb.schema.SchemaException;
import io.intellixity.tenantdb.schema.SchemaMaterializer;
import io.intellixity.tenantdb.session.LifecycleListener;
import io.intellixity.tenantdb.session.LifecycleState;
import io.intellixity.tenantdb.session.SessionException;
import io.intellixity.tenantdb.session.SessionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Shared plumbing of the blocking and async session managers: name resolution, hook registration,
 * provisioning memo and lifecycle transitions.\n
 *
 * A resolved database is provisioned (engine, precreate hooks, schema, postcreate hooks) once per manager;
 * later requests only open a session. A failed provisioning is not remembered, so the next request retries it.\n
 *
 * @param <M> manual hook type
 */
public abstract class AbstractJdbcSessionManager<M> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AbstractJdbcSessionManager.class);

  protected final ConnectionDescriptor descriptor;
  protected final HookRegistry<M> hooks;
  protected final SchemaMaterializer<JdbcEngineHandle> materializer;
  protected final JdbcEngineFactory engines;
  protected final LifecycleListener listener;
  protected final SingleFlightCache<EngineKey, JdbcEngineHandle> provisioned = new SingleFlightCache<>();

  protected AbstractJdbcSessionManager(ConnectionDescriptor descriptor,
                                       HookRegistry<M> hooks,
                                       SchemaMaterializer<JdbcEngineHandle> materializer,
                                       JdbcEngineFactory engines,
                                       LifecycleListener listener) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.hooks = Objects.requireNonNull(hooks, "hooks");
    this.materializer = (materializer == null) ? SchemaMaterializer.none() : materializer;
    this.engines = Objects.requireNonNull(engines, "engines");
    this.listener = (listener == null) ? LifecycleListener.NOOP : listener;
  }

  public ConnectionDescriptor descriptor() { return descriptor; }
  public HookRegistry<M> hooks() { return hooks; }

  public AutoHook registerPrecreate(String database, AutoHook hook) {
    return hooks.registerPrecreate(database, hook);
  }

  public AutoHook registerPrecreate(Collection<String> databases, AutoHook hook) {
    return hooks.registerPrecreate(databases, hook);
  }

  public M registerPrecreateManual(String database, M hook) {
    return hooks.registerPrecreateManual(database, hook);
  }

  public M registerPrecreateManual(Collection<String> databases, M hook) {
    return hooks.registerPrecreateManual(databases, hook);
  }

  public AutoHook registerPostcreate(String database, AutoHook hook) {
    return hooks.registerPostcreate(database, hook);
  }

  public AutoHook registerPostcreate(Collection<String> databases, AutoHook hook) {
    return hooks.registerPostcreate(databases, hook);
  }

  public M registerPostcreateManual(String database, M hook) {
    return hooks.registerPostcreateManual(database, hook);
  }

  public M registerPostcreateManual(Collection<String> databases, M hook) {
    return hooks.registerPostcreateManual(databases, hook);
  }

  /**
   * Forget the provisioning of one resolved database and dispose its engine. The next request provisions
   * again (hooks included).
   */
  public boolean evict(String database, String tenantId) {
    SessionRequest req = SessionRequest.resolve(descriptor, database, tenantId);
    boolean wasProvisioned = provisioned.remove(req.key()).isPresent();
    boolean hadEngine = engines.evict(req.key());
    log.info("tenantdb.manager op=evict db={} provisioned={} engine={}", req.key(), wasProvisioned, hadEngine);
    return wasProvisioned || hadEngine;
  }

  /** Dispose every cached engine. Sessions already handed out keep working until their connections fail. */
  @Override
  public void close() {
    provisioned.clear();
    engines.close();
    log.info("tenantdb.manager op=closed target={}", descriptor.target());
  }

  protected SessionRequest request(String database, String tenantId) {
    return SessionRequest.resolve(descriptor, database, tenantId);
  }

  /** Run one lifecycle step; success reports {@code state}, failure reports it as the state being reached. */
  protected <T> T transition(SessionRequest req, LifecycleState state, Supplier<T> step) {
    T value;
    try {
      value = step.get();
    } catch (RuntimeException e) {
      throw failure(req, state, e);
    }
    listener.onTransition(req.key(), state);
    return value;
  }

  protected void materialize(JdbcEngineHandle engine, SessionRequest req) {
    materializer.materialize(engine, req.database());
  }

  /** Typed error for a failed step, reported to the listener. */
  protected RuntimeException failure(SessionRequest req, LifecycleState state, Throwable error) {
    RuntimeException typed = typed(req, state, error);
    log.warn("tenantdb.manager op=failed db={} tenant={} state={} error={}",
        req.key(), req.tenantId(), state, typed.toString());
    listener.onFailure(req.key(), state, typed);
    return typed;
  }

  private static RuntimeException typed(SessionRequest req, LifecycleState state, Throwable error) {
    if (error instanceof TenantDbException tde) return tde;
    return switch (state) {
      case ENGINE_READY -> new DatabaseConnectionException(req.key(), 1, false, error);
      case SCHEMA_READY -> new SchemaException(
          "Schema materialization failed for " + req.key() + ": " + error.getMessage(), error);
      default -> new SessionException("Provisioning failed for " + req.key() + " in state " + state, state, error);
    };
  }

  protected void onSessionClosed(SessionRequest req, JdbcEngineHandle engine) {
    listener.onTransition(req.key(), LifecycleState.CLOSED);
    if (!descriptor.cacheEngines()) engine.close();
  }
}
