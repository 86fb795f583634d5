package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.engine.DatabaseConnectionException;
import io.intellixity.tenantdb.engine.EngineKey;
import io.intellixity.tenantdb.hook.AutoHook;
import io.intellixity.tenantdb.hook.HookExecutionException;
import io.intellixity.tenantdb.hook.HookKind;
import io.intellixity.tenantdb.jdbc.ManagerHarness.TestSession;
import io.intellixity.tenantdb.jdbc.schema.DeclaredSchemaMaterializer;
import io.intellixity.tenantdb.jdbc.schema.TableDeclaration;
import io.intellixity.tenantdb.retry.Sleeper;
import io.intellixity.tenantdb.schema.SchemaException;
import io.intellixity.tenantdb.schema.SchemaMaterializer;
import io.intellixity.tenantdb.session.LifecycleListener;
import io.intellixity.tenantdb.session.LifecycleState;
import io.intellixity.tenantdb.session.ProvisioningCancelledException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/** Lifecycle guarantees shared by the blocking and the async session manager. */
final class SessionManagerContractTest {
  private final H2 h2 = new H2();

  private ManagerHarness harness(ExecutionModel model, SchemaMaterializer<JdbcEngineHandle> schema, LifecycleListener listener) {
    return harness(model, h2.descriptor().build(), new JdbcEngineFactory(h2.urls()), schema, listener);
  }

  private ManagerHarness harness(ExecutionModel model,
                                 ConnectionDescriptor d,
                                 JdbcEngineFactory engines,
                                 SchemaMaterializer<JdbcEngineHandle> schema,
                                 LifecycleListener listener) {
    return ManagerHarness.create(model, d, engines, schema, listener);
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void sessionWithoutHooksReachesActive(ExecutionModel model) {
    List<LifecycleState> states = new CopyOnWriteArrayList<>();
    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), recording(states))) {
      try (TestSession s = m.open("plain", null)) {
        assertTrue(s.isOpen());
        assertEquals(1, s.query("SELECT 1 AS ONE").size());
      }
      assertEquals(List.of(
          LifecycleState.IDLE,
          LifecycleState.ENGINE_READY,
          LifecycleState.PRECREATED,
          LifecycleState.SCHEMA_READY,
          LifecycleState.POSTCREATED,
          LifecycleState.SESSION_ACTIVE,
          LifecycleState.CLOSED), states);
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void earlierAutoHookIsCommittedBeforeTheNextStarts(ExecutionModel model) throws Exception {
    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), LifecycleListener.NOOP)) {
      m.registerPrecreate("orders", AutoHook.of("CREATE TABLE dep(id INT)"));
      m.registerPrecreate("orders", AutoHook.single(t -> "INSERT INTO dep(id) VALUES (1)"));
      m.open("orders", "t1").close();
      assertEquals(List.of("1"), h2.strings("t1__orders", "SELECT id FROM dep"));
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void concurrentFirstRequestsShareOneConnectionSequence(ExecutionModel model) {
    AtomicInteger creates = new AtomicInteger();
    DataSourceFactory slow = (d, url, pool) -> {
      creates.incrementAndGet();
      pause(200);
      return JdbcDataSources.INSTANCE.create(d, url, pool);
    };
    JdbcEngineFactory engines =
        new JdbcEngineFactory(h2.urls(), slow, DatabaseProvisioner.NONE, new SqlStateFailureClassifier(), Sleeper.THREAD);
    AtomicInteger hookRuns = new AtomicInteger();
    try (ManagerHarness m = harness(model, h2.descriptor().build(), engines, SchemaMaterializer.none(), LifecycleListener.NOOP)) {
      m.registerPrecreate("orders", tenant -> {
        hookRuns.incrementAndGet();
        return List.of();
      });
      CompletableFuture<TestSession> a = m.openAsync("orders", "t1");
      CompletableFuture<TestSession> b = m.openAsync("orders", "t1");
      TestSession sa = ManagerHarness.join(a);
      TestSession sb = ManagerHarness.join(b);
      assertEquals(1, sa.query("SELECT 1").size());
      assertEquals(1, sb.query("SELECT 1").size());
      sa.close();
      sb.close();
      assertEquals(1, creates.get());
      assertEquals(1, hookRuns.get());
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void schemaMaterializationIsIdempotent(ExecutionModel model) throws Exception {
    DeclaredSchemaMaterializer declared = new DeclaredSchemaMaterializer()
        .declare("orders", TableDeclaration.of("visits", "CREATE TABLE visits(tenant VARCHAR(64))"));
    AtomicInteger runs = new AtomicInteger();
    SchemaMaterializer<JdbcEngineHandle> counting = (engine, db) -> {
      runs.incrementAndGet();
      declared.materialize(engine, db);
    };
    try (ManagerHarness m = harness(model, counting, LifecycleListener.NOOP)) {
      m.open("orders", "t1").close();
      m.open("orders", "t1").close();
      assertEquals(1, runs.get());

      // A fresh provisioning finds the table and leaves it alone.
      assertTrue(m.evict("orders", "t1"));
      m.open("orders", "t1").close();
      assertEquals(2, runs.get());
      assertEquals(List.of("VISITS"), h2.strings("t1__orders",
          "SELECT table_name FROM information_schema.tables WHERE UPPER(table_name) = 'VISITS'"));
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void failingHookKeepsEarlierEffectsAndStops(ExecutionModel model) throws Exception {
    h2.exec("t1__orders", "CREATE TABLE effects(name VARCHAR(16))");
    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), LifecycleListener.NOOP)) {
      m.registerPrecreate("orders", AutoHook.of("INSERT INTO effects VALUES ('one')"));
      m.registerPrecreate("orders", AutoHook.of("INSERT INTO effects VALUES ('two')", "INSERT INTO no_such_table VALUES (1)"));
      m.registerPrecreate("orders", AutoHook.of("INSERT INTO effects VALUES ('three')"));

      HookExecutionException e = assertThrows(HookExecutionException.class, () -> m.open("orders", "t1"));
      assertEquals(2, e.ordinal());
      assertEquals(HookKind.PRECREATE_AUTO, e.kind());
      assertEquals("orders", e.databaseName());
      assertEquals(LifecycleState.PRECREATED, e.state());
      assertEquals(List.of("one"), h2.strings("t1__orders", "SELECT name FROM effects"));
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void failedProvisioningIsRetriedByTheNextRequest(ExecutionModel model) throws Exception {
    h2.exec("t1__orders", "CREATE TABLE effects(name VARCHAR(16))");
    AtomicInteger calls = new AtomicInteger();
    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), LifecycleListener.NOOP)) {
      m.registerPostcreate("orders", tenant -> {
        if (calls.incrementAndGet() == 1) return List.of("INSERT INTO nowhere VALUES (1)");
        return List.of("INSERT INTO effects VALUES ('" + tenant + "')");
      });
      HookExecutionException e = assertThrows(HookExecutionException.class, () -> m.open("orders", "t1"));
      assertEquals(LifecycleState.POSTCREATED, e.state());

      m.open("orders", "t1").close();
      assertEquals(List.of("t1"), h2.strings("t1__orders", "SELECT name FROM effects"));
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void failingManualHookIsReported(ExecutionModel model) {
    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), LifecycleListener.NOOP)) {
      m.registerFailingManual(HookKind.Phase.POSTCREATE, "orders", new IllegalStateException("seed data missing"));
      HookExecutionException e = assertThrows(HookExecutionException.class, () -> m.open("orders", "t1"));
      assertEquals(HookKind.POSTCREATE_MANUAL, e.kind());
      assertEquals(1, e.ordinal());
      assertEquals(LifecycleState.POSTCREATED, e.state());
      assertTrue(e.getCause() instanceof IllegalStateException);
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void extensionHookRunsOnce(ExecutionModel model) throws Exception {
    AtomicInteger runs = new AtomicInteger();
    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), LifecycleListener.NOOP)) {
      // H2 has no extensions; a schema stands in for one.
      m.registerPrecreate("orders", AutoHook.single(t -> {
        runs.incrementAndGet();
        return "CREATE SCHEMA IF NOT EXISTS ext_x";
      }));
      try (TestSession s = m.open("orders", "t1")) {
        assertTrue(s.isOpen());
      }
      m.open("orders", "t1").close();
      assertEquals(1, runs.get());
      assertEquals(List.of("EXT_X"), h2.strings("t1__orders",
          "SELECT schema_name FROM information_schema.schemata WHERE schema_name = 'EXT_X'"));
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void postcreateManualHookSeedsEachTenantAfterSchema(ExecutionModel model) throws Exception {
    DeclaredSchemaMaterializer schema = new DeclaredSchemaMaterializer()
        .declare("orders", TableDeclaration.of("visits", "CREATE TABLE visits(tenant VARCHAR(64) PRIMARY KEY)"));
    try (ManagerHarness m = harness(model, schema, LifecycleListener.NOOP)) {
      m.registerManual(HookKind.Phase.POSTCREATE, "orders", "INSERT INTO visits(tenant) VALUES (?)");
      m.open("orders", "t1").close();
      m.open("orders", "t2").close();
      assertEquals(List.of("t1"), h2.strings("t1__orders", "SELECT tenant FROM visits"));
      assertEquals(List.of("t2"), h2.strings("t2__orders", "SELECT tenant FROM visits"));
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void hooksRegisteredUnderResolvedNameRunAfterLogicalOnes(ExecutionModel model) throws Exception {
    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), LifecycleListener.NOOP)) {
      m.registerPrecreate("t1__orders", AutoHook.of("INSERT INTO seq VALUES ('resolved')"));
      m.registerPrecreate("orders", AutoHook.of("CREATE TABLE seq(name VARCHAR(16))", "INSERT INTO seq VALUES ('logical')"));
      m.open("orders", "t1").close();
      assertEquals(List.of("logical", "resolved"), h2.strings("t1__orders", "SELECT name FROM seq ORDER BY name"));
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void unreachableEngineFailsInEngineReady(ExecutionModel model) {
    List<LifecycleState> failures = new CopyOnWriteArrayList<>();
    LifecycleListener listener = new LifecycleListener() {
      @Override public void onFailure(EngineKey key, LifecycleState failedIn, Throwable error) { failures.add(failedIn); }
    };
    JdbcEngineFactory engines = new JdbcEngineFactory((d, db) -> "jdbc:tenantdb-unreachable:" + db);
    try (ManagerHarness m = harness(model, h2.descriptor().maxRetryCount(1).build(), engines, SchemaMaterializer.none(), listener)) {
      DatabaseConnectionException e = assertThrows(DatabaseConnectionException.class, () -> m.open("orders", "t1"));
      assertEquals(LifecycleState.ENGINE_READY, e.state());
      assertEquals(2, e.attempts());
      assertTrue(e.transientFailure());
      assertEquals(List.of(LifecycleState.ENGINE_READY), failures);
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void schemaFailureIsWrappedAndNotRemembered(ExecutionModel model) {
    AtomicInteger runs = new AtomicInteger();
    SchemaMaterializer<JdbcEngineHandle> flaky = (engine, db) -> {
      if (runs.incrementAndGet() == 1) throw new IllegalStateException("metadata unavailable");
    };
    try (ManagerHarness m = harness(model, flaky, LifecycleListener.NOOP)) {
      SchemaException e = assertThrows(SchemaException.class, () -> m.open("orders", null));
      assertEquals(LifecycleState.SCHEMA_READY, e.state());
      assertTrue(e.getCause() instanceof IllegalStateException);

      m.open("orders", null).close();
      assertEquals(2, runs.get());
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void invalidDdlSurfacesAsSchemaException(ExecutionModel model) {
    DeclaredSchemaMaterializer schema = new DeclaredSchemaMaterializer()
        .declare("orders", TableDeclaration.of("broken", "CREATE TABLE broken ("));
    try (ManagerHarness m = harness(model, schema, LifecycleListener.NOOP)) {
      SchemaException e = assertThrows(SchemaException.class, () -> m.open("orders", "t1"));
      assertEquals(LifecycleState.SCHEMA_READY, e.state());
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void withSessionReleasesOnFailure(ExecutionModel model) throws Exception {
    h2.exec("t1__orders", "CREATE TABLE effects(name VARCHAR(16))");
    List<LifecycleState> states = new CopyOnWriteArrayList<>();
    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), recording(states))) {
      IllegalStateException e = assertThrows(IllegalStateException.class, () -> m.withSession("orders", "t1", s -> {
        s.execute("INSERT INTO effects VALUES ('uncommitted')");
        throw new IllegalStateException("work failed");
      }));
      assertEquals("work failed", e.getMessage());
      assertEquals(LifecycleState.CLOSED, states.get(states.size() - 1));
      assertEquals(List.of(), h2.strings("t1__orders", "SELECT name FROM effects"));

      int n = m.withSession("orders", "t1", s -> {
        int updated = s.execute("INSERT INTO effects VALUES ('kept')");
        s.commit();
        return updated;
      });
      assertEquals(1, n);
      assertEquals(List.of("kept"), h2.strings("t1__orders", "SELECT name FROM effects"));
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void enginesAreNotKeptWhenCachingIsOff(ExecutionModel model) {
    AtomicInteger hookRuns = new AtomicInteger();
    ConnectionDescriptor d = h2.descriptor().cacheEngines(false).build();
    try (ManagerHarness m = harness(model, d, new JdbcEngineFactory(h2.urls()), SchemaMaterializer.none(), LifecycleListener.NOOP)) {
      m.registerPrecreate("orders", t -> {
        hookRuns.incrementAndGet();
        return List.of();
      });
      TestSession first = m.open("orders", "t1");
      m.open("orders", "t1").close();
      assertEquals(2, hookRuns.get());
      assertTrue(first.isOpen());
      first.close();
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void cancellationStopsBeforeTheNextPhase(ExecutionModel model) throws Exception {
    AtomicInteger postcreateRuns = new AtomicInteger();
    AtomicReference<CompletableFuture<?>> pending = new AtomicReference<>();
    CountDownLatch published = new CountDownLatch(1);
    CountDownLatch failed = new CountDownLatch(1);
    AtomicReference<Throwable> failure = new AtomicReference<>();

    LifecycleListener listener = new LifecycleListener() {
      @Override
      public void onTransition(EngineKey key, LifecycleState state) {
        if (state != LifecycleState.PRECREATED) return;
        if (model == ExecutionModel.BLOCKING) {
          Thread.currentThread().interrupt();
        } else {
          await(published);
          pending.get().cancel(true);
        }
      }

      @Override
      public void onFailure(EngineKey key, LifecycleState failedIn, Throwable error) {
        failure.set(error);
        failed.countDown();
      }
    };

    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), listener)) {
      m.registerPrecreate("orders", AutoHook.of("CREATE TABLE pre(id INT)"));
      m.registerPostcreate("orders", t -> {
        postcreateRuns.incrementAndGet();
        return List.of("CREATE TABLE post(id INT)");
      });

      if (model == ExecutionModel.BLOCKING) {
        try {
          ProvisioningCancelledException e = assertThrows(ProvisioningCancelledException.class, () -> m.open("orders", "t1"));
          assertEquals(LifecycleState.SCHEMA_READY, e.state());
        } finally {
          Thread.interrupted();
        }
      } else {
        pending.set(m.async().getSession("orders", "t1"));
        published.countDown();
        assertTrue(failed.await(5, TimeUnit.SECONDS));
        assertTrue(pending.get().isCancelled());
        assertTrue(failure.get() instanceof ProvisioningCancelledException);
        assertEquals(LifecycleState.SCHEMA_READY, ((ProvisioningCancelledException) failure.get()).state());
      }

      assertEquals(0, postcreateRuns.get());
      assertEquals(List.of("PRE"), h2.strings("t1__orders",
          "SELECT table_name FROM information_schema.tables WHERE table_name IN ('PRE', 'POST')"));
    }
  }

  @ParameterizedTest
  @EnumSource(ExecutionModel.class)
  void getEngineProvisionsWithoutOpeningASession(ExecutionModel model) throws Exception {
    List<LifecycleState> states = new CopyOnWriteArrayList<>();
    try (ManagerHarness m = harness(model, SchemaMaterializer.none(), recording(states))) {
      m.registerPrecreate("orders", AutoHook.of("CREATE TABLE marker(id INT)"));
      JdbcEngineHandle engine = m.engine("orders", "t1");
      assertEquals("t1__orders", engine.databaseName());
      assertSame(engine, m.engine("orders", "t1"));
      assertFalse(states.contains(LifecycleState.SESSION_ACTIVE));
      assertEquals(List.of("MARKER"), h2.strings("t1__orders",
          "SELECT table_name FROM information_schema.tables WHERE table_name = 'MARKER'"));
    }
  }

  private static LifecycleListener recording(List<LifecycleState> states) {
    return new LifecycleListener() {
      @Override public void onTransition(EngineKey key, LifecycleState state) { states.add(state); }
    };
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
