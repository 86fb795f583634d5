package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.engine.DatabaseConnectionException;
import io.intellixity.tenantdb.engine.EngineFactory;
import io.intellixity.tenantdb.engine.EngineKey;
import io.intellixity.tenantdb.internal.SingleFlightCache;
import io.intellixity.tenantdb.internal.Stages;
import io.intellixity.tenantdb.retry.Sleeper;
import io.intellixity.tenantdb.session.LifecycleState;
import io.intellixity.tenantdb.session.ProvisioningCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * JDBC engine factory with retry, backoff and per-key single-flight creation.\n
 *
 * One attempt = provision the database (if the descriptor allows it) + build the DataSource + validate one
 * connection. Up to {@code maxRetryCount + 1} attempts run; only failures the
 * {@link TransientFailureClassifier} accepts are retried.\n
 *
 * Engines are cached by {@link EngineKey} unless the descriptor disables caching, in which case each call
 * returns a fresh engine owned by the caller.\n
 */
public final class JdbcEngineFactory implements EngineFactory<JdbcEngineHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcEngineFactory.class);
  private static final AtomicLong SEQ = new AtomicLong();

  private final JdbcUrlResolver urls;
  private final DataSourceFactory dataSources;
  private final DatabaseProvisioner provisioner;
  private final TransientFailureClassifier classifier;
  private final Sleeper sleeper;
  // Engines that finish after their key was evicted are closed rather than leaked.
  private final SingleFlightCache<EngineKey, JdbcEngineHandle> engines = new SingleFlightCache<>(h -> {
    log.info("tenantdb.engine op=discard_late db={} id={}", h.key(), h.id());
    h.close();
  });

  public JdbcEngineFactory(JdbcUrlResolver urls) {
    this(urls, DatabaseProvisioner.NONE, new SqlStateFailureClassifier());
  }

  public JdbcEngineFactory(JdbcUrlResolver urls,
                           DatabaseProvisioner provisioner,
                           TransientFailureClassifier classifier) {
    this(urls, JdbcDataSources.INSTANCE, provisioner, classifier, Sleeper.THREAD);
  }

  public JdbcEngineFactory(JdbcUrlResolver urls,
                           DataSourceFactory dataSources,
                           DatabaseProvisioner provisioner,
                           TransientFailureClassifier classifier,
                           Sleeper sleeper) {
    this.urls = Objects.requireNonNull(urls, "urls");
    this.dataSources = Objects.requireNonNull(dataSources, "dataSources");
    this.provisioner = (provisioner == null) ? DatabaseProvisioner.NONE : provisioner;
    this.classifier = (classifier == null) ? new SqlStateFailureClassifier() : classifier;
    this.sleeper = (sleeper == null) ? Sleeper.THREAD : sleeper;
  }

  @Override
  public JdbcEngineHandle getOrCreateEngine(ConnectionDescriptor descriptor, String resolvedDatabase) {
    Objects.requireNonNull(descriptor, "descriptor");
    EngineKey key = EngineKey.of(descriptor, resolvedDatabase);
    if (!descriptor.cacheEngines()) return connect(descriptor, key);
    return engines.getOrCompute(key, k -> connect(descriptor, k),
        () -> new ProvisioningCancelledException(key.resolvedDatabase(), LifecycleState.ENGINE_READY));
  }

  /**
   * Non-blocking variant. Attempts run on {@code executor}, backoff delays are scheduled rather than slept, and
   * concurrent callers for one key share a single attempt sequence.
   */
  public CompletableFuture<JdbcEngineHandle> getOrCreateEngineAsync(ConnectionDescriptor descriptor,
                                                                    String resolvedDatabase,
                                                                    Executor executor) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(executor, "executor");
    EngineKey key = EngineKey.of(descriptor, resolvedDatabase);
    if (!descriptor.cacheEngines()) return connectAsync(descriptor, key, executor, 1);
    return engines.getOrComputeAsync(key, k -> connectAsync(descriptor, k, executor, 1));
  }

  public Optional<JdbcEngineHandle> cached(EngineKey key) {
    return engines.getIfPresent(key);
  }

  @Override
  public boolean evict(EngineKey key) {
    Optional<JdbcEngineHandle> h = engines.remove(key);
    h.ifPresent(JdbcEngineHandle::close);
    return h.isPresent();
  }

  @Override
  public void close() {
    for (JdbcEngineHandle h : engines.clear()) h.close();
  }

  private JdbcEngineHandle connect(ConnectionDescriptor d, EngineKey key) {
    int maxAttempts = d.maxRetryCount() + 1;
    Throwable last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return attempt(d, key, attempt);
      } catch (SQLException | RuntimeException e) {
        last = e;
        if (!classifier.isTransient(e)) {
          log.error("tenantdb.engine op=connect_aborted db={} attempt={} error={}", key, attempt, e.toString());
          throw new DatabaseConnectionException(key, attempt, false, e);
        }
        if (attempt == maxAttempts) break;
        Duration delay = d.backoff().delayAfter(attempt);
        log.warn("tenantdb.engine op=connect_retry db={} attempt={} of={} delayMs={} error={}",
            key, attempt, maxAttempts, delay.toMillis(), e.toString());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new ProvisioningCancelledException(key.resolvedDatabase(), LifecycleState.ENGINE_READY);
        }
      }
    }
    log.error("tenantdb.engine op=connect_failed db={} attempts={}", key, maxAttempts);
    throw new DatabaseConnectionException(key, maxAttempts, true, last);
  }

  private CompletableFuture<JdbcEngineHandle> connectAsync(ConnectionDescriptor d, EngineKey key, Executor executor, int attempt) {
    int maxAttempts = d.maxRetryCount() + 1;
    CompletableFuture<JdbcEngineHandle> running = CompletableFuture.supplyAsync(() -> {
      try {
        return attempt(d, key, attempt);
      } catch (SQLException e) {
        throw new CompletionException(e);
      }
    }, executor);

    // Provisioning and the probe each get one connect timeout.
    long boundMs = d.connectTimeout().toMillis() * 2;
    CompletableFuture<JdbcEngineHandle> bounded = running.copy().orTimeout(boundMs, TimeUnit.MILLISECONDS);
    bounded.whenComplete((h, err) -> {
      if (err != null) running.thenAccept(JdbcEngineHandle::close);
    });

    return bounded.handle((h, err) -> {
      if (err == null) return CompletableFuture.completedFuture(h);
      Throwable cause = Stages.unwrap(err);
      if (!classifier.isTransient(cause)) {
        log.error("tenantdb.engine op=connect_aborted db={} attempt={} error={}", key, attempt, cause.toString());
        return Stages.<JdbcEngineHandle>failed(new DatabaseConnectionException(key, attempt, false, cause));
      }
      if (attempt >= maxAttempts) {
        log.error("tenantdb.engine op=connect_failed db={} attempts={}", key, maxAttempts);
        return Stages.<JdbcEngineHandle>failed(new DatabaseConnectionException(key, attempt, true, cause));
      }
      Duration delay = d.backoff().delayAfter(attempt);
      log.warn("tenantdb.engine op=connect_retry db={} attempt={} of={} delayMs={} error={}",
          key, attempt, maxAttempts, delay.toMillis(), cause.toString());
      Executor later = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
      return CompletableFuture.runAsync(() -> {}, later)
          .thenCompose(v -> connectAsync(d, key, executor, attempt + 1));
    }).thenCompose(Function.identity());
  }

  private JdbcEngineHandle attempt(ConnectionDescriptor d, EngineKey key, int attempt) throws SQLException {
    String db = key.resolvedDatabase();
    if (d.autoCreateDatabase() && provisioner.ensureDatabase(d, db)) {
      log.info("tenantdb.engine op=create_database db={}", key);
    }

    String url = urls.url(d, db);
    String id = "tenantdb-" + db + "-" + SEQ.incrementAndGet();
    log.debug("tenantdb.engine op=connect db={} attempt={} id={} pooling={}", key, attempt, id, d.poolingEnabled());
    DataSource ds = dataSources.create(d, url, id);
    try {
      probe(ds, d, key);
    } catch (SQLException | RuntimeException e) {
      JdbcDataSources.closeQuietly(ds, id);
      throw e;
    }
    log.info("tenantdb.engine op=created db={} id={} attempt={}", key, id, attempt);
    return new JdbcEngineHandle(id, ds, key, url);
  }

  private static void probe(DataSource ds, ConnectionDescriptor d, EngineKey key) throws SQLException {
    int seconds = (int) Math.max(1, d.connectTimeout().toSeconds());
    try (Connection c = ds.getConnection()) {
      if (!c.isValid(seconds)) {
        throw new SQLTransientConnectionException("Connection validation failed for " + key, "08006");
      }
    }
  }
}
