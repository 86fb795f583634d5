package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.engine.EngineHandle;
import io.intellixity.tenantdb.engine.EngineKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/** JDBC engine handle: a DataSource (pooled or not) bound to one resolved database. */
public final class JdbcEngineHandle implements EngineHandle<DataSource> {
  private static final Logger log = LoggerFactory.getLogger(JdbcEngineHandle.class);

  private final String id;
  private final DataSource client;
  private final EngineKey key;
  private final String jdbcUrl;
  private final AtomicBoolean closed = new AtomicBoolean();

  public JdbcEngineHandle(String id, DataSource client, EngineKey key, String jdbcUrl) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.key = Objects.requireNonNull(key, "key");
    this.jdbcUrl = jdbcUrl;
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String databaseName() { return key.resolvedDatabase(); }
  @Override public EngineKey key() { return key; }

  public String jdbcUrl() { return jdbcUrl; }

  public boolean isClosed() { return closed.get(); }

  /** Borrow a connection; the caller closes it. */
  public Connection connection() throws SQLException {
    if (closed.get()) throw new SQLException("Engine " + id + " is closed");
    return client.getConnection();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    JdbcDataSources.closeQuietly(client, id);
    log.info("tenantdb.engine op=dispose id={} db={}", id, key);
  }

  @Override
  public String toString() {
    return "JdbcEngineHandle{" + id + "}";
  }
}
