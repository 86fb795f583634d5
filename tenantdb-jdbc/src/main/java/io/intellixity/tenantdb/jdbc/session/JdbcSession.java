package io.intellixity.tenantdb.jdbc.session;

import io.intellixity.tenantdb.jdbc.JdbcEngineHandle;
import io.intellixity.tenantdb.session.LifecycleState;
import io.intellixity.tenantdb.session.Session;
import io.intellixity.tenantdb.session.SessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Session over one borrowed JDBC connection in manual-commit mode.\n
 *
 * Not thread-safe. {@link #close()} rolls back uncommitted work, returns the connection and then runs the
 * optional release action (used to dispose engines that are not cached).\n
 */
public final class JdbcSession implements Session {
  private static final Logger log = LoggerFactory.getLogger(JdbcSession.class);

  private final JdbcEngineHandle engine;
  private final Connection conn;
  private final Runnable onClose;
  private boolean closed;
  private boolean dirty;

  private JdbcSession(JdbcEngineHandle engine, Connection conn, Runnable onClose) {
    this.engine = engine;
    this.conn = conn;
    this.onClose = onClose;
  }

  public static JdbcSession open(JdbcEngineHandle engine) {
    return open(engine, null);
  }

  public static JdbcSession open(JdbcEngineHandle engine, Runnable onClose) {
    Objects.requireNonNull(engine, "engine");
    Connection c = null;
    try {
      c = engine.connection();
      c.setAutoCommit(false);
      return new JdbcSession(engine, c, onClose);
    } catch (SQLException e) {
      closeConnection(c, engine);
      throw new SessionException("Could not open session on " + engine.key(), e);
    }
  }

  public JdbcEngineHandle engine() {
    return engine;
  }

  @Override
  public int execute(String sql, Object... params) {
    ensureOpen();
    Objects.requireNonNull(sql, "sql");
    log.debug("tenantdb.session op=execute db={} params={} sql={}", engine.key(), params == null ? 0 : params.length, sql);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      dirty = true;
      ps.execute();
      int n = ps.getUpdateCount();
      return Math.max(n, 0);
    } catch (SQLException e) {
      throw new SessionException("Statement failed on " + engine.key() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public List<Map<String, Object>> query(String sql, Object... params) {
    ensureOpen();
    Objects.requireNonNull(sql, "sql");
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      dirty = true;
      try (ResultSet rs = ps.executeQuery()) {
        ResultSetMetaData md = rs.getMetaData();
        int cols = md.getColumnCount();
        List<Map<String, Object>> out = new ArrayList<>();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<>();
          for (int i = 1; i <= cols; i++) row.put(md.getColumnLabel(i), rs.getObject(i));
          out.add(row);
        }
        return out;
      }
    } catch (SQLException e) {
      throw new SessionException("Query failed on " + engine.key() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void commit() {
    ensureOpen();
    try {
      conn.commit();
      dirty = false;
    } catch (SQLException e) {
      throw new SessionException("Commit failed on " + engine.key(), e);
    }
  }

  @Override
  public void rollback() {
    ensureOpen();
    try {
      conn.rollback();
      dirty = false;
    } catch (SQLException e) {
      throw new SessionException("Rollback failed on " + engine.key(), e);
    }
  }

  @Override
  public boolean isOpen() {
    return !closed;
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    SessionException failure = null;
    try {
      if (dirty) conn.rollback();
    } catch (SQLException e) {
      failure = new SessionException("Rollback on close failed on " + engine.key(), LifecycleState.CLOSED, e);
    } finally {
      closeConnection(conn, engine);
      if (onClose != null) onClose.run();
    }
    if (failure != null) throw failure;
  }

  private void ensureOpen() {
    if (closed) throw new SessionException("Session on " + engine.key() + " is closed");
  }

  private static void bind(PreparedStatement ps, Object[] params) throws SQLException {
    if (params == null) return;
    for (int i = 0; i < params.length; i++) ps.setObject(i + 1, params[i]);
  }

  private static void closeConnection(Connection c, JdbcEngineHandle engine) {
    if (c == null) return;
    try {
      c.close();
    } catch (SQLException e) {
      log.warn("tenantdb.session op=close_failed db={} error={}", engine.key(), e.toString());
    }
  }
}
