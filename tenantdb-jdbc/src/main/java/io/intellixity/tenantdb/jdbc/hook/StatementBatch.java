package io.intellixity.tenantdb.jdbc.hook;

import io.intellixity.tenantdb.jdbc.JdbcEngineHandle;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/** Runs raw statements in order on a fresh connection, as one transaction. */
final class StatementBatch {
  private StatementBatch() {}

  static void execute(JdbcEngineHandle engine, List<String> statements) throws SQLException {
    if (statements == null || statements.isEmpty()) return;
    try (Connection c = engine.connection()) {
      c.setAutoCommit(false);
      try (Statement st = c.createStatement()) {
        for (String sql : statements) {
          if (sql == null || sql.isBlank()) continue;
          st.execute(sql);
        }
        c.commit();
      } catch (SQLException | RuntimeException e) {
        try {
          c.rollback();
        } catch (SQLException re) {
          e.addSuppressed(re);
        }
        throw e;
      }
    }
  }
}
