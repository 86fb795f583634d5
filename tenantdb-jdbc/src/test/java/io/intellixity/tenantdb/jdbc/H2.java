package io.intellixity.tenantdb.jdbc;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.retry.BackoffPolicy;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** In-memory H2 databases, one namespace per test so nothing leaks between tests. */
final class H2 {
  private final String namespace = "t" + UUID.randomUUID().toString().replace("-", "");

  ConnectionDescriptor.Builder descriptor() {
    return ConnectionDescriptor.builder()
        .host("h2")
        .port(9092)
        .username("sa")
        .secret("")
        .maxRetryCount(2)
        .backoff(BackoffPolicy.none());
  }

  JdbcUrlResolver urls() {
    return (d, db) -> url(db);
  }

  String url(String resolvedDatabase) {
    return "jdbc:h2:mem:" + namespace + "_" + resolvedDatabase + ";DB_CLOSE_DELAY=-1";
  }

  Connection connect(String resolvedDatabase) throws SQLException {
    return DriverManager.getConnection(url(resolvedDatabase), "sa", "");
  }

  void exec(String resolvedDatabase, String sql) throws SQLException {
    try (Connection c = connect(resolvedDatabase); Statement st = c.createStatement()) {
      st.execute(sql);
    }
  }

  List<String> strings(String resolvedDatabase, String sql) throws SQLException {
    List<String> out = new ArrayList<>();
    try (Connection c = connect(resolvedDatabase); Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
      while (rs.next()) out.add(rs.getString(1));
    }
    return out;
  }
}
