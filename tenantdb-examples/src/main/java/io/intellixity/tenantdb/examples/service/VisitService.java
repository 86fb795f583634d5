package io.intellixity.tenantdb.examples.service;

import io.intellixity.tenantdb.examples.config.TenantDbProperties;
import io.intellixity.tenantdb.jdbc.JdbcSessionManager;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public final class VisitService {
  private final JdbcSessionManager sessions;
  private final String database;

  public VisitService(JdbcSessionManager sessions, TenantDbProperties props) {
    this.sessions = sessions;
    this.database = props.getDatabase();
  }

  public long record(String tenantId, String path) {
    return sessions.withSession(database, tenantId, s -> {
      s.execute("INSERT INTO visits (path) VALUES (?)", path);
      s.commit();
      return count(s.query("SELECT count(*) AS n FROM visits"));
    });
  }

  public List<Map<String, Object>> recent(String tenantId, int limit) {
    return sessions.withSession(database, tenantId,
        s -> s.query("SELECT id, path, visited_at FROM visits ORDER BY id DESC LIMIT ?", limit));
  }

  private static long count(List<Map<String, Object>> rows) {
    Object n = rows.isEmpty() ? null : rows.get(0).get("n");
    return (n instanceof Number num) ? num.longValue() : 0L;
  }
}
