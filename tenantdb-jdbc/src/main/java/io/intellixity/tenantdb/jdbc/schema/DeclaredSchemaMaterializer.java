package io.intellixity.tenantdb.jdbc.schema;

import io.intellixity.tenantdb.jdbc.JdbcEngineHandle;
import io.intellixity.tenantdb.schema.SchemaException;
import io.intellixity.tenantdb.schema.SchemaMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Check-first materializer for table declarations keyed by logical database name.\n
 *
 * Existing tables are read from {@link DatabaseMetaData} for the connection's current catalog and schema, the
 * place unqualified DDL creates them (names compared case-insensitively). Missing tables are created in
 * declaration order inside one transaction.\n
 */
public final class DeclaredSchemaMaterializer implements SchemaMaterializer<JdbcEngineHandle> {
  private static final Logger log = LoggerFactory.getLogger(DeclaredSchemaMaterializer.class);

  private final Map<String, List<TableDeclaration>> declarations = new ConcurrentHashMap<>();

  /** Append tables to a database's declaration list. */
  public DeclaredSchemaMaterializer declare(String database, TableDeclaration... tables) {
    if (database == null || database.isBlank()) throw new IllegalArgumentException("database name is blank");
    List<TableDeclaration> l = declarations.computeIfAbsent(database.trim(), k -> new CopyOnWriteArrayList<>());
    for (TableDeclaration t : tables) {
      if (t == null) throw new NullPointerException("table");
      l.add(t);
    }
    return this;
  }

  public List<TableDeclaration> declared(String database) {
    List<TableDeclaration> l = database == null ? null : declarations.get(database.trim());
    return l == null ? List.of() : List.copyOf(l);
  }

  @Override
  public void materialize(JdbcEngineHandle engine, String databaseName) {
    List<TableDeclaration> tables = declared(databaseName);
    if (tables.isEmpty()) return;

    try (Connection c = engine.connection()) {
      Set<String> existing = existingTables(c);
      List<TableDeclaration> missing = new ArrayList<>();
      for (TableDeclaration t : tables) {
        if (!existing.contains(t.name().toLowerCase(Locale.ROOT))) missing.add(t);
      }
      if (missing.isEmpty()) {
        log.debug("tenantdb.schema op=up_to_date db={} tables={}", engine.key(), tables.size());
        return;
      }

      c.setAutoCommit(false);
      try (Statement st = c.createStatement()) {
        for (TableDeclaration t : missing) st.execute(t.createDdl());
        c.commit();
      } catch (SQLException | RuntimeException e) {
        try {
          c.rollback();
        } catch (SQLException re) {
          e.addSuppressed(re);
        }
        throw e;
      }
      log.info("tenantdb.schema op=created db={} tables={}", engine.key(), missing.stream().map(TableDeclaration::name).toList());
    } catch (SQLException e) {
      throw new SchemaException("Schema materialization failed for " + engine.key() + ": " + e.getMessage(), e);
    }
  }

  private static Set<String> existingTables(Connection c) throws SQLException {
    DatabaseMetaData md = c.getMetaData();
    String schema = c.getSchema();
    String schemaPattern = schema == null ? null : escape(schema, md.getSearchStringEscape());
    Set<String> out = new HashSet<>();
    // Drivers disagree on type labels ("TABLE", "BASE TABLE", "PARTITIONED TABLE"), so filter here.
    try (ResultSet rs = md.getTables(c.getCatalog(), schemaPattern, "%", null)) {
      while (rs.next()) {
        String type = rs.getString("TABLE_TYPE");
        if (type == null) continue;
        String t = type.toUpperCase(Locale.ROOT);
        if (!t.contains("TABLE") || t.contains("SYSTEM")) continue;
        // Without a search escape, '_' in the schema pattern still matches any character.
        if (schema != null && !schema.equals(rs.getString("TABLE_SCHEM"))) continue;
        out.add(rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
      }
    }
    return out;
  }

  static String escape(String name, String escape) {
    if (escape == null || escape.isEmpty()) return name;
    StringBuilder b = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char ch = name.charAt(i);
      if (ch == '_' || ch == '%' || escape.equals(String.valueOf(ch))) b.append(escape);
      b.append(ch);
    }
    return b.toString();
  }
}
