package io.intellixity.tenantdb.jdbc.postgres;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.jdbc.DatabaseProvisioner;
import io.intellixity.tenantdb.jdbc.JdbcDataSources;
import io.intellixity.tenantdb.jdbc.JdbcUrlResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Creates missing databases through the maintenance database.\n
 *
 * CREATE DATABASE cannot run inside a transaction, so the maintenance connection stays in auto-commit. A
 * concurrent creator winning the race counts as success: either SQLState 42P04, or any failure after which the
 * database is found to exist.\n
 */
public final class PostgresDatabaseProvisioner implements DatabaseProvisioner {
  private static final Logger log = LoggerFactory.getLogger(PostgresDatabaseProvisioner.class);

  static final String DUPLICATE_DATABASE = "42P04";

  private final JdbcUrlResolver urls;
  private final String maintenanceDatabase;

  public PostgresDatabaseProvisioner() {
    this(PostgresUrls.INSTANCE, PostgresUrls.MAINTENANCE_DATABASE);
  }

  public PostgresDatabaseProvisioner(JdbcUrlResolver urls, String maintenanceDatabase) {
    this.urls = Objects.requireNonNull(urls, "urls");
    this.maintenanceDatabase = Objects.requireNonNull(maintenanceDatabase, "maintenanceDatabase");
  }

  @Override
  public boolean ensureDatabase(ConnectionDescriptor d, String resolvedDatabase) throws SQLException {
    try (Connection c = DriverManager.getConnection(urls.url(d, maintenanceDatabase), JdbcDataSources.connectionProperties(d))) {
      c.setAutoCommit(true);
      return createIfMissing(c, resolvedDatabase);
    }
  }

  /** True when this call created the database; false when it already existed or a concurrent creator won. */
  static boolean createIfMissing(Connection c, String database) throws SQLException {
    if (exists(c, database)) return false;
    try (Statement st = c.createStatement()) {
      st.execute("CREATE DATABASE " + quoteIdent(database));
      return true;
    } catch (SQLException e) {
      if (DUPLICATE_DATABASE.equals(e.getSQLState()) || existsAfterFailure(c, database, e)) {
        log.debug("tenantdb.postgres op=create_database db={} status=created_concurrently sqlState={}",
            database, e.getSQLState());
        return false;
      }
      throw e;
    }
  }

  // A losing concurrent CREATE DATABASE may also fail with 23505 on pg_database's name index.
  private static boolean existsAfterFailure(Connection c, String database, SQLException failure) {
    try {
      return exists(c, database);
    } catch (SQLException recheck) {
      failure.addSuppressed(recheck);
      return false;
    }
  }

  static boolean exists(Connection c, String database) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
      ps.setString(1, database);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }

  static String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
