package io.intellixity.tenantdb.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.tenantdb.config.ConnectionDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Properties;

/**
 * Default {@link DataSourceFactory}: HikariCP when pooling is enabled, {@link UnpooledDataSource} otherwise.\n
 *
 * Pool mapping:\n
 * - minimumIdle / maximumPoolSize: descriptor pool bounds\n
 * - connectionTimeout: descriptor connect timeout (also the per-attempt bound)\n
 * - maxLifetime: descriptor pool recycle (0 keeps Hikari's default)\n
 * - driver properties: passed through untouched (keepalives, TLS material, ...)\n
 */
public final class JdbcDataSources implements DataSourceFactory {
  private static final Logger log = LoggerFactory.getLogger(JdbcDataSources.class);

  /** Hikari refuses lifetimes under 30s. */
  private static final long MIN_MAX_LIFETIME_MS = 30_000;

  public static final JdbcDataSources INSTANCE = new JdbcDataSources();

  private JdbcDataSources() {}

  @Override
  public DataSource create(ConnectionDescriptor d, String jdbcUrl, String poolName) {
    if (!d.poolingEnabled()) {
      return new UnpooledDataSource(jdbcUrl, connectionProperties(d));
    }

    HikariConfig hc = new HikariConfig();
    hc.setPoolName(poolName);
    hc.setJdbcUrl(jdbcUrl);
    hc.setUsername(d.username());
    hc.setPassword(d.secret());
    hc.setMinimumIdle(d.minPoolSize());
    hc.setMaximumPoolSize(d.maxPoolSize());
    hc.setConnectionTimeout(Math.max(250, d.connectTimeout().toMillis()));
    long recycle = d.poolRecycle().toMillis();
    if (recycle >= MIN_MAX_LIFETIME_MS) hc.setMaxLifetime(recycle);
    hc.setAutoCommit(true);
    // Connection failures must surface from the probe, not from the constructor.
    hc.setInitializationFailTimeout(-1);
    Properties props = new Properties();
    props.putAll(d.driverProperties());
    hc.setDataSourceProperties(props);
    if (d.applicationName() != null) hc.addDataSourceProperty("ApplicationName", d.applicationName());
    return new HikariDataSource(hc);
  }

  /** user/password plus the opaque driver properties, for DriverManager-style connects. */
  public static Properties connectionProperties(ConnectionDescriptor d) {
    Properties p = new Properties();
    p.putAll(d.driverProperties());
    p.setProperty("user", d.username());
    p.setProperty("password", d.secret());
    if (d.applicationName() != null) p.setProperty("ApplicationName", d.applicationName());
    return p;
  }

  static void closeQuietly(DataSource ds, String id) {
    if (!(ds instanceof AutoCloseable c)) return;
    try {
      c.close();
    } catch (Exception e) {
      log.warn("tenantdb.engine op=close_failed id={} error={}", id, e.toString());
    }
  }
}
