package io.intellixity.tenantdb.jdbc;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Opens a new physical connection per {@link #getConnection()}; used when pooling is disabled.\n
 *
 * Connect timeouts travel in the JDBC URL or the driver properties, so the login timeout is fixed at 0.\n
 */
public final class UnpooledDataSource implements DataSource {
  private final String url;
  private final Properties props;

  public UnpooledDataSource(String url, Properties props) {
    this.url = Objects.requireNonNull(url, "url");
    this.props = new Properties();
    if (props != null) this.props.putAll(props);
  }

  @Override
  public Connection getConnection() throws SQLException {
    return DriverManager.getConnection(url, props);
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    Properties p = new Properties();
    p.putAll(props);
    if (username != null) p.setProperty("user", username);
    if (password != null) p.setProperty("password", password);
    return DriverManager.getConnection(url, p);
  }

  @Override public PrintWriter getLogWriter() { return null; }
  @Override public void setLogWriter(PrintWriter out) {}
  @Override
  public void setLoginTimeout(int seconds) throws SQLException {
    throw new SQLFeatureNotSupportedException("Set the connect timeout through the JDBC URL or driver properties");
  }

  @Override public int getLoginTimeout() { return 0; }
  @Override public Logger getParentLogger() throws SQLFeatureNotSupportedException { throw new SQLFeatureNotSupportedException(); }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) return iface.cast(this);
    throw new SQLException("Not a wrapper for " + iface.getName());
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) {
    return iface.isInstance(this);
  }
}
