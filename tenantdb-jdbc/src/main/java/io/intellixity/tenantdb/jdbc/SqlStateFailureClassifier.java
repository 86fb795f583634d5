package io.intellixity.tenantdb.jdbc;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * SQLState-based classification shared by JDBC drivers.\n
 *
 * Fatal markers anywhere in the cause chain win over transient ones, so an authentication error wrapped in a
 * pool timeout is not retried.\n
 *
 * - Transient: SQLState class 08 (connection exception), HYT00/HYT01 (timeout), SQLTransientException,
 *   SQLRecoverableException, connect/socket timeouts\n
 * - Fatal: SQLState class 28 (invalid authorization), 3D000 (unknown database), anything unrecognized\n
 */
public class SqlStateFailureClassifier implements TransientFailureClassifier {

  @Override
  public final boolean isTransient(Throwable failure) {
    if (failure == null) return false;
    Map<Throwable, Boolean> seen = new IdentityHashMap<>();
    boolean transientSeen = false;
    for (Throwable t = failure; t != null && seen.put(t, Boolean.TRUE) == null; t = t.getCause()) {
      if (isFatal(t)) return false;
      if (isTransientMarker(t)) transientSeen = true;
    }
    return transientSeen;
  }

  /** Dialects extend the state lists here. */
  protected boolean isFatalState(String sqlState) {
    return sqlState.startsWith("28") || "3D000".equals(sqlState);
  }

  protected boolean isTransientState(String sqlState) {
    return sqlState.startsWith("08") || "HYT00".equals(sqlState) || "HYT01".equals(sqlState);
  }

  protected boolean isFatalMessage(String message) {
    return false;
  }

  private boolean isFatal(Throwable t) {
    if (t instanceof SQLException se) {
      String state = se.getSQLState();
      if (state != null && isFatalState(state)) return true;
    }
    String msg = t.getMessage();
    return msg != null && isFatalMessage(msg);
  }

  private boolean isTransientMarker(Throwable t) {
    if (t instanceof SQLException se) {
      String state = se.getSQLState();
      if (state != null && isTransientState(state)) return true;
    }
    return t instanceof SQLTransientException
        || t instanceof SQLRecoverableException
        || t instanceof ConnectException
        || t instanceof NoRouteToHostException
        || t instanceof SocketTimeoutException
        || t instanceof TimeoutException;
  }
}
