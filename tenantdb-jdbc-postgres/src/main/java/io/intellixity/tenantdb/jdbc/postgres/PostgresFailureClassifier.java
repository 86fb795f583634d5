package io.intellixity.tenantdb.jdbc.postgres;

import io.intellixity.tenantdb.jdbc.SqlStateFailureClassifier;
import org.postgresql.util.PSQLState;

/**
 * Adds server-side shutdown states (57P01 admin shutdown, 57P02 crash shutdown, 57P03 cannot connect now) to
 * the transient set, and treats a connection pooler's "server login has been failing" as fatal: the pooler
 * stops trying until its own backoff expires, so retrying only burns attempts.
 */
public final class PostgresFailureClassifier extends SqlStateFailureClassifier {
  static final String LOGIN_FAILING = "server login has been failing";

  @Override
  protected boolean isTransientState(String sqlState) {
    return super.isTransientState(sqlState)
        || PSQLState.isConnectionError(sqlState)
        || "57P01".equals(sqlState)
        || "57P02".equals(sqlState)
        || "57P03".equals(sqlState);
  }

  @Override
  protected boolean isFatalMessage(String message) {
    return message.contains(LOGIN_FAILING);
  }
}
