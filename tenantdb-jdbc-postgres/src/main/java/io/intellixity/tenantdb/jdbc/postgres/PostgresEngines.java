package io.intellixity.tenantdb.jdbc.postgres;

import io.intellixity.tenantdb.jdbc.JdbcEngineFactory;

/** Engine factory wired with the PostgreSQL URL resolver, provisioner and failure classifier. */
public final class PostgresEngines {
  private PostgresEngines() {}

  public static JdbcEngineFactory factory() {
    return new JdbcEngineFactory(PostgresUrls.INSTANCE, new PostgresDatabaseProvisioner(), new PostgresFailureClassifier());
  }
}
