package io.intellixity.tenantdb.jdbc.postgres;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.config.SecurityMode;
import io.intellixity.tenantdb.jdbc.JdbcUrlResolver;
import org.postgresql.PGProperty;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * {@code jdbc:postgresql://host:port/database?sslmode=...&connectTimeout=...}\n
 *
 * Only the security mode and the connect timeout go into the URL; every other driver setting travels as a
 * connection property.\n
 */
public final class PostgresUrls implements JdbcUrlResolver {
  public static final PostgresUrls INSTANCE = new PostgresUrls();

  /** Database used for existence checks and CREATE DATABASE. */
  public static final String MAINTENANCE_DATABASE = "postgres";

  private PostgresUrls() {}

  @Override
  public String url(ConnectionDescriptor d, String resolvedDatabase) {
    if (resolvedDatabase == null || resolvedDatabase.isBlank()) throw new IllegalArgumentException("database is blank");
    return "jdbc:postgresql://" + host(d.host()) + ":" + d.port() + "/"
        + URLEncoder.encode(resolvedDatabase, StandardCharsets.UTF_8)
        + "?" + PGProperty.SSL_MODE.getName() + "=" + sslMode(d.securityMode())
        + "&" + PGProperty.CONNECT_TIMEOUT.getName() + "=" + Math.max(1, d.connectTimeout().toSeconds());
  }

  static String sslMode(SecurityMode mode) {
    if (mode == null) return "prefer";
    return switch (mode) {
      case DISABLE -> "disable";
      case PREFER -> "prefer";
      case REQUIRE -> "require";
      case VERIFY_CA -> "verify-ca";
      case VERIFY_FULL -> "verify-full";
    };
  }

  private static String host(String host) {
    // Bare IPv6 literals need brackets.
    return host.indexOf(':') >= 0 && !host.startsWith("[") ? "[" + host + "]" : host;
  }
}
