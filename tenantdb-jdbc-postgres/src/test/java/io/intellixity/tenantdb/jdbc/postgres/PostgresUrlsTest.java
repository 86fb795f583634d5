package io.intellixity.tenantdb.jdbc.postgres;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.config.SecurityMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresUrlsTest {
  private static ConnectionDescriptor.Builder descriptor() {
    return ConnectionDescriptor.builder().host("pg.internal").port(5433).username("svc").secret("pw");
  }

  @Test
  void rendersHostPortDatabaseAndDriverSettings() {
    String url = PostgresUrls.INSTANCE.url(descriptor().connectTimeout(Duration.ofSeconds(12)).build(), "acme__orders");
    assertEquals("jdbc:postgresql://pg.internal:5433/acme__orders?sslmode=prefer&connectTimeout=12", url);
  }

  @Test
  void securityModeMapsToSslMode() {
    String url = PostgresUrls.INSTANCE.url(descriptor().securityMode(SecurityMode.VERIFY_FULL).build(), "orders");
    assertTrue(url.contains("sslmode=verify-full"), url);
    assertEquals("disable", PostgresUrls.sslMode(SecurityMode.DISABLE));
    assertEquals("verify-ca", PostgresUrls.sslMode(SecurityMode.VERIFY_CA));
  }

  @Test
  void bracketsIpv6Hosts() {
    String url = PostgresUrls.INSTANCE.url(descriptor().host("::1").build(), "orders");
    assertTrue(url.startsWith("jdbc:postgresql://[::1]:5433/orders?"), url);
  }

  @Test
  void encodesUnusualDatabaseNames() {
    String url = PostgresUrls.INSTANCE.url(descriptor().build(), "a/b");
    assertTrue(url.contains("/a%2Fb?"), url);
    assertThrows(IllegalArgumentException.class, () -> PostgresUrls.INSTANCE.url(descriptor().build(), " "));
  }
}
