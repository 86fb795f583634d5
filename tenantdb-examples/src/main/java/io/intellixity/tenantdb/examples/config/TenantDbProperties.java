package io.intellixity.tenantdb.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "tenantdb")
public class TenantDbProperties {
  /** Logical database every tenant gets a copy of. */
  private String database = "visits";

  /** Let the process environment (POSTGRES_URI, PG_*) override {@link #env}. */
  private boolean useSystemEnv = true;

  /** Environment-style defaults, e.g. {@code PG_HOST: localhost}. */
  private final Map<String, String> env = new HashMap<>();

  public String getDatabase() { return database; }
  public void setDatabase(String database) { this.database = database; }
  public boolean isUseSystemEnv() { return useSystemEnv; }
  public void setUseSystemEnv(boolean useSystemEnv) { this.useSystemEnv = useSystemEnv; }
  public Map<String, String> getEnv() { return env; }
}
