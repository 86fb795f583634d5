package io.intellixity.tenantdb.config;

import io.intellixity.tenantdb.retry.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link ConnectionDescriptor} from environment-style key/value pairs.\n
 *
 * Keys (all prefixed, e.g. {@code PG_}):\n
 * <pre>
 * HOST, PORT, USER, PASSWORD, DATABASE_TEMPLATE,
 * ENABLE_POOLING, MIN_CONNECTION, MAX_CONNECTION, CONNECTION_TIMEOUT (s), POOL_RECYCLE (s),
 * MAX_RETRY, RETRY_BACKOFF (none|fixed|exponential), RETRY_INITIAL_DELAY_MS, RETRY_MAX_DELAY_MS,
 * AUTO_CREATE, SECURITY_MODE, ANTI_PERSISTENT, APPLICATION_NAME,
 * CONNECT_ARG_&lt;name&gt; (copied into driver properties)
 * </pre>
 */
public final class EnvironmentDescriptorLoader {
  private static final Logger log = LoggerFactory.getLogger(EnvironmentDescriptorLoader.class);

  public static final String CONNECT_ARG = "CONNECT_ARG_";

  private EnvironmentDescriptorLoader() {}

  public static ConnectionDescriptor load(Map<String, String> env, String prefix) {
    ConnectionDescriptor d = builder(env, prefix).build();
    log.debug("tenantdb.config op=load prefix={} descriptor={}", prefix, d);
    return d;
  }

  /** Pre-populated builder, for callers that derive some settings elsewhere (e.g. from a URI). */
  public static ConnectionDescriptor.Builder builder(Map<String, String> env, String prefix) {
    Objects.requireNonNull(env, "env");
    String p = prefix == null ? "" : prefix;
    Reader r = new Reader(env, p);

    ConnectionDescriptor.Builder b = ConnectionDescriptor.builder()
        .host(r.string("HOST", null))
        .port(r.integer("PORT", 5432))
        .username(r.string("USER", null))
        .secret(r.string("PASSWORD", null))
        .databaseNameTemplate(r.string("DATABASE_TEMPLATE", ConnectionDescriptor.DEFAULT_DATABASE_TEMPLATE))
        .poolingEnabled(r.bool("ENABLE_POOLING", false))
        .poolSize(r.integer("MIN_CONNECTION", 1), r.integer("MAX_CONNECTION", 10))
        .connectTimeout(Duration.ofSeconds(r.integer("CONNECTION_TIMEOUT", 30)))
        .poolRecycle(Duration.ofSeconds(r.integer("POOL_RECYCLE", 300)))
        .maxRetryCount(r.integer("MAX_RETRY", 5))
        .autoCreateDatabase(r.bool("AUTO_CREATE", true))
        .securityMode(SecurityMode.parse(r.string("SECURITY_MODE", null)))
        .cacheEngines(!r.bool("ANTI_PERSISTENT", false))
        .applicationName(r.string("APPLICATION_NAME", null));

    Duration initial = Duration.ofMillis(r.integer("RETRY_INITIAL_DELAY_MS", 1000));
    Duration max = Duration.ofMillis(r.integer("RETRY_MAX_DELAY_MS", 30_000));
    try {
      b.backoff(BackoffPolicy.parse(r.string("RETRY_BACKOFF", null), initial, max));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid retry backoff settings under " + p + ": " + e.getMessage(), e);
    }

    String argPrefix = p + CONNECT_ARG;
    for (var e : env.entrySet()) {
      String k = e.getKey();
      if (k == null || !k.startsWith(argPrefix) || k.length() == argPrefix.length()) continue;
      b.driverProperty(k.substring(argPrefix.length()), e.getValue());
    }
    return b;
  }

  private static final class Reader {
    private final Map<String, String> env;
    private final String prefix;

    Reader(Map<String, String> env, String prefix) {
      this.env = env;
      this.prefix = prefix;
    }

    String string(String key, String def) {
      String v = env.get(prefix + key);
      return (v == null || v.isBlank()) ? def : v.trim();
    }

    int integer(String key, int def) {
      String v = string(key, null);
      if (v == null) return def;
      try {
        return Integer.parseInt(v);
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Expected an integer for " + prefix + key + ": " + v, e);
      }
    }

    boolean bool(String key, boolean def) {
      String v = string(key, null);
      if (v == null) return def;
      return switch (v.toLowerCase()) {
        case "true", "1", "yes", "on" -> true;
        case "false", "0", "no", "off" -> false;
        default -> throw new ConfigurationException("Expected a boolean for " + prefix + key + ": " + v);
      };
    }
  }
}
