package io.intellixity.tenantdb.config;

import io.intellixity.tenantdb.retry.BackoffPolicy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration for one database server and the logical databases served from it.\n
 *
 * One descriptor serves many databases and tenants: {@link #resolveDatabaseName(String, String)} turns a
 * (logical database, tenant) pair into the physical database name through {@link #databaseNameTemplate()}.\n
 *
 * All validation happens in {@link Builder#build()}; an instance that exists is valid.\n
 */
public final class ConnectionDescriptor {
  public static final String DATABASE_PLACEHOLDER = "{database}";
  public static final String TENANT_PLACEHOLDER = "{tenant}";
  public static final String DEFAULT_DATABASE_TEMPLATE = TENANT_PLACEHOLDER + "__" + DATABASE_PLACEHOLDER;

  private final String host;
  private final int port;
  private final String username;
  private final String secret;
  private final String databaseNameTemplate;
  private final boolean poolingEnabled;
  private final int minPoolSize;
  private final int maxPoolSize;
  private final Duration connectTimeout;
  private final Duration poolRecycle;
  private final int maxRetryCount;
  private final BackoffPolicy backoff;
  private final boolean autoCreateDatabase;
  private final SecurityMode securityMode;
  private final Map<String, String> driverProperties;
  private final String applicationName;
  private final boolean cacheEngines;

  private ConnectionDescriptor(Builder b) {
    this.host = b.host.trim();
    this.port = b.port;
    this.username = b.username;
    this.secret = b.secret;
    this.databaseNameTemplate = b.databaseNameTemplate;
    this.poolingEnabled = b.poolingEnabled;
    this.minPoolSize = b.minPoolSize;
    this.maxPoolSize = b.maxPoolSize;
    this.connectTimeout = b.connectTimeout;
    this.poolRecycle = b.poolRecycle;
    this.maxRetryCount = b.maxRetryCount;
    this.backoff = b.backoff;
    this.autoCreateDatabase = b.autoCreateDatabase;
    this.securityMode = b.securityMode;
    this.driverProperties = Map.copyOf(b.driverProperties);
    this.applicationName = b.applicationName;
    this.cacheEngines = b.cacheEngines;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder()
        .host(host)
        .port(port)
        .username(username)
        .secret(secret)
        .databaseNameTemplate(databaseNameTemplate)
        .poolingEnabled(poolingEnabled)
        .poolSize(minPoolSize, maxPoolSize)
        .connectTimeout(connectTimeout)
        .poolRecycle(poolRecycle)
        .maxRetryCount(maxRetryCount)
        .backoff(backoff)
        .autoCreateDatabase(autoCreateDatabase)
        .securityMode(securityMode)
        .applicationName(applicationName)
        .cacheEngines(cacheEngines);
    b.driverProperties.putAll(driverProperties);
    return b;
  }

  /**
   * Physical database name for a logical database and an optional tenant.
   * <p>
   * Without a tenant the logical name is used unchanged.
   */
  public String resolveDatabaseName(String database, String tenantId) {
    if (database == null || database.isBlank()) throw new IllegalArgumentException("database is blank");
    String db = database.trim();
    if (tenantId == null || tenantId.isBlank()) return db;
    return databaseNameTemplate
        .replace(TENANT_PLACEHOLDER, tenantId.trim())
        .replace(DATABASE_PLACEHOLDER, db);
  }

  /** Server identity used in engine cache keys. */
  public String target() {
    return host + ":" + port;
  }

  public String host() { return host; }
  public int port() { return port; }
  public String username() { return username; }
  public String secret() { return secret; }
  public String databaseNameTemplate() { return databaseNameTemplate; }
  public boolean poolingEnabled() { return poolingEnabled; }
  public int minPoolSize() { return minPoolSize; }
  public int maxPoolSize() { return maxPoolSize; }
  public Duration connectTimeout() { return connectTimeout; }
  public Duration poolRecycle() { return poolRecycle; }
  public int maxRetryCount() { return maxRetryCount; }
  public BackoffPolicy backoff() { return backoff; }
  public boolean autoCreateDatabase() { return autoCreateDatabase; }
  public SecurityMode securityMode() { return securityMode; }
  /** Opaque driver connection properties (keepalives, certificates, ...). */
  public Map<String, String> driverProperties() { return driverProperties; }
  public String applicationName() { return applicationName; }
  /** False reproduces per-request engines: nothing is cached and every request provisions again. */
  public boolean cacheEngines() { return cacheEngines; }

  @Override
  public String toString() {
    return "ConnectionDescriptor{target=" + target()
        + ", username=" + username
        + ", secret=****"
        + ", template=" + databaseNameTemplate
        + ", pooling=" + poolingEnabled
        + ", pool=" + minPoolSize + ".." + maxPoolSize
        + ", maxRetry=" + maxRetryCount
        + ", autoCreate=" + autoCreateDatabase
        + ", security=" + securityMode
        + ", cacheEngines=" + cacheEngines
        + "}";
  }

  public static final class Builder {
    private String host;
    private int port = 5432;
    private String username;
    private String secret;
    private String databaseNameTemplate = DEFAULT_DATABASE_TEMPLATE;
    private boolean poolingEnabled;
    private int minPoolSize = 1;
    private int maxPoolSize = 10;
    private Duration connectTimeout = Duration.ofSeconds(30);
    private Duration poolRecycle = Duration.ofSeconds(300);
    private int maxRetryCount = 5;
    private BackoffPolicy backoff = BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(30));
    private boolean autoCreateDatabase = true;
    private SecurityMode securityMode = SecurityMode.PREFER;
    private final Map<String, String> driverProperties = new LinkedHashMap<>();
    private String applicationName;
    private boolean cacheEngines = true;

    private Builder() {}

    public Builder host(String host) { this.host = host; return this; }
    public Builder port(int port) { this.port = port; return this; }
    public Builder username(String username) { this.username = username; return this; }
    public Builder secret(String secret) { this.secret = secret; return this; }
    public Builder databaseNameTemplate(String template) { this.databaseNameTemplate = template; return this; }
    public Builder poolingEnabled(boolean enabled) { this.poolingEnabled = enabled; return this; }
    public Builder poolSize(int min, int max) { this.minPoolSize = min; this.maxPoolSize = max; return this; }
    public Builder connectTimeout(Duration timeout) { this.connectTimeout = timeout; return this; }
    public Builder poolRecycle(Duration recycle) { this.poolRecycle = recycle; return this; }
    public Builder maxRetryCount(int count) { this.maxRetryCount = count; return this; }
    public Builder backoff(BackoffPolicy backoff) { this.backoff = backoff; return this; }
    public Builder autoCreateDatabase(boolean autoCreate) { this.autoCreateDatabase = autoCreate; return this; }
    public Builder securityMode(SecurityMode mode) { this.securityMode = mode; return this; }
    public Builder applicationName(String name) { this.applicationName = name; return this; }
    public Builder cacheEngines(boolean cache) { this.cacheEngines = cache; return this; }

    public Builder driverProperty(String key, String value) {
      Objects.requireNonNull(key, "key");
      if (value == null) driverProperties.remove(key);
      else driverProperties.put(key, value);
      return this;
    }

    public Builder driverProperties(Map<String, String> props) {
      if (props != null) props.forEach(this::driverProperty);
      return this;
    }

    public ConnectionDescriptor build() {
      if (host == null || host.isBlank()) throw new ConfigurationException("host is required");
      if (port < 1 || port > 65535) throw new ConfigurationException("port out of range: " + port);
      if (username == null || username.isBlank()) throw new ConfigurationException("username is required");
      if (secret == null) throw new ConfigurationException("secret is required");
      if (databaseNameTemplate == null || !databaseNameTemplate.contains(DATABASE_PLACEHOLDER)) {
        throw new ConfigurationException("databaseNameTemplate must contain " + DATABASE_PLACEHOLDER + ": " + databaseNameTemplate);
      }
      if (minPoolSize < 0) throw new ConfigurationException("minPoolSize must be >= 0: " + minPoolSize);
      if (maxPoolSize < 1) throw new ConfigurationException("maxPoolSize must be >= 1: " + maxPoolSize);
      if (minPoolSize > maxPoolSize) {
        throw new ConfigurationException("minPoolSize " + minPoolSize + " exceeds maxPoolSize " + maxPoolSize);
      }
      if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
        throw new ConfigurationException("connectTimeout must be > 0: " + connectTimeout);
      }
      if (poolRecycle == null || poolRecycle.isNegative()) {
        throw new ConfigurationException("poolRecycle must be >= 0: " + poolRecycle);
      }
      if (maxRetryCount < 0) throw new ConfigurationException("maxRetryCount must be >= 0: " + maxRetryCount);
      if (backoff == null) throw new ConfigurationException("backoff is required");
      if (securityMode == null) securityMode = SecurityMode.PREFER;
      return new ConnectionDescriptor(this);
    }
  }
}
