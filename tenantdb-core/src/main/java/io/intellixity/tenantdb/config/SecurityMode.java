package io.intellixity.tenantdb.config;

/**
 * Transport security requested for connections.
 * <p>
 * The value is handed to the driver-specific URL resolver as-is; tenantdb does not negotiate anything itself.
 */
public enum SecurityMode {
  DISABLE,
  PREFER,
  REQUIRE,
  VERIFY_CA,
  VERIFY_FULL;

  public static SecurityMode parse(String raw) {
    if (raw == null || raw.isBlank()) return PREFER;
    String s = raw.trim().toUpperCase().replace('-', '_');
    try {
      return valueOf(s);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown security mode: " + raw, e);
    }
  }
}
