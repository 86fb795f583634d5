package io.intellixity.tenantdb.config;

import io.intellixity.tenantdb.TenantDbException;

/** Raised for an invalid connection descriptor or unparseable configuration. Never retried. */
public final class ConfigurationException extends TenantDbException {
  public ConfigurationException(String message) {
    super(message, null);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, null, cause);
  }
}
