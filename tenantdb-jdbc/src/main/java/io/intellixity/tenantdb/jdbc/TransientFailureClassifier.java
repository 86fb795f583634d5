package io.intellixity.tenantdb.jdbc;

/** Decides whether a failed connection attempt is worth retrying. */
@FunctionalInterface
public interface TransientFailureClassifier {
  boolean isTransient(Throwable failure);
}
