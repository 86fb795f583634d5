package io.intellixity.tenantdb.retry;

import java.time.Duration;

/** Blocking pause between retry attempts; replaced in tests to keep them fast. */
@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD = d -> {
    if (!d.isZero() && !d.isNegative()) Thread.sleep(d.toMillis());
  };

  void sleep(Duration duration) throws InterruptedException;
}
