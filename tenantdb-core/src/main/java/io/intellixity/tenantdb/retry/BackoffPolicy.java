package io.intellixity.tenantdb.retry;

import io.intellixity.tenantdb.config.ConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay between two connection attempts.\n
 *
 * {@code failedAttempt} is 1-based: the delay before attempt 2 is {@code delayAfter(1)}.\n
 */
@FunctionalInterface
public interface BackoffPolicy {
  Duration delayAfter(int failedAttempt);

  static BackoffPolicy none() {
    return n -> Duration.ZERO;
  }

  static BackoffPolicy fixed(Duration delay) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
    return n -> delay;
  }

  /** {@code initial * 2^(n-1)}, capped at {@code max}. */
  static BackoffPolicy exponential(Duration initial, Duration max) {
    Objects.requireNonNull(initial, "initial");
    Objects.requireNonNull(max, "max");
    if (initial.isNegative() || max.isNegative()) throw new IllegalArgumentException("delays must be >= 0");
    if (max.compareTo(initial) < 0) throw new IllegalArgumentException("max must be >= initial");
    return n -> {
      int shift = Math.max(0, Math.min(n - 1, 30));
      long millis;
      try {
        millis = Math.multiplyExact(initial.toMillis(), 1L << shift);
      } catch (ArithmeticException overflow) {
        return max;
      }
      return millis > max.toMillis() ? max : Duration.ofMillis(millis);
    };
  }

  /** Config form: {@code none}, {@code fixed} or {@code exponential}. */
  static BackoffPolicy parse(String name, Duration initial, Duration max) {
    String n = (name == null || name.isBlank()) ? "exponential" : name.trim().toLowerCase();
    return switch (n) {
      case "none" -> none();
      case "fixed" -> fixed(initial);
      case "exponential" -> exponential(initial, max);
      default -> throw new ConfigurationException("Unknown retry backoff policy: " + name);
    };
  }
}
