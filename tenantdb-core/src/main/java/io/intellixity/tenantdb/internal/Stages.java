package io.intellixity.tenantdb.internal;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.BiFunction;

/** CompletionStage helpers for sequential async pipelines. */
public final class Stages {
  private static final CompletableFuture<Void> VOID = CompletableFuture.completedFuture(null);

  private Stages() {}

  public static CompletableFuture<Void> voidFuture() {
    return VOID;
  }

  public static <T> CompletableFuture<T> failed(Throwable t) {
    return CompletableFuture.failedFuture(t);
  }

  /**
   * Equivalent to:
   * <pre>{@code
   * for (int i = 0; i < items.size(); i++) {
   *   consumer.apply(items.get(i), i);
   * }
   * }</pre>
   * Each step starts only after the previous stage completed; the first failure stops the loop.
   */
  public static <T> CompletableFuture<Void> loop(List<T> items, BiFunction<T, Integer, CompletionStage<?>> consumer) {
    CompletableFuture<Void> chain = VOID;
    for (int i = 0; i < items.size(); i++) {
      final int index = i;
      final T item = items.get(i);
      chain = chain.thenCompose(v -> invoke(consumer, item, index).thenApply(r -> (Void) null));
    }
    return chain;
  }

  /** Strip CompletionException/ExecutionException layers added by future composition. */
  public static Throwable unwrap(Throwable t) {
    Throwable cur = t;
    while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
      cur = cur.getCause();
    }
    return cur;
  }

  private static <T> CompletionStage<?> invoke(BiFunction<T, Integer, CompletionStage<?>> consumer, T item, int index) {
    try {
      CompletionStage<?> s = consumer.apply(item, index);
      return s == null ? VOID : s;
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
