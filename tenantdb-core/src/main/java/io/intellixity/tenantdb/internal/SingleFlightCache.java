package io.intellixity.tenantdb.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Memoizing cache with per-key single-flight loading.\n
 *
 * - The first caller for a key runs the loader; concurrent callers for that key share its outcome\n
 * - Successful values stay cached until {@link #remove(Object)}\n
 * - Failures are never cached: the next caller starts a fresh load\n
 *
 * Blocking callers wait on the in-flight load; async callers get a future and never block.\n
 *
 * A key removed while its load is still running is not cached when the load finishes; the late value still
 * reaches the callers that joined the load and is also handed to the discard action.\n
 */
public final class SingleFlightCache<K, V> {
  private final Map<K, CompletableFuture<V>> entries = new ConcurrentHashMap<>();
  private final Consumer<? super V> onDiscard;

  public SingleFlightCache() {
    this(v -> {});
  }

  public SingleFlightCache(Consumer<? super V> onDiscard) {
    this.onDiscard = Objects.requireNonNull(onDiscard, "onDiscard");
  }

  /** Blocking lookup; the loader runs on the calling thread of the winning caller. */
  public V getOrCompute(K key, Function<K, V> loader) {
    return getOrCompute(key, loader, () -> new CompletionException("Interrupted while waiting for in-flight load", null));
  }

  /**
   * Blocking lookup. A waiter interrupted while another thread loads {@code key} keeps its interrupt flag and
   * throws what {@code onInterrupt} supplies.
   */
  public V getOrCompute(K key, Function<K, V> loader, Supplier<? extends RuntimeException> onInterrupt) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(loader, "loader");
    Objects.requireNonNull(onInterrupt, "onInterrupt");
    CompletableFuture<V> mine = new CompletableFuture<>();
    CompletableFuture<V> existing = entries.putIfAbsent(key, mine);
    if (existing != null) return await(existing, onInterrupt);

    try {
      V v = loader.apply(key);
      if (v == null) throw new IllegalStateException("Loader returned null for " + key);
      mine.complete(v);
      return v;
    } catch (RuntimeException | Error e) {
      entries.remove(key, mine);
      mine.completeExceptionally(e);
      throw e;
    }
  }

  /**
   * Non-blocking lookup. Each caller receives its own dependent future, so cancelling it never cancels the
   * shared load.
   */
  public CompletableFuture<V> getOrComputeAsync(K key, Function<K, ? extends CompletionStage<V>> loader) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(loader, "loader");
    CompletableFuture<V> mine = new CompletableFuture<>();
    CompletableFuture<V> existing = entries.putIfAbsent(key, mine);
    if (existing != null) return existing.copy();

    CompletionStage<V> stage;
    try {
      stage = loader.apply(key);
    } catch (RuntimeException | Error e) {
      entries.remove(key, mine);
      mine.completeExceptionally(e);
      return mine.copy();
    }
    stage.whenComplete((v, err) -> {
      if (err == null && v == null) err = new IllegalStateException("Loader returned null for " + key);
      if (err != null) {
        entries.remove(key, mine);
        mine.completeExceptionally(Stages.unwrap(err));
      } else {
        mine.complete(v);
      }
    });
    return mine.copy();
  }

  /** Completed value for {@code key}, if any. */
  public Optional<V> getIfPresent(K key) {
    CompletableFuture<V> f = entries.get(key);
    if (f == null || !f.isDone() || f.isCompletedExceptionally()) return Optional.empty();
    return Optional.ofNullable(f.getNow(null));
  }

  /**
   * Forget {@code key}; returns the completed value it held, if any. A load still in flight is not interrupted,
   * its value goes to the discard action once it completes.
   */
  public Optional<V> remove(K key) {
    CompletableFuture<V> f = entries.remove(key);
    if (f == null) return Optional.empty();
    if (!f.isDone()) {
      f.thenAccept(onDiscard);
      return Optional.empty();
    }
    if (f.isCompletedExceptionally()) return Optional.empty();
    return Optional.ofNullable(f.getNow(null));
  }

  /** Remove everything; returns the completed values. */
  public List<V> clear() {
    List<V> out = new ArrayList<>();
    for (K k : new ArrayList<>(entries.keySet())) remove(k).ifPresent(out::add);
    return out;
  }

  public int size() {
    return entries.size();
  }

  private static <V> V await(CompletableFuture<V> f, Supplier<? extends RuntimeException> onInterrupt) {
    try {
      return f.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      RuntimeException ex = onInterrupt.get();
      ex.addSuppressed(e);
      throw ex;
    } catch (ExecutionException e) {
      Throwable c = e.getCause();
      if (c instanceof RuntimeException re) throw re;
      if (c instanceof Error err) throw err;
      throw new CompletionException(c);
    }
  }
}
