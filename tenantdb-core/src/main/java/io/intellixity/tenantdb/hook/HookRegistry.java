package io.intellixity.tenantdb.hook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-database ordered hook lists, one list per {@link HookKind}.\n
 *
 * Registration order is execution order. Registering the same hook twice appends it twice. Nothing is ever
 * removed. Registrations must be complete before the first session request for a database: provisioning reads
 * the lists once, and hooks added afterwards do not run retroactively.\n
 *
 * @param <M> manual hook type ({@link ManualHook} or {@link AsyncManualHook})
 */
public final class HookRegistry<M> {
  private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

  private final Map<HookKind, Map<String, List<HookEntry<?>>>> hooks = new EnumMap<>(HookKind.class);

  public HookRegistry() {
    for (HookKind k : HookKind.values()) hooks.put(k, new ConcurrentHashMap<>());
  }

  public static HookRegistry<ManualHook> blocking() {
    return new HookRegistry<>();
  }

  public static HookRegistry<AsyncManualHook> async() {
    return new HookRegistry<>();
  }

  public AutoHook registerPrecreate(String database, AutoHook hook) {
    return registerPrecreate(List.of(requireName(database)), hook);
  }

  public AutoHook registerPrecreate(Collection<String> databases, AutoHook hook) {
    register(HookKind.PRECREATE_AUTO, databases, hook);
    return hook;
  }

  public M registerPrecreateManual(String database, M hook) {
    return registerPrecreateManual(List.of(requireName(database)), hook);
  }

  public M registerPrecreateManual(Collection<String> databases, M hook) {
    register(HookKind.PRECREATE_MANUAL, databases, hook);
    return hook;
  }

  public AutoHook registerPostcreate(String database, AutoHook hook) {
    return registerPostcreate(List.of(requireName(database)), hook);
  }

  public AutoHook registerPostcreate(Collection<String> databases, AutoHook hook) {
    register(HookKind.POSTCREATE_AUTO, databases, hook);
    return hook;
  }

  public M registerPostcreateManual(String database, M hook) {
    return registerPostcreateManual(List.of(requireName(database)), hook);
  }

  public M registerPostcreateManual(Collection<String> databases, M hook) {
    register(HookKind.POSTCREATE_MANUAL, databases, hook);
    return hook;
  }

  /**
   * Untyped registration; auto kinds require an {@link AutoHook}.
   * The same entry is appended to each named database, duplicates in {@code databases} collapse.
   */
  public void register(HookKind kind, Collection<String> databases, Object hook) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(hook, "hook");
    if (!kind.manual() && !(hook instanceof AutoHook)) {
      throw new IllegalArgumentException(kind + " requires an AutoHook, got " + hook.getClass().getName());
    }
    if (kind.manual() && hook instanceof AutoHook) {
      throw new IllegalArgumentException(kind + " requires a manual hook, got an AutoHook");
    }
    Set<String> names = normalizeNames(databases);
    Map<String, List<HookEntry<?>>> byDb = hooks.get(kind);
    for (String db : names) {
      byDb.computeIfAbsent(db, k -> new CopyOnWriteArrayList<>()).add(new HookEntry<>(kind, db, hook));
    }
    log.debug("tenantdb.hooks op=register kind={} dbs={} hook={}", kind, names, hook.getClass().getName());
  }

  /** Hooks of {@code kind} for {@code database} in registration order; empty when none. */
  public List<HookEntry<?>> get(HookKind kind, String database) {
    Objects.requireNonNull(kind, "kind");
    if (database == null) return List.of();
    List<HookEntry<?>> l = hooks.get(kind).get(database.trim());
    return l == null ? List.of() : List.copyOf(l);
  }

  /**
   * Hooks a request runs: those registered under the logical name, then those registered under the resolved
   * (tenant-qualified) name when it differs.
   */
  public List<HookEntry<?>> forRequest(HookKind kind, String logicalDatabase, String resolvedDatabase) {
    List<HookEntry<?>> out = new ArrayList<>(get(kind, logicalDatabase));
    if (resolvedDatabase != null && !resolvedDatabase.equals(logicalDatabase)) {
      out.addAll(get(kind, resolvedDatabase));
    }
    return List.copyOf(out);
  }

  @SuppressWarnings("unchecked")
  public List<HookEntry<AutoHook>> autoHooks(HookKind kind, String logicalDatabase, String resolvedDatabase) {
    if (kind.manual()) throw new IllegalArgumentException(kind + " is not an auto kind");
    List<HookEntry<AutoHook>> out = new ArrayList<>();
    for (HookEntry<?> e : forRequest(kind, logicalDatabase, resolvedDatabase)) out.add((HookEntry<AutoHook>) e);
    return out;
  }

  @SuppressWarnings("unchecked")
  public List<HookEntry<M>> manualHooks(HookKind kind, String logicalDatabase, String resolvedDatabase) {
    if (!kind.manual()) throw new IllegalArgumentException(kind + " is not a manual kind");
    List<HookEntry<M>> out = new ArrayList<>();
    for (HookEntry<?> e : forRequest(kind, logicalDatabase, resolvedDatabase)) out.add((HookEntry<M>) e);
    return out;
  }

  private static Set<String> normalizeNames(Collection<String> databases) {
    Objects.requireNonNull(databases, "databases");
    if (databases.isEmpty()) throw new IllegalArgumentException("databases is empty");
    Set<String> out = new LinkedHashSet<>();
    for (String d : databases) out.add(requireName(d));
    return out;
  }

  private static String requireName(String database) {
    if (database == null || database.isBlank()) throw new IllegalArgumentException("database name is blank");
    return database.trim();
  }
}
