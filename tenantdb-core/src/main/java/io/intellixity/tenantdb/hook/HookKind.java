package io.intellixity.tenantdb.hook;

import io.intellixity.tenantdb.session.LifecycleState;

/** The four hook lists kept per database. */
public enum HookKind {
  PRECREATE_AUTO(Phase.PRECREATE, false),
  PRECREATE_MANUAL(Phase.PRECREATE, true),
  POSTCREATE_AUTO(Phase.POSTCREATE, false),
  POSTCREATE_MANUAL(Phase.POSTCREATE, true);

  private final Phase phase;
  private final boolean manual;

  HookKind(Phase phase, boolean manual) {
    this.phase = phase;
    this.manual = manual;
  }

  public Phase phase() { return phase; }
  public boolean manual() { return manual; }

  /** Hook phase relative to schema materialization. */
  public enum Phase {
    PRECREATE(LifecycleState.PRECREATED),
    POSTCREATE(LifecycleState.POSTCREATED);

    private final LifecycleState state;

    Phase(LifecycleState state) {
      this.state = state;
    }

    /** State reached once every hook of the phase has run. */
    public LifecycleState state() { return state; }

    public HookKind autoKind() {
      return this == PRECREATE ? PRECREATE_AUTO : POSTCREATE_AUTO;
    }

    public HookKind manualKind() {
      return this == PRECREATE ? PRECREATE_MANUAL : POSTCREATE_MANUAL;
    }
  }
}
