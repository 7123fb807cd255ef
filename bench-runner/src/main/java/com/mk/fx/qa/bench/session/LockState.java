package com.mk.fx.qa.bench.session;

/** What an environment's lock file says about the target right now. */
public enum LockState {
  UNLOCKED,
  /** Held by a running session, or left behind by one that died. The two look the same on disk. */
  LOCKED
}
