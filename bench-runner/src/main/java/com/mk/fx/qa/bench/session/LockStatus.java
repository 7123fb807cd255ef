package com.mk.fx.qa.bench.session;

import java.nio.file.Path;
import java.util.Optional;

/** Snapshot of an environment lock for diagnostics. {@code owner} is empty when unlocked. */
public record LockStatus(
    String environment, Path lockFile, LockState state, Optional<String> owner) {

  public boolean locked() {
    return state == LockState.LOCKED;
  }
}
