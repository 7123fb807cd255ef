package com.mk.fx.qa.bench.cli;

import com.mk.fx.qa.bench.exception.SessionLockedException;
import com.mk.fx.qa.bench.session.LockStatus;
import java.nio.file.Path;

/** Operator-facing text for a held or stale environment lock. */
final class LockBanner {

  private static final String RULE = "=".repeat(72);

  private LockBanner() {}

  static String locked(SessionLockedException e, String environment) {
    return banner(e.getLockFile(), e.getOwner(), environment);
  }

  static String locked(LockStatus status) {
    return banner(status.lockFile(), status.owner().orElse(""), status.environment());
  }

  private static String banner(Path lockFile, String owner, String environment) {
    StringBuilder text = new StringBuilder();
    text.append(RULE).append('\n');
    text.append("  ENVIRONMENT LOCKED").append('\n');
    text.append(RULE).append('\n');
    text.append("  Lock file : ").append(lockFile).append('\n');
    text.append("  Owner     : ").append(owner.isBlank() ? "(not recorded)" : owner).append('\n');
    text.append('\n');
    text.append("  Another session is running against this environment, or a previous one")
        .append('\n');
    text.append("  died and left the target in an unknown state.").append('\n');
    text.append("  If no session is running, check the target and then run:").append('\n');
    text.append('\n');
    text.append("    bench unlock --environment ").append(environment).append(" --confirm")
        .append('\n');
    text.append(RULE);
    return text.toString();
  }
}
