package com.mk.fx.qa.bench.exception;

import java.nio.file.Path;
import lombok.Getter;

/**
 * The environment's lock file already exists: another session is running against the target, or
 * a previous one died and left the target tainted. The lock is never touched when this is thrown.
 */
@Getter
public class SessionLockedException extends HarnessException {

  private final Path lockFile;
  private final String owner;

  public SessionLockedException(Path lockFile, String owner) {
    super("Environment is locked by " + lockFile);
    this.lockFile = lockFile;
    this.owner = owner;
  }
}
