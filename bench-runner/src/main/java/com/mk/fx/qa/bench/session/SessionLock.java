package com.mk.fx.qa.bench.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Exclusive hold on one environment, backed by the existence of its lock file.
 *
 * <p>Not {@link AutoCloseable}: a session that fails or is interrupted must leave the file behind
 * so the target is treated as tainted. Only {@link #release()} after a clean run removes it.
 */
@Slf4j
@Getter
public final class SessionLock {

  private final String environment;
  private final Path lockFile;
  private final String owner;
  private final Instant acquiredAt;
  @Getter(AccessLevel.NONE)
  private final AtomicBoolean released = new AtomicBoolean();

  SessionLock(String environment, Path lockFile, String owner, Instant acquiredAt) {
    this.environment = environment;
    this.lockFile = lockFile;
    this.owner = owner;
    this.acquiredAt = acquiredAt;
  }

  /**
   * Removes the lock file. Calling it twice is a no-op.
   *
   * @throws IOException if the file cannot be deleted; the lock is then still held
   */
  public void release() throws IOException {
    if (!released.compareAndSet(false, true)) {
      return;
    }
    try {
      if (!Files.deleteIfExists(lockFile)) {
        log.warn("Lock {} was already gone at release", lockFile);
      }
    } catch (IOException e) {
      released.set(false);
      throw e;
    }
    log.info("Released lock {} for environment {}", lockFile, environment);
  }

  public boolean isReleased() {
    return released.get();
  }
}
