package com.mk.fx.qa.bench.session;

import com.mk.fx.qa.bench.cfg.HarnessCfg;
import com.mk.fx.qa.bench.exception.SessionLockedException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Enforces at most one session per environment through an atomically created lock file.
 *
 * <p>States: UNLOCKED, LOCKED_RUNNING after {@link #acquire(Path)} succeeds, then UNLOCKED again
 * on {@link SessionLock#release()} or LOCKED_STALE when the holder dies. A held lock fails the
 * next acquisition immediately; there is no waiting or retrying. Stale locks are only cleared by
 * {@link #clear(Path)}, which the operator triggers explicitly.
 */
@Slf4j
@Service
public class SessionGuard {

  static final String LOCK_SUFFIX = "_lock";

  private final Path lockDir;
  private final Clock clock;

  @Autowired
  public SessionGuard(HarnessCfg cfg) {
    this(cfg.getSession().getLockDir(), Clock.systemUTC());
  }

  public SessionGuard(Path lockDir, Clock clock) {
    this.lockDir = lockDir;
    this.clock = clock;
  }

  /** {@code <lock-dir>/<environment file name with '.' replaced by '_'>_lock}. */
  public Path lockPathFor(Path environment) {
    String basename = environment.getFileName().toString().replace('.', '_');
    return lockDir.resolve(basename + LOCK_SUFFIX);
  }

  /**
   * Takes the lock for {@code environment}.
   *
   * @throws SessionLockedException if the lock file already exists
   * @throws UncheckedIOException if the lock directory is unusable
   */
  public SessionLock acquire(Path environment) {
    Path lockFile = lockPathFor(environment);
    try {
      Files.createDirectories(lockDir);
      Files.createFile(lockFile);
    } catch (FileAlreadyExistsException e) {
      throw new SessionLockedException(lockFile, readOwner(lockFile).orElse(""));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create lock " + lockFile, e);
    }

    Instant now = clock.instant();
    String owner = ownerLine(now);
    try {
      Files.writeString(lockFile, owner + System.lineSeparator(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      // The empty file still excludes other sessions.
      log.warn("Could not record owner in {}: {}", lockFile, e.getMessage());
    }
    log.info("Acquired lock {} for environment {}", lockFile, environment);
    return new SessionLock(environment.toString(), lockFile, owner, now);
  }

  public LockStatus inspect(Path environment) {
    Path lockFile = lockPathFor(environment);
    if (!Files.exists(lockFile)) {
      return new LockStatus(environment.toString(), lockFile, LockState.UNLOCKED, Optional.empty());
    }
    return new LockStatus(environment.toString(), lockFile, LockState.LOCKED, readOwner(lockFile));
  }

  /**
   * Deletes a lock file regardless of who created it. Only for operator use on stale locks.
   *
   * @return true if a lock file was removed
   */
  public boolean clear(Path environment) throws IOException {
    Path lockFile = lockPathFor(environment);
    boolean removed = Files.deleteIfExists(lockFile);
    if (removed) {
      log.warn("Lock {} cleared by operator", lockFile);
    }
    return removed;
  }

  private static Optional<String> readOwner(Path lockFile) {
    try {
      String content = Files.readString(lockFile, StandardCharsets.UTF_8).strip();
      return content.isEmpty() ? Optional.empty() : Optional.of(content);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      log.debug("Lock owner unreadable in {}: {}", lockFile, e.getMessage());
      return Optional.empty();
    }
  }

  private static String ownerLine(Instant startedAt) {
    return "pid=" + ProcessHandle.current().pid()
        + " host=" + hostName()
        + " jvm=" + ManagementFactory.getRuntimeMXBean().getName()
        + " started=" + startedAt;
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "unknown";
    }
  }
}
