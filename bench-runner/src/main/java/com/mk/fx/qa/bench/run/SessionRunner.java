package com.mk.fx.qa.bench.run;

import com.mk.fx.qa.bench.exception.SessionExecutionException;
import com.mk.fx.qa.bench.session.SessionGuard;
import com.mk.fx.qa.bench.session.SessionLock;
import java.io.IOException;
import java.io.UncheckedIOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one session: validate, lock, execute, unlock.
 *
 * <p>Everything that can be rejected is rejected before the lock exists. Once the lock is held,
 * any failure or interrupt leaves it in place and marks the environment as tainted; there are no
 * retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRunner {

  private final RunConfigurationResolver resolver;
  private final SessionGuard guard;
  private final TestplanExecutor executor;

  /**
   * @return the configuration the session ran with
   * @throws com.mk.fx.qa.bench.exception.ConfigException if no executor is configured or the
   *     request is invalid; nothing was locked
   * @throws com.mk.fx.qa.bench.exception.SessionLockedException if the environment is locked
   * @throws SessionExecutionException if execution failed while locked; the lock is retained
   */
  public RunConfiguration run(RunRequest request) {
    executor.verifyReady();
    RunConfiguration configuration = resolver.resolve(request);

    SessionLock lock = guard.acquire(configuration.environment());
    RunSession session = new RunSession(configuration, lock);
    try {
      executor.execute(session);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw tainted("Session interrupted", lock, e);
    } catch (Exception e) {
      throw tainted("Session failed: " + e.getMessage(), lock, e);
    }

    try {
      lock.release();
    } catch (IOException e) {
      throw new UncheckedIOException("Session finished but lock could not be released", e);
    }
    log.info(
        "Session for {} completed, results in {}",
        configuration.environment(),
        configuration.outputDir());
    return configuration;
  }

  private static SessionExecutionException tainted(String message, SessionLock lock, Exception e) {
    log.error(
        "{}; environment {} is tainted, lock {} retained",
        message,
        lock.getEnvironment(),
        lock.getLockFile(),
        e);
    return new SessionExecutionException(message, lock.getLockFile(), e);
  }
}
