package com.mk.fx.qa.bench.cli;

import org.springframework.context.ApplicationContext;

/** A parsed {@code bench} sub-command, executed once the application context is up. */
public interface HarnessCommand {

  /** Number of {@code -v} flags; raises the harness log level. */
  default int verbosity() {
    return 0;
  }

  /** Whether the command opens windows, which keeps AWT out of headless mode. */
  default boolean needsDisplay() {
    return false;
  }

  /**
   * @return process exit code
   */
  int execute(ApplicationContext context) throws Exception;
}
