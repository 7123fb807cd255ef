package com.mk.fx.qa.bench.run;

/** Hands a locked session to the test execution engine and blocks until it finishes. */
public interface TestplanExecutor {

  /**
   * Fails fast on missing setup. Called before the session lock is taken.
   *
   * @throws com.mk.fx.qa.bench.exception.ConfigException if the executor cannot run at all
   */
  void verifyReady();

  void execute(RunSession session) throws Exception;
}
