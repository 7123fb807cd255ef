package com.mk.fx.qa.bench.run;

import com.mk.fx.qa.bench.cfg.HarnessCfg;
import com.mk.fx.qa.bench.exception.ConfigException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs the external engine as a child process sharing this process's stdin, stdout and stderr.
 *
 * <p>Command line: {@code <command...> --environment <env> --output <dir> [--filter <name>]
 * [-v ...] <testplan>...}
 */
@Slf4j
@Component
public class ProcessTestplanExecutor implements TestplanExecutor {

  private final List<String> command;

  @Autowired
  public ProcessTestplanExecutor(HarnessCfg cfg) {
    this(cfg.getExecutor().getCommand());
  }

  public ProcessTestplanExecutor(List<String> command) {
    this.command = command == null ? List.of() : List.copyOf(command);
  }

  @Override
  public void verifyReady() {
    if (command.isEmpty() || command.get(0).isBlank()) {
      throw new ConfigException("No test executor configured; set bench.executor.command");
    }
  }

  @Override
  public void execute(RunSession session) throws IOException, InterruptedException {
    verifyReady();
    List<String> commandLine = commandLine(session.configuration());
    log.info("Launching test executor: {}", String.join(" ", commandLine));

    Process process = new ProcessBuilder(commandLine).inheritIO().start();
    int exitCode;
    try {
      exitCode = process.waitFor();
    } catch (InterruptedException e) {
      log.warn("Interrupted, stopping test executor pid {}", process.pid());
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw e;
    }
    if (exitCode != 0) {
      throw new IllegalStateException("Test executor exited with code " + exitCode);
    }
    log.info("Test executor finished for {}", session.configuration().environment());
  }

  List<String> commandLine(RunConfiguration configuration) {
    List<String> args = new ArrayList<>(command);
    args.add("--environment");
    args.add(configuration.environment().toString());
    args.add("--output");
    args.add(configuration.outputDir().toString());
    configuration
        .filter()
        .ifPresent(
            filter -> {
              args.add("--filter");
              args.add(filter);
            });
    for (int i = 0; i < configuration.verbosity(); i++) {
      args.add("-v");
    }
    for (Path testplan : configuration.testplans()) {
      args.add(testplan.toString());
    }
    return args;
  }
}
