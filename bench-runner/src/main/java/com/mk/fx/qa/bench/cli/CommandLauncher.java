package com.mk.fx.qa.bench.cli;

import com.github.rvesse.airline.Cli;
import com.github.rvesse.airline.help.Help;
import com.github.rvesse.airline.parser.errors.ParseException;
import com.mk.fx.qa.bench.BenchHarnessApplication;
import com.mk.fx.qa.bench.exception.ConfigException;
import com.mk.fx.qa.bench.exception.SessionExecutionException;
import com.mk.fx.qa.bench.exception.SessionLockedException;
import com.mk.fx.qa.bench.report.exception.BenchReportException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point logic for the {@code bench} command line. Parses the arguments, starts a
 * non-web Spring context and runs the chosen command. Every failure maps to exit code 1.
 */
@Slf4j
public class CommandLauncher {

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;

  static final String LOG_LEVEL_PROPERTY = "logging.level.com.mk.fx.qa.bench";

  private final Cli<HarnessCommand> cli;
  private final Function<HarnessCommand, ConfigurableApplicationContext> contextFactory;
  private final PrintStream err;

  public CommandLauncher() {
    this(CommandLauncher::startContext, System.err);
  }

  CommandLauncher(
      Function<HarnessCommand, ConfigurableApplicationContext> contextFactory, PrintStream err) {
    this.cli =
        Cli.<HarnessCommand>builder("bench")
            .withDescription("Benchmark session runner and result plotter")
            .withCommands(RunCommand.class, PlotCommand.class, UnlockCommand.class)
            .build();
    this.contextFactory = contextFactory;
    this.err = err;
  }

  /** @throws ParseException on unknown commands, missing required options or bad arity */
  HarnessCommand parse(String... args) {
    return cli.parse(args);
  }

  public int launch(String... args) {
    HarnessCommand command;
    try {
      command = parse(args);
    } catch (ParseException e) {
      err.println(e.getMessage());
      printUsage();
      return EXIT_FAILURE;
    }

    try (ConfigurableApplicationContext context = contextFactory.apply(command)) {
      return command.execute(context);
    } catch (SessionLockedException e) {
      err.println(LockBanner.locked(e, environmentOf(command)));
      return EXIT_FAILURE;
    } catch (ConfigException | IllegalArgumentException e) {
      log.error("Invalid input: {}", e.getMessage());
      return EXIT_FAILURE;
    } catch (BenchReportException e) {
      log.error("Cannot aggregate results: {}", e.getMessage());
      return EXIT_FAILURE;
    } catch (SessionExecutionException e) {
      log.error(
          "{}. Lock {} kept; inspect the target, then run 'bench unlock --confirm'",
          e.getMessage(),
          e.getRetainedLock());
      return EXIT_FAILURE;
    } catch (Exception e) {
      log.error("Command failed: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }

  private void printUsage() {
    try {
      Help.help(cli.getMetadata(), List.of(), err);
    } catch (IOException e) {
      log.debug("Could not print usage: {}", e.getMessage());
    }
  }

  private static String environmentOf(HarnessCommand command) {
    if (command instanceof RunCommand run) {
      return run.environment;
    }
    if (command instanceof UnlockCommand unlock) {
      return unlock.environment;
    }
    return "<environment>";
  }

  static String logLevelFor(int verbosity) {
    return switch (verbosity) {
      case 0 -> "INFO";
      case 1 -> "DEBUG";
      default -> "TRACE";
    };
  }

  private static ConfigurableApplicationContext startContext(HarnessCommand command) {
    return new SpringApplicationBuilder(BenchHarnessApplication.class)
        .web(WebApplicationType.NONE)
        .bannerMode(Banner.Mode.OFF)
        .logStartupInfo(false)
        .headless(!command.needsDisplay())
        .properties(LOG_LEVEL_PROPERTY + "=" + logLevelFor(command.verbosity()))
        .run();
  }
}
