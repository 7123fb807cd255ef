package com.mk.fx.qa.bench.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.rvesse.airline.parser.errors.ParseException;
import com.mk.fx.qa.bench.cfg.HarnessCfg;
import com.mk.fx.qa.bench.exception.ConfigException;
import com.mk.fx.qa.bench.exception.SessionExecutionException;
import com.mk.fx.qa.bench.exception.SessionLockedException;
import com.mk.fx.qa.bench.run.RunConfiguration;
import com.mk.fx.qa.bench.run.RunRequest;
import com.mk.fx.qa.bench.run.SessionRunner;
import com.mk.fx.qa.bench.session.SessionGuard;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ConfigurableApplicationContext;

class CommandLauncherTest {

  @TempDir Path dir;

  private ConfigurableApplicationContext context;
  private ByteArrayOutputStream errBytes;
  private CommandLauncher launcher;

  @BeforeEach
  void setUp() {
    context = mock(ConfigurableApplicationContext.class);
    errBytes = new ByteArrayOutputStream();
    launcher =
        new CommandLauncher(
            command -> context, new PrintStream(errBytes, true, StandardCharsets.UTF_8));
  }

  private String err() {
    return errBytes.toString(StandardCharsets.UTF_8);
  }

  @Test
  void parse_runCommandCollectsRepeatedOptions() {
    HarnessCommand parsed =
        launcher.parse(
            "run", "-t", "a.plan", "--testplan", "b.plan", "-e", "lab.yaml", "-v", "-v",
            "--filter", "randread");

    assertThat(parsed).isInstanceOf(RunCommand.class);
    RunRequest request = ((RunCommand) parsed).toRequest();
    assertThat(request.testplans()).containsExactly(Path.of("a.plan"), Path.of("b.plan"));
    assertThat(request.environment()).isEqualTo(Path.of("lab.yaml"));
    assertThat(request.output()).isNull();
    assertThat(request.filter()).isEqualTo("randread");
    assertThat(parsed.verbosity()).isEqualTo(2);
  }

  @Test
  void parse_plotCommandBuildsSettings() {
    HarnessCommand parsed =
        launcher.parse(
            "plot", "--output-root", "results", "--kind", "scatter", "--metric", "latency",
            "--x-key", "numjobs", "--y-scale", "log", "--label", "{{bs}}", "--save",
            "--save-format", "png", "--save-format", "pdf", "--no-data");

    var request = ((PlotCommand) parsed).toRequest(new HarnessCfg());

    assertThat(request.outputRoot()).isEqualTo(Path.of("results"));
    assertThat(request.settings().plotName()).isEqualTo("scatter_latency_vs_numjobs");
    assertThat(request.settings().getYScale().name()).isEqualTo("LOG");
    assertThat(request.labelTemplate()).isEqualTo("{{bs}}");
    assertThat(request.save()).isTrue();
    assertThat(request.writeData()).isFalse();
    assertThat(request.formats()).extracting(Enum::name).containsExactly("PNG", "PDF");
    assertThat(parsed.needsDisplay()).isFalse();
  }

  @Test
  void parse_plotDefaultsToIopsOverIoDepth() {
    HarnessCommand parsed = launcher.parse("plot", "--output-root", "results");

    var request = ((PlotCommand) parsed).toRequest(new HarnessCfg());

    assertThat(request.settings().plotName()).isEqualTo("line_iops_vs_iodepth");
    assertThat(request.writeData()).isTrue();
    assertThat(request.save()).isFalse();
  }

  @Test
  void parse_missingRequiredOptionFails() {
    assertThatThrownBy(() -> launcher.parse("run", "-t", "a.plan"))
        .isInstanceOf(ParseException.class);
    assertThatThrownBy(() -> launcher.parse("plot", "--metric", "iops"))
        .isInstanceOf(ParseException.class);
  }

  @Test
  void launch_unknownCommandPrintsUsageAndExitsOne() {
    int code = launcher.launch("explode");

    assertThat(code).isEqualTo(CommandLauncher.EXIT_FAILURE);
    assertThat(err()).contains("bench");
  }

  @Test
  void launch_lockedEnvironmentPrintsBannerAndKeepsLock() {
    Path lock = dir.resolve("lab_yaml_lock");
    SessionRunner runner = mock(SessionRunner.class);
    when(context.getBean(SessionRunner.class)).thenReturn(runner);
    when(runner.run(any())).thenThrow(new SessionLockedException(lock, "pid=42 host=lab-1"));

    int code = launcher.launch("run", "-t", "a.plan", "-e", "lab.yaml");

    assertThat(code).isEqualTo(CommandLauncher.EXIT_FAILURE);
    assertThat(err())
        .contains("ENVIRONMENT LOCKED")
        .contains(lock.toString())
        .contains("pid=42 host=lab-1")
        .contains("bench unlock --environment lab.yaml --confirm");
  }

  @Test
  void launch_successfulRunExitsZero() {
    SessionRunner runner = mock(SessionRunner.class);
    when(context.getBean(SessionRunner.class)).thenReturn(runner);
    when(runner.run(any()))
        .thenReturn(
            new RunConfiguration(
                Path.of("lab.yaml"), List.of(Path.of("a.plan")), dir, Optional.empty(), 0));

    int code = launcher.launch("run", "-t", "a.plan", "-e", "lab.yaml", "-o", dir.toString());

    assertThat(code).isEqualTo(CommandLauncher.EXIT_OK);
    ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
    verify(runner).run(captor.capture());
    assertThat(captor.getValue().output()).isEqualTo(dir);
    verify(context).close();
  }

  @Test
  void launch_mapsHarnessFailuresToExitOne() {
    SessionRunner runner = mock(SessionRunner.class);
    when(context.getBean(SessionRunner.class)).thenReturn(runner);
    when(runner.run(any()))
        .thenThrow(new ConfigException("Testplan not found", Path.of("a.plan")))
        .thenThrow(
            new SessionExecutionException(
                "Session failed", dir.resolve("lock"), new IllegalStateException("exit 2")));

    assertThat(launcher.launch("run", "-t", "a.plan", "-e", "lab.yaml")).isEqualTo(1);
    assertThat(launcher.launch("run", "-t", "a.plan", "-e", "lab.yaml")).isEqualTo(1);
  }

  @Test
  void launch_unknownMetricExitsOne() {
    when(context.getBean(HarnessCfg.class)).thenReturn(new HarnessCfg());

    int code = launcher.launch("plot", "-r", dir.toString(), "-m", "joules", "-x", "iodepth");

    assertThat(code).isEqualTo(CommandLauncher.EXIT_FAILURE);
  }

  @Test
  void launch_unlockWithoutConfirmLeavesLockAndExitsOne() {
    SessionGuard guard = new SessionGuard(dir, Clock.systemUTC());
    when(context.getBean(SessionGuard.class)).thenReturn(guard);
    guard.acquire(Path.of("lab.yaml"));

    assertThat(launcher.launch("unlock", "-e", "lab.yaml")).isEqualTo(1);
    assertThat(guard.inspect(Path.of("lab.yaml")).locked()).isTrue();

    assertThat(launcher.launch("unlock", "-e", "lab.yaml", "--confirm")).isEqualTo(0);
    assertThat(guard.inspect(Path.of("lab.yaml")).locked()).isFalse();
  }

  @Test
  void logLevelFor_raisesWithVerbosity() {
    assertThat(CommandLauncher.logLevelFor(0)).isEqualTo("INFO");
    assertThat(CommandLauncher.logLevelFor(1)).isEqualTo("DEBUG");
    assertThat(CommandLauncher.logLevelFor(3)).isEqualTo("TRACE");
  }
}
