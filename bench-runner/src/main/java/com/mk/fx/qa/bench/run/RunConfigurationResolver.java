package com.mk.fx.qa.bench.run;

import com.mk.fx.qa.bench.cfg.HarnessCfg;
import com.mk.fx.qa.bench.exception.ConfigException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Checks a {@link RunRequest} before anything is locked or launched. The only side effect is
 * creating the output directory.
 */
@Slf4j
@Component
public class RunConfigurationResolver {

  static final String RUN_DIR_PREFIX = "run-";

  private final Path outputRoot;

  @Autowired
  public RunConfigurationResolver(HarnessCfg cfg) {
    this(cfg.getSession().getOutputRoot());
  }

  public RunConfigurationResolver(Path outputRoot) {
    this.outputRoot = outputRoot;
  }

  /**
   * @throws ConfigException naming the first path that is missing or cannot be used
   */
  public RunConfiguration resolve(RunRequest request) {
    if (request.testplans().isEmpty()) {
      throw new ConfigException("At least one testplan is required");
    }
    List<Path> testplans = new ArrayList<>(request.testplans().size());
    for (Path testplan : request.testplans()) {
      testplans.add(requireFile("Testplan not found", testplan));
    }
    if (request.environment() == null) {
      throw new ConfigException("An environment is required");
    }
    Path environment = requireFile("Environment not found", request.environment());

    Path outputDir =
        request.output() != null
            ? request.output()
            : outputRoot.resolve(RUN_DIR_PREFIX + UUID.randomUUID());
    prepareOutput(outputDir);

    Optional<String> filter =
        Optional.ofNullable(request.filter()).map(String::strip).filter(f -> !f.isEmpty());
    log.debug(
        "Resolved run: environment={} testplans={} output={}", environment, testplans, outputDir);
    return new RunConfiguration(
        environment, testplans, outputDir, filter, Math.max(0, request.verbosity()));
  }

  private static Path requireFile(String message, Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException(message, path);
    }
    return path.toAbsolutePath().normalize();
  }

  private static void prepareOutput(Path outputDir) {
    if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
      throw new ConfigException("Output is not a directory", outputDir);
    }
    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new ConfigException("Cannot create output directory", outputDir, e);
    }
  }
}
