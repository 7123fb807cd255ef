package com.mk.fx.qa.bench.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Harness settings bound from the {@code bench} prefix.
 *
 * <pre>{@code
 * bench:
 *   session:
 *     lock-dir: /tmp
 *     output-root: /tmp/bench-runs
 *   executor:
 *     command: [python3, -m, engine.run]
 *   collector:
 *     testcase-suffix: .py
 *     metrics-artifact: _aux/metrics.yml
 *   plot:
 *     width: 1024
 *     height: 640
 * }</pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "bench")
public class HarnessCfg {

  @Valid private Session session = new Session();
  @Valid private Executor executor = new Executor();
  @Valid private Collector collector = new Collector();
  @Valid private Plot plot = new Plot();

  @Data
  public static class Session {

    /** Directory holding the per-environment lock files. */
    @NotNull private Path lockDir = Path.of(System.getProperty("java.io.tmpdir"));

    /** Parent of the randomised output directories used when a run names none. */
    @NotNull
    private Path outputRoot = Path.of(System.getProperty("java.io.tmpdir"), "bench-runs");
  }

  @Data
  public static class Executor {

    /** Command line of the test execution engine; session arguments are appended to it. */
    private List<String> command = new ArrayList<>();
  }

  @Data
  public static class Collector {

    /** Suffix of testcase output directory names. */
    @NotBlank private String testcaseSuffix = ".py";

    /** Metrics artifact path, relative to a testcase output directory. */
    @NotBlank private String metricsArtifact = "_aux/metrics.yml";
  }

  @Data
  public static class Plot {

    @Min(200)
    @Max(8000)
    private int width = 1024;

    @Min(200)
    @Max(8000)
    private int height = 640;
  }
}
