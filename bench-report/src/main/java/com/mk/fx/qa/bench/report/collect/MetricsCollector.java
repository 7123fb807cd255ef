package com.mk.fx.qa.bench.report.collect;

import com.mk.fx.qa.bench.report.model.MetricRecord;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Gathers every sample below a run output directory.
 *
 * <p>A directory is a result source when its name ends with the testcase script suffix (the
 * execution engine names each testcase output directory after its script) and it contains the
 * metrics artifact, by default {@code _aux/metrics.yml}. Sources are read in lexicographic path
 * order.
 *
 * <p>Runs that were interrupted leave partial trees behind, so unreadable directories and broken
 * artifacts are reported as {@link CollectionWarning}s and collection carries on.
 *
 * <p>The tree must not be written to while it is collected; nothing here guards against that.
 */
@Slf4j
public class MetricsCollector {

  public static final String DEFAULT_TESTCASE_SUFFIX = ".py";
  public static final String DEFAULT_METRICS_ARTIFACT = "_aux/metrics.yml";

  private final String testcaseSuffix;
  private final String metricsArtifact;
  private final MetricRecordReader reader;

  public MetricsCollector() {
    this(DEFAULT_TESTCASE_SUFFIX, DEFAULT_METRICS_ARTIFACT, new MetricRecordReader());
  }

  public MetricsCollector(
      String testcaseSuffix, String metricsArtifact, MetricRecordReader reader) {
    this.testcaseSuffix = Objects.requireNonNull(testcaseSuffix, "testcaseSuffix");
    this.metricsArtifact = Objects.requireNonNull(metricsArtifact, "metricsArtifact");
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  /**
   * Walks {@code root} and reads every qualifying artifact.
   *
   * @throws IOException if {@code root} itself cannot be walked
   */
  public CollectionResult collect(Path root) throws IOException {
    List<CollectionWarning> warnings = new ArrayList<>();
    List<Path> artifacts = findArtifacts(root, warnings);
    artifacts.sort(null);

    List<MetricRecord> records = new ArrayList<>();
    int read = 0;
    for (Path artifact : artifacts) {
      try {
        List<MetricRecord> fromArtifact = reader.read(artifact);
        records.addAll(fromArtifact);
        read++;
        log.debug("Read {} records from {}", fromArtifact.size(), artifact);
      } catch (IOException | IllegalArgumentException e) {
        warnings.add(warn(artifact, "Unusable metrics artifact: " + e.getMessage()));
      }
    }

    log.info(
        "Collected {} records from {} artifacts under {} ({} warnings)",
        records.size(),
        read,
        root,
        warnings.size());
    return new CollectionResult(records, warnings, read);
  }

  private List<Path> findArtifacts(Path root, List<CollectionWarning> warnings)
      throws IOException {
    List<Path> artifacts = new ArrayList<>();
    Files.walkFileTree(
        root,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (isResultSource(dir)) {
              artifacts.add(dir.resolve(metricsArtifact));
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException e) {
            warnings.add(warn(file, "Cannot visit: " + e.getMessage()));
            return FileVisitResult.CONTINUE;
          }
        });
    return artifacts;
  }

  boolean isResultSource(Path dir) {
    Path name = dir.getFileName();
    return name != null
        && name.toString().endsWith(testcaseSuffix)
        && Files.isRegularFile(dir.resolve(metricsArtifact));
  }

  private static CollectionWarning warn(Path path, String message) {
    log.warn("{}: {}", path, message);
    return new CollectionWarning(path, message);
  }
}
