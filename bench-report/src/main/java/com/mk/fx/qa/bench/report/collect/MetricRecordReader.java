package com.mk.fx.qa.bench.report.collect;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.bench.report.model.MetricContext;
import com.mk.fx.qa.bench.report.model.MetricRecord;
import com.mk.fx.qa.bench.report.utils.ReportMappers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses one {@code metrics.yml} artifact.
 *
 * <p>The artifact is a YAML list of mappings. Numeric top-level fields are metrics; the nested
 * {@code ctx} mapping is the sample context and must hold {@code fname} and {@code timestamp}:
 *
 * <pre>{@code
 * - iops: 10234.5
 *   bandwidth: 41918464
 *   ctx: {bs: 4k, iodepth: 8, fname: randread-4k, timestamp: 1700000000}
 * }</pre>
 */
public class MetricRecordReader {

  public static final String CONTEXT_FIELD = "ctx";

  private static final TypeReference<List<Object>> LIST = new TypeReference<>() {};

  private final ObjectMapper yaml;

  public MetricRecordReader() {
    this(ReportMappers.yamlMapper());
  }

  public MetricRecordReader(ObjectMapper yaml) {
    this.yaml = yaml;
  }

  /**
   * Reads every record of the artifact.
   *
   * @throws IOException if the file cannot be read or is not valid YAML
   * @throws IllegalArgumentException if the content does not have the expected shape
   */
  public List<MetricRecord> read(Path artifact) throws IOException {
    if (Files.size(artifact) == 0) {
      throw new IllegalArgumentException("Artifact is empty");
    }
    List<Object> entries = yaml.readValue(artifact.toFile(), LIST);
    if (entries == null) {
      throw new IllegalArgumentException("Artifact holds no document");
    }
    List<MetricRecord> records = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      try {
        records.add(toRecord(entries.get(i)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Entry #" + i + ": " + e.getMessage(), e);
      }
    }
    return records;
  }

  private MetricRecord toRecord(Object entry) {
    if (!(entry instanceof Map<?, ?> fields)) {
      throw new IllegalArgumentException("expected a mapping but found " + describe(entry));
    }
    Map<String, Double> metrics = new LinkedHashMap<>();
    Object ctx = null;
    for (Map.Entry<?, ?> field : fields.entrySet()) {
      String name = String.valueOf(field.getKey());
      if (CONTEXT_FIELD.equals(name)) {
        ctx = field.getValue();
      } else if (field.getValue() instanceof Number number) {
        metrics.put(name, number.doubleValue());
      }
    }
    if (!(ctx instanceof Map<?, ?> rawContext)) {
      throw new IllegalArgumentException("missing '" + CONTEXT_FIELD + "' mapping");
    }
    Map<String, Object> context = new LinkedHashMap<>();
    rawContext.forEach((k, v) -> context.put(String.valueOf(k), v));
    return new MetricRecord(metrics, MetricContext.fromRaw(context));
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
