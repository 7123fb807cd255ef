package com.mk.fx.qa.bench.report.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mk.fx.qa.bench.report.exception.MalformedContextException;
import com.mk.fx.qa.bench.report.exception.MissingMetricException;
import com.mk.fx.qa.bench.report.exception.TemplateException;
import com.mk.fx.qa.bench.report.fingerprint.ContextFingerprint;
import com.mk.fx.qa.bench.report.label.LabelRenderer;
import com.mk.fx.qa.bench.report.model.ContextValue;
import com.mk.fx.qa.bench.report.model.MetricContext;
import com.mk.fx.qa.bench.report.model.MetricRecord;
import com.mk.fx.qa.bench.report.model.Series;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SeriesAggregatorTest {

  private final SeriesAggregator aggregator = new SeriesAggregator();

  private static MetricRecord record(String metric, double value, Object... ctx) {
    Map<String, Object> raw = new LinkedHashMap<>();
    for (int i = 0; i < ctx.length; i += 2) {
      raw.put((String) ctx[i], ctx[i + 1]);
    }
    return new MetricRecord(Map.of(metric, value), MetricContext.fromRaw(raw));
  }

  private static List<MetricRecord> scenario() {
    return List.of(
        record("iops", 100, "bs", "4k", "iodepth", 1, "fname", "a", "timestamp", 1),
        record("iops", 200, "bs", "4k", "iodepth", 4, "fname", "b", "timestamp", 2),
        record("iops", 50, "bs", "8k", "iodepth", 1, "fname", "c", "timestamp", 3));
  }

  private static Series byBs(Map<String, Series> result, String bs) {
    return result.values().stream()
        .filter(s -> s.context().get("bs").orElseThrow().equals(ContextValue.ofString(bs)))
        .findFirst()
        .orElseThrow();
  }

  @Test
  void aggregate_groupsScenarioByBlockSize() {
    Map<String, Series> result = aggregator.aggregate(scenario(), "iops", "iodepth");

    assertThat(result).hasSize(2);
    Series fourK = byBs(result, "4k");
    assertThat(fourK.xValues()).containsExactly(1, 4);
    assertThat(fourK.yValues()).containsExactly(100, 200);
    Series eightK = byBs(result, "8k");
    assertThat(eightK.xValues()).containsExactly(1);
    assertThat(eightK.yValues()).containsExactly(50);
  }

  @Test
  void aggregate_keysSeriesByFingerprintAndDropsVolatileKeysFromContext() {
    Map<String, Series> result = aggregator.aggregate(scenario(), "iops", "iodepth");

    result.forEach(
        (fingerprint, series) -> {
          assertThat(series.fingerprint()).isEqualTo(fingerprint);
          assertThat(series.label()).isEqualTo(fingerprint);
          assertThat(series.context().asMap()).containsOnlyKeys("bs");
          assertThat(ContextFingerprint.ofReduced(series.context())).isEqualTo(fingerprint);
        });
  }

  @Test
  void aggregate_sortsByXAndKeepsRecordOrderOnTies() {
    var records =
        List.of(
            record("iops", 1, "bs", "4k", "iodepth", 8, "fname", "a", "timestamp", 1),
            record("iops", 2, "bs", "4k", "iodepth", 2, "fname", "b", "timestamp", 2),
            record("iops", 3, "bs", "4k", "iodepth", 8, "fname", "c", "timestamp", 3),
            record("iops", 4, "bs", "4k", "iodepth", 2, "fname", "d", "timestamp", 4),
            record("iops", 5, "bs", "4k", "iodepth", 1, "fname", "e", "timestamp", 5));

    Series series = aggregator.aggregate(records, "iops", "iodepth").values().iterator().next();

    assertThat(series.xValues()).containsExactly(1, 2, 2, 8, 8);
    assertThat(series.yValues()).containsExactly(5, 2, 4, 1, 3);
    assertThatThrownBy(() -> series.add(0, 0)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void aggregate_sameGroupIffReducedContextsEqual() {
    List<MetricRecord> records = new ArrayList<>();
    String[] sizes = {"4k", "8k", "64k"};
    String[] modes = {"read", "write"};
    int n = 0;
    for (String bs : sizes) {
      for (String rw : modes) {
        for (int depth = 1; depth <= 4; depth++) {
          n++;
          records.add(
              record("iops", n, "rw", rw, "bs", bs, "iodepth", depth, "fname", "f" + n,
                  "timestamp", n));
        }
      }
    }
    Collections.shuffle(records, new Random(7));

    Map<String, Series> result = aggregator.aggregate(records, "iops", "iodepth");

    assertThat(result).hasSize(sizes.length * modes.length);
    for (MetricRecord a : records) {
      for (MetricRecord b : records) {
        boolean sameReduced =
            ContextFingerprint.reduce(a.context(), "iodepth")
                .equals(ContextFingerprint.reduce(b.context(), "iodepth"));
        boolean sameSeries =
            ContextFingerprint.of(a.context(), "iodepth")
                .equals(ContextFingerprint.of(b.context(), "iodepth"));
        assertThat(sameSeries).isEqualTo(sameReduced);
      }
    }
    result.values().forEach(s -> assertThat(s.xValues()).isSorted().hasSize(4));
  }

  @Test
  void aggregate_isDeterministicAcrossRepeatedPasses() {
    var first = aggregator.aggregate(scenario(), "iops", "iodepth");
    var second = aggregator.aggregate(scenario(), "iops", "iodepth");

    assertThat(second.keySet()).containsExactlyElementsOf(first.keySet());
    first.forEach(
        (fp, s) -> {
          assertThat(second.get(fp).xValues()).containsExactly(s.xValues());
          assertThat(second.get(fp).yValues()).containsExactly(s.yValues());
        });
  }

  @Test
  void aggregate_missingMetricAbortsWholePass() {
    var records = new ArrayList<>(scenario());
    records.add(
        record("bandwidth", 10, "bs", "4k", "iodepth", 2, "fname", "broken", "timestamp", 4));

    assertThatThrownBy(() -> aggregator.aggregate(records, "iops", "iodepth"))
        .isInstanceOf(MissingMetricException.class)
        .hasMessageContaining("broken")
        .hasMessageContaining("iops");
  }

  @Test
  void aggregate_nonIntegerXValueIsMalformedContext() {
    var records =
        List.of(record("iops", 1, "bs", "4k", "iodepth", "deep", "fname", "x", "timestamp", 1));

    assertThatThrownBy(() -> aggregator.aggregate(records, "iops", "iodepth"))
        .isInstanceOf(MalformedContextException.class)
        .satisfies(
            e -> {
              var ex = (MalformedContextException) e;
              assertThat(ex.getKey()).isEqualTo("iodepth");
              assertThat(ex.getFname()).isEqualTo("x");
            });
  }

  @Test
  void aggregate_missingXKeyIsMalformedContext() {
    var records = List.of(record("iops", 1, "bs", "4k", "fname", "x", "timestamp", 1));

    assertThatThrownBy(() -> aggregator.aggregate(records, "iops", "iodepth"))
        .isInstanceOf(MalformedContextException.class)
        .hasMessageContaining("absent");
  }

  @Test
  void aggregate_acceptsNumericStringsAndIntegralFloatsAsX() {
    var records =
        List.of(
            record("iops", 1, "bs", "4k", "iodepth", " 16 ", "fname", "a", "timestamp", 1),
            record("iops", 2, "bs", "4k", "iodepth", 2.0, "fname", "b", "timestamp", 2));

    Series series = aggregator.aggregate(records, "iops", "iodepth").values().iterator().next();

    assertThat(series.xValues()).containsExactly(2, 16);
  }

  @Test
  void aggregate_rendersLabelFromFirstRecordOfEachSeries() {
    var labels = new LabelRenderer("bs={{bs}}");

    Map<String, Series> result = aggregator.aggregate(scenario(), "iops", "iodepth", labels);

    assertThat(result.values()).extracting(Series::label).containsExactly("bs=4k", "bs=8k");
  }

  @Test
  void aggregate_labelReferencingDroppedKeyFails() {
    var labels = new LabelRenderer("{{fname}}");

    assertThatThrownBy(() -> aggregator.aggregate(scenario(), "iops", "iodepth", labels))
        .isInstanceOf(TemplateException.class);
  }

  @Test
  void aggregate_emptyInputYieldsNoSeries() {
    assertThat(aggregator.aggregate(List.of(), "iops", "iodepth")).isEmpty();
  }
}
