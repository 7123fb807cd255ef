package com.mk.fx.qa.bench.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.bench.report.aggregate.SeriesAggregator;
import com.mk.fx.qa.bench.report.collect.MetricRecordReader;
import com.mk.fx.qa.bench.report.collect.MetricsCollector;
import com.mk.fx.qa.bench.report.plot.PlotRenderer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the reporting library as beans, configured from {@link HarnessCfg}. */
@Configuration
public class ReportComponentsCfg {

  @Bean
  public MetricsCollector metricsCollector(
      HarnessCfg cfg, @Qualifier("yamlMapper") ObjectMapper yamlMapper) {
    return new MetricsCollector(
        cfg.getCollector().getTestcaseSuffix(),
        cfg.getCollector().getMetricsArtifact(),
        new MetricRecordReader(yamlMapper));
  }

  @Bean
  public SeriesAggregator seriesAggregator() {
    return new SeriesAggregator();
  }

  @Bean
  public PlotRenderer plotRenderer(ObjectMapper objectMapper) {
    return new PlotRenderer(objectMapper);
  }
}
