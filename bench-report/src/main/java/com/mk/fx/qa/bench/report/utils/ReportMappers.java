package com.mk.fx.qa.bench.report.utils;

import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/** Jackson mappers shared by the reporting pipeline. */
public final class ReportMappers {

  private ReportMappers() {
    // Utility class, no instantiation
  }

  /**
   * Compact mapper with map entries sorted by key. Used to build the canonical form of a context
   * before hashing, so it must never be configured with indentation or locale dependent output.
   * Non-finite floats are written as bare {@code NaN}/{@code Infinity} tokens so they cannot
   * collide with the strings {@code "NaN"} and {@code "Infinity"}.
   */
  public static ObjectMapper canonicalMapper() {
    return JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.INDENT_OUTPUT)
        .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
        .build();
  }

  /** Pretty-printing mapper for the aggregated series data file. */
  public static ObjectMapper dataMapper() {
    return JsonMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .build();
  }

  /** Mapper for the {@code metrics.yml} result artifacts. */
  public static ObjectMapper yamlMapper() {
    return YAMLMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }
}
