package com.mk.fx.qa.bench.report.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.bench.report.model.MetricContext;
import com.mk.fx.qa.bench.report.utils.ReportMappers;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes the grouping identity of a sample context.
 *
 * <p>The fingerprint is the SHA-256 of the key-sorted JSON form of the context with the x-axis key
 * and the volatile keys ({@code fname}, {@code timestamp}) removed. Two contexts get the same
 * fingerprint exactly when their reduced forms are equal key by key, whatever order the keys were
 * inserted in. The hash only serves grouping.
 */
public final class ContextFingerprint {

  private static final ObjectMapper CANONICAL = ReportMappers.canonicalMapper();

  private ContextFingerprint() {}

  /** Context keys dropped before grouping on {@code xKey}. */
  public static Set<String> excludedKeys(String xKey) {
    Set<String> keys = new HashSet<>(MetricContext.VOLATILE_KEYS);
    keys.add(xKey);
    return keys;
  }

  /** Context with {@code xKey} and the volatile keys removed. */
  public static MetricContext reduce(MetricContext context, String xKey) {
    return context.without(excludedKeys(xKey));
  }

  /** Fingerprint of the context once {@code xKey} and the volatile keys are removed. */
  public static String of(MetricContext context, String xKey) {
    return ofReduced(reduce(context, xKey));
  }

  /** Fingerprint of a context that has already been reduced. */
  public static String ofReduced(MetricContext reduced) {
    return sha256Hex(canonicalForm(reduced));
  }

  /** Key-sorted compact JSON of the context. */
  public static String canonicalForm(MetricContext context) {
    Map<String, Object> sorted = new TreeMap<>(context.toRawMap());
    try {
      return CANONICAL.writeValueAsString(sorted);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Context cannot be serialised: " + context, e);
    }
  }

  static String sha256Hex(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(hash.length * 2);
      for (byte b : hash) {
        hex.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException e) {
      // every JRE ships SHA-256
      throw new IllegalStateException(e);
    }
  }
}
