/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.environment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.opencensus.proto.resource.v1.Resource;

/**
 * Reads the resource from the {@value #OC_RESOURCE_TYPE} and {@value #OC_RESOURCE_LABELS}
 * environment variables.
 *
 * <p>Labels are comma-separated {@code key=value} pairs, where the value may be double-quoted,
 * ex. {@code k8s.pod.name="frontend-1",cloud.zone=us-east1-b}. Keys and values are ASCII, up to
 * {@value #MAX_LENGTH} characters.
 *
 * @see <a href="https://github.com/census-instrumentation/opencensus-specs/blob/master/resource/Resource.md">Resource API</a>
 */
public final class EnvironmentResourceDetector implements ResourceDetector {
  static final Logger LOG = Logger.getLogger(EnvironmentResourceDetector.class.getName());

  public static final String OC_RESOURCE_TYPE = "OC_RESOURCE_TYPE";
  public static final String OC_RESOURCE_LABELS = "OC_RESOURCE_LABELS";
  static final int MAX_LENGTH = 256;

  static final Pattern LABEL = Pattern.compile(
      "^\\s*(\\p{ASCII}{1," + MAX_LENGTH + "}?)=(\"\\p{ASCII}{0," + MAX_LENGTH + "}?\"|\\p{ASCII}{0,"
          + MAX_LENGTH + "}?)\\s*,");

  public static EnvironmentResourceDetector create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    Map<String, String> environment = System.getenv();

    /** The environment variables to read. Defaults to {@link System#getenv()}. */
    public Builder environment(Map<String, String> environment) {
      if (environment == null) throw new NullPointerException("environment == null");
      this.environment = environment;
      return this;
    }

    public EnvironmentResourceDetector build() {
      return new EnvironmentResourceDetector(this);
    }

    Builder() {
    }
  }

  final Map<String, String> environment;

  EnvironmentResourceDetector(Builder builder) {
    this.environment = builder.environment;
  }

  /**
   * Returns null when neither variable is set, or when the labels are malformed.
   */
  @Override
  public Resource detect() {
    String type = trimToEmpty(environment.get(OC_RESOURCE_TYPE));
    String labels = trimToEmpty(environment.get(OC_RESOURCE_LABELS));
    if (type.isEmpty() && labels.isEmpty()) return null;

    Resource.Builder result = Resource.newBuilder().setType(type);
    if (!labels.isEmpty()) {
      try {
        result.putAllLabels(decodeLabels(labels));
      } catch (IllegalArgumentException e) {
        LOG.log(Level.WARNING, "Ignoring " + OC_RESOURCE_LABELS + ": " + e.getMessage());
        return null;
      }
    }
    return result.build();
  }

  static Map<String, String> decodeLabels(String labels) {
    Map<String, String> result = new LinkedHashMap<>();
    // a trailing comma lets every pair match the same pattern
    String remainder = stripTrailingCommas(labels.trim()) + ",";
    while (!remainder.isEmpty()) {
      Matcher matcher = LABEL.matcher(remainder);
      if (!matcher.lookingAt()) {
        throw new IllegalArgumentException("invalid label formatting, remainder: " + remainder);
      }
      String value = matcher.group(2);
      if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
        value = value.substring(1, value.length() - 1);
      }
      result.put(matcher.group(1), value);
      remainder = remainder.substring(matcher.end());
    }
    return result;
  }

  static String stripTrailingCommas(String value) {
    int end = value.length();
    while (end > 0 && value.charAt(end - 1) == ',') end--;
    return value.substring(0, end);
  }

  static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
