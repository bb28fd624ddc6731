/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

/** Validation for the lower-hex trace and span identifiers carried by the source model. */
final class Ids {
  static final int TRACE_ID_LENGTH = 32;
  static final int SPAN_ID_LENGTH = 16;

  static String checkTraceId(String field, String traceId) {
    return checkId(field, traceId, TRACE_ID_LENGTH, false);
  }

  static String checkSpanId(String field, String spanId) {
    return checkId(field, spanId, SPAN_ID_LENGTH, false);
  }

  /** Like {@link #checkSpanId} except all zeros is allowed, and means "no parent". */
  static String checkParentId(String parentId) {
    String result = checkId("parentId", parentId, SPAN_ID_LENGTH, true);
    return isAllZeros(result) ? null : result;
  }

  static boolean isAllZeros(String id) {
    for (int i = 0, length = id.length(); i < length; i++) {
      if (id.charAt(i) != '0') return false;
    }
    return true;
  }

  private static String checkId(String field, String id, int expectedLength, boolean allowZeros) {
    if (id == null) throw new NullPointerException(field + " == null");
    if (id.length() != expectedLength) {
      throw new IllegalArgumentException(field + ".length != " + expectedLength);
    }
    for (int i = 0; i < expectedLength; i++) {
      char c = id.charAt(i);
      if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) {
        throw new IllegalArgumentException(id + " should be lower-hex encoded with no prefix");
      }
    }
    if (!allowZeros && isAllZeros(id)) {
      throw new IllegalArgumentException(field + " is all zeros");
    }
    return id;
  }

  private Ids() {
  }
}
