/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * A pointer from one span to another span, possibly in a different trace. Used for batching,
 * where one span handles work started by many.
 */
public final class Link {

  public enum Type {
    UNSPECIFIED,
    /** The linked span is a child of the current span. */
    CHILD,
    /** The linked span is a parent of the current span. */
    PARENT
  }

  public static Link create(String traceId, String spanId, Type type) {
    return create(traceId, spanId, type, Collections.<String, Object>emptyMap());
  }

  /**
   * @param traceId 32 lower-hex characters
   * @param spanId 16 lower-hex characters
   */
  public static Link create(String traceId, String spanId, Type type, Map<String, ?> attributes) {
    if (type == null) throw new NullPointerException("type == null");
    return new Link(Ids.checkTraceId("traceId", traceId), Ids.checkSpanId("spanId", spanId), type,
        ModelUtils.copyAttributes(attributes));
  }

  private final String traceId;
  private final String spanId;
  private final Type type;
  private final Map<String, Object> attributes;

  private Link(String traceId, String spanId, Type type, Map<String, Object> attributes) {
    this.traceId = traceId;
    this.spanId = spanId;
    this.type = type;
    this.attributes = attributes;
  }

  public String traceId() {
    return traceId;
  }

  public String spanId() {
    return spanId;
  }

  public Type type() {
    return type;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Link)) return false;
    Link that = (Link) o;
    return traceId.equals(that.traceId)
        && spanId.equals(that.spanId)
        && type == that.type
        && attributes.equals(that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(traceId, spanId, type, attributes);
  }

  @Override
  public String toString() {
    return "Link{traceId=" + traceId + ", spanId=" + spanId + ", type=" + type
        + ", attributes=" + attributes + "}";
  }
}
