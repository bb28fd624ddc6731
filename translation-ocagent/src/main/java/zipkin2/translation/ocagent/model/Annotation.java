/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/** A timestamped text message recorded on a span, with optional attributes. */
public final class Annotation {

  public static Annotation create(Instant time, String message) {
    return create(time, message, Collections.<String, Object>emptyMap());
  }

  public static Annotation create(Instant time, String message, Map<String, ?> attributes) {
    if (time == null) throw new NullPointerException("time == null");
    if (message == null) throw new NullPointerException("message == null");
    return new Annotation(time, message, ModelUtils.copyAttributes(attributes));
  }

  private final Instant time;
  private final String message;
  private final Map<String, Object> attributes;

  private Annotation(Instant time, String message, Map<String, Object> attributes) {
    this.time = time;
    this.message = message;
    this.attributes = attributes;
  }

  public Instant time() {
    return time;
  }

  public String message() {
    return message;
  }

  /** Insertion-ordered and unmodifiable. */
  public Map<String, Object> attributes() {
    return attributes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Annotation)) return false;
    Annotation that = (Annotation) o;
    return time.equals(that.time)
        && message.equals(that.message)
        && attributes.equals(that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(time, message, attributes);
  }

  @Override
  public String toString() {
    return "Annotation{time=" + time + ", message=" + message + ", attributes=" + attributes + "}";
  }
}
