/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A finished span as recorded by instrumentation, before translation to the wire format.
 *
 * <p>Identifiers are lower-hex strings: 32 characters for the trace ID and 16 for span IDs. A
 * parent ID of all zeros is accepted and treated the same as no parent.
 *
 * <p>Attribute values are intentionally untyped. Booleans, strings, fixed-width integers and
 * floating point numbers translate to their native wire kind, and anything else is rendered as a
 * string.
 */
public final class SpanData {

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String traceId, spanId, parentId, name = "";
    SpanKind kind = SpanKind.UNSPECIFIED;
    Instant startTime, endTime;
    Status status = Status.OK;
    boolean hasRemoteParent;
    Tracestate tracestate = Tracestate.EMPTY;
    final Map<String, Object> attributes = new LinkedHashMap<>();
    final List<Annotation> annotations = new ArrayList<>();
    final List<MessageEvent> messageEvents = new ArrayList<>();
    final List<Link> links = new ArrayList<>();

    /** Required: 32 lower-hex characters, not all zeros. */
    public Builder traceId(String traceId) {
      this.traceId = Ids.checkTraceId("traceId", traceId);
      return this;
    }

    /** Required: 16 lower-hex characters, not all zeros. */
    public Builder spanId(String spanId) {
      this.spanId = Ids.checkSpanId("spanId", spanId);
      return this;
    }

    /** Optional: 16 lower-hex characters. Null or all zeros means this is a root span. */
    public Builder parentId(String parentId) {
      this.parentId = parentId == null ? null : Ids.checkParentId(parentId);
      return this;
    }

    public Builder name(String name) {
      if (name == null) throw new NullPointerException("name == null");
      this.name = name;
      return this;
    }

    /** Null is coerced to {@link SpanKind#UNSPECIFIED}. */
    public Builder kind(SpanKind kind) {
      this.kind = kind != null ? kind : SpanKind.UNSPECIFIED;
      return this;
    }

    public Builder startTime(Instant startTime) {
      if (startTime == null) throw new NullPointerException("startTime == null");
      this.startTime = startTime;
      return this;
    }

    /** Not checked against the start time. */
    public Builder endTime(Instant endTime) {
      if (endTime == null) throw new NullPointerException("endTime == null");
      this.endTime = endTime;
      return this;
    }

    public Builder status(Status status) {
      if (status == null) throw new NullPointerException("status == null");
      this.status = status;
      return this;
    }

    public Builder hasRemoteParent(boolean hasRemoteParent) {
      this.hasRemoteParent = hasRemoteParent;
      return this;
    }

    public Builder tracestate(Tracestate tracestate) {
      if (tracestate == null) throw new NullPointerException("tracestate == null");
      this.tracestate = tracestate;
      return this;
    }

    /** Replaces an existing value for the same key, keeping its original position. */
    public Builder putAttribute(String key, Object value) {
      if (key == null) throw new NullPointerException("key == null");
      attributes.put(key, value);
      return this;
    }

    /** Adds all attributes in the iteration order of the input. */
    public Builder putAllAttributes(Map<String, ?> attributes) {
      if (attributes == null) throw new NullPointerException("attributes == null");
      attributes.forEach(this::putAttribute);
      return this;
    }

    public Builder addAnnotation(Annotation annotation) {
      if (annotation == null) throw new NullPointerException("annotation == null");
      annotations.add(annotation);
      return this;
    }

    public Builder addMessageEvent(MessageEvent messageEvent) {
      if (messageEvent == null) throw new NullPointerException("messageEvent == null");
      messageEvents.add(messageEvent);
      return this;
    }

    public Builder addLink(Link link) {
      if (link == null) throw new NullPointerException("link == null");
      links.add(link);
      return this;
    }

    public SpanData build() {
      String missing = "";
      if (traceId == null) missing += " traceId";
      if (spanId == null) missing += " spanId";
      if (startTime == null) missing += " startTime";
      if (endTime == null) missing += " endTime";
      if (!"".equals(missing)) throw new IllegalStateException("Missing :" + missing);
      return new SpanData(this);
    }

    Builder() {
    }
  }

  private final String traceId, spanId, parentId, name;
  private final SpanKind kind;
  private final Instant startTime, endTime;
  private final Status status;
  private final boolean hasRemoteParent;
  private final Tracestate tracestate;
  private final Map<String, Object> attributes;
  private final List<Annotation> annotations;
  private final List<MessageEvent> messageEvents;
  private final List<Link> links;

  SpanData(Builder builder) {
    this.traceId = builder.traceId;
    this.spanId = builder.spanId;
    this.parentId = builder.parentId;
    this.name = builder.name;
    this.kind = builder.kind;
    this.startTime = builder.startTime;
    this.endTime = builder.endTime;
    this.status = builder.status;
    this.hasRemoteParent = builder.hasRemoteParent;
    this.tracestate = builder.tracestate;
    this.attributes = ModelUtils.copyAttributes(builder.attributes);
    this.annotations = ModelUtils.copyList("annotations", builder.annotations);
    this.messageEvents = ModelUtils.copyList("messageEvents", builder.messageEvents);
    this.links = ModelUtils.copyList("links", builder.links);
  }

  public String traceId() {
    return traceId;
  }

  public String spanId() {
    return spanId;
  }

  /** Null when this is a root span. */
  public String parentId() {
    return parentId;
  }

  public String name() {
    return name;
  }

  public SpanKind kind() {
    return kind;
  }

  public Instant startTime() {
    return startTime;
  }

  public Instant endTime() {
    return endTime;
  }

  public Status status() {
    return status;
  }

  /** True when the parent of this span was propagated from another process. */
  public boolean hasRemoteParent() {
    return hasRemoteParent;
  }

  public Tracestate tracestate() {
    return tracestate;
  }

  /** Insertion-ordered and unmodifiable. */
  public Map<String, Object> attributes() {
    return attributes;
  }

  public List<Annotation> annotations() {
    return annotations;
  }

  public List<MessageEvent> messageEvents() {
    return messageEvents;
  }

  public List<Link> links() {
    return links;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SpanData)) return false;
    SpanData that = (SpanData) o;
    return traceId.equals(that.traceId)
        && spanId.equals(that.spanId)
        && Objects.equals(parentId, that.parentId)
        && name.equals(that.name)
        && kind == that.kind
        && startTime.equals(that.startTime)
        && endTime.equals(that.endTime)
        && status.equals(that.status)
        && hasRemoteParent == that.hasRemoteParent
        && tracestate.equals(that.tracestate)
        && attributes.equals(that.attributes)
        && annotations.equals(that.annotations)
        && messageEvents.equals(that.messageEvents)
        && links.equals(that.links);
  }

  @Override
  public int hashCode() {
    return Objects.hash(traceId, spanId, parentId, name, kind, startTime, endTime, status,
        hasRemoteParent, tracestate, attributes, annotations, messageEvents, links);
  }

  @Override
  public String toString() {
    return "SpanData{traceId=" + traceId + ", spanId=" + spanId + ", parentId=" + parentId
        + ", name=" + name + ", kind=" + kind + "}";
  }
}
