/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent;

import java.util.List;

import com.google.protobuf.BoolValue;
import com.google.protobuf.ByteString;
import io.opencensus.proto.agent.trace.v1.ExportTraceServiceRequest;
import io.opencensus.proto.trace.v1.Span;
import io.opencensus.proto.trace.v1.Span.TimeEvent;
import zipkin2.translation.ocagent.model.Annotation;
import zipkin2.translation.ocagent.model.Link;
import zipkin2.translation.ocagent.model.MessageEvent;
import zipkin2.translation.ocagent.model.SpanData;
import zipkin2.translation.ocagent.model.SpanKind;
import zipkin2.translation.ocagent.model.Status;
import zipkin2.translation.ocagent.model.Tracestate;

import static zipkin2.translation.ocagent.ProtoUtils.toTimestamp;
import static zipkin2.translation.ocagent.ProtoUtils.truncatableString;

/**
 * SpanTranslator converts recorded {@link SpanData} into an OpenCensus agent
 * {@link ExportTraceServiceRequest}.
 *
 * <p>Ex.
 *
 * <pre>{@code
 * request = SpanTranslator.create().translate(spans);
 * request = ExportRequests.withNode(request, node, startTime);
 * }</pre>
 *
 * <p>Spans are emitted in input order. Each limit below truncates its list or attribute bag to the
 * first N entries and records the remainder in the corresponding dropped count of the wire span.
 * All limits default to {@link #NO_LIMIT}.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class SpanTranslator {
  public static final int NO_LIMIT = Integer.MAX_VALUE;

  public static SpanTranslator create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    int maxAttributes = NO_LIMIT;
    int maxAnnotationAttributes = NO_LIMIT;
    int maxLinkAttributes = NO_LIMIT;
    int maxAnnotations = NO_LIMIT;
    int maxMessageEvents = NO_LIMIT;
    int maxLinks = NO_LIMIT;

    /** Maximum attributes kept per span. */
    public Builder maxAttributes(int maxAttributes) {
      this.maxAttributes = checkLimit("maxAttributes", maxAttributes);
      return this;
    }

    /** Maximum attributes kept per annotation. */
    public Builder maxAnnotationAttributes(int maxAnnotationAttributes) {
      this.maxAnnotationAttributes = checkLimit("maxAnnotationAttributes", maxAnnotationAttributes);
      return this;
    }

    /** Maximum attributes kept per link. */
    public Builder maxLinkAttributes(int maxLinkAttributes) {
      this.maxLinkAttributes = checkLimit("maxLinkAttributes", maxLinkAttributes);
      return this;
    }

    public Builder maxAnnotations(int maxAnnotations) {
      this.maxAnnotations = checkLimit("maxAnnotations", maxAnnotations);
      return this;
    }

    public Builder maxMessageEvents(int maxMessageEvents) {
      this.maxMessageEvents = checkLimit("maxMessageEvents", maxMessageEvents);
      return this;
    }

    public Builder maxLinks(int maxLinks) {
      this.maxLinks = checkLimit("maxLinks", maxLinks);
      return this;
    }

    public SpanTranslator build() {
      return new SpanTranslator(this);
    }

    static int checkLimit(String name, int limit) {
      if (limit < 0) throw new IllegalArgumentException(name + " < 0");
      return limit;
    }

    Builder() {
    }
  }

  final AttributesExtractor spanAttributes;
  final AttributesExtractor annotationAttributes;
  final AttributesExtractor linkAttributes;
  final int maxAnnotations, maxMessageEvents, maxLinks;

  SpanTranslator(Builder builder) {
    this.spanAttributes = new AttributesExtractor(builder.maxAttributes);
    this.annotationAttributes = new AttributesExtractor(builder.maxAnnotationAttributes);
    this.linkAttributes = new AttributesExtractor(builder.maxLinkAttributes);
    this.maxAnnotations = builder.maxAnnotations;
    this.maxMessageEvents = builder.maxMessageEvents;
    this.maxLinks = builder.maxLinks;
  }

  /**
   * Converts spans into a request with one wire span per input span, in the same order. The node
   * and resource are left unset.
   *
   * @see ExportRequests
   */
  public ExportTraceServiceRequest translate(List<SpanData> spans) {
    if (spans == null) throw new NullPointerException("spans == null");
    ExportTraceServiceRequest.Builder result = ExportTraceServiceRequest.newBuilder();
    for (SpanData span : spans) {
      result.addSpans(translate(span));
    }
    return result.build();
  }

  Span translate(SpanData span) {
    Span.Builder spanBuilder = Span.newBuilder()
        .setTraceId(ByteString.fromHex(span.traceId()))
        .setSpanId(ByteString.fromHex(span.spanId()))
        .setName(truncatableString(span.name()))
        .setKind(translateKind(span.kind()))
        .setStartTime(toTimestamp(span.startTime()))
        .setEndTime(toTimestamp(span.endTime()))
        .setStatus(translateStatus(span.status()))
        .setSameProcessAsParentSpan(BoolValue.newBuilder().setValue(!span.hasRemoteParent()));
    if (span.parentId() != null) {
      spanBuilder.setParentSpanId(ByteString.fromHex(span.parentId()));
    }
    if (!span.tracestate().entries().isEmpty()) {
      spanBuilder.setTracestate(translateTracestate(span.tracestate()));
    }
    Span.Attributes attributes = spanAttributes.extract(span.attributes());
    if (attributes != null) {
      spanBuilder.setAttributes(attributes);
    }
    if (!span.annotations().isEmpty() || !span.messageEvents().isEmpty()) {
      spanBuilder.setTimeEvents(translateTimeEvents(span));
    }
    if (!span.links().isEmpty()) {
      spanBuilder.setLinks(translateLinks(span.links()));
    }
    return spanBuilder.build();
  }

  /** Annotations come first, then message events. */
  Span.TimeEvents translateTimeEvents(SpanData span) {
    Span.TimeEvents.Builder result = Span.TimeEvents.newBuilder();
    List<Annotation> annotations = span.annotations();
    int annotationCount = Math.min(annotations.size(), maxAnnotations);
    for (int i = 0; i < annotationCount; i++) {
      result.addTimeEvent(translateAnnotation(annotations.get(i)));
    }
    result.setDroppedAnnotationsCount(annotations.size() - annotationCount);

    List<MessageEvent> messageEvents = span.messageEvents();
    int messageEventCount = Math.min(messageEvents.size(), maxMessageEvents);
    for (int i = 0; i < messageEventCount; i++) {
      result.addTimeEvent(translateMessageEvent(messageEvents.get(i)));
    }
    result.setDroppedMessageEventsCount(messageEvents.size() - messageEventCount);
    return result.build();
  }

  TimeEvent translateAnnotation(Annotation annotation) {
    TimeEvent.Annotation.Builder result = TimeEvent.Annotation.newBuilder()
        .setDescription(truncatableString(annotation.message()));
    Span.Attributes attributes = annotationAttributes.extract(annotation.attributes());
    if (attributes != null) {
      result.setAttributes(attributes);
    }
    return TimeEvent.newBuilder()
        .setTime(toTimestamp(annotation.time()))
        .setAnnotation(result)
        .build();
  }

  static TimeEvent translateMessageEvent(MessageEvent messageEvent) {
    return TimeEvent.newBuilder()
        .setTime(toTimestamp(messageEvent.time()))
        .setMessageEvent(TimeEvent.MessageEvent.newBuilder()
            .setType(translateMessageEventType(messageEvent.type()))
            .setId(messageEvent.messageId())
            .setUncompressedSize(messageEvent.uncompressedSize())
            .setCompressedSize(messageEvent.compressedSize()))
        .build();
  }

  Span.Links translateLinks(List<Link> links) {
    Span.Links.Builder result = Span.Links.newBuilder();
    int linkCount = Math.min(links.size(), maxLinks);
    for (int i = 0; i < linkCount; i++) {
      Link link = links.get(i);
      Span.Link.Builder linkBuilder = Span.Link.newBuilder()
          .setTraceId(ByteString.fromHex(link.traceId()))
          .setSpanId(ByteString.fromHex(link.spanId()))
          .setType(translateLinkType(link.type()));
      Span.Attributes attributes = linkAttributes.extract(link.attributes());
      if (attributes != null) {
        linkBuilder.setAttributes(attributes);
      }
      result.addLink(linkBuilder);
    }
    return result.setDroppedLinksCount(links.size() - linkCount).build();
  }

  static Span.Tracestate translateTracestate(Tracestate tracestate) {
    Span.Tracestate.Builder result = Span.Tracestate.newBuilder();
    for (Tracestate.Entry entry : tracestate.entries()) {
      result.addEntries(Span.Tracestate.Entry.newBuilder()
          .setKey(entry.key())
          .setValue(entry.value()));
    }
    return result.build();
  }

  static io.opencensus.proto.trace.v1.Status translateStatus(Status status) {
    return io.opencensus.proto.trace.v1.Status.newBuilder()
        .setCode(status.code())
        .setMessage(status.message())
        .build();
  }

  static Span.SpanKind translateKind(SpanKind kind) {
    if (kind != null) {
      switch (kind) {
        case SERVER:
          return Span.SpanKind.SERVER;
        case CLIENT:
          return Span.SpanKind.CLIENT;
        default:
          break;
      }
    }
    return Span.SpanKind.SPAN_KIND_UNSPECIFIED;
  }

  static TimeEvent.MessageEvent.Type translateMessageEventType(MessageEvent.Type type) {
    switch (type) {
      case SENT:
        return TimeEvent.MessageEvent.Type.SENT;
      case RECEIVED:
        return TimeEvent.MessageEvent.Type.RECEIVED;
      default:
        return TimeEvent.MessageEvent.Type.TYPE_UNSPECIFIED;
    }
  }

  static Span.Link.Type translateLinkType(Link.Type type) {
    switch (type) {
      case CHILD:
        return Span.Link.Type.CHILD_LINKED_SPAN;
      case PARENT:
        return Span.Link.Type.PARENT_LINKED_SPAN;
      default:
        return Span.Link.Type.TYPE_UNSPECIFIED;
    }
  }
}
