/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.protobuf.BoolValue;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import io.opencensus.proto.agent.trace.v1.ExportTraceServiceRequest;
import io.opencensus.proto.trace.v1.AttributeValue;
import io.opencensus.proto.trace.v1.Span;
import io.opencensus.proto.trace.v1.Span.TimeEvent;
import org.junit.jupiter.api.Test;
import zipkin2.translation.ocagent.model.Annotation;
import zipkin2.translation.ocagent.model.Link;
import zipkin2.translation.ocagent.model.MessageEvent;
import zipkin2.translation.ocagent.model.SpanData;
import zipkin2.translation.ocagent.model.SpanKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static zipkin2.translation.ocagent.ProtoUtils.truncatableString;
import static zipkin2.translation.ocagent.TestObjects.END;
import static zipkin2.translation.ocagent.TestObjects.LINKED_SPAN_ID;
import static zipkin2.translation.ocagent.TestObjects.LINKED_TRACE_ID;
import static zipkin2.translation.ocagent.TestObjects.PARENT_ID;
import static zipkin2.translation.ocagent.TestObjects.SPAN_ID;
import static zipkin2.translation.ocagent.TestObjects.START;
import static zipkin2.translation.ocagent.TestObjects.TRACE_ID;
import static zipkin2.translation.ocagent.TestObjects.rootSpan;
import static zipkin2.translation.ocagent.TestObjects.serverSpan;

class SpanTranslatorTest {
  static final Timestamp START_TIMESTAMP =
      Timestamp.newBuilder().setSeconds(1472470996).setNanos(199_000_000).build();
  static final Timestamp END_TIMESTAMP =
      Timestamp.newBuilder().setSeconds(1472471013).setNanos(199_000_000).build();

  SpanTranslator translator = SpanTranslator.create();

  /** This test is intentionally sensitive, so changing other parts makes obvious impact here */
  @Test
  void translate_serverSpan() {
    Span.Attributes startAttributes = Span.Attributes.newBuilder()
        .putAttributeMap("timeout_ns", AttributeValue.newBuilder().setIntValue(12_000_000_000L).build())
        .putAttributeMap("agent", AttributeValue.newBuilder().setStringValue(truncatableString("ocagent")).build())
        .putAttributeMap("cache_hit", AttributeValue.newBuilder().setBoolValue(true).build())
        .build();

    assertThat(translator.translate(serverSpan()))
        .isEqualTo(Span.newBuilder()
            .setTraceId(ByteString.fromHex(TRACE_ID))
            .setSpanId(ByteString.fromHex(SPAN_ID))
            .setParentSpanId(ByteString.fromHex(PARENT_ID))
            .setTracestate(Span.Tracestate.newBuilder()
                .addEntries(Span.Tracestate.Entry.newBuilder().setKey("foo").setValue("bar"))
                .addEntries(Span.Tracestate.Entry.newBuilder().setKey("a").setValue("b")))
            .setName(truncatableString("End-To-End Here"))
            .setKind(Span.SpanKind.SERVER)
            .setStartTime(START_TIMESTAMP)
            .setEndTime(END_TIMESTAMP)
            .setAttributes(startAttributes.toBuilder()
                .putAttributeMap("ping_count", AttributeValue.newBuilder().setIntValue(25).build()))
            .setTimeEvents(Span.TimeEvents.newBuilder()
                .addTimeEvent(TimeEvent.newBuilder()
                    .setTime(START_TIMESTAMP)
                    .setAnnotation(TimeEvent.Annotation.newBuilder()
                        .setDescription(truncatableString("start"))
                        .setAttributes(startAttributes)))
                .addTimeEvent(TimeEvent.newBuilder()
                    .setTime(START_TIMESTAMP)
                    .setMessageEvent(TimeEvent.MessageEvent.newBuilder()
                        .setType(TimeEvent.MessageEvent.Type.SENT)
                        .setId(1L)
                        .setUncompressedSize(1024L)
                        .setCompressedSize(512L)))
                .addTimeEvent(TimeEvent.newBuilder()
                    .setTime(END_TIMESTAMP)
                    .setMessageEvent(TimeEvent.MessageEvent.newBuilder()
                        .setType(TimeEvent.MessageEvent.Type.RECEIVED)
                        .setId(2L)
                        .setUncompressedSize(1024L)
                        .setCompressedSize(1000L))))
            .setLinks(Span.Links.newBuilder()
                .addLink(Span.Link.newBuilder()
                    .setTraceId(ByteString.fromHex(LINKED_TRACE_ID))
                    .setSpanId(ByteString.fromHex(LINKED_SPAN_ID))
                    .setType(Span.Link.Type.CHILD_LINKED_SPAN)))
            .setStatus(io.opencensus.proto.trace.v1.Status.newBuilder()
                .setCode(13)
                .setMessage("This is not a drill!"))
            .setSameProcessAsParentSpan(BoolValue.newBuilder().setValue(false))
            .build());
  }

  @Test
  void translate_minimalSpanLeavesOptionalFieldsUnset() {
    Span span = translator.translate(rootSpan(SPAN_ID, "get"));

    assertThat(span.getParentSpanId()).isEqualTo(ByteString.EMPTY);
    assertThat(span.hasTracestate()).isFalse();
    assertThat(span.hasAttributes()).isFalse();
    assertThat(span.hasTimeEvents()).isFalse();
    assertThat(span.hasLinks()).isFalse();
    assertThat(span.getKind()).isEqualTo(Span.SpanKind.SPAN_KIND_UNSPECIFIED);
    assertThat(span.getStatus().getCode()).isZero();
    assertThat(span.getStatus().getMessage()).isEmpty();
    assertThat(span.getSameProcessAsParentSpan().getValue()).isTrue();
    assertThat(span.getName().getValue()).isEqualTo("get");
    assertThat(span.getName().getTruncatedByteCount()).isZero();
  }

  @Test
  void translate_allZerosParentIsRoot() {
    SpanData span = SpanData.newBuilder()
        .traceId(TRACE_ID)
        .spanId(SPAN_ID)
        .parentId("0000000000000000")
        .startTime(START)
        .endTime(END)
        .build();

    assertThat(translator.translate(span).getParentSpanId()).isEqualTo(ByteString.EMPTY);
  }

  @Test
  void translate_idsAreRawBytes() {
    Span span = translator.translate(serverSpan());

    assertThat(span.getTraceId().size()).isEqualTo(16);
    assertThat(span.getTraceId().byteAt(15)).isEqualTo((byte) 0x0f);
    assertThat(span.getSpanId().size()).isEqualTo(8);
    assertThat(span.getSpanId().byteAt(0)).isEqualTo((byte) 0xff);
    assertThat(span.getParentSpanId().size()).isEqualTo(8);
  }

  @Test
  void translate_kind() {
    assertThat(translator.translate(kindSpan(SpanKind.CLIENT)).getKind())
        .isEqualTo(Span.SpanKind.CLIENT);
    assertThat(translator.translate(kindSpan(SpanKind.SERVER)).getKind())
        .isEqualTo(Span.SpanKind.SERVER);
    assertThat(translator.translate(kindSpan(SpanKind.UNSPECIFIED)).getKind())
        .isEqualTo(Span.SpanKind.SPAN_KIND_UNSPECIFIED);
    assertThat(translator.translate(kindSpan(null)).getKind())
        .isEqualTo(Span.SpanKind.SPAN_KIND_UNSPECIFIED);
  }

  @Test
  void translate_linkTypes() {
    SpanData span = SpanData.newBuilder()
        .traceId(TRACE_ID)
        .spanId(SPAN_ID)
        .startTime(START)
        .endTime(END)
        .addLink(Link.create(LINKED_TRACE_ID, LINKED_SPAN_ID, Link.Type.PARENT,
            Collections.singletonMap("reason", "batch")))
        .addLink(Link.create(LINKED_TRACE_ID, LINKED_SPAN_ID, Link.Type.UNSPECIFIED))
        .build();

    Span.Links links = translator.translate(span).getLinks();

    assertThat(links.getLinkList()).extracting(Span.Link::getType).containsExactly(
        Span.Link.Type.PARENT_LINKED_SPAN, Span.Link.Type.TYPE_UNSPECIFIED);
    assertThat(links.getLink(0).getAttributes().getAttributeMapMap())
        .containsOnlyKeys("reason");
    assertThat(links.getLink(1).hasAttributes()).isFalse();
    assertThat(links.getDroppedLinksCount()).isZero();
  }

  @Test
  void translate_annotationsBeforeMessageEvents() {
    SpanData span = SpanData.newBuilder()
        .traceId(TRACE_ID)
        .spanId(SPAN_ID)
        .startTime(START)
        .endTime(END)
        .addMessageEvent(MessageEvent.create(START, MessageEvent.Type.UNSPECIFIED, 7L, 0L, 0L))
        .addAnnotation(Annotation.create(END, "done"))
        .build();

    Span.TimeEvents timeEvents = translator.translate(span).getTimeEvents();

    assertThat(timeEvents.getTimeEventList()).extracting(TimeEvent::getValueCase).containsExactly(
        TimeEvent.ValueCase.ANNOTATION, TimeEvent.ValueCase.MESSAGE_EVENT);
    assertThat(timeEvents.getTimeEvent(0).getAnnotation().hasAttributes()).isFalse();
    assertThat(timeEvents.getTimeEvent(1).getMessageEvent().getType())
        .isEqualTo(TimeEvent.MessageEvent.Type.TYPE_UNSPECIFIED);
  }

  @Test
  void translate_request_keepsOrder() {
    ExportTraceServiceRequest request = translator.translate(Arrays.asList(
        rootSpan("0000000000000001", "a"),
        rootSpan("0000000000000002", "b"),
        rootSpan("0000000000000003", "c")));

    assertThat(request.getSpansList())
        .extracting(s -> s.getName().getValue())
        .containsExactly("a", "b", "c");
    assertThat(request.hasNode()).isFalse();
    assertThat(request.hasResource()).isFalse();
  }

  @Test
  void translate_request_empty() {
    assertThat(translator.translate(Collections.<SpanData>emptyList()))
        .isEqualTo(ExportTraceServiceRequest.getDefaultInstance());
  }

  @Test
  void translate_request_null() {
    assertThatThrownBy(() -> translator.translate((java.util.List<SpanData>) null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("spans == null");
  }

  @Test
  void limits_truncateAndCountDropped() {
    SpanTranslator limited = SpanTranslator.newBuilder()
        .maxAttributes(2)
        .maxAnnotationAttributes(1)
        .maxLinkAttributes(0)
        .maxAnnotations(0)
        .maxMessageEvents(1)
        .maxLinks(0)
        .build();

    Span span = limited.translate(serverSpan());

    assertThat(span.getAttributes().getAttributeMapMap()).containsOnlyKeys("timeout_ns", "agent");
    assertThat(span.getAttributes().getDroppedAttributesCount()).isEqualTo(2);
    assertThat(span.getTimeEvents().getTimeEventCount()).isEqualTo(1);
    assertThat(span.getTimeEvents().getTimeEvent(0).getMessageEvent().getId()).isEqualTo(1L);
    assertThat(span.getTimeEvents().getDroppedAnnotationsCount()).isEqualTo(1);
    assertThat(span.getTimeEvents().getDroppedMessageEventsCount()).isEqualTo(1);
    assertThat(span.getLinks().getLinkCount()).isZero();
    assertThat(span.getLinks().getDroppedLinksCount()).isEqualTo(1);
  }

  @Test
  void limits_annotationAttributes() {
    SpanTranslator limited = SpanTranslator.newBuilder().maxAnnotationAttributes(1).build();

    Span.Attributes attributes = limited.translate(serverSpan())
        .getTimeEvents().getTimeEvent(0).getAnnotation().getAttributes();

    assertThat(attributes.getAttributeMapMap()).containsOnlyKeys("timeout_ns");
    assertThat(attributes.getDroppedAttributesCount()).isEqualTo(2);
  }

  @Test
  void limits_linkAttributes() {
    Map<String, Object> linkAttributes = new LinkedHashMap<>();
    linkAttributes.put("a", 1);
    linkAttributes.put("b", new Object());
    linkAttributes.put("c", 2.0);
    SpanData span = SpanData.newBuilder()
        .traceId(TRACE_ID)
        .spanId(SPAN_ID)
        .startTime(START)
        .endTime(END)
        .putAllAttributes(linkAttributes)
        .addLink(Link.create(LINKED_TRACE_ID, LINKED_SPAN_ID, Link.Type.CHILD, linkAttributes))
        .build();
    SpanTranslator limited = SpanTranslator.newBuilder().maxLinkAttributes(1).build();

    Span translated = limited.translate(span);

    Span.Attributes attributes = translated.getLinks().getLink(0).getAttributes();
    assertThat(attributes.getAttributeMapMap()).containsOnlyKeys("a");
    assertThat(attributes.getDroppedAttributesCount()).isEqualTo(2);
    assertThat(translated.getAttributes().getAttributeMapMap()).containsOnlyKeys("a", "b", "c");
    assertThat(translated.getAttributes().getDroppedAttributesCount()).isZero();
    assertThat(translated.getLinks().getDroppedLinksCount()).isZero();
  }

  @Test
  void limits_unlimitedByDefault() {
    Span span = translator.translate(serverSpan());

    assertThat(span.getAttributes().getDroppedAttributesCount()).isZero();
    assertThat(span.getTimeEvents().getDroppedAnnotationsCount()).isZero();
    assertThat(span.getTimeEvents().getDroppedMessageEventsCount()).isZero();
    assertThat(span.getLinks().getDroppedLinksCount()).isZero();
  }

  @Test
  void limits_negative() {
    assertThatThrownBy(() -> SpanTranslator.newBuilder().maxLinks(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("maxLinks < 0");
    assertThatThrownBy(() -> SpanTranslator.newBuilder().maxAttributes(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("maxAttributes < 0");
  }

  static SpanData kindSpan(SpanKind kind) {
    return SpanData.newBuilder()
        .traceId(TRACE_ID)
        .spanId(SPAN_ID)
        .kind(kind)
        .startTime(START)
        .endTime(END)
        .build();
  }
}
