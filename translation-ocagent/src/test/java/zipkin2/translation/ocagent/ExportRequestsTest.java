/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent;

import java.time.Instant;
import java.util.Collections;

import com.google.protobuf.InvalidProtocolBufferException;
import io.opencensus.proto.agent.common.v1.LibraryInfo;
import io.opencensus.proto.agent.common.v1.Node;
import io.opencensus.proto.agent.common.v1.ProcessIdentifier;
import io.opencensus.proto.agent.common.v1.ServiceInfo;
import io.opencensus.proto.agent.metrics.v1.ExportMetricsServiceRequest;
import io.opencensus.proto.agent.trace.v1.ExportTraceServiceRequest;
import io.opencensus.proto.resource.v1.Resource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static zipkin2.translation.ocagent.TestObjects.START;
import static zipkin2.translation.ocagent.TestObjects.latencyViewData;
import static zipkin2.translation.ocagent.TestObjects.serverSpan;

class ExportRequestsTest {
  static final Instant PROCESS_START = Instant.ofEpochSecond(1472470000, 5);

  Node node = Node.newBuilder()
      .setIdentifier(ProcessIdentifier.newBuilder().setHostName("api.local").setPid(4321))
      .setLibraryInfo(LibraryInfo.newBuilder()
          .setLanguage(LibraryInfo.Language.JAVA)
          .setExporterVersion("0.1.0"))
      .setServiceInfo(ServiceInfo.newBuilder().setName("frontend"))
      .putAttributes("env", "test")
      .build();
  Resource resource = Resource.newBuilder()
      .setType("k8s.io/container")
      .putLabels("k8s.io/pod/name", "frontend-1")
      .build();

  ExportTraceServiceRequest traces =
      SpanTranslator.create().translate(Collections.singletonList(serverSpan()));
  ExportMetricsServiceRequest metrics =
      ViewTranslator.translate(Collections.singletonList(latencyViewData()));

  @Test
  void withNode_stampsStartTime() {
    ExportTraceServiceRequest request = ExportRequests.withNode(traces, node, PROCESS_START);

    Node sent = request.getNode();
    assertThat(sent.getIdentifier().getStartTimestamp().getSeconds()).isEqualTo(1472470000L);
    assertThat(sent.getIdentifier().getStartTimestamp().getNanos()).isEqualTo(5);
    assertThat(sent.getIdentifier().getHostName()).isEqualTo("api.local");
    assertThat(sent.getIdentifier().getPid()).isEqualTo(4321);
    assertThat(sent.getLibraryInfo()).isEqualTo(node.getLibraryInfo());
    assertThat(sent.getServiceInfo()).isEqualTo(node.getServiceInfo());
    assertThat(sent.getAttributesMap()).containsEntry("env", "test");
    assertThat(request.getSpansList()).isEqualTo(traces.getSpansList());
  }

  @Test
  void withNode_nodeWithoutIdentifier() {
    ExportMetricsServiceRequest request =
        ExportRequests.withNode(metrics, Node.getDefaultInstance(), PROCESS_START);

    assertThat(request.getNode().getIdentifier().getHostName()).isEmpty();
    assertThat(request.getNode().getIdentifier().getStartTimestamp().getSeconds())
        .isEqualTo(1472470000L);
    assertThat(request.getMetricsList()).isEqualTo(metrics.getMetricsList());
  }

  @Test
  void withNode_doesNotMutateInput() {
    ExportRequests.withNode(traces, node, PROCESS_START);

    assertThat(traces.hasNode()).isFalse();
    assertThat(node.getIdentifier().hasStartTimestamp()).isFalse();
  }

  @Test
  void withResource_attachedVerbatim() {
    assertThat(ExportRequests.withResource(traces, resource).getResource()).isEqualTo(resource);
    assertThat(ExportRequests.withResource(metrics, resource).getResource()).isEqualTo(resource);
  }

  @Test
  void withResource_lastWriteWins() {
    Resource other = Resource.newBuilder().setType("host").build();

    ExportMetricsServiceRequest request =
        ExportRequests.withResource(ExportRequests.withResource(metrics, resource), other);

    assertThat(request.getResource()).isEqualTo(other);
  }

  @Test
  void withNode_lastWriteWins() {
    Instant later = START.plusSeconds(60);

    ExportTraceServiceRequest request = ExportRequests.withNode(
        ExportRequests.withNode(traces, node, PROCESS_START), node, later);

    assertThat(request.getNode().getIdentifier().getStartTimestamp().getSeconds())
        .isEqualTo(later.getEpochSecond());
  }

  @Test
  void survivesSerialization() throws InvalidProtocolBufferException {
    ExportTraceServiceRequest request =
        ExportRequests.withResource(ExportRequests.withNode(traces, node, PROCESS_START), resource);

    assertThat(ExportTraceServiceRequest.parseFrom(request.toByteArray())).isEqualTo(request);
  }

  @Test
  void nullArguments() {
    assertThatThrownBy(() -> ExportRequests.withNode(traces, null, PROCESS_START))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("node == null");
    assertThatThrownBy(() -> ExportRequests.withNode(traces, node, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("startTime == null");
    assertThatThrownBy(() -> ExportRequests.withResource(metrics, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("resource == null");
    assertThatThrownBy(() -> ExportRequests.withResource((ExportMetricsServiceRequest) null, resource))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("request == null");
  }
}
