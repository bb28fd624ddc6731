/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent;

import java.time.Instant;

import io.opencensus.proto.agent.common.v1.Node;
import io.opencensus.proto.agent.metrics.v1.ExportMetricsServiceRequest;
import io.opencensus.proto.agent.trace.v1.ExportTraceServiceRequest;
import io.opencensus.proto.resource.v1.Resource;

import static zipkin2.translation.ocagent.ProtoUtils.toTimestamp;

/**
 * Attaches the node and resource descriptors to translated requests. Descriptors are attached
 * verbatim, and attaching again replaces the previous value.
 *
 * <p>The agent expects the node on the first request of a stream, so attach it before sending.
 *
 * <p>Requests are immutable, so each method returns a copy of its input with the field set.
 */
public final class ExportRequests {

  public static ExportTraceServiceRequest withResource(ExportTraceServiceRequest request,
      Resource resource) {
    if (request == null) throw new NullPointerException("request == null");
    if (resource == null) throw new NullPointerException("resource == null");
    return request.toBuilder().setResource(resource).build();
  }

  public static ExportMetricsServiceRequest withResource(ExportMetricsServiceRequest request,
      Resource resource) {
    if (request == null) throw new NullPointerException("request == null");
    if (resource == null) throw new NullPointerException("resource == null");
    return request.toBuilder().setResource(resource).build();
  }

  /**
   * Attaches the node, after setting its process start time to {@code startTime}.
   *
   * @param startTime when the process that produced the spans started
   */
  public static ExportTraceServiceRequest withNode(ExportTraceServiceRequest request, Node node,
      Instant startTime) {
    if (request == null) throw new NullPointerException("request == null");
    return request.toBuilder().setNode(nodeWithStartTime(node, startTime)).build();
  }

  /**
   * Attaches the node, after setting its process start time to {@code startTime}.
   *
   * @param startTime when the process that produced the view data started
   */
  public static ExportMetricsServiceRequest withNode(ExportMetricsServiceRequest request,
      Node node, Instant startTime) {
    if (request == null) throw new NullPointerException("request == null");
    return request.toBuilder().setNode(nodeWithStartTime(node, startTime)).build();
  }

  static Node nodeWithStartTime(Node node, Instant startTime) {
    if (node == null) throw new NullPointerException("node == null");
    if (startTime == null) throw new NullPointerException("startTime == null");
    Node.Builder result = node.toBuilder();
    result.getIdentifierBuilder().setStartTimestamp(toTimestamp(startTime));
    return result.build();
  }

  private ExportRequests() {
  }
}
