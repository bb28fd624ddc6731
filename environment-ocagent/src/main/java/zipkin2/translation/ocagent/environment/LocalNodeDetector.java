/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.environment;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.opencensus.proto.agent.common.v1.Node;
import io.opencensus.proto.agent.common.v1.ProcessIdentifier;
import io.opencensus.proto.agent.common.v1.ServiceInfo;

/**
 * Describes the current process: its host name and pid, this library, and the service name
 * configured by the caller.
 *
 * <p>The process start time is not detected. Supply it when attaching the node, with
 * {@code ExportRequests.withNode(request, node, startTime)}.
 */
public final class LocalNodeDetector implements NodeDetector {
  static final Logger LOG = Logger.getLogger(LocalNodeDetector.class.getName());

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String serviceName = "", hostName;
    final Map<String, String> attributes = new LinkedHashMap<>();

    /** The name of the service this process belongs to. Defaults to the empty string. */
    public Builder serviceName(String serviceName) {
      if (serviceName == null) throw new NullPointerException("serviceName == null");
      this.serviceName = serviceName;
      return this;
    }

    /** Overrides the host name, instead of looking up the local host. */
    public Builder hostName(String hostName) {
      if (hostName == null) throw new NullPointerException("hostName == null");
      this.hostName = hostName;
      return this;
    }

    /** Adds an attribute describing the node, such as its deployment environment. */
    public Builder putAttribute(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      attributes.put(key, value);
      return this;
    }

    public LocalNodeDetector build() {
      return new LocalNodeDetector(this);
    }

    Builder() {
    }
  }

  final String serviceName, hostName;
  final Map<String, String> attributes;

  LocalNodeDetector(Builder builder) {
    this.serviceName = builder.serviceName;
    this.hostName = builder.hostName;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
  }

  @Override
  public Node detect() {
    return Node.newBuilder()
        .setIdentifier(ProcessIdentifier.newBuilder()
            .setHostName(hostName != null ? hostName : localHostName())
            .setPid((int) ProcessHandle.current().pid()))
        .setLibraryInfo(ExporterLibrary.libraryInfo())
        .setServiceInfo(ServiceInfo.newBuilder().setName(serviceName))
        .putAllAttributes(attributes)
        .build();
  }

  static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      LOG.log(Level.FINE, "error resolving local host name", e);
      return "";
    }
  }
}
