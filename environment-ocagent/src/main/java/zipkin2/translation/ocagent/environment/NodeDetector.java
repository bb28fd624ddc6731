/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.environment;

import io.opencensus.proto.agent.common.v1.Node;

/**
 * Resolves the node that identifies this process and library to the agent.
 *
 * @see LocalNodeDetector
 */
@FunctionalInterface
public interface NodeDetector {

  Node detect();
}
