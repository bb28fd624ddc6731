/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.environment;

import io.opencensus.proto.resource.v1.Resource;

/**
 * Resolves the entity producing telemetry, such as a container or a cloud instance, once per
 * process. The result is attached to export requests as-is.
 *
 * @see EnvironmentResourceDetector
 */
@FunctionalInterface
public interface ResourceDetector {

  /** Returns null when no resource could be detected. */
  Resource detect();
}
