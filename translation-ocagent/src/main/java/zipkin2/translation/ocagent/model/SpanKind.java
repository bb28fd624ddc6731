/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

/** The relationship of a span to its remote peer, if any. */
public enum SpanKind {
  UNSPECIFIED,
  /** Handles a request from a remote client. */
  SERVER,
  /** Issues a request to a remote server. */
  CLIENT
}
