/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent;

import java.time.Instant;

import com.google.protobuf.Timestamp;
import io.opencensus.proto.trace.v1.TruncatableString;

final class ProtoUtils {

  static Timestamp toTimestamp(Instant instant) {
    return Timestamp.newBuilder()
        .setSeconds(instant.getEpochSecond())
        .setNanos(instant.getNano())
        .build();
  }

  /** Wraps the value as-is: nothing is truncated, so the truncated byte count stays zero. */
  static TruncatableString truncatableString(String value) {
    return TruncatableString.newBuilder().setValue(value).build();
  }

  private ProtoUtils() {
  }
}
