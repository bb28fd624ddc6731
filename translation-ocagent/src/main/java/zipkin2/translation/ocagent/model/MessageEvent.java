/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.time.Instant;
import java.util.Objects;

/** A message sent or received on a span, with its size before and after compression. */
public final class MessageEvent {

  public enum Type {
    UNSPECIFIED,
    SENT,
    RECEIVED
  }

  public static MessageEvent create(Instant time, Type type, long messageId,
      long uncompressedSize, long compressedSize) {
    if (time == null) throw new NullPointerException("time == null");
    if (type == null) throw new NullPointerException("type == null");
    return new MessageEvent(time, type, messageId, uncompressedSize, compressedSize);
  }

  private final Instant time;
  private final Type type;
  private final long messageId;
  private final long uncompressedSize;
  private final long compressedSize;

  private MessageEvent(Instant time, Type type, long messageId, long uncompressedSize,
      long compressedSize) {
    this.time = time;
    this.type = type;
    this.messageId = messageId;
    this.uncompressedSize = uncompressedSize;
    this.compressedSize = compressedSize;
  }

  public Instant time() {
    return time;
  }

  public Type type() {
    return type;
  }

  /** Identifier of the message within the span, or zero if not known. */
  public long messageId() {
    return messageId;
  }

  public long uncompressedSize() {
    return uncompressedSize;
  }

  /** Zero when the message was not compressed. */
  public long compressedSize() {
    return compressedSize;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MessageEvent)) return false;
    MessageEvent that = (MessageEvent) o;
    return time.equals(that.time)
        && type == that.type
        && messageId == that.messageId
        && uncompressedSize == that.uncompressedSize
        && compressedSize == that.compressedSize;
  }

  @Override
  public int hashCode() {
    return Objects.hash(time, type, messageId, uncompressedSize, compressedSize);
  }

  @Override
  public String toString() {
    return "MessageEvent{time=" + time + ", type=" + type + ", messageId=" + messageId
        + ", uncompressedSize=" + uncompressedSize + ", compressedSize=" + compressedSize + "}";
  }
}
