/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.util.Objects;

/**
 * Result of a span, as a canonical status code and an optional developer-facing message.
 *
 * <p>Codes are the <a href="https://github.com/googleapis/googleapis/blob/master/google/rpc/code.proto">
 * google.rpc.Code</a> values, where zero means OK.
 */
public final class Status {
  public static final int CODE_OK = 0;
  public static final int CODE_INTERNAL = 13;

  public static final Status OK = new Status(CODE_OK, "");

  public static Status create(int code, String message) {
    if (message == null) throw new NullPointerException("message == null");
    return new Status(code, message);
  }

  private final int code;
  private final String message;

  private Status(int code, String message) {
    this.code = code;
    this.message = message;
  }

  public int code() {
    return code;
  }

  public String message() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Status)) return false;
    Status that = (Status) o;
    return code == that.code && message.equals(that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message);
  }

  @Override
  public String toString() {
    return "Status{code=" + code + ", message=" + message + "}";
  }
}
