/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.util.Objects;

public final class Tag {

  public static Tag create(String key, String value) {
    if (key == null) throw new NullPointerException("key == null");
    if (value == null) throw new NullPointerException("value of " + key + " == null");
    return new Tag(key, value);
  }

  private final String key;
  private final String value;

  private Tag(String key, String value) {
    this.key = key;
    this.value = value;
  }

  public String key() {
    return key;
  }

  /** May be empty, which is different from the tag being absent. */
  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Tag)) return false;
    Tag that = (Tag) o;
    return key.equals(that.key) && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}
