/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Vendor-specific trace identification, propagated alongside the trace context as an ordered list
 * of key/value entries.
 *
 * @see <a href="https://www.w3.org/TR/trace-context/#tracestate-header">tracestate header</a>
 */
public final class Tracestate {
  public static final Tracestate EMPTY = new Tracestate(Collections.<Entry>emptyList());

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    final List<Entry> entries = new ArrayList<>();

    /** Appends an entry. Order is kept as added. */
    public Builder add(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      entries.add(new Entry(key, value));
      return this;
    }

    public Tracestate build() {
      if (entries.isEmpty()) return EMPTY;
      return new Tracestate(Collections.unmodifiableList(new ArrayList<>(entries)));
    }

    Builder() {
    }
  }

  public static final class Entry {
    private final String key;
    private final String value;

    Entry(String key, String value) {
      this.key = key;
      this.value = value;
    }

    public String key() {
      return key;
    }

    public String value() {
      return value;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Entry)) return false;
      Entry that = (Entry) o;
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

  private final List<Entry> entries;

  private Tracestate(List<Entry> entries) {
    this.entries = entries;
  }

  public List<Entry> entries() {
    return entries;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Tracestate)) return false;
    return entries.equals(((Tracestate) o).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "Tracestate" + entries;
  }
}
