/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated data for one combination of tag values. Tags missing from {@link #tags()} were not
 * present when the measurements were recorded.
 */
public final class Row {

  public static Row create(List<Tag> tags, AggregationData data) {
    if (data == null) throw new NullPointerException("data == null");
    return new Row(ModelUtils.copyList("tags", tags), data);
  }

  private final List<Tag> tags;
  private final AggregationData data;

  private Row(List<Tag> tags, AggregationData data) {
    this.tags = tags;
    this.data = data;
  }

  public List<Tag> tags() {
    return tags;
  }

  public AggregationData data() {
    return data;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Row)) return false;
    Row that = (Row) o;
    return tags.equals(that.tags) && data.equals(that.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tags, data);
  }

  @Override
  public String toString() {
    return "Row{tags=" + tags + ", data=" + data + "}";
  }
}
