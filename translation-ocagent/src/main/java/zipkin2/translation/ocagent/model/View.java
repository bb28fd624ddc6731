/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named aggregation of a {@link Measure}, grouped by the values of {@link #tagKeys()}. Each
 * distinct combination of tag values becomes one {@link Row}.
 */
public final class View {

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String name, description = "";
    Measure measure;
    Aggregation aggregation;
    final List<String> tagKeys = new ArrayList<>();

    public Builder name(String name) {
      if (name == null) throw new NullPointerException("name == null");
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      if (description == null) throw new NullPointerException("description == null");
      this.description = description;
      return this;
    }

    public Builder measure(Measure measure) {
      if (measure == null) throw new NullPointerException("measure == null");
      this.measure = measure;
      return this;
    }

    public Builder aggregation(Aggregation aggregation) {
      if (aggregation == null) throw new NullPointerException("aggregation == null");
      this.aggregation = aggregation;
      return this;
    }

    /** Appends a tag key. Order is significant, as it defines the label order of the metric. */
    public Builder addTagKey(String tagKey) {
      if (tagKey == null) throw new NullPointerException("tagKey == null");
      if (tagKeys.contains(tagKey)) {
        throw new IllegalArgumentException("duplicate tagKey: " + tagKey);
      }
      tagKeys.add(tagKey);
      return this;
    }

    public View build() {
      String missing = "";
      if (name == null) missing += " name";
      if (measure == null) missing += " measure";
      if (aggregation == null) missing += " aggregation";
      if (!"".equals(missing)) throw new IllegalStateException("Missing :" + missing);
      return new View(this);
    }

    Builder() {
    }
  }

  private final String name, description;
  private final Measure measure;
  private final Aggregation aggregation;
  private final List<String> tagKeys;

  View(Builder builder) {
    this.name = builder.name;
    this.description = builder.description;
    this.measure = builder.measure;
    this.aggregation = builder.aggregation;
    this.tagKeys = ModelUtils.copyList("tagKeys", builder.tagKeys);
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public Measure measure() {
    return measure;
  }

  public Aggregation aggregation() {
    return aggregation;
  }

  public List<String> tagKeys() {
    return tagKeys;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof View)) return false;
    View that = (View) o;
    return name.equals(that.name)
        && description.equals(that.description)
        && measure.equals(that.measure)
        && aggregation.equals(that.aggregation)
        && tagKeys.equals(that.tagKeys);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, measure, aggregation, tagKeys);
  }

  @Override
  public String toString() {
    return "View{name=" + name + ", aggregation=" + aggregation + ", tagKeys=" + tagKeys + "}";
  }
}
