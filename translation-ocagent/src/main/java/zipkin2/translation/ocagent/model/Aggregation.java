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
 * How recorded measurements are summarized by a {@link View}. Distribution aggregations also
 * carry the histogram bucket boundaries, as rows only hold per-bucket counts.
 */
public final class Aggregation {

  public enum Type {
    COUNT,
    SUM,
    LAST_VALUE,
    DISTRIBUTION
  }

  static final Aggregation COUNT = new Aggregation(Type.COUNT, Collections.<Double>emptyList());
  static final Aggregation SUM = new Aggregation(Type.SUM, Collections.<Double>emptyList());
  static final Aggregation LAST_VALUE =
      new Aggregation(Type.LAST_VALUE, Collections.<Double>emptyList());

  public static Aggregation count() {
    return COUNT;
  }

  public static Aggregation sum() {
    return SUM;
  }

  public static Aggregation lastValue() {
    return LAST_VALUE;
  }

  /**
   * @param bucketBoundaries strictly increasing upper bounds. N boundaries make N + 1 buckets,
   * the first for values below {@code bucketBoundaries[0]}.
   */
  public static Aggregation distribution(double... bucketBoundaries) {
    if (bucketBoundaries == null) throw new NullPointerException("bucketBoundaries == null");
    List<Double> boundaries = new ArrayList<>(bucketBoundaries.length);
    for (int i = 0; i < bucketBoundaries.length; i++) {
      if (i > 0 && !(bucketBoundaries[i - 1] < bucketBoundaries[i])) {
        throw new IllegalArgumentException("bucketBoundaries not strictly increasing at index " + i);
      }
      boundaries.add(bucketBoundaries[i]);
    }
    return new Aggregation(Type.DISTRIBUTION, Collections.unmodifiableList(boundaries));
  }

  private final Type type;
  private final List<Double> bucketBoundaries;

  private Aggregation(Type type, List<Double> bucketBoundaries) {
    this.type = type;
    this.bucketBoundaries = bucketBoundaries;
  }

  public Type type() {
    return type;
  }

  /** Empty unless this is a {@link Type#DISTRIBUTION distribution}. */
  public List<Double> bucketBoundaries() {
    return bucketBoundaries;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Aggregation)) return false;
    Aggregation that = (Aggregation) o;
    return type == that.type && bucketBoundaries.equals(that.bucketBoundaries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, bucketBoundaries);
  }

  @Override
  public String toString() {
    if (type != Type.DISTRIBUTION) return type.name();
    return type.name() + bucketBoundaries;
  }
}
