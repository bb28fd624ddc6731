/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.util.Objects;

/** The quantity being recorded, such as request latency, with its unit and value type. */
public final class Measure {

  public enum Type {
    INT64,
    DOUBLE
  }

  public static Measure create(String name, String description, String unit, Type type) {
    if (name == null) throw new NullPointerException("name == null");
    if (description == null) throw new NullPointerException("description == null");
    if (unit == null) throw new NullPointerException("unit == null");
    if (type == null) throw new NullPointerException("type == null");
    return new Measure(name, description, unit, type);
  }

  /** Shortcut for a measure recording floating point values. */
  public static Measure ofDouble(String name, String description, String unit) {
    return create(name, description, unit, Type.DOUBLE);
  }

  /** Shortcut for a measure recording integral values. */
  public static Measure ofInt64(String name, String description, String unit) {
    return create(name, description, unit, Type.INT64);
  }

  private final String name;
  private final String description;
  private final String unit;
  private final Type type;

  private Measure(String name, String description, String unit, Type type) {
    this.name = name;
    this.description = description;
    this.unit = unit;
    this.type = type;
  }

  public String name() {
    return name;
  }

  /** Not exported: the metric description comes from the {@link View}. */
  public String description() {
    return description;
  }

  /** Unified Code for Units of Measure, ex. "ms" or "By". */
  public String unit() {
    return unit;
  }

  public Type type() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Measure)) return false;
    Measure that = (Measure) o;
    return name.equals(that.name)
        && description.equals(that.description)
        && unit.equals(that.unit)
        && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, unit, type);
  }

  @Override
  public String toString() {
    return "Measure{name=" + name + ", unit=" + unit + ", type=" + type + "}";
  }
}
