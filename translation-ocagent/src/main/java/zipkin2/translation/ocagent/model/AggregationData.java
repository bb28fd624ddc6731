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
 * The aggregated value of one {@link Row}. The concrete type corresponds to the
 * {@link Aggregation.Type} of the view the row belongs to.
 */
public abstract class AggregationData {

  public static CountData count(long count) {
    return new CountData(count);
  }

  public static SumData sum(double sum) {
    return new SumData(sum);
  }

  public static LastValueData lastValue(double value) {
    return new LastValueData(value);
  }

  /**
   * @param count number of recorded values
   * @param mean arithmetic mean of the recorded values
   * @param sumOfSquaredDeviation sum of squared deviations from the mean
   * @param bucketCounts count of values per histogram bucket, in bucket order
   */
  public static DistributionData distribution(long count, double min, double max, double mean,
      double sumOfSquaredDeviation, List<Long> bucketCounts) {
    return new DistributionData(count, min, max, mean, sumOfSquaredDeviation,
        ModelUtils.copyList("bucketCounts", bucketCounts));
  }

  /** The aggregation that produces this kind of data. */
  public abstract Aggregation.Type type();

  AggregationData() {
  }

  public static final class CountData extends AggregationData {
    private final long count;

    CountData(long count) {
      this.count = count;
    }

    @Override
    public Aggregation.Type type() {
      return Aggregation.Type.COUNT;
    }

    public long count() {
      return count;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || (o instanceof CountData && ((CountData) o).count == count);
    }

    @Override
    public int hashCode() {
      return Long.hashCode(count);
    }

    @Override
    public String toString() {
      return "CountData{" + count + "}";
    }
  }

  public static final class SumData extends AggregationData {
    private final double sum;

    SumData(double sum) {
      this.sum = sum;
    }

    @Override
    public Aggregation.Type type() {
      return Aggregation.Type.SUM;
    }

    public double sum() {
      return sum;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || (o instanceof SumData && Double.compare(((SumData) o).sum, sum) == 0);
    }

    @Override
    public int hashCode() {
      return Double.hashCode(sum);
    }

    @Override
    public String toString() {
      return "SumData{" + sum + "}";
    }
  }

  public static final class LastValueData extends AggregationData {
    private final double value;

    LastValueData(double value) {
      this.value = value;
    }

    @Override
    public Aggregation.Type type() {
      return Aggregation.Type.LAST_VALUE;
    }

    public double value() {
      return value;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || (o instanceof LastValueData && Double.compare(((LastValueData) o).value, value) == 0);
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public String toString() {
      return "LastValueData{" + value + "}";
    }
  }

  /**
   * Running statistics of a histogram. Bucket boundaries are not included: they belong to the
   * {@link Aggregation} of the view.
   */
  public static final class DistributionData extends AggregationData {
    private final long count;
    private final double min, max, mean, sumOfSquaredDeviation;
    private final List<Long> bucketCounts;

    DistributionData(long count, double min, double max, double mean,
        double sumOfSquaredDeviation, List<Long> bucketCounts) {
      this.count = count;
      this.min = min;
      this.max = max;
      this.mean = mean;
      this.sumOfSquaredDeviation = sumOfSquaredDeviation;
      this.bucketCounts = bucketCounts;
    }

    @Override
    public Aggregation.Type type() {
      return Aggregation.Type.DISTRIBUTION;
    }

    public long count() {
      return count;
    }

    public double min() {
      return min;
    }

    public double max() {
      return max;
    }

    public double mean() {
      return mean;
    }

    public double sumOfSquaredDeviation() {
      return sumOfSquaredDeviation;
    }

    public List<Long> bucketCounts() {
      return bucketCounts;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof DistributionData)) return false;
      DistributionData that = (DistributionData) o;
      return count == that.count
          && Double.compare(min, that.min) == 0
          && Double.compare(max, that.max) == 0
          && Double.compare(mean, that.mean) == 0
          && Double.compare(sumOfSquaredDeviation, that.sumOfSquaredDeviation) == 0
          && bucketCounts.equals(that.bucketCounts);
    }

    @Override
    public int hashCode() {
      return Objects.hash(count, min, max, mean, sumOfSquaredDeviation, bucketCounts);
    }

    @Override
    public String toString() {
      return "DistributionData{count=" + count + ", mean=" + mean + ", bucketCounts="
          + bucketCounts + "}";
    }
  }
}
