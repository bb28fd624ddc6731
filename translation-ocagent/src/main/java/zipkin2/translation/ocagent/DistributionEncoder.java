/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.opencensus.proto.metrics.v1.DistributionValue;
import io.opencensus.proto.metrics.v1.DistributionValue.BucketOptions;
import zipkin2.translation.ocagent.model.AggregationData.DistributionData;

/**
 * Encodes the running statistics of a histogram as a wire distribution.
 *
 * <p>The source keeps a mean where the wire wants a sum, so the sum is {@code mean * count} in
 * double precision. Bucket boundaries come from the view's aggregation and are copied unchanged
 * into the explicit bucket options. Counts are copied positionally. No exemplars are attached.
 */
final class DistributionEncoder {
  static final Logger LOG = Logger.getLogger(DistributionEncoder.class.getName());

  static DistributionValue encode(DistributionData data, List<Double> bucketBoundaries) {
    DistributionValue.Builder result = DistributionValue.newBuilder()
        .setCount(data.count())
        .setSum(data.mean() * data.count())
        .setSumOfSquaredDeviation(data.sumOfSquaredDeviation())
        .setBucketOptions(BucketOptions.newBuilder()
            .setExplicit(BucketOptions.Explicit.newBuilder().addAllBounds(bucketBoundaries)));
    long bucketTotal = 0;
    for (Long count : data.bucketCounts()) {
      result.addBuckets(DistributionValue.Bucket.newBuilder().setCount(count));
      bucketTotal += count;
    }
    // inconsistent histograms are still copied as-is
    if (LOG.isLoggable(Level.FINE)) {
      if (data.bucketCounts().size() != bucketBoundaries.size() + 1) {
        LOG.log(Level.FINE, "Expected {0} bucket counts for {1} boundaries, but was {2}",
            new Object[] {bucketBoundaries.size() + 1, bucketBoundaries.size(),
                data.bucketCounts().size()});
      }
      if (bucketTotal != data.count()) {
        LOG.log(Level.FINE, "Bucket counts add up to {0}, but count is {1}",
            new Object[] {bucketTotal, data.count()});
      }
    }
    return result.build();
  }

  private DistributionEncoder() {
  }
}
