/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.protobuf.Timestamp;
import io.opencensus.proto.agent.metrics.v1.ExportMetricsServiceRequest;
import io.opencensus.proto.metrics.v1.LabelKey;
import io.opencensus.proto.metrics.v1.LabelValue;
import io.opencensus.proto.metrics.v1.Metric;
import io.opencensus.proto.metrics.v1.MetricDescriptor;
import io.opencensus.proto.metrics.v1.Point;
import io.opencensus.proto.metrics.v1.TimeSeries;
import zipkin2.translation.ocagent.model.Aggregation;
import zipkin2.translation.ocagent.model.AggregationData;
import zipkin2.translation.ocagent.model.AggregationData.CountData;
import zipkin2.translation.ocagent.model.AggregationData.DistributionData;
import zipkin2.translation.ocagent.model.AggregationData.LastValueData;
import zipkin2.translation.ocagent.model.AggregationData.SumData;
import zipkin2.translation.ocagent.model.Measure;
import zipkin2.translation.ocagent.model.Row;
import zipkin2.translation.ocagent.model.Tag;
import zipkin2.translation.ocagent.model.View;
import zipkin2.translation.ocagent.model.ViewData;

import static zipkin2.translation.ocagent.ProtoUtils.toTimestamp;

/**
 * ViewTranslator converts aggregated {@link ViewData} into an OpenCensus agent
 * {@link ExportMetricsServiceRequest}: one metric per view, and one time series per row.
 *
 * <p>The metric type follows from the aggregation and the measure's value type:
 *
 * <table>
 *   <tr><th>Aggregation</th><th>INT64 measure</th><th>DOUBLE measure</th></tr>
 *   <tr><td>COUNT</td><td>CUMULATIVE_INT64</td><td>CUMULATIVE_INT64</td></tr>
 *   <tr><td>SUM</td><td>CUMULATIVE_INT64</td><td>CUMULATIVE_DOUBLE</td></tr>
 *   <tr><td>LAST_VALUE</td><td>GAUGE_INT64</td><td>GAUGE_DOUBLE</td></tr>
 *   <tr><td>DISTRIBUTION</td><td>CUMULATIVE_DISTRIBUTION</td><td>CUMULATIVE_DISTRIBUTION</td></tr>
 * </table>
 *
 * <p>INT64 points of a SUM or LAST_VALUE view truncate the double toward zero, so 6.6 is sent as 6.
 */
public final class ViewTranslator {

  /**
   * Converts views into a request with one metric per view, in the same order. The node and
   * resource are left unset.
   *
   * @throws IllegalArgumentException if a row's data does not match its view's aggregation
   * @see ExportRequests
   */
  public static ExportMetricsServiceRequest translate(List<ViewData> views) {
    if (views == null) throw new NullPointerException("views == null");
    ExportMetricsServiceRequest.Builder result = ExportMetricsServiceRequest.newBuilder();
    for (ViewData viewData : views) {
      result.addMetrics(translate(viewData));
    }
    return result.build();
  }

  static Metric translate(ViewData viewData) {
    View view = viewData.view();
    Metric.Builder result = Metric.newBuilder().setMetricDescriptor(descriptor(view));
    Timestamp start = toTimestamp(viewData.start());
    Timestamp end = toTimestamp(viewData.end());
    for (Row row : viewData.rows()) {
      result.addTimeseries(TimeSeries.newBuilder()
          .setStartTimestamp(start)
          .addAllLabelValues(labelValues(view.tagKeys(), row.tags()))
          .addPoints(point(view, end, row.data())));
    }
    return result.build();
  }

  static MetricDescriptor descriptor(View view) {
    MetricDescriptor.Builder result = MetricDescriptor.newBuilder()
        .setName(view.name())
        .setDescription(view.description())
        .setUnit(view.measure().unit())
        .setType(descriptorType(view));
    // the source has no description for tag keys
    for (String tagKey : view.tagKeys()) {
      result.addLabelKeys(LabelKey.newBuilder().setKey(tagKey));
    }
    return result.build();
  }

  static MetricDescriptor.Type descriptorType(View view) {
    boolean int64 = view.measure().type() == Measure.Type.INT64;
    Aggregation.Type type = view.aggregation().type();
    switch (type) {
      case COUNT:
        return MetricDescriptor.Type.CUMULATIVE_INT64;
      case SUM:
        return int64 ? MetricDescriptor.Type.CUMULATIVE_INT64 : MetricDescriptor.Type.CUMULATIVE_DOUBLE;
      case LAST_VALUE:
        return int64 ? MetricDescriptor.Type.GAUGE_INT64 : MetricDescriptor.Type.GAUGE_DOUBLE;
      case DISTRIBUTION:
        return MetricDescriptor.Type.CUMULATIVE_DISTRIBUTION;
      default:
        throw new IllegalArgumentException("Unknown aggregation: " + type);
    }
  }

  /**
   * Label values are positioned by the view's tag keys, not by the row's tags. A key missing from
   * the row is marked as having no value, which differs from an empty value.
   */
  static List<LabelValue> labelValues(List<String> tagKeys, List<Tag> tags) {
    Map<String, String> tagValues = new LinkedHashMap<>();
    for (Tag tag : tags) {
      tagValues.putIfAbsent(tag.key(), tag.value());
    }
    List<LabelValue> result = new ArrayList<>(tagKeys.size());
    for (String tagKey : tagKeys) {
      String value = tagValues.get(tagKey);
      result.add(value != null
          ? LabelValue.newBuilder().setValue(value).setHasValue(true).build()
          : LabelValue.newBuilder().setHasValue(false).build());
    }
    return result;
  }

  static Point point(View view, Timestamp end, AggregationData data) {
    Aggregation aggregation = view.aggregation();
    if (data.type() != aggregation.type()) {
      throw new IllegalArgumentException("View " + view.name() + " aggregates "
          + aggregation.type() + ", but a row holds " + data.type() + " data");
    }
    boolean int64 = view.measure().type() == Measure.Type.INT64;
    Point.Builder result = Point.newBuilder().setTimestamp(end);
    switch (aggregation.type()) {
      case COUNT:
        return result.setInt64Value(((CountData) data).count()).build();
      case SUM:
        double sum = ((SumData) data).sum();
        return int64
            ? result.setInt64Value((long) sum).build()
            : result.setDoubleValue(sum).build();
      case LAST_VALUE:
        double value = ((LastValueData) data).value();
        return int64
            ? result.setInt64Value((long) value).build()
            : result.setDoubleValue(value).build();
      case DISTRIBUTION:
        return result.setDistributionValue(DistributionEncoder.encode((DistributionData) data,
            aggregation.bucketBoundaries())).build();
      default:
        throw new IllegalArgumentException("Unknown aggregation: " + aggregation.type());
    }
  }

  private ViewTranslator() {
  }
}
