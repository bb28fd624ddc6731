/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent;

import java.util.Arrays;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.opencensus.proto.trace.v1.AttributeValue;
import io.opencensus.proto.trace.v1.Span;

import static zipkin2.translation.ocagent.ProtoUtils.truncatableString;

/**
 * AttributesExtractor converts an untyped attribute bag into the attributes of an OpenCensus
 * span, annotation or link.
 *
 * <p>Values map to the closed set of wire kinds, checked in this order:
 * <ol>
 *   <li>{@link Boolean} to a bool value</li>
 *   <li>{@link CharSequence} to a string value</li>
 *   <li>{@link Byte}, {@link Short}, {@link Integer} and {@link Long} to an int value</li>
 *   <li>{@link Float} and {@link Double} to a double value</li>
 *   <li>anything else, including null, to a string value holding {@link #render(Object)}</li>
 * </ol>
 *
 * <p>At most {@code maxAttributes} entries are kept, in the iteration order of the input. The
 * rest are reported in the dropped attributes count.
 */
final class AttributesExtractor {
  static final Logger LOG = Logger.getLogger(AttributesExtractor.class.getName());

  final int maxAttributes;

  AttributesExtractor(int maxAttributes) {
    this.maxAttributes = maxAttributes;
  }

  /** Returns null when there are no attributes, as the wire field is then left unset. */
  Span.Attributes extract(Map<String, Object> attributes) {
    if (attributes.isEmpty()) return null;
    Span.Attributes.Builder result = Span.Attributes.newBuilder();
    int kept = 0;
    for (Map.Entry<String, Object> entry : attributes.entrySet()) {
      if (kept == maxAttributes) break;
      result.putAttributeMap(entry.getKey(), toAttributeValue(entry.getValue()));
      kept++;
    }
    int dropped = attributes.size() - kept;
    if (dropped > 0) {
      result.setDroppedAttributesCount(dropped);
      if (LOG.isLoggable(Level.FINE)) {
        LOG.log(Level.FINE, "Dropped {0} of {1} attributes", new Object[] {dropped, attributes.size()});
      }
    }
    return result.build();
  }

  static AttributeValue toAttributeValue(Object value) {
    AttributeValue.Builder result = AttributeValue.newBuilder();
    if (value instanceof Boolean) {
      return result.setBoolValue((Boolean) value).build();
    } else if (value instanceof CharSequence) {
      return result.setStringValue(truncatableString(value.toString())).build();
    } else if (value instanceof Byte || value instanceof Short
        || value instanceof Integer || value instanceof Long) {
      return result.setIntValue(((Number) value).longValue()).build();
    } else if (value instanceof Float || value instanceof Double) {
      return result.setDoubleValue(((Number) value).doubleValue()).build();
    }
    return result.setStringValue(truncatableString(render(value))).build();
  }

  /**
   * Human-readable form of a value that has no wire representation. Arrays render their elements
   * instead of their identity hash.
   */
  static String render(Object value) {
    if (value != null && value.getClass().isArray()) {
      String wrapped = Arrays.deepToString(new Object[] {value});
      return wrapped.substring(1, wrapped.length() - 1);
    }
    return String.valueOf(value);
  }
}
