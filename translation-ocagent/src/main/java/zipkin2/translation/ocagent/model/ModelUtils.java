/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package zipkin2.translation.ocagent.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ModelUtils {

  /**
   * Copies an attribute bag, keeping the iteration order of the input. Values may be null or of
   * any type, as it is the translator that decides how to represent them.
   */
  static Map<String, Object> copyAttributes(Map<String, ?> attributes) {
    if (attributes == null) throw new NullPointerException("attributes == null");
    if (attributes.isEmpty()) return Collections.emptyMap();
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : attributes.entrySet()) {
      if (entry.getKey() == null) throw new NullPointerException("attribute key == null");
      result.put(entry.getKey(), entry.getValue());
    }
    return Collections.unmodifiableMap(result);
  }

  static <T> List<T> copyList(String field, List<? extends T> input) {
    if (input == null) throw new NullPointerException(field + " == null");
    if (input.isEmpty()) return Collections.emptyList();
    List<T> result = new ArrayList<>(input.size());
    for (T element : input) {
      if (element == null) throw new NullPointerException(field + " element == null");
      result.add(element);
    }
    return Collections.unmodifiableList(result);
  }

  private ModelUtils() {
  }
}
