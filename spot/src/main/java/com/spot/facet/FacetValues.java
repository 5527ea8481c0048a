package com.spot.facet;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Extracts facet values from records held as nested maps and lists. */
public final class FacetValues {
  public static final String ARRAY_SUFFIX = "[]";
  public static final String LENGTH_SUFFIX = ".length";

  private static final Splitter PATH_SPLITTER = Splitter.on('.');

  private FacetValues() {}

  /**
   * Follows a dotted accessor path through a record. A trailing {@code []} is ignored and a {@code
   * length} segment applied to a list yields its size.
   */
  public static Object extract(Map<String, Object> record, String accessor) {
    String path =
        accessor.endsWith(ARRAY_SUFFIX)
            ? accessor.substring(0, accessor.length() - ARRAY_SUFFIX.length())
            : accessor;
    Object current = record;
    for (String segment : PATH_SPLITTER.split(path)) {
      if (current instanceof Map<?, ?> map) {
        current = map.get(segment);
      } else if (current instanceof List<?> list && "length".equals(segment)) {
        current = list.size();
      } else {
        return null;
      }
    }
    return current;
  }

  /**
   * The valid base values of a facet for one record: numbers (seconds for time facets) for
   * continuous-like facets, strings for categorial ones. Array values contribute every element; an
   * empty result means the record is missing this facet.
   */
  public static List<Object> baseValues(Facet facet, Map<String, Object> record) {
    Object raw = extract(record, facet.getAccessor());
    if (raw instanceof List<?> list) {
      List<Object> values = new ArrayList<>(list.size());
      for (Object element : list) {
        Object value = baseValue(facet, element);
        if (value != null) {
          values.add(value);
        }
      }
      return values;
    }
    Object value = baseValue(facet, raw);
    return value == null ? Collections.emptyList() : Collections.singletonList(value);
  }

  /** Converts one raw scalar to its base value, or null when it is missing or unparseable. */
  public static Object baseValue(Facet facet, Object raw) {
    if (facet.isMissing(raw)) {
      return null;
    }
    return facet.getType() == FacetType.CATEGORIAL ? asText(raw) : numericValue(facet, raw);
  }

  /**
   * Number a continuous-like facet compares and buckets: the value itself, or seconds for time
   * facets. Null for categorial facets and for values that don't parse.
   */
  public static Double numericValue(Facet facet, Object raw) {
    return switch (facet.getType()) {
      case CONTINUOUS -> parseNumber(raw);
      case DATETIME -> TimeTransform.datetimeToSeconds(raw);
      case DURATION -> TimeTransform.durationToSeconds(raw, facet.getDurationUnit());
      case CATEGORIAL -> null;
    };
  }

  public static Double parseNumber(Object raw) {
    if (raw instanceof Number number) {
      double value = number.doubleValue();
      return Double.isFinite(value) ? value : null;
    }
    if (raw instanceof Boolean) {
      return null;
    }
    String text = raw.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      double value = Double.parseDouble(text);
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public static String asText(Object raw) {
    return raw instanceof String text ? text : String.valueOf(raw);
  }
}
