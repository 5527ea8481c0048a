package com.spot.facet;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates facets for every leaf path found in a sample of records. Arrays become a single array
 * facet plus a {@code .length} facet; nested objects are walked recursively.
 */
public class FacetTypeInferencer {
  private static final Logger LOG = LoggerFactory.getLogger(FacetTypeInferencer.class);

  public static final int DEFAULT_SAMPLE_SIZE = 10;
  private static final Joiner DESCRIPTION_JOINER = Joiner.on(", ");

  private FacetTypeInferencer() {}

  /** Returns the facets for paths not yet covered by {@code existing}, in first-seen order. */
  public static List<Facet> inferFacets(
      Collection<Facet> existing, List<Map<String, Object>> sample) {
    Set<String> paths = new LinkedHashSet<>();
    for (Map<String, Object> record : sample) {
      collectPaths("", record, paths);
    }

    Set<String> accessors = new LinkedHashSet<>();
    existing.forEach(facet -> accessors.add(facet.getAccessor()));

    List<Facet> facets = new ArrayList<>();
    for (String path : paths) {
      if (accessors.contains(path) || accessors.contains(path + FacetValues.ARRAY_SUFFIX)) {
        continue;
      }
      Facet facet = newFacet(path, sample);
      accessors.add(facet.getAccessor());
      facets.add(facet);
      LOG.debug("Inferred facet {} of type {}", facet.getAccessor(), facet.getType());
    }
    return facets;
  }

  private static void collectPaths(String prefix, Map<?, ?> tree, Set<String> paths) {
    for (Map.Entry<?, ?> entry : tree.entrySet()) {
      String path = prefix.isEmpty() ? entry.getKey().toString() : prefix + "." + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof List) {
        paths.add(path);
        paths.add(path + FacetValues.LENGTH_SUFFIX);
      } else if (value instanceof Map<?, ?> subtree) {
        collectPaths(path, subtree, paths);
      } else {
        paths.add(path);
      }
    }
  }

  private static Facet newFacet(String path, List<Map<String, Object>> sample) {
    Set<Object> values = new LinkedHashSet<>();
    boolean isArray = false;
    for (Map<String, Object> record : sample) {
      Object value = FacetValues.extract(record, path);
      if (value instanceof List<?> list) {
        isArray = true;
        list.stream().filter(v -> v != null).forEach(values::add);
      } else if (value != null) {
        values.add(value);
      }
    }

    String accessor = isArray ? path + FacetValues.ARRAY_SUFFIX : path;
    Facet facet = new Facet(accessor, path, accessor, guessType(values));
    facet.setDescription(DESCRIPTION_JOINER.join(values));
    return facet;
  }

  /** Majority vote over per value heuristics; ties go to the earlier type in declaration order. */
  static FacetType guessType(Collection<Object> values) {
    Map<FacetType, Integer> votes = new EnumMap<>(FacetType.class);
    for (Object value : values) {
      votes.merge(classify(value), 1, Integer::sum);
    }
    FacetType best = FacetType.CATEGORIAL;
    int max = 0;
    for (FacetType type : FacetType.values()) {
      int count = votes.getOrDefault(type, 0);
      if (count > max) {
        best = type;
        max = count;
      }
    }
    return best;
  }

  static FacetType classify(Object value) {
    if (value instanceof Number) {
      return FacetType.CONTINUOUS;
    }
    if (!(value instanceof String text)) {
      return FacetType.CATEGORIAL;
    }
    if (TimeTransform.parseDatetime(text) != null) {
      return FacetType.DATETIME;
    }
    Double duration = TimeTransform.parseDuration(text);
    if (duration != null && duration != 0) {
      return FacetType.DURATION;
    }
    if (FacetValues.parseNumber(text) != null) {
      return FacetType.CONTINUOUS;
    }
    return FacetType.CATEGORIAL;
  }
}
