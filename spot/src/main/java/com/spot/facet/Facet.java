package com.spot.facet;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;

/**
 * A typed column of a dataset. Besides its type a facet carries the sentinels that mark a value as
 * missing, the value domain found by the last min/max scan, and the transforms used to bucket it.
 */
public class Facet {
  private final String id;
  private String name;
  private String accessor;
  private FacetType type;
  private ImmutableList<String> misval = ImmutableList.of();
  private DurationUnit durationUnit = DurationUnit.SECONDS;
  private String description = "";
  private Double minval;
  private Double maxval;
  private final ContinuousTransform continuousTransform = new ContinuousTransform();
  private final CategorialTransform categorialTransform = new CategorialTransform();

  public Facet(String id, String name, String accessor, FacetType type) {
    this.id = id;
    this.name = name;
    this.accessor = accessor;
    this.type = type;
  }

  public Facet(String accessor, FacetType type) {
    this(accessor, accessor, accessor, type);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getAccessor() {
    return accessor;
  }

  public void setAccessor(String accessor) {
    this.accessor = accessor;
  }

  public FacetType getType() {
    return type;
  }

  public void setType(FacetType type) {
    this.type = type;
  }

  public boolean isArray() {
    return accessor.endsWith(FacetValues.ARRAY_SUFFIX);
  }

  public ImmutableList<String> getMisval() {
    return misval;
  }

  public void setMisval(List<String> misval) {
    this.misval = ImmutableList.copyOf(misval);
  }

  public DurationUnit getDurationUnit() {
    return durationUnit;
  }

  public void setDurationUnit(DurationUnit durationUnit) {
    this.durationUnit = durationUnit;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public Double getMinval() {
    return minval;
  }

  public Double getMaxval() {
    return maxval;
  }

  public void setDomain(Double minval, Double maxval) {
    this.minval = minval;
    this.maxval = maxval;
  }

  public boolean hasDomain() {
    return minval != null && maxval != null;
  }

  public ContinuousTransform getContinuousTransform() {
    return continuousTransform;
  }

  public CategorialTransform getCategorialTransform() {
    return categorialTransform;
  }

  /**
   * Null is always missing; the misval list adds further sentinels. Time facets also match a
   * sentinel denoting the same number of seconds, e.g. {@code 1970-01-01T00:00:00Z} and {@code 0}.
   */
  public boolean isMissing(Object raw) {
    if (raw == null || raw == Misval.MISSING) {
      return true;
    }
    String text = FacetValues.asText(raw);
    for (String sentinel : misval) {
      if (sentinel.equals(text)) {
        return true;
      }
      if (raw instanceof Number number) {
        Double value = FacetValues.parseNumber(sentinel);
        if (value != null && value == number.doubleValue()) {
          return true;
        }
      }
      if (type.isTime() && sameSeconds(raw, sentinel)) {
        return true;
      }
    }
    return false;
  }

  private boolean sameSeconds(Object raw, String sentinel) {
    Double sentinelSeconds = FacetValues.numericValue(this, sentinel);
    if (sentinelSeconds == null) {
      return false;
    }
    Double seconds = FacetValues.numericValue(this, raw);
    return seconds != null && seconds.doubleValue() == sentinelSeconds.doubleValue();
  }

  public List<Object> baseValues(Map<String, Object> record) {
    return FacetValues.baseValues(this, record);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("accessor", accessor)
        .add("type", type)
        .add("minval", minval)
        .add("maxval", maxval)
        .toString();
  }
}
