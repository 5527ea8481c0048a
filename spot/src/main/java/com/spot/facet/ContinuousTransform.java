package com.spot.facet;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A monotonic piecewise linear map from raw values to rank space, defined by an ordered list of
 * control points. An inactive transform is the identity in both directions.
 */
public class ContinuousTransform {
  public enum Type {
    NONE,
    PERCENTILES,
    EXCEEDANCES
  }

  private Type type = Type.NONE;
  private ImmutableList<ControlPoint> controlPoints = ImmutableList.of();

  public void reset() {
    type = Type.NONE;
    controlPoints = ImmutableList.of();
  }

  public void set(Type type, List<ControlPoint> controlPoints) {
    checkArgument(type != Type.NONE, "Use reset() to clear a transform");
    checkArgument(controlPoints.size() >= 2, "A transform needs at least two control points");
    for (int i = 1; i < controlPoints.size(); i++) {
      ControlPoint prev = controlPoints.get(i - 1);
      ControlPoint cur = controlPoints.get(i);
      checkArgument(
          prev.x() <= cur.x() && prev.fx() <= cur.fx(),
          "Control points must be non-decreasing, got %s followed by %s",
          prev,
          cur);
    }
    this.type = type;
    this.controlPoints = ImmutableList.copyOf(controlPoints);
  }

  public Type getType() {
    return type;
  }

  public ImmutableList<ControlPoint> getControlPoints() {
    return controlPoints;
  }

  public boolean isActive() {
    return type != Type.NONE;
  }

  /** Raw value to rank: interpolate from the last control point at or below x. */
  public double forward(double x) {
    if (!isActive()) {
      return x;
    }
    ControlPoint first = controlPoints.get(0);
    ControlPoint last = controlPoints.get(controlPoints.size() - 1);
    if (x <= first.x()) {
      return first.fx();
    }
    if (x >= last.x()) {
      return last.fx();
    }
    int i = 0;
    while (controlPoints.get(i + 1).x() <= x) {
      i++;
    }
    ControlPoint lo = controlPoints.get(i);
    ControlPoint hi = controlPoints.get(i + 1);
    return lo.fx() + (x - lo.x()) * (hi.fx() - lo.fx()) / (hi.x() - lo.x());
  }

  /** Rank to raw value: interpolate on the first segment with a non-zero rank width. */
  public double inverse(double fx) {
    if (!isActive()) {
      return fx;
    }
    ControlPoint first = controlPoints.get(0);
    ControlPoint last = controlPoints.get(controlPoints.size() - 1);
    if (fx <= first.fx()) {
      return first.x();
    }
    if (fx >= last.fx()) {
      return last.x();
    }
    for (int i = 0; i < controlPoints.size() - 1; i++) {
      ControlPoint lo = controlPoints.get(i);
      ControlPoint hi = controlPoints.get(i + 1);
      if (lo.fx() <= fx && fx <= hi.fx() && lo.fx() < hi.fx()) {
        return lo.x() + (fx - lo.fx()) * (hi.x() - lo.x()) / (hi.fx() - lo.fx());
      }
    }
    return last.x();
  }

  @Override
  public String toString() {
    return "ContinuousTransform{type=" + type + ", controlPoints=" + controlPoints.size() + '}';
  }
}
