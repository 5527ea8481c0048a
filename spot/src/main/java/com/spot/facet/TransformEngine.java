package com.spot.facet;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes facet domains and transforms from the valid values of a facet. Both dataset backends
 * collect the values their own way and hand them to this class, so the resulting transforms are the
 * same for either backend.
 */
public class TransformEngine {
  private static final Logger LOG = LoggerFactory.getLogger(TransformEngine.class);

  public static final int PERCENTILE_MIN = 0;
  public static final int PERCENTILE_MAX = 100;

  private TransformEngine() {}

  public static void setMinMax(Facet facet, double[] values) {
    if (values.length == 0) {
      LOG.warn("No valid values for facet {}, leaving its domain unset", facet.getId());
      facet.setDomain(null, null);
      return;
    }
    double min = values[0];
    double max = values[0];
    for (double value : values) {
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    facet.setDomain(min, max);
  }

  public static void setPercentiles(Facet facet, double[] values) {
    ContinuousTransform transform = facet.getContinuousTransform();
    transform.reset();
    if (values.length == 0) {
      LOG.warn("No valid values for facet {}, percentile transform left inactive", facet.getId());
      return;
    }
    transform.set(ContinuousTransform.Type.PERCENTILES, percentiles(sorted(values)));
  }

  public static void setExceedances(Facet facet, double[] values) {
    ContinuousTransform transform = facet.getContinuousTransform();
    transform.reset();
    if (values.length == 0) {
      LOG.warn("No valid values for facet {}, exceedance transform left inactive", facet.getId());
      return;
    }
    transform.set(ContinuousTransform.Type.EXCEEDANCES, exceedances(sorted(values)));
  }

  /** Replaces the facet's rules with one identity rule per distinct value, in the given order. */
  public static void setCategories(Facet facet, Map<String, Long> counts) {
    CategorialTransform transform = facet.getCategorialTransform();
    transform.reset();
    counts.forEach((value, count) -> transform.addRule(new CategorialRule(value, value, count)));
    LOG.debug("Facet {} has {} categories", facet.getId(), counts.size());
  }

  /**
   * Percentiles 1 to 99 using the NIST recommended interpolation, bracketed by two copies of the
   * minimum at rank 0 and two copies of the maximum at rank 100.
   */
  @VisibleForTesting
  static ImmutableList<ControlPoint> percentiles(double[] data) {
    int n = data.length;
    ImmutableList.Builder<ControlPoint> points = ImmutableList.builder();
    points.add(new ControlPoint(data[0], PERCENTILE_MIN));
    points.add(new ControlPoint(data[0], PERCENTILE_MIN));
    for (int p = 1; p < PERCENTILE_MAX; p++) {
      double x = (p * 0.01) * (n + 1) - 1;
      x = Math.max(0, Math.min(n - 1, x));
      int i = (int) Math.floor(x);
      double value;
      if (i >= n - 1) {
        value = data[n - 1];
      } else {
        value = (1 - x + i) * data[i] + (x - i) * data[i + 1];
      }
      points.add(new ControlPoint(value, p));
    }
    points.add(new ControlPoint(data[n - 1], PERCENTILE_MAX));
    points.add(new ControlPoint(data[n - 1], PERCENTILE_MAX));
    return points.build();
  }

  /**
   * Maps the median to rank 0 and the value exceeded by one in k records to rank k, for k = 3..9,
   * 10..90, 100..900 and so on while k is below the record count. The mirrored low values get rank
   * -k, and the extremes get ranks -n and n.
   */
  @VisibleForTesting
  static ImmutableList<ControlPoint> exceedances(double[] data) {
    int n = data.length;
    Deque<ControlPoint> points = new ArrayDeque<>();

    double median;
    if (n % 2 == 0) {
      median = 0.5 * (data[n / 2 - 1] + data[n / 2]);
    } else {
      median = data[n / 2];
    }
    points.add(new ControlPoint(median, 0));

    long oom = 1;
    long mult = 3;
    while (mult * oom < n) {
      long k = oom * mult;
      int i = (int) (n - n / k - 1);
      points.addLast(new ControlPoint(data[i], k));
      points.addFirst(new ControlPoint(data[n - i - 1], -k));

      mult++;
      if (mult == 10) {
        oom = oom * 10;
        mult = 1;
      }
    }

    points.addFirst(new ControlPoint(data[0], -n));
    points.addLast(new ControlPoint(data[n - 1], n));
    return ImmutableList.copyOf(points);
  }

  private static double[] sorted(double[] values) {
    double[] copy = Arrays.copyOf(values, values.length);
    Arrays.sort(copy);
    return copy;
  }
}
