package com.spot.filter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Running count and exact decimal sum of the values of one aggregate within one group. Adding and
 * then removing the same value restores an equal accumulator.
 */
public final class AggregateAccumulator {
  private long count;
  private long numericCount;
  private BigDecimal sum = BigDecimal.ZERO;

  public AggregateAccumulator() {}

  public AggregateAccumulator(long count, long numericCount, BigDecimal sum) {
    this.count = count;
    this.numericCount = numericCount;
    this.sum = sum == null ? BigDecimal.ZERO : sum;
  }

  public void add(Object value) {
    count++;
    if (value instanceof Number number) {
      numericCount++;
      sum = sum.add(toDecimal(number));
    }
  }

  public void remove(Object value) {
    count--;
    if (value instanceof Number number) {
      numericCount--;
      sum = sum.subtract(toDecimal(number));
    }
  }

  private static BigDecimal toDecimal(Number number) {
    if (number instanceof BigDecimal decimal) {
      return decimal;
    }
    if (number instanceof Long || number instanceof Integer) {
      return BigDecimal.valueOf(number.longValue());
    }
    return BigDecimal.valueOf(number.doubleValue());
  }

  public long getCount() {
    return count;
  }

  public long getNumericCount() {
    return numericCount;
  }

  public BigDecimal getSum() {
    return sum;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AggregateAccumulator that)) {
      return false;
    }
    return count == that.count
        && numericCount == that.numericCount
        && sum.compareTo(that.sum) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(count, numericCount, sum.stripTrailingZeros());
  }

  @Override
  public String toString() {
    return "AggregateAccumulator{count=" + count + ", sum=" + sum + '}';
  }
}
