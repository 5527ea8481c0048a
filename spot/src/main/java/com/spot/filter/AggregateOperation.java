package com.spot.filter;

import com.spot.facet.Misval;
import java.math.BigDecimal;
import java.math.MathContext;

/** Reduction applied to an aggregate's accumulator to produce the value in a result row. */
public enum AggregateOperation {
  COUNT {
    @Override
    public Object reduce(AggregateAccumulator accumulator) {
      return (double) accumulator.getCount();
    }
  },
  SUM {
    @Override
    public Object reduce(AggregateAccumulator accumulator) {
      if (accumulator.getNumericCount() <= 0) {
        return Misval.MISSING;
      }
      return accumulator.getSum().doubleValue();
    }
  },
  AVG {
    @Override
    public Object reduce(AggregateAccumulator accumulator) {
      if (accumulator.getNumericCount() <= 0) {
        return Misval.MISSING;
      }
      return accumulator
          .getSum()
          .divide(BigDecimal.valueOf(accumulator.getNumericCount()), MathContext.DECIMAL64)
          .doubleValue();
    }
  };

  /** A Double, or {@link Misval#MISSING} when the reduction is undefined. */
  public abstract Object reduce(AggregateAccumulator accumulator);
}
