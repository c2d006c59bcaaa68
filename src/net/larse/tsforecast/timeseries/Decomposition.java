/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsforecast.timeseries;

import com.google.common.base.Preconditions;
import java.io.Serializable;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.larse.tsforecast.helper.ArrayHelper;
import org.apache.commons.math.stat.descriptive.moment.Variance;

/**
 * Trend, seasonal and remainder components of a series, aligned with its periods.
 *
 * <p>The remainder is the exact difference between the observation and the other two
 * components, so the three always add back to the observed series.
 */
public final class Decomposition implements Serializable {
  private static final long serialVersionUID = 1;

  private final TimeSeries observed;
  private final double[] trend;
  private final double[] seasonal;
  private final double[] remainder;
  private final double[] weights;

  Decomposition(TimeSeries observed, double[] trend, double[] seasonal, double[] weights) {
    int n = observed.size();
    Preconditions.checkArgument(trend.length == n && seasonal.length == n && weights.length == n);
    this.observed = observed;
    this.trend = trend.clone();
    this.seasonal = seasonal.clone();
    this.weights = weights.clone();
    this.remainder = new double[n];
    for (int i = 0; i < n; i++) {
      remainder[i] = observed.get(i) - this.trend[i] - this.seasonal[i];
    }
  }

  public TimeSeries observed() {
    return observed;
  }

  public int size() {
    return observed.size();
  }

  public double[] trend() {
    return trend.clone();
  }

  public double[] seasonal() {
    return seasonal.clone();
  }

  public double[] remainder() {
    return remainder.clone();
  }

  /** Robustness weights of the final pass; all ones for the non-robust procedure. */
  public double[] weights() {
    return weights.clone();
  }

  /** The observed series with the seasonal component removed. */
  public TimeSeries seasonallyAdjusted() {
    return observed.withValues(ArrayHelper.subtract(observed.values(), seasonal));
  }

  /** Strength of trend in [0, 1]: max(0, 1 - Var(R) / Var(T + R)). */
  public double trendStrength() {
    double[] trendAndRemainder = new double[trend.length];
    for (int i = 0; i < trend.length; i++) {
      trendAndRemainder[i] = trend[i] + remainder[i];
    }
    return strength(trendAndRemainder);
  }

  /** Strength of seasonality in [0, 1]: max(0, 1 - Var(R) / Var(S + R)). */
  public double seasonalStrength() {
    double[] seasonalAndRemainder = new double[seasonal.length];
    for (int i = 0; i < seasonal.length; i++) {
      seasonalAndRemainder[i] = seasonal[i] + remainder[i];
    }
    return strength(seasonalAndRemainder);
  }

  private double strength(double[] componentAndRemainder) {
    double denominator = new Variance().evaluate(componentAndRemainder);
    if (denominator <= 0) {
      return 0.0;
    }
    return Math.max(0.0, 1.0 - new Variance().evaluate(remainder) / denominator);
  }

  /** One row per period, for tabular output. */
  public List<Component> rows() {
    List<Component> rows = new ArrayList<>(trend.length);
    for (int i = 0; i < trend.length; i++) {
      rows.add(new Component(observed.periodAt(i), observed.get(i),
          trend[i], seasonal[i], remainder[i]));
    }
    return Collections.unmodifiableList(rows);
  }

  /** The components at a single period. */
  public static final class Component implements Serializable {
    private static final long serialVersionUID = 1;

    public final YearMonth period;
    public final double observed;
    public final double trend;
    public final double seasonal;
    public final double remainder;

    Component(YearMonth period, double observed, double trend, double seasonal,
        double remainder) {
      this.period = period;
      this.observed = observed;
      this.trend = trend;
      this.seasonal = seasonal;
      this.remainder = remainder;
    }

    @Override
    public String toString() {
      return String.format("%s,%s,%s,%s,%s", period, observed, trend, seasonal, remainder);
    }
  }
}
