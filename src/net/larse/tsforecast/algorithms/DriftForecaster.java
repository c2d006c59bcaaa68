package net.larse.tsforecast.algorithms;

import net.larse.tsforecast.timeseries.InsufficientDataException;
import net.larse.tsforecast.timeseries.TimeSeries;

/**
 * Extrapolates the line from the first to the last training value: the last value plus h times
 * the average change per period.
 */
public class DriftForecaster extends BenchmarkForecaster {
  @Override
  public String name() {
    return ForecastMethod.DRIFT.label();
  }

  @Override
  protected void checkHistory(TimeSeries train) {
    if (train.size() < 2) {
      throw new InsufficientDataException("Drift needs at least two observations");
    }
  }

  @Override
  protected int estimatedParameters() {
    return 1;
  }

  @Override
  protected double[] fittedValues(TimeSeries train) {
    double slope = slope(train);
    double[] fitted = new double[train.size()];
    fitted[0] = Double.NaN;
    for (int i = 1; i < fitted.length; i++) {
      fitted[i] = train.get(i - 1) + slope;
    }
    return fitted;
  }

  @Override
  protected double pointForecast(TimeSeries train, int h) {
    return train.last() + h * slope(train);
  }

  @Override
  protected double standardErrorMultiplier(TimeSeries train, int h) {
    // random walk error plus the uncertainty of the estimated slope
    return Math.sqrt(h * (1.0 + (double) h / (train.size() - 1)));
  }

  /** Average change per period over the training series. */
  static double slope(TimeSeries train) {
    return (train.last() - train.first()) / (train.size() - 1);
  }
}
