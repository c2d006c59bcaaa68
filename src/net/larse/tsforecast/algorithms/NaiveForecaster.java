package net.larse.tsforecast.algorithms;

import net.larse.tsforecast.timeseries.TimeSeries;

/** Forecasts every future period with the last training value (a random walk). */
public class NaiveForecaster extends BenchmarkForecaster {
  @Override
  public String name() {
    return ForecastMethod.NAIVE.label();
  }

  @Override
  protected void checkHistory(TimeSeries train) {
    // the last value always exists
  }

  @Override
  protected int estimatedParameters() {
    return 0;
  }

  @Override
  protected double[] fittedValues(TimeSeries train) {
    double[] fitted = new double[train.size()];
    fitted[0] = Double.NaN;
    for (int i = 1; i < fitted.length; i++) {
      fitted[i] = train.get(i - 1);
    }
    return fitted;
  }

  @Override
  protected double pointForecast(TimeSeries train, int h) {
    return train.last();
  }

  @Override
  protected double standardErrorMultiplier(TimeSeries train, int h) {
    return Math.sqrt(h);
  }
}
