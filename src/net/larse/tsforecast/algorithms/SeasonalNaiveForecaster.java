package net.larse.tsforecast.algorithms;

import net.larse.tsforecast.timeseries.TimeSeries;

/**
 * Forecasts each future period with the value observed one seasonal cycle earlier, repeating
 * the last observed cycle.
 */
public class SeasonalNaiveForecaster extends BenchmarkForecaster {
  @Override
  public String name() {
    return ForecastMethod.SEASONAL_NAIVE.label();
  }

  @Override
  protected void checkHistory(TimeSeries train) {
    if (train.size() < train.seasonalPeriod()) {
      throw new InsufficientSeasonalHistoryException(String.format(
          "Seasonal naive needs %d observations, got %d",
          train.seasonalPeriod(), train.size()));
    }
  }

  @Override
  protected int estimatedParameters() {
    return 0;
  }

  @Override
  protected double[] fittedValues(TimeSeries train) {
    int period = train.seasonalPeriod();
    double[] fitted = new double[train.size()];
    for (int i = 0; i < fitted.length; i++) {
      fitted[i] = i < period ? Double.NaN : train.get(i - period);
    }
    return fitted;
  }

  @Override
  protected double pointForecast(TimeSeries train, int h) {
    int period = train.seasonalPeriod();
    return train.get(train.size() - period + (h - 1) % period);
  }

  @Override
  protected double standardErrorMultiplier(TimeSeries train, int h) {
    // number of complete cycles the forecast reaches into, counting the current one
    return Math.sqrt((h - 1) / train.seasonalPeriod() + 1);
  }
}
