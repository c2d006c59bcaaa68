package net.larse.tsforecast.algorithms;

import java.util.Arrays;
import net.larse.tsforecast.timeseries.TimeSeries;
import org.apache.commons.math.stat.descriptive.moment.Mean;

/** Forecasts every future period with the mean of the training values. */
public class MeanForecaster extends BenchmarkForecaster {
  @Override
  public String name() {
    return ForecastMethod.MEAN.label();
  }

  @Override
  protected void checkHistory(TimeSeries train) {
    // any non-empty series has a mean
  }

  @Override
  protected int estimatedParameters() {
    return 1;
  }

  @Override
  protected double[] fittedValues(TimeSeries train) {
    double[] fitted = new double[train.size()];
    Arrays.fill(fitted, mean(train));
    return fitted;
  }

  @Override
  protected double pointForecast(TimeSeries train, int h) {
    return mean(train);
  }

  @Override
  protected double standardErrorMultiplier(TimeSeries train, int h) {
    return Math.sqrt(h);
  }

  private static double mean(TimeSeries train) {
    return new Mean().evaluate(train.values());
  }
}
