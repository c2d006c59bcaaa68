package net.larse.tsforecast.algorithms;

import net.larse.tsforecast.timeseries.TimeSeries;

/**
 * A forecasting model: {@link #fit} estimates a read-only {@link ModelFit} from a training
 * series, {@link #forecast} extends it over a horizon. Implementations keep only their
 * configuration, so one instance may fit several series concurrently.
 */
public interface Forecaster<F extends ModelFit> {
  String name();

  F fit(TimeSeries train);

  /**
   * Forecasts horizon periods past the end of the training series.
   *
   * @throws IllegalArgumentException if horizon is not positive
   */
  Forecast forecast(F fit, int horizon);

  default Forecast fitAndForecast(TimeSeries train, int horizon) {
    return forecast(fit(train), horizon);
  }
}
