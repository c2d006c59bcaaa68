package net.larse.tsforecast.algorithms;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsforecast.timeseries.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of the simple benchmark methods (mean, naive, seasonal naive, drift).
 *
 * <p>The fitted state is the training series itself plus the residual standard deviation of the
 * one-step in-sample fit, sigma = sqrt(sum(e^2) / (count - k)) with k the number of estimated
 * parameters. Prediction intervals are point +/- z * sigma * multiplier(h), with a
 * method-specific multiplier. When no residual degrees of freedom are left, sigma and the
 * interval bounds are NaN.
 */
public abstract class BenchmarkForecaster implements Forecaster<BenchmarkForecaster.Fit> {
  private static final Logger logger = LoggerFactory.getLogger(BenchmarkForecaster.class);

  /** Fit of a benchmark method. */
  public static final class Fit extends ModelFit {
    private static final long serialVersionUID = 1;

    Fit(String name, TimeSeries training, double[] fitted, double sigma) {
      super(name, training, fitted, sigma);
    }
  }

  /** Fails when the training series is too short for the method. */
  protected abstract void checkHistory(TimeSeries train);

  /** Number of parameters estimated from the training data. */
  protected abstract int estimatedParameters();

  /** One-step in-sample fitted values, NaN where there is no history. */
  protected abstract double[] fittedValues(TimeSeries train);

  /** Point forecast h steps past the end of train, h >= 1. */
  protected abstract double pointForecast(TimeSeries train, int h);

  /** Ratio of the h-step forecast standard error to sigma. */
  protected abstract double standardErrorMultiplier(TimeSeries train, int h);

  @Override
  public Fit fit(TimeSeries train) {
    Preconditions.checkNotNull(train, "train");
    checkHistory(train);

    double[] fitted = fittedValues(train);
    DoubleArrayList residuals = new DoubleArrayList(train.size());
    for (int i = 0; i < fitted.length; i++) {
      if (!Double.isNaN(fitted[i])) {
        residuals.add(train.get(i) - fitted[i]);
      }
    }

    int dof = residuals.size() - estimatedParameters();
    double sigma = Double.NaN;
    if (dof > 0) {
      double sumSq = 0;
      for (int i = 0; i < residuals.size(); i++) {
        sumSq += residuals.getDouble(i) * residuals.getDouble(i);
      }
      sigma = Math.sqrt(sumSq / dof);
    } else {
      logger.warn("{} on {} leaves no residual degrees of freedom, intervals are undefined",
          name(), train);
    }
    return new Fit(name(), train, fitted, sigma);
  }

  @Override
  public Forecast forecast(Fit fit, int horizon) {
    Preconditions.checkNotNull(fit, "fit");
    Preconditions.checkArgument(horizon >= 1, "Horizon must be positive, got %s", horizon);

    TimeSeries train = fit.training();
    List<ForecastPoint> points = new ArrayList<>(horizon);
    for (int h = 1; h <= horizon; h++) {
      double se = fit.sigma() * standardErrorMultiplier(train, h);
      points.add(ForecastPoint.withStandardError(
          train.end().plusMonths(h), pointForecast(train, h), se));
    }
    return new Forecast(fit.name(), train.seasonalPeriod(), points);
  }
}
