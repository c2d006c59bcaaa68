package net.larse.tsforecast.algorithms;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.larse.tsforecast.timeseries.TimeSeries;

/**
 * Compares forecasts with realized values over the periods both cover.
 *
 * Implemented measures:
 *
 * https://en.wikipedia.org/wiki/Root-mean-square_deviation
 * https://en.wikipedia.org/wiki/Mean_absolute_error
 * https://en.wikipedia.org/wiki/Mean_absolute_percentage_error
 * https://en.wikipedia.org/wiki/Mean_absolute_scaled_error
 */
public final class AccuracyEvaluator {
  private AccuracyEvaluator() {}

  /**
   * @throws NoOverlapException if the forecast and actual share no periods
   */
  public static AccuracyReport evaluate(Forecast forecast, TimeSeries actual) {
    return evaluate(forecast, actual, null);
  }

  /**
   * Like {@link #evaluate(Forecast, TimeSeries)}, also scaling the errors by the training
   * series' seasonal naive MAE.
   */
  public static AccuracyReport evaluate(Forecast forecast, TimeSeries actual,
      TimeSeries training) {
    Map<String, AccuracyMeasure> measures = new LinkedHashMap<>();
    measures.put(forecast.name(), compare(forecast, actual, training));
    return new AccuracyReport(measures);
  }

  /** One report for several forecasts of the same actual series. */
  public static AccuracyReport evaluateAll(List<Forecast> forecasts, TimeSeries actual,
      TimeSeries training) {
    Preconditions.checkArgument(!forecasts.isEmpty(), "Nothing to evaluate");
    Map<String, AccuracyMeasure> measures = new LinkedHashMap<>();
    for (Forecast forecast : forecasts) {
      Preconditions.checkArgument(!measures.containsKey(forecast.name()),
          "Duplicate model name %s", forecast.name());
      measures.put(forecast.name(), compare(forecast, actual, training));
    }
    return new AccuracyReport(measures);
  }

  /**
   * Accuracy of one forecast against actual over their common periods.
   *
   * @param training may be null, in which case MASE is NaN
   * @throws NoOverlapException if the forecast and actual share no periods
   */
  public static AccuracyMeasure compare(Forecast forecast, TimeSeries actual,
      TimeSeries training) {
    Preconditions.checkNotNull(forecast, "forecast");
    Preconditions.checkNotNull(actual, "actual");

    DoubleArrayList errors = new DoubleArrayList(forecast.horizon());
    DoubleArrayList relativeErrors = new DoubleArrayList(forecast.horizon());
    for (ForecastPoint point : forecast.points()) {
      int index = actual.indexOf(point.period);
      if (index < 0) {
        continue;
      }
      double actualValue = actual.get(index);
      double error = actualValue - point.point;
      errors.add(error);
      if (actualValue != 0) {
        relativeErrors.add(Math.abs(error / actualValue));
      }
    }

    int count = errors.size();
    if (count == 0) {
      throw new NoOverlapException(String.format(
          "Forecast %s..%s and actual %s..%s share no periods",
          forecast.start(), forecast.end(), actual.start(), actual.end()));
    }

    double sumSq = 0;
    double sumAbs = 0;
    for (int i = 0; i < count; i++) {
      double error = errors.getDouble(i);
      sumSq += error * error;
      sumAbs += Math.abs(error);
    }
    double rmse = Math.sqrt(sumSq / count);
    double mae = sumAbs / count;

    double mape = Double.NaN;
    if (!relativeErrors.isEmpty()) {
      double sum = 0;
      for (int i = 0; i < relativeErrors.size(); i++) {
        sum += relativeErrors.getDouble(i);
      }
      mape = 100.0 * sum / relativeErrors.size();
    }

    double scale = training == null ? Double.NaN : seasonalNaiveScale(training);
    double mase = scale > 0 ? mae / scale : Double.NaN;

    return new AccuracyMeasure(count, rmse, mae, mape, mase);
  }

  /** In-sample MAE of the seasonal naive method; NaN for less than one full cycle of history. */
  @VisibleForTesting
  static double seasonalNaiveScale(TimeSeries training) {
    int period = training.seasonalPeriod();
    if (training.size() <= period) {
      return Double.NaN;
    }
    double sum = 0;
    for (int i = period; i < training.size(); i++) {
      sum += Math.abs(training.get(i) - training.get(i - period));
    }
    return sum / (training.size() - period);
  }
}
