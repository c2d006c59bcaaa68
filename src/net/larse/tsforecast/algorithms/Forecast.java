package net.larse.tsforecast.algorithms;

import com.google.common.base.Preconditions;
import java.io.Serializable;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.larse.tsforecast.timeseries.TimeSeries;

/**
 * Point forecasts and prediction intervals for consecutive months following a training series.
 */
public final class Forecast implements Serializable {
  private static final long serialVersionUID = 1;

  private final String name;
  private final int seasonalPeriod;
  private final List<ForecastPoint> points;

  public Forecast(String name, int seasonalPeriod, List<ForecastPoint> points) {
    Preconditions.checkArgument(!points.isEmpty(), "A forecast needs at least one point");
    for (int i = 1; i < points.size(); i++) {
      Preconditions.checkArgument(
          points.get(i - 1).period.plusMonths(1).equals(points.get(i).period),
          "Forecast periods must be consecutive months");
    }
    this.name = name;
    this.seasonalPeriod = seasonalPeriod;
    this.points = Collections.unmodifiableList(new ArrayList<>(points));
  }

  /** Name of the model that produced the forecast. */
  public String name() {
    return name;
  }

  public int horizon() {
    return points.size();
  }

  public YearMonth start() {
    return points.get(0).period;
  }

  public YearMonth end() {
    return points.get(points.size() - 1).period;
  }

  public List<ForecastPoint> points() {
    return points;
  }

  /** The forecast at step h, 1-based. */
  public ForecastPoint step(int h) {
    Preconditions.checkElementIndex(h - 1, points.size());
    return points.get(h - 1);
  }

  public double[] pointForecasts() {
    double[] values = new double[points.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = points.get(i).point;
    }
    return values;
  }

  /** The point forecasts as a series. */
  public TimeSeries asSeries() {
    return TimeSeries.of(start(), pointForecasts(), seasonalPeriod);
  }

  @Override
  public String toString() {
    return String.format("Forecast[%s, %s..%s]", name, start(), end());
  }
}
