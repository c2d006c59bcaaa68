package net.larse.tsforecast.algorithms;

import com.google.common.base.Preconditions;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.larse.tsforecast.timeseries.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holdout comparison of competing forecasters: each candidate is fitted on the periods before
 * the cutoff, forecasts the remaining periods and is scored against them. The candidate with
 * the lowest RMSE (ties broken by MAE) is reported as the best one; refitting it on the full
 * series is left to the caller.
 */
public final class ModelSelection {
  private static final Logger logger = LoggerFactory.getLogger(ModelSelection.class);

  private final Map<String, Forecaster<? extends ModelFit>> candidates;
  private final Map<String, Forecast> forecasts;
  private final AccuracyReport report;

  private ModelSelection(Map<String, Forecaster<? extends ModelFit>> candidates,
      Map<String, Forecast> forecasts, AccuracyReport report) {
    this.candidates = candidates;
    this.forecasts = forecasts;
    this.report = report;
  }

  /**
   * Fits every candidate on series before cutoff and evaluates it on the rest.
   *
   * @throws net.larse.tsforecast.timeseries.EmptySplitException if the cutoff leaves an empty
   *     side
   */
  public static ModelSelection compare(List<? extends Forecaster<? extends ModelFit>> candidates,
      TimeSeries series, YearMonth cutoff) {
    Preconditions.checkArgument(!candidates.isEmpty(), "No candidates to compare");
    TimeSeries.Split split = series.split(cutoff);
    int horizon = split.test().size();

    Map<String, Forecaster<? extends ModelFit>> byName = new LinkedHashMap<>();
    Map<String, Forecast> forecasts = new LinkedHashMap<>();
    List<Forecast> ordered = new ArrayList<>(candidates.size());
    for (Forecaster<? extends ModelFit> candidate : candidates) {
      Preconditions.checkArgument(!byName.containsKey(candidate.name()),
          "Duplicate candidate %s", candidate.name());
      Forecast forecast = candidate.fitAndForecast(split.train(), horizon);
      byName.put(candidate.name(), candidate);
      forecasts.put(candidate.name(), forecast);
      ordered.add(forecast);
    }

    AccuracyReport report = AccuracyEvaluator.evaluateAll(ordered, split.test(), split.train());
    logger.debug("Holdout from {} over {} periods:\n{}", cutoff, horizon, report);
    return new ModelSelection(byName, forecasts, report);
  }

  public AccuracyReport report() {
    return report;
  }

  /** Holdout forecasts by candidate name. */
  public Map<String, Forecast> forecasts() {
    return Collections.unmodifiableMap(forecasts);
  }

  public String bestName() {
    return report.best();
  }

  public Forecaster<? extends ModelFit> best() {
    return candidates.get(bestName());
  }
}
