package net.larse.tsforecast.algorithms;

import com.google.common.base.Preconditions;
import java.io.Serializable;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Accuracy measures by model name, in the order the models were evaluated. */
public final class AccuracyReport implements Serializable {
  private static final long serialVersionUID = 1;

  private static final Comparator<AccuracyMeasure> BY_RMSE_THEN_MAE =
      Comparator.comparingDouble(AccuracyMeasure::getRootMeanSquaredError)
          .thenComparingDouble(AccuracyMeasure::getMeanAbsoluteError);

  private final Map<String, AccuracyMeasure> measures;

  AccuracyReport(Map<String, AccuracyMeasure> measures) {
    Preconditions.checkArgument(!measures.isEmpty(), "A report needs at least one model");
    this.measures = Collections.unmodifiableMap(new LinkedHashMap<>(measures));
  }

  public Map<String, AccuracyMeasure> measures() {
    return measures;
  }

  public Set<String> names() {
    return measures.keySet();
  }

  /**
   * @throws IllegalArgumentException if the report has no model of that name
   */
  public AccuracyMeasure get(String name) {
    AccuracyMeasure measure = measures.get(name);
    Preconditions.checkArgument(measure != null, "No model named %s in %s", name, names());
    return measure;
  }

  public double rmse(String name) {
    return get(name).getRootMeanSquaredError();
  }

  public double mae(String name) {
    return get(name).getMeanAbsoluteError();
  }

  /** Name of the model with the lowest RMSE, ties broken by MAE. */
  public String best() {
    return Collections.min(measures.entrySet(),
        Map.Entry.comparingByValue(BY_RMSE_THEN_MAE)).getKey();
  }

  @Override
  public String toString() {
    StringBuilder buffer = new StringBuilder();
    for (Map.Entry<String, AccuracyMeasure> entry : measures.entrySet()) {
      buffer.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
    }
    return buffer.toString();
  }
}
