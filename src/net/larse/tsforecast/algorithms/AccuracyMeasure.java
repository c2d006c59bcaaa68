package net.larse.tsforecast.algorithms;

import java.io.Serializable;

/**
 * Utility class to hold results from the accuracy calculation
 */
public final class AccuracyMeasure implements Serializable {
  private static final long serialVersionUID = 1;

  private final int count;
  private final double rootMeanSquaredError;
  private final double meanAbsoluteError;
  private final double meanAbsolutePercentageError;
  private final double meanAbsoluteScaledError;

  public AccuracyMeasure(int count, double rootMeanSquaredError, double meanAbsoluteError,
      double meanAbsolutePercentageError, double meanAbsoluteScaledError) {
    this.count = count;
    this.rootMeanSquaredError = rootMeanSquaredError;
    this.meanAbsoluteError = meanAbsoluteError;
    this.meanAbsolutePercentageError = meanAbsolutePercentageError;
    this.meanAbsoluteScaledError = meanAbsoluteScaledError;
  }

  /** Number of periods compared. */
  public int getCount() {
    return count;
  }

  public double getRootMeanSquaredError() {
    return rootMeanSquaredError;
  }

  public double getMeanAbsoluteError() {
    return meanAbsoluteError;
  }

  /** In percent, over the periods with a non-zero actual value; NaN if there are none. */
  public double getMeanAbsolutePercentageError() {
    return meanAbsolutePercentageError;
  }

  /** MAE scaled by the in-sample seasonal naive MAE; NaN without a usable training series. */
  public double getMeanAbsoluteScaledError() {
    return meanAbsoluteScaledError;
  }

  @Override
  public String toString() {
    return String.format("n=%d, RMSE=%.4f, MAE=%.4f, MAPE=%.4f, MASE=%.4f", count,
        rootMeanSquaredError, meanAbsoluteError, meanAbsolutePercentageError,
        meanAbsoluteScaledError);
  }
}
