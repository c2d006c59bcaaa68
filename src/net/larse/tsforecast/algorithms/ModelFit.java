package net.larse.tsforecast.algorithms;

import java.io.Serializable;
import net.larse.tsforecast.timeseries.TimeSeries;

/**
 * The estimated state of a forecaster on one training series. Read-only once built;
 * forecasting from a fit never changes it.
 */
public abstract class ModelFit implements Serializable {
  private static final long serialVersionUID = 1;

  private final String name;
  private final TimeSeries training;
  private final double[] fitted;
  private final double sigma;

  protected ModelFit(String name, TimeSeries training, double[] fitted, double sigma) {
    this.name = name;
    this.training = training;
    this.fitted = fitted.clone();
    this.sigma = sigma;
  }

  /** Name of the model that produced the fit. */
  public String name() {
    return name;
  }

  public TimeSeries training() {
    return training;
  }

  /** One-step in-sample fitted values; NaN where the model has no history to fit from. */
  public double[] fitted() {
    return fitted.clone();
  }

  /** Observed minus fitted; NaN where fitted is NaN. */
  public double[] residuals() {
    double[] residuals = new double[fitted.length];
    for (int i = 0; i < fitted.length; i++) {
      residuals[i] = training.get(i) - fitted[i];
    }
    return residuals;
  }

  /** Standard deviation of the one-step forecast errors. */
  public double sigma() {
    return sigma;
  }
}
