package net.larse.tsforecast.algorithms;

import java.io.Serializable;
import java.time.YearMonth;
import org.apache.commons.math.MathException;
import org.apache.commons.math.distribution.NormalDistributionImpl;

/** A point forecast with its 80% and 95% prediction intervals. */
public final class ForecastPoint implements Serializable {
  private static final long serialVersionUID = 1;

  /** Two-sided normal quantiles for the 80% and 95% intervals. */
  public static final double Z80 = standardNormalQuantile(0.90);
  public static final double Z95 = standardNormalQuantile(0.975);

  public final YearMonth period;
  public final double point;
  public final double lower80;
  public final double upper80;
  public final double lower95;
  public final double upper95;

  public ForecastPoint(YearMonth period, double point,
      double lower80, double upper80, double lower95, double upper95) {
    this.period = period;
    this.point = point;
    this.lower80 = lower80;
    this.upper80 = upper80;
    this.lower95 = lower95;
    this.upper95 = upper95;
  }

  /** Gaussian intervals point +/- z * standardError. */
  public static ForecastPoint withStandardError(YearMonth period, double point,
      double standardError) {
    return new ForecastPoint(period, point,
        point - Z80 * standardError, point + Z80 * standardError,
        point - Z95 * standardError, point + Z95 * standardError);
  }

  private static double standardNormalQuantile(double p) {
    try {
      return new NormalDistributionImpl(0, 1).inverseCumulativeProbability(p);
    } catch (MathException e) {
      throw new IllegalStateException("Cannot invert the normal distribution at " + p, e);
    }
  }

  @Override
  public String toString() {
    return String.format("%s,%s,%s,%s,%s,%s",
        period, point, lower80, upper80, lower95, upper95);
  }
}
