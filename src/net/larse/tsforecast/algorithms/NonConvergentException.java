package net.larse.tsforecast.algorithms;

import net.larse.tsforecast.timeseries.TimeSeriesException;

/** The parameter search did not converge within its evaluation budget. */
public class NonConvergentException extends TimeSeriesException {
  private static final long serialVersionUID = 1;

  public NonConvergentException(String message) {
    super(message);
  }

  public NonConvergentException(String message, Throwable cause) {
    super(message, cause);
  }
}
