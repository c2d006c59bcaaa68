package net.larse.tsforecast.algorithms;

import net.larse.tsforecast.timeseries.TimeSeriesException;

/** A forecast and the realized series share no periods. */
public class NoOverlapException extends TimeSeriesException {
  private static final long serialVersionUID = 1;

  public NoOverlapException(String message) {
    super(message);
  }
}
