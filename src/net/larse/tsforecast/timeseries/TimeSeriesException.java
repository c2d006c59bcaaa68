package net.larse.tsforecast.timeseries;

/** Base class of the errors raised while building, decomposing or forecasting a series. */
public class TimeSeriesException extends RuntimeException {
  private static final long serialVersionUID = 1;

  public TimeSeriesException(String message) {
    super(message);
  }

  public TimeSeriesException(String message, Throwable cause) {
    super(message, cause);
  }
}
