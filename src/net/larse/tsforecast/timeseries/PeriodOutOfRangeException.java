package net.larse.tsforecast.timeseries;

/** A requested period lies outside the series. */
public class PeriodOutOfRangeException extends TimeSeriesException {
  private static final long serialVersionUID = 1;

  public PeriodOutOfRangeException(String message) {
    super(message);
  }
}
