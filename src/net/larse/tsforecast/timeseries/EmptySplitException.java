package net.larse.tsforecast.timeseries;

/** Splitting a series would leave one side empty. */
public class EmptySplitException extends TimeSeriesException {
  private static final long serialVersionUID = 1;

  public EmptySplitException(String message) {
    super(message);
  }
}
