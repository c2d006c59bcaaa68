package net.larse.tsforecast.timeseries;

/** The series is too short for the requested operation. */
public class InsufficientDataException extends TimeSeriesException {
  private static final long serialVersionUID = 1;

  public InsufficientDataException(String message) {
    super(message);
  }
}
