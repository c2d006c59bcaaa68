package net.larse.tsforecast.timeseries;

/** The periods or values handed to a series break its structure. */
public class MalformedSeriesException extends TimeSeriesException {
  private static final long serialVersionUID = 1;

  public MalformedSeriesException(String message) {
    super(message);
  }
}
