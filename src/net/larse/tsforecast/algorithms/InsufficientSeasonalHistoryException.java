package net.larse.tsforecast.algorithms;

import net.larse.tsforecast.timeseries.InsufficientDataException;

/** The training series does not cover a full seasonal cycle. */
public class InsufficientSeasonalHistoryException extends InsufficientDataException {
  private static final long serialVersionUID = 1;

  public InsufficientSeasonalHistoryException(String message) {
    super(message);
  }
}
