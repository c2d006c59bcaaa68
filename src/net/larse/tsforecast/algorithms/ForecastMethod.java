package net.larse.tsforecast.algorithms;

/** The forecasting methods this package provides. */
public enum ForecastMethod {
  MEAN("mean"),
  NAIVE("naive"),
  SEASONAL_NAIVE("snaive"),
  DRIFT("drift"),
  ETS("ets(A,A,A)"),
  ETS_DAMPED("ets(A,Ad,A)");

  private final String label;

  ForecastMethod(String label) {
    this.label = label;
  }

  /** Name used in forecasts and accuracy reports. */
  public String label() {
    return label;
  }

  /** A forecaster for this method with default arguments. */
  public Forecaster<? extends ModelFit> newForecaster() {
    switch (this) {
      case MEAN:
        return new MeanForecaster();
      case NAIVE:
        return new NaiveForecaster();
      case SEASONAL_NAIVE:
        return new SeasonalNaiveForecaster();
      case DRIFT:
        return new DriftForecaster();
      case ETS:
        return new ExponentialSmoothing(new ExponentialSmoothing.Args());
      case ETS_DAMPED:
        ExponentialSmoothing.Args args = new ExponentialSmoothing.Args();
        args.damped = true;
        return new ExponentialSmoothing(args);
      default:
        throw new AssertionError("Unknown method " + this);
    }
  }
}
