package net.larse.tsforecast.algorithms;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.time.YearMonth;
import net.larse.tsforecast.SyntheticSeries;
import net.larse.tsforecast.timeseries.InsufficientDataException;
import net.larse.tsforecast.timeseries.TimeSeries;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BenchmarkForecasterTest {
  private static final double DELTA = 1e-9;

  @Test
  public void testSeasonalNaiveRepeatsLastCycle() {
    TimeSeries train = SyntheticSeries.trendSeason(36, 100, 1, 10, 1, 3);
    Forecast forecast = new SeasonalNaiveForecaster().fitAndForecast(train, 30);
    assertEquals(30, forecast.horizon());
    for (int h = 1; h <= 30; h++) {
      double expected = train.get(24 + (h - 1) % 12);
      assertEquals(expected, forecast.step(h).point, 0.0);
      // same calendar month as the matching training observation
      assertEquals(train.periodAt(24 + (h - 1) % 12).getMonth(),
          forecast.step(h).period.getMonth());
    }
  }

  @Test
  public void testSeasonalNaiveIntervalsStepPerCycle() {
    TimeSeries train = SyntheticSeries.trendSeason(48, 100, 1, 10, 2, 4);
    BenchmarkForecaster.Fit fit = new SeasonalNaiveForecaster().fit(train);
    Forecast forecast = new SeasonalNaiveForecaster().forecast(fit, 25);
    double sigma = fit.sigma();
    assertEquals(ForecastPoint.Z95 * sigma, halfWidth95(forecast.step(1)), 1e-9);
    assertEquals(ForecastPoint.Z95 * sigma, halfWidth95(forecast.step(12)), 1e-9);
    assertEquals(ForecastPoint.Z95 * sigma * Math.sqrt(2), halfWidth95(forecast.step(13)), 1e-9);
    assertEquals(ForecastPoint.Z95 * sigma * Math.sqrt(3), halfWidth95(forecast.step(25)), 1e-9);
  }

  @Test
  public void testDriftOnLine() {
    TimeSeries train = SyntheticSeries.linear(24, 100, 10);
    Forecast forecast = new DriftForecaster().fitAndForecast(train, 6);
    for (int h = 1; h <= 6; h++) {
      ForecastPoint point = forecast.step(h);
      assertEquals(330 + 10 * h, point.point, DELTA);
      assertEquals(point.point, point.lower95, DELTA);
      assertEquals(point.point, point.upper95, DELTA);
      assertEquals(point.point, point.lower80, DELTA);
      assertEquals(point.point, point.upper80, DELTA);
    }
    assertEquals(10.0, DriftForecaster.slope(train), DELTA);
  }

  @Test
  public void testDriftIntervalGrowth() {
    TimeSeries train = SyntheticSeries.trendSeason(25, 100, 1, 10, 2, 8);
    BenchmarkForecaster.Fit fit = new DriftForecaster().fit(train);
    Forecast forecast = new DriftForecaster().forecast(fit, 4);
    double expected = ForecastPoint.Z80 * fit.sigma() * Math.sqrt(4 * (1 + 4 / 24.0));
    ForecastPoint point = forecast.step(4);
    assertEquals(expected, point.upper80 - point.point, 1e-9);
  }

  @Test
  public void testMean() {
    TimeSeries train = TimeSeries.of(SyntheticSeries.START, 1, 2, 3, 4, 5, 6);
    BenchmarkForecaster.Fit fit = new MeanForecaster().fit(train);
    // squared deviations from 3.5 sum to 17.5 over 5 degrees of freedom
    assertEquals(Math.sqrt(3.5), fit.sigma(), DELTA);
    Forecast forecast = new MeanForecaster().forecast(fit, 3);
    assertArrayEquals(new double[] {3.5, 3.5, 3.5}, forecast.pointForecasts(), DELTA);
  }

  @Test
  public void testNaive() {
    TimeSeries train = TimeSeries.of(SyntheticSeries.START, 5, 7, 6, 9, 8);
    BenchmarkForecaster.Fit fit = new NaiveForecaster().fit(train);
    assertTrue(Double.isNaN(fit.fitted()[0]));
    assertEquals(5.0, fit.fitted()[1], 0.0);
    // residuals 2, -1, 3, -1
    assertEquals(Math.sqrt(15 / 4.0), fit.sigma(), DELTA);

    Forecast forecast = new NaiveForecaster().forecast(fit, 4);
    assertArrayEquals(new double[] {8, 8, 8, 8}, forecast.pointForecasts(), 0.0);
  }

  @Test
  public void testNaiveIntervalsGrowWithSquareRoot() {
    TimeSeries train = SyntheticSeries.trendSeason(40, 50, 0, 5, 1, 9);
    Forecast forecast = new NaiveForecaster().fitAndForecast(train, 9);
    double first = halfWidth95(forecast.step(1));
    assertTrue(first > 0);
    assertEquals(first * 2, halfWidth95(forecast.step(4)), 1e-9);
    assertEquals(first * 3, halfWidth95(forecast.step(9)), 1e-9);
  }

  @Test
  public void testIntervalsAreNested() {
    TimeSeries train = SyntheticSeries.trendSeason(48, 100, 1, 10, 2, 12);
    for (ForecastMethod method : new ForecastMethod[] {ForecastMethod.MEAN, ForecastMethod.NAIVE,
        ForecastMethod.SEASONAL_NAIVE, ForecastMethod.DRIFT}) {
      Forecast forecast = method.newForecaster().fitAndForecast(train, 18);
      double previousWidth = 0;
      for (ForecastPoint point : forecast.points()) {
        assertTrue(point.lower95 <= point.lower80);
        assertTrue(point.lower80 <= point.point);
        assertTrue(point.point <= point.upper80);
        assertTrue(point.upper80 <= point.upper95);
        double width = point.upper95 - point.lower95;
        assertTrue(method + " width shrinks", width >= previousWidth);
        previousWidth = width;
      }
    }
  }

  @Test(expected = InsufficientSeasonalHistoryException.class)
  public void testSeasonalNaiveNeedsACycle() {
    new SeasonalNaiveForecaster().fit(SyntheticSeries.linear(11, 0, 1));
  }

  @Test
  public void testSeasonalNaiveOnOneCycleHasNoSigma() {
    Forecast forecast =
        new SeasonalNaiveForecaster().fitAndForecast(SyntheticSeries.linear(12, 0, 1), 2);
    assertEquals(0.0, forecast.step(1).point, 0.0);
    assertEquals(1.0, forecast.step(2).point, 0.0);
    assertTrue(Double.isNaN(forecast.step(1).upper95));
  }

  @Test(expected = InsufficientDataException.class)
  public void testDriftNeedsTwoObservations() {
    new DriftForecaster().fit(TimeSeries.of(SyntheticSeries.START, 5.0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testHorizonMustBePositive() {
    NaiveForecaster naive = new NaiveForecaster();
    naive.forecast(naive.fit(SyntheticSeries.linear(10, 0, 1)), 0);
  }

  @Test
  public void testForecastStartsAfterTraining() {
    TimeSeries train = TimeSeries.of(YearMonth.of(2019, 11), 1, 2, 3);
    Forecast forecast = new MeanForecaster().fitAndForecast(train, 3);
    assertEquals(YearMonth.of(2020, 2), forecast.start());
    assertEquals(YearMonth.of(2020, 4), forecast.end());
    assertEquals(forecast.start(), forecast.asSeries().start());
  }

  @Test
  public void testForecastingDoesNotChangeFit() {
    TimeSeries train = SyntheticSeries.trendSeason(30, 10, 0.5, 3, 1, 2);
    DriftForecaster drift = new DriftForecaster();
    BenchmarkForecaster.Fit fit = drift.fit(train);
    Forecast longer = drift.forecast(fit, 10);
    Forecast shorter = drift.forecast(fit, 4);
    for (int h = 1; h <= 4; h++) {
      assertEquals(longer.step(h).point, shorter.step(h).point, 0.0);
      assertEquals(longer.step(h).upper95, shorter.step(h).upper95, 0.0);
    }
  }

  @Test
  public void testNames() {
    for (ForecastMethod method : ForecastMethod.values()) {
      assertEquals(method.label(), method.newForecaster().name());
    }
  }

  private static double halfWidth95(ForecastPoint point) {
    return point.upper95 - point.point;
  }
}
