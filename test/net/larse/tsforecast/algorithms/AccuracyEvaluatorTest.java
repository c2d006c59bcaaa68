package net.larse.tsforecast.algorithms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.larse.tsforecast.SyntheticSeries;
import net.larse.tsforecast.timeseries.TimeSeries;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AccuracyEvaluatorTest {
  private static final double DELTA = 1e-12;

  private static Forecast forecastOf(String name, YearMonth start, double... points) {
    List<ForecastPoint> list = new ArrayList<>();
    for (int i = 0; i < points.length; i++) {
      list.add(ForecastPoint.withStandardError(start.plusMonths(i), points[i], 1.0));
    }
    return new Forecast(name, TimeSeries.MONTHLY, list);
  }

  @Test
  public void testPerfectForecast() {
    TimeSeries actual = TimeSeries.of(YearMonth.of(2010, 1), 3, 4, 5, 6);
    AccuracyMeasure measure =
        AccuracyEvaluator.compare(forecastOf("m", actual.start(), 3, 4, 5, 6), actual, null);
    assertEquals(4, measure.getCount());
    assertEquals(0.0, measure.getRootMeanSquaredError(), 0.0);
    assertEquals(0.0, measure.getMeanAbsoluteError(), 0.0);
    assertEquals(0.0, measure.getMeanAbsolutePercentageError(), 0.0);
    assertTrue(Double.isNaN(measure.getMeanAbsoluteScaledError()));
  }

  @Test
  public void testConstantOffset() {
    TimeSeries actual = TimeSeries.of(YearMonth.of(2010, 1), 100, 100, 100, 100);
    AccuracyReport report = AccuracyEvaluator.evaluate(
        forecastOf("m", actual.start(), 95, 105, 95, 105), actual);
    assertEquals(5.0, report.rmse("m"), DELTA);
    assertEquals(5.0, report.mae("m"), DELTA);
    assertEquals(5.0, report.get("m").getMeanAbsolutePercentageError(), DELTA);
  }

  @Test
  public void testRmseWeighsLargeErrors() {
    TimeSeries actual = TimeSeries.of(YearMonth.of(2010, 1), 0, 0, 0, 0);
    AccuracyMeasure measure =
        AccuracyEvaluator.compare(forecastOf("m", actual.start(), 4, 0, 0, 0), actual, null);
    assertEquals(2.0, measure.getRootMeanSquaredError(), DELTA);
    assertEquals(1.0, measure.getMeanAbsoluteError(), DELTA);
    // all actual values are zero
    assertTrue(Double.isNaN(measure.getMeanAbsolutePercentageError()));
  }

  @Test
  public void testPartialOverlap() {
    TimeSeries actual = TimeSeries.of(YearMonth.of(2010, 3), 10, 20, 30);
    Forecast forecast = forecastOf("m", YearMonth.of(2010, 1), 0, 0, 12, 18, 0, 0);
    AccuracyMeasure measure = AccuracyEvaluator.compare(forecast, actual, null);
    assertEquals(3, measure.getCount());
    // errors -2, 2, 30
    assertEquals(34 / 3.0, measure.getMeanAbsoluteError(), DELTA);
  }

  @Test(expected = NoOverlapException.class)
  public void testNoOverlap() {
    TimeSeries actual = TimeSeries.of(YearMonth.of(2011, 1), 1, 2);
    AccuracyEvaluator.evaluate(forecastOf("m", YearMonth.of(2010, 1), 1, 2, 3), actual);
  }

  @Test
  public void testMeanAbsoluteScaledError() {
    TimeSeries training = SyntheticSeries.linear(24, 0, 1);
    assertEquals(12.0, AccuracyEvaluator.seasonalNaiveScale(training), DELTA);
    TimeSeries actual = TimeSeries.of(YearMonth.of(2002, 1), 30, 30);
    AccuracyMeasure measure = AccuracyEvaluator.compare(
        forecastOf("m", actual.start(), 24, 36), actual, training);
    assertEquals(0.5, measure.getMeanAbsoluteScaledError(), DELTA);
  }

  @Test
  public void testScaleNeedsMoreThanOneCycle() {
    assertTrue(Double.isNaN(
        AccuracyEvaluator.seasonalNaiveScale(SyntheticSeries.linear(12, 0, 1))));
  }

  @Test
  public void testEvaluateAllAndBest() {
    TimeSeries actual = TimeSeries.of(YearMonth.of(2010, 1), 10, 10, 10);
    AccuracyReport report = AccuracyEvaluator.evaluateAll(Arrays.asList(
        forecastOf("far", actual.start(), 20, 20, 20),
        forecastOf("near", actual.start(), 11, 9, 11),
        forecastOf("spiky", actual.start(), 10, 10, 13)), actual, null);
    assertEquals(Arrays.asList("far", "near", "spiky"), new ArrayList<>(report.names()));
    // near and spiky share an MAE of 1; near has the lower RMSE
    assertEquals("near", report.best());
  }

  @Test
  public void testTiesBrokenByMae() {
    TimeSeries actual = TimeSeries.of(YearMonth.of(2010, 1), 0, 0);
    AccuracyReport report = AccuracyEvaluator.evaluateAll(Arrays.asList(
        forecastOf("a", actual.start(), 3, 4),
        forecastOf("b", actual.start(), 5, 0)), actual, null);
    assertEquals(report.rmse("a"), report.rmse("b"), 0.0);
    assertEquals("b", report.best());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateNames() {
    TimeSeries actual = TimeSeries.of(YearMonth.of(2010, 1), 1, 2);
    AccuracyEvaluator.evaluateAll(Arrays.asList(
        forecastOf("m", actual.start(), 1, 2), forecastOf("m", actual.start(), 2, 1)),
        actual, null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownModel() {
    TimeSeries actual = TimeSeries.of(YearMonth.of(2010, 1), 1, 2);
    AccuracyEvaluator.evaluate(forecastOf("m", actual.start(), 1, 2), actual).get("other");
  }
}
