package net.larse.tsforecast.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;
import net.larse.tsforecast.SyntheticSeries;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class STLDecompositionTest {

  @Test
  public void testComponentsAddUp() {
    TimeSeries series = SyntheticSeries.trendSeason(120, 1000, 2, 50, 0.5, 42);
    Decomposition result = new STLDecomposition().decompose(series);
    double[] y = series.values();
    double[] trend = result.trend();
    double[] seasonal = result.seasonal();
    double[] remainder = result.remainder();
    assertEquals(120, result.size());
    for (int i = 0; i < y.length; i++) {
      assertEquals(y[i], trend[i] + seasonal[i] + remainder[i], 1e-9);
    }
  }

  @Test
  public void testSeasonalSumsToAboutZeroOverACycle() {
    TimeSeries series = SyntheticSeries.trendSeason(120, 1000, 2, 50, 0.5, 7);
    double[] seasonal = new STLDecomposition().decompose(series).seasonal();
    for (int start = 12; start + 12 <= 108; start++) {
      double sum = 0;
      for (int i = start; i < start + 12; i++) {
        sum += seasonal[i];
      }
      assertTrue("cycle starting at " + start + " sums to " + sum, Math.abs(sum) < 2);
    }
  }

  @Test
  public void testRecoversTrendAndSeason() {
    TimeSeries series = SyntheticSeries.trendSeason(120, 1000, 0.5, 50, 0, 1);
    Decomposition result = new STLDecomposition().decompose(series);
    double[] trend = result.trend();
    double[] seasonal = result.seasonal();
    for (int t = 24; t < 96; t++) {
      assertEquals(SyntheticSeries.season(t, 50), seasonal[t], 3);
      assertEquals(1000 + 0.5 * t, trend[t], 3);
    }
    assertTrue(result.seasonalStrength() > 0.9);
    assertTrue(result.trendStrength() > 0.9);
  }

  @Test
  public void testSeasonallyAdjusted() {
    TimeSeries series = SyntheticSeries.trendSeason(60, 200, 1, 20, 1, 3);
    Decomposition result = new STLDecomposition().decompose(series);
    TimeSeries adjusted = result.seasonallyAdjusted();
    assertEquals(series.start(), adjusted.start());
    double[] trend = result.trend();
    double[] remainder = result.remainder();
    for (int i = 0; i < series.size(); i++) {
      assertEquals(trend[i] + remainder[i], adjusted.get(i), 1e-9);
    }
  }

  @Test
  public void testRows() {
    TimeSeries series = SyntheticSeries.trendSeason(36, 10, 0.1, 2, 0.1, 5);
    List<Decomposition.Component> rows = new STLDecomposition().decompose(series).rows();
    assertEquals(36, rows.size());
    assertEquals(series.start(), rows.get(0).period);
    assertEquals(series.end(), rows.get(35).period);
    Decomposition.Component row = rows.get(17);
    assertEquals(row.observed, row.trend + row.seasonal + row.remainder, 1e-9);
  }

  @Test(expected = InsufficientDataException.class)
  public void testTooShort() {
    new STLDecomposition().decompose(SyntheticSeries.trendSeason(23, 10, 1, 1, 0, 1));
  }

  @Test
  public void testTwoCyclesIsEnough() {
    Decomposition result =
        new STLDecomposition().decompose(SyntheticSeries.trendSeason(24, 10, 1, 1, 0.1, 1));
    assertEquals(24, result.size());
  }

  @Test
  public void testNonRobustWeightsAreOne() {
    double[] weights = new STLDecomposition()
        .decompose(SyntheticSeries.trendSeason(48, 10, 1, 1, 0.1, 1)).weights();
    for (double w : weights) {
      assertEquals(1.0, w, 0.0);
    }
  }

  @Test
  public void testRobustDownweightsOutlier() {
    double[] values = SyntheticSeries.trendSeason(120, 1000, 2, 50, 0.5, 11).values();
    values[60] += 500;
    TimeSeries series = TimeSeries.of(SyntheticSeries.START, values);

    STLDecomposition.Args args = new STLDecomposition.Args();
    args.robust = true;
    Decomposition result = new STLDecomposition(args).decompose(series);

    double[] weights = result.weights();
    for (double w : weights) {
      assertTrue(w >= 0 && w <= 1);
    }
    assertTrue(weights[60] < 0.01);
    assertTrue(result.remainder()[60] > 400);
  }

  @Test
  public void testDerivedWindows() {
    STLDecomposition stl = new STLDecomposition();
    TimeSeries series = SyntheticSeries.constant(120, 1);
    assertEquals(11, stl.seasonalWindow(series));
    assertEquals(21, stl.trendWindow(12, 11));
    assertEquals(13, stl.lowPassWindow(12));
    assertEquals(7, stl.seasonalWindow(SyntheticSeries.constant(36, 1)));
  }

  @Test
  public void testExplicitWindowsAreMadeOdd() {
    STLDecomposition.Args args = new STLDecomposition.Args();
    args.seasonalWindow = 10;
    args.trendWindow = 2;
    args.lowPassWindow = 15;
    STLDecomposition stl = new STLDecomposition(args);
    assertEquals(11, stl.seasonalWindow(SyntheticSeries.constant(48, 1)));
    assertEquals(3, stl.trendWindow(12, 11));
    assertEquals(15, stl.lowPassWindow(12));
  }

  @Test
  public void testLaterArgsChangesAreIgnored() {
    STLDecomposition.Args args = new STLDecomposition.Args();
    STLDecomposition stl = new STLDecomposition(args);
    args.robust = true;
    args.seasonalWindow = 3;
    assertEquals(11, stl.seasonalWindow(SyntheticSeries.constant(120, 1)));
    double[] values = SyntheticSeries.trendSeason(48, 10, 1, 1, 0.1, 1).values();
    values[20] += 100;
    for (double w : stl.decompose(TimeSeries.of(SyntheticSeries.START, values)).weights()) {
      assertEquals(1.0, w, 0.0);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsBadDegree() {
    STLDecomposition.Args args = new STLDecomposition.Args();
    args.trendDegree = 2;
    new STLDecomposition(args);
  }
}
