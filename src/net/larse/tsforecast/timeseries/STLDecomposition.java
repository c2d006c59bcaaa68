/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsforecast.timeseries;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import net.larse.tsforecast.helper.AlgorithmBase;
import net.larse.tsforecast.helper.ArrayHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seasonal Decomposition of Time Series by Loess.
 *
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL:
 * A Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official Statistics, 6, 3–73.
 *
 * <p>Window spans left at 0 are derived from the series: the seasonal span grows with the number
 * of cycles (at least 7), the trend span follows Cleveland et al. (1.5 * period scaled by the
 * seasonal span) and the low-pass span is the period rounded up to odd. Evaluation jumps default
 * to a tenth of the span.
 */
public class STLDecomposition {
  private static final Logger logger = LoggerFactory.getLogger(STLDecomposition.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Span (in cycles) of the cycle-subseries smoother. 0 derives it from the "
        + "number of cycles.")
    @Optional
    public int seasonalWindow = 0;

    @Doc(help = "Local degree of the cycle-subseries smoother, 0 or 1.")
    @Optional
    public int seasonalDegree = 0;

    @Doc(help = "Span (in periods) of the trend smoother. 0 derives it from the seasonal span.")
    @Optional
    public int trendWindow = 0;

    @Doc(help = "Local degree of the trend smoother, 0 or 1.")
    @Optional
    public int trendDegree = 1;

    @Doc(help = "Span of the low-pass smoother. 0 uses the seasonal period rounded up to odd.")
    @Optional
    public int lowPassWindow = 0;

    @Doc(help = "Local degree of the low-pass smoother, 0 or 1.")
    @Optional
    public int lowPassDegree = 1;

    @Doc(help = "Evaluation step of the seasonal smoother. 0 uses a tenth of its span.")
    @Optional
    public int seasonalJump = 0;

    @Doc(help = "Evaluation step of the trend smoother. 0 uses a tenth of its span.")
    @Optional
    public int trendJump = 0;

    @Doc(help = "Evaluation step of the low-pass smoother. 0 uses a tenth of its span.")
    @Optional
    public int lowPassJump = 0;

    @Doc(help = "Use bisquare robustness weights between outer iterations.")
    @Optional
    public boolean robust = false;

    @Doc(help = "Inner iterations. 0 uses 2, or 1 when robust.")
    @Optional
    public int innerIterations = 0;

    @Doc(help = "Outer robustness iterations, only used when robust.")
    @Optional
    public int outerIterations = 15;
  }

  private final Args args;

  public STLDecomposition() {
    this(new Args());
  }

  public STLDecomposition(Args args) {
    Preconditions.checkArgument(isDegree(args.seasonalDegree), "seasonalDegree must be 0 or 1");
    Preconditions.checkArgument(isDegree(args.trendDegree), "trendDegree must be 0 or 1");
    Preconditions.checkArgument(isDegree(args.lowPassDegree), "lowPassDegree must be 0 or 1");
    Preconditions.checkArgument(args.seasonalWindow >= 0 && args.trendWindow >= 0
        && args.lowPassWindow >= 0, "Windows must not be negative");
    Preconditions.checkArgument(args.innerIterations >= 0 && args.outerIterations >= 0,
        "Iterations must not be negative");
    this.args = args.copy();
  }

  private static boolean isDegree(int degree) {
    return degree == 0 || degree == 1;
  }

  /**
   * Decomposes the series into trend, seasonal and remainder.
   *
   * @throws InsufficientDataException if the series covers fewer than two seasonal cycles
   */
  public Decomposition decompose(TimeSeries series) {
    int n = series.size();
    int period = series.seasonalPeriod();
    if (period < 2 || n < 2 * period) {
      throw new InsufficientDataException(String.format(
          "Decomposition needs two full cycles of %d periods, got %d observations", period, n));
    }

    int ns = seasonalWindow(series);
    int nt = trendWindow(period, ns);
    int nl = lowPassWindow(period);
    int inner = args.innerIterations > 0 ? args.innerIterations : (args.robust ? 1 : 2);
    int outer = args.robust ? args.outerIterations : 0;

    logger.debug("STL on {} with {}: ns={}, nt={}, nl={}, inner={}, outer={}",
        series, args, ns, nt, nl, inner, outer);

    double[] y = series.values();
    double[] weights = new double[n];
    double[] season = new double[n];
    double[] trend = new double[n];

    TimeSeriesUtils.stl(y, n, period, ns, nt, nl,
        args.seasonalDegree, args.trendDegree, args.lowPassDegree,
        jump(args.seasonalJump, ns), jump(args.trendJump, nt), jump(args.lowPassJump, nl),
        inner, outer, weights, season, trend);

    return new Decomposition(series, trend, season, weights);
  }

  @VisibleForTesting
  int seasonalWindow(TimeSeries series) {
    if (args.seasonalWindow > 0) {
      return ArrayHelper.nextOdd(Math.max(3, args.seasonalWindow));
    }
    return ArrayHelper.nextOdd(Math.max(7, series.cycles()));
  }

  @VisibleForTesting
  int trendWindow(int period, int seasonalWindow) {
    if (args.trendWindow > 0) {
      return ArrayHelper.nextOdd(Math.max(3, args.trendWindow));
    }
    return ArrayHelper.nextOdd(1.5 * period / (1.0 - 1.5 / seasonalWindow));
  }

  @VisibleForTesting
  int lowPassWindow(int period) {
    if (args.lowPassWindow > 0) {
      return ArrayHelper.nextOdd(Math.max(3, args.lowPassWindow));
    }
    return ArrayHelper.nextOdd(period);
  }

  private static int jump(int requested, int window) {
    return requested > 0 ? requested : (int) Math.ceil(window / 10.0);
  }
}
