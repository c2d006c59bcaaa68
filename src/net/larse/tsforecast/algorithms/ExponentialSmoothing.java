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
package net.larse.tsforecast.algorithms;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsforecast.helper.AlgorithmBase;
import net.larse.tsforecast.helper.ArrayHelper;
import net.larse.tsforecast.helper.FitGenerator;
import net.larse.tsforecast.timeseries.InsufficientDataException;
import net.larse.tsforecast.timeseries.TimeSeries;
import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.MultivariateRealFunction;
import org.apache.commons.math.optimization.GoalType;
import org.apache.commons.math.optimization.RealPointValuePair;
import org.apache.commons.math.optimization.SimpleScalarValueChecker;
import org.apache.commons.math.optimization.direct.NelderMead;
import org.apache.commons.math.random.JDKRandomGenerator;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math.stat.descriptive.moment.Variance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential smoothing in innovations state space form with additive errors, an additive
 * (optionally damped) trend and additive seasonality: ETS(A,A,A) and ETS(A,Ad,A) in the
 * taxonomy of Hyndman, Koehler, Ord and Snyder (2008), Forecasting with Exponential Smoothing.
 *
 * <pre>
 *   yhat_t = l_{t-1} + phi * b_{t-1} + s_{t-m}
 *   e_t    = y_t - yhat_t
 *   l_t    = l_{t-1} + phi * b_{t-1} + alpha * e_t
 *   b_t    = phi * b_{t-1} + beta * e_t
 *   s_t    = s_{t-m} + gamma * e_t
 * </pre>
 *
 * The smoothing parameters, the damping factor and the initial states are chosen to minimise
 * the sum of squared one-step errors, which maximises the Gaussian likelihood once the error
 * variance is profiled out. Box constraints are imposed through a logistic reparameterisation and
 * the search is a Nelder-Mead simplex started from a heuristic point and from a number of seeded
 * random points. Initial seasonal states are constrained to sum to zero.
 *
 * <p>Forecast variances follow the class 1 closed form of Hyndman et al. (2005):
 * v_h = sigma^2 * (1 + sum_{j=1}^{h-1} c_j^2), c_j = alpha + beta * phi_j + gamma * [j mod m == 0],
 * with phi_j = phi + ... + phi^j.
 */
public class ExponentialSmoothing implements Forecaster<ExponentialSmoothing.Fit> {
  private static final Logger logger = LoggerFactory.getLogger(ExponentialSmoothing.class);

  // Starting smoothing parameters of the heuristic start.
  private static final double START_ALPHA = 0.3;
  private static final double START_BETA = 0.1;
  private static final double START_GAMMA = 0.3;

  // Number of leading cycles used to seed the initial states.
  private static final int INIT_CYCLES = 3;

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Damp the trend with a factor phi estimated in [phiLower, phiUpper].")
    @Optional
    public boolean damped = false;

    @Doc(help = "Lower bound of the level smoothing parameter.")
    @Optional
    public double alphaLower = 0.0;

    @Doc(help = "Upper bound of the level smoothing parameter.")
    @Optional
    public double alphaUpper = 1.0;

    @Doc(help = "Lower bound of the trend smoothing parameter.")
    @Optional
    public double betaLower = 0.0;

    @Doc(help = "Upper bound of the trend smoothing parameter.")
    @Optional
    public double betaUpper = 1.0;

    @Doc(help = "Lower bound of the seasonal smoothing parameter.")
    @Optional
    public double gammaLower = 0.0;

    @Doc(help = "Upper bound of the seasonal smoothing parameter.")
    @Optional
    public double gammaUpper = 1.0;

    @Doc(help = "Lower bound of the damping factor.")
    @Optional
    public double phiLower = 0.8;

    @Doc(help = "Upper bound of the damping factor.")
    @Optional
    public double phiUpper = 0.98;

    @Doc(help = "Number of random starts in addition to the heuristic start.")
    @Optional
    public int restarts = 4;

    @Doc(help = "Number of times a converged search is restarted from its own optimum.")
    @Optional
    public int refinements = 1;

    @Doc(help = "Maximum objective evaluations of a single simplex search.")
    @Optional
    public int maxEvaluations = 100000;

    @Doc(help = "Relative change of the objective below which a search has converged.")
    @Optional
    public double relativeTolerance = 1e-8;

    @Doc(help = "Absolute change of the objective below which a search has converged.")
    @Optional
    public double absoluteTolerance = 1e-12;

    @Doc(help = "A heuristic start whose squared errors sum to less than this fraction of the "
        + "squared deviations of the observations from their mean is accepted without a search.")
    @Optional
    public double perfectFitTolerance = 1e-12;

    @Doc(help = "Seed of the random starts.")
    @Optional
    public long seed = 20150311L;
  }

  private final Args args;

  public ExponentialSmoothing() {
    this(new Args());
  }

  public ExponentialSmoothing(Args args) {
    checkBounds("alpha", args.alphaLower, args.alphaUpper, 0.0, 1.0);
    checkBounds("beta", args.betaLower, args.betaUpper, 0.0, 1.0);
    checkBounds("gamma", args.gammaLower, args.gammaUpper, 0.0, 1.0);
    checkBounds("phi", args.phiLower, args.phiUpper, Double.MIN_VALUE, 1.0);
    Preconditions.checkArgument(args.restarts >= 0 && args.refinements >= 0,
        "restarts and refinements must not be negative");
    Preconditions.checkArgument(args.maxEvaluations > 0, "maxEvaluations must be positive");
    this.args = args.copy();
  }

  private static void checkBounds(String name, double lower, double upper, double min,
      double max) {
    Preconditions.checkArgument(min <= lower && lower <= upper && upper <= max,
        "Bounds of %s must satisfy %s <= lower <= upper <= %s, got [%s, %s]",
        name, min, max, lower, upper);
  }

  @Override
  public String name() {
    return args.damped ? ForecastMethod.ETS_DAMPED.label() : ForecastMethod.ETS.label();
  }

  /**
   * Estimates parameters and initial states.
   *
   * @throws InsufficientDataException if train covers fewer than two seasonal cycles
   * @throws NonConvergentException if no simplex search converges within its budget
   */
  @Override
  public Fit fit(TimeSeries train) {
    Preconditions.checkNotNull(train, "train");
    int period = train.seasonalPeriod();
    int n = train.size();
    if (period < 2 || n < 2 * period) {
      throw new InsufficientDataException(String.format(
          "%s needs two full cycles of %d periods, got %d observations", name(), period, n));
    }

    logger.debug("Fitting {} to {} with {}", name(), train, args);
    double[] y = train.values();
    InitialStates init = initialStates(y, period);
    double scale = new StandardDeviation().evaluate(y);
    if (!(scale > 0)) {
      scale = Math.max(1.0, Math.abs(init.level));
    }
    Objective objective = new Objective(y, period, init, scale);

    // A start that already reproduces the data leaves the smoothing parameters unidentified;
    // keep the states fixed in that case.
    double[] still = objective.encode(args.alphaLower, args.betaLower, args.gammaLower,
        args.phiUpper);
    double stillSse = objective.value(still);
    // relative to the variation about the mean, independent of the level
    double variation = new Variance().evaluate(y) * (n - 1);
    if (!(variation > 0)) {
      variation = ArrayHelper.sumOfSquares(y, 0, n);
    }
    if (stillSse <= args.perfectFitTolerance * variation) {
      logger.debug("{} reproduces {} from its initial states, SSE {}", name(), train, stillSse);
      return buildFit(train, objective, still, 0, 0);
    }

    JDKRandomGenerator random = new JDKRandomGenerator();
    random.setSeed(args.seed);

    RealPointValuePair best = null;
    MathException lastFailure = null;
    int converged = 0;
    int evaluations = 0;
    for (int start = 0; start <= args.restarts; start++) {
      double[] startPoint = start == 0
          ? objective.encode(START_ALPHA, START_BETA, START_GAMMA, args.phiUpper)
          : randomStart(objective, random);
      NelderMead optimizer = newOptimizer();
      RealPointValuePair result;
      try {
        result = optimizer.optimize(objective, GoalType.MINIMIZE, startPoint);
      } catch (MathException e) {
        lastFailure = e;
        logger.warn("{} start {} on {} did not converge: {}", name(), start, train,
            e.getMessage());
        continue;
      }
      evaluations += optimizer.getEvaluations();
      for (int r = 0; r < args.refinements; r++) {
        NelderMead refiner = newOptimizer();
        try {
          RealPointValuePair refined =
              refiner.optimize(objective, GoalType.MINIMIZE, result.getPoint());
          evaluations += refiner.getEvaluations();
          if (refined.getValue() <= result.getValue()) {
            result = refined;
          }
        } catch (MathException e) {
          // keep the converged point of the start
          evaluations += args.maxEvaluations;
          logger.debug("{} refinement {} of start {} stopped: {}", name(), r, start,
              e.getMessage());
          break;
        }
      }

      converged++;
      logger.debug("{} start {} converged to SSE {}", name(), start, result.getValue());
      if (best == null || result.getValue() < best.getValue()) {
        best = result;
      }
    }

    if (best == null) {
      throw new NonConvergentException(String.format(
          "%s did not converge from any of %d starts within %d evaluations each",
          name(), args.restarts + 1, args.maxEvaluations), lastFailure);
    }
    if (Double.isNaN(best.getValue()) || Double.isInfinite(best.getValue())
        || best.getValue() >= Double.MAX_VALUE) {
      throw new NonConvergentException(String.format(
          "%s converged to a non-finite objective %s", name(), best.getValue()));
    }
    return buildFit(train, objective, best.getPoint(), converged, evaluations);
  }

  private NelderMead newOptimizer() {
    NelderMead optimizer = new NelderMead();
    optimizer.setMaxEvaluations(args.maxEvaluations);
    optimizer.setConvergenceChecker(
        new SimpleScalarValueChecker(args.relativeTolerance, args.absoluteTolerance));
    return optimizer;
  }

  private double[] randomStart(Objective objective, JDKRandomGenerator random) {
    double[] point = new double[objective.dimension()];
    int smoothing = args.damped ? 4 : 3;
    for (int i = 0; i < point.length; i++) {
      // smoothing parameters spread over the whole box, states jittered around the heuristic
      point[i] = i < smoothing ? -4.0 + 6.0 * random.nextDouble() : 0.1 * random.nextGaussian();
    }
    return point;
  }

  private Fit buildFit(TimeSeries train, Objective objective, double[] point, int converged,
      int evaluations) {
    Params params = objective.decode(point);
    Filtered filtered = filter(objective.y, objective.period, params, true);
    int n = objective.y.length;
    int k = objective.dimension();
    double sigma2 = filtered.sse / (n > k ? n - k : n);

    Fit fit = new Fit(name(), train, filtered.fitted, Math.sqrt(sigma2), args.damped, params,
        filtered, filtered.sse, converged, evaluations);
    logger.debug("{}", fit);
    return fit;
  }

  @Override
  public Forecast forecast(Fit fit, int horizon) {
    Preconditions.checkNotNull(fit, "fit");
    Preconditions.checkArgument(horizon >= 1, "Horizon must be positive, got %s", horizon);

    TimeSeries train = fit.training();
    int n = train.size();
    int period = train.seasonalPeriod();
    double sigma2 = fit.sigma() * fit.sigma();

    List<ForecastPoint> points = new ArrayList<>(horizon);
    double phiPower = 1.0;
    double phiSum = 0.0;
    double sumC2 = 0.0;
    for (int h = 1; h <= horizon; h++) {
      phiPower *= fit.phi;
      phiSum += phiPower;
      double point = fit.level + phiSum * fit.trend + fit.seasonal[(n + h - 1) % period];
      double variance = sigma2 * (1.0 + sumC2);
      points.add(ForecastPoint.withStandardError(
          train.end().plusMonths(h), point, Math.sqrt(variance)));

      double c = fit.alpha + fit.beta * phiSum + (h % period == 0 ? fit.gamma : 0.0);
      sumC2 += c * c;
    }
    return new Forecast(fit.name(), period, points);
  }

  /**
   * Seeds the states from the leading cycles: a centred moving average of one period gives the
   * trend, the per-position mean of the detrended values the seasonal states (centred to sum to
   * zero), and a least squares line through the deseasonalised values the level and slope.
   */
  @VisibleForTesting
  static InitialStates initialStates(double[] y, int period) {
    int k = Math.min(y.length / period, INIT_CYCLES) * period;
    int half = period / 2;

    double[] seasonal = new double[period];
    int[] counts = new int[period];
    for (int t = half; t < k - half; t++) {
      double ma;
      if (period % 2 == 0) {
        ma = 0.5 * y[t - half] + 0.5 * y[t + half];
        for (int j = t - half + 1; j < t + half; j++) {
          ma += y[j];
        }
      } else {
        ma = 0;
        for (int j = t - half; j <= t + half; j++) {
          ma += y[j];
        }
      }
      ma /= period;
      seasonal[t % period] += y[t] - ma;
      counts[t % period]++;
    }
    for (int j = 0; j < period; j++) {
      seasonal[j] /= counts[j];
    }
    double center = ArrayHelper.mean(seasonal, 0, period);
    for (int j = 0; j < period; j++) {
      seasonal[j] -= center;
    }

    double[] adjusted = new double[k];
    for (int t = 0; t < k; t++) {
      adjusted[t] = y[t] - seasonal[t % period];
    }
    double[] line = FitGenerator.fitLine(adjusted);
    return new InitialStates(line[0], line[1], seasonal);
  }

  /** Runs the state recursions over y and accumulates the squared one-step errors. */
  @VisibleForTesting
  static Filtered filter(double[] y, int period, Params params, boolean keepFitted) {
    double level = params.level;
    double trend = params.trend;
    double[] season = params.seasonal.clone();
    double[] fitted = keepFitted ? new double[y.length] : null;
    double sse = 0.0;

    for (int t = 0; t < y.length; t++) {
      int p = t % period;
      double dampedTrend = params.phi * trend;
      double yhat = level + dampedTrend + season[p];
      double e = y[t] - yhat;
      level = level + dampedTrend + params.alpha * e;
      trend = dampedTrend + params.beta * e;
      season[p] += params.gamma * e;
      sse += e * e;
      if (keepFitted) {
        fitted[t] = yhat;
      }
    }
    return new Filtered(level, trend, season, fitted, sse);
  }

  /** Heuristic initial states. */
  @VisibleForTesting
  static final class InitialStates {
    final double level;
    final double trend;
    final double[] seasonal;

    InitialStates(double level, double trend, double[] seasonal) {
      this.level = level;
      this.trend = trend;
      this.seasonal = seasonal;
    }
  }

  /** Parameters and initial states in their natural scale. */
  @VisibleForTesting
  static final class Params {
    final double alpha;
    final double beta;
    final double gamma;
    final double phi;
    final double level;
    final double trend;
    final double[] seasonal;

    Params(double alpha, double beta, double gamma, double phi, double level, double trend,
        double[] seasonal) {
      this.alpha = alpha;
      this.beta = beta;
      this.gamma = gamma;
      this.phi = phi;
      this.level = level;
      this.trend = trend;
      this.seasonal = seasonal;
    }
  }

  /** Final states after filtering the training data. */
  @VisibleForTesting
  static final class Filtered {
    final double level;
    final double trend;
    final double[] seasonal;
    final double[] fitted;
    final double sse;

    Filtered(double level, double trend, double[] seasonal, double[] fitted, double sse) {
      this.level = level;
      this.trend = trend;
      this.seasonal = seasonal;
      this.fitted = fitted;
      this.sse = sse;
    }
  }

  /**
   * Sum of squared one-step errors as a function of an unconstrained point. Smoothing
   * parameters map to their boxes through a logistic function; states are offsets from the
   * heuristic states in units of the series' standard deviation, and the last seasonal state
   * absorbs the others so the seasonal states keep summing to zero.
   */
  private final class Objective implements MultivariateRealFunction {
    private final double[] y;
    private final int period;
    private final InitialStates init;
    private final double scale;

    Objective(double[] y, int period, InitialStates init, double scale) {
      this.y = y;
      this.period = period;
      this.init = init;
      this.scale = scale;
    }

    int dimension() {
      return (args.damped ? 4 : 3) + 2 + (period - 1);
    }

    Params decode(double[] point) {
      int i = 0;
      double alpha = toBox(point[i++], args.alphaLower, args.alphaUpper);
      double beta = toBox(point[i++], args.betaLower, args.betaUpper);
      double gamma = toBox(point[i++], args.gammaLower, args.gammaUpper);
      double phi = args.damped ? toBox(point[i++], args.phiLower, args.phiUpper) : 1.0;
      double level = init.level + scale * point[i++];
      double trend = init.trend + scale / period * point[i++];
      double[] seasonal = new double[period];
      double shift = 0.0;
      for (int j = 0; j < period - 1; j++) {
        double offset = scale * point[i++];
        seasonal[j] = init.seasonal[j] + offset;
        shift += offset;
      }
      seasonal[period - 1] = init.seasonal[period - 1] - shift;
      return new Params(alpha, beta, gamma, phi, level, trend, seasonal);
    }

    /** A point with the given smoothing parameters and the heuristic states. */
    double[] encode(double alpha, double beta, double gamma, double phi) {
      double[] point = new double[dimension()];
      int i = 0;
      point[i++] = fromBox(alpha, args.alphaLower, args.alphaUpper);
      point[i++] = fromBox(beta, args.betaLower, args.betaUpper);
      point[i++] = fromBox(gamma, args.gammaLower, args.gammaUpper);
      if (args.damped) {
        point[i] = fromBox(phi, args.phiLower, args.phiUpper);
      }
      return point;
    }

    @Override
    public double value(double[] point) {
      double sse = filter(y, period, decode(point), false).sse;
      return Double.isNaN(sse) || Double.isInfinite(sse) ? Double.MAX_VALUE : sse;
    }
  }

  private static double toBox(double z, double lower, double upper) {
    return lower + (upper - lower) / (1.0 + Math.exp(-z));
  }

  private static double fromBox(double value, double lower, double upper) {
    if (upper <= lower) {
      return 0.0;
    }
    // the logistic never reaches the bounds, start just inside them
    double p = Math.min(1.0 - 1e-9, Math.max(1e-9, (value - lower) / (upper - lower)));
    return Math.log(p / (1.0 - p));
  }

  /** Fitted ETS model: smoothing parameters, initial states and the states at the last period. */
  public static final class Fit extends ModelFit {
    private static final long serialVersionUID = 1;

    final boolean damped;
    final double alpha;
    final double beta;
    final double gamma;
    final double phi;
    final double initialLevel;
    final double initialTrend;
    final double[] initialSeasonal;
    final double level;
    final double trend;
    final double[] seasonal;
    final double sse;
    final int convergedStarts;
    final int evaluations;

    Fit(String name, TimeSeries training, double[] fitted, double sigma, boolean damped,
        Params params, Filtered filtered, double sse, int convergedStarts, int evaluations) {
      super(name, training, fitted, sigma);
      this.damped = damped;
      this.alpha = params.alpha;
      this.beta = params.beta;
      this.gamma = params.gamma;
      this.phi = params.phi;
      this.initialLevel = params.level;
      this.initialTrend = params.trend;
      this.initialSeasonal = params.seasonal.clone();
      this.level = filtered.level;
      this.trend = filtered.trend;
      this.seasonal = filtered.seasonal.clone();
      this.sse = sse;
      this.convergedStarts = convergedStarts;
      this.evaluations = evaluations;
    }

    public boolean isDamped() {
      return damped;
    }

    public double alpha() {
      return alpha;
    }

    public double beta() {
      return beta;
    }

    public double gamma() {
      return gamma;
    }

    /** Damping factor; 1 for the undamped trend. */
    public double phi() {
      return phi;
    }

    public double initialLevel() {
      return initialLevel;
    }

    public double initialTrend() {
      return initialTrend;
    }

    /** Initial seasonal states by position in the cycle, counted from the training start. */
    public double[] initialSeasonal() {
      return initialSeasonal.clone();
    }

    /** Level at the last training period. */
    public double level() {
      return level;
    }

    /** Trend at the last training period. */
    public double trend() {
      return trend;
    }

    /** Seasonal states after the last training period, by position in the cycle. */
    public double[] seasonal() {
      return seasonal.clone();
    }

    public double sse() {
      return sse;
    }

    /** Number of starts whose search converged; 0 when no search was needed. */
    public int convergedStarts() {
      return convergedStarts;
    }

    public int evaluations() {
      return evaluations;
    }

    @Override
    public String toString() {
      return String.format(
          "%s[alpha=%.4f, beta=%.4f, gamma=%.4f, phi=%.4f, level=%.4f, trend=%.4f, sigma=%.4f]",
          name(), alpha, beta, gamma, phi, level, trend, sigma());
    }
  }
}
