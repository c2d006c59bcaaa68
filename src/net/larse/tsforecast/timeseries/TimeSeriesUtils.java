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

import org.apache.commons.math.stat.descriptive.rank.Median;

/**
 * Numerical kernels of the STL procedure:
 * R.B. Cleveland, W.S. Cleveland, J.E. McRae, and I. Terpenning,
 * STL: A Seasonal-Trend Decomposition Procedure Based on Loess,
 * Journal of Official Statistics, 6, 3-73, 1990.
 *
 * Based on the netlib stl routines used by the R package. The routine names and argument order
 * are kept so the two can be cross checked. Positions handed to the loess routines (xs, nleft,
 * nright) are 1-based as in the reference; arrays are 0-based.
 */
public final class TimeSeriesUtils {
  private TimeSeriesUtils() {}

  /**
   * @param y the series
   * @param n length of y
   * @param np seasonal period
   * @param ns span of the seasonal smoother
   * @param nt span of the trend smoother
   * @param nl span of the low-pass smoother
   * @param isdeg local degree for the seasonal smoother
   * @param itdeg local degree for the trend smoother
   * @param ildeg local degree for the low-pass smoother
   * @param nsjump evaluation step of the seasonal smoother
   * @param ntjump evaluation step of the trend smoother
   * @param nljump evaluation step of the low-pass smoother
   * @param ni number of inner iterations
   * @param no number of outer (robustness) iterations
   * @param rw output robustness weights, length n
   * @param season output seasonal component, length n
   * @param trend output trend component, length n
   */
  public static void stl(double[] y, int n, int np,
                         int ns, int nt, int nl,
                         int isdeg, int itdeg, int ildeg,
                         int nsjump, int ntjump, int nljump,
                         int ni, int no,
                         double[] rw, double[] season, double[] trend) {
    boolean userw = false;

    for (int i = 0; i < n; i++) {
      trend[i] = 0.0;
    }

    // the three spans must be at least three and odd
    int newns = Math.max(3, ns);
    int newnt = Math.max(3, nt);
    int newnl = Math.max(3, nl);

    if (newns % 2 == 0) {
      newns++;
    }
    if (newnt % 2 == 0) {
      newnt++;
    }
    if (newnl % 2 == 0) {
      newnl++;
    }

    int newnp = Math.max(2, np); // periodicity at least 2

    double[][] work = new double[5][n + 2 * newnp];
    double[] fit = new double[n];

    int k = 0;
    // outer loop -- robustness iterations
    while (true) {
      stlstp(y, n, newnp, newns, newnt, newnl, isdeg, itdeg, ildeg,
          nsjump, ntjump, nljump, ni, userw, rw, season, trend, work);
      k++;
      if (k > no) {
        break;
      }
      for (int i = 0; i < n; i++) {
        fit[i] = trend[i] + season[i];
      }
      stlrwt(y, n, fit, rw);
      userw = true;
    }

    // robustness weights when there were no robustness iterations
    if (no <= 0) {
      for (int i = 0; i < n; i++) {
        rw[i] = 1.0;
      }
    }
  }

  /** The inner loop: seasonal smoothing followed by trend smoothing, ni times. */
  static void stlstp(double[] y, int n, int np, int ns, int nt, int nl,
                     int isdeg, int itdeg, int ildeg,
                     int nsjump, int ntjump, int nljump,
                     int ni, boolean userw, double[] rw,
                     double[] season, double[] trend, double[][] work) {
    double[] work1 = work[0];
    double[] work2 = work[1];
    double[] work3 = work[2];
    double[] work4 = work[3];
    double[] work5 = work[4];

    for (int j = 0; j < ni; j++) {
      for (int i = 0; i < n; i++) {
        work1[i] = y[i] - trend[i];
      }

      // work2 <- cycle-subseries smooth, extended by one period at each end
      stlss(work1, n, np, ns, isdeg, nsjump, userw, rw, work2, work3, work4, work5, season);
      // work3 <- moving averages np, np, 3 of the extended smooth
      stlfts(work2, n + 2 * np, np, work3, work1);
      // work1 <- loess of the moving averages
      stless(work3, n, nl, ildeg, nljump, false, work4, work1, 0, work5);

      for (int i = 0; i < n; i++) {
        season[i] = work2[np + i] - work1[i];
      }
      for (int i = 0; i < n; i++) {
        work1[i] = y[i] - season[i];
      }

      stless(work1, n, nt, itdeg, ntjump, userw, rw, trend, 0, work3);
    }
  }

  /**
   * Bisquare robustness weights from the residuals y - fit, with the cutoff at six times the
   * median absolute residual.
   */
  static void stlrwt(double[] y, int n, double[] fit, double[] rw) {
    double[] r = new double[n];
    for (int i = 0; i < n; i++) {
      r[i] = Math.abs(y[i] - fit[i]);
    }

    double cmad = 6.0 * new Median().evaluate(r);
    double c9 = 0.999 * cmad;
    double c1 = 0.001 * cmad;

    for (int i = 0; i < n; i++) {
      if (r[i] <= c1) {
        rw[i] = 1.0;
      } else if (r[i] <= c9) {
        double u = r[i] / cmad;
        rw[i] = (1.0 - u * u) * (1.0 - u * u);
      } else {
        rw[i] = 0.0;
      }
    }
  }

  /**
   * Smooths each of the np cycle-subseries and extrapolates one value before and after it.
   * season must hold n + 2 * np values; work4 must hold at least n / np + 1 values.
   */
  static void stlss(double[] y, int n, int np, int ns, int isdeg, int nsjump,
                    boolean userw, double[] rw, double[] season,
                    double[] work1, double[] work2, double[] work3, double[] work4) {
    if (np < 1) {
      return;
    }

    for (int j = 1; j <= np; j++) {
      int k = (n - j) / np + 1;

      for (int i = 1; i <= k; i++) {
        work1[i - 1] = y[(i - 1) * np + j - 1];
      }
      if (userw) {
        for (int i = 1; i <= k; i++) {
          work3[i - 1] = rw[(i - 1) * np + j - 1];
        }
      }

      stless(work1, k, ns, isdeg, nsjump, userw, work3, work2, 1, work4);

      int nright = Math.min(ns, k);
      if (!stlest(work1, k, ns, isdeg, 0, work2, 0, 1, nright, work4, userw, work3)) {
        work2[0] = work2[1];
      }

      int nleft = Math.max(1, k - ns + 1);
      if (!stlest(work1, k, ns, isdeg, k + 1, work2, k + 1, nleft, k, work4, userw, work3)) {
        work2[k + 1] = work2[k];
      }

      for (int m = 1; m <= k + 2; m++) {
        season[(m - 1) * np + j - 1] = work2[m - 1];
      }
    }
  }

  /** The low-pass filter: moving averages of length np, np and 3. trend gets n - 2 * np values. */
  static void stlfts(double[] x, int n, int np, double[] trend, double[] work) {
    stlma(x, n, np, trend);
    stlma(trend, n - np + 1, np, work);
    stlma(work, n - 2 * np + 2, 3, trend);
  }

  /** Moving average of length len; ave gets n - len + 1 values. */
  static void stlma(double[] x, int n, int len, double[] ave) {
    int newn = n - len + 1;
    double flen = len;
    double v = 0.0;
    for (int i = 0; i < len; i++) {
      v += x[i];
    }
    ave[0] = v / flen;
    int k = len;
    int m = 0;
    for (int j = 1; j < newn; j++) {
      v = v - x[m] + x[k];
      ave[j] = v / flen;
      k++;
      m++;
    }
  }

  /**
   * Loess smoothing of y with span len and degree ideg, evaluated every njump points and linearly
   * interpolated in between. The result is written to ys starting at offset.
   */
  static void stless(double[] y, int n, int len, int ideg, int njump,
                     boolean userw, double[] rw, double[] ys, int offset, double[] res) {
    if (n < 2) {
      ys[offset] = y[0];
      return;
    }

    int newnj = Math.max(1, Math.min(njump, n - 1));
    int nleft = 0;
    int nright = 0;

    if (len >= n) {
      nleft = 1;
      nright = n;
      for (int i = 1; i <= n; i += newnj) {
        if (!stlest(y, n, len, ideg, i, ys, offset + i - 1, nleft, nright, res, userw, rw)) {
          ys[offset + i - 1] = y[i - 1];
        }
      }
    } else if (newnj == 1) {
      int nsh = (len + 1) / 2;
      nleft = 1;
      nright = len;
      for (int i = 1; i <= n; i++) {
        if (i > nsh && nright != n) {
          nleft++;
          nright++;
        }
        if (!stlest(y, n, len, ideg, i, ys, offset + i - 1, nleft, nright, res, userw, rw)) {
          ys[offset + i - 1] = y[i - 1];
        }
      }
    } else {
      int nsh = (len + 1) / 2;
      for (int i = 1; i <= n; i += newnj) {
        if (i < nsh) {
          nleft = 1;
          nright = len;
        } else if (i >= n - nsh + 1) {
          nleft = n - len + 1;
          nright = n;
        } else {
          nleft = i - nsh + 1;
          nright = len + i - nsh;
        }
        if (!stlest(y, n, len, ideg, i, ys, offset + i - 1, nleft, nright, res, userw, rw)) {
          ys[offset + i - 1] = y[i - 1];
        }
      }
    }

    if (newnj != 1) {
      for (int i = 1; i <= n - newnj; i += newnj) {
        double delta = (ys[offset + i + newnj - 1] - ys[offset + i - 1]) / newnj;
        for (int j = i + 1; j <= i + newnj - 1; j++) {
          ys[offset + j - 1] = ys[offset + i - 1] + delta * (j - i);
        }
      }
      int k = ((n - 1) / newnj) * newnj + 1;
      if (k != n) {
        if (!stlest(y, n, len, ideg, n, ys, offset + n - 1, nleft, nright, res, userw, rw)) {
          ys[offset + n - 1] = y[n - 1];
        }
        if (k != n - 1) {
          double delta = (ys[offset + n - 1] - ys[offset + k - 1]) / (n - k);
          for (int j = k + 1; j <= n - 1; j++) {
            ys[offset + j - 1] = ys[offset + k - 1] + delta * (j - k);
          }
        }
      }
    }
  }

  /**
   * Local weighted regression at position xs using the points nleft..nright with tricube
   * weights. Windows are not padded at the ends of the series, so near the edges the
   * neighbourhood is asymmetric. Returns false when every weight is zero.
   */
  static boolean stlest(double[] y, int n, int len, int ideg, double xs,
                        double[] ys, int ysIndex, int nleft, int nright,
                        double[] w, boolean userw, double[] rw) {
    double range = n - 1.0;
    double h = Math.max(xs - nleft, nright - xs);
    if (len > n) {
      h += (len - n) / 2;
    }
    double h9 = 0.999 * h;
    double h1 = 0.001 * h;

    double a = 0.0;
    for (int j = nleft; j <= nright; j++) {
      w[j - 1] = 0.0;
      double r = Math.abs(j - xs);
      if (r <= h9) {
        if (r <= h1) {
          w[j - 1] = 1.0;
        } else {
          double u = r / h;
          double t = 1.0 - u * u * u;
          w[j - 1] = t * t * t;
        }
        if (userw) {
          w[j - 1] *= rw[j - 1];
        }
        a += w[j - 1];
      }
    }

    if (a <= 0.0) {
      return false;
    }

    for (int j = nleft; j <= nright; j++) {
      w[j - 1] /= a;
    }

    if (h > 0.0 && ideg > 0) {
      a = 0.0;
      for (int j = nleft; j <= nright; j++) {
        a += w[j - 1] * j;
      }
      double b = xs - a;
      double c = 0.0;
      for (int j = nleft; j <= nright; j++) {
        c += w[j - 1] * (j - a) * (j - a);
      }
      if (Math.sqrt(c) > 0.001 * range) {
        b /= c;
        for (int j = nleft; j <= nright; j++) {
          w[j - 1] *= b * (j - a) + 1.0;
        }
      }
    }

    double value = 0.0;
    for (int j = nleft; j <= nright; j++) {
      value += w[j - 1] * y[j - 1];
    }
    ys[ysIndex] = value;
    return true;
  }
}
