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
package net.larse.tsforecast.helper;

import com.google.common.base.Preconditions;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

/**
 * A wrapper for OLS fitting.
 */
public class FitGenerator {
  private final int numRows;
  private final int numCols;

  private final DenseMatrix64F matrixA;
  private final DenseMatrix64F matrixB;

  public FitGenerator(int numRows, int numCols) {
    Preconditions.checkArgument(numRows >= numCols && numCols >= 1,
        "Need at least as many observations (%s) as coefficients (%s)", numRows, numCols);
    this.numRows = numRows;
    this.numCols = numCols;
    matrixA = new DenseMatrix64F(numRows, numCols);
    matrixB = new DenseMatrix64F(numRows, 1);
  }

  public void setObservation(int idx, int feature, double value) {
    matrixA.set(idx, feature, value);
  }

  public void setTarget(int idx, double target) {
    matrixB.set(idx, 0, target);
  }

  public int getNumRows() {
    return numRows;
  }

  /**
   * Solves the least squares problem. Returns null when the design matrix is singular.
   */
  public double[] linearFit() {
    DenseMatrix64F matrixX = new DenseMatrix64F(numCols, 1);
    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.leastSquares(numRows, numCols);
    if (!solver.setA(matrixA) || solver.quality() == 0) {
      return null;
    }
    solver.solve(matrixB, matrixX);
    return matrixX.getData();
  }

  /**
   * Fits y = intercept + slope * t to the values, where t runs 1..y.length.
   *
   * @return {intercept, slope}, or a flat line through the mean when the fit is singular
   */
  public static double[] fitLine(double[] y) {
    Preconditions.checkArgument(y.length >= 2, "Need two points for a line, got %s", y.length);
    FitGenerator generator = new FitGenerator(y.length, 2);
    for (int i = 0; i < y.length; i++) {
      generator.setObservation(i, 0, 1.0);
      generator.setObservation(i, 1, i + 1);
      generator.setTarget(i, y[i]);
    }
    double[] coefs = generator.linearFit();
    if (coefs == null) {
      return new double[] {ArrayHelper.mean(y, 0, y.length), 0.0};
    }
    return coefs;
  }
}
