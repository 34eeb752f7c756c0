/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.mhdscope.modules.dataprocessing.filter_bandpass;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.jetbrains.annotations.NotNull;

/**
 * Savitzky-Golay smoothing: every sample is replaced by the value of a least squares polynomial
 * fitted to the window around it. The first and last half windows are taken from the polynomial
 * fitted to the first and last full window.
 */
public final class SavitzkyGolayFilter {

  private final int windowLength;
  private final int polyOrder;
  /**
   * Row k maps the window samples to the fitted value at window position k.
   */
  private final double[][] projection;

  public SavitzkyGolayFilter(int windowLength, int polyOrder) {
    if (windowLength < 1 || windowLength % 2 == 0) {
      throw new IllegalArgumentException("Window length must be a positive odd number");
    }
    if (polyOrder < 0 || polyOrder >= windowLength) {
      throw new IllegalArgumentException(
          "Polynomial order " + polyOrder + " must be below the window length " + windowLength);
    }
    this.windowLength = windowLength;
    this.polyOrder = polyOrder;
    this.projection = projectionMatrix(windowLength, polyOrder);
  }

  public int getWindowLength() {
    return windowLength;
  }

  public int getPolyOrder() {
    return polyOrder;
  }

  /**
   * @throws IllegalArgumentException if the signal is shorter than the window
   */
  public double[] smooth(@NotNull double[] x) {
    final int n = x.length;
    if (n < windowLength) {
      throw new IllegalArgumentException(
          "Signal of " + n + " samples is shorter than the window " + windowLength);
    }
    final int half = windowLength / 2;
    final double[] y = new double[n];
    for (int i = half; i < n - half; i++) {
      y[i] = apply(projection[half], x, i - half);
    }
    for (int i = 0; i < half; i++) {
      y[i] = apply(projection[i], x, 0);
    }
    for (int i = n - half; i < n; i++) {
      y[i] = apply(projection[windowLength - (n - i)], x, n - windowLength);
    }
    return y;
  }

  private double apply(double[] weights, double[] x, int offset) {
    double sum = 0d;
    for (int j = 0; j < windowLength; j++) {
      sum += weights[j] * x[offset + j];
    }
    return sum;
  }

  /**
   * V pinv(V) with V the Vandermonde matrix of the window positions -half..half.
   */
  private static double[][] projectionMatrix(int windowLength, int polyOrder) {
    final int half = windowLength / 2;
    final double[][] vandermonde = new double[windowLength][polyOrder + 1];
    for (int i = 0; i < windowLength; i++) {
      final double position = i - half;
      double power = 1d;
      for (int j = 0; j <= polyOrder; j++) {
        vandermonde[i][j] = power;
        power *= position;
      }
    }
    final RealMatrix v = new Array2DRowRealMatrix(vandermonde, false);
    final RealMatrix pseudoInverse = new SingularValueDecomposition(v).getSolver().getInverse();
    return v.multiply(pseudoInverse).getData();
  }
}
