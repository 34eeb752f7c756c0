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
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.jetbrains.annotations.NotNull;

/**
 * Cascaded second-order sections in direct form II transposed. Rows are
 * {@code [b0, b1, b2, a0, a1, a2]} with a0 = 1.
 */
public final class SosFilter {

  private final double[][] sos;
  private final double[][] steadyState;

  public SosFilter(@NotNull double[][] sos) {
    if (sos.length == 0) {
      throw new IllegalArgumentException("At least one section is required");
    }
    this.sos = new double[sos.length][];
    for (int i = 0; i < sos.length; i++) {
      if (sos[i].length != 6 || sos[i][3] != 1d) {
        throw new IllegalArgumentException("Section " + i + " is not normalised [b0 b1 b2 1 a1 a2]");
      }
      this.sos[i] = sos[i].clone();
    }
    this.steadyState = steadyStateConditions(this.sos);
  }

  public int getNumberOfSections() {
    return sos.length;
  }

  /**
   * Samples of odd extension on each side for {@link #filtfilt(double[])}.
   */
  public int getPadLength() {
    return 3 * (2 * sos.length + 1);
  }

  /**
   * Single forward pass.
   *
   * @param initialState per section state, null for a zero state
   */
  double[] filter(double[] x, double[][] initialState) {
    final double[] y = x.clone();
    for (int s = 0; s < sos.length; s++) {
      final double b0 = sos[s][0], b1 = sos[s][1], b2 = sos[s][2];
      final double a1 = sos[s][4], a2 = sos[s][5];
      double z0 = initialState == null ? 0d : initialState[s][0];
      double z1 = initialState == null ? 0d : initialState[s][1];
      for (int i = 0; i < y.length; i++) {
        final double in = y[i];
        final double out = b0 * in + z0;
        z0 = b1 * in - a1 * out + z1;
        z1 = b2 * in - a2 * out;
        y[i] = out;
      }
    }
    return y;
  }

  /**
   * Forward-backward filtering with odd extension and steady-state initial conditions. The output
   * has no phase shift.
   *
   * @throws IllegalArgumentException if the signal is not longer than {@link #getPadLength()}
   */
  public double[] filtfilt(@NotNull double[] x) {
    final int padLength = getPadLength();
    final int n = x.length;
    if (n <= padLength) {
      throw new IllegalArgumentException(
          "Signal of " + n + " samples must be longer than the pad length " + padLength);
    }

    final double[] extended = new double[n + 2 * padLength];
    for (int i = 0; i < padLength; i++) {
      extended[i] = 2d * x[0] - x[padLength - i];
      extended[padLength + n + i] = 2d * x[n - 1] - x[n - 2 - i];
    }
    System.arraycopy(x, 0, extended, padLength, n);

    final double[] forward = filter(extended, scaledState(extended[0]));
    reverse(forward);
    final double[] backward = filter(forward, scaledState(forward[0]));
    reverse(backward);

    final double[] result = new double[n];
    System.arraycopy(backward, padLength, result, 0, n);
    return result;
  }

  private double[][] scaledState(double x0) {
    final double[][] state = new double[steadyState.length][2];
    for (int s = 0; s < state.length; s++) {
      state[s][0] = steadyState[s][0] * x0;
      state[s][1] = steadyState[s][1] * x0;
    }
    return state;
  }

  /**
   * State of each section for a unit step that has settled, scaled by the DC gain of the sections
   * in front of it.
   */
  private static double[][] steadyStateConditions(double[][] sos) {
    final double[][] zi = new double[sos.length][];
    double scale = 1d;
    for (int s = 0; s < sos.length; s++) {
      final double b0 = sos[s][0], b1 = sos[s][1], b2 = sos[s][2];
      final double a1 = sos[s][4], a2 = sos[s][5];
      final RealMatrix system = new Array2DRowRealMatrix(
          new double[][]{{1d + a1, -1d}, {a2, 1d}});
      final double[] rhs = {b1 - a1 * b0, b2 - a2 * b0};
      final double[] solved = new LUDecomposition(system).getSolver()
          .solve(new ArrayRealVector(rhs, false)).toArray();
      zi[s] = new double[]{solved[0] * scale, solved[1] * scale};
      scale *= (b0 + b1 + b2) / (1d + a1 + a2);
    }
    return zi;
  }

  private static void reverse(double[] values) {
    for (int i = 0, j = values.length - 1; i < j; i++, j--) {
      final double tmp = values[i];
      values[i] = values[j];
      values[j] = tmp;
    }
  }
}
