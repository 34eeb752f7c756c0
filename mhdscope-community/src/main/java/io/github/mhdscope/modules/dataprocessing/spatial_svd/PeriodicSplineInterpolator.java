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

package io.github.mhdscope.modules.dataprocessing.spatial_svd;

import io.github.mhdscope.util.exceptions.SplineFitException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.jetbrains.annotations.NotNull;

/**
 * Closed parametric curve through a ring of points: a periodic cubic spline per coordinate with
 * continuous second derivative, parameterised by normalised chord length.
 */
public final class PeriodicSplineInterpolator {

  private final double[] knots;
  private final double[][] values;
  private final double[][] secondDerivatives;

  /**
   * @param points [point][x, y], the ring is closed between the last and the first point
   * @throws SplineFitException for fewer than 3 points, two consecutive identical points or a
   *                            singular system
   */
  public PeriodicSplineInterpolator(@NotNull double[][] points) {
    final int n = points.length;
    if (n < 3) {
      throw new SplineFitException("A periodic spline needs at least 3 points, got " + n);
    }
    knots = new double[n + 1];
    for (int i = 1; i <= n; i++) {
      final double[] a = points[i - 1];
      final double[] b = points[i % n];
      final double chord = Math.hypot(b[0] - a[0], b[1] - a[1]);
      if (!(chord > 0d)) {
        throw new SplineFitException("Points " + (i - 1) + " and " + (i % n) + " coincide");
      }
      knots[i] = knots[i - 1] + chord;
    }
    final double total = knots[n];
    for (int i = 1; i < n; i++) {
      knots[i] /= total;
    }
    knots[n] = 1d;

    final double[] h = new double[n];
    for (int i = 0; i < n; i++) {
      h[i] = knots[i + 1] - knots[i];
    }
    final RealMatrix system = new Array2DRowRealMatrix(n, n);
    for (int i = 0; i < n; i++) {
      final int prev = (i + n - 1) % n;
      system.addToEntry(i, prev, h[prev]);
      system.addToEntry(i, i, 2d * (h[prev] + h[i]));
      system.addToEntry(i, (i + 1) % n, h[i]);
    }
    final DecompositionSolver solver;
    try {
      solver = new LUDecomposition(system).getSolver();
    } catch (RuntimeException e) {
      throw new SplineFitException("Cannot factor the spline system", e);
    }
    if (!solver.isNonSingular()) {
      throw new SplineFitException("The spline system is singular");
    }

    values = new double[2][n];
    secondDerivatives = new double[2][];
    for (int dim = 0; dim < 2; dim++) {
      for (int i = 0; i < n; i++) {
        values[dim][i] = points[i][dim];
      }
      final double[] rhs = new double[n];
      for (int i = 0; i < n; i++) {
        final int prev = (i + n - 1) % n;
        final int next = (i + 1) % n;
        rhs[i] = 6d * ((values[dim][next] - values[dim][i]) / h[i]
            - (values[dim][i] - values[dim][prev]) / h[prev]);
      }
      try {
        secondDerivatives[dim] = solver.solve(new ArrayRealVector(rhs, false)).toArray();
      } catch (SingularMatrixException e) {
        throw new SplineFitException("The spline system is singular", e);
      }
    }
  }

  /**
   * @return the curve parameter of each input point, 0 for the first
   */
  public double[] getKnots() {
    final double[] copy = new double[knots.length - 1];
    System.arraycopy(knots, 0, copy, 0, copy.length);
    return copy;
  }

  /**
   * @param u curve parameter, wrapped into [0, 1]
   * @return [x, y]
   */
  public double[] value(double u) {
    double t = u - Math.floor(u);
    if (u == 1d) {
      t = 1d;
    }
    final int n = values[0].length;
    int i = 0;
    while (i < n - 1 && t > knots[i + 1]) {
      i++;
    }
    final int next = (i + 1) % n;
    final double h = knots[i + 1] - knots[i];
    final double a = knots[i + 1] - t;
    final double b = t - knots[i];
    final double[] result = new double[2];
    for (int dim = 0; dim < 2; dim++) {
      final double mi = secondDerivatives[dim][i];
      final double mj = secondDerivatives[dim][next];
      result[dim] = mi * a * a * a / (6d * h) + mj * b * b * b / (6d * h)
          + (values[dim][i] / h - mi * h / 6d) * a + (values[dim][next] / h - mj * h / 6d) * b;
    }
    return result;
  }

  /**
   * @return [point][x, y] at the given parameters
   */
  public double[][] evaluate(@NotNull double[] parameters) {
    final double[][] curve = new double[parameters.length][];
    for (int k = 0; k < parameters.length; k++) {
      curve[k] = value(parameters[k]);
    }
    return curve;
  }
}
