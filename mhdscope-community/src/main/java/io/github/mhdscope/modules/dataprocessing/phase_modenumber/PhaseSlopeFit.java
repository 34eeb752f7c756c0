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

package io.github.mhdscope.modules.dataprocessing.phase_modenumber;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Ordinary least squares line of phase difference against probe angle. Its slope is the mode
 * number.
 */
public record PhaseSlopeFit(double slope, double intercept, double rSquared, int points) {

  /**
   * @return the fit, or null for fewer than two points or a single probe angle
   */
  public static @Nullable PhaseSlopeFit fit(@NotNull double[] angles, @NotNull double[] phases) {
    if (angles.length != phases.length) {
      throw new IllegalArgumentException("Angles and phases differ in length");
    }
    if (angles.length < 2) {
      return null;
    }
    final SimpleRegression regression = new SimpleRegression(true);
    for (int i = 0; i < angles.length; i++) {
      regression.addData(angles[i], phases[i]);
    }
    final double slope = regression.getSlope();
    if (Double.isNaN(slope)) {
      return null;
    }
    // constant phases have no variance to explain
    final double rSquared = regression.getTotalSumSquares() == 0d ? 0d : regression.getRSquare();
    return new PhaseSlopeFit(slope, regression.getIntercept(), rSquared, angles.length);
  }

  public double predict(double angle) {
    return slope * angle + intercept;
  }
}
