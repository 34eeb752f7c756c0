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

import io.github.mhdscope.parameters.ParameterSet;
import io.github.mhdscope.util.MathUtils;
import io.github.mhdscope.util.exceptions.DimensionMismatchException;
import io.github.mhdscope.util.exceptions.SplineFitException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Separates the probe signals into spatial modes (columns of U) and their time traces (rows of
 * VT) and draws a spatial mode as a deformed probe ring.
 */
public class SpatialDecomposer {

  private static final Logger logger = Logger.getLogger(SpatialDecomposer.class.getName());

  private final double radius;
  private final double displayAmplitude;
  private final int interpolationPoints;

  public SpatialDecomposer(@NotNull ParameterSet parameters) {
    radius = parameters.getValue(SpatialStructureParameters.RADIUS);
    displayAmplitude = parameters.getValue(SpatialStructureParameters.FACTOR);
    interpolationPoints = parameters.getValue(SpatialStructureParameters.INTERP_POINTS);
  }

  /**
   * @param data [channel][time]
   * @return the economy SVD, or null if the matrix is absent, ragged, not finite or the
   * decomposition fails
   */
  public @Nullable SVDResult decompose(@Nullable double[][] data) {
    if (data == null || data.length == 0 || data[0] == null || data[0].length == 0) {
      return null;
    }
    for (double[] row : data) {
      if (row == null || row.length != data[0].length) {
        logger.warning("Cannot decompose a ragged matrix");
        return null;
      }
    }
    if (!MathUtils.allFinite(data)) {
      logger.warning("Cannot decompose a matrix with non-finite values");
      return null;
    }
    try {
      final RealMatrix matrix = new Array2DRowRealMatrix(data, true);
      final SingularValueDecomposition svd = new SingularValueDecomposition(matrix);
      return new SVDResult(svd.getU().getData(), svd.getSingularValues(),
          svd.getVT().getData());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "SVD failed", e);
      return null;
    }
  }

  /**
   * Share of the total energy per singular value, S_i^2 / sum(S^2).
   */
  public static double[] modeEnergyFractions(@NotNull double[] singularValues) {
    double total = 0d;
    for (double s : singularValues) {
      total += s * s;
    }
    final double[] fractions = new double[singularValues.length];
    if (total == 0d) {
      return fractions;
    }
    for (int i = 0; i < singularValues.length; i++) {
      fractions[i] = singularValues[i] * singularValues[i] / total;
    }
    return fractions;
  }

  /**
   * @param mode     spatial weights, one per probe
   * @param numCoils probes on the ring, evenly spaced from angle 0
   * @throws DimensionMismatchException if the mode length differs from the probe count
   * @throws SplineFitException         if no closed contour can be fitted; probe positions are still
   *                                    available through {@link #displace(double[], int)}
   */
  public @NotNull SpatialStructure spatialStructure(@NotNull double[] mode, int numCoils) {
    final double[][][] positions = displace(mode, numCoils);
    final PeriodicSplineInterpolator spline = new PeriodicSplineInterpolator(positions[1]);
    final double[][] contour = spline.evaluate(
        MathUtils.linspace(0d, 1d, interpolationPoints));
    return new SpatialStructure(positions[0], positions[1], contour);
  }

  /**
   * @return {probe positions, displaced positions}, each [probe][x, y]
   */
  public double[][][] displace(@NotNull double[] mode, int numCoils) {
    if (mode.length != numCoils) {
      throw new DimensionMismatchException(numCoils, mode.length);
    }
    final double maxAbs = MathUtils.maxAbs(mode);
    final double[][] probes = new double[numCoils][2];
    final double[][] displaced = new double[numCoils][2];
    for (int i = 0; i < numCoils; i++) {
      final double angle = 2d * Math.PI * i / numCoils;
      final double cos = Math.cos(angle);
      final double sin = Math.sin(angle);
      probes[i][0] = radius * cos;
      probes[i][1] = radius * sin;
      final double weight = maxAbs > 0d ? mode[i] / maxAbs * displayAmplitude : 0d;
      displaced[i][0] = probes[i][0] + weight * cos;
      displaced[i][1] = probes[i][1] + weight * sin;
    }
    return new double[][][]{probes, displaced};
  }
}
