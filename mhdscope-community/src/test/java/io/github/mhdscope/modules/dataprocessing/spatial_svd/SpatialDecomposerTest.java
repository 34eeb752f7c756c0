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

import io.github.mhdscope.util.exceptions.DimensionMismatchException;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpatialDecomposerTest {

  private final SpatialDecomposer decomposer = new SpatialDecomposer(
      new SpatialStructureParameters());

  @Test
  void testReconstruction() {
    final Random random = new Random(7);
    final double[][] data = new double[12][300];
    for (int ch = 0; ch < 12; ch++) {
      for (int t = 0; t < 300; t++) {
        data[ch][t] = Math.sin(2d * Math.PI * t / 20d - ch * Math.PI / 6d)
            + 0.1 * random.nextGaussian();
      }
    }
    final SVDResult svd = decomposer.decompose(data);
    Assertions.assertNotNull(svd);
    Assertions.assertEquals(12, svd.getRank());
    Assertions.assertEquals(12, svd.u().length);
    Assertions.assertEquals(12, svd.vt().length);
    Assertions.assertEquals(300, svd.vt()[0].length);
    for (int k = 1; k < svd.s().length; k++) {
      Assertions.assertTrue(svd.s()[k] <= svd.s()[k - 1]);
      Assertions.assertTrue(svd.s()[k] >= 0d);
    }

    final double[][] reconstructed = svd.reconstruct();
    for (int ch = 0; ch < 12; ch++) {
      for (int t = 0; t < 300; t++) {
        Assertions.assertEquals(data[ch][t], reconstructed[ch][t], 1e-9);
      }
    }
  }

  @Test
  void testWideAndTallMatrices() {
    final double[][] tall = {{1d, 2d}, {3d, 4d}, {5d, 6d}};
    final SVDResult svd = decomposer.decompose(tall);
    Assertions.assertNotNull(svd);
    Assertions.assertEquals(2, svd.getRank());
    Assertions.assertEquals(3, svd.u().length);
    Assertions.assertEquals(2, svd.u()[0].length);
    Assertions.assertEquals(6d, svd.reconstruct()[2][1], 1e-12);
  }

  @Test
  void testInvalidInputGivesNull() {
    Assertions.assertNull(decomposer.decompose(null));
    Assertions.assertNull(decomposer.decompose(new double[0][]));
    Assertions.assertNull(decomposer.decompose(new double[][]{{1d, 2d}, {3d}}));
    Assertions.assertNull(decomposer.decompose(new double[][]{{1d, Double.NaN}, {3d, 4d}}));
    Assertions.assertNull(
        decomposer.decompose(new double[][]{{1d, Double.POSITIVE_INFINITY}, {3d, 4d}}));
  }

  @Test
  void testEnergyFractions() {
    final double[] fractions = SpatialDecomposer.modeEnergyFractions(new double[]{3d, 4d});
    Assertions.assertEquals(9d / 25d, fractions[0], 1e-12);
    Assertions.assertEquals(16d / 25d, fractions[1], 1e-12);
    Assertions.assertArrayEquals(new double[]{0d, 0d},
        SpatialDecomposer.modeEnergyFractions(new double[]{0d, 0d}));
  }

  @Test
  void testZeroModeKeepsProbePositions() {
    final SpatialStructure structure = decomposer.spatialStructure(new double[12], 12);
    for (int i = 0; i < 12; i++) {
      Assertions.assertArrayEquals(structure.probePositions()[i],
          structure.displacedPositions()[i]);
    }
    Assertions.assertEquals(200, structure.contour().length);
    // the contour of an undisturbed ring stays close to the ring
    for (double[] point : structure.contour()) {
      Assertions.assertEquals(40d, Math.hypot(point[0], point[1]), 0.5);
    }
  }

  @Test
  void testModeDisplacesProbes() {
    final double[] mode = new double[12];
    mode[0] = -2d;
    mode[3] = 1d;
    final SpatialStructure structure = decomposer.spatialStructure(mode, 12);
    // largest weight moves by the display amplitude
    Assertions.assertEquals(40d - 15d, structure.displacedPositions()[0][0], 1e-9);
    Assertions.assertEquals(40d + 7.5, structure.displacedPositions()[3][1], 1e-9);
    Assertions.assertEquals(40d, structure.probePositions()[0][0], 1e-12);

    final double[][] contour = structure.contour();
    Assertions.assertArrayEquals(structure.displacedPositions()[0], contour[0], 1e-9);
    Assertions.assertArrayEquals(contour[0], contour[contour.length - 1], 1e-9);
  }

  @Test
  void testDimensionMismatch() {
    final DimensionMismatchException e = Assertions.assertThrows(
        DimensionMismatchException.class, () -> decomposer.spatialStructure(new double[10], 12));
    Assertions.assertEquals(12, e.getExpected());
    Assertions.assertEquals(10, e.getActual());
  }
}
