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

import org.jetbrains.annotations.NotNull;

/**
 * Economy size singular value decomposition of a (channel, time) matrix.
 *
 * @param u  spatial modes as columns, channel x k
 * @param s  singular values, descending
 * @param vt temporal modes as rows, k x time
 */
public record SVDResult(double[][] u, double[] s, double[][] vt) {

  public int getRank() {
    return s.length;
  }

  /**
   * @param mode 0-based mode index
   * @return the spatial weights of the mode, one per channel
   */
  public double[] spatialMode(int mode) {
    final double[] column = new double[u.length];
    for (int ch = 0; ch < u.length; ch++) {
      column[ch] = u[ch][mode];
    }
    return column;
  }

  /**
   * @return U diag(S) VT
   */
  public @NotNull double[][] reconstruct() {
    final int rows = u.length;
    final int cols = vt.length == 0 ? 0 : vt[0].length;
    final double[][] out = new double[rows][cols];
    for (int r = 0; r < rows; r++) {
      for (int k = 0; k < s.length; k++) {
        final double weight = u[r][k] * s[k];
        for (int c = 0; c < cols; c++) {
          out[r][c] += weight * vt[k][c];
        }
      }
    }
    return out;
  }
}
