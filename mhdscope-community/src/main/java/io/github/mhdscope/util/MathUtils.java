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

package io.github.mhdscope.util;

import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Small array helpers shared by the processing modules.
 */
public final class MathUtils {

  private MathUtils() {
  }

  /**
   * @return {@code num} evenly spaced values from start to stop, both inclusive
   */
  public static double[] linspace(double start, double stop, int num) {
    if (num <= 0) {
      return new double[0];
    }
    final double[] values = new double[num];
    if (num == 1) {
      values[0] = start;
      return values;
    }
    final double step = (stop - start) / (num - 1);
    for (int i = 0; i < num; i++) {
      values[i] = start + i * step;
    }
    // avoid accumulated rounding at the end point
    values[num - 1] = stop;
    return values;
  }

  /**
   * Left insertion point of value in a non-decreasing array, i.e. the index of the first element
   * that is not smaller than value.
   */
  public static int searchSortedLeft(double[] sorted, double value) {
    int lo = 0;
    int hi = sorted.length;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (sorted[mid] < value) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  /**
   * @return index of the first maximum in [from, to)
   */
  public static int argMax(double[] values, int from, int to) {
    int best = from;
    for (int i = from + 1; i < to; i++) {
      if (values[i] > values[best]) {
        best = i;
      }
    }
    return best;
  }

  public static double max(double[] values) {
    double max = Double.NEGATIVE_INFINITY;
    for (double v : values) {
      max = Math.max(max, v);
    }
    return max;
  }

  public static double maxAbs(double[] values) {
    double max = 0d;
    for (double v : values) {
      max = Math.max(max, Math.abs(v));
    }
    return max;
  }

  public static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  public static boolean allFinite(double[][] matrix) {
    for (double[] row : matrix) {
      for (double v : row) {
        if (!Double.isFinite(v)) {
          return false;
        }
      }
    }
    return true;
  }

  public static double[][] transpose(double[][] matrix) {
    if (matrix.length == 0) {
      return new double[0][0];
    }
    final int rows = matrix.length;
    final int cols = matrix[0].length;
    final double[][] out = new double[cols][rows];
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        out[c][r] = matrix[r][c];
      }
    }
    return out;
  }

  public static double[][] copy(@NotNull double[][] matrix) {
    final double[][] out = new double[matrix.length][];
    for (int i = 0; i < matrix.length; i++) {
      out[i] = Arrays.copyOf(matrix[i], matrix[i].length);
    }
    return out;
  }

  public static double[] column(double[][] matrix, int column) {
    final double[] out = new double[matrix.length];
    for (int r = 0; r < matrix.length; r++) {
      out[r] = matrix[r][column];
    }
    return out;
  }
}
