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

import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SosFilterTest {

  private static final double FS = 200_000d;

  @Test
  void testZeroPhaseInBand() {
    final SosFilter filter = new SosFilter(
        ButterworthBandpass.design(new FilterSpec(4, 8000d, 12_000d), FS));
    final int n = 2000;
    final double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = Math.sin(2d * Math.PI * 10_000d * i / FS);
    }
    final double[] y = filter.filtfilt(x);
    Assertions.assertEquals(n, y.length);
    for (int i = 500; i < 1500; i++) {
      Assertions.assertEquals(x[i], y[i], 0.02, "sample " + i);
    }
  }

  @Test
  void testOutOfBandIsRemoved() {
    final SosFilter filter = new SosFilter(
        ButterworthBandpass.design(new FilterSpec(4, 8000d, 12_000d), FS));
    final double[] x = new double[2000];
    for (int i = 0; i < x.length; i++) {
      x[i] = Math.sin(2d * Math.PI * 60_000d * i / FS);
    }
    final double[] y = filter.filtfilt(x);
    for (int i = 500; i < 1500; i++) {
      Assertions.assertEquals(0d, y[i], 1e-3);
    }
  }

  @Test
  void testConstantStartsInSteadyState() {
    final SosFilter filter = new SosFilter(
        ButterworthBandpass.design(new FilterSpec(2, 8000d, 12_000d), FS));
    final double[] x = new double[200];
    Arrays.fill(x, 0.4);
    for (double v : filter.filtfilt(x)) {
      Assertions.assertEquals(0d, v, 1e-9);
    }
  }

  @Test
  void testSignalMustBeLongerThanPadding() {
    final SosFilter filter = new SosFilter(
        ButterworthBandpass.design(new FilterSpec(2, 8000d, 12_000d), FS));
    Assertions.assertEquals(15, filter.getPadLength());
    Assertions.assertThrows(IllegalArgumentException.class, () -> filter.filtfilt(new double[15]));
    Assertions.assertEquals(16, filter.filtfilt(new double[16]).length);
  }

  @Test
  void testInvalidSections() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SosFilter(new double[0][]));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SosFilter(new double[][]{{1d, 0d, -1d, 2d, 0d, 0d}}));
  }
}
