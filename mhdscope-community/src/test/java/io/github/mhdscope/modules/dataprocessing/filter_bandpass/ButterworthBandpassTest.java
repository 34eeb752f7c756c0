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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ButterworthBandpassTest {

  private static final double FS = 200_000d;

  @Test
  void testOneSectionPerPolePair() {
    Assertions.assertEquals(4,
        ButterworthBandpass.design(new FilterSpec(4, 9000d, 11000d), FS).length);
    Assertions.assertEquals(3,
        ButterworthBandpass.design(new FilterSpec(3, 9000d, 11000d), FS).length);
    Assertions.assertEquals(16,
        ButterworthBandpass.design(new FilterSpec(16, 8000d, 12000d), FS).length);
  }

  @Test
  void testSectionsAreStable() {
    for (double[] section : ButterworthBandpass.design(new FilterSpec(16, 8000d, 12000d), FS)) {
      Assertions.assertEquals(1d, section[3]);
      // a2 is the squared pole radius
      Assertions.assertTrue(section[5] < 1d);
      Assertions.assertEquals(0d, section[1]);
      Assertions.assertEquals(-section[0], section[2], 1e-15);
    }
  }

  @Test
  void testResponse() {
    final double low = 9000d;
    final double high = 11000d;
    final double[][] sos = ButterworthBandpass.design(new FilterSpec(4, low, high), FS);

    final double centre = FS / Math.PI * Math.atan(
        Math.sqrt(Math.tan(Math.PI * low / FS) * Math.tan(Math.PI * high / FS)));
    Assertions.assertEquals(1d, ButterworthBandpass.magnitude(sos, centre, FS), 1e-9);
    // -3 dB at both cutoffs
    Assertions.assertEquals(Math.sqrt(0.5), ButterworthBandpass.magnitude(sos, low, FS), 1e-6);
    Assertions.assertEquals(Math.sqrt(0.5), ButterworthBandpass.magnitude(sos, high, FS), 1e-6);

    Assertions.assertTrue(ButterworthBandpass.magnitude(sos, 1000d, FS) < 1e-3);
    Assertions.assertTrue(ButterworthBandpass.magnitude(sos, 50_000d, FS) < 1e-3);
    Assertions.assertEquals(0d, ButterworthBandpass.magnitude(sos, 0d, FS), 1e-12);
  }

  @Test
  void testInvalidCutoffs() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> ButterworthBandpass.design(new FilterSpec(4, 9000d, 120_000d), FS));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> ButterworthBandpass.design(new FilterSpec(4, -10d, 1000d), FS));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new FilterSpec(4, 2000d, 1000d));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new FilterSpec(0, 1000d, 2000d));
  }

  @Test
  void testPassBandAroundCentre() {
    final FilterSpec spec = FilterSpec.around(16, 10_000d, 2000d, FS, 100d);
    Assertions.assertEquals(8000d, spec.lowHz());
    Assertions.assertEquals(12_000d, spec.highHz());

    final FilterSpec clamped = FilterSpec.around(4, 1000d, 5000d, FS, 100d);
    Assertions.assertEquals(100d, clamped.lowHz());
    Assertions.assertEquals(6000d, clamped.highHz());

    final FilterSpec nearNyquist = FilterSpec.around(4, 99_000d, 5000d, FS, 100d);
    Assertions.assertEquals(99_900d, nearNyquist.highHz());
  }
}
