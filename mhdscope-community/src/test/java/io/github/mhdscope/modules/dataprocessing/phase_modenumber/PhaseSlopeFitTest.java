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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PhaseSlopeFitTest {

  @Test
  void testExactLine() {
    final double[] angles = {0d, 30d, 60d, 90d};
    final double[] phases = {10d, 70d, 130d, 190d};
    final PhaseSlopeFit fit = PhaseSlopeFit.fit(angles, phases);
    Assertions.assertNotNull(fit);
    Assertions.assertEquals(2d, fit.slope(), 1e-12);
    Assertions.assertEquals(10d, fit.intercept(), 1e-9);
    Assertions.assertEquals(1d, fit.rSquared(), 1e-12);
    Assertions.assertEquals(4, fit.points());
    Assertions.assertEquals(730d, fit.predict(360d), 1e-9);
  }

  @Test
  void testConstantPhases() {
    final PhaseSlopeFit fit = PhaseSlopeFit.fit(new double[]{0d, 30d, 60d},
        new double[]{5d, 5d, 5d});
    Assertions.assertNotNull(fit);
    Assertions.assertEquals(0d, fit.slope(), 1e-12);
    Assertions.assertEquals(0d, fit.rSquared());
  }

  @Test
  void testTooFewPoints() {
    Assertions.assertNull(PhaseSlopeFit.fit(new double[]{0d}, new double[]{1d}));
    Assertions.assertNull(PhaseSlopeFit.fit(new double[]{10d, 10d}, new double[]{1d, 2d}));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> PhaseSlopeFit.fit(new double[]{0d, 1d}, new double[]{1d}));
  }
}
