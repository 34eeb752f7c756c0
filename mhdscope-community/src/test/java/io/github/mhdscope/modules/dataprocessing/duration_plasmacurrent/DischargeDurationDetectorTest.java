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

package io.github.mhdscope.modules.dataprocessing.duration_plasmacurrent;

import io.github.mhdscope.util.exceptions.InvalidChannelDataException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DischargeDurationDetectorTest {

  private final DischargeDurationDetector detector = new DischargeDurationDetector(
      new DischargeDurationParameters());

  @Test
  void testTrapezoid() {
    final double fs = 1000d;
    final int n = 1000;
    final double[] current = new double[n];
    final double[] time = new double[n];
    for (int i = 0; i < n; i++) {
      time[i] = i / fs;
      if (i >= 50 && i < 100) {
        current[i] = 2000d * (i - 50) / 50d;
      } else if (i >= 100 && i <= 900) {
        current[i] = 10_000d;
      } else if (i > 900 && i < 950) {
        current[i] = 2000d * (950 - i) / 50d;
      }
    }
    final DischargeWindow window = detector.detect(current, time);
    Assertions.assertEquals((900 - 100) / fs, window.duration(), 1e-12);
    Assertions.assertEquals(100, window.startIndex());
    Assertions.assertEquals(10_000d, window.peakAmplitude());
  }

  @Test
  void testNoSampleAboveThreshold() {
    final double[] current = {100d, 200d, 300d, 200d};
    final double[] time = {0d, 1d, 2d, 3d};
    final DischargeWindow window = detector.detect(current, time);
    Assertions.assertEquals(DischargeWindow.NONE, window);
    Assertions.assertEquals(0d, window.duration());
    Assertions.assertEquals(0d, window.peakAmplitude());
    Assertions.assertEquals(0, window.startIndex());
    Assertions.assertTrue(window.isEmpty());
  }

  @Test
  void testAbsentInput() {
    Assertions.assertEquals(DischargeWindow.NONE, detector.detect(null, null));
    Assertions.assertEquals(DischargeWindow.NONE, detector.detect(new double[0], new double[0]));
  }

  @Test
  void testLengthMismatch() {
    Assertions.assertThrows(InvalidChannelDataException.class,
        () -> detector.detect(new double[]{1d, 2d}, new double[]{0d}));
  }

  @Test
  void testEarlyStartHasSameDuration() {
    // start at 100 ms lies before the 300 ms threshold, the duration is unaffected
    final double[] time = {0d, 100d, 200d, 400d, 500d};
    final double[] current = {0d, 5000d, 6000d, 5000d, 0d};
    final DischargeWindow window = detector.detect(current, time);
    Assertions.assertEquals(300d, window.duration());
    Assertions.assertEquals(1, window.startIndex());
  }
}
