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

import org.jetbrains.annotations.NotNull;

/**
 * Phase differences of the included probes against the first included probe.
 *
 * @param angles         probe positions in degrees, ascending in channel order
 * @param phaseDiffs     phase difference in degrees per probe
 * @param referenceTimes peak time used per probe (ms)
 */
public record PhaseFitResult(double[] angles, double[] phaseDiffs, double[] referenceTimes) {

  private static final PhaseFitResult EMPTY = new PhaseFitResult(new double[0], new double[0],
      new double[0]);

  public PhaseFitResult {
    if (angles.length != phaseDiffs.length || angles.length != referenceTimes.length) {
      throw new IllegalArgumentException("Angles, phases and times differ in length");
    }
  }

  public static @NotNull PhaseFitResult empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return angles.length == 0;
  }

  public int size() {
    return angles.length;
  }
}
