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

import org.jetbrains.annotations.NotNull;

/**
 * Butterworth bandpass specification.
 *
 * @param order  prototype order, the bandpass has twice as many poles
 * @param lowHz  lower cutoff
 * @param highHz upper cutoff
 */
public record FilterSpec(int order, double lowHz, double highHz) {

  public FilterSpec {
    if (order < 1) {
      throw new IllegalArgumentException("Filter order must be >= 1 but was " + order);
    }
    if (!(lowHz < highHz)) {
      throw new IllegalArgumentException(
          "Lower cutoff " + lowHz + " must be below upper cutoff " + highHz);
    }
  }

  /**
   * Pass band {@code [max(margin, f - df), min(fs/2 - margin, f + df)]}.
   */
  public static @NotNull FilterSpec around(int order, double centerHz, double halfWidthHz,
      double samplingRate, double margin) {
    final double low = Math.max(margin, centerHz - halfWidthHz);
    final double high = Math.min(samplingRate / 2d - margin, centerHz + halfWidthHz);
    return new FilterSpec(order, low, high);
  }
}
