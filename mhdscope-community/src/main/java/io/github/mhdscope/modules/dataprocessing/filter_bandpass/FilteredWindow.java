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

import java.util.List;

/**
 * Result of {@link BandpassSmoother}.
 *
 * @param time             sliced time axis
 * @param data             samples oriented [time][channel]
 * @param filterOrder      Butterworth order chosen for the slice length
 * @param windowLength     smoothing window chosen for the slice length, 0 if not smoothed
 * @param fallbackChannels 0-based channels that kept their clipped data after a filter failure
 */
public record FilteredWindow(double[] time, double[][] data, int filterOrder, int windowLength,
                             List<Integer> fallbackChannels) {

  public int getNumberOfSamples() {
    return time.length;
  }

  public int getNumberOfChannels() {
    return data.length == 0 ? 0 : data[0].length;
  }

  /**
   * @return the samples oriented [channel][time]
   */
  public double[][] channelMajor() {
    final int channels = getNumberOfChannels();
    final double[][] result = new double[channels][data.length];
    for (int t = 0; t < data.length; t++) {
      for (int c = 0; c < channels; c++) {
        result[c][t] = data[t][c];
      }
    }
    return result;
  }
}
