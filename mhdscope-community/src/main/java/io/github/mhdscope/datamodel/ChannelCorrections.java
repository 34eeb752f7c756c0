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

package io.github.mhdscope.datamodel;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;

/**
 * Per-channel time origin offsets (init phase, ms) and amplitude multipliers. These are applied
 * once, before the matrix is handed to the processing modules.
 */
public final class ChannelCorrections {

  private final Map<Integer, Double> t0OffsetsMs;
  private final Map<Integer, Double> amplitudeMultipliers;

  public ChannelCorrections(@NotNull Map<Integer, Double> t0OffsetsMs,
      @NotNull Map<Integer, Double> amplitudeMultipliers) {
    this.t0OffsetsMs = Collections.unmodifiableMap(new HashMap<>(t0OffsetsMs));
    this.amplitudeMultipliers = Collections.unmodifiableMap(new HashMap<>(amplitudeMultipliers));
  }

  public static ChannelCorrections none() {
    return new ChannelCorrections(Map.of(), Map.of());
  }

  /**
   * @param channel 0-based channel index
   */
  public double getT0OffsetMs(int channel) {
    return t0OffsetsMs.getOrDefault(channel, 0d);
  }

  /**
   * @param channel 0-based channel index
   */
  public double getAmplitudeMultiplier(int channel) {
    return amplitudeMultipliers.getOrDefault(channel, 1d);
  }

  /**
   * Shifts every channel by its t0 offset and scales it by its multiplier. A positive offset is a
   * delay and moves the samples towards earlier times; vacated samples are zero.
   *
   * @return a new matrix, the input is not modified
   */
  public @NotNull ChannelMatrix apply(@NotNull ChannelMatrix matrix) {
    final double fs = matrix.getSamplingRate();
    final int n = matrix.getNumberOfSamples();
    final double[][] out = new double[matrix.getNumberOfChannels()][];
    for (int ch = 0; ch < out.length; ch++) {
      final double[] row = matrix.getChannel(ch);
      final int shift = (int) (-getT0OffsetMs(ch) * fs / 1000d);
      final double[] shifted;
      if (shift == 0) {
        shifted = row;
      } else {
        shifted = new double[n];
        if (shift > 0 && shift < n) {
          System.arraycopy(row, 0, shifted, shift, n - shift);
        } else if (shift < 0 && -shift < n) {
          System.arraycopy(row, -shift, shifted, 0, n + shift);
        }
      }
      final double mult = getAmplitudeMultiplier(ch);
      if (mult != 1d) {
        for (int i = 0; i < n; i++) {
          shifted[i] *= mult;
        }
      }
      out[ch] = shifted;
    }
    return new ChannelMatrix(out, matrix.getTime(), fs);
  }
}
