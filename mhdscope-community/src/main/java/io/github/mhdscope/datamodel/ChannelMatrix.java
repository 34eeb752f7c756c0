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

import com.google.common.collect.Range;
import io.github.mhdscope.util.MathUtils;
import io.github.mhdscope.util.exceptions.InvalidChannelDataException;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Immutable multi-channel probe recording. Rows are channels (0-based internally), columns are
 * samples on a shared, non-decreasing time axis in milliseconds.
 */
public final class ChannelMatrix {

  private final double[][] data;
  private final double[] time;
  private final double samplingRate;

  public ChannelMatrix(@NotNull double[][] data, @NotNull double[] time, double samplingRate) {
    if (!(samplingRate > 0d) || Double.isInfinite(samplingRate)) {
      throw new InvalidChannelDataException("Sampling rate must be > 0 but was " + samplingRate);
    }
    if (data.length == 0) {
      throw new InvalidChannelDataException("At least one channel is required");
    }
    for (int ch = 0; ch < data.length; ch++) {
      if (data[ch] == null || data[ch].length != time.length) {
        throw new InvalidChannelDataException(
            "Channel " + (ch + 1) + " has " + (data[ch] == null ? 0 : data[ch].length)
                + " samples, time axis has " + time.length);
      }
    }
    for (int i = 1; i < time.length; i++) {
      if (time[i] < time[i - 1]) {
        throw new InvalidChannelDataException(
            "Time axis decreases at index " + i + ": " + time[i - 1] + " -> " + time[i]);
      }
    }
    this.data = MathUtils.copy(data);
    this.time = Arrays.copyOf(time, time.length);
    this.samplingRate = samplingRate;
  }

  public int getNumberOfChannels() {
    return data.length;
  }

  public int getNumberOfSamples() {
    return time.length;
  }

  public double getSamplingRate() {
    return samplingRate;
  }

  /**
   * @return a copy of the time axis (ms)
   */
  public double[] getTime() {
    return Arrays.copyOf(time, time.length);
  }

  /**
   * @param channel 0-based channel index
   * @return a copy of the channel samples
   */
  public double[] getChannel(int channel) {
    return Arrays.copyOf(data[channel], data[channel].length);
  }

  /**
   * @return a copy of the full channels x time matrix
   */
  public double[][] getData() {
    return MathUtils.copy(data);
  }

  public @NotNull Range<Double> getTimeRange() {
    if (time.length == 0) {
      return Range.singleton(0d);
    }
    return Range.closed(time[0], time[time.length - 1]);
  }

  @Override
  public String toString() {
    return "ChannelMatrix{channels=" + data.length + ", samples=" + time.length + ", fs="
        + samplingRate + "}";
  }
}
