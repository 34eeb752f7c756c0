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

package io.github.mhdscope.modules.dataprocessing.featdet_localmaxima;

import io.github.mhdscope.datamodel.PeakRecord;
import io.github.mhdscope.util.exceptions.InvalidChannelDataException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Detects local maxima on every channel of a (channel, time) matrix. A local maximum is a sample,
 * or the middle of a flat run of samples, that is strictly higher than its neighbours on both
 * sides. The first and the last sample never qualify.
 */
public class LocalMaximaPeakExtractor {

  private static final Logger logger = Logger.getLogger(LocalMaximaPeakExtractor.class.getName());

  public static final int DEFAULT_DISTANCE = 10;

  /**
   * Half a mode period in samples, the natural spacing of peaks of a signal at {@code modeHz}.
   */
  public static int distanceForFrequency(double samplingRate, double modeHz) {
    if (!(modeHz > 0d)) {
      return 1;
    }
    return Math.max(1, (int) (0.5 * samplingRate / modeHz));
  }

  /**
   * @param time     time axis
   * @param data     [channel][time]
   * @param distance minimum index distance between two peaks on one channel, defaults to
   *                 {@link #DEFAULT_DISTANCE}
   * @return peaks channel by channel, in time order within a channel. Channels are 1-based.
   */
  public @NotNull List<PeakRecord> findPeaks(@Nullable double[] time, @Nullable double[][] data,
      @Nullable Integer distance) {
    if (time == null || data == null) {
      return List.of();
    }
    final int minDistance = distance != null ? distance : DEFAULT_DISTANCE;
    if (minDistance < 1) {
      throw new IllegalArgumentException("Peak distance must be >= 1 but was " + minDistance);
    }
    final List<PeakRecord> peaks = new ArrayList<>();
    for (int ch = 0; ch < data.length; ch++) {
      final double[] signal = checkLength(data[ch], time, ch);
      final int[] candidates = localMaxima(signal);
      final int[] selected = selectByDistance(candidates, signal, minDistance);
      for (int index : selected) {
        peaks.add(new PeakRecord(time[index], ch + 1, signal[index]));
      }
    }
    logger.finest(() -> "Found " + peaks.size() + " peaks with distance " + minDistance);
    return peaks;
  }

  public @NotNull List<PeakRecord> findPeaks(@Nullable double[] time, @Nullable double[][] data) {
    return findPeaks(time, data, null);
  }

  /**
   * All local maxima with a non-negative amplitude, without a distance constraint. Used as marker
   * overlay of a filtered window.
   *
   * @param data [channel][time]
   */
  public @NotNull List<PeakRecord> findMaxMarkers(@Nullable double[] time,
      @Nullable double[][] data) {
    if (time == null || data == null) {
      return List.of();
    }
    final List<PeakRecord> markers = new ArrayList<>();
    for (int ch = 0; ch < data.length; ch++) {
      final double[] signal = checkLength(data[ch], time, ch);
      for (int index : localMaxima(signal)) {
        if (signal[index] >= 0d) {
          markers.add(new PeakRecord(time[index], ch + 1, signal[index]));
        }
      }
    }
    return markers;
  }

  private static double[] checkLength(double[] signal, double[] time, int channel) {
    if (signal.length != time.length) {
      throw new InvalidChannelDataException(
          "Channel " + (channel + 1) + " has " + signal.length + " samples, time axis has "
              + time.length);
    }
    return signal;
  }

  /**
   * Indices of local maxima in ascending order. Flat tops resolve to their middle sample, rounded
   * down.
   */
  static int[] localMaxima(@NotNull double[] x) {
    final List<Integer> maxima = new ArrayList<>();
    int i = 1;
    final int last = x.length - 1;
    while (i < last) {
      if (x[i - 1] < x[i]) {
        int ahead = i + 1;
        while (ahead < last && x[ahead] == x[i]) {
          ahead++;
        }
        if (x[ahead] < x[i]) {
          maxima.add((i + ahead - 1) / 2);
          i = ahead;
        }
      }
      i++;
    }
    return maxima.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * Keeps the highest peaks first and removes every lower peak closer than {@code distance}.
   * Equal heights keep the earlier peak.
   */
  static int[] selectByDistance(int[] peaks, double[] x, int distance) {
    if (distance <= 1 || peaks.length < 2) {
      return peaks;
    }
    final boolean[] keep = new boolean[peaks.length];
    Arrays.fill(keep, true);
    final Integer[] priority = IntStream.range(0, peaks.length).boxed()
        .sorted(Comparator.<Integer>comparingDouble(k -> -x[peaks[k]])
            .thenComparingInt(k -> k)).toArray(Integer[]::new);
    for (int k : priority) {
      if (!keep[k]) {
        continue;
      }
      for (int j = k - 1; j >= 0 && peaks[k] - peaks[j] < distance; j--) {
        keep[j] = false;
      }
      for (int j = k + 1; j < peaks.length && peaks[j] - peaks[k] < distance; j++) {
        keep[j] = false;
      }
    }
    return IntStream.range(0, peaks.length).filter(k -> keep[k]).map(k -> peaks[k]).toArray();
  }
}
