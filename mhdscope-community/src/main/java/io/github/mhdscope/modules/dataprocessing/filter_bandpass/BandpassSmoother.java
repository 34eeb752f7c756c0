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

import com.google.common.collect.Range;
import io.github.mhdscope.datamodel.ChannelMatrix;
import io.github.mhdscope.parameters.ParameterSet;
import io.github.mhdscope.util.MathUtils;
import io.github.mhdscope.util.ThresholdTable;
import io.github.mhdscope.util.exceptions.EmptyRangeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Cuts a time window out of the probe signals and isolates one mode frequency: the slice is
 * clipped, bandpass filtered forward and backward, and smoothed with a Savitzky-Golay filter. The
 * filter order and the smoothing window shrink with the slice length.
 */
public class BandpassSmoother {

  private static final Logger logger = Logger.getLogger(BandpassSmoother.class.getName());

  /**
   * Window length marking slices that are clipped only.
   */
  public static final int NO_SMOOTHING = 0;

  private final double clipWidth;
  private final double frequencyMargin;
  private final int polyOrder;
  private final int minLengthForFilter;
  private final ThresholdTable<Integer> filterOrders;
  private final ThresholdTable<Integer> smoothingWindows;

  public BandpassSmoother(@NotNull ParameterSet parameters) {
    clipWidth = parameters.getValue(BandpassSmoothingParameters.NORM_WIDTH);
    frequencyMargin = parameters.getValue(BandpassSmoothingParameters.FILTER_LOW_MARGIN);
    polyOrder = parameters.getValue(BandpassSmoothingParameters.POLYORDER);
    minLengthForFilter = parameters.getValue(BandpassSmoothingParameters.MIN_LEN_FOR_FILTER);

    filterOrders = ThresholdTable.<Integer>builder()
        .atLeast(400, parameters.getValue(BandpassSmoothingParameters.FILTER_ORDER_DEFAULT))
        .atLeast(100, parameters.getValue(BandpassSmoothingParameters.FILTER_ORDER_MEDIUM))
        .otherwise(parameters.getValue(BandpassSmoothingParameters.FILTER_ORDER_SHORT));

    final int veryShort = parameters.getValue(BandpassSmoothingParameters.MIN_SAMPLES_VERY_SHORT);
    final int shortSlice = parameters.getValue(BandpassSmoothingParameters.MIN_SAMPLES_SHORT);
    final ThresholdTable.Builder<Integer> windows = ThresholdTable.<Integer>builder()
        .atLeast(Math.max(veryShort, shortSlice) + 1,
            parameters.getValue(BandpassSmoothingParameters.WINSIZE_DEFAULT));
    if (shortSlice > veryShort) {
      windows.atLeast(veryShort + 1,
          parameters.getValue(BandpassSmoothingParameters.WINSIZE_SHORT));
    }
    smoothingWindows = windows.otherwise(NO_SMOOTHING);
  }

  /**
   * Butterworth order by slice length.
   */
  public @NotNull ThresholdTable<Integer> getFilterOrders() {
    return filterOrders;
  }

  /**
   * Savitzky-Golay window by slice length, {@link #NO_SMOOTHING} for slices that are only
   * clipped.
   */
  public @NotNull ThresholdTable<Integer> getSmoothingWindows() {
    return smoothingWindows;
  }

  /**
   * @param data        channel matrix with a time axis in ms
   * @param timeWindow  samples with {@code searchsorted(lower) <= i < searchsorted(upper)}, an
   *                    unbounded side extends to the end of the time axis
   * @param centerHz    mode frequency
   * @param halfWidthHz half width of the pass band
   * @throws EmptyRangeException if the window contains no sample
   */
  public @NotNull FilteredWindow smooth(@NotNull ChannelMatrix data,
      @NotNull Range<Double> timeWindow, double centerHz, double halfWidthHz) {
    final double[] time = data.getTime();
    final int from = timeWindow.hasLowerBound() ? MathUtils.searchSortedLeft(time,
        timeWindow.lowerEndpoint()) : 0;
    final int to = timeWindow.hasUpperBound() ? MathUtils.searchSortedLeft(time,
        timeWindow.upperEndpoint()) : time.length;
    if (from >= to) {
      throw new EmptyRangeException(timeWindow);
    }
    final int n = to - from;
    final int channels = data.getNumberOfChannels();
    final double fs = data.getSamplingRate();

    final double[][] clipped = new double[channels][];
    for (int ch = 0; ch < channels; ch++) {
      final double[] slice = Arrays.copyOfRange(data.getChannel(ch), from, to);
      for (int i = 0; i < n; i++) {
        slice[i] = MathUtils.clamp(slice[i], -clipWidth, clipWidth);
      }
      clipped[ch] = slice;
    }
    final double[] slicedTime = Arrays.copyOfRange(time, from, to);

    final int order = filterOrders.lookup(n);
    final int window = smoothingWindows.lookup(n);
    if (window == NO_SMOOTHING || n < minLengthForFilter) {
      logger.fine(() -> "Slice of " + n + " samples is returned clipped only");
      return new FilteredWindow(slicedTime, MathUtils.transpose(clipped), order, NO_SMOOTHING,
          List.of());
    }

    final List<Integer> fallbacks = new ArrayList<>();
    final SosFilter filter = createFilter(order, centerHz, halfWidthHz, fs);
    final SavitzkyGolayFilter smoother = n > window ? createSmoother(window) : null;

    final double[][] result = new double[channels][];
    for (int ch = 0; ch < channels; ch++) {
      if (filter == null) {
        result[ch] = clipped[ch];
        fallbacks.add(ch);
        continue;
      }
      try {
        double[] filtered = filter.filtfilt(clipped[ch]);
        if (smoother != null) {
          filtered = smoother.smooth(filtered);
        }
        result[ch] = filtered;
      } catch (RuntimeException e) {
        logger.log(Level.WARNING,
            "Filtering channel " + (ch + 1) + " failed (n=" + n + ", order=" + order
                + "), using clipped data", e);
        result[ch] = clipped[ch];
        fallbacks.add(ch);
      }
    }
    return new FilteredWindow(slicedTime, MathUtils.transpose(result), order,
        smoother == null ? NO_SMOOTHING : window, List.copyOf(fallbacks));
  }

  /**
   * Raw array variant.
   *
   * @param data         [channel][time]
   * @param time         time axis in ms
   * @param samplingRate Hz
   */
  public @NotNull FilteredWindow smooth(@NotNull double[][] data, @NotNull double[] time,
      double tStart, double tEnd, double centerHz, double halfWidthHz, double samplingRate) {
    final ChannelMatrix matrix = new ChannelMatrix(data, time, samplingRate);
    // a reversed window selects nothing
    final Range<Double> window = Range.closedOpen(tStart, Math.max(tStart, tEnd));
    return smooth(matrix, window, centerHz, halfWidthHz);
  }

  private @Nullable SavitzkyGolayFilter createSmoother(int window) {
    try {
      return new SavitzkyGolayFilter(window, polyOrder);
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Smoothing disabled: " + e.getMessage());
      return null;
    }
  }

  private @Nullable SosFilter createFilter(int order, double centerHz, double halfWidthHz,
      double fs) {
    try {
      final FilterSpec spec = FilterSpec.around(order, centerHz, halfWidthHz, fs, frequencyMargin);
      return new SosFilter(ButterworthBandpass.design(spec, fs));
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Cannot design bandpass around " + centerHz + " +/- "
          + halfWidthHz + " Hz at fs=" + fs + ", using clipped data", e);
      return null;
    }
  }
}
