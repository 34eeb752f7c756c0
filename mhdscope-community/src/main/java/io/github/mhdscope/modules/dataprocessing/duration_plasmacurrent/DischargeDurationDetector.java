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

import io.github.mhdscope.parameters.ParameterSet;
import io.github.mhdscope.util.MathUtils;
import io.github.mhdscope.util.exceptions.InvalidChannelDataException;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Derives the plasma discharge window from the plasma current (Ip) trace. A sample belongs to the
 * discharge if it exceeds {@code thresholdFactor * max(Ip)} and is not below the absolute floor.
 */
public class DischargeDurationDetector {

  private static final Logger logger = Logger.getLogger(DischargeDurationDetector.class.getName());

  private final double thresholdFactor;
  private final double minValue;
  private final double minStartTimeThreshold;

  public DischargeDurationDetector(@NotNull ParameterSet parameters) {
    this.thresholdFactor = parameters.getValue(DischargeDurationParameters.THRESHOLD_FACTOR);
    this.minValue = parameters.getValue(DischargeDurationParameters.MIN_VALUE);
    this.minStartTimeThreshold = parameters.getValue(
        DischargeDurationParameters.MIN_START_TIME_THRESHOLD);
  }

  /**
   * @param current reference current trace
   * @param time    time axis of the trace
   * @return the discharge window or {@link DischargeWindow#NONE} if the input is absent or no
   * sample passes the threshold
   * @throws InvalidChannelDataException if both arrays are present but differ in length
   */
  public @NotNull DischargeWindow detect(@Nullable double[] current, @Nullable double[] time) {
    if (current == null || time == null || current.length == 0) {
      return DischargeWindow.NONE;
    }
    if (current.length != time.length) {
      throw new InvalidChannelDataException(
          "Current trace has " + current.length + " samples, time axis has " + time.length);
    }

    final double max = MathUtils.max(current);
    final double threshold = thresholdFactor * max;

    int start = -1;
    for (int i = 0; i < current.length; i++) {
      if (isValid(current[i], threshold)) {
        start = i;
        break;
      }
    }
    if (start < 0) {
      logger.fine(() -> "No sample above threshold " + threshold + " (max " + max + ")");
      return DischargeWindow.NONE;
    }
    int end = start;
    for (int i = current.length - 1; i >= start; i--) {
      if (isValid(current[i], threshold)) {
        end = i;
        break;
      }
    }

    final double startTime = time[start];
    final double endTime = time[end];
    final double duration;
    if (startTime >= minStartTimeThreshold) {
      duration = endTime - startTime;
    } else {
      // early start is only reported, the duration is the same
      logger.fine(() -> "Discharge starts at " + startTime + ", before " + minStartTimeThreshold);
      duration = endTime - startTime;
    }
    final int startIndex = start;
    final int endIndex = end;
    logger.fine(() -> "Discharge window: threshold=" + threshold + ", start=" + startIndex + " ("
        + startTime + "), end=" + endIndex + " (" + endTime + ")");
    return new DischargeWindow(duration, max, start);
  }

  private boolean isValid(double sample, double threshold) {
    return sample > threshold && sample >= minValue;
  }
}
