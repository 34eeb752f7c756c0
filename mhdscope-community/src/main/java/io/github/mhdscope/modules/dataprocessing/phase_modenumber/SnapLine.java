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

import io.github.mhdscope.util.exceptions.DegenerateLineException;
import org.jetbrains.annotations.NotNull;

/**
 * Straight line {@code channel = slope * time + intercept} through exactly two reference points.
 * The peak pattern of a rotating mode lines up along it.
 */
public record SnapLine(double slope, double intercept) {

  /**
   * @throws DegenerateLineException if both points share their time or their channel
   */
  public static @NotNull SnapLine through(@NotNull ReferencePoint p1,
      @NotNull ReferencePoint p2) {
    if (p1.time() == p2.time()) {
      throw new DegenerateLineException(
          "Reference points share the time " + p1.time() + ", the line has no finite slope");
    }
    final double slope = (p1.channel() - p2.channel()) / (p1.time() - p2.time());
    if (slope == 0d) {
      throw new DegenerateLineException(
          "Reference points share the channel " + p1.channel() + ", the line cannot be inverted");
    }
    return new SnapLine(slope, p2.channel() - slope * p2.time());
  }

  /**
   * Time at which the line crosses the channel.
   */
  public double predictTime(double channel) {
    return (channel - intercept) / slope;
  }
}
