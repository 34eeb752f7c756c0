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

import io.github.mhdscope.util.MathUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Mirnov coil arrays of the device. Poloidal arrays resolve the m mode number, toroidal arrays the
 * n mode number.
 */
public enum ProbeLayout {

  POLOIDAL("m", "OBP", 12),
  TOROIDAL("n", "M", 14);

  private final String modeLabel;
  private final String signalPrefix;
  private final int numberOfProbes;

  ProbeLayout(String modeLabel, String signalPrefix, int numberOfProbes) {
    this.modeLabel = modeLabel;
    this.signalPrefix = signalPrefix;
    this.numberOfProbes = numberOfProbes;
  }

  public @NotNull String getModeLabel() {
    return modeLabel;
  }

  public @NotNull String getSignalPrefix() {
    return signalPrefix;
  }

  public int getNumberOfProbes() {
    return numberOfProbes;
  }

  /**
   * @return probe angles in degrees, evenly spaced starting at 0
   */
  public double[] getAngles() {
    return ringAngles(numberOfProbes);
  }

  /**
   * Evenly spaced positions on a closed ring: 0, 360/n, ..., 360 (n-1)/n degrees.
   */
  public static double[] ringAngles(int numberOfProbes) {
    if (numberOfProbes <= 0) {
      return new double[0];
    }
    return MathUtils.linspace(0d, 360d * (numberOfProbes - 1) / numberOfProbes, numberOfProbes);
  }

  /**
   * @return the array with this number of probes or null if no array matches
   */
  public static @Nullable ProbeLayout forChannelCount(int channels) {
    for (ProbeLayout layout : values()) {
      if (layout.numberOfProbes == channels) {
        return layout;
      }
    }
    return null;
  }

  public static @NotNull ProbeLayout fromModeLabel(@NotNull String label) {
    for (ProbeLayout layout : values()) {
      if (layout.modeLabel.equalsIgnoreCase(label.trim())) {
        return layout;
      }
    }
    throw new IllegalArgumentException("Unknown mode label: " + label);
  }
}
