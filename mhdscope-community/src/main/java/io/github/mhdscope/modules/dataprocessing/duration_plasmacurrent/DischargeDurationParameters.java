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

import io.github.mhdscope.parameters.Parameter;
import io.github.mhdscope.parameters.impl.SimpleParameterSet;
import io.github.mhdscope.parameters.parametertypes.DoubleParameter;
import java.text.DecimalFormat;

public class DischargeDurationParameters extends SimpleParameterSet {

  public static final DoubleParameter THRESHOLD_FACTOR = new DoubleParameter("Threshold factor",
      "Fraction of the maximum plasma current that a sample must exceed to count as discharge.",
      new DecimalFormat("0.###"), 0.095, 0d, 1d, "cal_duration.threshold_factor");

  public static final DoubleParameter MIN_VALUE = new DoubleParameter("Minimum current",
      "Absolute floor of the plasma current for a sample to count as discharge.",
      new DecimalFormat("0.#"), 2500d, -Double.MAX_VALUE, Double.MAX_VALUE, "cal_duration.min_val");

  public static final DoubleParameter MIN_START_TIME_THRESHOLD = new DoubleParameter(
      "Minimum start time", "Discharges starting before this time are reported in the log.",
      new DecimalFormat("0.#"), 300d, -Double.MAX_VALUE, Double.MAX_VALUE,
      "cal_duration.min_start_time_threshold");

  public DischargeDurationParameters() {
    super(new Parameter[]{THRESHOLD_FACTOR, MIN_VALUE, MIN_START_TIME_THRESHOLD});
  }
}
