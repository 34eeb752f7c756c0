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

import io.github.mhdscope.parameters.Parameter;
import io.github.mhdscope.parameters.impl.SimpleParameterSet;
import io.github.mhdscope.parameters.parametertypes.DoubleParameter;
import io.github.mhdscope.parameters.parametertypes.IntegerParameter;
import java.text.DecimalFormat;

public class BandpassSmoothingParameters extends SimpleParameterSet {

  public static final IntegerParameter FILTER_ORDER_DEFAULT = new IntegerParameter(
      "Filter order", "Butterworth order for slices of at least 400 samples.", 16, 1, 64,
      "wavelet.filter_order_default");

  public static final IntegerParameter FILTER_ORDER_MEDIUM = new IntegerParameter(
      "Filter order (medium slices)", "Butterworth order for slices of 100 to 399 samples.", 4, 1,
      64, "wavelet.filter_order_medium");

  public static final IntegerParameter FILTER_ORDER_SHORT = new IntegerParameter(
      "Filter order (short slices)", "Butterworth order for slices below 100 samples.", 2, 1, 64,
      "wavelet.filter_order_short");

  public static final DoubleParameter NORM_WIDTH = new DoubleParameter("Clip width",
      "Amplitudes are clipped to +/- this value before filtering.", new DecimalFormat("0.###"),
      0.5, 0d, Double.MAX_VALUE, "wavelet.norm_width");

  public static final DoubleParameter FILTER_LOW_MARGIN = new DoubleParameter("Frequency margin",
      "Minimum distance of the pass band edges from 0 Hz and from the Nyquist frequency.",
      new DecimalFormat("0.#"), 100d, 0d, Double.MAX_VALUE, "wavelet.filter_low_margin");

  public static final IntegerParameter WINSIZE_DEFAULT = new IntegerParameter(
      "Smoothing window", "Savitzky-Golay window length (odd).", 11, 1, 10_001,
      "wavelet.winsize_default");

  public static final IntegerParameter WINSIZE_SHORT = new IntegerParameter(
      "Smoothing window (short slices)", "Savitzky-Golay window length for short slices (odd).", 5,
      1, 10_001, "wavelet.winsize_short");

  public static final IntegerParameter MIN_SAMPLES_SHORT = new IntegerParameter(
      "Short slice length", "Slices with at most this many samples use the short window.", 11, 0,
      Integer.MAX_VALUE, "wavelet.min_samples_short");

  public static final IntegerParameter MIN_SAMPLES_VERY_SHORT = new IntegerParameter(
      "Very short slice length", "Slices with at most this many samples are only clipped.", 5, 0,
      Integer.MAX_VALUE, "wavelet.min_samples_very_short");

  public static final IntegerParameter POLYORDER = new IntegerParameter("Polynomial order",
      "Savitzky-Golay polynomial order.", 3, 0, 20, "savgol.polyorder");

  public static final IntegerParameter MIN_LEN_FOR_FILTER = new IntegerParameter(
      "Minimum filter length", "Slices shorter than this are neither filtered nor smoothed.", 100,
      0, Integer.MAX_VALUE, "savgol.min_len_for_filter");

  public BandpassSmoothingParameters() {
    super(new Parameter[]{FILTER_ORDER_DEFAULT, FILTER_ORDER_MEDIUM, FILTER_ORDER_SHORT,
        NORM_WIDTH, FILTER_LOW_MARGIN, WINSIZE_DEFAULT, WINSIZE_SHORT, MIN_SAMPLES_SHORT,
        MIN_SAMPLES_VERY_SHORT, POLYORDER, MIN_LEN_FOR_FILTER});
  }
}
