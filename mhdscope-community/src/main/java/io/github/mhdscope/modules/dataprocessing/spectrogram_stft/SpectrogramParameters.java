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

package io.github.mhdscope.modules.dataprocessing.spectrogram_stft;

import io.github.mhdscope.parameters.Parameter;
import io.github.mhdscope.parameters.impl.SimpleParameterSet;
import io.github.mhdscope.parameters.parametertypes.DoubleParameter;
import io.github.mhdscope.parameters.parametertypes.IntegerParameter;
import java.text.DecimalFormat;

public class SpectrogramParameters extends SimpleParameterSet {

  public static final DoubleParameter NOVERLAP_RATIO = new DoubleParameter("Overlap ratio",
      "Overlap of adjacent segments as a fraction of the segment length.",
      new DecimalFormat("0.00"), 0.5, 0d, 0.99, "spectrogram.noverlap_ratio");

  public static final IntegerParameter DEFAULT_NFFT = new IntegerParameter("FFT size",
      "Number of FFT points per segment if not given explicitly.", 512, 2, 1 << 20,
      "spectrogram.default_nfft");

  public SpectrogramParameters() {
    super(new Parameter[]{NOVERLAP_RATIO, DEFAULT_NFFT});
  }
}
