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

import io.github.mhdscope.parameters.ParameterSet;
import java.util.Arrays;
import java.util.logging.Logger;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Short-time Fourier transform of a single channel with a periodic Hann window.
 */
public class SpectrogramCalculator {

  private static final Logger logger = Logger.getLogger(SpectrogramCalculator.class.getName());

  private final double overlapRatio;
  private final int defaultNfft;
  private final FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);

  public SpectrogramCalculator(@NotNull ParameterSet parameters) {
    this.overlapRatio = parameters.getValue(SpectrogramParameters.NOVERLAP_RATIO);
    this.defaultNfft = parameters.getValue(SpectrogramParameters.DEFAULT_NFFT);
  }

  /**
   * Segment length in samples for a window given in milliseconds.
   */
  public static int segmentLengthForWindow(double windowMs, double samplingRate) {
    return (int) (windowMs * samplingRate / 1000d);
  }

  /**
   * @param signal       samples of one channel
   * @param samplingRate Hz
   * @param startTime    time of the first sample, added to the segment centre times
   * @param windowMs     segment length in ms, overrides nperseg if not null
   * @param nperseg      segment length in samples; 1 ms of samples if null
   * @param noverlap     overlapping samples; the configured ratio of nperseg if null
   * @param nfft         FFT points; the configured default if null. The FFT size used is the
   *                     next power of two of max(nfft, segment length), so 1000 becomes 1024
   */
  public @NotNull Spectrogram compute(@NotNull double[] signal, double samplingRate,
      double startTime, @Nullable Double windowMs, @Nullable Integer nperseg,
      @Nullable Integer noverlap, @Nullable Integer nfft) {
    if (!(samplingRate > 0d)) {
      throw new IllegalArgumentException("Sampling rate must be > 0 but was " + samplingRate);
    }
    int segment = windowMs != null ? segmentLengthForWindow(windowMs, samplingRate)
        : nperseg != null ? nperseg : (int) (0.001 * samplingRate);
    segment = Math.max(1, segment);
    if (segment > signal.length && signal.length > 0) {
      final int requested = segment;
      logger.fine(() -> "Segment length " + requested + " exceeds signal length " + signal.length);
      segment = signal.length;
    }
    int overlap = noverlap != null ? noverlap : (int) (segment * overlapRatio);
    if (overlap >= segment) {
      throw new IllegalArgumentException(
          "Overlap " + overlap + " must be smaller than the segment length " + segment);
    }
    final int fftSize = nextPowerOfTwo(Math.max(nfft != null ? nfft : defaultNfft, segment));
    return computeSegments(signal, samplingRate, startTime, segment, overlap, fftSize);
  }

  /**
   * Convenience overload with the configured defaults (1 ms segments).
   */
  public @NotNull Spectrogram compute(@NotNull double[] signal, double samplingRate,
      double startTime) {
    return compute(signal, samplingRate, startTime, null, null, null, null);
  }

  private Spectrogram computeSegments(double[] signal, double fs, double startTime, int segment,
      int overlap, int fftSize) {
    final int step = segment - overlap;
    final int numSegments = signal.length < segment ? 0 : (signal.length - overlap) / step;
    final int numFreqs = fftSize / 2 + 1;

    final double[] window = hann(segment);
    double windowPower = 0d;
    for (double w : window) {
      windowPower += w * w;
    }
    final double scale = 1d / (fs * windowPower);

    final double[] frequencies = new double[numFreqs];
    for (int k = 0; k < numFreqs; k++) {
      frequencies[k] = k * fs / fftSize;
    }
    final double[] times = new double[numSegments];
    final double[][] power = new double[numFreqs][numSegments];

    final double[] buffer = new double[fftSize];
    for (int s = 0; s < numSegments; s++) {
      final int offset = s * step;
      double mean = 0d;
      for (int i = 0; i < segment; i++) {
        mean += signal[offset + i];
      }
      mean /= segment;
      Arrays.fill(buffer, 0d);
      for (int i = 0; i < segment; i++) {
        buffer[i] = (signal[offset + i] - mean) * window[i];
      }
      final Complex[] spectrum = fft.transform(buffer, TransformType.FORWARD);
      for (int k = 0; k < numFreqs; k++) {
        final double re = spectrum[k].getReal();
        final double im = spectrum[k].getImaginary();
        double p = (re * re + im * im) * scale;
        // one-sided: fold negative frequencies except DC and Nyquist
        if (k != 0 && !(k == numFreqs - 1 && fftSize % 2 == 0)) {
          p *= 2d;
        }
        power[k][s] = p;
      }
      // centre of the segment; the time axis is in ms
      times[s] = startTime + (offset + segment / 2d) / fs * 1000d;
    }
    return new Spectrogram(frequencies, times, power);
  }

  /**
   * Periodic Hann window as used for spectral estimation.
   */
  static double[] hann(int length) {
    final double[] w = new double[length];
    for (int i = 0; i < length; i++) {
      w[i] = 0.5 - 0.5 * Math.cos(2d * Math.PI * i / length);
    }
    return w;
  }

  static int nextPowerOfTwo(int n) {
    if (n <= 1) {
      return 2;
    }
    return Integer.bitCount(n) == 1 ? n : Integer.highestOneBit(n) << 1;
  }
}
