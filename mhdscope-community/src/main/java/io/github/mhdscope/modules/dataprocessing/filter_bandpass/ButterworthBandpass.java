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

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.complex.Complex;
import org.jetbrains.annotations.NotNull;

/**
 * Digital Butterworth bandpass in second-order sections. The analog low pass prototype is shifted
 * to a band pass around the prewarped cutoffs and mapped to the z-plane with the bilinear
 * transform. Each section holds one conjugate pole pair and the zero pair at z = 1 and z = -1,
 * normalised to unit gain at the centre frequency.
 * <p>
 * A section row is {@code [b0, b1, b2, 1, a1, a2]}.
 */
public final class ButterworthBandpass {

  private static final double POLE_IMAG_TOLERANCE = 1e-12;

  private ButterworthBandpass() {
  }

  /**
   * @param spec         order and cutoffs in Hz
   * @param samplingRate Hz
   * @return sections, one row per pole pair
   * @throws IllegalArgumentException if the cutoffs are not inside (0, fs/2)
   */
  public static double[][] design(@NotNull FilterSpec spec, double samplingRate) {
    final double nyquist = samplingRate / 2d;
    if (!(spec.lowHz() > 0d) || !(spec.highHz() < nyquist)) {
      throw new IllegalArgumentException(
          "Cutoffs [" + spec.lowHz() + ", " + spec.highHz() + "] Hz must lie inside (0, "
              + nyquist + ") Hz");
    }
    final int order = spec.order();

    // prewarp the normalised cutoffs, bilinear transform at fs = 2
    final double w1 = 4d * Math.tan(Math.PI * spec.lowHz() / nyquist / 2d);
    final double w2 = 4d * Math.tan(Math.PI * spec.highHz() / nyquist / 2d);
    final double bandwidth = w2 - w1;
    final double centre = Math.sqrt(w1 * w2);

    final List<Complex> poles = new ArrayList<>(2 * order);
    for (int m = -order + 1; m < order; m += 2) {
      final Complex prototype = new Complex(0d, Math.PI * m / (2d * order)).exp().negate();
      final Complex lowPass = prototype.multiply(bandwidth / 2d);
      final Complex root = lowPass.multiply(lowPass).subtract(centre * centre).sqrt();
      poles.add(bilinear(lowPass.add(root)));
      poles.add(bilinear(lowPass.subtract(root)));
    }

    final double normFrequency = 2d * Math.atan(centre / 4d);
    final List<double[]> sections = new ArrayList<>(order);
    final List<Double> realPoles = new ArrayList<>();
    for (Complex p : poles) {
      if (Math.abs(p.getImaginary()) <= POLE_IMAG_TOLERANCE) {
        realPoles.add(p.getReal());
      } else if (p.getImaginary() > 0d) {
        sections.add(section(-2d * p.getReal(), p.abs() * p.abs(), normFrequency));
      }
    }
    for (int i = 0; i + 1 < realPoles.size(); i += 2) {
      final double r1 = realPoles.get(i);
      final double r2 = realPoles.get(i + 1);
      sections.add(section(-(r1 + r2), r1 * r2, normFrequency));
    }
    return sections.toArray(new double[0][]);
  }

  private static Complex bilinear(Complex analogPole) {
    return new Complex(4d).add(analogPole).divide(new Complex(4d).subtract(analogPole));
  }

  private static double[] section(double a1, double a2, double omega) {
    // |H(e^jw)| of (1 - z^-2) / (1 + a1 z^-1 + a2 z^-2)
    final Complex z1 = new Complex(Math.cos(omega), -Math.sin(omega));
    final Complex z2 = z1.multiply(z1);
    final Complex numerator = Complex.ONE.subtract(z2);
    final Complex denominator = Complex.ONE.add(z1.multiply(a1)).add(z2.multiply(a2));
    final double gain = numerator.abs() / denominator.abs();
    final double k = gain > 0d ? 1d / gain : 1d;
    return new double[]{k, 0d, -k, 1d, a1, a2};
  }

  /**
   * Magnitude response of the cascade at the given frequency.
   */
  public static double magnitude(double[][] sos, double frequencyHz, double samplingRate) {
    final double omega = 2d * Math.PI * frequencyHz / samplingRate;
    final Complex z1 = new Complex(Math.cos(omega), -Math.sin(omega));
    final Complex z2 = z1.multiply(z1);
    double magnitude = 1d;
    for (double[] s : sos) {
      final Complex num = new Complex(s[0]).add(z1.multiply(s[1])).add(z2.multiply(s[2]));
      final Complex den = new Complex(s[3]).add(z1.multiply(s[4])).add(z2.multiply(s[5]));
      magnitude *= num.abs() / den.abs();
    }
    return magnitude;
  }
}
