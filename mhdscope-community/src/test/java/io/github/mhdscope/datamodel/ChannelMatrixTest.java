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

import io.github.mhdscope.util.exceptions.InvalidChannelDataException;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ChannelMatrixTest {

  @Test
  void testInputIsCopied() {
    final double[][] data = {{1d, 2d, 3d}, {4d, 5d, 6d}};
    final double[] time = {0d, 1d, 2d};
    final ChannelMatrix matrix = new ChannelMatrix(data, time, 1000d);
    data[0][0] = 99d;
    time[0] = -1d;
    Assertions.assertEquals(1d, matrix.getChannel(0)[0]);
    Assertions.assertEquals(0d, matrix.getTime()[0]);

    matrix.getChannel(1)[0] = 42d;
    Assertions.assertEquals(4d, matrix.getData()[1][0]);
    Assertions.assertEquals(2, matrix.getNumberOfChannels());
    Assertions.assertEquals(3, matrix.getNumberOfSamples());
    Assertions.assertEquals(2d, matrix.getTimeRange().upperEndpoint());
  }

  @Test
  void testShapeErrors() {
    Assertions.assertThrows(InvalidChannelDataException.class,
        () -> new ChannelMatrix(new double[][]{{1d, 2d}}, new double[]{0d, 1d, 2d}, 1000d));
    Assertions.assertThrows(InvalidChannelDataException.class,
        () -> new ChannelMatrix(new double[0][], new double[]{0d}, 1000d));
    Assertions.assertThrows(InvalidChannelDataException.class,
        () -> new ChannelMatrix(new double[][]{{1d, 2d}}, new double[]{1d, 0d}, 1000d));
    Assertions.assertThrows(InvalidChannelDataException.class,
        () -> new ChannelMatrix(new double[][]{{1d}}, new double[]{0d}, 0d));
  }

  @Test
  void testCorrectionsShiftAndScale() {
    final double[] time = {0d, 1d, 2d, 3d, 4d};
    final ChannelMatrix matrix = new ChannelMatrix(
        new double[][]{{1d, 2d, 3d, 4d, 5d}, {1d, 2d, 3d, 4d, 5d}}, time, 1000d);
    // 1 sample per ms at 1 kHz, channel 1 is delayed by 2 ms, channel 2 is inverted
    final ChannelCorrections corrections = new ChannelCorrections(Map.of(0, 2d), Map.of(1, -1d));
    final ChannelMatrix corrected = corrections.apply(matrix);

    Assertions.assertArrayEquals(new double[]{3d, 4d, 5d, 0d, 0d}, corrected.getChannel(0));
    Assertions.assertArrayEquals(new double[]{-1d, -2d, -3d, -4d, -5d}, corrected.getChannel(1));
    Assertions.assertArrayEquals(new double[]{1d, 2d, 3d, 4d, 5d}, matrix.getChannel(0));
  }

  @Test
  void testNoCorrectionKeepsValues() {
    final ChannelMatrix matrix = new ChannelMatrix(new double[][]{{1d, -2d}}, new double[]{0d, 1d},
        1000d);
    Assertions.assertArrayEquals(matrix.getChannel(0),
        ChannelCorrections.none().apply(matrix).getChannel(0));
  }

  @Test
  void testProbeLayoutRings() {
    final double[] poloidal = ProbeLayout.POLOIDAL.getAngles();
    Assertions.assertEquals(12, poloidal.length);
    Assertions.assertEquals(30d, poloidal[1], 1e-12);
    Assertions.assertEquals(330d, poloidal[11], 1e-12);

    final double[] toroidal = ProbeLayout.TOROIDAL.getAngles();
    Assertions.assertEquals(14, toroidal.length);
    Assertions.assertEquals(360d * 13 / 14, toroidal[13], 1e-12);

    Assertions.assertSame(ProbeLayout.TOROIDAL, ProbeLayout.fromModeLabel("n"));
    Assertions.assertSame(ProbeLayout.POLOIDAL, ProbeLayout.forChannelCount(12));
    Assertions.assertNull(ProbeLayout.forChannelCount(7));
    Assertions.assertThrows(IllegalArgumentException.class, () -> ProbeLayout.fromModeLabel("x"));
  }
}
