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

package io.github.mhdscope.parameters;

import io.github.mhdscope.modules.dataprocessing.duration_plasmacurrent.DischargeDurationParameters;
import io.github.mhdscope.modules.dataprocessing.filter_bandpass.BandpassSmoothingParameters;
import io.github.mhdscope.modules.dataprocessing.spatial_svd.SpatialStructureParameters;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalysisConfigurationTest {

  @TempDir
  Path tempDir;

  @Test
  void testDefaults() {
    final AnalysisConfiguration config = AnalysisConfiguration.defaults();
    final BandpassSmoothingParameters params = config.createParameters(
        BandpassSmoothingParameters::new);
    Assertions.assertEquals(16, params.getValue(BandpassSmoothingParameters.FILTER_ORDER_DEFAULT));
    Assertions.assertEquals(4, params.getValue(BandpassSmoothingParameters.FILTER_ORDER_MEDIUM));
    Assertions.assertEquals(2, params.getValue(BandpassSmoothingParameters.FILTER_ORDER_SHORT));
    Assertions.assertEquals(0.5, params.getValue(BandpassSmoothingParameters.NORM_WIDTH));
    Assertions.assertEquals(100d, params.getValue(BandpassSmoothingParameters.FILTER_LOW_MARGIN));
    Assertions.assertEquals(3, params.getValue(BandpassSmoothingParameters.POLYORDER));
    Assertions.assertEquals(100, params.getValue(BandpassSmoothingParameters.MIN_LEN_FOR_FILTER));
    Assertions.assertEquals(AnalysisConfiguration.DEFAULT_SAMPLING_RATE,
        config.getSamplingRate());
  }

  @Test
  void testLoadFromFile() throws IOException, URISyntaxException {
    final Path file = Paths.get(
        AnalysisConfigurationTest.class.getResource("/analysis-test-config.json").toURI());
    final AnalysisConfiguration config = AnalysisConfiguration.load(file);

    Assertions.assertEquals(100_000d, config.getSamplingRate());

    final DischargeDurationParameters duration = config.createParameters(
        DischargeDurationParameters::new);
    Assertions.assertEquals(0.2, duration.getValue(DischargeDurationParameters.THRESHOLD_FACTOR));
    Assertions.assertEquals(1000d, duration.getValue(DischargeDurationParameters.MIN_VALUE));
    Assertions.assertEquals(300d,
        duration.getValue(DischargeDurationParameters.MIN_START_TIME_THRESHOLD));

    final BandpassSmoothingParameters bandpass = config.createParameters(
        BandpassSmoothingParameters::new);
    // written as 8.0 in the file
    Assertions.assertEquals(8, bandpass.getValue(BandpassSmoothingParameters.FILTER_ORDER_DEFAULT));
    Assertions.assertEquals(0.8, bandpass.getValue(BandpassSmoothingParameters.NORM_WIDTH));
    Assertions.assertEquals(11, bandpass.getValue(BandpassSmoothingParameters.WINSIZE_DEFAULT));

    final SpatialStructureParameters spatial = config.createParameters(
        SpatialStructureParameters::new);
    Assertions.assertEquals(50, spatial.getValue(SpatialStructureParameters.INTERP_POINTS));
    Assertions.assertEquals(40d, spatial.getValue(SpatialStructureParameters.RADIUS));
  }

  @Test
  void testMissingFileFallsBackToDefaults() throws IOException {
    final AnalysisConfiguration config = AnalysisConfiguration.load(
        tempDir.resolve("does_not_exist.json"));
    Assertions.assertEquals(AnalysisConfiguration.DEFAULT_SAMPLING_RATE,
        config.getSamplingRate());
    Assertions.assertNull(config.get("analysis.wavelet.norm_width"));
  }

  @Test
  void testBrokenFileIsAnError() throws IOException {
    final Path file = tempDir.resolve("broken.json");
    Files.writeString(file, "{ \"analysis\": ");
    Assertions.assertThrows(IOException.class, () -> AnalysisConfiguration.load(file));
  }

  @Test
  void testOutOfRangeValueIsRejected() {
    final AnalysisConfiguration config = AnalysisConfiguration.fromJson(
        "{\"analysis\": {\"cal_duration\": {\"threshold_factor\": 1.5}}}");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> config.createParameters(DischargeDurationParameters::new));
  }

  @Test
  void testNonIntegralOrderIsRejected() {
    final AnalysisConfiguration config = AnalysisConfiguration.fromJson(
        "{\"analysis\": {\"wavelet\": {\"filter_order_default\": 8.5}}}");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> config.createParameters(BandpassSmoothingParameters::new));
  }

  @Test
  void testParameterSetsAreIndependent() {
    final AnalysisConfiguration config = AnalysisConfiguration.defaults();
    final SpatialStructureParameters first = config.createParameters(
        SpatialStructureParameters::new);
    final SpatialStructureParameters second = config.createParameters(
        SpatialStructureParameters::new);
    first.setParameter(SpatialStructureParameters.RADIUS, 10d);
    Assertions.assertEquals(10d, first.getValue(SpatialStructureParameters.RADIUS));
    Assertions.assertEquals(40d, second.getValue(SpatialStructureParameters.RADIUS));
    Assertions.assertEquals(40d, SpatialStructureParameters.RADIUS.getValue());

    final ParameterSet clone = first.cloneParameterSet();
    Assertions.assertEquals(10d, clone.getValue(SpatialStructureParameters.RADIUS));
  }
}
