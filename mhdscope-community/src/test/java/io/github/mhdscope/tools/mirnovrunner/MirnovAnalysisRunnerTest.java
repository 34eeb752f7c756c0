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

package io.github.mhdscope.tools.mirnovrunner;

import io.github.mhdscope.datamodel.ChannelCorrections;
import io.github.mhdscope.datamodel.ChannelMatrix;
import io.github.mhdscope.datamodel.ProbeLayout;
import io.github.mhdscope.modules.dataprocessing.phase_modenumber.ReferencePoint;
import io.github.mhdscope.parameters.AnalysisConfiguration;
import io.github.mhdscope.tools.mirnovrunner.MirnovAnalysisRunner.ChannelTable;
import io.github.mhdscope.tools.mirnovrunner.MirnovAnalysisRunner.RunSettings;
import io.github.mhdscope.tools.mirnovrunner.MirnovAnalysisRunner.RunSummary;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MirnovAnalysisRunnerTest {

  @TempDir
  Path tempDir;

  @Test
  void testReadChannelsWithHeader() throws IOException, URISyntaxException {
    final File file = new File(
        MirnovAnalysisRunnerTest.class.getResource("/shot_channels.tsv").toURI());
    final ChannelTable table = MirnovAnalysisRunner.readChannels(file);
    Assertions.assertEquals(5, table.time().length);
    Assertions.assertEquals(0.02, table.time()[4]);
    Assertions.assertEquals(3, table.data().length);
    Assertions.assertEquals(0.4, table.data()[1][1]);
    Assertions.assertEquals(List.of("OBP1", "OBP2", "OBP3"), table.channelNames());
  }

  @Test
  void testReadChannelsWithoutHeader() throws IOException {
    final Path file = tempDir.resolve("plain.csv");
    Files.writeString(file, "0.0, 1.0, 2.0\n0.5, 1.5, 2.5\n\n1.0, 2.0, 3.0\n");
    final ChannelTable table = MirnovAnalysisRunner.readChannels(file.toFile());
    Assertions.assertEquals(3, table.time().length);
    Assertions.assertEquals(2, table.data().length);
    Assertions.assertEquals(3.0, table.data()[1][2]);
    Assertions.assertTrue(table.channelNames().isEmpty());
  }

  @Test
  void testRaggedFileIsRejected() throws IOException {
    final Path file = tempDir.resolve("ragged.tsv");
    Files.writeString(file, "0\t1\t2\n1\t2\n");
    Assertions.assertThrows(IOException.class,
        () -> MirnovAnalysisRunner.readChannels(file.toFile()));
  }

  @Test
  void testSettingParsers() {
    Assertions.assertEquals(new ReferencePoint(1.5, 12d), RunSettings.parsePoint("1.5, 12"));
    Assertions.assertNull(RunSettings.parsePoint(" "));
    Assertions.assertThrows(IllegalArgumentException.class, () -> RunSettings.parsePoint("1.5"));
    Assertions.assertEquals(Set.of(3, 7), RunSettings.parseChannels("3, 7"));
    Assertions.assertEquals(Map.of(1, -1d), RunSettings.parseChannelValues("2:-1"));
    Assertions.assertNull(RunSettings.optionalDouble(null));
  }

  @Test
  void testAnalyseWritesChartsAndSummary() throws IOException {
    final double fs = 200_000d;
    final int samples = 2000;
    final int channels = 12;
    final double[] time = new double[samples];
    final double[][] data = new double[channels][samples];
    for (int i = 0; i < samples; i++) {
      time[i] = i / 200d;
      for (int ch = 0; ch < channels; ch++) {
        // m = 1 mode rotating at 10 kHz
        data[ch][i] = 0.3 * Math.sin(2d * Math.PI * 10_000d * i / fs - ch * Math.PI / 6d);
      }
    }
    final ChannelMatrix matrix = new ChannelMatrix(data, time, fs);
    final RunSettings settings = new RunSettings(fs, ProbeLayout.POLOIDAL, 10_000d, 2000d, 2d,
        8d, new ReferencePoint(4.0, 1), new ReferencePoint(4.0917, 12), Set.of(), 0,
        5d, ChannelCorrections.none());

    final RunSummary summary = MirnovAnalysisRunner.analyse(matrix, settings,
        AnalysisConfiguration.defaults(), tempDir);

    Assertions.assertEquals(12, summary.get("channels"));
    Assertions.assertEquals(16, summary.get("filter_order"));
    Assertions.assertEquals(12, summary.get("direct_channels"));
    Assertions.assertNotNull(summary.get("direct_slope"));
    Assertions.assertNotNull(summary.get("mode0_energy_fraction"));
    Assertions.assertEquals(5.005, (double) summary.get("cycle_time"), 1e-9);
    Assertions.assertNotNull(summary.get("cycle_phases"));
    Assertions.assertEquals(10_000d, (double) summary.get("dominant_frequency_hz"), 400d);
    Assertions.assertTrue(Files.exists(tempDir.resolve("phase_fit.png")));
    Assertions.assertTrue(Files.exists(tempDir.resolve("singular_values.png")));
    Assertions.assertTrue(Files.exists(tempDir.resolve("spatial_structure.png")));
    Assertions.assertTrue(summary.toTsv().startsWith("key\tvalue\n"));
  }
}
