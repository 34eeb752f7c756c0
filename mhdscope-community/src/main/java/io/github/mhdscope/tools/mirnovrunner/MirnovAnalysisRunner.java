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

import com.google.common.base.Splitter;
import com.google.common.collect.Range;
import io.github.mhdscope.datamodel.ChannelCorrections;
import io.github.mhdscope.datamodel.ChannelMatrix;
import io.github.mhdscope.datamodel.PeakRecord;
import io.github.mhdscope.datamodel.ProbeLayout;
import io.github.mhdscope.modules.dataprocessing.duration_plasmacurrent.DischargeDurationDetector;
import io.github.mhdscope.modules.dataprocessing.duration_plasmacurrent.DischargeDurationParameters;
import io.github.mhdscope.modules.dataprocessing.duration_plasmacurrent.DischargeWindow;
import io.github.mhdscope.modules.dataprocessing.featdet_localmaxima.LocalMaximaPeakExtractor;
import io.github.mhdscope.modules.dataprocessing.filter_bandpass.BandpassSmoother;
import io.github.mhdscope.modules.dataprocessing.filter_bandpass.BandpassSmoothingParameters;
import io.github.mhdscope.modules.dataprocessing.filter_bandpass.FilteredWindow;
import io.github.mhdscope.modules.dataprocessing.phase_modenumber.CyclePhase;
import io.github.mhdscope.modules.dataprocessing.phase_modenumber.PhaseAnalyzer;
import io.github.mhdscope.modules.dataprocessing.phase_modenumber.PhaseFitResult;
import io.github.mhdscope.modules.dataprocessing.phase_modenumber.PhaseSlopeFit;
import io.github.mhdscope.modules.dataprocessing.phase_modenumber.ReferencePoint;
import io.github.mhdscope.modules.dataprocessing.spatial_svd.SVDResult;
import io.github.mhdscope.modules.dataprocessing.spatial_svd.SpatialDecomposer;
import io.github.mhdscope.modules.dataprocessing.spatial_svd.SpatialStructure;
import io.github.mhdscope.modules.dataprocessing.spatial_svd.SpatialStructureParameters;
import io.github.mhdscope.modules.dataprocessing.spectrogram_stft.Spectrogram;
import io.github.mhdscope.modules.dataprocessing.spectrogram_stft.SpectrogramCalculator;
import io.github.mhdscope.modules.dataprocessing.spectrogram_stft.SpectrogramParameters;
import io.github.mhdscope.parameters.AnalysisConfiguration;
import io.github.mhdscope.util.exceptions.MirnovAnalysisException;
import java.awt.BasicStroke;
import java.awt.Color;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Standalone runner that analyses one shot of Mirnov probe signals. The channel file has the time
 * in ms in the first column and one column per probe, separated by tabs, commas or blanks, with
 * an optional header line.
 * <p>
 * Usage:
 * <pre>
 *   -Dinput=/abs/shot.tsv -DoutDir=/abs/out -Dconfig=config.json -Dip=/abs/ip.tsv
 *   -Dmode=m -Dfbase=10000 -Ddf=2000 -DtStart=1.0 -DtEnd=2.0
 *   -Dp1=1.0,1 -Dp2=1.5,12 -Dexclude=3,7 -Dt0=2:0.01 -Dmult=5:-1 -Dcursor=1.5
 * </pre>
 * Or call main with args: input [outDir]
 */
public class MirnovAnalysisRunner {

  private static final Logger logger = Logger.getLogger(MirnovAnalysisRunner.class.getName());

  private static final Pattern SEPARATOR = Pattern.compile("[\\t,;]|\\s+");

  public static void main(String[] args) throws Exception {
    try (InputStream in = MirnovAnalysisRunner.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    }
    final String inputArg = (args != null && args.length > 0 && args[0] != null
        && !args[0].isBlank()) ? args[0] : System.getProperty("input", "");
    if (inputArg.isBlank()) {
      System.err.println("Please provide the channel file via -Dinput or first CLI arg.");
      return;
    }
    final Path input = Paths.get(inputArg).toAbsolutePath().normalize();
    final String outDirArg = (args != null && args.length > 1 && args[1] != null
        && !args[1].isBlank()) ? args[1]
        : System.getProperty("outDir", input.resolveSibling("mirnov_analysis").toString());
    final Path outDir = Paths.get(outDirArg).toAbsolutePath().normalize();
    Files.createDirectories(outDir);

    final AnalysisConfiguration config = AnalysisConfiguration.load(
        Paths.get(System.getProperty("config", "config.json")));
    final RunSettings settings = RunSettings.fromSystemProperties(config.getSamplingRate());

    final ChannelTable table = readChannels(input.toFile());
    if (table.time().length == 0) {
      System.err.println("No samples in " + input);
      return;
    }
    final ChannelMatrix raw = new ChannelMatrix(table.data(), table.time(),
        settings.samplingRate());
    final ChannelMatrix matrix = settings.corrections().apply(raw);
    System.out.printf(Locale.US, "Input: %s (%d channels, %d samples)%nOutput: %s%n", input,
        matrix.getNumberOfChannels(), matrix.getNumberOfSamples(), outDir);

    final RunSummary summary = analyse(matrix, settings, config, outDir);

    final String ipArg = System.getProperty("ip", "").trim();
    if (!ipArg.isEmpty()) {
      final ChannelTable ip = readChannels(Paths.get(ipArg).toFile());
      final DischargeWindow discharge = new DischargeDurationDetector(
          config.createParameters(DischargeDurationParameters::new)).detect(
          ip.data().length > 0 ? ip.data()[0] : null, ip.time());
      summary.put("discharge_duration_ms", discharge.duration());
      summary.put("ip_max", discharge.peakAmplitude());
      summary.put("discharge_start_index", discharge.startIndex());
    }

    final Path report = outDir.resolve("analysis_summary.tsv");
    Files.writeString(report, summary.toTsv(), StandardCharsets.UTF_8);
    System.out.printf(Locale.US, "Saved %d chart%s, report: %s%n", summary.charts(),
        summary.charts() == 1 ? "" : "s", report.getFileName());
  }

  /**
   * Runs the signal chain on the matrix and writes the charts to outDir.
   */
  static @NotNull RunSummary analyse(@NotNull ChannelMatrix matrix, @NotNull RunSettings settings,
      @NotNull AnalysisConfiguration config, @Nullable Path outDir) throws IOException {
    final RunSummary summary = new RunSummary();
    final double[] time = matrix.getTime();
    final double tStart = settings.tStart() != null ? settings.tStart() : time[0];
    final double tEnd = settings.tEnd() != null ? settings.tEnd() : time[time.length - 1];
    summary.put("channels", matrix.getNumberOfChannels());
    summary.put("samples", matrix.getNumberOfSamples());
    summary.put("fs_hz", matrix.getSamplingRate());
    summary.put("t_start_ms", tStart);
    summary.put("t_end_ms", tEnd);

    final SpectrogramCalculator spectrogramCalculator = new SpectrogramCalculator(
        config.createParameters(SpectrogramParameters::new));
    final Spectrogram spectrogram = spectrogramCalculator.compute(matrix.getChannel(0),
        matrix.getSamplingRate(), time[0]);
    summary.put("dominant_frequency_hz", dominantFrequency(spectrogram));

    final BandpassSmoother smoother = new BandpassSmoother(
        config.createParameters(BandpassSmoothingParameters::new));
    final FilteredWindow window;
    try {
      window = smoother.smooth(matrix, Range.closedOpen(tStart, Math.max(tStart, tEnd)),
          settings.fBase(), settings.halfWidth());
    } catch (MirnovAnalysisException e) {
      logger.log(Level.WARNING, "No data in the selected window", e);
      summary.put("error", e.getMessage());
      return summary;
    }
    summary.put("filter_order", window.filterOrder());
    summary.put("smoothing_window", window.windowLength());
    summary.put("fallback_channels", window.fallbackChannels().toString());
    final double[][] filtered = window.channelMajor();

    final PhaseAnalyzer phaseAnalyzer = new PhaseAnalyzer();
    final PhaseFitResult direct = phaseAnalyzer.computeDirect(filtered, window.time(), tStart,
        tEnd, settings.fBase(), settings.layout());
    putFit(summary, "direct", direct);

    PhaseFitResult snapped = null;
    if (settings.p1() != null && settings.p2() != null) {
      final LocalMaximaPeakExtractor extractor = new LocalMaximaPeakExtractor();
      final List<PeakRecord> peaks = extractor.findPeaks(window.time(), filtered,
          LocalMaximaPeakExtractor.distanceForFrequency(matrix.getSamplingRate(),
              settings.fBase()));
      summary.put("peaks", peaks.size());
      snapped = phaseAnalyzer.computeSnapped(peaks, settings.p1(), settings.p2(),
          settings.fBase(), settings.layout().getNumberOfProbes(), settings.excluded());
      putFit(summary, "snapped", snapped);
    }

    if (settings.cursor() != null) {
      final CyclePhase cycle = phaseAnalyzer.computeCycle(window, settings.cursor());
      if (!cycle.isEmpty()) {
        summary.put("cycle_time", cycle.time());
        summary.put("cycle_phases", Arrays.toString(cycle.phases()));
      }
    }

    final SpatialDecomposer decomposer = new SpatialDecomposer(
        config.createParameters(SpatialStructureParameters::new));
    final SVDResult svd = decomposer.decompose(filtered);
    SpatialStructure structure = null;
    if (svd != null) {
      final double[] energy = SpatialDecomposer.modeEnergyFractions(svd.s());
      summary.put("mode0_energy_fraction", energy.length > 0 ? energy[0] : 0d);
      final int mode = Math.min(settings.svdMode(), svd.getRank() - 1);
      try {
        structure = decomposer.spatialStructure(svd.spatialMode(mode),
            matrix.getNumberOfChannels());
      } catch (MirnovAnalysisException e) {
        logger.log(Level.WARNING, "No spatial structure for mode " + mode, e);
      }
    }

    if (outDir != null) {
      final PhaseFitResult phases = snapped != null && !snapped.isEmpty() ? snapped : direct;
      if (!phases.isEmpty()) {
        savePhaseChart(outDir.resolve("phase_fit.png").toFile(), phases, settings);
        summary.chartSaved();
      }
      if (svd != null) {
        saveSingularValueChart(outDir.resolve("singular_values.png").toFile(), svd);
        summary.chartSaved();
      }
      if (structure != null) {
        saveStructureChart(outDir.resolve("spatial_structure.png").toFile(), structure);
        summary.chartSaved();
      }
    }
    return summary;
  }

  private static void putFit(RunSummary summary, String prefix, PhaseFitResult result) {
    summary.put(prefix + "_channels", result.size());
    final PhaseSlopeFit fit = PhaseSlopeFit.fit(result.angles(), result.phaseDiffs());
    if (fit != null) {
      summary.put(prefix + "_slope", fit.slope());
      summary.put(prefix + "_r2", fit.rSquared());
    }
  }

  private static double dominantFrequency(Spectrogram spectrogram) {
    double best = 0d;
    double bestPower = -1d;
    for (int k = 1; k < spectrogram.getNumberOfFrequencies(); k++) {
      double power = 0d;
      for (double p : spectrogram.power()[k]) {
        power += p;
      }
      if (power > bestPower) {
        bestPower = power;
        best = spectrogram.frequencies()[k];
      }
    }
    return best;
  }

  /**
   * Reads a delimited numeric table. The first column is the time axis, every further column is
   * one channel. A first line that is not numeric is taken as header.
   */
  static @NotNull ChannelTable readChannels(@NotNull File file) throws IOException {
    final List<double[]> rows = new ArrayList<>();
    List<String> header = List.of();
    try (BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      String line;
      boolean first = true;
      while ((line = br.readLine()) != null) {
        final String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        final List<String> cells = Splitter.on(SEPARATOR).omitEmptyStrings().trimResults()
            .splitToList(trimmed);
        final double[] values = parseRow(cells);
        if (values == null) {
          if (first) {
            header = cells;
            first = false;
            continue;
          }
          throw new IOException("Non-numeric row in " + file + ": " + line);
        }
        first = false;
        if (!rows.isEmpty() && values.length != rows.get(0).length) {
          throw new IOException(
              "Row with " + values.length + " columns, expected " + rows.get(0).length + ": "
                  + line);
        }
        rows.add(values);
      }
    }
    final int columns = rows.isEmpty() ? 0 : rows.get(0).length;
    final double[] time = new double[rows.size()];
    final double[][] data = new double[Math.max(0, columns - 1)][rows.size()];
    for (int r = 0; r < rows.size(); r++) {
      time[r] = rows.get(r)[0];
      for (int c = 1; c < columns; c++) {
        data[c - 1][r] = rows.get(r)[c];
      }
    }
    final List<String> names = header.size() > 1 ? header.subList(1, header.size()) : List.of();
    return new ChannelTable(time, data, names);
  }

  private static @Nullable double[] parseRow(List<String> cells) {
    final double[] values = new double[cells.size()];
    try {
      for (int i = 0; i < values.length; i++) {
        values[i] = Double.parseDouble(cells.get(i));
      }
    } catch (NumberFormatException e) {
      return null;
    }
    return values;
  }

  private static void savePhaseChart(File out, PhaseFitResult phases, RunSettings settings)
      throws IOException {
    final XYSeries points = new XYSeries("Phase difference");
    for (int i = 0; i < phases.size(); i++) {
      points.add(phases.angles()[i], phases.phaseDiffs()[i]);
    }
    final XYSeriesCollection ds = new XYSeriesCollection(points);
    final PhaseSlopeFit fit = PhaseSlopeFit.fit(phases.angles(), phases.phaseDiffs());
    String title = settings.layout().getModeLabel() + " mode, f=" + settings.fBase() + " Hz";
    if (fit != null) {
      final XYSeries line = new XYSeries("Fit");
      line.add(0d, fit.predict(0d));
      line.add(360d, fit.predict(360d));
      ds.addSeries(line);
      title += String.format(Locale.US, ", slope=%.3f, R2=%.3f", fit.slope(), fit.rSquared());
    }
    final JFreeChart chart = ChartFactory.createXYLineChart(title, "Probe angle (deg)",
        "Phase difference (deg)", ds, PlotOrientation.VERTICAL, true, false, false);
    final XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
    renderer.setSeriesLinesVisible(0, false);
    renderer.setSeriesShapesVisible(0, true);
    renderer.setSeriesShapesVisible(1, false);
    renderer.setSeriesPaint(1, Color.RED);
    chart.getXYPlot().setRenderer(renderer);
    ChartUtils.saveChartAsPNG(out, chart, 900, 600);
  }

  private static void saveSingularValueChart(File out, SVDResult svd) throws IOException {
    final double[] energy = SpatialDecomposer.modeEnergyFractions(svd.s());
    final XYSeries series = new XYSeries("Energy fraction");
    for (int i = 0; i < energy.length; i++) {
      series.add(i + 1, energy[i]);
    }
    final JFreeChart chart = ChartFactory.createXYLineChart("Singular values", "Mode",
        "S^2 / sum(S^2)", new XYSeriesCollection(series), PlotOrientation.VERTICAL, false, false,
        false);
    final XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, true);
    chart.getXYPlot().setRenderer(renderer);
    ChartUtils.saveChartAsPNG(out, chart, 900, 600);
  }

  private static void saveStructureChart(File out, SpatialStructure structure)
      throws IOException {
    final XYSeries ring = new XYSeries("Probes", false);
    final XYSeries displaced = new XYSeries("Displaced", false);
    final XYSeries contour = new XYSeries("Contour", false);
    for (double[] p : structure.probePositions()) {
      ring.add(p[0], p[1]);
    }
    for (double[] p : structure.displacedPositions()) {
      displaced.add(p[0], p[1]);
    }
    for (double[] p : structure.contour()) {
      contour.add(p[0], p[1]);
    }
    final XYSeriesCollection ds = new XYSeriesCollection();
    ds.addSeries(ring);
    ds.addSeries(displaced);
    ds.addSeries(contour);
    final JFreeChart chart = ChartFactory.createXYLineChart("Spatial structure", "x", "y", ds,
        PlotOrientation.VERTICAL, true, false, false);
    final XYPlot plot = chart.getXYPlot();
    final XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
    renderer.setSeriesLinesVisible(0, false);
    renderer.setSeriesLinesVisible(1, false);
    renderer.setSeriesShapesVisible(2, false);
    renderer.setSeriesStroke(2, new BasicStroke(2f));
    plot.setRenderer(renderer);
    ChartUtils.saveChartAsPNG(out, chart, 700, 700);
  }

  /**
   * Parsed channel file.
   */
  record ChannelTable(double[] time, double[][] data, List<String> channelNames) {

  }

  /**
   * Values of the summary report in insertion order.
   */
  static final class RunSummary {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private int charts;

    void put(String key, Object value) {
      values.put(key, value);
    }

    @Nullable Object get(String key) {
      return values.get(key);
    }

    void chartSaved() {
      charts++;
    }

    int charts() {
      return charts;
    }

    String toTsv() {
      final StringBuilder sb = new StringBuilder("key\tvalue\n");
      values.forEach((k, v) -> sb.append(k).append('\t').append(v).append('\n'));
      return sb.toString();
    }
  }

  /**
   * Run options taken from system properties.
   */
  record RunSettings(double samplingRate, ProbeLayout layout, double fBase, double halfWidth,
                     @Nullable Double tStart, @Nullable Double tEnd, @Nullable ReferencePoint p1,
                     @Nullable ReferencePoint p2, Set<Integer> excluded, int svdMode,
                     @Nullable Double cursor, ChannelCorrections corrections) {

    static RunSettings fromSystemProperties(double configuredSamplingRate) {
      final String fs = System.getProperty("fs", "").trim();
      return new RunSettings(
          fs.isEmpty() ? configuredSamplingRate : Double.parseDouble(fs),
          ProbeLayout.fromModeLabel(System.getProperty("mode", "m")),
          Double.parseDouble(System.getProperty("fbase", "10000")),
          Double.parseDouble(System.getProperty("df", "2000")),
          optionalDouble(System.getProperty("tStart")),
          optionalDouble(System.getProperty("tEnd")),
          parsePoint(System.getProperty("p1")),
          parsePoint(System.getProperty("p2")),
          parseChannels(System.getProperty("exclude", "")),
          Integer.parseInt(System.getProperty("svdMode", "0")),
          optionalDouble(System.getProperty("cursor")),
          new ChannelCorrections(parseChannelValues(System.getProperty("t0", "")),
              parseChannelValues(System.getProperty("mult", ""))));
    }

    static @Nullable Double optionalDouble(@Nullable String value) {
      return value == null || value.isBlank() ? null : Double.valueOf(value.trim());
    }

    /**
     * "time,channel"
     */
    static @Nullable ReferencePoint parsePoint(@Nullable String value) {
      if (value == null || value.isBlank()) {
        return null;
      }
      final List<String> parts = Splitter.on(',').trimResults().splitToList(value);
      if (parts.size() != 2) {
        throw new IllegalArgumentException("Reference point must be 'time,channel': " + value);
      }
      return new ReferencePoint(Double.parseDouble(parts.get(0)),
          Double.parseDouble(parts.get(1)));
    }

    static Set<Integer> parseChannels(String value) {
      final Set<Integer> channels = new LinkedHashSet<>();
      for (String s : Splitter.on(',').trimResults().omitEmptyStrings().split(value)) {
        channels.add(Integer.parseInt(s));
      }
      return channels;
    }

    /**
     * "channel:value,..." with 1-based channels, returned with 0-based keys.
     */
    static Map<Integer, Double> parseChannelValues(String value) {
      final Map<Integer, Double> result = new HashMap<>();
      for (String entry : Splitter.on(',').trimResults().omitEmptyStrings().split(value)) {
        final List<String> kv = Splitter.on(':').trimResults().splitToList(entry);
        if (kv.size() != 2) {
          throw new IllegalArgumentException("Expected channel:value but got " + entry);
        }
        result.put(Integer.parseInt(kv.get(0)) - 1, Double.parseDouble(kv.get(1)));
      }
      return result;
    }
  }
}
