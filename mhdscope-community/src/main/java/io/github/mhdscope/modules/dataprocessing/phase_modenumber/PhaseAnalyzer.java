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

package io.github.mhdscope.modules.dataprocessing.phase_modenumber;

import io.github.mhdscope.datamodel.PeakRecord;
import io.github.mhdscope.datamodel.ProbeLayout;
import io.github.mhdscope.modules.dataprocessing.filter_bandpass.FilteredWindow;
import io.github.mhdscope.util.MathUtils;
import io.github.mhdscope.util.exceptions.DegenerateLineException;
import io.github.mhdscope.util.exceptions.InvalidChannelDataException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Phase differences between Mirnov probes for a mode rotating at a known frequency. Times are in
 * ms, the frequency in Hz, so a time difference dt gives {@code 360 * f * 1e-3 * dt} degrees.
 */
public class PhaseAnalyzer {

  private static final Logger logger = Logger.getLogger(PhaseAnalyzer.class.getName());

  private static final double DEGREES_PER_HZ_MS = 360d * 1e-3;

  private static final double CYCLE_TIME_OFFSET = 1e-4;

  /**
   * Peak of every channel inside one time window, referenced to channel 1. Phases are signed.
   *
   * @param data   [channel][time]
   * @param time   time axis (ms)
   * @param t1     window border, either order
   * @param t2     window border, either order
   * @param layout probe array, its ring is replaced by an even ring over all channels if the
   *               channel count differs. Null selects the array by channel count.
   * @return the phases or an empty result if the window holds no sample
   */
  public @NotNull PhaseFitResult computeDirect(@Nullable double[][] data, @Nullable double[] time,
      double t1, double t2, double fBaseHz, @Nullable ProbeLayout layout) {
    if (data == null || time == null || data.length == 0) {
      return PhaseFitResult.empty();
    }
    final int from = MathUtils.searchSortedLeft(time, Math.min(t1, t2));
    final int to = MathUtils.searchSortedLeft(time, Math.max(t1, t2));
    if (to <= from) {
      return PhaseFitResult.empty();
    }

    final int channels = data.length;
    final double[] peakTimes = new double[channels];
    for (int ch = 0; ch < channels; ch++) {
      if (data[ch].length != time.length) {
        throw new InvalidChannelDataException(
            "Channel " + (ch + 1) + " has " + data[ch].length + " samples, time axis has "
                + time.length);
      }
      peakTimes[ch] = time[MathUtils.argMax(data[ch], from, to)];
    }

    final double[] phases = new double[channels];
    for (int ch = 0; ch < channels; ch++) {
      phases[ch] = DEGREES_PER_HZ_MS * fBaseHz * (peakTimes[ch] - peakTimes[0]);
    }

    final ProbeLayout probes = layout != null ? layout : ProbeLayout.forChannelCount(channels);
    double[] angles = probes != null ? probes.getAngles() : ProbeLayout.ringAngles(channels);
    if (angles.length != channels) {
      logger.fine(() -> probes + " has " + probes.getNumberOfProbes() + " probes but the data "
          + channels + " channels, using an even ring");
      angles = ProbeLayout.ringAngles(channels);
    }
    return new PhaseFitResult(angles, phases, peakTimes);
  }

  /**
   * Follows the line through two picked points across the peak map. On every channel the peak
   * closest to the line is taken, the phase is the unsigned time difference to the first included
   * channel.
   *
   * @param peaks    peaks of all channels, channels 1-based
   * @param numCoils probes of the ring
   * @param excluded 1-based channels to leave out
   * @return the phases, empty if there are no peaks, if every channel is excluded or without peaks
   * or if the two points do not define an invertible line
   */
  public @NotNull PhaseFitResult computeSnapped(@Nullable List<PeakRecord> peaks,
      @NotNull ReferencePoint p1, @NotNull ReferencePoint p2, double fBaseHz, int numCoils,
      @Nullable Collection<Integer> excluded) {
    if (peaks == null || peaks.isEmpty()) {
      return PhaseFitResult.empty();
    }
    final List<List<Double>> peaksByChannel = new ArrayList<>(numCoils);
    for (int i = 0; i < numCoils; i++) {
      peaksByChannel.add(new ArrayList<>());
    }
    for (PeakRecord peak : peaks) {
      if (peak.channel() >= 1 && peak.channel() <= numCoils) {
        peaksByChannel.get(peak.channel() - 1).add(peak.time());
      }
    }
    peaksByChannel.forEach(list -> list.sort(Double::compare));

    final SnapLine line;
    try {
      line = SnapLine.through(p1, p2);
    } catch (DegenerateLineException e) {
      logger.fine(() -> "No snapped phase fit: " + e.getMessage());
      return PhaseFitResult.empty();
    }
    final Set<Integer> skip = excluded == null ? Set.of() : Set.copyOf(excluded);
    final double[] ring = ProbeLayout.ringAngles(numCoils);

    final List<Double> times = new ArrayList<>();
    final List<Double> angles = new ArrayList<>();
    for (int i = 0; i < numCoils; i++) {
      final int channel = i + 1;
      final List<Double> candidates = peaksByChannel.get(i);
      if (skip.contains(channel) || candidates.isEmpty()) {
        continue;
      }
      times.add(nearest(candidates, line.predictTime(channel)));
      angles.add(ring[i]);
    }
    if (times.isEmpty()) {
      logger.fine("No channel left for the snapped phase fit");
      return PhaseFitResult.empty();
    }

    final double first = times.get(0);
    final double[] snapped = times.stream().mapToDouble(Double::doubleValue).toArray();
    final double[] phases = new double[snapped.length];
    for (int i = 0; i < snapped.length; i++) {
      phases[i] = DEGREES_PER_HZ_MS * fBaseHz * Math.abs(snapped[i] - first);
    }
    return new PhaseFitResult(angles.stream().mapToDouble(Double::doubleValue).toArray(), phases,
        snapped);
  }

  /**
   * Instantaneous phase of every channel against channel 1 at the first sample at least 0.1 us
   * after {@code tRef}: {@code atan2(x_ch, x_1)} in degrees.
   *
   * @param window filtered samples, [time][channel]
   * @param tRef   time of the cursor (ms)
   * @return the phases, empty if no sample lies after {@code tRef}
   */
  public @NotNull CyclePhase computeCycle(@Nullable FilteredWindow window, double tRef) {
    if (window == null || window.getNumberOfChannels() == 0) {
      return CyclePhase.empty();
    }
    final double[] time = window.time();
    final int idx = MathUtils.searchSortedLeft(time, tRef + CYCLE_TIME_OFFSET);
    if (idx >= time.length || idx >= window.data().length) {
      logger.fine(() -> "No filtered sample after " + tRef + " ms");
      return CyclePhase.empty();
    }
    final double[] sample = window.data()[idx];
    final double reference = sample[0];
    final double[] phases = new double[sample.length];
    for (int ch = 0; ch < sample.length; ch++) {
      phases[ch] = Math.toDegrees(Math.atan2(sample[ch], reference));
    }
    return new CyclePhase(time[idx], phases);
  }

  /**
   * Earliest of the closest candidates, the list is sorted.
   */
  private static double nearest(List<Double> sortedTimes, double target) {
    double best = sortedTimes.get(0);
    double bestDistance = Math.abs(best - target);
    for (double t : sortedTimes) {
      final double distance = Math.abs(t - target);
      if (distance < bestDistance) {
        best = t;
        bestDistance = distance;
      }
    }
    return best;
  }
}
