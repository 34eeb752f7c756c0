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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Nested key-value configuration store ({@code config.json}). Processing modules do not read it
 * themselves; callers create parameter sets from it and pass them to the module constructors.
 * <p>
 * Layout:
 * <pre>
 * {
 *   "system":   { "fs": 200000.0 },
 *   "analysis": { "cal_duration": {...}, "wavelet": {...}, "savgol": {...},
 *                 "spectrogram": {...}, "spatial": {...} }
 * }
 * </pre>
 */
public final class AnalysisConfiguration {

  private static final Logger logger = Logger.getLogger(AnalysisConfiguration.class.getName());

  public static final double DEFAULT_SAMPLING_RATE = 200_000d;

  private final JSONObject root;

  private AnalysisConfiguration(@NotNull JSONObject root) {
    this.root = root;
  }

  /**
   * @return a configuration without entries, every parameter keeps its default
   */
  public static @NotNull AnalysisConfiguration defaults() {
    return new AnalysisConfiguration(new JSONObject());
  }

  public static @NotNull AnalysisConfiguration fromJson(@NotNull String json) {
    try {
      return new AnalysisConfiguration(new JSONObject(json));
    } catch (JSONException e) {
      throw new IllegalArgumentException("Configuration is not a valid JSON object", e);
    }
  }

  /**
   * Reads the configuration file. A missing file is not an error, all defaults apply.
   *
   * @throws IOException if the file exists but cannot be read
   */
  public static @NotNull AnalysisConfiguration load(@NotNull Path file) throws IOException {
    if (Files.notExists(file)) {
      logger.info(() -> "Configuration " + file + " not found, using defaults");
      return defaults();
    }
    final String content = Files.readString(file, StandardCharsets.UTF_8);
    try {
      return new AnalysisConfiguration(new JSONObject(content));
    } catch (JSONException e) {
      throw new IOException("Cannot parse configuration " + file, e);
    }
  }

  /**
   * Creates a parameter set with its defaults overwritten by the {@code analysis} section.
   *
   * @throws IllegalArgumentException if a configured value is invalid or out of range
   */
  public @NotNull <T extends ParameterSet> T createParameters(@NotNull Supplier<T> factory) {
    final T parameters = factory.get();
    final JSONObject analysis = root.optJSONObject("analysis");
    if (analysis != null) {
      parameters.loadValuesFromConfig(analysis);
    }
    final List<String> errors = new ArrayList<>();
    if (!parameters.checkParameterValues(errors)) {
      throw new IllegalArgumentException(
          "Invalid configuration for " + parameters.getClass().getSimpleName() + ": " + errors);
    }
    return parameters;
  }

  /**
   * Sampling rate of the acquisition system in Hz ({@code system.fs}).
   */
  public double getSamplingRate() {
    final Object raw = get("system.fs");
    if (raw == null) {
      return DEFAULT_SAMPLING_RATE;
    }
    try {
      final double fs = raw instanceof Number n ? n.doubleValue() : Double.parseDouble(raw.toString());
      if (!(fs > 0d)) {
        throw new IllegalArgumentException("system.fs must be > 0 but was " + fs);
      }
      return fs;
    } catch (NumberFormatException e) {
      logger.log(Level.WARNING, "system.fs is not a number, using " + DEFAULT_SAMPLING_RATE, e);
      return DEFAULT_SAMPLING_RATE;
    }
  }

  /**
   * @param dottedPath e.g. {@code analysis.wavelet.norm_width}
   * @return the raw entry or null if any path element is missing
   */
  public @Nullable Object get(@NotNull String dottedPath) {
    final String[] keys = dottedPath.split("\\.");
    Object current = root;
    for (String key : keys) {
      if (!(current instanceof JSONObject obj) || !obj.has(key)) {
        return null;
      }
      current = obj.get(key);
    }
    return current == JSONObject.NULL ? null : current;
  }
}
