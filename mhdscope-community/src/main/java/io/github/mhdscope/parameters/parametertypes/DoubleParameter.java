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

package io.github.mhdscope.parameters.parametertypes;

import java.text.NumberFormat;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class DoubleParameter extends NumberParameter<Double> {

  public DoubleParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, Double defaultValue, @NotNull Double minimum,
      @NotNull Double maximum, @Nullable String configKey) {
    super(name, description, format, defaultValue, minimum, maximum, configKey);
  }

  public DoubleParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, Double defaultValue) {
    this(name, description, format, defaultValue, -Double.MAX_VALUE, Double.MAX_VALUE, null);
  }

  @Override
  protected Double convert(double number) {
    return number;
  }

  @Override
  public @NotNull DoubleParameter cloneParameter() {
    return new DoubleParameter(name, description, format, value, minimum, maximum, configKey);
  }
}
