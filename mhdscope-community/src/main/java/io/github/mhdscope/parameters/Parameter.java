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

import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named, typed value of a {@link ParameterSet}. Parameter sets declare their parameters as
 * static templates and keep cloned instances, so changing a value never touches another set.
 *
 * @param <T> value type
 */
public interface Parameter<T> {

  @NotNull String getName();

  @NotNull String getDescription();

  T getValue();

  void setValue(T newValue);

  /**
   * @param errorMessages receives a message for each problem
   * @return true if the current value is valid
   */
  boolean checkValue(@NotNull Collection<String> errorMessages);

  /**
   * Dotted path of this parameter in the configuration store below the {@code analysis} section,
   * e.g. {@code wavelet.norm_width}, or null if it is not configurable.
   */
  @Nullable String getConfigKey();

  /**
   * Reads the value from a raw configuration entry (number or numeric string).
   *
   * @throws IllegalArgumentException if the entry cannot be converted
   */
  void loadValueFromConfig(@NotNull Object rawValue);

  @NotNull Parameter<T> cloneParameter();
}
