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

import io.github.mhdscope.parameters.Parameter;
import java.text.NumberFormat;
import java.util.Collection;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Numeric parameter with an inclusive valid range and an optional configuration key.
 */
public abstract class NumberParameter<T extends Number & Comparable<T>> implements Parameter<T> {

  protected final String name;
  protected final String description;
  protected final NumberFormat format;
  protected final T minimum;
  protected final T maximum;
  protected final @Nullable String configKey;
  protected T value;

  protected NumberParameter(@NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, T defaultValue, @NotNull T minimum, @NotNull T maximum,
      @Nullable String configKey) {
    this.name = name;
    this.description = description;
    this.format = format;
    this.value = defaultValue;
    this.minimum = minimum;
    this.maximum = maximum;
    this.configKey = configKey;
  }

  @Override
  public @NotNull String getName() {
    return name;
  }

  @Override
  public @NotNull String getDescription() {
    return description;
  }

  @Override
  public T getValue() {
    return value;
  }

  @Override
  public void setValue(T newValue) {
    this.value = newValue;
  }

  public @NotNull T getMinimum() {
    return minimum;
  }

  public @NotNull T getMaximum() {
    return maximum;
  }

  public @NotNull NumberFormat getFormat() {
    return format;
  }

  @Override
  public @Nullable String getConfigKey() {
    return configKey;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (value == null) {
      errorMessages.add(name + " is not set properly");
      return false;
    }
    if (value.compareTo(minimum) < 0 || value.compareTo(maximum) > 0) {
      errorMessages.add(
          name + " lies outside its bounds: (" + format.format(minimum) + " ... " + format.format(
              maximum) + ")");
      return false;
    }
    return true;
  }

  @Override
  public void loadValueFromConfig(@NotNull Object rawValue) {
    final double number;
    if (rawValue instanceof Number n) {
      number = n.doubleValue();
    } else {
      try {
        number = Double.parseDouble(rawValue.toString().trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Configuration value of " + configKey + " is not a number: " + rawValue, e);
      }
    }
    setValue(convert(number));
  }

  protected abstract T convert(double number);

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NumberParameter<?> that)) {
      return false;
    }
    return name.equals(that.name) && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return name + "=" + (value == null ? "null" : format.format(value));
  }
}
