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

package io.github.mhdscope.util;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Maps a sample count to a processing parameter. Each entry applies from its lower bound
 * (inclusive) up to the next larger bound; counts below the smallest bound get the fallback value.
 *
 * @param <T> parameter type
 */
public final class ThresholdTable<T> {

  private final ImmutableSortedMap<Integer, T> lowerBounds;
  private final T fallback;

  private ThresholdTable(ImmutableSortedMap<Integer, T> lowerBounds, T fallback) {
    this.lowerBounds = lowerBounds;
    this.fallback = fallback;
  }

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  public @NotNull T lookup(int sampleCount) {
    final Map.Entry<Integer, T> entry = lowerBounds.floorEntry(sampleCount);
    return entry == null ? fallback : entry.getValue();
  }

  public @NotNull ImmutableSortedMap<Integer, T> getLowerBounds() {
    return lowerBounds;
  }

  public @NotNull T getFallback() {
    return fallback;
  }

  @Override
  public String toString() {
    return "ThresholdTable" + lowerBounds + " otherwise " + fallback;
  }

  public static final class Builder<T> {

    private final ImmutableSortedMap.Builder<Integer, T> entries = ImmutableSortedMap.naturalOrder();

    private Builder() {
    }

    public Builder<T> atLeast(int sampleCount, @NotNull T value) {
      entries.put(sampleCount, Objects.requireNonNull(value));
      return this;
    }

    public ThresholdTable<T> otherwise(@NotNull T fallback) {
      return new ThresholdTable<>(entries.buildOrThrow(), Objects.requireNonNull(fallback));
    }
  }
}
