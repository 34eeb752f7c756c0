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
import org.json.JSONObject;

/**
 * Group of parameters handed to a processing module at construction.
 */
public interface ParameterSet {

  @NotNull Parameter<?>[] getParameters();

  /**
   * @param template the static template of the parameter
   * @return this set's instance of the parameter
   */
  @NotNull <T extends Parameter<?>> T getParameter(@NotNull T template);

  default <V> V getValue(@NotNull Parameter<V> template) {
    return getParameter(template).getValue();
  }

  default <V> void setParameter(@NotNull Parameter<V> template, V value) {
    getParameter(template).setValue(value);
  }

  /**
   * Loads every configurable parameter whose key is present in the section. Missing keys keep
   * their current value.
   *
   * @param analysisSection the {@code analysis} object of the configuration store
   */
  void loadValuesFromConfig(@NotNull JSONObject analysisSection);

  boolean checkParameterValues(@NotNull Collection<String> errorMessages);

  @NotNull ParameterSet cloneParameterSet();
}
