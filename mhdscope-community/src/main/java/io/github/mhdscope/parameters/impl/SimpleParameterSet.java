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

package io.github.mhdscope.parameters.impl;

import io.github.mhdscope.parameters.Parameter;
import io.github.mhdscope.parameters.ParameterSet;
import java.lang.reflect.InvocationTargetException;
import java.util.Collection;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;

public class SimpleParameterSet implements ParameterSet {

  private static final Logger logger = Logger.getLogger(SimpleParameterSet.class.getName());

  private final Parameter<?>[] parameters;

  public SimpleParameterSet(@NotNull Parameter<?>[] templates) {
    this.parameters = new Parameter<?>[templates.length];
    for (int i = 0; i < templates.length; i++) {
      parameters[i] = templates[i].cloneParameter();
    }
  }

  @Override
  public @NotNull Parameter<?>[] getParameters() {
    return parameters;
  }

  @SuppressWarnings("unchecked")
  @Override
  public @NotNull <T extends Parameter<?>> T getParameter(@NotNull T template) {
    for (Parameter<?> p : parameters) {
      if (p.getName().equals(template.getName())) {
        return (T) p;
      }
    }
    throw new IllegalArgumentException(
        "Parameter " + template.getName() + " does not exist in " + getClass().getSimpleName());
  }

  @Override
  public void loadValuesFromConfig(@NotNull JSONObject analysisSection) {
    for (Parameter<?> p : parameters) {
      final String key = p.getConfigKey();
      if (key == null) {
        continue;
      }
      final Object raw = resolve(analysisSection, key);
      if (raw == null) {
        logger.finest(() -> "No configuration entry for " + key + ", keeping " + p.getValue());
        continue;
      }
      p.loadValueFromConfig(raw);
    }
  }

  private static @Nullable Object resolve(@NotNull JSONObject root, @NotNull String dottedKey) {
    final String[] path = dottedKey.split("\\.");
    JSONObject current = root;
    for (int i = 0; i < path.length - 1; i++) {
      current = current.optJSONObject(path[i]);
      if (current == null) {
        return null;
      }
    }
    final Object value = current.opt(path[path.length - 1]);
    return value == JSONObject.NULL ? null : value;
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean allValid = true;
    for (Parameter<?> p : parameters) {
      allValid &= p.checkValue(errorMessages);
    }
    return allValid;
  }

  @Override
  public @NotNull ParameterSet cloneParameterSet() {
    if (getClass() == SimpleParameterSet.class) {
      return new SimpleParameterSet(parameters);
    }
    try {
      final SimpleParameterSet copy = getClass().getDeclaredConstructor().newInstance();
      for (Parameter<?> p : parameters) {
        copyValue(p, copy.getParameter(p));
      }
      return copy;
    } catch (InstantiationException | IllegalAccessException | NoSuchMethodException
             | InvocationTargetException e) {
      throw new IllegalStateException("Cannot clone parameter set " + getClass().getName(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static <T> void copyValue(Parameter<T> source, Parameter<?> target) {
    ((Parameter<T>) target).setValue(source.getValue());
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
    for (int i = 0; i < parameters.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(parameters[i].getName()).append('=').append(parameters[i].getValue());
    }
    return sb.append('}').toString();
  }
}
