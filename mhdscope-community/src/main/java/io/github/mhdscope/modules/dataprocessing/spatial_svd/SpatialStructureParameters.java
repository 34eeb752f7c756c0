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

package io.github.mhdscope.modules.dataprocessing.spatial_svd;

import io.github.mhdscope.parameters.Parameter;
import io.github.mhdscope.parameters.impl.SimpleParameterSet;
import io.github.mhdscope.parameters.parametertypes.DoubleParameter;
import io.github.mhdscope.parameters.parametertypes.IntegerParameter;
import java.text.DecimalFormat;

public class SpatialStructureParameters extends SimpleParameterSet {

  public static final DoubleParameter RADIUS = new DoubleParameter("Ring radius",
      "Radius of the undisturbed probe ring in the spatial structure plot.",
      new DecimalFormat("0.#"), 40d, Double.MIN_VALUE, Double.MAX_VALUE, "spatial.radius");

  public static final DoubleParameter FACTOR = new DoubleParameter("Display amplitude",
      "Radial displacement of the probe with the largest mode weight.", new DecimalFormat("0.#"),
      15d, 0d, Double.MAX_VALUE, "spatial.factor");

  public static final IntegerParameter INTERP_POINTS = new IntegerParameter(
      "Interpolation points", "Points on the interpolated mode contour.", 200, 2, 100_000,
      "spatial.interp_points");

  public SpatialStructureParameters() {
    super(new Parameter[]{RADIUS, FACTOR, INTERP_POINTS});
  }
}
