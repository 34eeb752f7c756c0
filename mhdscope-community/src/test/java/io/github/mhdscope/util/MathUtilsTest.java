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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MathUtilsTest {

  @Test
  void testLinspaceHitsEndPoint() {
    final double[] values = MathUtils.linspace(0d, 1d, 200);
    Assertions.assertEquals(200, values.length);
    Assertions.assertEquals(0d, values[0]);
    Assertions.assertEquals(1d, values[199]);
  }

  @Test
  void testSearchSortedLeft() {
    final double[] sorted = {1d, 2d, 2d, 3d};
    Assertions.assertEquals(0, MathUtils.searchSortedLeft(sorted, 0.5));
    Assertions.assertEquals(1, MathUtils.searchSortedLeft(sorted, 2d));
    Assertions.assertEquals(3, MathUtils.searchSortedLeft(sorted, 2.5));
    Assertions.assertEquals(4, MathUtils.searchSortedLeft(sorted, 10d));
  }

  @Test
  void testArgMaxReturnsFirstOccurrence() {
    final double[] values = {1d, 5d, 3d, 5d, 0d};
    Assertions.assertEquals(1, MathUtils.argMax(values, 0, values.length));
    Assertions.assertEquals(3, MathUtils.argMax(values, 2, values.length));
  }
}
