/*
 * Copyright (c) 2020-2025 The bmlab Development Team
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
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.bmlab.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MathUtilsTest {

  @Test
  void testNanAwareStatistics() {
    Assertions.assertEquals(2, MathUtils.nanMean(1, Double.NaN, 3), 1e-12);
    Assertions.assertEquals(1, MathUtils.nanMin(Double.NaN, 4, 1), 1e-12);
    Assertions.assertTrue(Double.isNaN(MathUtils.nanMean(Double.NaN, Double.NaN)));
    Assertions.assertTrue(MathUtils.allNaN(new double[]{Double.NaN}));
    Assertions.assertFalse(MathUtils.allNaN(new double[]{Double.NaN, 0}));
  }

  @Test
  void testMedianAndMean() {
    Assertions.assertEquals(2.5, MathUtils.median(new double[]{4, 1, 3, 2}), 1e-12);
    Assertions.assertEquals(2.5, MathUtils.mean(new double[]{1, 2, 3, 4}, 1, 3), 1e-12);
  }
}
