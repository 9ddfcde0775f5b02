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

import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.jetbrains.annotations.NotNull;

/**
 * NaN aware reductions used by the calibration and evaluation steps.
 */
public class MathUtils {

  private MathUtils() {
  }

  /**
   * @return the median of all values, NaN for an empty array.
   */
  public static double median(final double @NotNull [] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    final Median median = new Median();
    return median.evaluate(values);
  }

  public static double mean(final double @NotNull [] values, final int from, final int to) {
    double sum = 0;
    for (int i = from; i < to; i++) {
      sum += values[i];
    }
    return sum / (to - from);
  }

  /**
   * Mean of all finite values. NaN if there is none.
   */
  public static double nanMean(final double @NotNull ... values) {
    double sum = 0;
    int n = 0;
    for (final double v : values) {
      if (!Double.isNaN(v)) {
        sum += v;
        n++;
      }
    }
    return n == 0 ? Double.NaN : sum / n;
  }

  /**
   * Minimum ignoring NaN. NaN if all values are NaN.
   */
  public static double nanMin(final double @NotNull ... values) {
    double min = Double.NaN;
    for (final double v : values) {
      if (Double.isNaN(v)) {
        continue;
      }
      if (Double.isNaN(min) || v < min) {
        min = v;
      }
    }
    return min;
  }

  public static boolean allNaN(final double @NotNull [] values) {
    for (final double v : values) {
      if (!Double.isNaN(v)) {
        return false;
      }
    }
    return true;
  }

  public static double[] sorted(final double @NotNull [] values) {
    final double[] copy = values.clone();
    Arrays.sort(copy);
    return copy;
  }
}
