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

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Finds local maxima in a one dimensional signal and characterizes them by their topographic
 * prominence and their width at half prominence. Flat maxima are reported at the middle sample of
 * the plateau.
 */
public class PeakFinder {

  private PeakFinder() {
  }

  /**
   * @param y             the signal
   * @param minHeight     minimum absolute height of a peak or null to accept all heights
   * @param minProminence minimum prominence
   * @return all peaks matching the filters, ordered by index
   */
  public static @NotNull List<DetectedPeak> findPeaks(final double @NotNull [] y,
      @Nullable final Double minHeight, final double minProminence) {
    final List<DetectedPeak> peaks = new ArrayList<>();
    for (final int index : findLocalMaxima(y)) {
      if (minHeight != null && y[index] < minHeight) {
        continue;
      }
      final DetectedPeak peak = characterize(y, index);
      if (peak.prominence() >= minProminence) {
        peaks.add(peak);
      }
    }
    return peaks;
  }

  /**
   * Indices of all local maxima. The first and last sample are never maxima.
   */
  public static @NotNull List<Integer> findLocalMaxima(final double @NotNull [] y) {
    final List<Integer> maxima = new ArrayList<>();
    int i = 1;
    final int last = y.length - 1;
    while (i < last) {
      if (y[i - 1] < y[i]) {
        int ahead = i + 1;
        while (ahead < last && y[ahead] == y[i]) {
          ahead++;
        }
        if (y[ahead] < y[i]) {
          maxima.add((i + ahead - 1) / 2);
          i = ahead;
        }
      }
      i++;
    }
    return maxima;
  }

  private static @NotNull DetectedPeak characterize(final double[] y, final int peak) {
    final double height = y[peak];

    // walk outwards until a higher sample or the border, remember the lowest point on the way
    int leftBase = peak;
    double leftMin = height;
    for (int i = peak - 1; i >= 0 && y[i] <= height; i--) {
      if (y[i] < leftMin) {
        leftMin = y[i];
        leftBase = i;
      }
    }
    int rightBase = peak;
    double rightMin = height;
    for (int i = peak + 1; i < y.length && y[i] <= height; i++) {
      if (y[i] < rightMin) {
        rightMin = y[i];
        rightBase = i;
      }
    }
    final double prominence = height - Math.max(leftMin, rightMin);

    final double evaluationHeight = height - prominence * 0.5;
    int i = peak;
    while (leftBase < i && y[i] > evaluationHeight) {
      i--;
    }
    double leftIp = i;
    if (y[i] < evaluationHeight) {
      leftIp += (evaluationHeight - y[i]) / (y[i + 1] - y[i]);
    }
    i = peak;
    while (i < rightBase && y[i] > evaluationHeight) {
      i++;
    }
    double rightIp = i;
    if (y[i] < evaluationHeight) {
      rightIp -= (evaluationHeight - y[i]) / (y[i - 1] - y[i]);
    }

    return new DetectedPeak(peak, height, prominence, rightIp - leftIp);
  }

  /**
   * @param index      sample index of the apex
   * @param height     signal value at the apex
   * @param prominence vertical distance to the higher of both bases
   * @param width      width in samples at half prominence
   */
  public record DetectedPeak(int index, double height, double prominence, double width) {

  }
}
