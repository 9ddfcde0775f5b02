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

package io.github.bmlab.modules.dataprocessing.calib_peakfinder;

import com.google.common.collect.Range;
import io.github.bmlab.util.MathUtils;
import io.github.bmlab.util.PeakFinder;
import io.github.bmlab.util.PeakFinder.DetectedPeak;
import io.github.bmlab.util.exceptions.AmbiguousCenterException;
import io.github.bmlab.util.exceptions.InsufficientPeaksException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Finds the Rayleigh and Brillouin peaks in an averaged calibration spectrum. A calibration
 * spectrum shows the Brillouin doublets of all calibration samples between two Rayleigh peaks. The
 * peaks left of the center are the Stokes peaks, the peaks right of it the anti-Stokes peaks.
 */
public class CalibrationPeakFinder {

  private static final Logger logger = Logger.getLogger(CalibrationPeakFinder.class.getName());

  /**
   * Regions extend this many peak widths to each side of a peak.
   */
  private static final double REGION_WIDTH_FACTOR = 4;

  private final double minHeight;
  private final double minProminence;
  private final int numBrillouinSamples;

  public CalibrationPeakFinder(double minHeight, double minProminence, int numBrillouinSamples) {
    if (numBrillouinSamples < 1) {
      throw new IllegalArgumentException("At least one Brillouin sample is required");
    }
    this.minHeight = minHeight;
    this.minProminence = minProminence;
    this.numBrillouinSamples = numBrillouinSamples;
  }

  public int getExpectedNumberOfPeaks() {
    return 2 + 2 * numBrillouinSamples;
  }

  /**
   * @param spectrum the averaged calibration spectrum, not modified
   * @return the Brillouin regions (two if more than one sample is used) and the two Rayleigh
   * regions
   * @throws InsufficientPeaksException if fewer peaks than expected are found
   * @throws AmbiguousCenterException   if the peaks cannot be split around the center
   */
  public @NotNull CalibrationRegions findRegions(final double @NotNull [] spectrum)
      throws InsufficientPeaksException, AmbiguousCenterException {
    final double background = MathUtils.median(spectrum);
    final int expectedPeaks = getExpectedNumberOfPeaks();

    List<DetectedPeak> peaks = PeakFinder.findPeaks(spectrum, background + minHeight,
        minProminence);
    if (peaks.size() < expectedPeaks) {
      final int found = peaks.size();
      logger.fine(() -> "Found only %d of %d peaks above the minimum height, retrying without".formatted(
          found, expectedPeaks));
      peaks = PeakFinder.findPeaks(spectrum, null, minProminence);
      if (peaks.size() < expectedPeaks) {
        throw new InsufficientPeaksException(
            "Found " + peaks.size() + " calibration peaks but expected " + expectedPeaks);
      }
    }

    final double[] positions = peaks.stream().mapToDouble(DetectedPeak::index).toArray();
    final double center = findCenter(spectrum, background, positions, expectedPeaks);

    final int firstBrillouin = firstBrillouinIndex(positions, center, numBrillouinSamples);
    final int leftRayleigh = firstBrillouin - 1;
    final int rightRayleigh = firstBrillouin + 2 * numBrillouinSamples;

    List<Range<Double>> brillouin = new ArrayList<>();
    for (int i = firstBrillouin; i < rightRayleigh; i++) {
      brillouin.add(toRegion(peaks.get(i), spectrum.length));
    }
    if (numBrillouinSamples > 1) {
      brillouin = List.of(
          Range.closedOpen(brillouin.get(0).lowerEndpoint(),
              brillouin.get(numBrillouinSamples - 1).upperEndpoint()),
          Range.closedOpen(brillouin.get(numBrillouinSamples).lowerEndpoint(),
              brillouin.get(brillouin.size() - 1).upperEndpoint()));
    }
    final List<Range<Double>> rayleigh = List.of(toRegion(peaks.get(leftRayleigh), spectrum.length),
        toRegion(peaks.get(rightRayleigh), spectrum.length));
    return new CalibrationRegions(brillouin, rayleigh);
  }

  /**
   * Splits the ascending peak positions at center. The Stokes Brillouin peaks are the
   * numBrillouinSamples peaks left of the center, preceded by the left Rayleigh peak. The anti-Stokes
   * peaks and the right Rayleigh peak follow.
   *
   * @return the index of the first Stokes Brillouin peak
   * @throws AmbiguousCenterException if a Rayleigh peak would fall outside the peak list
   */
  static int firstBrillouinIndex(double[] positions, double center, int numBrillouinSamples)
      throws AmbiguousCenterException {
    int numLeft = 0;
    for (final double p : positions) {
      if (p <= center) {
        numLeft++;
      }
    }
    final int firstBrillouin = numLeft - numBrillouinSamples;
    if (firstBrillouin - 1 < 0 || numLeft + numBrillouinSamples >= positions.length) {
      throw new AmbiguousCenterException(
          "Cannot assign the peaks around the center at pixel %.1f, %d peaks left of it, %d peaks found".formatted(
              center, numLeft, positions.length));
    }
    return firstBrillouin;
  }

  /**
   * The position between the Stokes and the anti-Stokes peaks.
   */
  private double findCenter(double[] spectrum, double background, double[] positions,
      int expectedPeaks) {
    final int n = positions.length;
    if (n == expectedPeaks) {
      final int idx = expectedPeaks / 2;
      return MathUtils.mean(positions, idx - 1, idx + 1);
    }

    // center of mass, samples below the background do not contribute. Pixel positions start at 1.
    double weightedSum = 0;
    double sum = 0;
    for (int i = 0; i < spectrum.length; i++) {
      final double v = spectrum[i] < background ? 0 : spectrum[i];
      if (Double.isNaN(v)) {
        continue;
      }
      weightedSum += v * (i + 1);
      sum += v;
    }
    double center = weightedSum / sum;

    int right = 0;
    for (final double p : positions) {
      if (p > center) {
        right++;
      }
    }
    final int left = n - right;
    if (right < numBrillouinSamples + 1) {
      center = MathUtils.mean(positions, n - numBrillouinSamples - 2, n - numBrillouinSamples);
    } else if (left < numBrillouinSamples + 1) {
      center = MathUtils.mean(positions, numBrillouinSamples, numBrillouinSamples + 2);
    }
    return center;
  }

  private static Range<Double> toRegion(DetectedPeak peak, int length) {
    final double halfWidth = REGION_WIDTH_FACTOR * peak.width();
    final int start = clamp((int) (peak.index() - halfWidth), length);
    final int end = clamp((int) (peak.index() + halfWidth), length);
    return Range.closedOpen((double) start, (double) end);
  }

  private static int clamp(int value, int length) {
    return Math.max(0, Math.min(length, value));
  }
}
