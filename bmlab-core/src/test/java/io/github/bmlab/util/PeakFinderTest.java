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

import io.github.bmlab.TestSpectra;
import io.github.bmlab.util.PeakFinder.DetectedPeak;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PeakFinderTest {

  @Test
  void testFindsPeaksWithProminenceAndWidth() {
    final double[] y = TestSpectra.lorentzians(200, 10, new double[]{50, 6, 100},
        new double[]{140, 6, 40});
    final List<DetectedPeak> peaks = PeakFinder.findPeaks(y, null, 5);

    Assertions.assertEquals(2, peaks.size());
    Assertions.assertEquals(50, peaks.get(0).index());
    Assertions.assertEquals(140, peaks.get(1).index());
    Assertions.assertEquals(110, peaks.get(0).height(), 1);
    Assertions.assertTrue(peaks.get(0).prominence() > 95);
    // width at half prominence is close to the fwhm for well separated peaks
    Assertions.assertEquals(6, peaks.get(0).width(), 0.5);
  }

  @Test
  void testHeightAndProminenceFilters() {
    final double[] y = TestSpectra.lorentzians(200, 10, new double[]{50, 6, 100},
        new double[]{140, 6, 40});
    Assertions.assertEquals(1, PeakFinder.findPeaks(y, 80d, 5).size());
    Assertions.assertEquals(1, PeakFinder.findPeaks(y, null, 60).size());
    Assertions.assertTrue(PeakFinder.findPeaks(y, 200d, 0).isEmpty());
  }

  @Test
  void testPlateauIsReportedAtItsMiddle() {
    final double[] y = {0, 1, 5, 5, 5, 1, 0};
    Assertions.assertEquals(List.of(3), PeakFinder.findLocalMaxima(y));
  }

  @Test
  void testBordersAreNoMaxima() {
    final double[] y = {5, 1, 0, 1, 5};
    Assertions.assertTrue(PeakFinder.findLocalMaxima(y).isEmpty());
  }
}
