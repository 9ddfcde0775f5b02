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
import io.github.bmlab.TestSpectra;
import io.github.bmlab.util.exceptions.AmbiguousCenterException;
import io.github.bmlab.util.exceptions.InsufficientPeaksException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CalibrationPeakFinderTest {

  private static double[] peak(double center) {
    return new double[]{center, 4, 1000};
  }

  @Test
  void testTwoSamplesGiveMergedBrillouinRegions() throws Exception {
    final double[] spectrum = TestSpectra.lorentzians(600, 10, peak(50), peak(150), peak(250),
        peak(350), peak(450), peak(550));
    final CalibrationPeakFinder finder = new CalibrationPeakFinder(15, 15, 2);
    Assertions.assertEquals(6, finder.getExpectedNumberOfPeaks());

    final CalibrationRegions regions = finder.findRegions(spectrum);

    Assertions.assertEquals(2, regions.brillouin().size());
    final Range<Double> stokes = regions.brillouin().get(0);
    final Range<Double> antiStokes = regions.brillouin().get(1);
    Assertions.assertTrue(stokes.contains(150d) && stokes.contains(250d));
    Assertions.assertTrue(antiStokes.contains(350d) && antiStokes.contains(450d));
    Assertions.assertFalse(stokes.contains(300d));
    Assertions.assertFalse(antiStokes.contains(300d));

    Assertions.assertEquals(2, regions.rayleigh().size());
    Assertions.assertTrue(regions.rayleigh().get(0).contains(50d));
    Assertions.assertTrue(regions.rayleigh().get(1).contains(550d));
    Assertions.assertFalse(regions.rayleigh().get(0).contains(150d));
  }

  @Test
  void testSingleSampleKeepsOneRegionPerPeak() throws Exception {
    final double[] spectrum = TestSpectra.lorentzians(600, 10, peak(100), peak(250), peak(350),
        peak(500));
    final CalibrationRegions regions = new CalibrationPeakFinder(15, 15, 1).findRegions(spectrum);

    Assertions.assertEquals(2, regions.brillouin().size());
    Assertions.assertTrue(regions.brillouin().get(0).contains(250d));
    Assertions.assertTrue(regions.brillouin().get(1).contains(350d));
    Assertions.assertTrue(regions.rayleigh().get(0).contains(100d));
    Assertions.assertTrue(regions.rayleigh().get(1).contains(500d));
  }

  @Test
  void testRegionsAreClampedToTheSpectrum() throws Exception {
    final double[] spectrum = TestSpectra.lorentzians(300, 10, new double[]{5, 8, 1000},
        peak(100), peak(200), new double[]{294, 8, 1000});
    final CalibrationRegions regions = new CalibrationPeakFinder(15, 15, 1).findRegions(spectrum);

    Assertions.assertEquals(0d, regions.rayleigh().get(0).lowerEndpoint());
    Assertions.assertEquals(300d, regions.rayleigh().get(1).upperEndpoint());
  }

  @Test
  void testExtraPeakIsIgnoredByCenterOfMass() throws Exception {
    final double[] spectrum = TestSpectra.lorentzians(600, 10, peak(100), peak(250), peak(350),
        peak(500), new double[]{560, 4, 100});
    final CalibrationRegions regions = new CalibrationPeakFinder(15, 15, 1).findRegions(spectrum);

    Assertions.assertTrue(regions.brillouin().get(0).contains(250d));
    Assertions.assertTrue(regions.brillouin().get(1).contains(350d));
    Assertions.assertTrue(regions.rayleigh().get(0).contains(100d));
    Assertions.assertTrue(regions.rayleigh().get(1).contains(500d));
    Assertions.assertFalse(regions.rayleigh().get(1).contains(560d));
  }

  @Test
  void testCenterShiftsLeftWhenRightRayleighDominates() throws Exception {
    // the bright peak at 500 pulls the center of mass past 350
    final double[] spectrum = TestSpectra.lorentzians(600, 10, new double[]{40, 4, 100},
        peak(100), peak(250), peak(350), new double[]{500, 4, 20000});
    final CalibrationRegions regions = new CalibrationPeakFinder(15, 15, 1).findRegions(spectrum);

    Assertions.assertTrue(regions.brillouin().get(0).contains(250d));
    Assertions.assertTrue(regions.brillouin().get(1).contains(350d));
    Assertions.assertTrue(regions.rayleigh().get(0).contains(100d));
    Assertions.assertTrue(regions.rayleigh().get(1).contains(500d));
  }

  @Test
  void testCenterShiftsRightWhenLeftRayleighDominates() throws Exception {
    final double[] spectrum = TestSpectra.lorentzians(600, 10, new double[]{100, 4, 20000},
        peak(250), peak(350), peak(500), new double[]{560, 4, 100});
    final CalibrationRegions regions = new CalibrationPeakFinder(15, 15, 1).findRegions(spectrum);

    Assertions.assertTrue(regions.brillouin().get(0).contains(250d));
    Assertions.assertTrue(regions.brillouin().get(1).contains(350d));
    Assertions.assertTrue(regions.rayleigh().get(0).contains(100d));
    Assertions.assertTrue(regions.rayleigh().get(1).contains(500d));
  }

  @Test
  void testSplitAroundCenter() throws Exception {
    final double[] positions = {100, 250, 350, 500, 560};
    Assertions.assertEquals(1, CalibrationPeakFinder.firstBrillouinIndex(positions, 300, 1));
    Assertions.assertEquals(2, CalibrationPeakFinder.firstBrillouinIndex(positions, 400, 1));

    // no Rayleigh peak left of the Stokes peaks
    Assertions.assertThrows(AmbiguousCenterException.class,
        () -> CalibrationPeakFinder.firstBrillouinIndex(positions, 200, 1));
    // no Rayleigh peak right of the anti-Stokes peaks
    Assertions.assertThrows(AmbiguousCenterException.class,
        () -> CalibrationPeakFinder.firstBrillouinIndex(positions, 520, 1));
    Assertions.assertThrows(AmbiguousCenterException.class,
        () -> CalibrationPeakFinder.firstBrillouinIndex(positions, 300, 2));
  }

  @Test
  void testTooFewPeaks() {
    final double[] spectrum = TestSpectra.lorentzians(600, 10, peak(50), peak(300), peak(550));
    Assertions.assertThrows(InsufficientPeaksException.class,
        () -> new CalibrationPeakFinder(15, 15, 2).findRegions(spectrum));
  }
}
