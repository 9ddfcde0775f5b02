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

package io.github.bmlab.datamodel.calibration;

import com.google.common.collect.Range;
import io.github.bmlab.datamodel.fit.PeakFit;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CalibrationModelTest {

  private static FrequencyCalibration calibration(double time, double marker) {
    return new FrequencyCalibration(time, new double[]{marker, 0, 0, 0}, new double[]{marker});
  }

  @Test
  void testFrequenciesOfClosestCalibration() {
    final CalibrationModel model = new CalibrationModel();
    Assertions.assertNull(model.getFrequenciesByTime(5));

    model.setFrequencyCalibration("1", 0, calibration(0, 1));
    model.setFrequencyCalibration("1", 1, calibration(1, 2));
    model.setFrequencyCalibration("2", 0, calibration(10, 3));

    Assertions.assertArrayEquals(new double[]{1}, model.getFrequenciesByTime(-4));
    Assertions.assertArrayEquals(new double[]{2}, model.getFrequenciesByTime(3));
    Assertions.assertArrayEquals(new double[]{3}, model.getFrequenciesByTime(8));
    Assertions.assertNull(model.getFrequenciesByTime(Double.NaN));
  }

  @Test
  void testEqualDistanceKeepsFirstCalibration() {
    final CalibrationModel model = new CalibrationModel();
    model.setFrequencyCalibration("1", 0, calibration(0, 1));
    model.setFrequencyCalibration("2", 0, calibration(10, 2));
    model.setFrequencyCalibration("2", 1, calibration(10, 3));

    Assertions.assertArrayEquals(new double[]{1}, model.getFrequenciesByTime(5));
    Assertions.assertArrayEquals(new double[]{2}, model.getFrequenciesByTime(12));
  }

  @Test
  void testSortedPeaksOfAllRegions() {
    final CalibrationModel model = new CalibrationModel();
    model.setRayleighFit("1", 0, 0, PeakFit.single(50, 4, 1000, 10));
    model.setRayleighFit("1", 0, 1, PeakFit.single(550, 4, 1000, 10));
    model.setBrillouinFit("1", 0, 1, new PeakFit(new double[]{450, 350}, new double[]{4, 4},
        new double[]{100, 100}, 10));
    model.setBrillouinFit("1", 0, 0, new PeakFit(new double[]{150, 250}, new double[]{4, 4},
        new double[]{100, 100}, 10));

    Assertions.assertArrayEquals(new double[]{50, 150, 250, 350, 450, 550},
        model.getSortedPeaks("1", 0));
    Assertions.assertEquals(0, model.getSortedPeaks("1", 1).length);
  }

  @Test
  void testRegionsByIndex() {
    final CalibrationModel model = new CalibrationModel();
    model.setBrillouinRegion("1", 0, Range.closedOpen(10d, 20d));
    model.setBrillouinRegion("1", 1, Range.closedOpen(30d, 40d));
    model.setBrillouinRegion("1", 0, Range.closedOpen(12d, 20d));
    model.addRayleighRegion("2", Range.closedOpen(0d, 5d));
    model.addRayleighRegion("2", Range.closedOpen(3d, 8d));

    Assertions.assertEquals(List.of(Range.closedOpen(12d, 20d), Range.closedOpen(30d, 40d)),
        model.getBrillouinRegions("1"));
    Assertions.assertEquals(2, model.getRayleighRegions("2").size());
    Assertions.assertEquals(List.of("1", "2"), model.getRegionKeys());
  }

  @Test
  void testClearCalibrationKeepsRegions() {
    final CalibrationModel model = new CalibrationModel();
    model.setBrillouinRegion("1", 0, Range.closedOpen(10d, 20d));
    model.setBrillouinFit("1", 0, 0, PeakFit.single(15, 2, 100, 0));
    model.setFrequencyCalibration("1", 0, calibration(0, 1));

    model.clearCalibration("1");
    Assertions.assertFalse(model.hasFrequencyCalibration());
    Assertions.assertNull(model.getBrillouinFit("1", 0, 0));
    Assertions.assertEquals(1, model.getBrillouinRegions("1").size());
  }
}
