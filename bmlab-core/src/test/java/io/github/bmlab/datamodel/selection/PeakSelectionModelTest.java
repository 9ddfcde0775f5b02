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

package io.github.bmlab.datamodel.selection;

import com.google.common.collect.Range;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PeakSelectionModelTest {

  @Test
  void testOverlappingRegionsAreMerged() {
    final PeakSelectionModel model = new PeakSelectionModel();
    model.addBrillouinRegion(Range.closed(4.9, 7d));
    model.addBrillouinRegion(Range.closed(6d, 9d));
    Assertions.assertEquals(List.of(Range.closed(5d, 9d)), model.getBrillouinRegions());

    model.addBrillouinRegion(Range.closed(20d, 30d));
    Assertions.assertEquals(2, model.getBrillouinRegions().size());
  }

  @Test
  void testContainedRegionDoesNotChangeTheSelection() {
    final PeakSelectionModel model = new PeakSelectionModel();
    model.addRayleighRegion(Range.closed(1d, 3d));
    model.addRayleighRegion(Range.closed(2d, 3d));
    Assertions.assertEquals(List.of(Range.closed(1d, 3d)), model.getRayleighRegions());
  }

  @Test
  void testSetReplacesOrAppends() {
    final PeakSelectionModel model = new PeakSelectionModel();
    model.addBrillouinRegion(Range.closed(1d, 3d));
    model.setBrillouinRegion(0, Range.closed(2d, 5d));
    model.setBrillouinRegion(1, Range.closed(4d, 8d));
    Assertions.assertEquals(List.of(Range.closed(2d, 5d), Range.closed(4d, 8d)),
        model.getBrillouinRegions());

    model.clearBrillouinRegions();
    Assertions.assertTrue(model.getBrillouinRegions().isEmpty());
  }

  @Test
  void testSetRoundsEndpoints() {
    final PeakSelectionModel model = new PeakSelectionModel();
    model.addBrillouinRegion(Range.closed(6d, 9d));
    model.setBrillouinRegion(0, Range.closed(0.9, 3d));
    Assertions.assertEquals(List.of(Range.closed(1d, 3d)), model.getBrillouinRegions());

    model.setRayleighRegion(0, Range.closed(10.4, 12.6));
    Assertions.assertEquals(List.of(Range.closed(10d, 13d)), model.getRayleighRegions());
  }
}
