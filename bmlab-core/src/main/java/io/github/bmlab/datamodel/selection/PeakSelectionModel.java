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
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Frequency regions in Hz that are fitted during the evaluation.
 */
public class PeakSelectionModel {

  private final List<Range<Double>> brillouinRegions = new ArrayList<>();
  private final List<Range<Double>> rayleighRegions = new ArrayList<>();

  /**
   * Rounds the region to whole Hz and merges it into the first region it overlaps with.
   */
  public synchronized void addBrillouinRegion(@NotNull Range<Double> region) {
    addRegion(brillouinRegions, region);
  }

  public synchronized void addRayleighRegion(@NotNull Range<Double> region) {
    addRegion(rayleighRegions, region);
  }

  /**
   * Rounds the region to whole Hz and replaces the region at index without merging. Index equal to
   * the number of regions appends.
   */
  public synchronized void setBrillouinRegion(int index, @NotNull Range<Double> region) {
    setRegion(brillouinRegions, index, region);
  }

  public synchronized void setRayleighRegion(int index, @NotNull Range<Double> region) {
    setRegion(rayleighRegions, index, region);
  }

  public synchronized @NotNull List<Range<Double>> getBrillouinRegions() {
    return List.copyOf(brillouinRegions);
  }

  public synchronized @NotNull List<Range<Double>> getRayleighRegions() {
    return List.copyOf(rayleighRegions);
  }

  public synchronized void clearBrillouinRegions() {
    brillouinRegions.clear();
  }

  public synchronized void clearRayleighRegions() {
    rayleighRegions.clear();
  }

  private static void addRegion(List<Range<Double>> regions, Range<Double> region) {
    final Range<Double> rounded = round(region);
    for (int i = 0; i < regions.size(); i++) {
      final Range<Double> existing = regions.get(i);
      if (existing.isConnected(rounded)) {
        regions.set(i, existing.span(rounded));
        return;
      }
    }
    regions.add(rounded);
  }

  private static void setRegion(List<Range<Double>> regions, int index, Range<Double> region) {
    final Range<Double> rounded = round(region);
    if (index == regions.size()) {
      regions.add(rounded);
    } else {
      regions.set(index, rounded);
    }
  }

  private static Range<Double> round(Range<Double> region) {
    final double lower = Math.round(region.lowerEndpoint());
    final double upper = Math.round(region.upperEndpoint());
    return Range.closed(Math.min(lower, upper), Math.max(lower, upper));
  }
}
