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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Calibration state of one repetition. Regions are half open pixel intervals per calibration key.
 * Fits are stored per calibration key, frame and region index. The frequency calibration of each
 * frame is kept together with its acquisition time so that payload frames can be matched to the
 * closest calibration.
 */
public class CalibrationModel {

  private final Map<String, List<Range<Double>>> brillouinRegions = new LinkedHashMap<>();
  private final Map<String, List<Range<Double>>> rayleighRegions = new LinkedHashMap<>();
  private final Map<String, Map<Integer, Map<Integer, PeakFit>>> brillouinFits = new LinkedHashMap<>();
  private final Map<String, Map<Integer, Map<Integer, PeakFit>>> rayleighFits = new LinkedHashMap<>();
  private final Map<String, NavigableMap<Integer, FrequencyCalibration>> frequencyCalibrations = new LinkedHashMap<>();

  public synchronized void setBrillouinRegions(@NotNull String calibKey,
      @NotNull List<Range<Double>> regions) {
    brillouinRegions.put(calibKey, new ArrayList<>(regions));
  }

  public synchronized void setRayleighRegions(@NotNull String calibKey,
      @NotNull List<Range<Double>> regions) {
    rayleighRegions.put(calibKey, new ArrayList<>(regions));
  }

  /**
   * Replaces the region at index or appends it if index equals the number of regions.
   */
  public synchronized void setBrillouinRegion(@NotNull String calibKey, int index,
      @NotNull Range<Double> region) {
    setRegion(brillouinRegions, calibKey, index, region);
  }

  public synchronized void setRayleighRegion(@NotNull String calibKey, int index,
      @NotNull Range<Double> region) {
    setRegion(rayleighRegions, calibKey, index, region);
  }

  /**
   * Appends a region. Overlapping regions are kept as they are.
   */
  public synchronized void addBrillouinRegion(@NotNull String calibKey,
      @NotNull Range<Double> region) {
    brillouinRegions.computeIfAbsent(calibKey, k -> new ArrayList<>()).add(region);
  }

  public synchronized void addRayleighRegion(@NotNull String calibKey,
      @NotNull Range<Double> region) {
    rayleighRegions.computeIfAbsent(calibKey, k -> new ArrayList<>()).add(region);
  }

  private static void setRegion(Map<String, List<Range<Double>>> regions, String calibKey,
      int index, Range<Double> region) {
    final List<Range<Double>> list = regions.computeIfAbsent(calibKey, k -> new ArrayList<>());
    if (index == list.size()) {
      list.add(region);
    } else {
      list.set(index, region);
    }
  }

  public synchronized @NotNull List<Range<Double>> getBrillouinRegions(@NotNull String calibKey) {
    return List.copyOf(brillouinRegions.getOrDefault(calibKey, List.of()));
  }

  public synchronized @NotNull List<Range<Double>> getRayleighRegions(@NotNull String calibKey) {
    return List.copyOf(rayleighRegions.getOrDefault(calibKey, List.of()));
  }

  public synchronized @NotNull List<String> getRegionKeys() {
    final List<String> keys = new ArrayList<>(brillouinRegions.keySet());
    for (final String key : rayleighRegions.keySet()) {
      if (!keys.contains(key)) {
        keys.add(key);
      }
    }
    return keys;
  }

  public synchronized void setBrillouinFit(@NotNull String calibKey, int frame, int region,
      @NotNull PeakFit fit) {
    brillouinFits.computeIfAbsent(calibKey, k -> new TreeMap<>())
        .computeIfAbsent(frame, f -> new TreeMap<>()).put(region, fit);
  }

  public synchronized void setRayleighFit(@NotNull String calibKey, int frame, int region,
      @NotNull PeakFit fit) {
    rayleighFits.computeIfAbsent(calibKey, k -> new TreeMap<>())
        .computeIfAbsent(frame, f -> new TreeMap<>()).put(region, fit);
  }

  public synchronized @Nullable PeakFit getBrillouinFit(@NotNull String calibKey, int frame,
      int region) {
    return getFit(brillouinFits, calibKey, frame, region);
  }

  public synchronized @Nullable PeakFit getRayleighFit(@NotNull String calibKey, int frame,
      int region) {
    return getFit(rayleighFits, calibKey, frame, region);
  }

  private static PeakFit getFit(Map<String, Map<Integer, Map<Integer, PeakFit>>> fits,
      String calibKey, int frame, int region) {
    final Map<Integer, Map<Integer, PeakFit>> frames = fits.get(calibKey);
    if (frames == null || !frames.containsKey(frame)) {
      return null;
    }
    return frames.get(frame).get(region);
  }

  /**
   * @return all frames with fits for this calibration key mapped to region index and fit
   */
  public synchronized @NotNull Map<Integer, Map<Integer, PeakFit>> getBrillouinFits(
      @NotNull String calibKey) {
    return copyFits(brillouinFits.get(calibKey));
  }

  public synchronized @NotNull Map<Integer, Map<Integer, PeakFit>> getRayleighFits(
      @NotNull String calibKey) {
    return copyFits(rayleighFits.get(calibKey));
  }

  private static Map<Integer, Map<Integer, PeakFit>> copyFits(
      @Nullable Map<Integer, Map<Integer, PeakFit>> fits) {
    final Map<Integer, Map<Integer, PeakFit>> copy = new TreeMap<>();
    if (fits != null) {
      fits.forEach((frame, regions) -> copy.put(frame, new TreeMap<>(regions)));
    }
    return copy;
  }

  /**
   * Removes all fits of the calibration key. Regions are kept.
   */
  public synchronized void clearFits(@NotNull String calibKey) {
    brillouinFits.remove(calibKey);
    rayleighFits.remove(calibKey);
  }

  /**
   * Positions of all Rayleigh and Brillouin peaks fitted in one frame, ascending. NaN positions of
   * failed fits are sorted to the end.
   */
  public synchronized double @NotNull [] getSortedPeaks(@NotNull String calibKey, int frame) {
    final List<Double> peaks = new ArrayList<>();
    collectCenters(rayleighFits, calibKey, frame, peaks);
    collectCenters(brillouinFits, calibKey, frame, peaks);
    final double[] sorted = peaks.stream().mapToDouble(Double::doubleValue).toArray();
    Arrays.sort(sorted);
    return sorted;
  }

  private static void collectCenters(Map<String, Map<Integer, Map<Integer, PeakFit>>> fits,
      String calibKey, int frame, List<Double> peaks) {
    final Map<Integer, Map<Integer, PeakFit>> frames = fits.get(calibKey);
    if (frames == null || !frames.containsKey(frame)) {
      return;
    }
    for (final PeakFit fit : frames.get(frame).values()) {
      for (final double center : fit.centers()) {
        peaks.add(center);
      }
    }
  }

  public synchronized void setFrequencyCalibration(@NotNull String calibKey, int frame,
      @NotNull FrequencyCalibration calibration) {
    frequencyCalibrations.computeIfAbsent(calibKey, k -> new TreeMap<>()).put(frame, calibration);
  }

  public synchronized @Nullable FrequencyCalibration getFrequencyCalibration(
      @NotNull String calibKey, int frame) {
    final NavigableMap<Integer, FrequencyCalibration> frames = frequencyCalibrations.get(calibKey);
    return frames == null ? null : frames.get(frame);
  }

  public synchronized @NotNull Map<String, NavigableMap<Integer, FrequencyCalibration>> getFrequencyCalibrations() {
    final Map<String, NavigableMap<Integer, FrequencyCalibration>> copy = new LinkedHashMap<>();
    frequencyCalibrations.forEach((key, frames) -> copy.put(key, new TreeMap<>(frames)));
    return copy;
  }

  public synchronized boolean hasFrequencyCalibration() {
    return frequencyCalibrations.values().stream().anyMatch(frames -> !frames.isEmpty());
  }

  /**
   * Frequency axis of the calibration frame acquired closest to the given time. Ties are resolved
   * in favor of the calibration key added first, then the lower frame index.
   *
   * @return the frequency axis or null if there is no calibration
   */
  public synchronized double @Nullable [] getFrequenciesByTime(double time) {
    if (Double.isNaN(time)) {
      return null;
    }
    FrequencyCalibration closest = null;
    double minDistance = Double.POSITIVE_INFINITY;
    for (final NavigableMap<Integer, FrequencyCalibration> frames : frequencyCalibrations.values()) {
      for (final Entry<Integer, FrequencyCalibration> entry : frames.entrySet()) {
        final double distance = Math.abs(entry.getValue().time() - time);
        if (distance < minDistance || (closest == null && !Double.isNaN(distance))) {
          minDistance = distance;
          closest = entry.getValue();
        }
      }
    }
    return closest == null ? null : closest.frequencies();
  }

  /**
   * Drops fits, VIPA parameters and frequency axes of the calibration key.
   */
  public synchronized void clearCalibration(@NotNull String calibKey) {
    clearFits(calibKey);
    frequencyCalibrations.remove(calibKey);
  }
}
