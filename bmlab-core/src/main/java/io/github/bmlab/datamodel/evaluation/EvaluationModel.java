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

package io.github.bmlab.datamodel.evaluation;

import io.github.bmlab.datamodel.evaluation.ResultQuantity.RegionKind;
import io.github.bmlab.datamodel.fit.PeakFit;
import io.github.bmlab.util.MathUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Evaluation results of one repetition, one {@link ResultTensor} per {@link ResultQuantity}.
 */
public class EvaluationModel {

  private static final String[] AXIS_LABELS = {"x", "y", "z"};

  private final Map<ResultQuantity, ResultTensor> results = new EnumMap<>(ResultQuantity.class);

  /**
   * Allocates all tensors filled with NaN. The peak axis of Brillouin quantities holds the single
   * peak fit at index 0 followed by the peaks of the multi-peak fit, if more than one peak is
   * fitted.
   *
   * @param resolution         scan points along x, y and z
   * @param frames             frames per image
   * @param brillouinRegions   number of Brillouin regions
   * @param rayleighRegions    number of Rayleigh regions
   * @param brillouinPeaks     number of peaks fitted per Brillouin region
   */
  public synchronized void initializeResults(int @NotNull [] resolution, int frames,
      int brillouinRegions, int rayleighRegions, int brillouinPeaks) {
    results.clear();
    final int peakAxis = brillouinPeaks == 1 ? 1 : brillouinPeaks + 1;
    for (final ResultQuantity quantity : ResultQuantity.values()) {
      final int[] shape = switch (quantity.getRegionKind()) {
        case BRILLOUIN -> new int[]{resolution[0], resolution[1], resolution[2], frames,
            brillouinRegions, peakAxis};
        case RAYLEIGH -> new int[]{resolution[0], resolution[1], resolution[2], frames,
            rayleighRegions, 1};
        case NONE -> new int[]{resolution[0], resolution[1], resolution[2], frames, 1, 1};
      };
      results.put(quantity, new ResultTensor(shape));
    }
  }

  /**
   * Drops all results, for example after a new calibration.
   */
  public synchronized void invalidateResults() {
    results.clear();
  }

  public synchronized boolean hasResults() {
    return !results.isEmpty();
  }

  public synchronized @Nullable ResultTensor getTensor(@NotNull ResultQuantity quantity) {
    return results.get(quantity);
  }

  public synchronized void setTensor(@NotNull ResultQuantity quantity,
      @NotNull ResultTensor tensor) {
    results.put(quantity, tensor);
  }

  /**
   * @return number of peaks of the multi-peak fit or 1 if only single peaks were fitted
   */
  public synchronized int getNumberOfBrillouinPeaks() {
    final ResultTensor tensor = results.get(ResultQuantity.BRILLOUIN_PEAK_POSITION_F);
    if (tensor == null || tensor.getShape(5) <= 1) {
      return 1;
    }
    return tensor.getShape(5) - 1;
  }

  /**
   * Fits stored for one scan point, indexed [frame][region]. Brillouin fits hold the peaks of the
   * multi-peak fit if one was made, otherwise the single peak fit.
   *
   * @return the fits or null if there are no results
   */
  public synchronized PeakFit @Nullable [][] getFits(@NotNull RegionKind kind, int x, int y,
      int z) {
    final ResultTensor position;
    final ResultTensor fwhm;
    final ResultTensor intensity;
    final ResultTensor offset;
    switch (kind) {
      case BRILLOUIN -> {
        position = results.get(ResultQuantity.BRILLOUIN_PEAK_POSITION_F);
        fwhm = results.get(ResultQuantity.BRILLOUIN_PEAK_FWHM_F);
        intensity = results.get(ResultQuantity.BRILLOUIN_PEAK_INTENSITY);
        offset = results.get(ResultQuantity.BRILLOUIN_PEAK_OFFSET);
      }
      case RAYLEIGH -> {
        position = results.get(ResultQuantity.RAYLEIGH_PEAK_POSITION_F);
        fwhm = results.get(ResultQuantity.RAYLEIGH_PEAK_FWHM_F);
        intensity = results.get(ResultQuantity.RAYLEIGH_PEAK_INTENSITY);
        offset = results.get(ResultQuantity.RAYLEIGH_PEAK_OFFSET);
      }
      default -> throw new IllegalArgumentException("No fits are stored for " + kind);
    }
    if (position == null) {
      return null;
    }

    final int storedPeaks = position.getShape(5);
    final int fromPeak = storedPeaks > 1 ? 1 : 0;
    final int numPeaks = storedPeaks - fromPeak;
    final PeakFit[][] fits = new PeakFit[position.getShape(3)][position.getShape(4)];
    for (int f = 0; f < fits.length; f++) {
      for (int r = 0; r < fits[f].length; r++) {
        final double[] centers = new double[numPeaks];
        final double[] fwhms = new double[numPeaks];
        final double[] intensities = new double[numPeaks];
        for (int p = 0; p < numPeaks; p++) {
          centers[p] = position.get(x, y, z, f, r, fromPeak + p);
          fwhms[p] = fwhm.get(x, y, z, f, r, fromPeak + p);
          intensities[p] = intensity.get(x, y, z, f, r, fromPeak + p);
        }
        fits[f][r] = new PeakFit(centers, fwhms, intensities, offset.get(x, y, z, f, r, fromPeak));
      }
    }
    return fits;
  }

  /**
   * Reduces a quantity to one value per scan point by averaging over frames and regions.
   * <p>
   * With a multi-peak fit, peak indices below the stored peak count select that peak, the stored
   * peak count selects the mean of all multi-peak fits and the stored peak count plus one the
   * average weighted by intensity times width. Every other index selects the single peak fit.
   *
   * @param positions stage positions passed through to the result, may be null
   */
  public synchronized @NotNull EvaluatedData getData(@NotNull ResultQuantity quantity,
      int peakIndex, int @NotNull [] resolution, @Nullable List<double[][][]> positions) {
    final double[][][] data = new double[resolution[0]][resolution[1]][resolution[2]];
    final ResultTensor tensor = results.get(quantity);
    for (int x = 0; x < resolution[0]; x++) {
      for (int y = 0; y < resolution[1]; y++) {
        if (tensor == null) {
          Arrays.fill(data[x][y], Double.NaN);
          continue;
        }
        for (int z = 0; z < resolution[2]; z++) {
          data[x][y][z] = pointValue(quantity, tensor, peakIndex, x, y, z)
              * quantity.getScaling();
        }
      }
    }

    int dimensionality = 0;
    final List<String> labels = new ArrayList<>(3);
    for (int axis = 0; axis < 3; axis++) {
      if (resolution[axis] > 1) {
        dimensionality++;
      }
      labels.add(AXIS_LABELS[axis] + " [µm]");
    }
    return new EvaluatedData(data, positions, dimensionality, labels);
  }

  private double pointValue(ResultQuantity quantity, ResultTensor tensor, int peakIndex, int x,
      int y, int z) {
    final int frames = tensor.getShape(3);
    final int regions = tensor.getShape(4);
    final int storedPeaks = tensor.getShape(5);
    final List<Double> values = new ArrayList<>();

    if (storedPeaks > 1 && peakIndex == storedPeaks + 1
        && quantity.getRegionKind() == RegionKind.BRILLOUIN) {
      final ResultTensor intensity = results.get(ResultQuantity.BRILLOUIN_PEAK_INTENSITY);
      final ResultTensor fwhm = results.get(ResultQuantity.BRILLOUIN_PEAK_FWHM_F);
      for (int f = 0; f < frames; f++) {
        for (int r = 0; r < regions; r++) {
          double weightedSum = 0;
          double weightSum = 0;
          for (int p = 1; p < storedPeaks; p++) {
            final double w = intensity.get(x, y, z, f, r, p) * fwhm.get(x, y, z, f, r, p);
            final double d = tensor.get(x, y, z, f, r, p);
            if (!Double.isNaN(w)) {
              weightSum += w;
              if (!Double.isNaN(d)) {
                weightedSum += d * w;
              }
            }
          }
          values.add(weightedSum / weightSum);
        }
      }
    } else {
      final int fromPeak;
      final int toPeak;
      if (storedPeaks > 1 && peakIndex >= 0 && peakIndex < storedPeaks) {
        fromPeak = peakIndex;
        toPeak = peakIndex + 1;
      } else if (storedPeaks > 1 && peakIndex == storedPeaks) {
        fromPeak = 1;
        toPeak = storedPeaks;
      } else {
        fromPeak = 0;
        toPeak = 1;
      }
      for (int f = 0; f < frames; f++) {
        for (int r = 0; r < regions; r++) {
          for (int p = fromPeak; p < toPeak; p++) {
            values.add(tensor.get(x, y, z, f, r, p));
          }
        }
      }
    }
    return MathUtils.nanMean(values.stream().mapToDouble(Double::doubleValue).toArray());
  }
}
