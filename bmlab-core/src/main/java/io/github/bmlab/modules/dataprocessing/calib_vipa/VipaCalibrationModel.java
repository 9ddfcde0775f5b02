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

package io.github.bmlab.modules.dataprocessing.calib_vipa;

import io.github.bmlab.datamodel.setup.CalibrationSetup;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Transfer function of the VIPA spectrometer. The frequency at pixel x is
 * <pre>
 *   VIPA(x) = f0 + c + b * x + a * x^2
 * </pre>
 * and the calibration peak i appears at {@code f0 + shifts[i] + orders[i] * fsr}. The parameters
 * are stored as {@code [c, b, a, fsr]}.
 */
public class VipaCalibrationModel {

  private static final Logger logger = Logger.getLogger(VipaCalibrationModel.class.getName());

  public static final int NUMBER_OF_PARAMETERS = 4;
  public static final int FSR_INDEX = 3;

  private VipaCalibrationModel() {
  }

  /**
   * Solves the linear least squares problem {@code c + b x_i + a x_i^2 - orders_i fsr = shifts_i}
   * by singular value decomposition. The pixel positions are scaled to the unit interval for the
   * decomposition.
   *
   * @param sortedPeaks fitted peak positions of one calibration frame in pixels, ascending
   * @return the parameters or null if the peaks do not match the setup or the system is
   * degenerate
   */
  public static double @Nullable [] fit(final double @NotNull [] sortedPeaks,
      @NotNull CalibrationSetup setup) {
    final int n = sortedPeaks.length;
    if (n != setup.getNumberOfPeaks()) {
      logger.fine(() -> "Found " + n + " calibration peaks, the setup defines "
          + setup.getNumberOfPeaks());
      return null;
    }
    if (n < NUMBER_OF_PARAMETERS) {
      return null;
    }
    double scale = 0;
    for (final double peak : sortedPeaks) {
      if (!Double.isFinite(peak)) {
        return null;
      }
      scale = Math.max(scale, Math.abs(peak));
    }
    if (scale == 0) {
      return null;
    }

    final RealMatrix design = new Array2DRowRealMatrix(n, NUMBER_OF_PARAMETERS);
    final RealVector target = new ArrayRealVector(n);
    for (int i = 0; i < n; i++) {
      final double u = sortedPeaks[i] / scale;
      design.setEntry(i, 0, 1);
      design.setEntry(i, 1, u);
      design.setEntry(i, 2, u * u);
      design.setEntry(i, 3, -setup.orders()[i]);
      target.setEntry(i, setup.shifts()[i]);
    }

    final SingularValueDecomposition svd = new SingularValueDecomposition(design);
    if (svd.getRank() < NUMBER_OF_PARAMETERS) {
      logger.fine("VIPA fit is rank deficient");
      return null;
    }
    final DecompositionSolver solver = svd.getSolver();
    final double[] solution = solver.solve(target).toArray();

    return new double[]{solution[0], solution[1] / scale, solution[2] / (scale * scale),
        solution[3]};
  }

  /**
   * @return frequency relative to f0 in Hz at the pixel position
   */
  public static double relativeFrequency(final double @NotNull [] params, double pixel) {
    return params[0] + params[1] * pixel + params[2] * pixel * pixel;
  }

  /**
   * @return frequency relative to f0 of every pixel of a spectrum
   */
  public static double @NotNull [] frequencyAxis(final double @NotNull [] params, int length) {
    final double[] axis = new double[length];
    for (int i = 0; i < length; i++) {
      axis[i] = relativeFrequency(params, i);
    }
    return axis;
  }

  /**
   * @return frequency of each calibration peak relative to f0
   */
  public static double @NotNull [] expectedFrequencies(final double @NotNull [] params,
      @NotNull CalibrationSetup setup) {
    final double[] expected = new double[setup.getNumberOfPeaks()];
    for (int i = 0; i < expected.length; i++) {
      expected[i] = setup.shifts()[i] + setup.orders()[i] * params[FSR_INDEX];
    }
    return expected;
  }
}
