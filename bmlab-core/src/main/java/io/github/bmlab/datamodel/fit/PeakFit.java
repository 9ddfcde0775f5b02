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

package io.github.bmlab.datamodel.fit;

import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Lorentzian peaks sharing one constant offset. Centers and widths are in the unit of the axis
 * that was fitted, pixels for calibration fits and Hz for evaluation fits.
 */
public record PeakFit(double @NotNull [] centers, double @NotNull [] fwhms,
                      double @NotNull [] intensities, double offset) {

  public PeakFit {
    if (centers.length != fwhms.length || centers.length != intensities.length) {
      throw new IllegalArgumentException("All peak parameters need one value per peak");
    }
  }

  public static @NotNull PeakFit single(double center, double fwhm, double intensity,
      double offset) {
    return new PeakFit(new double[]{center}, new double[]{fwhm}, new double[]{intensity}, offset);
  }

  /**
   * A fit that did not converge. All values are NaN.
   */
  public static @NotNull PeakFit missing(int numberOfPeaks) {
    final double[] nan = new double[numberOfPeaks];
    Arrays.fill(nan, Double.NaN);
    return new PeakFit(nan, nan.clone(), nan.clone(), Double.NaN);
  }

  public int getNumberOfPeaks() {
    return centers.length;
  }

  public double center() {
    return centers[0];
  }

  public double fwhm() {
    return fwhms[0];
  }

  public double intensity() {
    return intensities[0];
  }

  public boolean isMissing() {
    return Double.isNaN(offset);
  }

  /**
   * @return value of the fitted model at x
   */
  public double value(double x) {
    double y = offset;
    for (int i = 0; i < centers.length; i++) {
      final double hwhm = fwhms[i] / 2;
      final double d = x - centers[i];
      y += intensities[i] * hwhm * hwhm / (d * d + hwhm * hwhm);
    }
    return y;
  }
}
