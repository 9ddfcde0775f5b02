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

package io.github.bmlab.datamodel.extraction;

import org.jetbrains.annotations.NotNull;

/**
 * Spectra extracted from the frames of one image.
 *
 * @param spectra     one intensity array per frame, indexed by pixel
 * @param times       acquisition time of each frame in seconds
 * @param intensities mean camera intensity of each frame
 */
public record ExtractedSpectra(double @NotNull [][] spectra, double @NotNull [] times,
                               double @NotNull [] intensities) {

  public ExtractedSpectra {
    if (spectra.length != times.length || spectra.length != intensities.length) {
      throw new IllegalArgumentException("Number of spectra, times and intensities differ");
    }
  }

  public int getNumberOfFrames() {
    return spectra.length;
  }

  /**
   * @return the mean spectrum over all frames
   */
  public double @NotNull [] averageSpectrum() {
    if (spectra.length == 0) {
      return new double[0];
    }
    final double[] mean = new double[spectra[0].length];
    for (final double[] spectrum : spectra) {
      for (int i = 0; i < mean.length; i++) {
        mean[i] += spectrum[i];
      }
    }
    for (int i = 0; i < mean.length; i++) {
      mean[i] /= spectra.length;
    }
    return mean;
  }
}
