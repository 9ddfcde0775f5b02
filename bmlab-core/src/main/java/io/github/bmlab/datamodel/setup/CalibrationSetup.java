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

package io.github.bmlab.datamodel.setup;

import org.jetbrains.annotations.NotNull;

/**
 * Known peaks of the calibration measurement. Peak i, ordered by pixel position, has the frequency
 * {@code f0 + shifts[i] + orders[i] * fsr}.
 *
 * @param numBrillouinSamples number of calibration samples, each contributing a Brillouin doublet
 * @param shifts              frequency shift of each calibration peak in Hz
 * @param orders              VIPA order of each calibration peak
 */
public record CalibrationSetup(int numBrillouinSamples, double @NotNull [] shifts,
                               double @NotNull [] orders) {

  public CalibrationSetup {
    if (shifts.length != orders.length) {
      throw new IllegalArgumentException("Calibration shifts and orders differ in length");
    }
  }

  public int getNumberOfPeaks() {
    return shifts.length;
  }
}
