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

import org.jetbrains.annotations.NotNull;

/**
 * All quantities stored during the evaluation. Frequencies are stored in Hz and displayed in GHz.
 */
public enum ResultQuantity {

  BRILLOUIN_SHIFT_F("Brillouin frequency shift", "GHz", 1e-9, RegionKind.BRILLOUIN),
  BRILLOUIN_PEAK_POSITION_F("Brillouin peak position", "GHz", 1e-9, RegionKind.BRILLOUIN),
  BRILLOUIN_PEAK_FWHM_F("Brillouin peak width", "GHz", 1e-9, RegionKind.BRILLOUIN),
  BRILLOUIN_PEAK_INTENSITY("Brillouin peak intensity", "a.u.", 1, RegionKind.BRILLOUIN),
  BRILLOUIN_PEAK_OFFSET("Brillouin peak offset", "a.u.", 1, RegionKind.BRILLOUIN),
  RAYLEIGH_PEAK_POSITION_F("Rayleigh peak position", "GHz", 1e-9, RegionKind.RAYLEIGH),
  RAYLEIGH_PEAK_FWHM_F("Rayleigh peak width", "GHz", 1e-9, RegionKind.RAYLEIGH),
  RAYLEIGH_PEAK_INTENSITY("Rayleigh peak intensity", "a.u.", 1, RegionKind.RAYLEIGH),
  RAYLEIGH_PEAK_OFFSET("Rayleigh peak offset", "a.u.", 1, RegionKind.RAYLEIGH),
  RAYLEIGH_SHIFT("Rayleigh peak drift", "GHz", 1e-9, RegionKind.RAYLEIGH),
  TIME("Time", "s", 1, RegionKind.NONE),
  INTENSITY("Intensity", "a.u.", 1, RegionKind.NONE);

  private final String label;
  private final String unit;
  private final double scaling;
  private final RegionKind regionKind;

  ResultQuantity(String label, String unit, double scaling, RegionKind regionKind) {
    this.label = label;
    this.unit = unit;
    this.scaling = scaling;
    this.regionKind = regionKind;
  }

  public @NotNull String getLabel() {
    return label;
  }

  public @NotNull String getUnit() {
    return unit;
  }

  /**
   * Factor from the stored value to the display unit.
   */
  public double getScaling() {
    return scaling;
  }

  public @NotNull RegionKind getRegionKind() {
    return regionKind;
  }

  @Override
  public String toString() {
    return label + " [" + unit + "]";
  }

  /**
   * Which regions span the region axis of the tensor.
   */
  public enum RegionKind {
    BRILLOUIN, RAYLEIGH, NONE
  }
}
