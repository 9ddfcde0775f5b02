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

import io.github.bmlab.parameters.impl.SimpleParameterSet;
import io.github.bmlab.parameters.parametertypes.BooleanParameter;
import io.github.bmlab.parameters.parametertypes.DoubleParameter;
import java.text.DecimalFormat;

public class CalibrationParameters extends SimpleParameterSet {

  public static final BooleanParameter findRegions = new BooleanParameter("Find regions",
      "Detect the Rayleigh and Brillouin regions of every calibration image before fitting. "
          + "If disabled, regions that were set before are used.", true);

  public static final DoubleParameter minHeight = new DoubleParameter("Minimum height",
      "Minimum peak height above the median of the calibration spectrum.",
      new DecimalFormat("#.#"), 15d, 0d, Double.MAX_VALUE);

  public static final DoubleParameter minProminence = new DoubleParameter("Minimum prominence",
      "Minimum prominence of a calibration peak.", new DecimalFormat("#.#"), 15d, 0d,
      Double.MAX_VALUE);

  public CalibrationParameters() {
    super(findRegions, minHeight, minProminence);
  }
}
