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

package io.github.bmlab.modules.dataprocessing.eval_brillouin;

import io.github.bmlab.parameters.impl.SimpleParameterSet;
import io.github.bmlab.parameters.parametertypes.IntegerParameter;
import io.github.bmlab.parameters.parametertypes.OptionalParameter;
import io.github.bmlab.parameters.parametertypes.PeakBoundsParameter;

public class BrillouinEvaluationParameters extends SimpleParameterSet {

  public static final IntegerParameter brillouinPeaks = new IntegerParameter(
      "Number of Brillouin peaks",
      "Number of peaks fitted per Brillouin region. With more than one peak, the single peak fit "
          + "is followed by a multi-peak fit.", 1, 1, 10);

  public static final OptionalParameter<PeakBoundsParameter> centerBounds = new OptionalParameter<>(
      new PeakBoundsParameter("Peak position bounds",
          "Bounds of the Brillouin shift of every peak of the multi-peak fit in GHz. "
              + "Tokens are numbers, min, max, Inf and -Inf, e.g. 'min,5;5,max'."));

  public static final OptionalParameter<PeakBoundsParameter> fwhmBounds = new OptionalParameter<>(
      new PeakBoundsParameter("Peak width bounds",
          "Bounds of the full width at half maximum of every peak of the multi-peak fit in GHz."));

  public BrillouinEvaluationParameters() {
    super(brillouinPeaks, centerBounds, fwhmBounds);
  }
}
