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

import com.google.common.collect.Range;
import io.github.bmlab.datamodel.fit.PeakFit;
import io.github.bmlab.modules.dataprocessing.fit_lorentz.LorentzianRegionFitter;
import io.github.bmlab.util.exceptions.FitDidNotConvergeException;
import java.util.concurrent.Callable;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Fits one region of one frame. Failed fits return {@link PeakFit#missing(int)}.
 */
record RegionFitTask(@NotNull Range<Double> region, double @NotNull [] frequencies,
                     double @NotNull [] spectrum, int numPeaks,
                     double @Nullable [][] centerBounds,
                     double @Nullable [][] fwhmBounds) implements Callable<PeakFit> {

  private static final Logger logger = Logger.getLogger(RegionFitTask.class.getName());

  RegionFitTask(@NotNull Range<Double> region, double @NotNull [] frequencies,
      double @NotNull [] spectrum) {
    this(region, frequencies, spectrum, 1, null, null);
  }

  @Override
  public PeakFit call() {
    try {
      return LorentzianRegionFitter.fit(region, frequencies, spectrum, numPeaks, centerBounds,
          fwhmBounds);
    } catch (FitDidNotConvergeException e) {
      logger.finest(() -> "Fit in region " + region + " failed: " + e.getMessage());
      return PeakFit.missing(numPeaks);
    }
  }
}
