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

import io.github.bmlab.datamodel.evaluation.EvaluationModel;
import io.github.bmlab.datamodel.evaluation.ResultQuantity;
import io.github.bmlab.datamodel.evaluation.ResultTensor;
import org.jetbrains.annotations.NotNull;

/**
 * Calculates the Brillouin shift of every fitted Brillouin peak as the distance to the closest
 * Rayleigh peak of the same scan point and frame.
 */
public class DerivedValuesCalculator {

  private DerivedValuesCalculator() {
  }

  /**
   * Writes {@link ResultQuantity#BRILLOUIN_SHIFT_F}. Does nothing until Brillouin and Rayleigh
   * positions exist.
   */
  public static void calculate(@NotNull EvaluationModel model) {
    final ResultTensor brillouin = model.getTensor(ResultQuantity.BRILLOUIN_PEAK_POSITION_F);
    final ResultTensor rayleigh = model.getTensor(ResultQuantity.RAYLEIGH_PEAK_POSITION_F);
    final ResultTensor shift = model.getTensor(ResultQuantity.BRILLOUIN_SHIFT_F);
    if (brillouin == null || rayleigh == null || shift == null) {
      return;
    }
    final int[] shape = brillouin.getShape();
    final int rayleighRegions = rayleigh.getShape(4);
    for (int x = 0; x < shape[0]; x++) {
      for (int y = 0; y < shape[1]; y++) {
        for (int z = 0; z < shape[2]; z++) {
          for (int f = 0; f < shape[3]; f++) {
            for (int r = 0; r < shape[4]; r++) {
              for (int p = 0; p < shape[5]; p++) {
                final double position = brillouin.get(x, y, z, f, r, p);
                double min = Double.NaN;
                for (int q = 0; q < rayleighRegions; q++) {
                  final double distance = Math.abs(position - rayleigh.get(x, y, z, f, q, 0));
                  if (!Double.isNaN(distance) && (Double.isNaN(min) || distance < min)) {
                    min = distance;
                  }
                }
                shift.set(x, y, z, f, r, p, min);
              }
            }
          }
        }
      }
    }
  }
}
