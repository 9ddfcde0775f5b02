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

import io.github.bmlab.modules.BmlabProcessingModule;
import io.github.bmlab.parameters.ParameterSet;
import io.github.bmlab.project.BrillouinSession;
import io.github.bmlab.project.RepetitionData;
import io.github.bmlab.taskcontrol.Task;
import io.github.bmlab.util.ExitCode;
import java.time.Instant;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;

public class CalibrationModule implements BmlabProcessingModule {

  private static final String MODULE_NAME = "VIPA calibration";
  private static final String DESCRIPTION = "Detects the calibration peaks and fits the pixel to frequency mapping of every calibration image.";

  @Override
  public @NotNull String getName() {
    return MODULE_NAME;
  }

  @Override
  public @NotNull String getDescription() {
    return DESCRIPTION;
  }

  @Override
  public @NotNull Class<? extends ParameterSet> getParameterSetClass() {
    return CalibrationParameters.class;
  }

  @Override
  public @NotNull ExitCode runModule(@NotNull BrillouinSession session,
      @NotNull ParameterSet parameters, @NotNull Collection<Task> tasks,
      @NotNull Instant moduleCallDate) {
    if (session.getSetup() == null) {
      return ExitCode.ERROR;
    }
    for (final RepetitionData repetition : session.getRepetitions()) {
      if (repetition.getCalibrationSource() == null) {
        continue;
      }
      tasks.add(new CalibrationTask(session, repetition, parameters, moduleCallDate));
    }
    return ExitCode.OK;
  }
}
