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

import io.github.bmlab.modules.BmlabProcessingModule;
import io.github.bmlab.parameters.ParameterSet;
import io.github.bmlab.project.BrillouinSession;
import io.github.bmlab.project.RepetitionData;
import io.github.bmlab.taskcontrol.Task;
import io.github.bmlab.util.ExitCode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

public class BrillouinEvaluationModule implements BmlabProcessingModule {

  private static final Logger logger = Logger.getLogger(BrillouinEvaluationModule.class.getName());

  private static final String MODULE_NAME = "Brillouin evaluation";
  private static final String DESCRIPTION = "Fits the Brillouin and Rayleigh peaks of every scan point and calculates the Brillouin shift.";

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
    return BrillouinEvaluationParameters.class;
  }

  @Override
  public @NotNull ExitCode runModule(@NotNull BrillouinSession session,
      @NotNull ParameterSet parameters, @NotNull Collection<Task> tasks,
      @NotNull Instant moduleCallDate) {
    final List<String> errors = new ArrayList<>();
    if (!parameters.checkParameterValues(errors)) {
      logger.warning("Cannot start " + MODULE_NAME + ": " + String.join(", ", errors));
      return ExitCode.ERROR;
    }
    for (final RepetitionData repetition : session.getRepetitions()) {
      if (repetition.getPayloadSource() == null) {
        continue;
      }
      tasks.add(new BrillouinEvaluationTask(repetition, parameters, moduleCallDate));
    }
    return ExitCode.OK;
  }
}
