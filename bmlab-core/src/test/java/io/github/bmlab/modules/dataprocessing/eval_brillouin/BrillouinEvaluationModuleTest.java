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

import io.github.bmlab.TestSpectra.MapPayloadSource;
import io.github.bmlab.parameters.ParameterSet;
import io.github.bmlab.project.BrillouinSession;
import io.github.bmlab.project.RepetitionData;
import io.github.bmlab.taskcontrol.Task;
import io.github.bmlab.util.ExitCode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BrillouinEvaluationModuleTest {

  @Test
  void testRunModuleCreatesTaskAndReturnsOK() {
    BrillouinSession session = new BrillouinSession();
    session.addRepetition(new RepetitionData("0", null, new MapPayloadSource(1, 1, 1)));
    session.addRepetition(new RepetitionData("1"));

    BrillouinEvaluationModule module = new BrillouinEvaluationModule();
    Collection<Task> tasks = new ArrayList<>();
    ExitCode code = module.runModule(session, new BrillouinEvaluationParameters(), tasks,
        Instant.now());

    Assertions.assertEquals(ExitCode.OK, code);
    Assertions.assertEquals(1, tasks.size());
    Assertions.assertTrue(tasks.iterator().next() instanceof BrillouinEvaluationTask);
  }

  @Test
  void testEmptyBoundsAreRejected() {
    BrillouinSession session = new BrillouinSession();
    session.addRepetition(new RepetitionData("0", null, new MapPayloadSource(1, 1, 1)));
    ParameterSet parameters = new BrillouinEvaluationParameters();
    parameters.getParameter(BrillouinEvaluationParameters.centerBounds).setValue(true);

    Collection<Task> tasks = new ArrayList<>();
    ExitCode code = new BrillouinEvaluationModule().runModule(session, parameters, tasks,
        Instant.now());

    Assertions.assertEquals(ExitCode.ERROR, code);
    Assertions.assertTrue(tasks.isEmpty());
  }
}
