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

import io.github.bmlab.datamodel.extraction.SpectrumSource;
import io.github.bmlab.parameters.ParameterSet;
import io.github.bmlab.project.BrillouinSession;
import io.github.bmlab.project.RepetitionData;
import io.github.bmlab.taskcontrol.AbstractTask;
import io.github.bmlab.taskcontrol.TaskProgress;
import io.github.bmlab.taskcontrol.TaskStatus;
import io.github.bmlab.util.exceptions.BrillouinProcessingException;
import io.github.bmlab.util.exceptions.MissingPrerequisiteException;
import java.time.Instant;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Calibrates all calibration images of one repetition. Images whose regions cannot be detected are
 * skipped, the others are still calibrated.
 */
public class CalibrationTask extends AbstractTask {

  private static final Logger logger = Logger.getLogger(CalibrationTask.class.getName());

  private final @NotNull BrillouinSession session;
  private final @NotNull RepetitionData repetition;
  private final boolean findRegions;
  private final double minHeight;
  private final double minProminence;
  private final TaskProgress progress = new TaskProgress();

  public CalibrationTask(@NotNull BrillouinSession session, @NotNull RepetitionData repetition,
      @NotNull ParameterSet parameters, @NotNull Instant moduleCallDate) {
    super(moduleCallDate);
    this.session = session;
    this.repetition = repetition;
    this.findRegions = parameters.getValue(CalibrationParameters.findRegions);
    this.minHeight = parameters.getValue(CalibrationParameters.minHeight);
    this.minProminence = parameters.getValue(CalibrationParameters.minProminence);
  }

  @Override
  protected void process() {
    setStatus(TaskStatus.PROCESSING);
    final SpectrumSource source = repetition.getCalibrationSource();
    if (source == null || session.getSetup() == null) {
      progress.markFailed();
      error("Cannot calibrate repetition " + repetition.getKey()
          + ", the setup or the calibration data is missing");
      return;
    }

    final CalibrationProcessor processor = new CalibrationProcessor(session.getSetup(),
        repetition);
    final List<String> calibKeys = source.getImageKeys();
    for (final String calibKey : calibKeys) {
      if (isCanceled()) {
        progress.markFailed();
        return;
      }
      if (findRegions) {
        try {
          processor.findPeaks(calibKey, minHeight, minProminence);
        } catch (MissingPrerequisiteException e) {
          progress.markFailed();
          error(e.getMessage(), e);
          return;
        } catch (BrillouinProcessingException e) {
          logger.log(Level.WARNING,
              "Skipping calibration " + calibKey + " of repetition " + repetition.getKey() + ": "
                  + e.getMessage());
          continue;
        }
      }
      try {
        processor.calibrate(calibKey, progress);
      } catch (MissingPrerequisiteException e) {
        error(e.getMessage(), e);
        return;
      }
    }
    setStatus(TaskStatus.FINISHED);
  }

  public @NotNull TaskProgress getProgress() {
    return progress;
  }

  @Override
  public String getTaskDescription() {
    return "Calibrating repetition " + repetition.getKey();
  }

  @Override
  public double getFinishedPercentage() {
    return progress.getFinishedPercentage();
  }
}
