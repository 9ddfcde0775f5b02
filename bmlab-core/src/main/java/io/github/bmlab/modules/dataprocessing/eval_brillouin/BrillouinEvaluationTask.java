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
import io.github.bmlab.datamodel.calibration.CalibrationModel;
import io.github.bmlab.datamodel.evaluation.BoundTokens;
import io.github.bmlab.datamodel.evaluation.EvaluationModel;
import io.github.bmlab.datamodel.evaluation.ResultQuantity;
import io.github.bmlab.datamodel.evaluation.ResultTensor;
import io.github.bmlab.datamodel.evaluation.ScanGrid;
import io.github.bmlab.datamodel.extraction.ExtractedSpectra;
import io.github.bmlab.datamodel.extraction.PayloadSource;
import io.github.bmlab.datamodel.fit.PeakFit;
import io.github.bmlab.parameters.ParameterSet;
import io.github.bmlab.project.RepetitionData;
import io.github.bmlab.taskcontrol.AbstractTask;
import io.github.bmlab.taskcontrol.TaskProgress;
import io.github.bmlab.taskcontrol.TaskStatus;
import io.github.bmlab.util.MathUtils;
import io.github.bmlab.util.exceptions.MissingPrerequisiteException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Evaluates all scan points of one repetition. For every point the spectra of all frames are
 * extracted, matched to the calibration closest in time and all Brillouin and Rayleigh regions are
 * fitted on a worker pool. With more than one Brillouin peak, the single peak fit is followed by a
 * bounded multi-peak fit. Results are written to the {@link EvaluationModel} of the repetition,
 * only by the thread running this task.
 * <p>
 * Scan points without spectra or calibration stay NaN. Canceling stops after the current point and
 * keeps the partial results.
 */
public class BrillouinEvaluationTask extends AbstractTask {

  private static final Logger logger = Logger.getLogger(BrillouinEvaluationTask.class.getName());

  /**
   * Brillouin shifts are updated every this many scan points.
   */
  private static final int DERIVED_VALUES_INTERVAL = 10;
  private static final String PROBE_KEY = "0";

  private final @NotNull RepetitionData repetition;
  private final int brillouinPeaks;
  private final @Nullable List<BoundTokens> centerBounds;
  private final @Nullable List<BoundTokens> fwhmBounds;
  private final TaskProgress progress = new TaskProgress();

  // Rayleigh positions of the first evaluated point, indexed [frame][region]
  private double[][] rayleighReference;

  public BrillouinEvaluationTask(@NotNull RepetitionData repetition,
      @NotNull ParameterSet parameters, @NotNull Instant moduleCallDate) {
    super(moduleCallDate);
    this.repetition = repetition;
    this.brillouinPeaks = parameters.getValue(BrillouinEvaluationParameters.brillouinPeaks);
    this.centerBounds = parameters.getEmbeddedParameterValueIfSelectedOrElse(
        BrillouinEvaluationParameters.centerBounds, null);
    this.fwhmBounds = parameters.getEmbeddedParameterValueIfSelectedOrElse(
        BrillouinEvaluationParameters.fwhmBounds, null);
  }

  @Override
  protected void process() {
    setStatus(TaskStatus.PROCESSING);
    progress.reset();

    final PayloadSource payload = repetition.getPayloadSource();
    final CalibrationModel calibration = repetition.getCalibrationModel();
    final EvaluationModel evaluation = repetition.getEvaluationModel();
    final List<Range<Double>> brillouinRegions = repetition.getPeakSelectionModel()
        .getBrillouinRegions();
    final List<Range<Double>> rayleighRegions = repetition.getPeakSelectionModel()
        .getRayleighRegions();
    try {
      checkPrerequisites(payload, calibration, brillouinRegions, rayleighRegions);
    } catch (MissingPrerequisiteException e) {
      progress.markFailed();
      error(e.getMessage());
      return;
    }

    final int[] resolution = payload.getResolution();
    final ScanGrid grid = ScanGrid.of(resolution);
    progress.setTotal(grid.getNumberOfPoints());

    final ExtractedSpectra probe = payload.getSpectra(PROBE_KEY, null);
    if (probe == null || probe.getNumberOfFrames() == 0) {
      progress.markFailed();
      error("Cannot determine the number of frames of repetition " + repetition.getKey());
      return;
    }
    final int frames = probe.getNumberOfFrames();
    evaluation.initializeResults(resolution, frames, brillouinRegions.size(),
        rayleighRegions.size(), brillouinPeaks);
    rayleighReference = null;

    final ExecutorService pool = createPool();
    try {
      for (int index = 0; index < grid.getNumberOfPoints(); index++) {
        progress.incrementCompleted();
        if (isCanceled()) {
          DerivedValuesCalculator.calculate(evaluation);
          progress.markFailed();
          logger.info("Evaluation of " + repetition.getKey() + " canceled after " + index
              + " points");
          return;
        }
        final int[] xyz = grid.indicesFromIndex(index);
        evaluatePoint(pool, payload, calibration, evaluation, String.valueOf(index), xyz, frames,
            brillouinRegions, rayleighRegions);
        if (index % DERIVED_VALUES_INTERVAL == 0) {
          DerivedValuesCalculator.calculate(evaluation);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      progress.markFailed();
      error("Evaluation of " + repetition.getKey() + " was interrupted", e);
      return;
    } catch (ExecutionException e) {
      progress.markFailed();
      error("Fitting failed: " + e.getCause().getMessage(), e.getCause());
      return;
    } finally {
      shutdown(pool);
    }

    DerivedValuesCalculator.calculate(evaluation);
    logger.info("Evaluated " + grid.getNumberOfPoints() + " points of " + repetition.getKey());
    setStatus(TaskStatus.FINISHED);
  }

  private void checkPrerequisites(@Nullable PayloadSource payload, CalibrationModel calibration,
      List<Range<Double>> brillouinRegions, List<Range<Double>> rayleighRegions)
      throws MissingPrerequisiteException {
    if (payload == null) {
      throw new MissingPrerequisiteException(
          "Repetition " + repetition.getKey() + " has no measurement data");
    }
    if (!calibration.hasFrequencyCalibration()) {
      throw new MissingPrerequisiteException(
          "Repetition " + repetition.getKey() + " is not calibrated");
    }
    if (brillouinRegions.isEmpty() && rayleighRegions.isEmpty()) {
      throw new MissingPrerequisiteException(
          "No Brillouin or Rayleigh regions selected for " + repetition.getKey());
    }
  }

  private void evaluatePoint(ExecutorService pool, PayloadSource payload,
      CalibrationModel calibration, EvaluationModel evaluation, String key, int[] xyz, int frames,
      List<Range<Double>> brillouinRegions, List<Range<Double>> rayleighRegions)
      throws InterruptedException, ExecutionException {
    final int x = xyz[0];
    final int y = xyz[1];
    final int z = xyz[2];
    final ExtractedSpectra spectra = payload.getSpectra(key, null);
    if (spectra == null) {
      logger.fine(() -> "No spectra for scan point " + key);
      return;
    }
    final int pointFrames = Math.min(frames, spectra.getNumberOfFrames());

    final ResultTensor time = evaluation.getTensor(ResultQuantity.TIME);
    final ResultTensor intensity = evaluation.getTensor(ResultQuantity.INTENSITY);
    for (int f = 0; f < pointFrames; f++) {
      time.set(x, y, z, f, 0, 0, spectra.times()[f]);
      intensity.set(x, y, z, f, 0, 0, spectra.intensities()[f]);
    }

    final double[][] axes = new double[pointFrames][];
    for (int f = 0; f < pointFrames; f++) {
      axes[f] = calibration.getFrequenciesByTime(spectra.times()[f]);
      if (axes[f] == null || axes[f].length != spectra.spectra()[f].length) {
        logger.fine(() -> "No matching calibration for scan point " + key);
        return;
      }
    }

    final List<RegionFitTask> fits = new ArrayList<>();
    for (final Range<Double> region : brillouinRegions) {
      for (int f = 0; f < pointFrames; f++) {
        fits.add(new RegionFitTask(region, axes[f], spectra.spectra()[f]));
      }
    }
    for (final Range<Double> region : rayleighRegions) {
      for (int f = 0; f < pointFrames; f++) {
        fits.add(new RegionFitTask(region, axes[f], spectra.spectra()[f]));
      }
    }
    final List<Future<PeakFit>> results = pool.invokeAll(fits);
    int i = 0;
    for (int r = 0; r < brillouinRegions.size(); r++) {
      for (int f = 0; f < pointFrames; f++) {
        writeBrillouinFit(evaluation, xyz, f, r, 0, results.get(i++).get(), 0);
      }
    }
    final ResultTensor rayleighPosition = evaluation.getTensor(
        ResultQuantity.RAYLEIGH_PEAK_POSITION_F);
    for (int r = 0; r < rayleighRegions.size(); r++) {
      for (int f = 0; f < pointFrames; f++) {
        final PeakFit fit = results.get(i++).get();
        rayleighPosition.set(x, y, z, f, r, 0, fit.center());
        evaluation.getTensor(ResultQuantity.RAYLEIGH_PEAK_FWHM_F).set(x, y, z, f, r, 0, fit.fwhm());
        evaluation.getTensor(ResultQuantity.RAYLEIGH_PEAK_INTENSITY)
            .set(x, y, z, f, r, 0, fit.intensity());
        evaluation.getTensor(ResultQuantity.RAYLEIGH_PEAK_OFFSET)
            .set(x, y, z, f, r, 0, fit.offset());
      }
    }

    final double[][] rayleighPositions = new double[pointFrames][rayleighRegions.size()];
    for (int f = 0; f < pointFrames; f++) {
      for (int r = 0; r < rayleighRegions.size(); r++) {
        rayleighPositions[f][r] = rayleighPosition.get(x, y, z, f, r, 0);
      }
    }

    if (brillouinPeaks > 1 && !brillouinRegions.isEmpty()) {
      fitMultiplePeaks(pool, evaluation, xyz, pointFrames, axes, spectra, brillouinRegions,
          rayleighPositions);
    }

    updateRayleighShift(evaluation, xyz, rayleighPositions);
  }

  private void fitMultiplePeaks(ExecutorService pool, EvaluationModel evaluation, int[] xyz,
      int pointFrames, double[][] axes, ExtractedSpectra spectra,
      List<Range<Double>> brillouinRegions, double[][] rayleighPositions)
      throws InterruptedException, ExecutionException {
    final double[][][][] centers = BoundsTranslator.translateCenterBounds(brillouinRegions,
        rayleighPositions, centerBounds);
    final double[][][][] widths = BoundsTranslator.translateFwhmBounds(brillouinRegions,
        rayleighPositions, fwhmBounds);

    final List<RegionFitTask> fits = new ArrayList<>();
    for (int r = 0; r < brillouinRegions.size(); r++) {
      for (int f = 0; f < pointFrames; f++) {
        fits.add(new RegionFitTask(brillouinRegions.get(r), axes[f], spectra.spectra()[f],
            brillouinPeaks, centers == null ? null : centers[r][f],
            widths == null ? null : widths[r][f]));
      }
    }
    final List<Future<PeakFit>> results = pool.invokeAll(fits);
    int i = 0;
    for (int r = 0; r < brillouinRegions.size(); r++) {
      for (int f = 0; f < pointFrames; f++) {
        final PeakFit fit = results.get(i++).get();
        for (int p = 0; p < brillouinPeaks; p++) {
          writeBrillouinFit(evaluation, xyz, f, r, p + 1, fit, p);
        }
      }
    }
  }

  private static void writeBrillouinFit(EvaluationModel evaluation, int[] xyz, int frame,
      int region, int peakIndex, PeakFit fit, int fitPeak) {
    final int x = xyz[0];
    final int y = xyz[1];
    final int z = xyz[2];
    evaluation.getTensor(ResultQuantity.BRILLOUIN_PEAK_POSITION_F)
        .set(x, y, z, frame, region, peakIndex, fit.centers()[fitPeak]);
    evaluation.getTensor(ResultQuantity.BRILLOUIN_PEAK_FWHM_F)
        .set(x, y, z, frame, region, peakIndex, fit.fwhms()[fitPeak]);
    evaluation.getTensor(ResultQuantity.BRILLOUIN_PEAK_INTENSITY)
        .set(x, y, z, frame, region, peakIndex, fit.intensities()[fitPeak]);
    evaluation.getTensor(ResultQuantity.BRILLOUIN_PEAK_OFFSET)
        .set(x, y, z, frame, region, peakIndex, fit.offset());
  }

  /**
   * The first point with a Rayleigh fit becomes the reference, the shift of every point is its
   * difference to the reference.
   */
  private void updateRayleighShift(EvaluationModel evaluation, int[] xyz,
      double[][] rayleighPositions) {
    if (rayleighReference == null) {
      boolean anyFit = false;
      for (final double[] frame : rayleighPositions) {
        anyFit |= !MathUtils.allNaN(frame);
      }
      if (anyFit) {
        rayleighReference = new double[rayleighPositions.length][];
        for (int f = 0; f < rayleighPositions.length; f++) {
          rayleighReference[f] = rayleighPositions[f].clone();
        }
      }
    }
    final ResultTensor shift = evaluation.getTensor(ResultQuantity.RAYLEIGH_SHIFT);
    for (int f = 0; f < rayleighPositions.length; f++) {
      for (int r = 0; r < rayleighPositions[f].length; r++) {
        final double reference =
            rayleighReference == null || f >= rayleighReference.length ? Double.NaN
                : rayleighReference[f][r];
        shift.set(xyz[0], xyz[1], xyz[2], f, r, 0, rayleighPositions[f][r] - reference);
      }
    }
  }

  private static ExecutorService createPool() {
    final int threads = 2 * Runtime.getRuntime().availableProcessors();
    final AtomicInteger threadCount = new AtomicInteger();
    return Executors.newFixedThreadPool(threads, r -> {
      Thread t = new Thread(r, "brillouin-fit-" + threadCount.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  private static void shutdown(ExecutorService pool) {
    pool.shutdownNow();
    try {
      if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
        logger.warning("Fit workers did not terminate");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while waiting for the fit workers", e);
    }
  }

  public @NotNull TaskProgress getProgress() {
    return progress;
  }

  @Override
  public String getTaskDescription() {
    return "Evaluating repetition " + repetition.getKey();
  }

  @Override
  public double getFinishedPercentage() {
    return progress.getFinishedPercentage();
  }
}
