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

import com.google.common.collect.Range;
import io.github.bmlab.datamodel.calibration.CalibrationModel;
import io.github.bmlab.datamodel.calibration.FrequencyCalibration;
import io.github.bmlab.datamodel.extraction.ExtractedSpectra;
import io.github.bmlab.datamodel.extraction.SpectrumSource;
import io.github.bmlab.datamodel.fit.PeakFit;
import io.github.bmlab.datamodel.setup.Setup;
import io.github.bmlab.modules.dataprocessing.calib_peakfinder.CalibrationPeakFinder;
import io.github.bmlab.modules.dataprocessing.calib_peakfinder.CalibrationRegions;
import io.github.bmlab.modules.dataprocessing.fit_lorentz.LorentzianRegionFitter;
import io.github.bmlab.project.RepetitionData;
import io.github.bmlab.taskcontrol.TaskProgress;
import io.github.bmlab.util.exceptions.AmbiguousCenterException;
import io.github.bmlab.util.exceptions.ExtractionUnavailableException;
import io.github.bmlab.util.exceptions.FitDidNotConvergeException;
import io.github.bmlab.util.exceptions.InsufficientPeaksException;
import io.github.bmlab.util.exceptions.MissingPrerequisiteException;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Calibrates the frequency axis of one repetition. For every calibration image the Rayleigh and
 * Brillouin regions are detected on the averaged spectrum, the peaks are fitted per frame and the
 * VIPA transfer function is fitted to the sorted peak positions.
 */
public class CalibrationProcessor {

  private static final Logger logger = Logger.getLogger(CalibrationProcessor.class.getName());

  private final @Nullable Setup setup;
  private final @NotNull RepetitionData repetition;

  public CalibrationProcessor(@Nullable Setup setup, @NotNull RepetitionData repetition) {
    this.setup = setup;
    this.repetition = repetition;
  }

  /**
   * Detects the calibration regions of one calibration image and replaces the regions stored for
   * this key by index.
   */
  public @NotNull CalibrationRegions findPeaks(@NotNull String calibKey, double minHeight,
      double minProminence)
      throws MissingPrerequisiteException, ExtractionUnavailableException, InsufficientPeaksException, AmbiguousCenterException {
    final Setup setup = requireSetup();
    final SpectrumSource source = requireCalibrationSource();
    final ExtractedSpectra spectra = source.getSpectra(calibKey, null);
    if (spectra == null || spectra.getNumberOfFrames() == 0) {
      throw new ExtractionUnavailableException("No calibration spectra for key " + calibKey);
    }

    final CalibrationPeakFinder finder = new CalibrationPeakFinder(minHeight, minProminence,
        setup.calibration().numBrillouinSamples());
    final CalibrationRegions regions = finder.findRegions(spectra.averageSpectrum());

    final CalibrationModel model = repetition.getCalibrationModel();
    for (int i = 0; i < regions.brillouin().size(); i++) {
      model.setBrillouinRegion(calibKey, i, regions.brillouin().get(i));
    }
    for (int i = 0; i < regions.rayleigh().size(); i++) {
      model.setRayleighRegion(calibKey, i, regions.rayleigh().get(i));
    }
    logger.fine(() -> "Calibration regions of " + calibKey + ": " + regions);
    return regions;
  }

  /**
   * Fits all peaks of all frames of one calibration image and the VIPA parameters of every frame.
   * Frames whose VIPA fit fails are skipped and removed from the progress total. Stored evaluation
   * results become invalid.
   *
   * @param progress total is increased by the number of frames, set to -1 if a prerequisite is
   *                 missing
   * @throws MissingPrerequisiteException if the setup, the calibration source or the spectra are
   *                                      missing
   */
  public void calibrate(@NotNull String calibKey, @NotNull TaskProgress progress)
      throws MissingPrerequisiteException {
    final Setup setup;
    final SpectrumSource source;
    try {
      setup = requireSetup();
      source = requireCalibrationSource();
    } catch (MissingPrerequisiteException e) {
      progress.markFailed();
      throw e;
    }
    final ExtractedSpectra spectra = source.getSpectra(calibKey, null);
    if (spectra == null || spectra.getNumberOfFrames() == 0) {
      progress.markFailed();
      throw new MissingPrerequisiteException("No calibration spectra for key " + calibKey);
    }

    final CalibrationModel model = repetition.getCalibrationModel();
    final List<Range<Double>> brillouinRegions = model.getBrillouinRegions(calibKey);
    final List<Range<Double>> rayleighRegions = model.getRayleighRegions(calibKey);
    model.clearCalibration(calibKey);

    final int frames = spectra.getNumberOfFrames();
    final int numSamples = setup.calibration().numBrillouinSamples();
    for (int frame = 0; frame < frames; frame++) {
      final double[] spectrum = spectra.spectra()[frame];
      final double[] pixels = pixelAxis(spectrum.length);
      for (int r = 0; r < rayleighRegions.size(); r++) {
        model.setRayleighFit(calibKey, frame, r,
            fitOrMissing(rayleighRegions.get(r), pixels, spectrum, 1));
      }
      // merged Brillouin regions contain one peak per calibration sample
      for (int r = 0; r < brillouinRegions.size(); r++) {
        model.setBrillouinFit(calibKey, frame, r,
            fitOrMissing(brillouinRegions.get(r), pixels, spectrum, numSamples));
      }
    }

    progress.addToTotal(frames);
    int calibrated = 0;
    for (int frame = 0; frame < frames; frame++) {
      final double[] peaks = model.getSortedPeaks(calibKey, frame);
      final double[] params = VipaCalibrationModel.fit(peaks, setup.calibration());
      if (params == null) {
        logger.warning("VIPA fit of frame " + frame + " of calibration " + calibKey + " failed");
        progress.addToTotal(-1);
        continue;
      }
      final double[] frequencies = VipaCalibrationModel.frequencyAxis(params,
          spectra.spectra()[frame].length);
      model.setFrequencyCalibration(calibKey, frame,
          new FrequencyCalibration(spectra.times()[frame], params, frequencies));
      progress.incrementCompleted();
      calibrated++;
    }
    logger.info("Calibrated " + calibrated + " of " + frames + " frames of " + calibKey);

    repetition.getEvaluationModel().invalidateResults();
  }

  /**
   * Removes fits, VIPA parameters and frequency axes of one calibration image.
   */
  public void clearCalibration(@NotNull String calibKey) {
    repetition.getCalibrationModel().clearCalibration(calibKey);
    repetition.getEvaluationModel().invalidateResults();
  }

  /**
   * @return frequencies of the calibration peaks relative to f0 according to the fitted free
   * spectral range, or null if the frame was not calibrated
   */
  public double @Nullable [] expectedFrequencies(@NotNull String calibKey, int frame) {
    final FrequencyCalibration calibration = repetition.getCalibrationModel()
        .getFrequencyCalibration(calibKey, frame);
    if (calibration == null || setup == null) {
      return null;
    }
    return VipaCalibrationModel.expectedFrequencies(calibration.vipaParameters(),
        setup.calibration());
  }

  private static PeakFit fitOrMissing(Range<Double> region, double[] x, double[] y,
      int numPeaks) {
    try {
      return LorentzianRegionFitter.fit(region, x, y, numPeaks, null, null);
    } catch (FitDidNotConvergeException e) {
      logger.fine(() -> "Calibration fit failed: " + e.getMessage());
      return PeakFit.missing(numPeaks);
    }
  }

  private static double[] pixelAxis(int length) {
    final double[] pixels = new double[length];
    for (int i = 0; i < length; i++) {
      pixels[i] = i;
    }
    return pixels;
  }

  private Setup requireSetup() throws MissingPrerequisiteException {
    if (setup == null) {
      throw new MissingPrerequisiteException("No setup selected");
    }
    return setup;
  }

  private SpectrumSource requireCalibrationSource() throws MissingPrerequisiteException {
    final SpectrumSource source = repetition.getCalibrationSource();
    if (source == null) {
      throw new MissingPrerequisiteException(
          "Repetition " + repetition.getKey() + " has no calibration data");
    }
    return source;
  }
}
