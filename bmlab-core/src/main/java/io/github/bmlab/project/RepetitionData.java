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

package io.github.bmlab.project;

import io.github.bmlab.datamodel.calibration.CalibrationModel;
import io.github.bmlab.datamodel.evaluation.EvaluatedData;
import io.github.bmlab.datamodel.evaluation.EvaluationModel;
import io.github.bmlab.datamodel.evaluation.ResultQuantity;
import io.github.bmlab.datamodel.evaluation.ResultQuantity.RegionKind;
import io.github.bmlab.datamodel.evaluation.ScanGrid;
import io.github.bmlab.datamodel.extraction.PayloadSource;
import io.github.bmlab.datamodel.extraction.SpectrumSource;
import io.github.bmlab.datamodel.fit.PeakFit;
import io.github.bmlab.datamodel.selection.PeakSelectionModel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Data sources and models of one repetition of a measurement.
 */
public class RepetitionData {

  private final @NotNull String key;
  private final @NotNull CalibrationModel calibrationModel = new CalibrationModel();
  private final @NotNull PeakSelectionModel peakSelectionModel = new PeakSelectionModel();
  private final @NotNull EvaluationModel evaluationModel = new EvaluationModel();
  private @Nullable SpectrumSource calibrationSource;
  private @Nullable PayloadSource payloadSource;

  public RepetitionData(@NotNull String key) {
    this(key, null, null);
  }

  public RepetitionData(@NotNull String key, @Nullable SpectrumSource calibrationSource,
      @Nullable PayloadSource payloadSource) {
    this.key = key;
    this.calibrationSource = calibrationSource;
    this.payloadSource = payloadSource;
  }

  public @NotNull String getKey() {
    return key;
  }

  public @Nullable SpectrumSource getCalibrationSource() {
    return calibrationSource;
  }

  public void setCalibrationSource(@Nullable SpectrumSource calibrationSource) {
    this.calibrationSource = calibrationSource;
  }

  public @Nullable PayloadSource getPayloadSource() {
    return payloadSource;
  }

  public void setPayloadSource(@Nullable PayloadSource payloadSource) {
    this.payloadSource = payloadSource;
  }

  public @NotNull CalibrationModel getCalibrationModel() {
    return calibrationModel;
  }

  public @NotNull PeakSelectionModel getPeakSelectionModel() {
    return peakSelectionModel;
  }

  public @NotNull EvaluationModel getEvaluationModel() {
    return evaluationModel;
  }

  /**
   * Evaluated values of one quantity per scan point, see
   * {@link EvaluationModel#getData(ResultQuantity, int, int[], java.util.List)}.
   *
   * @return the data or null if there is no payload
   */
  public @Nullable EvaluatedData getEvaluatedData(@NotNull ResultQuantity quantity,
      int peakIndex) {
    final PayloadSource payload = payloadSource;
    if (payload == null) {
      return null;
    }
    return evaluationModel.getData(quantity, peakIndex, payload.getResolution(),
        payload.getPositions());
  }

  /**
   * Fits stored for the scan point of an image key, see
   * {@link EvaluationModel#getFits(RegionKind, int, int, int)}.
   *
   * @return the fits or null if there is no payload or no result
   */
  public PeakFit @Nullable [][] getFits(@NotNull String imageKey, @NotNull RegionKind kind) {
    final PayloadSource payload = payloadSource;
    if (payload == null) {
      return null;
    }
    final int[] xyz = ScanGrid.of(payload.getResolution()).indicesFromKey(imageKey);
    return evaluationModel.getFits(kind, xyz[0], xyz[1], xyz[2]);
  }
}
