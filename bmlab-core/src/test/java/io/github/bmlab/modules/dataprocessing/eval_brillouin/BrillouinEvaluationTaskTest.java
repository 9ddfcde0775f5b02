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
import io.github.bmlab.TestSpectra;
import io.github.bmlab.TestSpectra.MapPayloadSource;
import io.github.bmlab.datamodel.calibration.FrequencyCalibration;
import io.github.bmlab.datamodel.evaluation.EvaluatedData;
import io.github.bmlab.datamodel.evaluation.ResultQuantity.RegionKind;
import io.github.bmlab.datamodel.evaluation.ResultQuantity;
import io.github.bmlab.datamodel.evaluation.ResultTensor;
import io.github.bmlab.datamodel.fit.PeakFit;
import io.github.bmlab.datamodel.selection.PeakSelectionModel;
import io.github.bmlab.parameters.ParameterSet;
import io.github.bmlab.project.RepetitionData;
import io.github.bmlab.taskcontrol.TaskProgress;
import io.github.bmlab.taskcontrol.TaskStatus;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BrillouinEvaluationTaskTest {

  private static final int PIXELS = 600;
  // 50 MHz per pixel, 0 Hz at pixel 300
  private static final double HZ_PER_PIXEL = 5e7;

  private static double[] frequencyAxis() {
    final double[] axis = new double[PIXELS];
    for (int i = 0; i < PIXELS; i++) {
      axis[i] = (i - 300) * HZ_PER_PIXEL;
    }
    return axis;
  }

  private static double pixel(double hz) {
    return 300 + hz / HZ_PER_PIXEL;
  }

  /**
   * Rayleigh peaks at -10 and 10 GHz and the given Brillouin peaks, all shifted by drift pixels.
   */
  private static double[] spectrum(double drift, double... brillouinHz) {
    final double[][] peaks = new double[2 + brillouinHz.length][];
    peaks[0] = new double[]{pixel(-10e9) + drift, 6, 1000};
    peaks[1] = new double[]{pixel(10e9) + drift, 6, 1000};
    for (int i = 0; i < brillouinHz.length; i++) {
      peaks[2 + i] = new double[]{pixel(brillouinHz[i]) + drift, 10, 300};
    }
    return TestSpectra.lorentzians(PIXELS, 20, peaks);
  }

  private static RepetitionData repetition(MapPayloadSource payload, double brillouinWidth) {
    final RepetitionData repetition = new RepetitionData("0", null, payload);
    final double[] axis = frequencyAxis();
    repetition.getCalibrationModel().setFrequencyCalibration("1", 0,
        new FrequencyCalibration(0, new double[]{axis[0], HZ_PER_PIXEL, 0, 15e9}, axis));
    final PeakSelectionModel selection = repetition.getPeakSelectionModel();
    selection.addBrillouinRegion(Range.closed(-5e9 - brillouinWidth, -5e9 + brillouinWidth));
    selection.addBrillouinRegion(Range.closed(5e9 - brillouinWidth, 5e9 + brillouinWidth));
    selection.addRayleighRegion(Range.closed(-12e9, -8e9));
    selection.addRayleighRegion(Range.closed(8e9, 12e9));
    return repetition;
  }

  private static MapPayloadSource singlePeakPayload() {
    final MapPayloadSource payload = new MapPayloadSource(2, 2, 1);
    for (int i = 0; i < 4; i++) {
      // the last point drifts by two pixels
      final double drift = i == 3 ? 2 : 0;
      payload.put(String.valueOf(i),
          TestSpectra.frames(new double[]{i}, spectrum(drift, -5e9, 5e9)));
    }
    return payload;
  }

  private static BrillouinEvaluationTask task(RepetitionData repetition, int peaks,
      String centerBounds) {
    final ParameterSet parameters = new BrillouinEvaluationParameters().cloneParameterSet();
    parameters.getParameter(BrillouinEvaluationParameters.brillouinPeaks).setValue(peaks);
    if (centerBounds != null) {
      parameters.getParameter(BrillouinEvaluationParameters.centerBounds).setValue(true);
      parameters.getParameter(BrillouinEvaluationParameters.centerBounds).getEmbeddedParameter()
          .setValue(centerBounds);
    }
    return new BrillouinEvaluationTask(repetition, parameters, Instant.now());
  }

  @Test
  void testSinglePeakEvaluation() {
    final RepetitionData repetition = repetition(singlePeakPayload(), 2e9);
    final BrillouinEvaluationTask task = task(repetition, 1, null);
    task.run();

    Assertions.assertEquals(TaskStatus.FINISHED, task.getStatus());
    Assertions.assertEquals(4, task.getProgress().getTotal());
    Assertions.assertEquals(4, task.getProgress().getCompleted());

    final ResultTensor position = repetition.getEvaluationModel()
        .getTensor(ResultQuantity.BRILLOUIN_PEAK_POSITION_F);
    Assertions.assertArrayEquals(new int[]{2, 2, 1, 1, 2, 1}, position.getShape());
    Assertions.assertEquals(-5e9, position.get(0, 0, 0, 0, 0, 0), 2e7);
    Assertions.assertEquals(5e9, position.get(1, 0, 0, 0, 1, 0), 2e7);

    final ResultTensor shift = repetition.getEvaluationModel()
        .getTensor(ResultQuantity.BRILLOUIN_SHIFT_F);
    for (int x = 0; x < 2; x++) {
      for (int y = 0; y < 2; y++) {
        for (int r = 0; r < 2; r++) {
          Assertions.assertEquals(5e9, shift.get(x, y, 0, 0, r, 0), 2e7);
        }
      }
    }

    final ResultTensor time = repetition.getEvaluationModel().getTensor(ResultQuantity.TIME);
    Assertions.assertEquals(3, time.get(1, 1, 0, 0, 0, 0));

    final ResultTensor drift = repetition.getEvaluationModel()
        .getTensor(ResultQuantity.RAYLEIGH_SHIFT);
    Assertions.assertEquals(0, drift.get(0, 0, 0, 0, 0, 0), 1e6);
    Assertions.assertEquals(2 * HZ_PER_PIXEL, drift.get(1, 1, 0, 0, 0, 0), 1e7);
    Assertions.assertEquals(2 * HZ_PER_PIXEL, drift.get(1, 1, 0, 0, 1, 0), 1e7);

    final EvaluatedData data = repetition.getEvaluatedData(ResultQuantity.BRILLOUIN_SHIFT_F, 0);
    Assertions.assertNotNull(data);
    Assertions.assertEquals(2, data.dimensionality());
    Assertions.assertEquals(5, data.data()[1][1][0], 0.02);
  }

  @Test
  void testMissingSpectraLeaveNaN() {
    final MapPayloadSource payload = new MapPayloadSource(3, 1, 1);
    payload.put("0", TestSpectra.frames(new double[]{0}, spectrum(0, -5e9, 5e9)));
    payload.put("2", TestSpectra.frames(new double[]{2}, spectrum(0, -5e9, 5e9)));
    final RepetitionData repetition = repetition(payload, 2e9);
    final BrillouinEvaluationTask task = task(repetition, 1, null);
    task.run();

    Assertions.assertEquals(TaskStatus.FINISHED, task.getStatus());
    final ResultTensor shift = repetition.getEvaluationModel()
        .getTensor(ResultQuantity.BRILLOUIN_SHIFT_F);
    Assertions.assertTrue(Double.isNaN(shift.get(1, 0, 0, 0, 0, 0)));
    Assertions.assertEquals(5e9, shift.get(2, 0, 0, 0, 0, 0), 2e7);
  }

  @Test
  void testCancelKeepsPartialResults() {
    final MapPayloadSource payload = singlePeakPayload();
    final RepetitionData repetition = repetition(payload, 2e9);
    final BrillouinEvaluationTask task = task(repetition, 1, null);
    final AtomicInteger firstPointRequests = new AtomicInteger();
    // the first request probes the number of frames, the second one evaluates the first point
    payload.setRequestListener(key -> {
      if (key.equals("0") && firstPointRequests.incrementAndGet() == 2) {
        task.cancel();
      }
    });
    task.run();

    Assertions.assertEquals(TaskStatus.CANCELED, task.getStatus());
    Assertions.assertEquals(TaskProgress.FAILED, task.getProgress().getTotal());
    final ResultTensor shift = repetition.getEvaluationModel()
        .getTensor(ResultQuantity.BRILLOUIN_SHIFT_F);
    Assertions.assertEquals(5e9, shift.get(0, 0, 0, 0, 0, 0), 2e7);
    Assertions.assertTrue(Double.isNaN(shift.get(1, 0, 0, 0, 0, 0)));
    Assertions.assertTrue(Double.isNaN(shift.get(0, 1, 0, 0, 0, 0)));
    Assertions.assertTrue(Double.isNaN(shift.get(1, 1, 0, 0, 0, 0)));
  }

  @Test
  void testMissingPayloadFails() {
    final RepetitionData repetition = new RepetitionData("0");
    final BrillouinEvaluationTask task = task(repetition, 1, null);
    task.run();

    Assertions.assertEquals(TaskStatus.ERROR, task.getStatus());
    Assertions.assertNotNull(task.getErrorMessage());
    Assertions.assertTrue(task.getProgress().isFailed());
    Assertions.assertFalse(repetition.getEvaluationModel().hasResults());
  }

  @Test
  void testMissingCalibrationFails() {
    final RepetitionData repetition = new RepetitionData("0", null, singlePeakPayload());
    repetition.getPeakSelectionModel().addBrillouinRegion(Range.closed(3e9, 7e9));
    final BrillouinEvaluationTask task = task(repetition, 1, null);
    task.run();

    Assertions.assertEquals(TaskStatus.ERROR, task.getStatus());
    Assertions.assertTrue(task.getProgress().isFailed());
  }

  @Test
  void testBoundedMultiPeakFit() {
    final MapPayloadSource payload = new MapPayloadSource(1, 1, 1);
    payload.put("0", TestSpectra.frames(new double[]{0},
        spectrum(0, -6.25e9, -4.5e9, 4.5e9, 6.25e9)));
    final RepetitionData repetition = repetition(payload, 3e9);
    final BrillouinEvaluationTask task = task(repetition, 2, "min,5;5,max");
    task.run();

    Assertions.assertEquals(TaskStatus.FINISHED, task.getStatus());
    final ResultTensor position = repetition.getEvaluationModel()
        .getTensor(ResultQuantity.BRILLOUIN_PEAK_POSITION_F);
    Assertions.assertEquals(3, position.getShape(5));
    Assertions.assertEquals(2, repetition.getEvaluationModel().getNumberOfBrillouinPeaks());

    // Stokes region, bounds count from the left Rayleigh peak
    Assertions.assertEquals(-6.25e9, position.get(0, 0, 0, 0, 0, 1), 3e7);
    Assertions.assertEquals(-4.5e9, position.get(0, 0, 0, 0, 0, 2), 3e7);
    // anti-Stokes region, bounds count from the right Rayleigh peak
    Assertions.assertEquals(6.25e9, position.get(0, 0, 0, 0, 1, 1), 3e7);
    Assertions.assertEquals(4.5e9, position.get(0, 0, 0, 0, 1, 2), 3e7);

    final ResultTensor shift = repetition.getEvaluationModel()
        .getTensor(ResultQuantity.BRILLOUIN_SHIFT_F);
    Assertions.assertEquals(3.75e9, shift.get(0, 0, 0, 0, 0, 1), 3e7);
    Assertions.assertEquals(5.5e9, shift.get(0, 0, 0, 0, 1, 2), 3e7);

    final PeakFit[][] fits = repetition.getFits("0", RegionKind.BRILLOUIN);
    Assertions.assertEquals(1, fits.length);
    Assertions.assertEquals(2, fits[0].length);
    Assertions.assertEquals(2, fits[0][0].getNumberOfPeaks());
    Assertions.assertEquals(-4.5e9, fits[0][0].centers()[1], 3e7);
    Assertions.assertEquals(1, repetition.getFits("0", RegionKind.RAYLEIGH)[0][1]
        .getNumberOfPeaks());
  }
}
