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

package io.github.bmlab.io;

import com.google.common.collect.Range;
import io.github.bmlab.datamodel.calibration.CalibrationModel;
import io.github.bmlab.datamodel.calibration.FrequencyCalibration;
import io.github.bmlab.datamodel.evaluation.ResultQuantity;
import io.github.bmlab.datamodel.evaluation.ResultTensor;
import io.github.bmlab.datamodel.fit.PeakFit;
import io.github.bmlab.project.BrillouinSession;
import io.github.bmlab.project.RepetitionData;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionJsonSerializerTest {

  @TempDir
  Path tempDir;

  private static BrillouinSession session() {
    final BrillouinSession session = new BrillouinSession();
    final RepetitionData repetition = session.getOrCreateRepetition("0");

    final CalibrationModel calibration = repetition.getCalibrationModel();
    calibration.setBrillouinRegion("1", 0, Range.closedOpen(150d, 230d));
    calibration.setRayleighRegion("1", 0, Range.closedOpen(30d, 70d));
    calibration.setBrillouinFit("1", 0, 0, new PeakFit(new double[]{170.5, 211.2},
        new double[]{4, 4.1}, new double[]{1000, 990}, 10));
    calibration.setRayleighFit("1", 0, 0, PeakFit.missing(1));
    calibration.setFrequencyCalibration("1", 0, new FrequencyCalibration(12.5,
        new double[]{-1.5e9, 3e7, 5e3, 15e9}, new double[]{-1.5e9, -1.47e9, Double.NaN}));

    repetition.getPeakSelectionModel().addBrillouinRegion(Range.closed(3e9, 7e9));
    repetition.getPeakSelectionModel().addRayleighRegion(Range.closed(8e9, 12e9));

    repetition.getEvaluationModel().initializeResults(new int[]{2, 1, 1}, 1, 1, 1, 1);
    repetition.getEvaluationModel().getTensor(ResultQuantity.BRILLOUIN_SHIFT_F)
        .set(1, 0, 0, 0, 0, 0, 5.1e9);
    return session;
  }

  @Test
  void testWriteAndReadSession() throws IOException {
    final File file = tempDir.resolve("session.json").toFile();
    SessionJsonSerializer.write(session(), file);
    Assertions.assertTrue(Files.size(file.toPath()) > 0);

    final BrillouinSession restored = new BrillouinSession();
    SessionJsonSerializer.read(file, restored);
    final RepetitionData repetition = restored.getRepetition("0");
    Assertions.assertNotNull(repetition);

    final CalibrationModel calibration = repetition.getCalibrationModel();
    Assertions.assertEquals(List.of(Range.closedOpen(150d, 230d)),
        calibration.getBrillouinRegions("1"));
    Assertions.assertEquals(List.of(Range.closedOpen(30d, 70d)),
        calibration.getRayleighRegions("1"));
    Assertions.assertArrayEquals(new double[]{170.5, 211.2},
        calibration.getBrillouinFit("1", 0, 0).centers(), 1e-9);
    Assertions.assertTrue(calibration.getRayleighFit("1", 0, 0).isMissing());

    final FrequencyCalibration frequencies = calibration.getFrequencyCalibration("1", 0);
    Assertions.assertEquals(12.5, frequencies.time(), 1e-9);
    Assertions.assertEquals(15e9, frequencies.vipaParameters()[3], 1e-3);
    Assertions.assertEquals(-1.47e9, frequencies.frequencies()[1], 1e-3);
    Assertions.assertTrue(Double.isNaN(frequencies.frequencies()[2]));

    Assertions.assertEquals(List.of(Range.closed(3e9, 7e9)),
        repetition.getPeakSelectionModel().getBrillouinRegions());
    Assertions.assertEquals(List.of(Range.closed(8e9, 12e9)),
        repetition.getPeakSelectionModel().getRayleighRegions());

    final ResultTensor shift = repetition.getEvaluationModel()
        .getTensor(ResultQuantity.BRILLOUIN_SHIFT_F);
    Assertions.assertArrayEquals(new int[]{2, 1, 1, 1, 1, 1}, shift.getShape());
    Assertions.assertEquals(5.1e9, shift.get(1, 0, 0, 0, 0, 0), 1e-3);
    Assertions.assertTrue(Double.isNaN(shift.get(0, 0, 0, 0, 0, 0)));
  }

  @Test
  void testKeyOrderSurvivesRoundTrip() {
    final BrillouinSession session = new BrillouinSession();
    session.getOrCreateRepetition("1");
    session.getOrCreateRepetition("0");
    final CalibrationModel calibration = session.getRepetition("1").getCalibrationModel();
    calibration.setFrequencyCalibration("2", 0,
        new FrequencyCalibration(0, new double[]{0, 0, 0, 0}, new double[]{2}));
    calibration.setFrequencyCalibration("1", 0,
        new FrequencyCalibration(10, new double[]{0, 0, 0, 0}, new double[]{1}));
    Assertions.assertEquals(2.0, calibration.getFrequenciesByTime(5)[0]);

    final BrillouinSession restored = new BrillouinSession();
    SessionJsonSerializer.fromJson(SessionJsonSerializer.toJson(session), restored);
    Assertions.assertEquals(List.of("1", "0"),
        restored.getRepetitions().stream().map(RepetitionData::getKey).toList());
    final CalibrationModel restoredCalibration = restored.getRepetition("1")
        .getCalibrationModel();
    Assertions.assertEquals(List.of("2", "1"),
        List.copyOf(restoredCalibration.getFrequencyCalibrations().keySet()));
    Assertions.assertEquals(2.0, restoredCalibration.getFrequenciesByTime(5)[0]);
  }

  @Test
  void testInvalidFile() throws IOException {
    final File file = tempDir.resolve("broken.json").toFile();
    Files.writeString(file.toPath(), "{ not json");
    Assertions.assertThrows(IOException.class,
        () -> SessionJsonSerializer.read(file, new BrillouinSession()));
  }
}
