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
import io.github.bmlab.datamodel.evaluation.EvaluationModel;
import io.github.bmlab.datamodel.evaluation.ResultQuantity;
import io.github.bmlab.datamodel.evaluation.ResultTensor;
import io.github.bmlab.datamodel.fit.PeakFit;
import io.github.bmlab.datamodel.selection.PeakSelectionModel;
import io.github.bmlab.project.BrillouinSession;
import io.github.bmlab.project.RepetitionData;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Stores the calibration, the peak selection and the evaluation results of all repetitions of a
 * session as JSON. Measurement data and the setup are not stored. Non-finite numbers are written as
 * null and read as NaN.
 */
public class SessionJsonSerializer {

  private static final Logger logger = Logger.getLogger(SessionJsonSerializer.class.getName());

  public static final int VERSION = 2;

  private SessionJsonSerializer() {
  }

  public static void write(@NotNull BrillouinSession session, @NotNull File file)
      throws IOException {
    Files.writeString(file.toPath(), toJson(session).toString(2), StandardCharsets.UTF_8);
    logger.info(() -> "Saved session to " + file.getAbsolutePath());
  }

  /**
   * Restores the models of all stored repetitions into the session. Repetitions missing in the
   * session are created.
   */
  public static void read(@NotNull File file, @NotNull BrillouinSession session)
      throws IOException {
    final String content = Files.readString(file.toPath(), StandardCharsets.UTF_8);
    try {
      fromJson(new JSONObject(content), session);
    } catch (JSONException e) {
      throw new IOException("Cannot read session file " + file + ": " + e.getMessage(), e);
    }
  }

  public static @NotNull JSONObject toJson(@NotNull BrillouinSession session) {
    final JSONObject root = new JSONObject();
    root.put("version", VERSION);
    final JSONArray repetitions = new JSONArray();
    for (final RepetitionData repetition : session.getRepetitions()) {
      final JSONObject obj = new JSONObject();
      obj.put("key", repetition.getKey());
      obj.put("calibration", calibrationToJson(repetition.getCalibrationModel()));
      obj.put("peak_selection", selectionToJson(repetition.getPeakSelectionModel()));
      obj.put("evaluation", evaluationToJson(repetition.getEvaluationModel()));
      repetitions.put(obj);
    }
    root.put("repetitions", repetitions);
    return root;
  }

  public static void fromJson(@NotNull JSONObject root, @NotNull BrillouinSession session) {
    final int version = root.optInt("version", VERSION);
    if (version > VERSION) {
      logger.warning("Session was written by a newer version (" + version + ")");
    }
    final JSONArray repetitions = root.getJSONArray("repetitions");
    for (int i = 0; i < repetitions.length(); i++) {
      final JSONObject obj = repetitions.getJSONObject(i);
      final RepetitionData repetition = session.getOrCreateRepetition(obj.getString("key"));
      calibrationFromJson(obj.getJSONObject("calibration"), repetition.getCalibrationModel());
      selectionFromJson(obj.getJSONObject("peak_selection"),
          repetition.getPeakSelectionModel());
      evaluationFromJson(obj.getJSONObject("evaluation"), repetition.getEvaluationModel());
    }
  }

  private static JSONObject calibrationToJson(CalibrationModel model) {
    final JSONObject calibration = new JSONObject();
    final JSONArray keys = new JSONArray();
    for (final String calibKey : model.getRegionKeys()) {
      final JSONObject obj = new JSONObject();
      obj.put("key", calibKey);
      obj.put("brillouin_regions", regionsToJson(model.getBrillouinRegions(calibKey)));
      obj.put("rayleigh_regions", regionsToJson(model.getRayleighRegions(calibKey)));
      obj.put("brillouin_fits", fitsToJson(model.getBrillouinFits(calibKey)));
      obj.put("rayleigh_fits", fitsToJson(model.getRayleighFits(calibKey)));
      keys.put(obj);
    }
    calibration.put("keys", keys);

    // arrays keep the key order, which decides ties in the time lookup
    final JSONArray frequencies = new JSONArray();
    for (final Map.Entry<String, NavigableMap<Integer, FrequencyCalibration>> entry : model.getFrequencyCalibrations()
        .entrySet()) {
      final JSONArray frames = new JSONArray();
      entry.getValue().forEach((frame, fc) -> {
        final JSONObject obj = new JSONObject();
        obj.put("frame", frame.intValue());
        obj.put("time", number(fc.time()));
        obj.put("vipa_params", toJson(fc.vipaParameters()));
        obj.put("frequencies", toJson(fc.frequencies()));
        frames.put(obj);
      });
      frequencies.put(new JSONObject().put("key", entry.getKey()).put("frames", frames));
    }
    calibration.put("frequencies", frequencies);
    return calibration;
  }

  private static void calibrationFromJson(JSONObject calibration, CalibrationModel model) {
    final JSONArray keys = calibration.getJSONArray("keys");
    for (int i = 0; i < keys.length(); i++) {
      final JSONObject obj = keys.getJSONObject(i);
      final String calibKey = obj.getString("key");
      model.setBrillouinRegions(calibKey, pixelRegionsFromJson(obj.getJSONArray("brillouin_regions")));
      model.setRayleighRegions(calibKey, pixelRegionsFromJson(obj.getJSONArray("rayleigh_regions")));
      model.clearFits(calibKey);
      final JSONObject brillouinFits = obj.getJSONObject("brillouin_fits");
      for (final String frame : brillouinFits.keySet()) {
        final JSONObject regions = brillouinFits.getJSONObject(frame);
        for (final String region : regions.keySet()) {
          model.setBrillouinFit(calibKey, Integer.parseInt(frame), Integer.parseInt(region),
              fitFromJson(regions.getJSONObject(region)));
        }
      }
      final JSONObject rayleighFits = obj.getJSONObject("rayleigh_fits");
      for (final String frame : rayleighFits.keySet()) {
        final JSONObject regions = rayleighFits.getJSONObject(frame);
        for (final String region : regions.keySet()) {
          model.setRayleighFit(calibKey, Integer.parseInt(frame), Integer.parseInt(region),
              fitFromJson(regions.getJSONObject(region)));
        }
      }
    }

    final JSONArray frequencies = calibration.getJSONArray("frequencies");
    for (int i = 0; i < frequencies.length(); i++) {
      final JSONObject entry = frequencies.getJSONObject(i);
      final String calibKey = entry.getString("key");
      final JSONArray frames = entry.getJSONArray("frames");
      for (int j = 0; j < frames.length(); j++) {
        final JSONObject obj = frames.getJSONObject(j);
        model.setFrequencyCalibration(calibKey, obj.getInt("frame"),
            new FrequencyCalibration(number(obj, "time"), fromJson(obj.getJSONArray("vipa_params")),
                fromJson(obj.getJSONArray("frequencies"))));
      }
    }
  }

  private static JSONObject fitsToJson(Map<Integer, Map<Integer, PeakFit>> fits) {
    final JSONObject frames = new JSONObject();
    fits.forEach((frame, regions) -> {
      final JSONObject regionObj = new JSONObject();
      regions.forEach((region, fit) -> {
        final JSONObject obj = new JSONObject();
        obj.put("w0", toJson(fit.centers()));
        obj.put("fwhm", toJson(fit.fwhms()));
        obj.put("intensity", toJson(fit.intensities()));
        obj.put("offset", number(fit.offset()));
        regionObj.put(String.valueOf(region), obj);
      });
      frames.put(String.valueOf(frame), regionObj);
    });
    return frames;
  }

  private static PeakFit fitFromJson(JSONObject obj) {
    return new PeakFit(fromJson(obj.getJSONArray("w0")), fromJson(obj.getJSONArray("fwhm")),
        fromJson(obj.getJSONArray("intensity")), number(obj, "offset"));
  }

  private static JSONObject selectionToJson(PeakSelectionModel model) {
    final JSONObject obj = new JSONObject();
    obj.put("brillouin_regions", regionsToJson(model.getBrillouinRegions()));
    obj.put("rayleigh_regions", regionsToJson(model.getRayleighRegions()));
    return obj;
  }

  private static void selectionFromJson(JSONObject obj, PeakSelectionModel model) {
    model.clearBrillouinRegions();
    model.clearRayleighRegions();
    final JSONArray brillouin = obj.getJSONArray("brillouin_regions");
    for (int i = 0; i < brillouin.length(); i++) {
      final JSONArray r = brillouin.getJSONArray(i);
      model.setBrillouinRegion(i, Range.closed(r.getDouble(0), r.getDouble(1)));
    }
    final JSONArray rayleigh = obj.getJSONArray("rayleigh_regions");
    for (int i = 0; i < rayleigh.length(); i++) {
      final JSONArray r = rayleigh.getJSONArray(i);
      model.setRayleighRegion(i, Range.closed(r.getDouble(0), r.getDouble(1)));
    }
  }

  private static JSONObject evaluationToJson(EvaluationModel model) {
    final JSONObject results = new JSONObject();
    for (final ResultQuantity quantity : ResultQuantity.values()) {
      final ResultTensor tensor = model.getTensor(quantity);
      if (tensor == null) {
        continue;
      }
      final JSONObject obj = new JSONObject();
      obj.put("shape", new JSONArray(tensor.getShape()));
      obj.put("data", toJson(tensor.getData()));
      results.put(quantity.name(), obj);
    }
    return results;
  }

  private static void evaluationFromJson(JSONObject results, EvaluationModel model) {
    model.invalidateResults();
    for (final String name : results.keySet()) {
      final ResultQuantity quantity;
      try {
        quantity = ResultQuantity.valueOf(name);
      } catch (IllegalArgumentException e) {
        logger.warning("Skipping unknown result quantity " + name);
        continue;
      }
      final JSONObject obj = results.getJSONObject(name);
      final JSONArray shapeArray = obj.getJSONArray("shape");
      final int[] shape = new int[shapeArray.length()];
      for (int i = 0; i < shape.length; i++) {
        shape[i] = shapeArray.getInt(i);
      }
      model.setTensor(quantity, new ResultTensor(shape, fromJson(obj.getJSONArray("data"))));
    }
  }

  private static JSONArray regionsToJson(List<Range<Double>> regions) {
    final JSONArray array = new JSONArray();
    for (final Range<Double> region : regions) {
      array.put(new JSONArray().put(region.lowerEndpoint().doubleValue())
          .put(region.upperEndpoint().doubleValue()));
    }
    return array;
  }

  private static List<Range<Double>> pixelRegionsFromJson(JSONArray array) {
    final List<Range<Double>> regions = new ArrayList<>(array.length());
    for (int i = 0; i < array.length(); i++) {
      final JSONArray r = array.getJSONArray(i);
      regions.add(Range.closedOpen(r.getDouble(0), r.getDouble(1)));
    }
    return regions;
  }

  private static JSONArray toJson(double[] values) {
    final JSONArray array = new JSONArray();
    for (final double v : values) {
      array.put(number(v));
    }
    return array;
  }

  private static double[] fromJson(JSONArray array) {
    final double[] values = new double[array.length()];
    for (int i = 0; i < values.length; i++) {
      values[i] = array.isNull(i) ? Double.NaN : array.getDouble(i);
    }
    return values;
  }

  private static Object number(double value) {
    return Double.isFinite(value) ? (Object) value : JSONObject.NULL;
  }

  private static double number(JSONObject obj, String key) {
    return obj.isNull(key) ? Double.NaN : obj.getDouble(key);
  }
}
