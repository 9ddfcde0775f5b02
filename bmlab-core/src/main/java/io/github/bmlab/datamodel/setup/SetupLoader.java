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

package io.github.bmlab.datamodel.setup;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Reads the instrument setups that ship with bmlab from {@code setups.json}.
 */
public class SetupLoader {

  private static final Logger logger = Logger.getLogger(SetupLoader.class.getName());
  private static final String RESOURCE = "/setups.json";

  private SetupLoader() {
  }

  public static @NotNull List<Setup> loadAvailableSetups() throws IOException {
    try (InputStream in = SetupLoader.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        throw new IOException("Resource " + RESOURCE + " not found");
      }
      return parseSetups(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  /**
   * @return the setup with this key or null
   */
  public static @Nullable Setup getSetup(@NotNull String key) throws IOException {
    for (final Setup setup : loadAvailableSetups()) {
      if (setup.key().equals(key)) {
        return setup;
      }
    }
    logger.fine(() -> "No setup with key " + key);
    return null;
  }

  public static @NotNull List<Setup> parseSetups(@NotNull String json) throws IOException {
    try {
      final JSONArray array = new JSONObject(json).getJSONArray("setups");
      final List<Setup> setups = new ArrayList<>(array.length());
      for (int i = 0; i < array.length(); i++) {
        setups.add(parseSetup(array.getJSONObject(i)));
      }
      return setups;
    } catch (JSONException e) {
      throw new IOException("Cannot parse setups: " + e.getMessage(), e);
    }
  }

  private static Setup parseSetup(JSONObject obj) {
    final JSONObject calib = obj.getJSONObject("calibration");
    final CalibrationSetup calibration = new CalibrationSetup(
        calib.getInt("num_brillouin_samples"), toArray(calib.getJSONArray("shifts")),
        toArray(calib.getJSONArray("orders")));
    return new Setup(obj.getString("key"), obj.getString("name"), obj.getDouble("f0"),
        calibration);
  }

  private static double[] toArray(JSONArray array) {
    final double[] values = new double[array.length()];
    for (int i = 0; i < values.length; i++) {
      values[i] = array.getDouble(i);
    }
    return values;
  }
}
