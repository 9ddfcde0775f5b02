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

package io.github.bmlab;

import io.github.bmlab.datamodel.extraction.ExtractedSpectra;
import io.github.bmlab.datamodel.extraction.PayloadSource;
import io.github.bmlab.datamodel.extraction.SpectrumSource;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Synthetic spectra and in-memory spectrum sources for tests.
 */
public class TestSpectra {

  private TestSpectra() {
  }

  /**
   * @param peaks center, fwhm and intensity of each peak in pixels
   */
  public static double[] lorentzians(int length, double offset, double[]... peaks) {
    final double[] y = new double[length];
    for (int i = 0; i < length; i++) {
      double v = offset;
      for (final double[] peak : peaks) {
        final double hwhm = peak[1] / 2;
        final double d = i - peak[0];
        v += peak[2] * hwhm * hwhm / (d * d + hwhm * hwhm);
      }
      y[i] = v;
    }
    return y;
  }

  public static double[] pixels(int length) {
    final double[] x = new double[length];
    for (int i = 0; i < length; i++) {
      x[i] = i;
    }
    return x;
  }

  public static ExtractedSpectra frames(double[] times, double[]... spectra) {
    final double[] intensities = new double[spectra.length];
    for (int i = 0; i < spectra.length; i++) {
      double sum = 0;
      for (final double v : spectra[i]) {
        sum += v;
      }
      intensities[i] = sum / spectra[i].length;
    }
    return new ExtractedSpectra(spectra, times, intensities);
  }

  /**
   * Serves fixed spectra per image key. Unknown keys have no spectra.
   */
  public static class MapSpectrumSource implements SpectrumSource {

    protected final Map<String, ExtractedSpectra> spectra = new HashMap<>();
    private final List<String> keys = new ArrayList<>();

    public MapSpectrumSource put(String key, ExtractedSpectra s) {
      spectra.put(key, s);
      if (!keys.contains(key)) {
        keys.add(key);
      }
      return this;
    }

    @Override
    public @NotNull List<String> getImageKeys() {
      return List.copyOf(keys);
    }

    @Override
    public @Nullable ExtractedSpectra getSpectra(@NotNull String imageKey,
        @Nullable Integer frame) {
      final ExtractedSpectra s = spectra.get(imageKey);
      if (s == null || frame == null) {
        return s;
      }
      return new ExtractedSpectra(new double[][]{s.spectra()[frame]},
          new double[]{s.times()[frame]}, new double[]{s.intensities()[frame]});
    }
  }

  /**
   * A scan with a fixed resolution. A listener is notified with the key of every request.
   */
  public static class MapPayloadSource extends MapSpectrumSource implements PayloadSource {

    private final int[] resolution;
    private Consumer<String> requestListener = key -> {
    };

    public MapPayloadSource(int... resolution) {
      this.resolution = resolution;
    }

    public void setRequestListener(Consumer<String> requestListener) {
      this.requestListener = requestListener;
    }

    @Override
    public @Nullable ExtractedSpectra getSpectra(@NotNull String imageKey,
        @Nullable Integer frame) {
      requestListener.accept(imageKey);
      return super.getSpectra(imageKey, frame);
    }

    @Override
    public int @NotNull [] getResolution() {
      return resolution.clone();
    }

    @Override
    public @Nullable List<double[][][]> getPositions() {
      return null;
    }
  }
}
