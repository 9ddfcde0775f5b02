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
import io.github.bmlab.datamodel.evaluation.BoundTokens;
import io.github.bmlab.util.MathUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Translates the bounds entered for a multi-peak fit into bounds on the frequency axis. Bounds of
 * peak centers are entered as Brillouin shifts in GHz relative to the closer Rayleigh peak. A
 * region right of the midpoint between both Rayleigh peaks is an anti-Stokes region, its shifts
 * count from the right Rayleigh peak towards lower frequencies.
 * <p>
 * Results are indexed [brillouin region][frame][peak][lower, upper].
 */
public class BoundsTranslator {

  private static final double GHZ = 1e9;

  private BoundsTranslator() {
  }

  /**
   * @param brillouinRegions  the Brillouin regions in Hz
   * @param rayleighPositions fitted Rayleigh peak positions in Hz, indexed [frame][rayleigh region]
   * @param bounds            one pair of tokens per peak
   * @return the center bounds or null if there are no bounds or not exactly two Rayleigh peaks
   */
  public static double @Nullable [][][][] translateCenterBounds(
      @NotNull List<Range<Double>> brillouinRegions, double @NotNull [][] rayleighPositions,
      @Nullable List<BoundTokens> bounds) {
    if (bounds == null || !hasTwoRayleighPeaks(rayleighPositions)) {
      return null;
    }
    final int frames = rayleighPositions.length;
    final double[][][][] result = new double[brillouinRegions.size()][frames][bounds.size()][];
    for (int r = 0; r < brillouinRegions.size(); r++) {
      final Range<Double> region = brillouinRegions.get(r);
      final double[] edges = {region.lowerEndpoint(), region.upperEndpoint()};
      for (int f = 0; f < frames; f++) {
        final double[] rayleigh = rayleighPositions[f];
        final double midpoint = MathUtils.nanMean(rayleigh);
        final boolean pure = (edges[0] >= midpoint) == (edges[1] >= midpoint);
        final boolean antiStokesRegion = (edges[0] + edges[1]) / 2 > midpoint;

        for (int p = 0; p < bounds.size(); p++) {
          final BoundTokens bound = bounds.get(p);
          final boolean antiStokes = pure ? antiStokesRegion : isAntiStokesBound(bound);
          final double lower = translateCenterToken(bound.lower(), edges, rayleigh, antiStokes);
          final double upper = translateCenterToken(bound.upper(), edges, rayleigh, antiStokes);
          result[r][f][p] = new double[]{Math.min(lower, upper), Math.max(lower, upper)};
        }
      }
    }
    return result;
  }

  /**
   * @return the width bounds or null if there are no bounds or not exactly two Rayleigh peaks
   */
  public static double @Nullable [][][][] translateFwhmBounds(
      @NotNull List<Range<Double>> brillouinRegions, double @NotNull [][] rayleighPositions,
      @Nullable List<BoundTokens> bounds) {
    if (bounds == null || !hasTwoRayleighPeaks(rayleighPositions)) {
      return null;
    }
    final int frames = rayleighPositions.length;
    final double[][][][] result = new double[brillouinRegions.size()][frames][bounds.size()][];
    for (int r = 0; r < brillouinRegions.size(); r++) {
      for (int f = 0; f < frames; f++) {
        for (int p = 0; p < bounds.size(); p++) {
          final BoundTokens bound = bounds.get(p);
          // kept in the given order, an inverted pair fails the fit
          result[r][f][p] = new double[]{translateFwhmToken(bound.lower()),
              translateFwhmToken(bound.upper())};
        }
      }
    }
    return result;
  }

  static double translateCenterToken(@NotNull String token, double[] edges, double[] rayleigh,
      boolean antiStokes) {
    switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "min":
        return edges[antiStokes ? 1 : 0];
      case "max":
        return edges[antiStokes ? 0 : 1];
      case "-inf":
        return antiStokes ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
      case "inf":
        return antiStokes ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
      default:
        final Double value = parseNumber(token);
        if (value == null) {
          return Double.POSITIVE_INFINITY;
        }
        final double shift = Math.abs(value) * GHZ;
        return antiStokes ? rayleigh[1] - shift : rayleigh[0] + shift;
    }
  }

  static double translateFwhmToken(@NotNull String token) {
    switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "min":
      case "-inf":
        return 0;
      case "max":
      case "inf":
        return Double.POSITIVE_INFINITY;
      default:
        final Double value = parseNumber(token);
        return value == null ? Double.POSITIVE_INFINITY : Math.abs(value) * GHZ;
    }
  }

  /**
   * Negative numbers mark a bound on the anti-Stokes side.
   */
  private static boolean isAntiStokesBound(BoundTokens bound) {
    final List<Double> values = new ArrayList<>(2);
    for (final String token : List.of(bound.lower(), bound.upper())) {
      final Double value = parseNumber(token);
      if (value != null && Double.isFinite(value)) {
        values.add(value);
      }
    }
    final double mean = MathUtils.nanMean(
        values.stream().mapToDouble(Double::doubleValue).toArray());
    return mean < 0;
  }

  private static @Nullable Double parseNumber(String token) {
    try {
      return Double.parseDouble(token.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static boolean hasTwoRayleighPeaks(double[][] rayleighPositions) {
    return rayleighPositions.length > 0 && Arrays.stream(rayleighPositions)
        .allMatch(frame -> frame.length == 2);
  }
}
