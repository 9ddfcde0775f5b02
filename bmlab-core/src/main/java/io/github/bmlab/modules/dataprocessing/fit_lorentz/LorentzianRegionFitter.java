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

package io.github.bmlab.modules.dataprocessing.fit_lorentz;

import com.google.common.collect.Range;
import io.github.bmlab.datamodel.fit.PeakFit;
import io.github.bmlab.util.PeakFinder;
import io.github.bmlab.util.exceptions.FitDidNotConvergeException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Fits a sum of Lorentzian peaks with a shared constant offset to the samples of a spectrum inside
 * a region:
 * <pre>
 *   L(x) = offset + sum_k I_k * (G_k / 2)^2 / ((x - w0_k)^2 + (G_k / 2)^2)
 * </pre>
 * The x and y values are scaled to the unit interval for the optimization. Per peak bounds for the
 * center and the width are enforced by a parameter validator.
 */
public class LorentzianRegionFitter {

  private static final int MAX_ITERATIONS = 1000;
  private static final int MAX_EVALUATIONS = 5000;
  private static final double MIN_WIDTH = 1e-6;

  private LorentzianRegionFitter() {
  }

  /**
   * Single peak without bounds.
   */
  public static @NotNull PeakFit fit(@NotNull Range<Double> region, double @NotNull [] x,
      double @NotNull [] y) throws FitDidNotConvergeException {
    return fit(region, x, y, 1, null, null);
  }

  /**
   * @param region       only samples with x inside the region are fitted
   * @param x            axis, pixels or Hz
   * @param y            intensities
   * @param numPeaks     number of Lorentzian peaks
   * @param centerBounds lower and upper bound of each peak center in units of x, or null
   * @param fwhmBounds   lower and upper bound of each peak width in units of x, or null
   * @return the fit with peaks in the order of the bounds
   * @throws FitDidNotConvergeException if there are too few samples, the bounds are invalid or
   *                                    the optimization fails
   */
  public static @NotNull PeakFit fit(@NotNull Range<Double> region, double @NotNull [] x,
      double @NotNull [] y, int numPeaks, double @Nullable [][] centerBounds,
      double @Nullable [][] fwhmBounds) throws FitDidNotConvergeException {
    if (x.length != y.length) {
      throw new IllegalArgumentException("x and y differ in length");
    }
    if (numPeaks < 1) {
      throw new IllegalArgumentException("At least one peak has to be fitted");
    }

    final List<Integer> inRegion = new ArrayList<>();
    for (int i = 0; i < x.length; i++) {
      if (Double.isFinite(x[i]) && Double.isFinite(y[i]) && region.contains(x[i])) {
        inRegion.add(i);
      }
    }
    final int n = inRegion.size();
    final int numParameters = 3 * numPeaks + 1;
    if (n < numParameters) {
      throw new FitDidNotConvergeException(
          "Region " + region + " contains " + n + " samples, " + numParameters + " are needed");
    }

    double xMin = Double.POSITIVE_INFINITY;
    double xMax = Double.NEGATIVE_INFINITY;
    double yMin = Double.POSITIVE_INFINITY;
    double yMax = Double.NEGATIVE_INFINITY;
    for (final int i : inRegion) {
      xMin = Math.min(xMin, x[i]);
      xMax = Math.max(xMax, x[i]);
      yMin = Math.min(yMin, y[i]);
      yMax = Math.max(yMax, y[i]);
    }
    final double xScale = xMax - xMin;
    if (xScale <= 0) {
      throw new FitDidNotConvergeException("Region " + region + " has no extent on the axis");
    }
    final double yScale = yMax > yMin ? yMax - yMin : 1d;

    final double[] u = new double[n];
    final double[] v = new double[n];
    for (int k = 0; k < n; k++) {
      final int i = inRegion.get(k);
      u[k] = (x[i] - xMin) / xScale;
      v[k] = (y[i] - yMin) / yScale;
    }

    final double[][] cb = normalizeBounds(centerBounds, numPeaks, xMin, xScale, true);
    final double[][] wb = normalizeBounds(fwhmBounds, numPeaks, 0, xScale, false);
    for (int p = 0; p < numPeaks; p++) {
      wb[p][0] = Math.max(wb[p][0], MIN_WIDTH);
    }

    final double[] start = initialGuess(u, v, numPeaks, cb, wb);
    final Optimum optimum;
    try {
      final LeastSquaresProblem problem = new LeastSquaresBuilder().start(start)
          .target(v).model(new LorentzianModel(u, numPeaks))
          .parameterValidator(new BoundsValidator(cb, wb)).lazyEvaluation(false)
          .maxEvaluations(MAX_EVALUATIONS).maxIterations(MAX_ITERATIONS).build();
      optimum = new LevenbergMarquardtOptimizer().optimize(problem);
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      throw new FitDidNotConvergeException("Lorentzian fit in " + region + " failed", e);
    }

    final double[] result = optimum.getPoint().toArray();
    final double[] centers = new double[numPeaks];
    final double[] fwhms = new double[numPeaks];
    final double[] intensities = new double[numPeaks];
    for (int p = 0; p < numPeaks; p++) {
      centers[p] = xMin + result[3 * p] * xScale;
      fwhms[p] = Math.abs(result[3 * p + 1]) * xScale;
      intensities[p] = result[3 * p + 2] * yScale;
    }
    final double offset = yMin + result[3 * numPeaks] * yScale;
    final PeakFit fit = new PeakFit(centers, fwhms, intensities, offset);
    if (!isFinite(fit)) {
      throw new FitDidNotConvergeException("Lorentzian fit in " + region + " is not finite");
    }
    return fit;
  }

  private static boolean isFinite(PeakFit fit) {
    for (int p = 0; p < fit.getNumberOfPeaks(); p++) {
      if (!Double.isFinite(fit.centers()[p]) || !Double.isFinite(fit.fwhms()[p])
          || !Double.isFinite(fit.intensities()[p])) {
        return false;
      }
    }
    return Double.isFinite(fit.offset());
  }

  /**
   * Maps bounds to the unit interval of the region. Missing bounds are unbounded.
   */
  private static double[][] normalizeBounds(double @Nullable [][] bounds, int numPeaks,
      double origin, double scale, boolean position) throws FitDidNotConvergeException {
    final double[][] normalized = new double[numPeaks][];
    for (int p = 0; p < numPeaks; p++) {
      if (bounds == null || p >= bounds.length || bounds[p] == null) {
        normalized[p] = new double[]{position ? Double.NEGATIVE_INFINITY : 0,
            Double.POSITIVE_INFINITY};
        continue;
      }
      final double lower = bounds[p][0];
      final double upper = bounds[p][1];
      if (Double.isNaN(lower) || Double.isNaN(upper) || lower > upper) {
        throw new FitDidNotConvergeException(
            "Invalid bounds [" + lower + ", " + upper + "] for peak " + p);
      }
      normalized[p] = new double[]{(lower - origin) / scale, (upper - origin) / scale};
    }
    return normalized;
  }

  /**
   * Centers at the highest separated local maxima inside the center bounds, widths a fraction of
   * the region, offset at the minimum.
   */
  private static double[] initialGuess(double[] u, double[] v, int numPeaks, double[][] cb,
      double[][] wb) {
    final double[] start = new double[3 * numPeaks + 1];
    final List<Integer> maxima = PeakFinder.findLocalMaxima(v);
    maxima.sort(Comparator.comparingDouble((Integer i) -> v[i]).reversed());
    final double minSeparation = 0.5 / numPeaks;
    final List<Double> used = new ArrayList<>();

    for (int p = 0; p < numPeaks; p++) {
      Double center = null;
      for (final int i : maxima) {
        if (u[i] < cb[p][0] || u[i] > cb[p][1]) {
          continue;
        }
        final double candidate = u[i];
        if (used.stream().allMatch(c -> Math.abs(c - candidate) >= minSeparation)) {
          center = candidate;
          break;
        }
      }
      if (center == null) {
        center = clamp((p + 1d) / (numPeaks + 1d), cb[p]);
      }
      used.add(center);

      start[3 * p] = center;
      start[3 * p + 1] = clamp(0.2 / numPeaks, wb[p]);
      start[3 * p + 2] = Math.max(interpolate(u, v, center), 1e-3);
    }
    start[3 * numPeaks] = 0;
    return start;
  }

  private static double clamp(double value, double[] bounds) {
    if (value >= bounds[0] && value <= bounds[1]) {
      return value;
    }
    if (Double.isFinite(bounds[0]) && Double.isFinite(bounds[1])) {
      return (bounds[0] + bounds[1]) / 2;
    }
    return Double.isFinite(bounds[0]) ? bounds[0] + Math.abs(value - bounds[0]) : bounds[1] - Math.abs(
        value - bounds[1]);
  }

  private static double interpolate(double[] u, double[] v, double position) {
    int nearest = 0;
    for (int i = 1; i < u.length; i++) {
      if (Math.abs(u[i] - position) < Math.abs(u[nearest] - position)) {
        nearest = i;
      }
    }
    return v[nearest];
  }

  /**
   * Parameters (w0, fwhm, intensity) per peak followed by the offset.
   */
  private record LorentzianModel(double[] u, int numPeaks) implements MultivariateJacobianFunction {

    @Override
    public Pair<RealVector, RealMatrix> value(RealVector point) {
      final double[] params = point.toArray();
      final double[] values = new double[u.length];
      final double[][] jacobian = new double[u.length][params.length];
      final double offset = params[3 * numPeaks];
      for (int i = 0; i < u.length; i++) {
        double value = offset;
        for (int p = 0; p < numPeaks; p++) {
          final double w0 = params[3 * p];
          final double g = params[3 * p + 1] / 2;
          final double intensity = params[3 * p + 2];
          final double d = u[i] - w0;
          final double denominator = d * d + g * g;
          final double shape = g * g / denominator;
          value += intensity * shape;
          jacobian[i][3 * p] = 2 * intensity * g * g * d / (denominator * denominator);
          jacobian[i][3 * p + 1] = intensity * g * d * d / (denominator * denominator);
          jacobian[i][3 * p + 2] = shape;
        }
        jacobian[i][3 * numPeaks] = 1;
        values[i] = value;
      }
      return new Pair<>(new ArrayRealVector(values, false),
          new Array2DRowRealMatrix(jacobian, false));
    }
  }

  /**
   * Clamps centers and widths into their bounds.
   */
  private record BoundsValidator(double[][] centerBounds, double[][] fwhmBounds) implements
      ParameterValidator {

    @Override
    public RealVector validate(RealVector params) {
      final double[] p = params.toArray();
      for (int k = 0; k < centerBounds.length; k++) {
        p[3 * k] = Math.min(Math.max(p[3 * k], centerBounds[k][0]), centerBounds[k][1]);
        p[3 * k + 1] = Math.min(Math.max(Math.abs(p[3 * k + 1]), fwhmBounds[k][0]),
            fwhmBounds[k][1]);
      }
      return new ArrayRealVector(p, false);
    }
  }
}
