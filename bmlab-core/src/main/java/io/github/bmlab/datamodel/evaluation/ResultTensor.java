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

package io.github.bmlab.datamodel.evaluation;

import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Dense array over the axes x, y, z, frame, region and peak, initialized with NaN. The shape is
 * fixed on creation.
 */
public class ResultTensor {

  public static final int DIMENSIONS = 6;

  private final int[] shape;
  private final double[] data;

  public ResultTensor(int @NotNull ... shape) {
    this(shape, null);
  }

  /**
   * @param data row major values or null to fill with NaN
   */
  public ResultTensor(int @NotNull [] shape, double[] data) {
    if (shape.length != DIMENSIONS) {
      throw new IllegalArgumentException("A result tensor has " + DIMENSIONS + " axes");
    }
    int size = 1;
    for (final int s : shape) {
      if (s < 0) {
        throw new IllegalArgumentException("Negative axis length in " + Arrays.toString(shape));
      }
      size *= s;
    }
    this.shape = shape.clone();
    if (data == null) {
      this.data = new double[size];
      Arrays.fill(this.data, Double.NaN);
    } else {
      if (data.length != size) {
        throw new IllegalArgumentException(
            "Expected " + size + " values for shape " + Arrays.toString(shape) + " but got "
                + data.length);
      }
      this.data = data.clone();
    }
  }

  public int @NotNull [] getShape() {
    return shape.clone();
  }

  public int getShape(int axis) {
    return shape[axis];
  }

  public double get(int x, int y, int z, int frame, int region, int peak) {
    return data[index(x, y, z, frame, region, peak)];
  }

  public void set(int x, int y, int z, int frame, int region, int peak,
      double value) {
    data[index(x, y, z, frame, region, peak)] = value;
  }

  /**
   * @return a copy of the row major values
   */
  public double @NotNull [] getData() {
    return data.clone();
  }

  public boolean isAllNaN() {
    for (final double v : data) {
      if (!Double.isNaN(v)) {
        return false;
      }
    }
    return true;
  }

  private int index(int x, int y, int z, int frame, int region, int peak) {
    final int[] idx = {x, y, z, frame, region, peak};
    int flat = 0;
    for (int axis = 0; axis < DIMENSIONS; axis++) {
      if (idx[axis] < 0 || idx[axis] >= shape[axis]) {
        throw new IndexOutOfBoundsException(
            "Index " + Arrays.toString(idx) + " outside of shape " + Arrays.toString(shape));
      }
      flat = flat * shape[axis] + idx[axis];
    }
    return flat;
  }
}
