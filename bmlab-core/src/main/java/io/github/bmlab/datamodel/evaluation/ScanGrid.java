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

import org.jetbrains.annotations.NotNull;

/**
 * Maps scan indices to image keys. The key of point (x, y, z) is {@code z * dimX * dimY + y * dimX +
 * x}.
 */
public record ScanGrid(int dimX, int dimY, int dimZ) {

  public ScanGrid {
    if (dimX < 1 || dimY < 1 || dimZ < 1) {
      throw new IllegalArgumentException("Scan resolution must be positive");
    }
  }

  public static @NotNull ScanGrid of(int @NotNull [] resolution) {
    return new ScanGrid(resolution[0], resolution[1], resolution[2]);
  }

  public int getNumberOfPoints() {
    return dimX * dimY * dimZ;
  }

  public @NotNull String keyFromIndices(int x, int y, int z) {
    if (x < 0 || x >= dimX || y < 0 || y >= dimY || z < 0 || z >= dimZ) {
      throw new IndexOutOfBoundsException(
          "Indices (" + x + ", " + y + ", " + z + ") outside of the scan resolution (" + dimX + ", "
              + dimY + ", " + dimZ + ")");
    }
    return String.valueOf(z * (dimX * dimY) + y * dimX + x);
  }

  /**
   * @return x, y and z index of the key
   */
  public int @NotNull [] indicesFromKey(@NotNull String key) {
    final int index;
    try {
      index = Integer.parseInt(key.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Image key " + key + " is not a scan index", e);
    }
    return indicesFromIndex(index);
  }

  public int @NotNull [] indicesFromIndex(int index) {
    if (index < 0 || index >= getNumberOfPoints()) {
      throw new IndexOutOfBoundsException(
          "Index " + index + " outside of the scan with " + getNumberOfPoints() + " points");
    }
    final int z = index / (dimX * dimY);
    final int rest = index % (dimX * dimY);
    return new int[]{rest % dimX, rest / dimX, z};
  }
}
