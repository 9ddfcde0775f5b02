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

package io.github.bmlab.parameters.parametertypes;

import io.github.bmlab.parameters.Parameter;
import java.text.NumberFormat;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class DoubleParameter implements Parameter<Double> {

  private final String name;
  private final String description;
  private final NumberFormat format;
  private final Double minimum;
  private final Double maximum;
  private Double value;

  public DoubleParameter(String name, String description, NumberFormat format, Double defaultValue) {
    this(name, description, format, defaultValue, null, null);
  }

  public DoubleParameter(String name, String description, NumberFormat format, Double defaultValue,
      @Nullable Double minimum, @Nullable Double maximum) {
    this.name = name;
    this.description = description;
    this.format = format;
    this.value = defaultValue;
    this.minimum = minimum;
    this.maximum = maximum;
  }

  @Override
  public @NotNull String getName() {
    return name;
  }

  @Override
  public @NotNull String getDescription() {
    return description;
  }

  @Override
  public Double getValue() {
    return value;
  }

  @Override
  public void setValue(@Nullable Double newValue) {
    this.value = newValue;
  }

  public NumberFormat getFormat() {
    return format;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (value == null || value.isNaN()) {
      errorMessages.add(name + " is not set properly");
      return false;
    }
    if (minimum != null && value < minimum) {
      errorMessages.add(name + " lies outside its bounds: (" + format.format(minimum) + " - "
          + (maximum == null ? "" : format.format(maximum)) + ")");
      return false;
    }
    if (maximum != null && value > maximum) {
      errorMessages.add(name + " lies outside its bounds: (" + (minimum == null ? ""
          : format.format(minimum)) + " - " + format.format(maximum) + ")");
      return false;
    }
    return true;
  }

  @Override
  public @NotNull DoubleParameter cloneParameter() {
    return new DoubleParameter(name, description, format, value, minimum, maximum);
  }
}
