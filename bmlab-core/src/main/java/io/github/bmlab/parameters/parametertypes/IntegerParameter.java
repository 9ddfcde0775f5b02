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
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public class IntegerParameter implements Parameter<Integer> {

  private final String name;
  private final String description;
  private final Integer minimum;
  private final Integer maximum;
  private Integer value;

  public IntegerParameter(String name, String description, Integer defaultValue) {
    this(name, description, defaultValue, null, null);
  }

  public IntegerParameter(String name, String description, Integer defaultValue,
      @Nullable Integer minimum, @Nullable Integer maximum) {
    this.name = name;
    this.description = description;
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
  public Integer getValue() {
    return value;
  }

  @Override
  public void setValue(@Nullable Integer newValue) {
    this.value = newValue;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (value == null) {
      errorMessages.add(name + " is not set properly");
      return false;
    }
    if ((minimum != null && value < minimum) || (maximum != null && value > maximum)) {
      errorMessages.add(
          name + " lies outside its bounds: (" + (minimum == null ? "" : minimum) + " - " + (
              maximum == null ? "" : maximum) + ")");
      return false;
    }
    return true;
  }

  @Override
  public @NotNull IntegerParameter cloneParameter() {
    return new IntegerParameter(name, description, value, minimum, maximum);
  }
}
