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

import io.github.bmlab.datamodel.evaluation.BoundTokens;
import io.github.bmlab.parameters.Parameter;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Bounds for the peaks of a multi-peak fit, one {@link BoundTokens} per peak.
 */
public class PeakBoundsParameter implements Parameter<List<BoundTokens>> {

  private final String name;
  private final String description;
  private List<BoundTokens> value;

  public PeakBoundsParameter(String name, String description) {
    this(name, description, List.of());
  }

  public PeakBoundsParameter(String name, String description, List<BoundTokens> defaultValue) {
    this.name = name;
    this.description = description;
    this.value = defaultValue;
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
  public List<BoundTokens> getValue() {
    return value;
  }

  @Override
  public void setValue(@Nullable List<BoundTokens> newValue) {
    this.value = newValue == null ? null : List.copyOf(newValue);
  }

  /**
   * @param text bounds in the form {@code "min,5;5,max"}
   */
  public void setValue(@NotNull String text) {
    setValue(BoundTokens.parseList(text));
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (value == null || value.isEmpty()) {
      errorMessages.add(name + " requires at least one pair of bounds");
      return false;
    }
    return true;
  }

  @Override
  public @NotNull PeakBoundsParameter cloneParameter() {
    return new PeakBoundsParameter(name, description, value);
  }
}
