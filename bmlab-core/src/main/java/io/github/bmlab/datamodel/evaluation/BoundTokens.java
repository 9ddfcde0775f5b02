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

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Lower and upper bound of one fitted peak as entered by the user. A token is a number in GHz,
 * {@code min}, {@code max}, {@code Inf} or {@code -Inf}.
 */
public record BoundTokens(@NotNull String lower, @NotNull String upper) {

  /**
   * Parses bounds in the form {@code "min,5;5,max"}, one pair per peak.
   *
   * @throws IllegalArgumentException if a pair does not consist of two tokens
   */
  public static @NotNull List<BoundTokens> parseList(@NotNull String text) {
    final List<BoundTokens> bounds = new ArrayList<>();
    for (final String pair : text.split(";")) {
      if (pair.isBlank()) {
        continue;
      }
      final String[] tokens = pair.split(",");
      if (tokens.length != 2) {
        throw new IllegalArgumentException("Cannot parse peak bounds '" + pair + "'");
      }
      bounds.add(new BoundTokens(tokens[0].trim(), tokens[1].trim()));
    }
    return bounds;
  }

  public static @NotNull String formatList(@NotNull List<BoundTokens> bounds) {
    final StringBuilder b = new StringBuilder();
    for (final BoundTokens bound : bounds) {
      if (!b.isEmpty()) {
        b.append(';');
      }
      b.append(bound.lower()).append(',').append(bound.upper());
    }
    return b.toString();
  }
}
