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

package io.github.bmlab.parameters.impl;

import io.github.bmlab.parameters.Parameter;
import io.github.bmlab.parameters.ParameterSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Holds copies of the static parameter declarations so that module classes can be instantiated
 * several times with different values.
 */
public class SimpleParameterSet implements ParameterSet {

  private static final Logger logger = Logger.getLogger(SimpleParameterSet.class.getName());

  private final Parameter<?>[] parameters;

  public SimpleParameterSet(Parameter<?>... parameters) {
    this.parameters = Arrays.stream(parameters).map(Parameter::cloneParameter)
        .toArray(Parameter<?>[]::new);
  }

  @Override
  public @NotNull Parameter<?>[] getParameters() {
    return parameters;
  }

  @SuppressWarnings("unchecked")
  @Override
  public <T extends Parameter<?>> T getParameter(@NotNull T parameter) {
    for (final Parameter<?> p : parameters) {
      if (p.getName().equals(parameter.getName())) {
        return (T) p;
      }
    }
    throw new IllegalArgumentException(
        "Parameter " + parameter.getName() + " does not exist in " + getClass().getSimpleName());
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean allValid = true;
    for (final Parameter<?> p : parameters) {
      allValid &= p.checkValue(errorMessages);
    }
    if (!allValid) {
      logger.finest(() -> "Invalid parameters: " + errorMessages);
    }
    return allValid;
  }

  @Override
  public @NotNull ParameterSet cloneParameterSet() {
    try {
      final SimpleParameterSet clone = getClass().getDeclaredConstructor().newInstance();
      for (int i = 0; i < parameters.length; i++) {
        clone.parameters[i] = parameters[i].cloneParameter();
      }
      return clone;
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Parameter set " + getClass().getName()
          + " needs a public no-argument constructor to be cloned", e);
    }
  }
}
