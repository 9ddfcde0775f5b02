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

package io.github.bmlab.parameters;

import io.github.bmlab.parameters.parametertypes.OptionalParameter;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A set of parameters of one module. Parameters are looked up by the static instances declared in
 * the module's parameter class.
 */
public interface ParameterSet {

  @NotNull Parameter<?>[] getParameters();

  <T extends Parameter<?>> T getParameter(@NotNull T parameter);

  default <V> V getValue(@NotNull Parameter<V> parameter) {
    return getParameter(parameter).getValue();
  }

  default <V> void setParameter(@NotNull Parameter<V> parameter, @Nullable V value) {
    getParameter(parameter).setValue(value);
  }

  /**
   * @return the value of the embedded parameter if the optional parameter is selected, otherwise
   * the default value
   */
  default <V> V getEmbeddedParameterValueIfSelectedOrElse(
      @NotNull OptionalParameter<? extends Parameter<V>> parameter, V defaultValue) {
    final OptionalParameter<? extends Parameter<V>> own = getParameter(parameter);
    if (!Boolean.TRUE.equals(own.getValue())) {
      return defaultValue;
    }
    final V value = own.getEmbeddedParameter().getValue();
    return value == null ? defaultValue : value;
  }

  boolean checkParameterValues(@NotNull Collection<String> errorMessages);

  @NotNull ParameterSet cloneParameterSet();
}
