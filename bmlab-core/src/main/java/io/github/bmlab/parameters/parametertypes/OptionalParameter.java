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

/**
 * Wraps another parameter that is only used when this parameter is selected. The embedded value is
 * only validated if selected.
 */
public class OptionalParameter<EmbeddedParameterType extends Parameter<?>> implements
    Parameter<Boolean> {

  private final EmbeddedParameterType embeddedParameter;
  private Boolean value;

  public OptionalParameter(EmbeddedParameterType embeddedParameter) {
    this(embeddedParameter, false);
  }

  public OptionalParameter(EmbeddedParameterType embeddedParameter, boolean defaultValue) {
    this.embeddedParameter = embeddedParameter;
    this.value = defaultValue;
  }

  public EmbeddedParameterType getEmbeddedParameter() {
    return embeddedParameter;
  }

  @Override
  public @NotNull String getName() {
    return embeddedParameter.getName();
  }

  @Override
  public @NotNull String getDescription() {
    return embeddedParameter.getDescription();
  }

  @Override
  public Boolean getValue() {
    return value;
  }

  @Override
  public void setValue(@Nullable Boolean newValue) {
    this.value = newValue;
  }

  @Override
  public boolean checkValue(@NotNull Collection<String> errorMessages) {
    if (value == null) {
      errorMessages.add(getName() + " is not set properly");
      return false;
    }
    if (value) {
      return embeddedParameter.checkValue(errorMessages);
    }
    return true;
  }

  @SuppressWarnings("unchecked")
  @Override
  public @NotNull OptionalParameter<EmbeddedParameterType> cloneParameter() {
    final EmbeddedParameterType embeddedClone = (EmbeddedParameterType) embeddedParameter.cloneParameter();
    return new OptionalParameter<>(embeddedClone, Boolean.TRUE.equals(value));
  }
}
