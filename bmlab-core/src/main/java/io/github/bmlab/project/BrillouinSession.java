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

package io.github.bmlab.project;

import io.github.bmlab.datamodel.setup.Setup;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A measurement file opened for analysis. Holds the selected instrument setup and the data of each
 * repetition. Sessions are created by the caller and passed to the modules and tasks.
 */
public class BrillouinSession {

  private final Map<String, RepetitionData> repetitions = new LinkedHashMap<>();
  private @Nullable Setup setup;

  public BrillouinSession() {
  }

  public BrillouinSession(@Nullable Setup setup) {
    this.setup = setup;
  }

  public @Nullable Setup getSetup() {
    return setup;
  }

  public void setSetup(@Nullable Setup setup) {
    this.setup = setup;
  }

  public synchronized @NotNull RepetitionData addRepetition(@NotNull RepetitionData repetition) {
    repetitions.put(repetition.getKey(), repetition);
    return repetition;
  }

  /**
   * @return the repetition with this key, created if it does not exist
   */
  public synchronized @NotNull RepetitionData getOrCreateRepetition(@NotNull String key) {
    return repetitions.computeIfAbsent(key, RepetitionData::new);
  }

  public synchronized @Nullable RepetitionData getRepetition(@NotNull String key) {
    return repetitions.get(key);
  }

  public synchronized @NotNull List<RepetitionData> getRepetitions() {
    return new ArrayList<>(repetitions.values());
  }
}
