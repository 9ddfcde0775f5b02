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

package io.github.bmlab.taskcontrol;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of all tasks. Subclasses implement {@link #process()}, set
 * {@link TaskStatus#PROCESSING} when they start and {@link TaskStatus#FINISHED} on success. Runtime
 * exceptions escaping {@link #process()} turn the task into {@link TaskStatus#ERROR}.
 */
public abstract class AbstractTask implements Task {

  private static final Logger logger = Logger.getLogger(AbstractTask.class.getName());

  private final @NotNull Instant moduleCallDate;
  private volatile TaskStatus status = TaskStatus.WAITING;
  private volatile String errorMessage;

  protected AbstractTask(@NotNull Instant moduleCallDate) {
    this.moduleCallDate = moduleCallDate;
  }

  protected abstract void process();

  @Override
  public final void run() {
    if (isCanceled()) {
      return;
    }
    try {
      process();
    } catch (RuntimeException e) {
      error("Unexpected error in " + getTaskDescription() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public TaskStatus getStatus() {
    return status;
  }

  /**
   * Canceled and failed tasks keep their state.
   */
  public final void setStatus(TaskStatus newStatus) {
    if (status == TaskStatus.CANCELED || status == TaskStatus.ERROR) {
      return;
    }
    status = newStatus;
  }

  @Override
  public void cancel() {
    setStatus(TaskStatus.CANCELED);
  }

  protected void error(@NotNull String message) {
    error(message, null);
  }

  protected void error(@NotNull String message, @Nullable Throwable t) {
    if (t != null) {
      logger.log(Level.WARNING, message, t);
    } else {
      logger.warning(message);
    }
    errorMessage = message;
    setStatus(TaskStatus.ERROR);
  }

  @Override
  public @Nullable String getErrorMessage() {
    return errorMessage;
  }

  public @NotNull Instant getModuleCallDate() {
    return moduleCallDate;
  }
}
