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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Completed and total work items of a running task. Readable from any thread while the task
 * updates it. A total of {@link #FAILED} marks an aborted or failed run.
 */
public class TaskProgress {

  public static final int FAILED = -1;

  private final AtomicInteger completed = new AtomicInteger();
  private final AtomicInteger total = new AtomicInteger();

  public int getCompleted() {
    return completed.get();
  }

  public int getTotal() {
    return total.get();
  }

  public void setTotal(int total) {
    this.total.set(total);
  }

  public void addToTotal(int delta) {
    total.addAndGet(delta);
  }

  public int incrementCompleted() {
    return completed.incrementAndGet();
  }

  public void reset() {
    completed.set(0);
    total.set(0);
  }

  public void markFailed() {
    total.set(FAILED);
  }

  public boolean isFailed() {
    return total.get() == FAILED;
  }

  public double getFinishedPercentage() {
    final int t = total.get();
    if (t <= 0) {
      return 0;
    }
    return Math.min(1d, completed.get() / (double) t);
  }
}
