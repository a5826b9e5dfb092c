/*
 * Copyright (C) 2017 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */


package com.android.callscreen.testing;

import com.android.callscreen.common.concurrent.UiThreadScheduler;
import com.android.callscreen.common.time.Clock;
import com.google.common.util.concurrent.SettableFuture;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;

/**
 * {@link UiThreadScheduler} and {@link Clock} driven by the test. Posted work runs only when the
 * test calls {@link #advanceTimeBy(long)} or {@link #runPending()}, always on the calling thread.
 */
public class FakeUiThreadScheduler implements UiThreadScheduler, Clock {

  private final List<ScheduledTask> tasks = new ArrayList<>();
  private long currentTimeMillis;
  private long nextSequence;
  private boolean isUiThread = true;

  public FakeUiThreadScheduler() {
    this(0);
  }

  public FakeUiThreadScheduler(long startTimeMillis) {
    currentTimeMillis = startTimeMillis;
  }

  public void setIsUiThread(boolean isUiThread) {
    this.isUiThread = isUiThread;
  }

  @Override
  public boolean isUiThread() {
    return isUiThread;
  }

  @Override
  public long currentTimeMillis() {
    return currentTimeMillis;
  }

  @Override
  public void post(Runnable runnable) {
    schedule(runnable, 0, 0);
  }

  @Override
  public Future<?> postDelayed(Runnable runnable, long delayMillis) {
    return schedule(runnable, delayMillis, 0);
  }

  @Override
  public Future<?> postAtFixedRate(Runnable runnable, long periodMillis) {
    return schedule(runnable, periodMillis, periodMillis);
  }

  /** Runs the work which is due right now. */
  public void runPending() {
    advanceTimeBy(0);
  }

  /** Moves the clock forward, running every task which becomes due on the way in time order. */
  public void advanceTimeBy(long millis) {
    long targetTimeMillis = currentTimeMillis + millis;
    ScheduledTask task;
    while ((task = nextDueTask(targetTimeMillis)) != null) {
      tasks.remove(task);
      currentTimeMillis = task.dueTimeMillis;
      task.runnable.run();
      if (task.periodMillis > 0 && !task.future.isCancelled()) {
        task.dueTimeMillis += task.periodMillis;
        task.sequence = nextSequence++;
        tasks.add(task);
      } else if (task.periodMillis == 0) {
        task.future.set(null);
      }
    }
    currentTimeMillis = targetTimeMillis;
  }

  /** Number of scheduled tasks which were not cancelled. */
  public int getPendingTaskCount() {
    int count = 0;
    for (ScheduledTask task : tasks) {
      if (!task.future.isCancelled()) {
        count++;
      }
    }
    return count;
  }

  private Future<?> schedule(Runnable runnable, long delayMillis, long periodMillis) {
    ScheduledTask task =
        new ScheduledTask(runnable, currentTimeMillis + delayMillis, periodMillis, nextSequence++);
    tasks.add(task);
    return task.future;
  }

  private ScheduledTask nextDueTask(long targetTimeMillis) {
    ScheduledTask next = null;
    for (ScheduledTask task : new ArrayList<>(tasks)) {
      if (task.future.isCancelled()) {
        tasks.remove(task);
        continue;
      }
      if (task.dueTimeMillis > targetTimeMillis) {
        continue;
      }
      if (next == null
          || task.dueTimeMillis < next.dueTimeMillis
          || (task.dueTimeMillis == next.dueTimeMillis && task.sequence < next.sequence)) {
        next = task;
      }
    }
    return next;
  }

  private static class ScheduledTask {
    final Runnable runnable;
    final long periodMillis;
    final SettableFuture<Void> future = SettableFuture.create();
    long dueTimeMillis;
    long sequence;

    ScheduledTask(Runnable runnable, long dueTimeMillis, long periodMillis, long sequence) {
      this.runnable = runnable;
      this.dueTimeMillis = dueTimeMillis;
      this.periodMillis = periodMillis;
      this.sequence = sequence;
    }
  }
}
