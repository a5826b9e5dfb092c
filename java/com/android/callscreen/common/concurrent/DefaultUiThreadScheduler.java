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

package com.android.callscreen.common.concurrent;

import com.android.callscreen.common.Assert;
import com.android.callscreen.common.LogUtil;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * {@link UiThreadScheduler} backed by a single-thread {@link ScheduledExecutorService}. The worker
 * thread of that executor is the UI-affinity thread.
 */
public class DefaultUiThreadScheduler implements UiThreadScheduler {

  private static final String THREAD_NAME = "CallScreen-Ui";

  private final ScheduledExecutorService executorService;
  private volatile Thread uiThread;

  private DefaultUiThreadScheduler() {
    executorService =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactory() {
              @Override
              public Thread newThread(Runnable runnable) {
                LogUtil.i("DefaultUiThreadScheduler.newThread", "creating ui thread");
                Thread thread = new Thread(runnable, THREAD_NAME);
                // Java thread priority 5 corresponds to Process.THREAD_PRIORITY_DEFAULT (0)
                thread.setPriority(5);
                uiThread = thread;
                return thread;
              }
            });
  }

  public static DefaultUiThreadScheduler create() {
    DefaultUiThreadScheduler scheduler = new DefaultUiThreadScheduler();
    // Start the worker eagerly so isUiThread() has a thread to compare against.
    scheduler.executorService.execute(() -> {});
    return scheduler;
  }

  @Override
  public boolean isUiThread() {
    return Thread.currentThread() == uiThread;
  }

  @Override
  public void post(Runnable runnable) {
    executorService.execute(wrap(runnable));
  }

  @Override
  public Future<?> postDelayed(Runnable runnable, long delayMillis) {
    Assert.checkArgument(delayMillis >= 0, "negative delay: %d", delayMillis);
    return executorService.schedule(wrap(runnable), delayMillis, TimeUnit.MILLISECONDS);
  }

  @Override
  public Future<?> postAtFixedRate(Runnable runnable, long periodMillis) {
    Assert.checkArgument(periodMillis > 0, "non-positive period: %d", periodMillis);
    return executorService.scheduleAtFixedRate(
        wrap(runnable), periodMillis, periodMillis, TimeUnit.MILLISECONDS);
  }

  /** Stops the UI thread. Pending work is dropped. */
  public void shutdown() {
    LogUtil.enterBlock("DefaultUiThreadScheduler.shutdown");
    executorService.shutdownNow();
  }

  private static Runnable wrap(Runnable runnable) {
    return () -> {
      try {
        runnable.run();
      } catch (RuntimeException | Error e) {
        // uncaught exceptions on the UI thread should crash the app
        LogUtil.e("DefaultUiThreadScheduler.run", "uncaught exception on ui thread", e);
        throw e;
      }
    };
  }
}
