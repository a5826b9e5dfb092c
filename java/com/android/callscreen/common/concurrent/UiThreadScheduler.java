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

import java.util.concurrent.Future;

/**
 * The single UI-affinity thread of the call screen.
 *
 * <p>Every mutation of call screen state runs on this thread. Waiting is always expressed as
 * scheduled re-entry through {@link #postDelayed} or {@link #postAtFixedRate}, never as blocking.
 */
public interface UiThreadScheduler {

  /** Whether the calling thread is the UI-affinity thread. */
  boolean isUiThread();

  /** Posts a runnable to the UI thread. */
  void post(Runnable runnable);

  /**
   * Posts a runnable to the UI thread, to be run after the specified amount of time elapses.
   *
   * @return a future whose {@link Future#cancel} prevents the runnable from running
   */
  Future<?> postDelayed(Runnable runnable, long delayMillis);

  /**
   * Posts a runnable to the UI thread which runs every {@code periodMillis} until cancelled. The
   * first run happens one period from now.
   */
  Future<?> postAtFixedRate(Runnable runnable, long periodMillis);
}
