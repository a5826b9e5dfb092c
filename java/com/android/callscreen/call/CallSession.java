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

package com.android.callscreen.call;

/** The call owned by the call model. The call screen observes it and never mutates it. */
public interface CallSession {

  CallSnapshot getSnapshot();

  /**
   * Subscribes {@code observer} to future changes. The caller reads {@link #getSnapshot()} right
   * after subscribing to sync up with the current state.
   */
  void addObserver(CallObserver observer);

  void removeObserver(CallObserver observer);
}
