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

/**
 * States of the call shown on the call screen. Transitions are driven by the call model; the call
 * screen only observes them.
 */
public enum CallState {
  IDLE,
  /* An outgoing call during dial phase */
  DIALING,
  /* An incoming call ringing on this device */
  LOCAL_RINGING,
  /* An outgoing call ringing on the remote device */
  REMOTE_RINGING,
  /* An incoming call which was accepted and is being secured */
  ANSWERING,
  CONNECTED,
  REMOTE_BUSY,
  LOCAL_FAILURE,
  REMOTE_HANGUP,
  LOCAL_HANGUP;

  /** Whether entering this state ends the call screen after a short delay. */
  public boolean dismissesAfterDelay() {
    switch (this) {
      case REMOTE_HANGUP:
      case REMOTE_BUSY:
      case LOCAL_FAILURE:
        return true;
      default:
        return false;
    }
  }

  /** Whether entering this state ends the call screen right away. */
  public boolean dismissesImmediately() {
    return this == LOCAL_HANGUP;
  }
}
