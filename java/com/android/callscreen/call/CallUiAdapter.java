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

/** Requests the call screen sends to the call model in response to user actions. */
public interface CallUiAdapter {

  void answerCall();

  /** Denies an incoming not-yet-connected call. Do not confuse with {@link #localHangupCall()}. */
  void declineCall();

  /** Ends a connected call. Do not confuse with {@link #declineCall()}. */
  void localHangupCall();

  void setMuted(boolean isMuted);

  void setHasLocalVideo(boolean hasLocalVideo);
}
