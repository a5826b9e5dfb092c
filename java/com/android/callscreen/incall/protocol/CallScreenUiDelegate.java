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

package com.android.callscreen.incall.protocol;

import com.android.callscreen.audiomode.AudioSource;

/** Callbacks from the call screen UI out to the controller. */
public interface CallScreenUiDelegate {

  void onScreenShown();

  void onScreenHidden();

  void onAppForegrounded();

  void onRootViewTouched();

  void onLeaveCallViewTapped();

  void onAnswerClicked();

  void onDeclineClicked();

  void onHangupClicked();

  void onMuteClicked();

  void onVideoClicked();

  void onAudioSourceClicked();

  void onAudioSourceSelected(AudioSource audioSource);

  void onShowCallSettingsClicked();

  void onDismissNagClicked();
}
