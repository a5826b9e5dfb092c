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

package com.android.callscreen.speakerbuttonlogic;

/** Info about how the audio source button should be displayed */
public class AudioSourceButtonInfo {

  // Testing note: most of this is exercised in UiStateProjectorTest.java

  public final AudioSourceIcon icon;
  public final boolean isVisible;
  public final boolean isChecked;

  public AudioSourceButtonInfo(
      boolean hasAlternateSources,
      boolean isLocalVideoVisible,
      boolean hasLocalVideo,
      boolean isSpeakerphoneSelected) {
    if (hasAlternateSources) {
      // Pressing the button pops the picker, the button never stays selected.
      isChecked = false;
      isVisible = true;
      icon =
          isLocalVideoVisible
              ? AudioSourceIcon.BLUETOOTH_VIDEO_MODE
              : AudioSourceIcon.BLUETOOTH_AUDIO_MODE;
    } else {
      icon = AudioSourceIcon.SPEAKER;
      // Video calls always use the speakerphone, the button would only take space from the video.
      isVisible = !isLocalVideoVisible;
      // Video mode turns the speaker on, but that should not highlight the button.
      isChecked = isSpeakerphoneSelected && !hasLocalVideo;
    }
  }
}
