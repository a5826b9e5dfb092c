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

import com.android.callscreen.dismissal.NagReason;
import com.android.callscreen.speakerbuttonlogic.AudioSourceIcon;
import com.google.auto.value.AutoValue;

/**
 * Visibility and selection of every control group of the call screen. Always derived from scratch,
 * never patched.
 */
@AutoValue
public abstract class CallScreenUiState {

  public abstract String statusText();

  public abstract boolean showIncomingControls();

  public abstract boolean showOngoingControls();

  /** Selection of both the audio-mode and the video-mode mute buttons. */
  public abstract boolean muteButtonsSelected();

  /** Selection of both the audio-mode and the video-mode video buttons. */
  public abstract boolean videoModeButtonsSelected();

  /** Audio-mode mute and video buttons. */
  public abstract boolean audioModeControlsHidden();

  /** Video-mode mute and video buttons. */
  public abstract boolean videoModeControlsHidden();

  /** The user tapped to hide the controls over the remote video. */
  public abstract boolean remoteControlsHidden();

  public abstract boolean contactAvatarHidden();

  /** Contact name and status labels. */
  public abstract boolean contactLabelsHidden();

  /** Marquee scrolling is distracting during a video call. */
  public abstract boolean contactNameMarqueeEnabled();

  public abstract boolean localVideoVisible();

  public abstract boolean remoteVideoVisible();

  public abstract boolean audioSourceButtonVisible();

  public abstract boolean audioSourceButtonSelected();

  public abstract AudioSourceIcon audioSourceIcon();

  public abstract boolean settingsNagVisible();

  public abstract NagReason settingsNagReason();

  public static Builder builder() {
    return new AutoValue_CallScreenUiState.Builder();
  }

  /** Builder class for call screen UI state. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setStatusText(String statusText);

    public abstract Builder setShowIncomingControls(boolean showIncomingControls);

    public abstract Builder setShowOngoingControls(boolean showOngoingControls);

    public abstract Builder setMuteButtonsSelected(boolean muteButtonsSelected);

    public abstract Builder setVideoModeButtonsSelected(boolean videoModeButtonsSelected);

    public abstract Builder setAudioModeControlsHidden(boolean audioModeControlsHidden);

    public abstract Builder setVideoModeControlsHidden(boolean videoModeControlsHidden);

    public abstract Builder setRemoteControlsHidden(boolean remoteControlsHidden);

    public abstract Builder setContactAvatarHidden(boolean contactAvatarHidden);

    public abstract Builder setContactLabelsHidden(boolean contactLabelsHidden);

    public abstract Builder setContactNameMarqueeEnabled(boolean contactNameMarqueeEnabled);

    public abstract Builder setLocalVideoVisible(boolean localVideoVisible);

    public abstract Builder setRemoteVideoVisible(boolean remoteVideoVisible);

    public abstract Builder setAudioSourceButtonVisible(boolean audioSourceButtonVisible);

    public abstract Builder setAudioSourceButtonSelected(boolean audioSourceButtonSelected);

    public abstract Builder setAudioSourceIcon(AudioSourceIcon audioSourceIcon);

    public abstract Builder setSettingsNagVisible(boolean settingsNagVisible);

    public abstract Builder setSettingsNagReason(NagReason settingsNagReason);

    public abstract CallScreenUiState build();
  }
}
