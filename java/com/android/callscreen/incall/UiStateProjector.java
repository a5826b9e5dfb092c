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

package com.android.callscreen.incall;

import com.android.callscreen.call.CallSnapshot;
import com.android.callscreen.call.CallState;
import com.android.callscreen.common.Assert;
import com.android.callscreen.incall.protocol.CallScreenUiState;
import com.android.callscreen.incall.protocol.ProjectorInput;
import com.android.callscreen.speakerbuttonlogic.AudioSourceButtonInfo;
import javax.inject.Inject;

/**
 * Derives the call screen UI state. Has no side effects: the same input always yields an equal
 * state, so it is safe to call after every single change.
 */
public class UiStateProjector {

  private final CallStatusTextFormatter statusTextFormatter;

  @Inject
  public UiStateProjector(CallStatusTextFormatter statusTextFormatter) {
    this.statusTextFormatter = Assert.isNotNull(statusTextFormatter);
  }

  public String getStatusText(CallSnapshot call, long nowMillis) {
    return statusTextFormatter.getStatusText(call, nowMillis);
  }

  public CallScreenUiState project(ProjectorInput input) {
    CallSnapshot call = input.call();
    boolean isLocalVideoVisible = input.isLocalVideoVisible();
    boolean isRemoteVideoVisible = input.isRemoteVideoVisible();

    // Show incoming vs. ongoing call controls.
    boolean isRinging = call.state() == CallState.LOCAL_RINGING;
    boolean showOngoingControls = !isRinging;

    // Also hide other controls if user has tapped to hide them.
    boolean remoteControlsHidden = input.shouldRemoteControlsBeHidden() && isRemoteVideoVisible;
    if (remoteControlsHidden) {
      showOngoingControls = false;
    }

    AudioSourceButtonInfo audioSourceButtonInfo =
        new AudioSourceButtonInfo(
            input.hasAlternateAudioSources(),
            isLocalVideoVisible,
            call.hasLocalVideo(),
            input.isSpeakerphoneSelected());

    CallScreenUiState.Builder state =
        CallScreenUiState.builder()
            .setStatusText(getStatusText(call, input.nowMillis()))
            .setShowIncomingControls(isRinging)
            .setShowOngoingControls(showOngoingControls)
            .setMuteButtonsSelected(call.isMuted())
            .setVideoModeButtonsSelected(call.hasLocalVideo())
            .setAudioModeControlsHidden(isLocalVideoVisible)
            .setVideoModeControlsHidden(!isLocalVideoVisible)
            .setRemoteControlsHidden(remoteControlsHidden)
            .setContactAvatarHidden(isRemoteVideoVisible)
            .setContactLabelsHidden(remoteControlsHidden)
            .setContactNameMarqueeEnabled(!call.hasLocalVideo())
            .setLocalVideoVisible(isLocalVideoVisible)
            .setRemoteVideoVisible(isRemoteVideoVisible)
            .setAudioSourceButtonVisible(audioSourceButtonInfo.isVisible)
            .setAudioSourceButtonSelected(audioSourceButtonInfo.isChecked)
            .setAudioSourceIcon(audioSourceButtonInfo.icon)
            .setSettingsNagVisible(false)
            .setSettingsNagReason(input.nagReason());

    if (input.dismissalState().isShowingNag()) {
      // The nag replaces the avatar and every call control.
      state
          .setSettingsNagVisible(true)
          .setContactAvatarHidden(true)
          .setShowIncomingControls(false)
          .setShowOngoingControls(false);
    }
    return state.build();
  }
}
