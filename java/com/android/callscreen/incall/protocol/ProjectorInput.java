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

import com.android.callscreen.call.CallSnapshot;
import com.android.callscreen.dismissal.DismissalState;
import com.android.callscreen.dismissal.NagReason;
import com.google.auto.value.AutoValue;

/** Everything the call screen UI state is derived from. */
@AutoValue
public abstract class ProjectorInput {

  public abstract CallSnapshot call();

  public abstract DismissalState dismissalState();

  public abstract NagReason nagReason();

  public abstract boolean isLocalVideoVisible();

  public abstract boolean isRemoteVideoVisible();

  public abstract boolean hasAlternateAudioSources();

  /** Speakerphone selection of the audio source button, including not yet confirmed presses. */
  public abstract boolean isSpeakerphoneSelected();

  /** The "hide controls" toggle flipped by tapping the remote video. */
  public abstract boolean shouldRemoteControlsBeHidden();

  public abstract long nowMillis();

  public static Builder builder() {
    return new AutoValue_ProjectorInput.Builder()
        .setNagReason(NagReason.ALL)
        .setIsLocalVideoVisible(false)
        .setIsRemoteVideoVisible(false)
        .setHasAlternateAudioSources(false)
        .setIsSpeakerphoneSelected(false)
        .setShouldRemoteControlsBeHidden(false);
  }

  /** Builder class for projector input. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setCall(CallSnapshot call);

    public abstract Builder setDismissalState(DismissalState dismissalState);

    public abstract Builder setNagReason(NagReason nagReason);

    public abstract Builder setIsLocalVideoVisible(boolean isLocalVideoVisible);

    public abstract Builder setIsRemoteVideoVisible(boolean isRemoteVideoVisible);

    public abstract Builder setHasAlternateAudioSources(boolean hasAlternateAudioSources);

    public abstract Builder setIsSpeakerphoneSelected(boolean isSpeakerphoneSelected);

    public abstract Builder setShouldRemoteControlsBeHidden(boolean shouldRemoteControlsBeHidden);

    public abstract Builder setNowMillis(long nowMillis);

    public abstract ProjectorInput build();
  }
}
