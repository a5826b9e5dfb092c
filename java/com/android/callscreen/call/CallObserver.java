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

import com.android.callscreen.audiomode.AudioSource;
import com.android.callscreen.videosurface.protocol.VideoTrack;
import com.google.common.base.Optional;
import javax.annotation.Nullable;

/**
 * Notified on changes to the observed call. Callbacks arrive on the UI thread, one at a time, in
 * the order the changes happened.
 */
public interface CallObserver {

  void onStateChanged(CallSnapshot call);

  void onMuteChanged(CallSnapshot call);

  void onHasLocalVideoChanged(CallSnapshot call);

  void onHoldChanged(CallSnapshot call);

  void onAudioSourceChanged(CallSnapshot call, Optional<AudioSource> audioSource);

  void onVideoTracksChanged(@Nullable VideoTrack localTrack, @Nullable VideoTrack remoteTrack);
}
