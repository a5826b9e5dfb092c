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

package com.android.callscreen.videosurface;

import com.android.callscreen.videosurface.protocol.VideoTrack;
import com.google.auto.value.AutoValue;
import com.google.common.base.Optional;

/** The tracks currently bound to the local and remote surfaces. */
@AutoValue
public abstract class VideoBinding {

  public abstract Optional<VideoTrack> localTrack();

  public abstract Optional<VideoTrack> remoteTrack();

  public abstract boolean isLocalVideoVisible();

  public abstract boolean isRemoteVideoVisible();

  public static VideoBinding empty() {
    return create(Optional.<VideoTrack>absent(), Optional.<VideoTrack>absent(), false, false);
  }

  public static VideoBinding create(
      Optional<VideoTrack> localTrack,
      Optional<VideoTrack> remoteTrack,
      boolean isLocalVideoVisible,
      boolean isRemoteVideoVisible) {
    return new AutoValue_VideoBinding(
        localTrack, remoteTrack, isLocalVideoVisible, isRemoteVideoVisible);
  }
}
