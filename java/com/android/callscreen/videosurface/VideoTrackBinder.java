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

import com.android.callscreen.common.Assert;
import com.android.callscreen.common.LogUtil;
import com.android.callscreen.videosurface.Annotations.LocalVideoSurface;
import com.android.callscreen.videosurface.Annotations.RemoteVideoSurface;
import com.android.callscreen.videosurface.protocol.VideoSurface;
import com.android.callscreen.videosurface.protocol.VideoTrack;
import com.google.common.base.Optional;
import javax.annotation.Nullable;
import javax.inject.Inject;

/**
 * Binds the local and remote video tracks to their surfaces. Binding the track that is already
 * bound is a no-op, so callers may forward every track update without causing surface churn.
 */
public class VideoTrackBinder {

  private final VideoSurface localSurface;
  private final VideoSurface remoteSurface;

  @Nullable private VideoTrack localTrack;
  @Nullable private VideoTrack remoteTrack;
  private boolean isLocalVideoVisible;

  @Inject
  public VideoTrackBinder(
      @LocalVideoSurface VideoSurface localSurface,
      @RemoteVideoSurface VideoSurface remoteSurface) {
    this.localSurface = Assert.isNotNull(localSurface);
    this.remoteSurface = Assert.isNotNull(remoteSurface);
    Assert.checkArgument(
        localSurface.getSurfaceType() == VideoSurface.SURFACE_TYPE_LOCAL,
        "local surface has type %d",
        localSurface.getSurfaceType());
    Assert.checkArgument(
        remoteSurface.getSurfaceType() == VideoSurface.SURFACE_TYPE_REMOTE,
        "remote surface has type %d",
        remoteSurface.getSurfaceType());
  }

  /**
   * Binds {@code track} as the camera preview.
   *
   * @return whether the binding changed
   */
  public boolean bindLocal(@Nullable VideoTrack track) {
    if (localTrack == track) {
      return false;
    }
    if (localTrack != null) {
      // A track without a capture source was never attached.
      if (isLocalVideoVisible) {
        localSurface.detachTrack(localTrack);
      }
      localSurface.clear();
    }
    localTrack = track;
    isLocalVideoVisible = track != null && track.hasCaptureSource();
    if (isLocalVideoVisible) {
      localSurface.attachTrack(track);
    }
    LogUtil.i(
        "VideoTrackBinder.bindLocal",
        "track: %s, isHidden: %b",
        track == null ? null : track.getId(),
        !isLocalVideoVisible);
    return true;
  }

  /**
   * Binds {@code track} as the remote party's video.
   *
   * @return whether the binding changed
   */
  public boolean bindRemote(@Nullable VideoTrack track) {
    if (remoteTrack == track) {
      return false;
    }
    if (remoteTrack != null) {
      remoteSurface.detachTrack(remoteTrack);
    }
    remoteTrack = null;
    remoteSurface.clear();
    remoteTrack = track;
    if (track != null) {
      remoteSurface.attachTrack(track);
    }
    LogUtil.i(
        "VideoTrackBinder.bindRemote",
        "track: %s, isHidden: %b",
        track == null ? null : track.getId(),
        track == null);
    return true;
  }

  public boolean isLocalVideoVisible() {
    return isLocalVideoVisible;
  }

  public boolean isRemoteVideoVisible() {
    return remoteTrack != null;
  }

  public VideoBinding getBinding() {
    return VideoBinding.create(
        Optional.fromNullable(localTrack),
        Optional.fromNullable(remoteTrack),
        isLocalVideoVisible(),
        isRemoteVideoVisible());
  }

  /** Detaches both tracks. Used when the call screen goes away. */
  public void unbindAll() {
    bindLocal(null);
    bindRemote(null);
  }
}
