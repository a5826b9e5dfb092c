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

package com.android.callscreen.audiomode;

import com.android.callscreen.common.Assert;
import com.android.callscreen.common.LogUtil;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.inject.Inject;

/**
 * Accrues every audio source seen during the lifetime of one call screen and computes which of them
 * can be offered to the user.
 *
 * <p>Sources are never removed. Availability events arrive asynchronously and a transient session
 * reconfiguration can briefly report fewer devices, so a device unpaired mid call stays listed
 * until the next call.
 */
public class AudioRouteCoordinator {

  // Built-in mic and built-in speaker are always present.
  private static final int BUILT_IN_SOURCE_COUNT = 2;

  private final AudioService audioService;
  private final Set<AudioSource> audioSourcePool = new LinkedHashSet<>();

  @Inject
  public AudioRouteCoordinator(AudioService audioService) {
    this.audioService = Assert.isNotNull(audioService);
    observe(audioService.availableInputs());
  }

  /** Adds {@code availableSources} to the pool. */
  public void observe(Set<AudioSource> availableSources) {
    Assert.isNotNull(availableSources);
    int before = audioSourcePool.size();
    audioSourcePool.addAll(availableSources);
    if (audioSourcePool.size() != before) {
      LogUtil.i(
          "AudioRouteCoordinator.observe",
          "pool grew from %d to %d sources",
          before,
          audioSourcePool.size());
    }
  }

  public ImmutableSet<AudioSource> allSources() {
    return ImmutableSet.copyOf(audioSourcePool);
  }

  /**
   * Returns the sources which suit the current call. The receiver is unsuitable for video calls, so
   * with local video only the speaker and external devices qualify.
   */
  public ImmutableSet<AudioSource> appropriateSources(boolean hasLocalVideo) {
    if (!hasLocalVideo) {
      return allSources();
    }
    ImmutableSet.Builder<AudioSource> appropriateForVideo = ImmutableSet.builder();
    for (AudioSource audioSource : audioSourcePool) {
      if (audioSource.getKind() != AudioSource.Kind.BUILT_IN_MIC) {
        appropriateForVideo.add(audioSource);
      }
    }
    return appropriateForVideo.build();
  }

  /** Any source beyond the built-in pair indicates e.g. an attached bluetooth device. */
  public boolean hasAlternateSources() {
    LogUtil.v("AudioRouteCoordinator.hasAlternateSources", "available: %s", audioSourcePool);
    return audioSourcePool.size() > BUILT_IN_SOURCE_COUNT;
  }

  /** Rows for the audio source picker, with the active source checked. */
  public ImmutableList<AudioSourceOption> pickerOptions(boolean hasLocalVideo) {
    Optional<AudioSource> current = audioService.currentAudioSource();
    ImmutableList.Builder<AudioSourceOption> options = ImmutableList.builder();
    for (AudioSource audioSource : appropriateSources(hasLocalVideo)) {
      options.add(
          AudioSourceOption.create(
              audioSource, current.isPresent() && current.get().equals(audioSource)));
    }
    return options.build();
  }

  /** Routes the call to {@code audioSource}. The audio service owns the active route. */
  public void select(AudioSource audioSource) {
    Assert.isNotNull(audioSource);
    LogUtil.i("AudioRouteCoordinator.select", "routing to %s", audioSource);
    audioService.setAudioSource(audioSource);
  }
}
