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

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;

/** Proxy for the platform audio session of the current call. */
public interface AudioService {

  ImmutableSet<AudioSource> availableInputs();

  Optional<AudioSource> currentAudioSource();

  boolean isSpeakerphoneEnabled();

  /** Asynchronous; the result is reported through {@link AudioServiceDelegate}. */
  void requestSpeakerphone(boolean isEnabled);

  void setAudioSource(AudioSource audioSource);

  /** The service holds a single delegate. Passing {@code null} detaches the current one. */
  void setDelegate(@Nullable AudioServiceDelegate delegate);

  @Nullable
  AudioServiceDelegate getDelegate();
}
