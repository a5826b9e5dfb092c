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
import com.google.common.base.Objects;

/**
 * An audio input/output device a call can be routed to. Two sources are the same source when their
 * descriptors are equal, whatever their display names.
 */
public final class AudioSource {

  /** Broad category of an audio device. */
  public enum Kind {
    /* The receiver/earpiece route, paired with the built-in microphone. */
    BUILT_IN_MIC,
    BUILT_IN_SPEAKER,
    /* Bluetooth, wired headset, car kit, ... */
    EXTERNAL_DEVICE
  }

  private final Kind kind;
  private final String descriptor;
  private final String displayName;

  public AudioSource(Kind kind, String descriptor, String displayName) {
    this.kind = Assert.isNotNull(kind);
    this.descriptor = Assert.isNotNull(descriptor);
    this.displayName = Assert.isNotNull(displayName);
  }

  public Kind getKind() {
    return kind;
  }

  /** Opaque device id supplied by the audio service. */
  public String getDescriptor() {
    return descriptor;
  }

  public String getDisplayName() {
    return displayName;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof AudioSource)) {
      return false;
    }
    return descriptor.equals(((AudioSource) other).descriptor);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(descriptor);
  }

  @Override
  public String toString() {
    return "AudioSource{" + kind + ", " + LogUtil.sanitizePii(displayName) + "}";
  }
}
