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

import com.google.auto.value.AutoValue;
import com.google.common.base.Optional;
import java.util.Locale;

/** Immutable observation of a call. A new snapshot replaces the old one on every notification. */
@AutoValue
public abstract class CallSnapshot {

  public abstract CallState state();

  public abstract boolean isMuted();

  public abstract boolean hasLocalVideo();

  public abstract boolean isOnHold();

  public abstract CallDirection direction();

  /** Wall clock time at which the call connected, absent until it does. */
  public abstract Optional<Long> connectTimeMillis();

  public abstract Optional<CallError> error();

  public static Builder builder() {
    return new AutoValue_CallSnapshot.Builder()
        .setState(CallState.IDLE)
        .setIsMuted(false)
        .setHasLocalVideo(false)
        .setIsOnHold(false)
        .setDirection(CallDirection.OUTGOING);
  }

  /** Builder class for call snapshots. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setState(CallState state);

    public abstract Builder setIsMuted(boolean isMuted);

    public abstract Builder setHasLocalVideo(boolean hasLocalVideo);

    public abstract Builder setIsOnHold(boolean isOnHold);

    public abstract Builder setDirection(CallDirection direction);

    public abstract Builder setConnectTimeMillis(Long connectTimeMillis);

    public abstract Builder setError(CallError error);

    public abstract CallSnapshot build();
  }

  @Override
  public String toString() {
    return String.format(
        Locale.US,
        "CallSnapshot, state: %s, direction: %s, muted: %b, video: %b",
        state(),
        direction(),
        isMuted(),
        hasLocalVideo());
  }
}
