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

import com.android.callscreen.common.Assert;
import com.android.callscreen.configprovider.ConfigProvider;
import com.google.auto.value.AutoValue;

/** Delays and periods used by the call screen, read from {@link ConfigProvider}. */
@AutoValue
public abstract class CallScreenTimings {

  static final String KEY_DISMISS_DELAY_MILLIS = "call_screen_dismiss_delay_millis";
  static final String KEY_NAG_AUTO_DISMISS_MILLIS = "call_screen_settings_nag_auto_dismiss_millis";
  static final String KEY_DURATION_UPDATE_MILLIS = "call_screen_duration_update_millis";

  public static final long DEFAULT_DISMISS_DELAY_MILLIS = 1500;
  public static final long DEFAULT_NAG_AUTO_DISMISS_MILLIS = 5000;
  public static final long DEFAULT_DURATION_UPDATE_MILLIS = 1000 / 20;

  /** Time the call screen stays up after the remote party ended or the call failed. */
  public abstract long dismissDelayMillis();

  /** Time the fleeting settings nag stays up before the call screen goes away. */
  public abstract long nagAutoDismissMillis();

  /** Refresh period of the call duration while connected. */
  public abstract long durationUpdateMillis();

  public static CallScreenTimings create(
      long dismissDelayMillis, long nagAutoDismissMillis, long durationUpdateMillis) {
    Assert.checkArgument(dismissDelayMillis >= 0, "dismiss delay: %d", dismissDelayMillis);
    Assert.checkArgument(nagAutoDismissMillis >= 0, "nag delay: %d", nagAutoDismissMillis);
    Assert.checkArgument(durationUpdateMillis > 0, "duration period: %d", durationUpdateMillis);
    return new AutoValue_CallScreenTimings(
        dismissDelayMillis, nagAutoDismissMillis, durationUpdateMillis);
  }

  public static CallScreenTimings defaults() {
    return create(
        DEFAULT_DISMISS_DELAY_MILLIS,
        DEFAULT_NAG_AUTO_DISMISS_MILLIS,
        DEFAULT_DURATION_UPDATE_MILLIS);
  }

  public static CallScreenTimings fromConfig(ConfigProvider configProvider) {
    return create(
        configProvider.getLong(KEY_DISMISS_DELAY_MILLIS, DEFAULT_DISMISS_DELAY_MILLIS),
        configProvider.getLong(KEY_NAG_AUTO_DISMISS_MILLIS, DEFAULT_NAG_AUTO_DISMISS_MILLIS),
        configProvider.getLong(KEY_DURATION_UPDATE_MILLIS, DEFAULT_DURATION_UPDATE_MILLIS));
  }
}
