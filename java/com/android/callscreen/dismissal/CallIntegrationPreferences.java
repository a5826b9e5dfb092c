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

package com.android.callscreen.dismissal;

/** User settings of the system call-answering integration. */
public interface CallIntegrationPreferences {

  boolean isCallIntegrationEnabled();

  void setCallIntegrationEnabled(boolean enabled);

  /** Whether caller details are hidden from the system call log and lock screen. */
  boolean isCallIntegrationPrivacyEnabled();

  void setCallIntegrationPrivacyEnabled(boolean enabled);

  /** Whether the user (or the nag) ever wrote {@link #setCallIntegrationEnabled}. */
  boolean isCallIntegrationEnabledSet();

  /** Whether the user (or the nag) ever wrote {@link #setCallIntegrationPrivacyEnabled}. */
  boolean isCallIntegrationPrivacySet();
}
