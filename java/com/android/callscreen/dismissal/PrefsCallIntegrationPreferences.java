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

import com.android.callscreen.common.Assert;
import com.android.callscreen.common.LogUtil;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * {@link CallIntegrationPreferences} stored in a {@link Preferences} node. A setting counts as set
 * once its key exists in the node.
 */
public class PrefsCallIntegrationPreferences implements CallIntegrationPreferences {

  static final String KEY_CALL_INTEGRATION_ENABLED = "call_integration_enabled";
  static final String KEY_CALL_INTEGRATION_PRIVACY_ENABLED = "call_integration_privacy_enabled";

  private static final boolean DEFAULT_CALL_INTEGRATION_ENABLED = true;
  private static final boolean DEFAULT_CALL_INTEGRATION_PRIVACY_ENABLED = false;

  private final Preferences preferences;

  public PrefsCallIntegrationPreferences() {
    this(Preferences.userNodeForPackage(PrefsCallIntegrationPreferences.class));
  }

  public PrefsCallIntegrationPreferences(Preferences preferences) {
    this.preferences = Assert.isNotNull(preferences);
  }

  @Override
  public boolean isCallIntegrationEnabled() {
    return preferences.getBoolean(KEY_CALL_INTEGRATION_ENABLED, DEFAULT_CALL_INTEGRATION_ENABLED);
  }

  @Override
  public void setCallIntegrationEnabled(boolean enabled) {
    put(KEY_CALL_INTEGRATION_ENABLED, enabled);
  }

  @Override
  public boolean isCallIntegrationPrivacyEnabled() {
    return preferences.getBoolean(
        KEY_CALL_INTEGRATION_PRIVACY_ENABLED, DEFAULT_CALL_INTEGRATION_PRIVACY_ENABLED);
  }

  @Override
  public void setCallIntegrationPrivacyEnabled(boolean enabled) {
    put(KEY_CALL_INTEGRATION_PRIVACY_ENABLED, enabled);
  }

  @Override
  public boolean isCallIntegrationEnabledSet() {
    return preferences.get(KEY_CALL_INTEGRATION_ENABLED, null) != null;
  }

  @Override
  public boolean isCallIntegrationPrivacySet() {
    return preferences.get(KEY_CALL_INTEGRATION_PRIVACY_ENABLED, null) != null;
  }

  private void put(String key, boolean value) {
    LogUtil.i("PrefsCallIntegrationPreferences.put", "%s = %b", key, value);
    preferences.putBoolean(key, value);
    try {
      preferences.flush();
    } catch (BackingStoreException e) {
      // The node keeps the value in memory; it is only lost across restarts.
      LogUtil.w("PrefsCallIntegrationPreferences.put", "unable to persist %s: %s", key, e);
    }
  }
}
