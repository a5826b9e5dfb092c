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
import com.android.callscreen.common.LogUtil;
import com.android.callscreen.configprovider.ConfigProvider;
import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/** User-facing strings of the call screen, from the {@value #BUNDLE_NAME} resource bundle. */
public class CallScreenStrings {

  static final String BUNDLE_NAME = "callscreen_strings";
  static final String KEY_STATUS_FORMAT = "call_screen_status_format";
  static final String DEFAULT_STATUS_FORMAT = "%s";

  public static final String CALL_STATUS_TERMINATED = "call_status_terminated";
  public static final String CALL_STATUS_CONNECTING = "call_status_connecting";
  public static final String CALL_STATUS_RINGING = "call_status_ringing";
  public static final String CALL_STATUS_SECURING = "call_status_securing";
  public static final String CALL_STATUS_BUSY = "call_status_busy";
  public static final String CALL_STATUS_NO_ANSWER = "call_status_no_answer";
  public static final String CALL_STATUS_FAILED = "call_status_failed";

  private final ResourceBundle bundle;
  private final String statusFormat;

  CallScreenStrings(ResourceBundle bundle, String statusFormat) {
    this.bundle = Assert.isNotNull(bundle);
    this.statusFormat = Assert.isNotNull(statusFormat);
  }

  public static CallScreenStrings load(Locale locale, ConfigProvider configProvider) {
    return new CallScreenStrings(
        ResourceBundle.getBundle(BUNDLE_NAME, locale),
        checkStatusFormat(configProvider.getString(KEY_STATUS_FORMAT, DEFAULT_STATUS_FORMAT)));
  }

  /**
   * Returns {@code format} if it takes exactly the status text and keeps it, {@link
   * #DEFAULT_STATUS_FORMAT} otherwise.
   */
  static String checkStatusFormat(String format) {
    String sample = "status";
    try {
      if (String.format(format, sample).contains(sample)) {
        return format;
      }
      LogUtil.w("CallScreenStrings.checkStatusFormat", "format drops the status: %s", format);
    } catch (IllegalFormatException e) {
      LogUtil.w("CallScreenStrings.checkStatusFormat", "invalid format: %s, %s", format, e);
    }
    return DEFAULT_STATUS_FORMAT;
  }

  public String get(String key) {
    try {
      return bundle.getString(key);
    } catch (MissingResourceException e) {
      throw Assert.createAssertionFailException("missing string: " + key, e);
    }
  }

  /** Wraps a status text in the configured status format, e.g. "Signal %s". */
  public String formatStatus(String statusText) {
    return String.format(statusFormat, statusText);
  }
}
