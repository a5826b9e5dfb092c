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

import java.util.Locale;

/** Formats the elapsed time of a connected call. */
public class CallDurationFormatter {

  private CallDurationFormatter() {}

  /**
   * Returns {@code elapsedMillis} as "H:MM:SS". The hour segment is left out below one hour, so 45
   * seconds read "0:45" and 3725 seconds read "1:02:05". Negative durations read "0:00".
   */
  public static String formatDuration(long elapsedMillis) {
    long elapsedSeconds = Math.max(0, elapsedMillis) / 1000;
    long hours = elapsedSeconds / 3600;
    long minutes = (elapsedSeconds % 3600) / 60;
    long seconds = elapsedSeconds % 60;
    if (hours > 0) {
      return String.format(Locale.US, "%d:%02d:%02d", hours, minutes, seconds);
    }
    return String.format(Locale.US, "%d:%02d", minutes, seconds);
  }
}
