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

import junit.framework.TestCase;

public class CallDurationFormatterTest extends TestCase {

  public void testFormatDuration_Zero() {
    assertEquals("0:00", CallDurationFormatter.formatDuration(0));
  }

  public void testFormatDuration_UnderOneMinute() {
    assertEquals("0:45", CallDurationFormatter.formatDuration(45_000));
  }

  public void testFormatDuration_TruncatesPartialSeconds() {
    assertEquals("0:01", CallDurationFormatter.formatDuration(1_999));
  }

  public void testFormatDuration_Minutes() {
    assertEquals("12:07", CallDurationFormatter.formatDuration((12 * 60 + 7) * 1000L));
  }

  public void testFormatDuration_OverOneHour() {
    assertEquals("1:02:05", CallDurationFormatter.formatDuration(3725_000));
  }

  public void testFormatDuration_Negative() {
    // Clock skew between the connect time and now.
    assertEquals("0:00", CallDurationFormatter.formatDuration(-5_000));
  }
}
