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


package com.android.callscreen.speakerbuttonlogic;

import junit.framework.TestCase;

public class AudioSourceButtonInfoTest extends TestCase {

  public void testNoAlternates_SpeakerToggle() {
    AudioSourceButtonInfo info = new AudioSourceButtonInfo(false, false, false, true);

    assertEquals(AudioSourceIcon.SPEAKER, info.icon);
    assertTrue(info.isVisible);
    assertTrue(info.isChecked);
  }

  public void testNoAlternates_HiddenBehindLocalVideo() {
    AudioSourceButtonInfo info = new AudioSourceButtonInfo(false, true, true, true);

    assertFalse(info.isVisible);
    assertFalse(info.isChecked);
  }

  public void testAlternates_NeverChecked() {
    AudioSourceButtonInfo info = new AudioSourceButtonInfo(true, false, false, true);

    assertEquals(AudioSourceIcon.BLUETOOTH_AUDIO_MODE, info.icon);
    assertTrue(info.isVisible);
    assertFalse(info.isChecked);
  }

  public void testAlternates_VideoModeIcon() {
    AudioSourceButtonInfo info = new AudioSourceButtonInfo(true, true, true, false);

    assertEquals(AudioSourceIcon.BLUETOOTH_VIDEO_MODE, info.icon);
    assertTrue(info.isVisible);
  }
}
