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

import com.android.callscreen.configprovider.ConfigProvider;
import java.util.Locale;
import junit.framework.TestCase;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

public class CallScreenStringsTest extends TestCase {

  @Mock private ConfigProvider configProvider;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    MockitoAnnotations.initMocks(this);
    Mockito.when(configProvider.getString(Mockito.anyString(), Mockito.anyString()))
        .thenAnswer(invocation -> invocation.getArgument(1));
  }

  public void testLoad_ReadsBundledStrings() {
    CallScreenStrings strings = CallScreenStrings.load(Locale.ROOT, configProvider);

    assertEquals("Connecting…", strings.get(CallScreenStrings.CALL_STATUS_CONNECTING));
    assertEquals("No Answer", strings.get(CallScreenStrings.CALL_STATUS_NO_ANSWER));
    assertEquals("Busy", strings.formatStatus("Busy"));
  }

  public void testLoad_StatusFormatFromConfig() {
    Mockito.when(
            configProvider.getString(
                Mockito.eq(CallScreenStrings.KEY_STATUS_FORMAT), Mockito.anyString()))
        .thenReturn("Signal %s");

    CallScreenStrings strings = CallScreenStrings.load(Locale.ROOT, configProvider);

    assertEquals("Signal Busy", strings.formatStatus("Busy"));
  }

  public void testLoad_MalformedStatusFormatFallsBack() {
    Mockito.when(
            configProvider.getString(
                Mockito.eq(CallScreenStrings.KEY_STATUS_FORMAT), Mockito.anyString()))
        .thenReturn("%d%%");

    CallScreenStrings strings = CallScreenStrings.load(Locale.ROOT, configProvider);

    assertEquals("Busy", strings.formatStatus("Busy"));
  }

  public void testCheckStatusFormat() {
    assertEquals("Signal %s", CallScreenStrings.checkStatusFormat("Signal %s"));
    assertEquals("%s", CallScreenStrings.checkStatusFormat("%d%%"));
    assertEquals("%s", CallScreenStrings.checkStatusFormat("Signal %s %s"));
    assertEquals("%s", CallScreenStrings.checkStatusFormat("%"));
    // Dropping the status would leave the status label blank.
    assertEquals("%s", CallScreenStrings.checkStatusFormat("Signal"));
  }
}
