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
import junit.framework.TestCase;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

public class CallScreenTimingsTest extends TestCase {

  @Mock private ConfigProvider configProvider;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    MockitoAnnotations.initMocks(this);
    // Unknown keys fall back to the default passed in.
    Mockito.when(configProvider.getLong(Mockito.anyString(), Mockito.anyLong()))
        .thenAnswer(invocation -> invocation.getArgument(1));
  }

  public void testDefaults() {
    CallScreenTimings timings = CallScreenTimings.defaults();

    assertEquals(1500, timings.dismissDelayMillis());
    assertEquals(5000, timings.nagAutoDismissMillis());
    assertEquals(50, timings.durationUpdateMillis());
  }

  public void testFromConfig_Defaults() {
    assertEquals(CallScreenTimings.defaults(), CallScreenTimings.fromConfig(configProvider));
  }

  public void testFromConfig_Overrides() {
    Mockito.when(
            configProvider.getLong(
                Mockito.eq(CallScreenTimings.KEY_DISMISS_DELAY_MILLIS), Mockito.anyLong()))
        .thenReturn(3000L);
    Mockito.when(
            configProvider.getLong(
                Mockito.eq(CallScreenTimings.KEY_DURATION_UPDATE_MILLIS), Mockito.anyLong()))
        .thenReturn(1000L);

    CallScreenTimings timings = CallScreenTimings.fromConfig(configProvider);

    assertEquals(3000, timings.dismissDelayMillis());
    assertEquals(5000, timings.nagAutoDismissMillis());
    assertEquals(1000, timings.durationUpdateMillis());
  }

  public void testCreate_NegativeDelay() {
    try {
      CallScreenTimings.create(-1, 5000, 50);
      fail();
    } catch (IllegalArgumentException e) {}
  }

  public void testCreate_ZeroPeriod() {
    try {
      CallScreenTimings.create(1500, 5000, 0);
      fail();
    } catch (IllegalArgumentException e) {}
  }
}
