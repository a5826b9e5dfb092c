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


package com.android.callscreen.common;

import com.android.callscreen.testing.FakeUiThreadScheduler;
import junit.framework.TestCase;

public class AssertTest extends TestCase {

  private final FakeUiThreadScheduler scheduler = new FakeUiThreadScheduler();

  @Override
  protected void tearDown() throws Exception {
    Assert.setAreThreadAssertsEnabled(true);
    super.tearDown();
  }

  public void testCheckArgument_Message() {
    try {
      Assert.checkArgument(false, "bad value: %d", 42);
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("bad value: 42", e.getMessage());
    }
  }

  public void testCheckState() {
    Assert.checkState(true);
    try {
      Assert.checkState(false);
      fail();
    } catch (IllegalStateException e) {
      assertNull(e.getMessage());
    }
  }

  public void testIsNotNull() {
    assertEquals("value", Assert.isNotNull("value"));
    try {
      Assert.isNotNull(null, "missing %s", "thing");
      fail();
    } catch (NullPointerException e) {
      assertEquals("missing thing", e.getMessage());
    }
  }

  public void testIsUiThread() {
    Assert.isUiThread(scheduler);

    scheduler.setIsUiThread(false);
    try {
      Assert.isUiThread(scheduler);
      fail();
    } catch (IllegalStateException e) {}
  }

  public void testIsUiThread_Disabled() {
    scheduler.setIsUiThread(false);
    Assert.setAreThreadAssertsEnabled(false);

    Assert.isUiThread(scheduler);
  }
}
