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

import com.android.callscreen.call.CallDirection;
import com.android.callscreen.call.CallError;
import com.android.callscreen.call.CallSnapshot;
import com.android.callscreen.call.CallState;
import java.util.ListResourceBundle;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import junit.framework.TestCase;

public class CallStatusTextFormatterTest extends TestCase {

  private static final long NOW_MILLIS = 1_000_000;

  private CallStatusTextFormatter formatter;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    formatter = new CallStatusTextFormatter(new CallScreenStrings(englishStrings(), "%s"));
  }

  public void testGetStatusText_Idle() {
    assertEquals("Call Ended.", statusText(CallState.IDLE));
  }

  public void testGetStatusText_Dialing() {
    assertEquals("Connecting…", statusText(CallState.DIALING));
  }

  public void testGetStatusText_Ringing() {
    assertEquals("Ringing…", statusText(CallState.LOCAL_RINGING));
    assertEquals("Ringing…", statusText(CallState.REMOTE_RINGING));
  }

  public void testGetStatusText_Answering() {
    assertEquals("Answered. Securing…", statusText(CallState.ANSWERING));
  }

  public void testGetStatusText_Hangups() {
    assertEquals("Call Ended.", statusText(CallState.REMOTE_HANGUP));
    assertEquals("Call Ended.", statusText(CallState.LOCAL_HANGUP));
  }

  public void testGetStatusText_Busy() {
    assertEquals("Busy", statusText(CallState.REMOTE_BUSY));
  }

  public void testGetStatusText_Connected() {
    CallSnapshot call =
        CallSnapshot.builder()
            .setState(CallState.CONNECTED)
            .setConnectTimeMillis(NOW_MILLIS - 45_000)
            .build();
    assertEquals("0:45", formatter.getStatusText(call, NOW_MILLIS));
  }

  public void testGetStatusText_ConnectedWithoutConnectTime() {
    CallSnapshot call = CallSnapshot.builder().setState(CallState.CONNECTED).build();
    assertEquals("0:00", formatter.getStatusText(call, NOW_MILLIS));
  }

  public void testGetStatusText_OutgoingTimeout() {
    CallSnapshot call =
        CallSnapshot.builder()
            .setState(CallState.LOCAL_FAILURE)
            .setDirection(CallDirection.OUTGOING)
            .setError(CallError.timeout("no answer after 60s"))
            .build();
    assertEquals("No Answer", formatter.getStatusText(call, NOW_MILLIS));
  }

  public void testGetStatusText_IncomingTimeout() {
    CallSnapshot call =
        CallSnapshot.builder()
            .setState(CallState.LOCAL_FAILURE)
            .setDirection(CallDirection.INCOMING)
            .setError(CallError.timeout("no answer after 60s"))
            .build();
    assertEquals("Call Failed.", formatter.getStatusText(call, NOW_MILLIS));
  }

  public void testGetStatusText_OtherFailure() {
    CallSnapshot call =
        CallSnapshot.builder()
            .setState(CallState.LOCAL_FAILURE)
            .setError(CallError.failure("ice failed"))
            .build();
    assertEquals("Call Failed.", formatter.getStatusText(call, NOW_MILLIS));
  }

  public void testGetStatusText_FailureWithoutError() {
    assertEquals("Call Failed.", statusText(CallState.LOCAL_FAILURE));
  }

  public void testGetStatusText_EveryStateHasText() {
    for (CallState state : CallState.values()) {
      assertFalse(state.name(), statusText(state).isEmpty());
    }
  }

  public void testGetStatusText_AppliesStatusFormat() {
    formatter = new CallStatusTextFormatter(new CallScreenStrings(englishStrings(), "Signal %s"));
    assertEquals("Signal Busy", statusText(CallState.REMOTE_BUSY));
  }

  public void testGetStatusText_MissingString() {
    ResourceBundle empty =
        new ListResourceBundle() {
          @Override
          protected Object[][] getContents() {
            return new Object[0][];
          }
        };
    formatter = new CallStatusTextFormatter(new CallScreenStrings(empty, "%s"));
    try {
      statusText(CallState.REMOTE_BUSY);
      fail();
    } catch (AssertionError e) {
      assertTrue(e.getCause() instanceof MissingResourceException);
    }
  }

  private String statusText(CallState state) {
    return formatter.getStatusText(CallSnapshot.builder().setState(state).build(), NOW_MILLIS);
  }

  static ResourceBundle englishStrings() {
    return new ListResourceBundle() {
      @Override
      protected Object[][] getContents() {
        return new Object[][] {
          {CallScreenStrings.CALL_STATUS_TERMINATED, "Call Ended."},
          {CallScreenStrings.CALL_STATUS_CONNECTING, "Connecting…"},
          {CallScreenStrings.CALL_STATUS_RINGING, "Ringing…"},
          {CallScreenStrings.CALL_STATUS_SECURING, "Answered. Securing…"},
          {CallScreenStrings.CALL_STATUS_BUSY, "Busy"},
          {CallScreenStrings.CALL_STATUS_NO_ANSWER, "No Answer"},
          {CallScreenStrings.CALL_STATUS_FAILED, "Call Failed."},
        };
      }
    };
  }
}
