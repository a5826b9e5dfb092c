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
import com.android.callscreen.common.Assert;
import javax.inject.Inject;

/** Maps a call to the text of the status label. Every call state has a text. */
public class CallStatusTextFormatter {

  private final CallScreenStrings strings;

  @Inject
  public CallStatusTextFormatter(CallScreenStrings strings) {
    this.strings = Assert.isNotNull(strings);
  }

  public String getStatusText(CallSnapshot call, long nowMillis) {
    return strings.formatStatus(getTextForCallState(call, nowMillis));
  }

  private String getTextForCallState(CallSnapshot call, long nowMillis) {
    switch (call.state()) {
      case IDLE:
      case REMOTE_HANGUP:
      case LOCAL_HANGUP:
        return strings.get(CallScreenStrings.CALL_STATUS_TERMINATED);
      case DIALING:
        return strings.get(CallScreenStrings.CALL_STATUS_CONNECTING);
      case REMOTE_RINGING:
      case LOCAL_RINGING:
        return strings.get(CallScreenStrings.CALL_STATUS_RINGING);
      case ANSWERING:
        return strings.get(CallScreenStrings.CALL_STATUS_SECURING);
      case CONNECTED:
        long connectTimeMillis = call.connectTimeMillis().or(nowMillis);
        return CallDurationFormatter.formatDuration(nowMillis - connectTimeMillis);
      case REMOTE_BUSY:
        return strings.get(CallScreenStrings.CALL_STATUS_BUSY);
      case LOCAL_FAILURE:
        if (call.error().isPresent()
            && call.error().get().kind() == CallError.Kind.TIMEOUT
            && call.direction() == CallDirection.OUTGOING) {
          return strings.get(CallScreenStrings.CALL_STATUS_NO_ANSWER);
        }
        return strings.get(CallScreenStrings.CALL_STATUS_FAILED);
    }
    throw Assert.createIllegalStateFailException("unknown call state: " + call.state());
  }
}
