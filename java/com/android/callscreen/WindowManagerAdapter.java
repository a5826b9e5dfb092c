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

package com.android.callscreen;

/** The window system hosting the call screen. Calls are fire-and-forget. */
public interface WindowManagerAdapter {

  /** Removes the call screen of {@code callScreenController}. */
  void endCall(CallScreenController callScreenController);

  /** Moves the call screen out of the way while the call continues. */
  void leaveCallView();

  /** Opens the privacy settings of the app, after the call screen was removed. */
  void showPrivacySettings();
}
