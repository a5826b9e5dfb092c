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

package com.android.callscreen.incall.protocol;

import com.android.callscreen.audiomode.AudioSourceOption;
import com.google.common.collect.ImmutableList;

/** Interface for the call screen UI. Implementations only draw, they make no decisions. */
public interface CallScreenUi {

  void render(CallScreenUiState state);

  /** Updates only the status label, used by the periodic call duration refresh. */
  void setStatusText(String statusText);

  void showAudioSourcePicker(ImmutableList<AudioSourceOption> options);
}
