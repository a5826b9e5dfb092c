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

package com.android.callscreen.call;

import com.google.auto.value.AutoValue;
import com.google.common.base.Optional;

/** An already classified error reported by the call model. Errors are data, never thrown. */
@AutoValue
public abstract class CallError {

  /** Error categories the call screen distinguishes. */
  public enum Kind {
    TIMEOUT,
    FAILURE
  }

  public abstract Kind kind();

  public abstract Optional<String> description();

  public static CallError timeout(String description) {
    return new AutoValue_CallError(Kind.TIMEOUT, Optional.of(description));
  }

  public static CallError failure(String description) {
    return new AutoValue_CallError(Kind.FAILURE, Optional.of(description));
  }
}
