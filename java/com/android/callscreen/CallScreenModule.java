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

import com.android.callscreen.common.time.Clock;
import com.android.callscreen.common.time.SystemClock;
import com.android.callscreen.configprovider.ConfigProvider;
import com.android.callscreen.configprovider.ConfigProviderModule;
import com.android.callscreen.incall.CallScreenStrings;
import com.android.callscreen.incall.CallScreenTimings;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import java.util.Locale;

/** Module which binds the call screen's own implementations. */
@Module(includes = ConfigProviderModule.class)
public abstract class CallScreenModule {

  @Binds
  abstract Clock bindClock(SystemClock systemClock);

  @Provides
  static CallScreenTimings provideCallScreenTimings(ConfigProvider configProvider) {
    return CallScreenTimings.fromConfig(configProvider);
  }

  @Provides
  static CallScreenStrings provideCallScreenStrings(ConfigProvider configProvider) {
    return CallScreenStrings.load(Locale.getDefault(), configProvider);
  }
}
