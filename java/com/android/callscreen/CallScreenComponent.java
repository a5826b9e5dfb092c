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

import com.android.callscreen.audiomode.AudioService;
import com.android.callscreen.call.CallSession;
import com.android.callscreen.call.CallUiAdapter;
import com.android.callscreen.common.concurrent.UiThreadScheduler;
import com.android.callscreen.dismissal.CallIntegrationPlatform;
import com.android.callscreen.dismissal.CallIntegrationPreferences;
import com.android.callscreen.incall.protocol.CallScreenUi;
import com.android.callscreen.videosurface.Annotations.LocalVideoSurface;
import com.android.callscreen.videosurface.Annotations.RemoteVideoSurface;
import com.android.callscreen.videosurface.protocol.VideoSurface;
import dagger.BindsInstance;
import dagger.Component;

/**
 * Dagger component for one call screen. The host supplies the platform services, the component
 * builds the controller and everything behind it.
 */
@Component(modules = CallScreenModule.class)
public interface CallScreenComponent {

  CallScreenController callScreenController();

  static Builder builder() {
    return DaggerCallScreenComponent.builder();
  }

  /** Builder for {@link CallScreenComponent}. */
  @Component.Builder
  interface Builder {
    @BindsInstance
    Builder callSession(CallSession callSession);

    @BindsInstance
    Builder callUiAdapter(CallUiAdapter callUiAdapter);

    @BindsInstance
    Builder audioService(AudioService audioService);

    @BindsInstance
    Builder windowManager(WindowManagerAdapter windowManager);

    @BindsInstance
    Builder proximitySensor(ProximitySensor proximitySensor);

    @BindsInstance
    Builder callScreenUi(CallScreenUi callScreenUi);

    @BindsInstance
    Builder uiThreadScheduler(UiThreadScheduler uiThreadScheduler);

    @BindsInstance
    Builder callIntegrationPreferences(CallIntegrationPreferences callIntegrationPreferences);

    @BindsInstance
    Builder callIntegrationPlatform(CallIntegrationPlatform callIntegrationPlatform);

    @BindsInstance
    Builder localVideoSurface(@LocalVideoSurface VideoSurface localVideoSurface);

    @BindsInstance
    Builder remoteVideoSurface(@RemoteVideoSurface VideoSurface remoteVideoSurface);

    CallScreenComponent build();
  }
}
