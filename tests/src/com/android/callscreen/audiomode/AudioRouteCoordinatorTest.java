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


package com.android.callscreen.audiomode;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import junit.framework.TestCase;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

public class AudioRouteCoordinatorTest extends TestCase {

  private static final AudioSource RECEIVER =
      new AudioSource(AudioSource.Kind.BUILT_IN_MIC, "receiver", "iPhone");
  private static final AudioSource SPEAKER =
      new AudioSource(AudioSource.Kind.BUILT_IN_SPEAKER, "speaker", "Speaker");
  private static final AudioSource HEADSET =
      new AudioSource(AudioSource.Kind.EXTERNAL_DEVICE, "bt:00:11", "Headset");
  private static final AudioSource CAR_KIT =
      new AudioSource(AudioSource.Kind.EXTERNAL_DEVICE, "bt:22:33", "Car");

  @Mock private AudioService audioService;
  private AudioRouteCoordinator coordinator;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    MockitoAnnotations.initMocks(this);
    Mockito.when(audioService.availableInputs()).thenReturn(ImmutableSet.of(RECEIVER, SPEAKER));
    Mockito.when(audioService.currentAudioSource()).thenReturn(Optional.of(RECEIVER));
    coordinator = new AudioRouteCoordinator(audioService);
  }

  public void testConstructor_SeedsPoolFromService() {
    assertEquals(ImmutableSet.of(RECEIVER, SPEAKER), coordinator.allSources());
    assertFalse(coordinator.hasAlternateSources());
  }

  public void testObserve_AddsNewSources() {
    coordinator.observe(ImmutableSet.of(RECEIVER, SPEAKER, HEADSET));

    assertEquals(ImmutableSet.of(RECEIVER, SPEAKER, HEADSET), coordinator.allSources());
    assertTrue(coordinator.hasAlternateSources());
  }

  public void testObserve_NeverRemovesSources() {
    coordinator.observe(ImmutableSet.of(HEADSET));
    coordinator.observe(ImmutableSet.of(RECEIVER));
    coordinator.observe(ImmutableSet.<AudioSource>of());

    assertEquals(ImmutableSet.of(RECEIVER, SPEAKER, HEADSET), coordinator.allSources());
    assertTrue(coordinator.hasAlternateSources());
  }

  public void testObserve_SameDescriptorIsSameSource() {
    coordinator.observe(
        ImmutableSet.of(new AudioSource(AudioSource.Kind.BUILT_IN_SPEAKER, "speaker", "Loud")));

    assertEquals(2, coordinator.allSources().size());
  }

  public void testAppropriateSources_AudioCall() {
    coordinator.observe(ImmutableSet.of(HEADSET));

    assertEquals(
        ImmutableSet.of(RECEIVER, SPEAKER, HEADSET), coordinator.appropriateSources(false));
  }

  public void testAppropriateSources_VideoCallExcludesReceiver() {
    coordinator.observe(ImmutableSet.of(HEADSET, CAR_KIT));

    assertEquals(
        ImmutableSet.of(SPEAKER, HEADSET, CAR_KIT), coordinator.appropriateSources(true));
  }

  public void testPickerOptions_ChecksCurrentSource() {
    coordinator.observe(ImmutableSet.of(HEADSET));
    Mockito.when(audioService.currentAudioSource()).thenReturn(Optional.of(HEADSET));

    assertEquals(
        ImmutableList.of(
            AudioSourceOption.create(RECEIVER, false),
            AudioSourceOption.create(SPEAKER, false),
            AudioSourceOption.create(HEADSET, true)),
        coordinator.pickerOptions(false));
  }

  public void testPickerOptions_NoCurrentSource() {
    Mockito.when(audioService.currentAudioSource()).thenReturn(Optional.<AudioSource>absent());

    for (AudioSourceOption option : coordinator.pickerOptions(true)) {
      assertFalse(option.isChecked());
    }
  }

  public void testSelect_RoutesThroughService() {
    coordinator.select(HEADSET);

    Mockito.verify(audioService).setAudioSource(HEADSET);
  }
}
