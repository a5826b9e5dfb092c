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

import com.android.callscreen.audiomode.AudioRouteCoordinator;
import com.android.callscreen.audiomode.AudioService;
import com.android.callscreen.audiomode.AudioServiceDelegate;
import com.android.callscreen.audiomode.AudioSource;
import com.android.callscreen.call.CallObserver;
import com.android.callscreen.call.CallSession;
import com.android.callscreen.call.CallSnapshot;
import com.android.callscreen.call.CallState;
import com.android.callscreen.call.CallUiAdapter;
import com.android.callscreen.common.Assert;
import com.android.callscreen.common.LogUtil;
import com.android.callscreen.common.concurrent.UiThreadScheduler;
import com.android.callscreen.common.time.Clock;
import com.android.callscreen.dismissal.CallIntegrationPlatform;
import com.android.callscreen.dismissal.CallIntegrationPreferences;
import com.android.callscreen.dismissal.DismissalPolicy;
import com.android.callscreen.dismissal.DismissalState;
import com.android.callscreen.incall.CallScreenTimings;
import com.android.callscreen.incall.UiStateProjector;
import com.android.callscreen.incall.protocol.CallScreenUi;
import com.android.callscreen.incall.protocol.CallScreenUiDelegate;
import com.android.callscreen.incall.protocol.CallScreenUiState;
import com.android.callscreen.incall.protocol.ProjectorInput;
import com.android.callscreen.videosurface.VideoBinding;
import com.android.callscreen.videosurface.VideoTrackBinder;
import com.android.callscreen.videosurface.protocol.VideoTrack;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import java.util.concurrent.Future;
import javax.annotation.Nullable;
import javax.inject.Inject;

/**
 * Logic for the call screen: receives call, audio and video events, derives the UI state and
 * decides when the screen goes away.
 *
 * <p>Everything runs on the UI thread of {@link UiThreadScheduler}. The controller is fully built
 * by its constructor; {@link #start()} subscribes it to the call and {@link #tearDown()} detaches
 * it again.
 */
public class CallScreenController
    implements CallObserver, AudioServiceDelegate, CallScreenUiDelegate, DismissalPolicy.Host {

  private final CallSession callSession;
  private final CallUiAdapter callUiAdapter;
  private final AudioService audioService;
  private final WindowManagerAdapter windowManager;
  private final ProximitySensor proximitySensor;
  private final CallScreenUi callScreenUi;
  private final UiThreadScheduler uiThreadScheduler;
  private final Clock clock;
  private final CallScreenTimings timings;
  private final UiStateProjector projector;
  private final AudioRouteCoordinator audioRouteCoordinator;
  private final VideoTrackBinder videoTrackBinder;
  private final DismissalPolicy dismissalPolicy;

  private CallSnapshot call;
  private boolean shouldRemoteControlsBeHidden;
  private boolean isSpeakerphoneSelected;
  @Nullable private Future<?> callDurationTimer;
  private int generation;
  private boolean isStarted;
  private boolean isTornDown;

  @Inject
  public CallScreenController(
      CallSession callSession,
      CallUiAdapter callUiAdapter,
      AudioService audioService,
      WindowManagerAdapter windowManager,
      ProximitySensor proximitySensor,
      CallScreenUi callScreenUi,
      UiThreadScheduler uiThreadScheduler,
      Clock clock,
      CallScreenTimings timings,
      UiStateProjector projector,
      AudioRouteCoordinator audioRouteCoordinator,
      VideoTrackBinder videoTrackBinder,
      CallIntegrationPreferences callIntegrationPreferences,
      CallIntegrationPlatform callIntegrationPlatform) {
    this.callSession = Assert.isNotNull(callSession);
    this.callUiAdapter = Assert.isNotNull(callUiAdapter);
    this.audioService = Assert.isNotNull(audioService);
    this.windowManager = Assert.isNotNull(windowManager);
    this.proximitySensor = Assert.isNotNull(proximitySensor);
    this.callScreenUi = Assert.isNotNull(callScreenUi);
    this.uiThreadScheduler = Assert.isNotNull(uiThreadScheduler);
    this.clock = Assert.isNotNull(clock);
    this.timings = Assert.isNotNull(timings);
    this.projector = Assert.isNotNull(projector);
    this.audioRouteCoordinator = Assert.isNotNull(audioRouteCoordinator);
    this.videoTrackBinder = Assert.isNotNull(videoTrackBinder);
    this.dismissalPolicy =
        new DismissalPolicy(
            this, callIntegrationPreferences, callIntegrationPlatform, uiThreadScheduler, timings);
    this.call = Assert.isNotNull(callSession.getSnapshot());
    this.isSpeakerphoneSelected = audioService.isSpeakerphoneEnabled();
  }

  /** Subscribes to the call and the audio service and renders the first state. */
  public void start() {
    Assert.isUiThread(uiThreadScheduler);
    Assert.checkState(!isStarted, "already started");
    Assert.checkState(!isTornDown, "start after tear down");
    isStarted = true;

    Assert.checkState(audioService.getDelegate() == null, "audio service already has a delegate");
    audioService.setDelegate(this);

    // Subscribe for future call updates
    callSession.addObserver(this);
    call = callSession.getSnapshot();
    LogUtil.i("CallScreenController.start", "call: %s", call);
    updateCallUi();
  }

  /** Detaches from every collaborator. Pending delayed work becomes a no-op. */
  public void tearDown() {
    Assert.isUiThread(uiThreadScheduler);
    if (isTornDown) {
      return;
    }
    LogUtil.enterBlock("CallScreenController.tearDown");
    isTornDown = true;
    generation++;
    callSession.removeObserver(this);
    detachAudioDelegate();
    cancelCallDurationTimer();
    dismissalPolicy.tearDown();
    videoTrackBinder.unbindAll();
    proximitySensor.setMonitoringEnabled(false);
  }

  public DismissalState getDismissalState() {
    return dismissalPolicy.getState();
  }

  @VisibleForTesting
  DismissalPolicy getDismissalPolicy() {
    return dismissalPolicy;
  }

  @VisibleForTesting
  boolean isCallDurationTimerRunning() {
    return callDurationTimer != null;
  }

  // CallObserver

  @Override
  public void onStateChanged(CallSnapshot call) {
    if (ignoreAfterTearDown("CallScreenController.onStateChanged")) {
      return;
    }
    LogUtil.i("CallScreenController.onStateChanged", "new call status: %s", call.state());
    if (call.error().isPresent()) {
      LogUtil.i("CallScreenController.onStateChanged", "call error: %s", call.error().get());
    }
    this.call = call;
    updateCallUi();
  }

  @Override
  public void onMuteChanged(CallSnapshot call) {
    if (ignoreAfterTearDown("CallScreenController.onMuteChanged")) {
      return;
    }
    this.call = call;
    updateCallUi();
  }

  @Override
  public void onHasLocalVideoChanged(CallSnapshot call) {
    if (ignoreAfterTearDown("CallScreenController.onHasLocalVideoChanged")) {
      return;
    }
    this.call = call;
    updateCallUi();
  }

  @Override
  public void onHoldChanged(CallSnapshot call) {
    if (ignoreAfterTearDown("CallScreenController.onHoldChanged")) {
      return;
    }
    this.call = call;
    updateCallUi();
  }

  @Override
  public void onAudioSourceChanged(CallSnapshot call, Optional<AudioSource> audioSource) {
    if (ignoreAfterTearDown("CallScreenController.onAudioSourceChanged")) {
      return;
    }
    LogUtil.i("CallScreenController.onAudioSourceChanged", "audio source: %s", audioSource);
    this.call = call;
    updateCallUi();
  }

  @Override
  public void onVideoTracksChanged(
      @Nullable VideoTrack localTrack, @Nullable VideoTrack remoteTrack) {
    if (ignoreAfterTearDown("CallScreenController.onVideoTracksChanged")) {
      return;
    }
    boolean localChanged = videoTrackBinder.bindLocal(localTrack);
    boolean remoteChanged = videoTrackBinder.bindRemote(remoteTrack);
    if (remoteChanged) {
      // A fresh remote stream does not inherit hidden controls.
      shouldRemoteControlsBeHidden = false;
    }
    if (localChanged || remoteChanged) {
      updateCallUi();
    }
  }

  // AudioServiceDelegate

  @Override
  public void onSpeakerphoneChanged(boolean isSpeakerphoneEnabled) {
    if (ignoreAfterTearDown("CallScreenController.onSpeakerphoneChanged")) {
      return;
    }
    isSpeakerphoneSelected = isSpeakerphoneEnabled;
    updateCallUi();
  }

  @Override
  public void onAudioSessionChanged() {
    if (ignoreAfterTearDown("CallScreenController.onAudioSessionChanged")) {
      return;
    }
    audioRouteCoordinator.observe(audioService.availableInputs());
    updateCallUi();
  }

  // CallScreenUiDelegate

  @Override
  public void onScreenShown() {
    checkActive("onScreenShown");
    proximitySensor.setMonitoringEnabled(true);
    updateCallUi();
  }

  @Override
  public void onScreenHidden() {
    checkActive("onScreenHidden");
    proximitySensor.setMonitoringEnabled(false);
    cancelCallDurationTimer();
  }

  @Override
  public void onAppForegrounded() {
    checkActive("onAppForegrounded");
    shouldRemoteControlsBeHidden = false;
    updateCallUi();
  }

  @Override
  public void onRootViewTouched() {
    checkActive("onRootViewTouched");
    if (videoTrackBinder.isRemoteVideoVisible()) {
      shouldRemoteControlsBeHidden = !shouldRemoteControlsBeHidden;
      updateCallUi();
    }
    // Background taps also leave the call view.
    windowManager.leaveCallView();
  }

  @Override
  public void onLeaveCallViewTapped() {
    checkActive("onLeaveCallViewTapped");
    windowManager.leaveCallView();
  }

  @Override
  public void onAnswerClicked() {
    checkActive("onAnswerClicked");
    LogUtil.enterBlock("CallScreenController.onAnswerClicked");
    callUiAdapter.answerCall();
  }

  @Override
  public void onDeclineClicked() {
    checkActive("onDeclineClicked");
    LogUtil.enterBlock("CallScreenController.onDeclineClicked");
    callUiAdapter.declineCall();
    dismissIfPossible(false /* shouldDelay */, false /* ignoreNag */, null);
  }

  @Override
  public void onHangupClicked() {
    checkActive("onHangupClicked");
    LogUtil.enterBlock("CallScreenController.onHangupClicked");
    callUiAdapter.localHangupCall();
    dismissIfPossible(false /* shouldDelay */, false /* ignoreNag */, null);
  }

  @Override
  public void onMuteClicked() {
    checkActive("onMuteClicked");
    boolean isMuted = !call.isMuted();
    LogUtil.i("CallScreenController.onMuteClicked", "muted: %b", isMuted);
    callUiAdapter.setMuted(isMuted);
  }

  @Override
  public void onVideoClicked() {
    checkActive("onVideoClicked");
    boolean hasLocalVideo = !call.hasLocalVideo();
    LogUtil.i("CallScreenController.onVideoClicked", "local video: %b", hasLocalVideo);
    callUiAdapter.setHasLocalVideo(hasLocalVideo);
  }

  @Override
  public void onAudioSourceClicked() {
    checkActive("onAudioSourceClicked");
    LogUtil.enterBlock("CallScreenController.onAudioSourceClicked");
    if (audioRouteCoordinator.hasAlternateSources()) {
      callScreenUi.showAudioSourcePicker(
          audioRouteCoordinator.pickerOptions(call.hasLocalVideo()));
      return;
    }
    // The speakerphone switch is slow and asynchronous, select the button right away and let
    // onSpeakerphoneChanged confirm it.
    isSpeakerphoneSelected = !isSpeakerphoneSelected;
    audioService.requestSpeakerphone(isSpeakerphoneSelected);
    updateCallUi();
  }

  @Override
  public void onAudioSourceSelected(AudioSource audioSource) {
    checkActive("onAudioSourceSelected");
    audioRouteCoordinator.select(audioSource);
  }

  @Override
  public void onShowCallSettingsClicked() {
    checkActive("onShowCallSettingsClicked");
    LogUtil.enterBlock("CallScreenController.onShowCallSettingsClicked");
    dismissalPolicy.markNagComplete();
    dismissIfPossible(
        false /* shouldDelay */, true /* ignoreNag */, windowManager::showPrivacySettings);
  }

  @Override
  public void onDismissNagClicked() {
    checkActive("onDismissNagClicked");
    LogUtil.enterBlock("CallScreenController.onDismissNagClicked");
    dismissalPolicy.markNagComplete();
    dismissIfPossible(false /* shouldDelay */, true /* ignoreNag */, null);
  }

  // DismissalPolicy.Host

  @Override
  public void onSettingsNagChanged(boolean isShowingNag) {
    LogUtil.i("CallScreenController.onSettingsNagChanged", "showing: %b", isShowingNag);
    updateCallUi();
  }

  @Override
  public void onDismissed() {
    cancelCallDurationTimer();
  }

  @Override
  public void endCall() {
    windowManager.endCall(this);
  }

  private void dismissIfPossible(
      boolean shouldDelay, boolean ignoreNag, @Nullable Runnable completion) {
    detachAudioDelegate();
    dismissalPolicy.requestDismiss(call.direction(), shouldDelay, ignoreNag, completion);
  }

  private void updateCallUi() {
    Assert.isUiThread(uiThreadScheduler);
    CallScreenUiState state = projector.project(buildProjectorInput());
    callScreenUi.render(state);
    if (state.settingsNagVisible()) {
      // The nag covers the status label and waits for the user.
      cancelCallDurationTimer();
      return;
    }

    // Dismiss handling
    CallState callState = call.state();
    if (callState.dismissesAfterDelay()) {
      LogUtil.d(
          "CallScreenController.updateCallUi",
          "dismissing after delay because new state is %s",
          callState);
      dismissIfPossible(true /* shouldDelay */, false /* ignoreNag */, null);
    } else if (callState.dismissesImmediately()) {
      LogUtil.d("CallScreenController.updateCallUi", "dismissing immediately from local hangup");
      dismissIfPossible(false /* shouldDelay */, false /* ignoreNag */, null);
    }

    if (call.state() == CallState.CONNECTED && !dismissalPolicy.getState().hasDismissed()) {
      if (callDurationTimer == null) {
        startCallDurationTimer();
      }
    } else {
      cancelCallDurationTimer();
    }
  }

  private ProjectorInput buildProjectorInput() {
    VideoBinding videoBinding = videoTrackBinder.getBinding();
    return ProjectorInput.builder()
        .setCall(call)
        .setDismissalState(dismissalPolicy.getState())
        .setNagReason(dismissalPolicy.getNagReason())
        .setIsLocalVideoVisible(videoBinding.isLocalVideoVisible())
        .setIsRemoteVideoVisible(videoBinding.isRemoteVideoVisible())
        .setHasAlternateAudioSources(audioRouteCoordinator.hasAlternateSources())
        .setIsSpeakerphoneSelected(isSpeakerphoneSelected)
        .setShouldRemoteControlsBeHidden(shouldRemoteControlsBeHidden)
        .setNowMillis(clock.currentTimeMillis())
        .build();
  }

  private void startCallDurationTimer() {
    final int scheduledGeneration = generation;
    callDurationTimer =
        uiThreadScheduler.postAtFixedRate(
            () -> {
              if (scheduledGeneration != generation
                  || dismissalPolicy.getState().hasDismissed()) {
                return;
              }
              updateCallDuration();
            },
            timings.durationUpdateMillis());
  }

  private void updateCallDuration() {
    callScreenUi.setStatusText(projector.getStatusText(call, clock.currentTimeMillis()));
  }

  private void cancelCallDurationTimer() {
    if (callDurationTimer != null) {
      callDurationTimer.cancel(false);
      callDurationTimer = null;
    }
  }

  private void detachAudioDelegate() {
    if (audioService.getDelegate() == this) {
      audioService.setDelegate(null);
    }
  }

  private void checkActive(String method) {
    Assert.isUiThread(uiThreadScheduler);
    Assert.checkState(!isTornDown, "%s after tear down", method);
  }

  private boolean ignoreAfterTearDown(String tag) {
    Assert.isUiThread(uiThreadScheduler);
    if (isTornDown) {
      LogUtil.w(tag, "ignored after tear down");
      return true;
    }
    return false;
  }
}
