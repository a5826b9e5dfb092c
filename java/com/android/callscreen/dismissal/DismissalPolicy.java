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

package com.android.callscreen.dismissal;

import com.android.callscreen.call.CallDirection;
import com.android.callscreen.common.Assert;
import com.android.callscreen.common.LogUtil;
import com.android.callscreen.common.concurrent.UiThreadScheduler;
import com.android.callscreen.incall.CallScreenTimings;
import com.google.common.annotations.VisibleForTesting;
import java.util.concurrent.Future;
import javax.annotation.Nullable;

/**
 * Decides when and how the call screen goes away.
 *
 * <p>Before an incoming call screen is dismissed the user may be reminded, once, to review the
 * settings of the system call integration. Once dismissed, the policy ignores every further
 * request, including the ones made re-entrantly from its own callbacks.
 */
public class DismissalPolicy {

  /** Phases of the dismissal state machine. {@link #DISMISSED} is terminal. */
  public enum Phase {
    ACTIVE,
    NAG_PENDING,
    NAG_DISMISSED,
    DISMISSED
  }

  /** Callbacks from the policy out to the call screen. */
  public interface Host {

    /** The settings nag was shown or hidden. */
    void onSettingsNagChanged(boolean isShowingNag);

    /** The dismissal latch was set. Called before {@link #endCall()}. */
    void onDismissed();

    /** Removes the call screen from the window. */
    void endCall();
  }

  private final Host host;
  private final CallIntegrationPreferences preferences;
  private final CallIntegrationPlatform platform;
  private final UiThreadScheduler uiThreadScheduler;
  private final CallScreenTimings timings;

  @Nullable private Future<?> delayedFinish;
  @Nullable private Future<?> fleetingNagTimeout;
  private Phase phase = Phase.ACTIVE;
  private NagReason nagReason = NagReason.ALL;
  private int generation;

  public DismissalPolicy(
      Host host,
      CallIntegrationPreferences preferences,
      CallIntegrationPlatform platform,
      UiThreadScheduler uiThreadScheduler,
      CallScreenTimings timings) {
    this.host = Assert.isNotNull(host);
    this.preferences = Assert.isNotNull(preferences);
    this.platform = Assert.isNotNull(platform);
    this.uiThreadScheduler = Assert.isNotNull(uiThreadScheduler);
    this.timings = Assert.isNotNull(timings);
  }

  public void requestDismiss(CallDirection direction, boolean delayed, boolean ignoreNag) {
    requestDismiss(direction, delayed, ignoreNag, null);
  }

  /**
   * Dismisses the call screen unless it already was.
   *
   * @param direction direction of the call being dismissed
   * @param delayed whether to keep the screen up for a moment so the user can read the final state
   * @param ignoreNag skips the settings nag
   * @param completion run right after the screen was removed
   */
  public void requestDismiss(
      CallDirection direction, boolean delayed, boolean ignoreNag, @Nullable Runnable completion) {
    Assert.isUiThread(uiThreadScheduler);
    if (phase == Phase.DISMISSED) {
      // Don't dismiss twice.
      LogUtil.d("DismissalPolicy.requestDismiss", "already dismissed");
      return;
    }

    if (!ignoreNag && shouldShowNag(direction)) {
      showNag();
      return;
    }

    boolean wasShowingNag = phase == Phase.NAG_PENDING;
    if (wasShowingNag) {
      phase = Phase.NAG_DISMISSED;
      LogUtil.i("DismissalPolicy.requestDismiss", "settings nag resolved");
    }
    // Latch before calling out so re-entrant requests are no-ops.
    phase = Phase.DISMISSED;
    host.onDismissed();
    if (wasShowingNag) {
      host.onSettingsNagChanged(false);
    }

    if (delayed) {
      LogUtil.i(
          "DismissalPolicy.requestDismiss",
          "dismissing in %d millis",
          timings.dismissDelayMillis());
      final int scheduledGeneration = generation;
      delayedFinish =
          uiThreadScheduler.postDelayed(
              () -> {
                delayedFinish = null;
                if (scheduledGeneration != generation) {
                  LogUtil.w(
                      "DismissalPolicy.requestDismiss", "torn down before delayed dismissal");
                  return;
                }
                finish(completion);
              },
              timings.dismissDelayMillis());
    } else {
      LogUtil.i("DismissalPolicy.requestDismiss", "dismissing now");
      finish(completion);
    }
  }

  /**
   * We only show the "blocking" settings nag until the user has chosen to view the privacy settings
   * <em>or</em> dismissed the nag at least once.
   *
   * <p>In either case both settings are written back with their current values to record that the
   * user has reviewed them. From then on the nag only shows in its "fleeting" form.
   */
  public void markNagComplete() {
    LogUtil.enterBlock("DismissalPolicy.markNagComplete");
    preferences.setCallIntegrationEnabled(preferences.isCallIntegrationEnabled());
    preferences.setCallIntegrationPrivacyEnabled(preferences.isCallIntegrationPrivacyEnabled());
  }

  /**
   * Makes every pending callback a no-op. A nag still showing is dropped without dismissing, the
   * call screen is going away without the policy's help.
   */
  public void tearDown() {
    LogUtil.enterBlock("DismissalPolicy.tearDown");
    generation++;
    if (phase == Phase.NAG_PENDING) {
      phase = Phase.ACTIVE;
    }
    delayedFinish = cancel(delayedFinish);
    fleetingNagTimeout = cancel(fleetingNagTimeout);
  }

  public Phase getPhase() {
    return phase;
  }

  public DismissalState getState() {
    return DismissalState.create(phase == Phase.DISMISSED, phase == Phase.NAG_PENDING);
  }

  /** The reason shown by the nag, meaningful while {@link DismissalState#isShowingNag()}. */
  public NagReason getNagReason() {
    return nagReason;
  }

  private boolean shouldShowNag(CallDirection direction) {
    return platform.isSettingsNagRequired()
        && direction == CallDirection.INCOMING
        && platform.supportsCallIntegration()
        && (!preferences.isCallIntegrationEnabled()
            || preferences.isCallIntegrationPrivacyEnabled());
  }

  private void showNag() {
    if (phase == Phase.NAG_PENDING) {
      LogUtil.d("DismissalPolicy.showNag", "nag already showing");
      return;
    }
    phase = Phase.NAG_PENDING;
    // Only privacy mode is left to review once the integration is enabled.
    nagReason = preferences.isCallIntegrationEnabled() ? NagReason.PRIVACY_ONLY : NagReason.ALL;
    LogUtil.i("DismissalPolicy.showNag", "reason: %s", nagReason);
    host.onSettingsNagChanged(true);

    if (fleetingNagTimeout == null
        && (preferences.isCallIntegrationEnabledSet()
            || preferences.isCallIntegrationPrivacySet())) {
      // User has already touched these preferences, only show the "fleeting" nag, not the
      // "blocking" nag.
      final int scheduledGeneration = generation;
      fleetingNagTimeout =
          uiThreadScheduler.postDelayed(
              () -> {
                fleetingNagTimeout = null;
                if (scheduledGeneration != generation || phase != Phase.NAG_PENDING) {
                  return;
                }
                LogUtil.i("DismissalPolicy.showNag", "fleeting nag timed out");
                requestDismiss(CallDirection.INCOMING, false /* delayed */, true /* ignoreNag */);
              },
              timings.nagAutoDismissMillis());
    }
  }

  private void finish(@Nullable Runnable completion) {
    host.endCall();
    if (completion != null) {
      completion.run();
    }
  }

  @Nullable
  private static Future<?> cancel(@Nullable Future<?> future) {
    if (future != null) {
      future.cancel(false);
    }
    return null;
  }

  @VisibleForTesting
  boolean hasPendingTimers() {
    return delayedFinish != null || fleetingNagTimeout != null;
  }
}
