/*
 * Copyright (C) 2016 The Android Open Source Project
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

package com.android.callscreen.common;

import com.android.callscreen.common.concurrent.UiThreadScheduler;
import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Assertions which will result in program termination unless disabled by flags.
 *
 * <p>A failed assertion is logged at error level before the exception is thrown, so the log shows
 * the violated precondition even when the caller swallows the crash.
 */
public class Assert {

  private static volatile boolean areThreadAssertsEnabled = true;

  private Assert() {}

  public static void setAreThreadAssertsEnabled(boolean areThreadAssertsEnabled) {
    Assert.areThreadAssertsEnabled = areThreadAssertsEnabled;
  }

  @CheckReturnValue
  public static AssertionError createAssertionFailException(String msg) {
    return logged(new AssertionError(msg));
  }

  @CheckReturnValue
  public static AssertionError createAssertionFailException(String msg, Throwable reason) {
    return logged(new AssertionError(msg, reason));
  }

  @CheckReturnValue
  public static IllegalStateException createIllegalStateFailException(String msg) {
    return logged(new IllegalStateException(msg));
  }

  /**
   * Ensures the truth of an expression involving one or more parameters to the calling method.
   *
   * @param expression a boolean expression
   * @throws IllegalArgumentException if {@code expression} is false
   */
  public static void checkArgument(boolean expression) {
    checkArgument(expression, null);
  }

  /**
   * Ensures the truth of an expression involving one or more parameters to the calling method.
   *
   * @param expression a boolean expression
   * @param messageTemplate the message to log, possible with format arguments.
   * @param args optional arguments to be used in the formatted string.
   * @throws IllegalArgumentException if {@code expression} is false
   */
  public static void checkArgument(
      boolean expression, @Nullable String messageTemplate, Object... args) {
    if (!expression) {
      throw logged(new IllegalArgumentException(format(messageTemplate, args)));
    }
  }

  /**
   * Ensures the truth of an expression involving the state of the calling instance, but not
   * involving any parameters to the calling method.
   *
   * @param expression a boolean expression
   * @throws IllegalStateException if {@code expression} is false
   */
  public static void checkState(boolean expression) {
    checkState(expression, null);
  }

  /**
   * Ensures the truth of an expression involving the state of the calling instance, but not
   * involving any parameters to the calling method.
   *
   * @param expression a boolean expression
   * @param messageTemplate the message to log, possible with format arguments.
   * @param args optional arguments to be used in the formatted string.
   * @throws IllegalStateException if {@code expression} is false
   */
  public static void checkState(
      boolean expression, @Nullable String messageTemplate, Object... args) {
    if (!expression) {
      throw logged(new IllegalStateException(format(messageTemplate, args)));
    }
  }

  /**
   * Ensures that an object reference passed as a parameter to the calling method is not null.
   *
   * @param reference an object reference
   * @return the non-null reference that was validated
   * @throws NullPointerException if {@code reference} is null
   */
  @Nonnull
  public static <T> T isNotNull(@Nullable T reference) {
    return isNotNull(reference, null);
  }

  /**
   * Ensures that an object reference passed as a parameter to the calling method is not null.
   *
   * @param reference an object reference
   * @param messageTemplate the message to log, possible with format arguments.
   * @param args optional arguments to be used in the formatted string.
   * @return the non-null reference that was validated
   * @throws NullPointerException if {@code reference} is null
   */
  @Nonnull
  public static <T> T isNotNull(
      @Nullable T reference, @Nullable String messageTemplate, Object... args) {
    if (reference == null) {
      throw logged(new NullPointerException(format(messageTemplate, args)));
    }
    return reference;
  }

  /**
   * Ensures that the current thread is the UI-affinity thread of {@code scheduler}.
   *
   * @throws IllegalStateException if called on any other thread
   */
  public static void isUiThread(UiThreadScheduler scheduler) {
    isUiThread(scheduler, null);
  }

  /**
   * Ensures that the current thread is the UI-affinity thread of {@code scheduler}.
   *
   * @param messageTemplate the message to log, possible with format arguments.
   * @param args optional arguments to be used in the formatted string.
   * @throws IllegalStateException if called on any other thread
   */
  public static void isUiThread(
      UiThreadScheduler scheduler, @Nullable String messageTemplate, Object... args) {
    if (!areThreadAssertsEnabled) {
      return;
    }
    checkState(scheduler.isUiThread(), messageTemplate, args);
  }

  private static <T extends Throwable> T logged(T throwable) {
    LogUtil.e("Assert", "assertion failed", throwable);
    return throwable;
  }

  @Nullable
  private static String format(@Nullable String messageTemplate, Object... args) {
    if (messageTemplate == null) {
      return null;
    }
    return String.format(messageTemplate, args);
  }
}
