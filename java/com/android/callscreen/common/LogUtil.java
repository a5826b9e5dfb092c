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

import com.google.common.base.Strings;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Provides logging functions. */
public class LogUtil {

  public static final String TAG = "CallScreen";
  private static final String SEPARATOR = " - ";

  private static final Logger logger = Logger.getLogger(TAG);

  private LogUtil() {}

  /**
   * Log at a verbose level. Verbose logs should generally be filtered out, but may be useful when
   * additional information is needed (e.g. to see how a particular flow evolved).
   *
   * @param tag An identifier to allow searching for related logs. Generally of the form
   *     'Class.method'.
   * @param msg The message you would like logged, possibly with format arguments.
   * @param args Optional arguments to be used in the formatted string.
   */
  public static void v(@Nonnull String tag, @Nullable String msg, @Nullable Object... args) {
    println(Level.FINEST, tag, msg, args);
  }

  /**
   * Log at a debug level. Debug logs should provide known-useful information to aid in
   * troubleshooting or evaluating flow.
   *
   * @param tag An identifier to allow searching for related logs. Generally of the form
   *     'Class.method'
   * @param msg The message you would like logged, possibly with format arguments
   * @param args Optional arguments to be used in the formatted string
   */
  public static void d(@Nonnull String tag, @Nullable String msg, @Nullable Object... args) {
    println(Level.FINE, tag, msg, args);
  }

  /**
   * Log at an info level. Info logs provide information that would be useful to have on production
   * builds for troubleshooting.
   *
   * @param tag An identifier to allow searching for related logs. Generally of the form
   *     'Class.method'.
   * @param msg The message you would like logged, possibly with format arguments.
   * @param args Optional arguments to be used in the formatted string.
   */
  public static void i(@Nonnull String tag, @Nullable String msg, @Nullable Object... args) {
    println(Level.INFO, tag, msg, args);
  }

  /**
   * Log entry into a method at the info level.
   *
   * @param tag An identifier to allow searching for related logs. Generally of the form
   *     'Class.method'.
   */
  public static void enterBlock(String tag) {
    println(Level.INFO, tag, "enter");
  }

  /**
   * Log at a warn level. Warn logs indicate a possible error (e.g. a default switch branch was hit,
   * or a null object was expected to be non-null), but recovery is possible.
   *
   * @param tag An identifier to allow searching for related logs. Generally of the form
   *     'Class.method'.
   * @param msg The message you would like logged, possibly with format arguments.
   * @param args Optional arguments to be used in the formatted string.
   */
  public static void w(@Nonnull String tag, @Nullable String msg, @Nullable Object... args) {
    println(Level.WARNING, tag, msg, args);
  }

  /**
   * Log at an error level. Error logs are used when it is known that an error occurred and is
   * possibly fatal.
   *
   * @param tag An identifier to allow searching for related logs. Generally of the form
   *     'Class.method'.
   * @param msg The message you would like logged, possibly with format arguments.
   * @param args Optional arguments to be used in the formatted string.
   */
  public static void e(@Nonnull String tag, @Nullable String msg, @Nullable Object... args) {
    println(Level.SEVERE, tag, msg, args);
  }

  /**
   * Log an exception at an error level.
   *
   * @param tag An identifier to allow searching for related logs. Generally of the form
   *     'Class.method'.
   * @param msg The message you would like logged.
   * @param throwable The exception to log.
   */
  public static void e(@Nonnull String tag, @Nullable String msg, @Nonnull Throwable throwable) {
    String formattedMsg = Strings.isNullOrEmpty(msg) ? tag : tag + SEPARATOR + msg;
    logger.log(Level.SEVERE, formattedMsg, throwable);
  }

  /**
   * Used for log statements where we don't want to log various strings (e.g., device names) with
   * default logging to avoid leaking PII.
   *
   * @return text as is if debug logging is enabled; returns a redacted version otherwise.
   */
  public static String sanitizePii(@Nullable Object object) {
    if (object == null) {
      return "null";
    }
    if (isDebugEnabled()) {
      return object.toString();
    }
    return "Redacted-" + object.toString().length() + "-chars";
  }

  public static boolean isDebugEnabled() {
    return logger.isLoggable(Level.FINE);
  }

  private static void println(
      Level level, @Nonnull String localTag, @Nullable String msg, @Nullable Object... args) {
    // Formatted message is computed lazily if required.
    if (level.intValue() < Level.INFO.intValue() && !logger.isLoggable(level)) {
      return;
    }
    // Either null is passed as a single argument or more than one argument is passed.
    boolean hasArgs = args == null || args.length > 0;
    String formattedMsg = localTag;
    if (!Strings.isNullOrEmpty(msg)) {
      formattedMsg += SEPARATOR + (hasArgs ? String.format(msg, args) : msg);
    }
    logger.log(level, formattedMsg);
  }
}
