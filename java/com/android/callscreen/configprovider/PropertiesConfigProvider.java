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

package com.android.callscreen.configprovider;

import com.android.callscreen.common.LogUtil;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import javax.annotation.Nullable;
import javax.inject.Inject;

/**
 * {@link ConfigProvider} which reads {@value #RESOURCE_NAME} from the classpath.
 *
 * <p>A JVM system property with the same key overrides the file, for example:
 *
 * <pre>
 *   java -Dcall_screen_dismiss_delay_millis=3000 ...
 * </pre>
 */
public class PropertiesConfigProvider implements ConfigProvider {

  static final String RESOURCE_NAME = "callscreen.properties";

  private final Properties properties;

  @Inject
  public PropertiesConfigProvider() {
    this(load(RESOURCE_NAME));
  }

  @VisibleForTesting
  PropertiesConfigProvider(Properties properties) {
    this.properties = properties;
  }

  @Override
  public String getString(String key, String defaultValue) {
    String value = lookup(key);
    return value == null ? defaultValue : value;
  }

  @Override
  public long getLong(String key, long defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      LogUtil.w(
          "PropertiesConfigProvider.getLong",
          "malformed value for %s: %s, using %d",
          key,
          value,
          defaultValue);
      return defaultValue;
    }
  }

  @Override
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  @Nullable
  private String lookup(String key) {
    String override = System.getProperty(key);
    if (override != null) {
      return override;
    }
    return properties.getProperty(key);
  }

  @VisibleForTesting
  static Properties load(String resourceName) {
    Properties properties = new Properties();
    InputStream stream =
        PropertiesConfigProvider.class.getClassLoader().getResourceAsStream(resourceName);
    if (stream == null) {
      LogUtil.i("PropertiesConfigProvider.load", "no %s on classpath, using defaults", resourceName);
      return properties;
    }
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException e) {
      LogUtil.e("PropertiesConfigProvider.load", "unable to read " + resourceName, e);
      properties.clear();
    }
    return properties;
  }
}
