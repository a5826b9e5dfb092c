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

import java.util.Properties;
import junit.framework.TestCase;

public class PropertiesConfigProviderTest extends TestCase {

  private static final String OVERRIDE_KEY = "properties_config_provider_test_override";

  private Properties properties;
  private PropertiesConfigProvider configProvider;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    properties = new Properties();
    configProvider = new PropertiesConfigProvider(properties);
  }

  @Override
  protected void tearDown() throws Exception {
    System.clearProperty(OVERRIDE_KEY);
    super.tearDown();
  }

  public void testGetString_Missing() {
    assertEquals("fallback", configProvider.getString("missing", "fallback"));
  }

  public void testGetString() {
    properties.setProperty("format", "Signal %s");
    assertEquals("Signal %s", configProvider.getString("format", "%s"));
  }

  public void testGetLong() {
    properties.setProperty("delay", " 3000 ");
    assertEquals(3000, configProvider.getLong("delay", 1500));
  }

  public void testGetLong_Malformed() {
    properties.setProperty("delay", "soon");
    assertEquals(1500, configProvider.getLong("delay", 1500));
  }

  public void testGetBoolean() {
    properties.setProperty("flag", "true");
    assertTrue(configProvider.getBoolean("flag", false));
    assertTrue(configProvider.getBoolean("missing", true));
  }

  public void testSystemPropertyOverridesFile() {
    properties.setProperty(OVERRIDE_KEY, "1");
    System.setProperty(OVERRIDE_KEY, "2");

    assertEquals(2, configProvider.getLong(OVERRIDE_KEY, 0));
  }

  public void testLoad_BundledFile() {
    Properties bundled = PropertiesConfigProvider.load(PropertiesConfigProvider.RESOURCE_NAME);

    assertEquals("1500", bundled.getProperty("call_screen_dismiss_delay_millis"));
    assertEquals("5000", bundled.getProperty("call_screen_settings_nag_auto_dismiss_millis"));
  }

  public void testLoad_MissingFile() {
    assertTrue(PropertiesConfigProvider.load("does_not_exist.properties").isEmpty());
  }
}
