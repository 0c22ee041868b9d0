/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.vyc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.vyc.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void reset() {
    Settings.reset();
    System.clearProperty(Settings.FOLD_CACHE);
  }

  @Test
  public void testDefaults() throws Exception {
    assertTrue(Settings.getBoolean(Settings.REQUIRE_SPANS));
    assertTrue(Settings.getBoolean(Settings.JSON_PRETTY));
    assertTrue(Settings.getBoolean(Settings.FOLD_CACHE));
    assertTrue(Settings.getBoolean(Settings.OPT_CONSTANT_FOLD));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertTrue(Settings.getKeys().contains(Settings.FOLD_CACHE));
  }

  @Test
  public void testSetAndReset() throws Exception {
    Settings.set(Settings.JSON_PRETTY, " False ");
    assertFalse(Settings.getBoolean(Settings.JSON_PRETTY));
    Settings.reset();
    assertTrue(Settings.getBoolean(Settings.JSON_PRETTY));
  }

  @Test
  public void testSystemProperty() throws Exception {
    System.setProperty(Settings.FOLD_CACHE, "false");
    Settings.initProperties();
    assertFalse(Settings.getBoolean(Settings.FOLD_CACHE));
  }

  @Test
  public void testInvalidBoolean() throws Exception {
    Settings.set(Settings.REQUIRE_SPANS, "maybe");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.REQUIRE_SPANS);
    Settings.getBoolean(Settings.REQUIRE_SPANS);
  }

  @Test
  public void testInvalidSystemProperty() throws Exception {
    System.setProperty(Settings.FOLD_CACHE, "yes");
    exception.expect(InvalidOptionException.class);
    Settings.initProperties();
  }

  @Test
  public void testInvalidLong() throws Exception {
    exception.expect(InvalidOptionException.class);
    Settings.getLong(Settings.LOG_TRACE);
  }

  @Test
  public void testMissingKey() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("no value");
    Settings.getBoolean("vyc.no.such.key");
  }
}
