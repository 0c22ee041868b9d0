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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.vyc.common.exceptions.InvalidOptionException;

/**
 * General VYC settings.  Defaults are set here and can be overridden
 * by Java system properties of the same name.
 * */
public class Settings
{
  /** Builder rejects parsed input that carries no source span */
  public static final String REQUIRE_SPANS = "vyc.ast.require-spans";
  public static final String JSON_PRETTY = "vyc.ast.json-pretty";
  /** Memoize constant fold results on nodes */
  public static final String FOLD_CACHE = "vyc.fold.cache";
  public static final String OPT_CONSTANT_FOLD = "vyc.opt.constant-fold";

  public static final String LOG_FILE = "vyc.log.file";
  public static final String LOG_TRACE = "vyc.log.trace";

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(REQUIRE_SPANS, "true");
    defaults.setProperty(JSON_PRETTY, "true");
    defaults.setProperty(FOLD_CACHE, "true");
    defaults.setProperty(OPT_CONSTANT_FOLD, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any overrides so that defaults apply again
   */
  public static void reset() {
    properties.clear();
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(REQUIRE_SPANS);
    getBoolean(JSON_PRETTY);
    getBoolean(FOLD_CACHE);
    getBoolean(OPT_CONSTANT_FOLD);
    getBoolean(LOG_TRACE);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal);
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
