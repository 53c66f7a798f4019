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

package exm.gotocc.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.gotocc.common.exceptions.InvalidOptionException;

/**
 * General gotocc settings.
 *
 * Defaults are set here and may be overridden by Java system properties
 * of the same name, see {@link #initProperties()}.
 * */
public class Settings
{
  /* Prefix of generated temporaries, e.g. $tmp::if_expr$1 */
  public static final String TMP_PREFIX = "gotocc.tmp-prefix";
  /* Language mode recorded on generated symbols */
  public static final String MODE = "gotocc.mode";
  /* Check that lowered programs only contain pure expressions */
  public static final String CHECK_LOWERED = "gotocc.check-lowered";

  public static final String LOG_FILE = "gotocc.log.file";
  public static final String LOG_TRACE = "gotocc.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(TMP_PREFIX, "$tmp");
    defaults.setProperty(MODE, "C");
    defaults.setProperty(CHECK_LOWERED, "true");
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
   * Drop any value set through {@link #set(String, String)} or
   * {@link #initProperties()}, falling back to the default.
   */
  public static void reset(String key) {
    properties.remove(key);
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
    getBoolean(CHECK_LOWERED);
    getBoolean(LOG_TRACE);
    String prefix = get(TMP_PREFIX);
    if (prefix.length() == 0) {
      throw new InvalidOptionException("option " + TMP_PREFIX +
                                       " must not be empty");
    }
    if (get(MODE).length() == 0) {
      throw new InvalidOptionException("option " + MODE +
                                       " must not be empty");
    }
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
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
