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

package exm.dec.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.dec.common.exceptions.DECRuntimeError;
import exm.dec.common.exceptions.InvalidOptionException;
import exm.dec.common.lang.Operators.IntDivMode;

/**
 * General DEC settings.
 *
 * Defaults are set here and can be overridden with Java system properties
 * of the same name, see {@link #initDECProperties()}.
 * */
public class Settings
{
  public static final String LOG_FILE = "dec.log.file";
  public static final String LOG_TRACE = "dec.log.trace";

  /** Number of spaces per indentation level in unparsed output */
  public static final String UNPARSE_INDENT_WIDTH = "dec.unparse.indent-width";

  /** Rounding for // and %: truncate or floor */
  public static final String EVAL_INT_DIVISION = "dec.eval.int-division";

  /** Log every node creation in the builder */
  public static final String BUILDER_TRACE = "dec.builder.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(UNPARSE_INDENT_WIDTH, "4");
    defaults.setProperty(EVAL_INT_DIVISION, "truncate");
    defaults.setProperty(BUILDER_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initDECProperties() throws InvalidOptionException {
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
   * Drop any overrides and go back to the defaults
   */
  public static void reset() {
    properties.clear();
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
    getBoolean(LOG_TRACE);
    getBoolean(BUILDER_TRACE);
    int width = getInt(UNPARSE_INDENT_WIDTH);
    if (width < 0) {
      throw new InvalidOptionException("Expected property "
          + UNPARSE_INDENT_WIDTH + " to be non-negative but was " + width);
    }
    checkOneOf(EVAL_INT_DIVISION, Arrays.asList("truncate", "floor"));
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    String lcaseVal = val.trim().toLowerCase();
    for (String vv: validVals) {
      if (lcaseVal.equals(vv.toLowerCase())) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(vv);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key + " to be one of: "
        + sb.toString() + " but was '" + val + "'");
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
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

  public static IntDivMode getIntDivMode() throws InvalidOptionException {
    checkOneOf(EVAL_INT_DIVISION, Arrays.asList("truncate", "floor"));
    return IntDivMode.fromString(get(EVAL_INT_DIVISION));
  }

  /**
   * Indent width for callers that cannot handle a bad setting.
   * @throws DECRuntimeError if the setting is invalid
   */
  public static int indentWidth() {
    try {
      int width = getInt(UNPARSE_INDENT_WIDTH);
      return Math.max(width, 0);
    } catch (InvalidOptionException e) {
      throw new DECRuntimeError("Invalid setting: " + e.getMessage(), e);
    }
  }

  /**
   * Boolean setting for callers that cannot handle a bad setting.
   * @throws DECRuntimeError if the setting is invalid
   */
  public static boolean flag(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new DECRuntimeError("Invalid setting: " + e.getMessage(), e);
    }
  }
}
