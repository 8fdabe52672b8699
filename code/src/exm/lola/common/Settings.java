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
package exm.lola.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import exm.lola.common.exceptions.InvalidOptionException;
import exm.lola.common.lang.PacingPolicy;
import exm.lola.common.lang.PacingPolicy.EventCombination;
import exm.lola.common.lang.PacingPolicy.FrequencyRule;

/**
 * Analysis settings
 *
 * Every key has a default.  Values can be overridden from Java system
 * properties with the same key, or set explicitly before the analysis
 * starts.  A Settings object is not changed by the analysis itself.
 * */
public class Settings
{
  /** How to combine the clocks of several event-driven dependencies */
  public static final String EVENT_COMBINATION = "lola.pacing.event-combination";
  /** When two periodic clocks are compatible */
  public static final String FREQUENCY_RULE = "lola.pacing.frequency-rule";
  /* Default literal-only numeric types to Int64/Float64 */
  public static final String DEFAULT_LITERAL_TYPES = "lola.type.default-literals";
  public static final String WARN_UNUSED_INPUTS = "lola.warn.unused-inputs";
  public static final String ALLOW_LOOKAHEAD = "lola.lookahead.allowed";
  // Largest number of samples a single stream may need to retain
  public static final String MAX_MEMORY_BOUND = "lola.memory.max-bound";
  // Largest number of deadlines in the static schedule of one hyper period
  public static final String MAX_DEADLINES = "lola.schedule.max-deadlines";

  private static final Properties defaults;

  static {
    defaults = new Properties();
    // Set defaults here
    defaults.setProperty(EVENT_COMBINATION, "disjunction");
    defaults.setProperty(FREQUENCY_RULE, "integer-multiple");
    defaults.setProperty(DEFAULT_LITERAL_TYPES, "true");
    defaults.setProperty(WARN_UNUSED_INPUTS, "true");
    defaults.setProperty(ALLOW_LOOKAHEAD, "true");
    defaults.setProperty(MAX_MEMORY_BOUND, "65535");
    defaults.setProperty(MAX_DEADLINES, "100000");
  }

  private final Properties properties;

  private Settings(Properties properties) {
    this.properties = properties;
  }

  /**
   * @return settings with every key at its default
   */
  public static Settings defaults() {
    return new Settings(new Properties(defaults));
  }

  /**
     Overwrite each default property with the value from System,
     if present
   */
  public static Settings fromSystemProperties() throws InvalidOptionException {
    Settings settings = defaults();
    for (String key: defaults.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        settings.properties.setProperty(key, sysVal);
      }
    }
    for (String key: System.getProperties().stringPropertyNames()) {
      if (key.startsWith("lola.") && !defaults.containsKey(key)) {
        Logging.uniqueWarn("Ignoring unknown option " + key);
      }
    }
    settings.validate();
    return settings;
  }

  /**
   * Copy with one key changed.  Validates the result.
   */
  public Settings with(String key, String value) throws InvalidOptionException {
    if (!defaults.containsKey(key)) {
      throw new InvalidOptionException("Unknown option " + key);
    }
    Properties copy = new Properties(defaults);
    for (String k: properties.stringPropertyNames()) {
      copy.setProperty(k, properties.getProperty(k));
    }
    copy.setProperty(key, value);
    Settings result = new Settings(copy);
    result.validate();
    return result;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public void validate() throws InvalidOptionException {
    checkOneOf(EVENT_COMBINATION, Arrays.asList("disjunction", "conjunction"));
    checkOneOf(FREQUENCY_RULE,
               Arrays.asList("integer-multiple", "common-divisor"));
    getBoolean(DEFAULT_LITERAL_TYPES);
    getBoolean(WARN_UNUSED_INPUTS);
    getBoolean(ALLOW_LOOKAHEAD);
    checkPositive(MAX_MEMORY_BOUND);
    checkPositive(MAX_DEADLINES);
  }

  private void checkPositive(String key) throws InvalidOptionException {
    long val = getLong(key);
    if (val < 1) {
      throw new InvalidOptionException(key + " must be at least 1 but was " +
                                       val);
    }
  }

  public String get(String key)
  {
    return properties.getProperty(key);
  }

  public List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  public PacingPolicy pacingPolicy() {
    EventCombination combination =
        get(EVENT_COMBINATION).trim().equalsIgnoreCase("conjunction") ?
            EventCombination.CONJUNCTION : EventCombination.DISJUNCTION;
    FrequencyRule rule =
        get(FREQUENCY_RULE).trim().equalsIgnoreCase("common-divisor") ?
            FrequencyRule.COMMON_DIVISOR : FrequencyRule.INTEGER_MULTIPLE;
    return new PacingPolicy(combination, rule);
  }

  public boolean defaultLiteralTypes() {
    return getBooleanUnchecked(DEFAULT_LITERAL_TYPES);
  }

  public boolean warnUnusedInputs() {
    return getBooleanUnchecked(WARN_UNUSED_INPUTS);
  }

  public boolean allowLookahead() {
    return getBooleanUnchecked(ALLOW_LOOKAHEAD);
  }

  public long maxMemoryBound() {
    return Long.parseLong(StringUtils.trim(get(MAX_MEMORY_BOUND)));
  }

  public long maxDeadlines() {
    return Long.parseLong(StringUtils.trim(get(MAX_DEADLINES)));
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.trim().equalsIgnoreCase(vv)) {
        return;
      }
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: '" + StringUtils.join(validVals, "', '") +
        "' but was '" + val + "'");
  }

  public long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public boolean getBoolean(String key)
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

  /** Only for keys already checked by validate() */
  private boolean getBooleanUnchecked(String key) {
    return Boolean.parseBoolean(get(key).trim());
  }
}
