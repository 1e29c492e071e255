/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package roster.config;

import java.util.Properties;

import org.apache.commons.beanutils.ConversionException;
import org.apache.commons.beanutils.ConvertUtilsBean;

/**
 * Typed reads out of a {@link Properties} configuration. Every failure names
 * the offending key.
 */
public final class Settings {

  private static final ConvertUtilsBean CONVERTER = new ConvertUtilsBean();

  static {
    // throw on unparseable input instead of falling back to 0
    CONVERTER.register(true, false, 0);
  }

  private Settings() {
  }

  public static String getRequired(Properties config, String key, String description) throws RosterConfigException {
    String value = config.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      throw new RosterConfigException("Missing " + description + ", must be specified in configuration properties key \"" + key + "\".");
    }
    return value.trim();
  }

  public static String get(Properties config, String key, String defaultValue) {
    String value = config.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    return value.trim();
  }

  public static int getRequiredInt(Properties config, String key, String description) throws RosterConfigException {
    return toInt(key, getRequired(config, key, description));
  }

  public static int getInt(Properties config, String key, int defaultValue) throws RosterConfigException {
    String value = get(config, key, null);
    if (value == null) {
      return defaultValue;
    }
    return toInt(key, value);
  }

  public static boolean getBoolean(Properties config, String key, boolean defaultValue) throws RosterConfigException {
    String value = get(config, key, null);
    if (value == null) {
      return defaultValue;
    }
    Object o;
    try {
      o = CONVERTER.convert(value, Boolean.class);
    } catch (ConversionException e) {
      throw new RosterConfigException("Could not coerce " + key + " value \"" + value + "\" to a boolean.", e);
    }
    if (!(o instanceof Boolean)) {
      throw new RosterConfigException("Could not coerce " + key + " value \"" + value + "\" to a boolean.");
    }
    return (Boolean) o;
  }

  private static int toInt(String key, String value) throws RosterConfigException {
    Object o;
    try {
      o = CONVERTER.convert(value, Integer.class);
    } catch (ConversionException e) {
      throw new RosterConfigException("Could not coerce " + key + " value \"" + value + "\" to an integer.", e);
    }
    if (!(o instanceof Integer)) {
      throw new RosterConfigException("Could not coerce " + key + " value \"" + value + "\" to an integer.");
    }
    return (Integer) o;
  }
}
