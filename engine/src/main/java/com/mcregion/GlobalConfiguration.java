/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.mcregion;

import com.mcregion.exception.ErrorCode;
import com.mcregion.exception.MCRegionException;
import com.mcregion.log.LogManager;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and, as a fallback,
 * environment variables with the same name.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("mcregion.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false, value -> {
    if (Boolean.TRUE.equals(value))
      dumpConfiguration(System.out);
    return value;
  }),

  // NBT
  NBT_MAX_DEPTH("mcregion.nbt.maxDepth",
      "Maximum nesting of lists and compounds accepted while decoding a NBT document. 0 or a negative number disables the limit, in this case a "
          + "malicious document can exhaust the call stack", Integer.class, 512),

  // REGION
  REGION_EXTENDED_COMPRESSION("mcregion.region.extendedCompression",
      "Accepts the chunk compression types introduced by newer game versions: 3 (uncompressed) and 4 (LZ4). When disabled only 1 (gzip) and 2 "
          + "(zlib) are supported", Boolean.class, false),

  REGION_BUFFER_SIZE("mcregion.region.bufferSize", "Size in bytes of the read buffer used when a region or NBT file is opened from a path",
      Integer.class, 64 * 1024, value -> {
    if ((Integer) value < 1) {
      LogManager.instance().log(GlobalConfiguration.class, Level.WARNING, "Invalid buffer size %s, using the default", value);
      return 64 * 1024;
    }
    return value;
  });

  private static final String PREFIX = "mcregion.";

  private final    String                   key;
  private final    Object                   defValue;
  private final    Class<?>                 type;
  private final    String                   description;
  private final    Function<Object, Object> callback;
  private volatile Object                   value;

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this(key, description, type, defValue, null);
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final Function<Object, Object> callback) {
    this.key = key;
    this.description = description;
    this.defValue = defValue;
    this.type = type;
    this.callback = callback;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (final GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = null;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.println("MCREGION configuration:");

    String lastSection = "";
    for (final GlobalConfiguration v : values()) {
      final String keyWithoutPrefix = v.key.substring(PREFIX.length());
      final int dot = keyWithoutPrefix.indexOf('.');
      final String section = dot > -1 ? keyWithoutPrefix.substring(0, dot) : "environment";

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  /**
   * Find the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (final GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values
   */
  public static void setConfiguration(final Map<String, Object> config) {
    for (final Map.Entry<String, Object> entry : config.entrySet()) {
      for (final GlobalConfiguration v : values()) {
        if (v.getKey().equals(entry.getKey()) || v.name().equals(entry.getKey())) {
          v.setValue(entry.getValue());
          break;
        }
      }
    }
  }

  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null) {
        try {
          config.setValue(prop);
        } catch (final MCRegionException e) {
          LogManager.instance().log(GlobalConfiguration.class, Level.SEVERE, "Ignoring setting %s=%s", e, config.key, prop);
        }
      }
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != null;
  }

  public void setValue(final Object newValue) {
    if (newValue == null) {
      value = null;
      return;
    }

    Object converted;
    try {
      if (type == Boolean.class)
        converted = Boolean.parseBoolean(newValue.toString());
      else if (type == Integer.class)
        converted = Integer.parseInt(newValue.toString().trim());
      else if (type == Long.class)
        converted = Long.parseLong(newValue.toString().trim());
      else if (type == String.class)
        converted = newValue.toString();
      else
        converted = newValue;
    } catch (final NumberFormatException e) {
      throw new MCRegionException(ErrorCode.CONFIGURATION_ERROR, "Invalid value '" + newValue + "' for setting '" + key + "'", e);
    }

    if (callback != null)
      converted = callback.apply(converted);

    value = converted;
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}
