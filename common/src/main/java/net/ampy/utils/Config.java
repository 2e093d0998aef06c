// This file is part of ampy.
// Copyright (C) 2013-2026  The ampy Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.ampy.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

/**
 * ampy Configuration Class
 * 
 * This handles all of the user configurable variables for the data access
 * layer. On initialization default values are configured for all variables.
 * Then implementations should call the {@link #loadConfig()} methods to
 * search for a default configuration or try to load one provided by the user.
 * 
 * To add a configuration, simply add a default value to the DEFAULTS table.
 * Wherever you need to access the config value, use the proper helper to fetch
 * the value, accounting for exceptions that may be thrown if necessary.
 * 
 * The get<type> number helpers will throw NumberFormatExceptions if the
 * requested property is null or unparseable. Durations are stored as human
 * readable strings, e.g. "5m", and read with {@link #getDuration(String)}.
 * @since 1.0
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  public static final String NNTSC_HOST_KEY = "ampy.nntsc.host";
  public static final String NNTSC_PORT_KEY = "ampy.nntsc.port";
  public static final String NNTSC_SOCKET_TIMEOUT_KEY = 
      "ampy.nntsc.socket_timeout";
  public static final String BLOCK_FACTOR_KEY = "ampy.cache.block_factor";
  public static final String SHORT_TTL_KEY = "ampy.cache.ttl.short";
  public static final String LONG_TTL_KEY = "ampy.cache.ttl.long";
  public static final String LRU_OBJECTS_KEY = "ampy.cache.lru.limit.objects";
  public static final String LRU_SIZE_KEY = "ampy.cache.lru.limit.size";
  public static final String REFRESH_INTERVAL_KEY = 
      "ampy.streams.refresh_interval";
  public static final String ACTIVE_INTERVAL_KEY = 
      "ampy.streams.active_interval";
  public static final String TARGET_POINTS_KEY = "ampy.query.target_points";

  /**
   * The list of properties configured to their defaults or modified by users
   */
  protected final HashMap<String, String> properties = 
    new HashMap<String, String>();

  /** Default values, applied for every key the user left unset. */
  private static final Map<String, String> DEFAULTS = 
      ImmutableMap.<String, String>builder()
        .put(NNTSC_HOST_KEY, "localhost")
        .put(NNTSC_PORT_KEY, "61234")
        .put(NNTSC_SOCKET_TIMEOUT_KEY, "0")
        .put(BLOCK_FACTOR_KEY, "12")
        .put(SHORT_TTL_KEY, "5m")
        .put(LONG_TTL_KEY, "6h")
        .put(LRU_OBJECTS_KEY, "100000")
        .put(LRU_SIZE_KEY, "134217728")
        .put(REFRESH_INTERVAL_KEY, "5m")
        .put(ACTIVE_INTERVAL_KEY, "30m")
        .put(TARGET_POINTS_KEY, "200")
        .build();

  /** Tracks the location of the file that was actually loaded */
  protected String config_location;

  /**
   * Constructor that initializes default configuration values. May attempt to
   * search for a config file if configured.
   * @param auto_load_config When set to true, attempts to search for a config
   *          file in the default locations
   * @throws IOException Thrown if unable to read or parse one of the default
   *           config files
   */
  public Config(final boolean auto_load_config) throws IOException {
    if (auto_load_config) {
      loadConfig();
    }
    setDefaults();
  }

  /**
   * Constructor that initializes default values and attempts to load the given
   * properties file
   * @param file Path to the file to load
   * @throws IOException Thrown if unable to read or parse the file
   */
  public Config(final String file) throws IOException {
    loadConfig(file);
    setDefaults();
  }

  /**
   * Constructor for collections or tests that want a copy of the parent
   * properties but without the ability to modify them
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    // copy so changes to the local props don't affect the parent
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    setDefaults();
  }

  /**
   * Creates a new Config holding only the defaults.
   */
  public Config() {
    setDefaults();
  }

  /** @return The file that generated this config. May be null */
  public String configLocation() {
    return config_location;
  }

  /**
   * Allows for modifying properties after creation or loading.
   * 
   * WARNING: This should only be used on initialization and is meant for
   * command line overrides and tests.
   * 
   * @param property The name of the property to override
   * @param value The value to store
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * Returns the given property as a String
   * @param property The property to load
   * @return The property value as a string, null if it did not exist
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * Returns the given property as an integer
   * @param property The property to load
   * @return A parsed integer or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final int getInt(final String property) {
    return Integer.parseInt(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a long
   * @param property The property to load
   * @return A parsed long or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   */
  public final long getLong(final String property) {
    return Long.parseLong(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as a human readable duration converted to
   * seconds.
   * @param property The property to load
   * @return The duration in seconds.
   * @throws IllegalArgumentException if the duration could not be parsed
   */
  public final long getDuration(final String property) {
    return DateTime.parseDuration(sanitize(properties.get(property))) / 1000L;
  }

  /**
   * Returns the given property as a boolean
   * 
   * Property values are case insensitive and the following values will result
   * in a True return value: - 1 - True - Yes
   * 
   * Any other values, including an empty string, will result in a False
   * 
   * @param property The property to load
   * @return A parsed boolean
   * @throws NullPointerException if the property was not found
   */
  public final boolean getBoolean(final String property) {
    final String val = properties.get(property).trim().toUpperCase();
    if (val.equals("1"))
      return true;
    if (val.equals("TRUE"))
      return true;
    if (val.equals("YES"))
      return true;
    return false;
  }

  /**
   * Determines if the given propery is in the map
   * @param property The property to search for
   * @return True if the property exists and has a value, not an empty string
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.get(property);
    if (val == null)
      return false;
    if (val.isEmpty())
      return false;
    return true;
  }

  /**
   * Loads default entries that were not provided by a file or command line
   * 
   * This should be called in the constructor
   */
  protected void setDefaults() {
    for (final Map.Entry<String, String> entry : DEFAULTS.entrySet()) {
      properties.putIfAbsent(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Searches a list of locations for a valid ampy.conf file
   * 
   * The config file must be a standard JAVA properties formatted file. If none
   * of the locations have a config file, then the defaults or command line
   * arguments will be used for the configuration
   * 
   * Defaults for Linux based systems are: ./ampy.conf /etc/ampy.conf
   * /etc/ampy/ampy.conf /opt/ampy/ampy.conf
   * 
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (config_location != null && !config_location.isEmpty()) {
      loadConfig(config_location);
      return;
    }

    final ArrayList<String> file_locations = new ArrayList<String>();
    file_locations.add("ampy.conf");
    file_locations.add("/etc/ampy.conf");
    file_locations.add("/etc/ampy/ampy.conf");
    file_locations.add("/opt/ampy/ampy.conf");

    for (String file : file_locations) {
      try (final FileInputStream file_stream = new FileInputStream(file)) {
        final Properties props = new Properties();
        props.load(file_stream);
        loadHashMap(props);
      } catch (FileNotFoundException e) {
        // the file may be missing and that's fine
        LOG.debug("Unable to find " + file, e);
        continue;
      }

      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
      return;
    }

    LOG.info("No configuration found, will use defaults");
  }

  /**
   * Attempts to load the configuration from the given location
   * @param file Path to the file to load
   * @throws IOException Thrown if there was an issue reading the file
   * @throws FileNotFoundException Thrown if the config file was not found
   */
  protected void loadConfig(final String file) throws FileNotFoundException,
      IOException {
    try (final InputStream file_stream = new FileInputStream(file)) {
      final Properties props = new Properties();
      props.load(file_stream);
      loadHashMap(props);
      LOG.info("Successfully loaded configuration file: " + file);
      config_location = file;
    }
  }

  /**
   * Returns the given string trimmed or null if is null 
   * @param string The string be trimmed of 
   * @return The string trimmed or null
   */
  private final String sanitize(final String string) {
    if (string == null) {
      return null;
    }
    return string.trim();
  }

  /**
   * Called from {@link #loadConfig} to copy the properties into the hash map.
   * @param props The loaded Properties object to copy
   */
  private void loadHashMap(final Properties props) {
    properties.clear();
    for (final String key : props.stringPropertyNames()) {
      properties.put(key, props.getProperty(key));
    }
  }
}
