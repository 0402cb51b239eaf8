// This file is part of PerfSignal.
// Copyright (C) 2021  The PerfSignal Authors.
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
package net.perfsignal.utils;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * User configurable settings for change point computations.
 * <p>
 * On initialization default values are configured for all known keys. Then
 * callers may load a properties file, either from an explicit location or by
 * searching the default locations, and override individual values.
 * <p>
 * The number helpers throw a {@link NumberFormatException} if the requested
 * property is missing or unparseable. {@link #getString(String)} returns null
 * for unknown properties.
 * <p>
 * Plugins that need their own copy should use {@link #Config(Config)} so
 * changes never leak back into the parent.
 *
 * @since 1.0
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** The significance level for the permutation test. */
  public static final String PVALUE_KEY = "perfsignal.changepoints.pvalue";

  /** How many permutations to run for each candidate. */
  public static final String PERMUTATIONS_KEY =
      "perfsignal.changepoints.permutations";

  /** The seed for the permutation shuffles. */
  public static final String SEED_KEY = "perfsignal.changepoints.seed";

  /** The decay weighting used by the range finder. */
  public static final String WEIGHTING_KEY = "perfsignal.changepoints.weighting";

  /** The number of points the range finder considers around a candidate. */
  public static final String BOUNDS_KEY = "perfsignal.changepoints.bounds";

  /** The minimum number of points to recompute. Empty means everything. */
  public static final String MIN_POINTS_KEY = "perfsignal.changepoints.min_points";

  /** Which QHat calculator to instantiate. */
  public static final String QHAT_IMPLEMENTATION_KEY =
      "perfsignal.changepoints.qhat.implementation";

  /** Number of attempts for a compute and commit cycle. */
  public static final String RETRY_ATTEMPTS_KEY =
      "perfsignal.changepoints.retry.attempts";

  /** Fixed delay between attempts in milliseconds. */
  public static final String RETRY_DELAY_KEY =
      "perfsignal.changepoints.retry.delay_ms";

  /** Size of the worker pool for batches. */
  public static final String WORKERS_KEY = "perfsignal.changepoints.workers";

  /** Local checkout used to resolve revision ranges. */
  public static final String GIT_REPOSITORY_KEY = "perfsignal.git.repository";

  /** Base API URL of the remote repository. */
  public static final String GITHUB_API_KEY = "perfsignal.git.github.api";

  /** Optional token for the remote API. */
  public static final String GITHUB_TOKEN_KEY = "perfsignal.git.github.token";

  /** Connection string for the document store. */
  public static final String MONGO_URI_KEY = "perfsignal.storage.mongo.uri";

  /** Database holding the points and change points. */
  public static final String MONGO_DATABASE_KEY =
      "perfsignal.storage.mongo.database";

  /** Files searched, in order, when no explicit location is given. */
  public static final List<String> DEFAULT_LOCATIONS = ImmutableList.of(
      "perfsignal.conf",
      "/etc/perfsignal.conf",
      "/etc/perfsignal/perfsignal.conf",
      "/opt/perfsignal/perfsignal.conf");

  /**
   * The list of properties configured to their defaults or modified by users
   */
  protected final HashMap<String, String> properties =
    new HashMap<String, String>();

  /** Holds default values for the config */
  protected static final HashMap<String, String> default_map =
    new HashMap<String, String>();

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
   * Constructor for plugins or overloaders who want a copy of the parent
   * properties but without the ability to modify them.
   * @param parent Parent configuration object to load from
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
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
   * command line overrides.
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
   * @return The property value as a string or null if not present.
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
   * Returns the given property as a double
   * @param property The property to load
   * @return A parsed double or an exception if the value could not be parsed
   * @throws NumberFormatException if the property could not be parsed
   * @throws NullPointerException if the property did not exist
   */
  public final double getDouble(final String property) {
    return Double.parseDouble(sanitize(properties.get(property)));
  }

  /**
   * Returns the given property as an Integer or null if the property is
   * missing or empty. Used for optional thresholds.
   * @param property The property to load
   * @return A parsed integer or null.
   * @throws NumberFormatException if the property could not be parsed
   */
  public final Integer getNullableInt(final String property) {
    if (!hasProperty(property)) {
      return null;
    }
    return Integer.parseInt(sanitize(properties.get(property)));
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
   * Returns a simple string with the configured properties for debugging
   * @return A string with information about the config
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty())
      return "No configuration settings stored";

    StringBuilder response = new StringBuilder("PerfSignal Configuration:\n");
    response.append("File [" + config_location + "]\n");
    int line = 0;
    for (Map.Entry<String, String> entry : properties.entrySet()) {
      if (line > 0) {
        response.append("\n");
      }
      response.append("Key [" + entry.getKey() + "]  Value [");
      if (entry.getKey().toUpperCase().contains("PASS") ||
          entry.getKey().toUpperCase().contains("TOKEN")) {
         response.append("********");
      } else {
        response.append(entry.getValue());
      }
      response.append("]");
      line++;
    }
    return response.toString();
  }

  /** @return An immutable copy of the configuration map */
  public final Map<String, String> getMap() {
    return ImmutableMap.copyOf(properties);
  }

  /**
   * Loads default entries that were not provided by a file or command line
   *
   * This should be called in the constructor
   */
  protected void setDefaults() {
    default_map.put(PVALUE_KEY, "0.05");
    default_map.put(PERMUTATIONS_KEY, "100");
    default_map.put(SEED_KEY, "1234");
    default_map.put(WEIGHTING_KEY, "0.001");
    default_map.put(BOUNDS_KEY, "1");
    default_map.put(MIN_POINTS_KEY, "");
    default_map.put(QHAT_IMPLEMENTATION_KEY, "DIFF_MATRIX");
    default_map.put(RETRY_ATTEMPTS_KEY, "3");
    default_map.put(RETRY_DELAY_KEY, "5000");
    default_map.put(WORKERS_KEY,
        Integer.toString(Runtime.getRuntime().availableProcessors()));
    default_map.put(GIT_REPOSITORY_KEY, "");
    default_map.put(GITHUB_API_KEY, "https://api.github.com/repos/mongodb/mongo");
    default_map.put(GITHUB_TOKEN_KEY, "");
    default_map.put(MONGO_URI_KEY, "mongodb://localhost:27017");
    default_map.put(MONGO_DATABASE_KEY, "perf");

    for (Map.Entry<String, String> entry : default_map.entrySet()) {
      if (!properties.containsKey(entry.getKey()))
        properties.put(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Searches a list of locations for a valid config file. Files that are
   * missing or unreadable are skipped. If nothing is found the defaults
   * are used.
   *
   * @throws IOException Thrown if there was an issue reading a file
   */
  protected void loadConfig() throws IOException {
    if (config_location != null && !config_location.isEmpty()) {
      loadConfig(config_location);
      return;
    }

    for (final String file : DEFAULT_LOCATIONS) {
      try (final FileInputStream file_stream = new FileInputStream(file)) {
        final Properties props = new Properties();
        props.load(file_stream);
        loadHashMap(props);
      } catch (Exception e) {
        // the file may be missing and that's fine
        LOG.debug("Unable to find or load " + file, e);
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
    try (final FileInputStream file_stream = new FileInputStream(file)) {
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
   * Copies the properties into the hash map.
   * @param props The loaded Properties object to copy
   */
  private void loadHashMap(final Properties props) {
    properties.clear();
    for (final String key : props.stringPropertyNames()) {
      properties.put(key, props.getProperty(key));
    }
  }
}
