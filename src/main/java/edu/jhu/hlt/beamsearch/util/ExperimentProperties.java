package edu.jhu.hlt.beamsearch.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import com.google.common.base.Splitter;

/**
 * Methods with defaults will return the default if the key is not in this map,
 * and also add the (key, defaultValue) pair to this map, so that dumping these
 * properties after a run shows every value that was actually used.
 *
 * Methods without defaults throw an {@link IllegalArgumentException} naming
 * the missing key.
 */
public class ExperimentProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;

  private static ExperimentProperties singleton;

  /**
   * Sets up the process-wide instance from key/value pairs given on the
   * command line. Calling this twice is an error.
   */
  public static synchronized ExperimentProperties init(String[] mainArgs) {
    if (singleton != null)
      throw new IllegalStateException("ExperimentProperties already initialized");
    singleton = new ExperimentProperties();
    singleton.putAll(mainArgs);
    return singleton;
  }

  /**
   * The process-wide instance, created empty (all defaults) if
   * {@link #init(String[])} was never called.
   */
  public static synchronized ExperimentProperties getInstance() {
    if (singleton == null)
      singleton = new ExperimentProperties();
    return singleton;
  }

  public void putAll(String[] mainArgs) {
    putAll(mainArgs, false);
  }

  public void putAll(String[] mainArgs, boolean allowOverwrites) {
    if (mainArgs.length % 2 != 0)
      throw new IllegalArgumentException("expected key/value pairs, got " + mainArgs.length + " args");
    for (int i = 0; i + 1 < mainArgs.length; i += 2) {
      String key = mainArgs[i];
      String value = mainArgs[i + 1];
      Object prev = setProperty(key, value);
      if (prev != null && !allowOverwrites)
        throw new IllegalArgumentException("duplicate value for " + key + ": " + prev + " and " + value);
    }
  }

  private String require(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new IllegalArgumentException("missing required property: " + key);
    return value;
  }

  /**
   * Shared by the getters with defaults. A null default is returned but not
   * recorded, since Properties can't hold null values.
   */
  private <T> T getOrRecord(String key, T defaultValue, Function<String, T> parse) {
    String value = getProperty(key);
    if (value != null)
      return parse.apply(value);
    if (defaultValue != null)
      setProperty(key, String.valueOf(defaultValue));
    return defaultValue;
  }

  public int getInt(String key, int defaultValue) {
    return getOrRecord(key, defaultValue, v -> Integer.parseInt(v.trim()));
  }

  public int getInt(String key) {
    return Integer.parseInt(require(key).trim());
  }

  public double getDouble(String key, double defaultValue) {
    return getOrRecord(key, defaultValue, v -> Double.parseDouble(v.trim()));
  }

  public double getDouble(String key) {
    return Double.parseDouble(require(key).trim());
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    return getOrRecord(key, defaultValue, v -> Boolean.parseBoolean(v.trim()));
  }

  public boolean getBoolean(String key) {
    return Boolean.parseBoolean(require(key).trim());
  }

  /** defaultValue may be null */
  public String getString(String key, String defaultValue) {
    return getOrRecord(key, defaultValue, Function.identity());
  }

  public String getString(String key) {
    return require(key);
  }

  /**
   * Parses a comma separated list of ints, e.g. "4,0,17". Returns null (and
   * records nothing) if the key is absent.
   */
  public List<Integer> getIntList(String key) {
    String value = getProperty(key);
    if (value == null)
      return null;
    List<Integer> l = new ArrayList<>();
    for (String tok : Splitter.on(',').trimResults().omitEmptyStrings().split(value))
      l.add(Integer.parseInt(tok));
    return l;
  }
}
