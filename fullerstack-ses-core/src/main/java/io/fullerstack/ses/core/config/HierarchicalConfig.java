package io.fullerstack.ses.core.config;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Hierarchical configuration using ResourceBundle.
 *
 * <p>Supports fallback chain:
 * <ol>
 *   <li>JVM system property with the same key</li>
 *   <li>Environment variable derived from the key ({@code notify.dry-run} → {@code NOTIFY_DRY_RUN})</li>
 *   <li>ses-monitor_{environment}.properties (environment-specific)</li>
 *   <li>ses-monitor.properties (global defaults)</li>
 * </ol>
 *
 * <p><strong>How ResourceBundle Fallback Works:</strong>
 * <p>ResourceBundle uses {@link Locale} for fallback. The deployment environment name
 * is used as a locale language tag:
 * <ul>
 *   <li>Locale "prod" → ses-monitor_prod.properties → ses-monitor.properties</li>
 * </ul>
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # ses-monitor.properties (global defaults)
 * thresholds.sending-quota.critical-percent=90
 *
 * # ses-monitor_prod.properties (environment override)
 * thresholds.sending-quota.critical-percent=85
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * HierarchicalConfig prod = HierarchicalConfig.forEnvironment("prod");
 * double critical = prod.getDouble("thresholds.sending-quota.critical-percent");
 * // → 85.0 (from ses-monitor_prod.properties)
 * </pre>
 *
 * <p>Blank property values are treated as absent by the default-taking getters, so a
 * key can be declared empty in the defaults file and filled in by an override.
 */
public class HierarchicalConfig {

  static final String BUNDLE_NAME = "ses-monitor";

  private final ResourceBundle bundle;
  private final String context;  // For debugging/logging
  private final UnaryOperator<String> environment;

  private HierarchicalConfig(ResourceBundle bundle, String context, UnaryOperator<String> environment) {
    this.bundle = bundle;
    this.context = context;
    this.environment = environment;
  }

  /**
   * Get global configuration (ses-monitor.properties).
   *
   * @return Global configuration
   */
  public static HierarchicalConfig global() {
    ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT, NoFallbackControl.INSTANCE);
    return new HierarchicalConfig(bundle, "global", System::getenv);
  }

  /**
   * Get environment-specific configuration.
   *
   * <p>Fallback chain:
   * <ol>
   *   <li>ses-monitor_{environmentName}.properties</li>
   *   <li>ses-monitor.properties (global)</li>
   * </ol>
   *
   * @param environmentName Deployment environment (e.g., "prod", "staging")
   * @return Environment-specific configuration
   */
  public static HierarchicalConfig forEnvironment(String environmentName) {
    Objects.requireNonNull(environmentName, "environmentName cannot be null");
    if (environmentName.isBlank()) {
      throw new IllegalArgumentException("environmentName cannot be blank");
    }

    // Locale(String) keeps names that are not valid language tags, e.g. "prod"
    Locale environmentLocale = new Locale(environmentName.trim().toLowerCase(Locale.ROOT));
    ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_NAME, environmentLocale, NoFallbackControl.INSTANCE);
    return new HierarchicalConfig(bundle, "environment:" + environmentName, System::getenv);
  }

  /**
   * Returns a copy of this configuration that resolves environment variables through the given lookup.
   *
   * @param lookup environment variable lookup, returning null for unset variables
   * @return configuration using the lookup
   */
  public HierarchicalConfig withEnvironment(UnaryOperator<String> lookup) {
    Objects.requireNonNull(lookup, "lookup cannot be null");
    return new HierarchicalConfig(bundle, context, lookup);
  }

  /**
   * Converts a property key to its environment variable name.
   *
   * @param key property key, e.g. {@code slack.webhook-url}
   * @return variable name, e.g. {@code SLACK_WEBHOOK_URL}
   */
  static String environmentVariableName(String key) {
    return key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  // =========================================================================
  // Type-safe getters with system property and environment override support
  // =========================================================================

  /**
   * Get string value.
   *
   * <p>Checks system properties first, then environment variables, then ResourceBundle.
   *
   * @param key Property key
   * @return Property value
   * @throws ConfigurationException if key not found
   */
  public String getString(String key) {
    String override = override(key);
    if (override != null) {
      return override;
    }

    try {
      return bundle.getString(key);
    } catch (MissingResourceException e) {
      throw new ConfigurationException(
        "Missing config key '" + key + "' in context: " + context, e
      );
    }
  }

  /**
   * Get string value with default. Blank values resolve to the default.
   *
   * @param key Property key
   * @param defaultValue Default if not found or blank
   * @return Property value or default
   */
  public String getString(String key, String defaultValue) {
    return getOptionalString(key).orElse(defaultValue);
  }

  /**
   * Get string value if present and not blank.
   *
   * @param key Property key
   * @return Trimmed property value, or empty
   */
  public Optional<String> getOptionalString(String key) {
    String value = override(key);
    if (value == null) {
      try {
        value = bundle.getString(key);
      } catch (MissingResourceException e) {
        return Optional.empty();
      }
    }
    value = value.trim();
    return value.isEmpty() ? Optional.empty() : Optional.of(value);
  }

  /**
   * Get a comma-separated list value. Empty entries are dropped.
   *
   * @param key Property key
   * @return List of trimmed values, empty if the key is absent or blank
   */
  public List<String> getList(String key) {
    return getOptionalString(key)
      .map(value -> Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(entry -> !entry.isEmpty())
        .toList())
      .orElse(List.of());
  }

  /**
   * Get double value.
   *
   * @param key Property key
   * @return Property value as double
   * @throws ConfigurationException if key not found or invalid format
   */
  public double getDouble(String key) {
    String value = getString(key).trim();
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid double value for key '" + key + "': " + value, e
      );
    }
  }

  /**
   * Get double value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as double or default
   * @throws ConfigurationException if the value is present but not a number
   */
  public double getDouble(String key, double defaultValue) {
    Optional<String> value = getOptionalString(key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.get());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid double value for key '" + key + "': " + value.get(), e
      );
    }
  }

  /**
   * Get int value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as int or default
   * @throws ConfigurationException if the value is present but not an integer
   */
  public int getInt(String key, int defaultValue) {
    Optional<String> value = getOptionalString(key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.get());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid int value for key '" + key + "': " + value.get(), e
      );
    }
  }

  /**
   * Get boolean value with default.
   *
   * <p>Accepts true/false, yes/no, on/off and 1/0 (case-insensitive).
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as boolean or default
   * @throws ConfigurationException if the value is present but not a recognised boolean
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    Optional<String> value = getOptionalString(key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    switch (value.get().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on", "1", "y", "t":
        return true;
      case "false", "no", "off", "0", "n", "f":
        return false;
      default:
        throw new ConfigurationException(
          "Invalid boolean value for key '" + key + "': " + value.get()
        );
    }
  }

  /**
   * Check if key exists in configuration.
   *
   * @param key Property key
   * @return true if key exists
   */
  public boolean contains(String key) {
    if (override(key) != null) {
      return true;
    }
    return bundle.containsKey(key);
  }

  /**
   * Get all keys in this configuration level.
   *
   * @return Set of all keys
   */
  public Set<String> keys() {
    return bundle.keySet();
  }

  /**
   * Get configuration context (for debugging).
   *
   * @return Context description (e.g., "global", "environment:prod")
   */
  public String context() {
    return context;
  }

  private String override(String key) {
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }
    return environment.apply(environmentVariableName(key));
  }

  @Override
  public String toString() {
    return "HierarchicalConfig[context=" + context + "]";
  }

  /**
   * Keeps bundle lookup independent of the JVM default locale.
   */
  private static final class NoFallbackControl extends ResourceBundle.Control {

    static final NoFallbackControl INSTANCE = new NoFallbackControl();

    @Override
    public List<String> getFormats(String baseName) {
      return ResourceBundle.Control.FORMAT_PROPERTIES;
    }

    @Override
    public Locale getFallbackLocale(String baseName, Locale locale) {
      return null;
    }
  }
}
