package wirenet.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import wirenet.WireNetException;

/**
 * Data-Class to hold construction options of a {@link wirenet.netlist.Block}.
 */
public class WireNetConfig {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Classpath resource read by {@link #fromClasspath()}. */
  public static final String RESOURCE_NAME = "wirenet.yaml";

  /** Append the user source location to generated wire names. */
  public boolean debug_mode = false;
  /** Record the construction call stack on every wire. */
  public boolean keep_call_stack = false;
  /** Prefix of generated temporary wire names. */
  public String temp_prefix = "tmp";
  /** Prefix of generated constant wire names. */
  public String const_prefix = "const_";

  /**
   * Reads a configuration from a YAML mapping. Missing keys keep their default, unknown keys are ignored.
   * @param in the YAML document
   * @return the parsed configuration
   */
  public static WireNetConfig load(InputStream in) {
    Yaml yaml = new Yaml();
    Object readData = yaml.load(in);
    WireNetConfig cfg = new WireNetConfig();
    if (readData == null)
      return cfg;
    if (!(readData instanceof Map))
      throw new WireNetException("WireNet configuration must be a YAML mapping, got " + readData.getClass().getSimpleName());
    for (Map.Entry<?, ?> setting : ((Map<?, ?>)readData).entrySet()) {
      String key = String.valueOf(setting.getKey());
      Object value = setting.getValue();
      switch (key) {
      case "debug_mode":
        cfg.debug_mode = asBoolean(key, value);
        break;
      case "keep_call_stack":
        cfg.keep_call_stack = asBoolean(key, value);
        break;
      case "temp_prefix":
        cfg.temp_prefix = asPrefix(key, value);
        break;
      case "const_prefix":
        cfg.const_prefix = asPrefix(key, value);
        break;
      default:
        logger.warn("Ignoring unknown configuration key {}", key);
      }
    }
    return cfg;
  }

  /**
   * Reads {@value #RESOURCE_NAME} from the classpath, falling back to the defaults if it does not exist.
   * @return the configuration
   */
  public static WireNetConfig fromClasspath() {
    ClassLoader loader = WireNetConfig.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
      if (in == null) {
        logger.debug("No {} on the classpath, using defaults", RESOURCE_NAME);
        return new WireNetConfig();
      }
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + RESOURCE_NAME, e);
    }
  }

  private static boolean asBoolean(String key, Object value) {
    if (!(value instanceof Boolean))
      throw new WireNetException(String.format("Configuration key %s expects true or false, got \"%s\"", key, value));
    return (Boolean)value;
  }

  private static String asPrefix(String key, Object value) {
    if (!(value instanceof String) || ((String)value).isEmpty())
      throw new WireNetException(String.format("Configuration key %s expects a non-empty string, got \"%s\"", key, value));
    return (String)value;
  }

  @Override
  public String toString() {
    return String.format("WireNetConfig(debug_mode: %b, keep_call_stack: %b, temp_prefix: %s, const_prefix: %s)", debug_mode,
                         keep_call_stack, temp_prefix, const_prefix);
  }
}
