package ca.gc.cra.qotd.api;

import ca.gc.cra.qotd.config.ConfigMerger;
import ca.gc.cra.qotd.config.DefaultsForMode;
import ca.gc.cra.qotd.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Records a boolean CLI flag as a {@code key=true} entry unless the key was given explicitly.
   */
  static void putFlag(CliInput input, String flag, Map<String, String> kv, String key) {
    if (input.hasFlag(flag)) {
      kv.putIfAbsent(key, "true");
    }
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && !value.isBlank() && Boolean.parseBoolean(value.trim());
  }

  /**
   * Merges defaults, the optional YAML file named by {@code config=}, and CLI arguments.
   *
   * @param mode command whose YAML section and defaults apply
   * @param kv CLI key/value arguments; {@code config} is removed
   * @param log logger receiving override warnings
   * @return effective settings
   * @throws IllegalArgumentException if the YAML file is missing or malformed
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> kv, Logger log)
      throws IOException {
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
  }
}
