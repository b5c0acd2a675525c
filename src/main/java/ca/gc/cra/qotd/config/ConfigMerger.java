package ca.gc.cra.qotd.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked for overridden or shadowed settings; may be {@code null}
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> warnings = warn == null ? message -> {} : warn;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        warnings.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged, warnings);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective, Consumer<String> warn) {
    if (!DefaultsForMode.SERVE.equalsIgnoreCase(mode)) {
      return;
    }
    String categories = trim(effective.get("categories"));
    boolean all = parseBoolean(effective.get("all"));
    boolean offensive = parseBoolean(effective.get("offensive"));
    if (!categories.isEmpty() && (all || offensive)) {
      warn.accept("categories=" + categories + " takes precedence over --all/--offensive");
    } else if (all && offensive) {
      warn.accept("--all takes precedence over --offensive");
    }
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
