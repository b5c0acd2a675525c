package ca.gc.cra.qotd.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags and key/value pairs.
 *
 * <p>Verbosity flags accumulate: {@code -v} counts one, {@code -vv} two, {@code -vvv} three, and each
 * {@code --verbose} adds one.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> QUIET_FLAGS = Set.of("--quiet", "-q");
  private static final Map<String, Integer> VERBOSE_FLAGS =
      Map.of("--verbose", 1, "--debug", 2, "-v", 1, "-vv", 2, "-vvv", 3);

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean quiet;
  private final int verbosity;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean quiet, int verbosity) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.quiet = quiet;
    this.verbosity = verbosity;
  }

  /**
   * Parses raw arguments into flag and key/value partitions.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false, 0);
    }

    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean quiet = false;
    int verbosity = 0;
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
      } else if (QUIET_FLAGS.contains(lower)) {
        quiet = true;
        flags.add("--quiet");
      } else if (VERBOSE_FLAGS.containsKey(lower)) {
        verbosity += VERBOSE_FLAGS.get(lower);
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags), help, quiet, verbosity);
  }

  /**
   * Returns a defensive copy of the key/value style arguments.
   *
   * @return copy of arguments intended for key=value parsing
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /**
   * Indicates whether a help flag was supplied.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return help;
  }

  /**
   * Indicates whether {@code --quiet} was supplied.
   *
   * @return {@code true} when only errors should be logged
   */
  public boolean quiet() {
    return quiet;
  }

  /**
   * Returns the accumulated verbosity level.
   *
   * @return 0 when no verbose flag was given
   */
  public int verbosity() {
    return verbosity;
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns all normalized flags supplied on the command line.
   *
   * @return set of normalized flags (lowercase)
   */
  public Set<String> flags() {
    return flags;
  }
}
