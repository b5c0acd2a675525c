package ca.gc.cra.qotd.domain.quote;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Operator selection of which {@link QuoteCategory categories} the corpus may serve.
 *
 * @since 0.1.0
 */
public enum AllowedCategories {
  /** Decorous quotes only; the default. */
  DECOROUS(EnumSet.of(QuoteCategory.DECOROUS)),
  /** Offensive quotes only. */
  OFFENSIVE(EnumSet.of(QuoteCategory.OFFENSIVE)),
  /** Every category. */
  ALL(EnumSet.allOf(QuoteCategory.class));

  private final Set<QuoteCategory> categories;

  AllowedCategories(EnumSet<QuoteCategory> categories) {
    this.categories = Collections.unmodifiableSet(categories);
  }

  /**
   * Returns the accepted categories.
   *
   * @return unmodifiable, non-empty set
   */
  public Set<QuoteCategory> categories() {
    return categories;
  }

  /**
   * Parses a selector name.
   *
   * @param raw {@code decorous}, {@code offensive} or {@code all}, case-insensitive
   * @return selector
   * @throws IllegalArgumentException if {@code raw} names no selector
   */
  public static AllowedCategories parse(String raw) {
    String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "categories must be decorous, offensive or all (was " + raw + ")", ex);
    }
  }

  /**
   * Resolves the selector from an explicit choice and the shortcut flags. An explicit choice wins over
   * {@code all}, which wins over {@code offensive}.
   *
   * @param explicit explicit selector name; blank or {@code null} when not given
   * @param all whether every category was requested
   * @param offensive whether offensive-only was requested
   * @return resolved selector, {@link #DECOROUS} when nothing was requested
   */
  public static AllowedCategories resolve(String explicit, boolean all, boolean offensive) {
    if (explicit != null && !explicit.isBlank()) {
      return parse(explicit);
    }
    if (all) {
      return ALL;
    }
    return offensive ? OFFENSIVE : DECOROUS;
  }
}
