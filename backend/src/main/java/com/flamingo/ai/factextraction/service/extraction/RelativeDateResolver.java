package com.flamingo.ai.factextraction.service.extraction;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Infers an event date from relative time phrases when the LLM did not provide {@code
 * occurred_start} for an event.
 *
 * <p>Phrases are checked in table order; the first match wins and resolves to midnight of the
 * reference date shifted by the phrase's day offset.
 */
public final class RelativeDateResolver {

  private static final Map<Pattern, Integer> DAY_OFFSETS = new LinkedHashMap<>();

  static {
    DAY_OFFSETS.put(Pattern.compile("\\blast night\\b"), -1);
    DAY_OFFSETS.put(Pattern.compile("\\byesterday\\b"), -1);
    DAY_OFFSETS.put(Pattern.compile("\\btoday\\b"), 0);
    DAY_OFFSETS.put(Pattern.compile("\\bthis morning\\b"), 0);
    DAY_OFFSETS.put(Pattern.compile("\\bthis afternoon\\b"), 0);
    DAY_OFFSETS.put(Pattern.compile("\\bthis evening\\b"), 0);
    DAY_OFFSETS.put(Pattern.compile("\\btonigh?t\\b"), 0);
    DAY_OFFSETS.put(Pattern.compile("\\btomorrow\\b"), 1);
    DAY_OFFSETS.put(Pattern.compile("\\blast week\\b"), -7);
    DAY_OFFSETS.put(Pattern.compile("\\bthis week\\b"), 0);
    DAY_OFFSETS.put(Pattern.compile("\\bnext week\\b"), 7);
    DAY_OFFSETS.put(Pattern.compile("\\blast month\\b"), -30);
    DAY_OFFSETS.put(Pattern.compile("\\bthis month\\b"), 0);
    DAY_OFFSETS.put(Pattern.compile("\\bnext month\\b"), 30);
  }

  private RelativeDateResolver() {}

  /**
   * Resolves the first relative time phrase found in {@code factText}.
   *
   * @param factText combined fact text to scan
   * @param eventDate reference date of the content
   * @return midnight of the resolved day, in the reference date's offset, or empty if no phrase
   *     matched
   */
  public static Optional<OffsetDateTime> infer(String factText, OffsetDateTime eventDate) {
    if (factText == null || factText.isBlank() || eventDate == null) {
      return Optional.empty();
    }
    String lower = factText.toLowerCase(Locale.ROOT);
    for (Map.Entry<Pattern, Integer> entry : DAY_OFFSETS.entrySet()) {
      if (entry.getKey().matcher(lower).find()) {
        return Optional.of(eventDate.plusDays(entry.getValue()).truncatedTo(ChronoUnit.DAYS));
      }
    }
    return Optional.empty();
  }
}
