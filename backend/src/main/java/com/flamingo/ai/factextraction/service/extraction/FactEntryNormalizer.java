package com.flamingo.ai.factextraction.service.extraction;

import com.flamingo.ai.factextraction.config.FactExtractionConfig;
import com.flamingo.ai.factextraction.domain.model.CausalRelation;
import com.flamingo.ai.factextraction.domain.model.CausalRelationType;
import com.flamingo.ai.factextraction.domain.model.FactKind;
import com.flamingo.ai.factextraction.domain.model.FactType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Second stage of response parsing: turns one untyped entry of the LLM's {@code facts} array into
 * a {@link ChunkFact}, repairing what can be repaired and rejecting the rest.
 *
 * <p>Problems inside an entry (an invalid entity, a malformed causal relation) drop only the
 * offending value. The entry itself is rejected only when it is not an object or has no {@code
 * what}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FactEntryNormalizer {

  private static final String PLACEHOLDER = "N/A";
  private static final Pattern INTEGER = Pattern.compile("-?\\d+");

  private final FactExtractionConfig config;

  /**
   * Normalizes a single raw entry.
   *
   * @param entry decoded JSON value of the entry
   * @param index position of the entry in the response, for logging
   * @param eventDate reference date of the content; becomes {@code mentionedAt}
   * @return the parsed fact, or the reason it was rejected
   */
  public EntryParseResult normalize(Object entry, int index, OffsetDateTime eventDate) {
    if (!(entry instanceof Map<?, ?> raw)) {
      log.warn("Skipping fact {}: not a JSON object", index);
      return EntryParseResult.rejected(FactParseError.NOT_AN_OBJECT);
    }

    String what = text(raw, "what");
    if (what == null) {
      what = text(raw, "factual_core");
    }
    if (what == null) {
      log.warn("Skipping fact {}: missing 'what' field", index);
      return EntryParseResult.rejected(FactParseError.MISSING_WHAT);
    }

    boolean repaired = false;
    FactType factType = resolveFactType(raw).orElse(null);
    if (factType == null) {
      log.warn("Fact {}: defaulting to fact_type='world'", index);
      factType = FactType.WORLD;
      repaired = true;
    }

    String factText = combineDimensions(what, text(raw, "when"), text(raw, "who"), text(raw, "why"));

    OffsetDateTime occurredStart = null;
    OffsetDateTime occurredEnd = null;
    if (FactKind.fromValue(raw.get("fact_kind")) == FactKind.EVENT) {
      occurredStart = parseTimestamp(raw.get("occurred_start"), eventDate);
      if (occurredStart == null) {
        occurredStart = RelativeDateResolver.infer(factText, eventDate).orElse(null);
      }
      if (occurredStart != null) {
        occurredEnd = parseTimestamp(raw.get("occurred_end"), eventDate);
        if (occurredEnd == null || occurredEnd.isBefore(occurredStart)) {
          occurredEnd = occurredStart;
        }
      }
    }

    ChunkFact fact =
        new ChunkFact(
            factText,
            factType,
            occurredStart,
            occurredEnd,
            eventDate,
            text(raw, "where"),
            entities(raw.get("entities")),
            causalRelations(raw.get("causal_relations"), index));
    return EntryParseResult.parsed(fact, repaired);
  }

  /**
   * Resolves {@code fact_type}. The LLM is told to say {@code assistant} for experience facts, and
   * sometimes swaps {@code fact_type} with {@code fact_kind}.
   */
  private Optional<FactType> resolveFactType(Map<?, ?> raw) {
    Object type = raw.get("fact_type");
    if ("assistant".equals(type)) {
      return Optional.of(FactType.EXPERIENCE);
    }
    Optional<FactType> direct = FactType.fromValue(type);
    if (direct.isPresent()) {
      return direct;
    }
    Object kind = raw.get("fact_kind");
    if ("assistant".equals(kind)) {
      return Optional.of(FactType.EXPERIENCE);
    }
    return FactType.fromValue(kind);
  }

  static String combineDimensions(String what, String when, String who, String why) {
    StringBuilder sb = new StringBuilder(what);
    if (when != null) {
      sb.append(" | When: ").append(when);
    }
    if (who != null) {
      sb.append(" | Involving: ").append(who);
    }
    if (why != null) {
      sb.append(" | ").append(why);
    }
    return sb.toString();
  }

  private List<String> entities(Object raw) {
    if (!(raw instanceof Collection<?> values)) {
      return List.of();
    }
    Set<String> names = new LinkedHashSet<>();
    for (Object value : values) {
      String name = null;
      if (value instanceof String s) {
        name = s.trim();
      } else if (value instanceof Map<?, ?> m && m.get("text") instanceof String s) {
        name = s.trim();
      }
      if (name == null || name.isEmpty()) {
        log.warn("Invalid entity {}", value);
        continue;
      }
      names.add(name);
    }
    return new ArrayList<>(names);
  }

  private List<CausalRelation> causalRelations(Object raw, int factIndex) {
    if (!(raw instanceof Collection<?> values)) {
      return List.of();
    }
    int cap = config.getExtraction().getMaxCausalRelationsPerFact();
    List<CausalRelation> relations = new ArrayList<>();
    for (Object value : values) {
      if (relations.size() >= cap) {
        log.debug("Fact {}: ignoring causal relations beyond the first {}", factIndex, cap);
        break;
      }
      if (!(value instanceof Map<?, ?> m)) {
        log.warn("Fact {}: invalid causal relation {}", factIndex, value);
        continue;
      }
      Integer target = integer(m.get("target_fact_index"));
      Optional<CausalRelationType> type = CausalRelationType.fromValue(m.get("relation_type"));
      Double strength =
          m.containsKey("strength") && m.get("strength") != null
              ? decimal(m.get("strength"))
              : Double.valueOf(CausalRelation.DEFAULT_STRENGTH);
      boolean strengthInRange = strength != null && strength >= 0 && strength <= 1;
      if (target == null || type.isEmpty() || !strengthInRange) {
        log.warn("Fact {}: invalid causal relation {}", factIndex, value);
        continue;
      }
      relations.add(new CausalRelation(target, type.get(), strength));
    }
    return relations;
  }

  /** Reads a dimension value; {@code null}, blank, empty and "N/A" values count as absent. */
  private static String text(Map<?, ?> raw, String field) {
    Object value = raw.get(field);
    String text = null;
    if (value instanceof String s) {
      text = s.trim();
    } else if (value instanceof Number || value instanceof Boolean) {
      text = value.toString();
    }
    if (text == null || text.isEmpty() || PLACEHOLDER.equalsIgnoreCase(text)) {
      return null;
    }
    return text;
  }

  /**
   * Parses an ISO-8601 timestamp. Values without an offset take the event date's offset; plain
   * dates resolve to midnight.
   */
  static OffsetDateTime parseTimestamp(Object raw, OffsetDateTime eventDate) {
    if (!(raw instanceof String s) || s.isBlank() || PLACEHOLDER.equalsIgnoreCase(s.trim())) {
      return null;
    }
    String value = s.trim();
    if (value.length() > 10 && value.charAt(10) == ' ') {
      value = value.substring(0, 10) + 'T' + value.substring(11);
    }
    try {
      return OffsetDateTime.parse(value);
    } catch (DateTimeParseException ignored) {
      // fall through to the offset-less forms
    }
    try {
      return LocalDateTime.parse(value).atOffset(eventDate.getOffset());
    } catch (DateTimeParseException ignored) {
      // fall through to a plain date
    }
    try {
      return LocalDate.parse(value).atStartOfDay().atOffset(eventDate.getOffset());
    } catch (DateTimeParseException e) {
      log.debug("Unparseable timestamp '{}': {}", value, e.getMessage());
      return null;
    }
  }

  private static Integer integer(Object value) {
    if (value instanceof Integer || value instanceof Short) {
      return ((Number) value).intValue();
    }
    if (value instanceof Number n) {
      try {
        return new BigDecimal(n.toString()).intValueExact();
      } catch (ArithmeticException | NumberFormatException e) {
        // fractional or outside the int range
        return null;
      }
    }
    if (value instanceof String s && INTEGER.matcher(s.trim()).matches()) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static Double decimal(Object value) {
    if (value instanceof Number n) {
      double d = n.doubleValue();
      return Double.isNaN(d) ? null : d;
    }
    if (value instanceof String s) {
      try {
        double d = Double.parseDouble(s.trim());
        return Double.isNaN(d) ? null : d;
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}
