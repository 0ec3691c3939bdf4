package com.flamingo.ai.factextraction.service.extraction;

import com.flamingo.ai.factextraction.domain.model.ExtractionMode;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/** Prompt text for the fact extraction call. */
final class FactExtractionPrompts {

  private static final String FACTS_INSTRUCTION =
      "Extract ONLY facts with fact_type 'world' or 'assistant'. Do NOT extract opinions; they are"
          + " extracted in a separate step.";

  private static final String OPINIONS_INSTRUCTION =
      "Extract ONLY facts with fact_type 'opinion' (formed opinions, beliefs and stances). Do NOT"
          + " extract 'world' or 'assistant' facts.";

  private static final String SYSTEM_PROMPT =
      """
      Extract facts from the text as structured JSON. Be EXTREMELY detailed: writing too much is
      always better than leaving something out.

      %s

      FACT FORMAT - all five dimensions are required
      1. what: what happened, with every concrete action, object, quantity and outcome.
      2. when: when it happened, including dates, times, durations, frequencies and relative
         references. Prefer absolute dates in the form YYYY-MM-DD (Weekday). Write "N/A" only
         when there is no temporal clue at all.
      3. where: where it happened (city, venue, building, online platform, country). Write "N/A"
         only when there is no location clue at all.
      4. who: every person or entity involved, with names, roles and relationships. Resolve
         references: if "my roommate" is later called Emily, write "Emily (the user's college
         roommate)".
      5. why: why it matters - motivations, emotions, preferences, significance. For assistant
         facts, include what the user asked for and what outcome they expected.

      FACT KIND
      - fact_kind="event": an action or occurrence that can be placed in time (went, bought,
        finished, is scheduled for). Set occurred_start and occurred_end.
      - fact_kind="conversation": ongoing states, preferences, traits and general information.
        Leave occurred_start and occurred_end null.

      TIME
      - Resolve every relative expression ("yesterday", "last week", "recently") against the
        EVENT DATE given with the text, never against today.
      - occurred_start/occurred_end are ISO-8601 timestamps of when the event happened, not when
        it was mentioned. For a point event occurred_end equals occurred_start.

      FACT TYPE
      - world: about the user or other people, their background and experiences.
      - assistant: interactions in which the assistant itself took part.
      - opinion: a formed belief or stance.

      ENTITIES
      List named entities, objects and key concepts that connect related facts. Keep proper nouns
      exactly as written.

      CAUSAL RELATIONS
      At most 2 per fact. target_fact_index is the 0-based index of an EARLIER fact in the facts
      array of this response. relation_type is one of causes, caused_by, enables, prevents.
      strength is 1.0 for direct causation, 0.5 moderate, 0.3 weak.

      EXTRACT: preferences (always as separate facts), emotions, plans, events, relationships,
      achievements, important background.
      SKIP: greetings, thanks, filler and purely structural statements ("thanks", "ok", "got it").
      """;

  private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

  private FactExtractionPrompts() {}

  static String systemPrompt(ExtractionMode mode) {
    String instruction = mode == ExtractionMode.OPINIONS ? OPINIONS_INSTRUCTION : FACTS_INSTRUCTION;
    return String.format(SYSTEM_PROMPT, instruction);
  }

  static String userMessage(
      String chunk,
      int chunkIndex,
      int totalChunks,
      OffsetDateTime eventDate,
      String context,
      String agentName,
      ExtractionMode mode) {
    StringBuilder sb = new StringBuilder("Extract facts from the following text chunk.\n");
    if (mode == ExtractionMode.OPINIONS && agentName != null && !agentName.isBlank()) {
      sb.append("\n- Your name: ").append(agentName).append('\n');
    }
    String weekday = eventDate.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    sb.append("\nChunk: ").append(chunkIndex + 1).append('/').append(totalChunks);
    sb.append("\nEvent date: ")
        .append(DATE.format(eventDate))
        .append(" (")
        .append(weekday)
        .append(", ")
        .append(eventDate)
        .append(')');
    sb.append("\nContext: ").append(context == null || context.isBlank() ? "none" : context);
    sb.append("\n\nText:\n").append(chunk);
    return sb.toString();
  }
}
