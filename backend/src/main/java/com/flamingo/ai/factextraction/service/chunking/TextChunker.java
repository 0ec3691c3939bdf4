package com.flamingo.ai.factextraction.service.chunking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits content into chunks small enough for a single extraction call.
 *
 * <p>Conversation transcripts (a JSON array of turn objects) are packed by whole turns so a turn is
 * never cut in half; each chunk is itself a JSON array. Any other text goes through {@link
 * RecursiveCharacterSplitter}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextChunker {

  private final ObjectMapper objectMapper;

  public List<String> chunk(String text, int maxChars) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    if (text.length() <= maxChars) {
      return List.of(text);
    }

    List<String> turns = parseTurns(text);
    List<String> chunks =
        turns != null
            ? packTurns(turns, maxChars)
            : new RecursiveCharacterSplitter(maxChars).split(text);
    log.debug(
        "Split {} chars into {} chunks ({})",
        text.length(),
        chunks.size(),
        turns != null ? turns.size() + " turns" : "plain text");
    return chunks;
  }

  /** Returns the serialized turns, or {@code null} when the text is not a list of turn objects. */
  private List<String> parseTurns(String text) {
    String trimmed = text.strip();
    if (!trimmed.startsWith("[")) {
      return null;
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(trimmed);
    } catch (JsonProcessingException e) {
      log.debug("Text looks like a JSON array but does not parse: {}", e.getOriginalMessage());
      return null;
    }
    if (root == null || !root.isArray() || root.isEmpty()) {
      return null;
    }
    List<String> turns = new ArrayList<>(root.size());
    for (JsonNode turn : root) {
      if (!turn.isObject()) {
        return null;
      }
      turns.add(turn.toString());
    }
    return turns;
  }

  private static List<String> packTurns(List<String> turns, int maxChars) {
    List<String> chunks = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int size = 2;
    for (String turn : turns) {
      int turnSize = turn.length() + 1;
      if (size + turnSize > maxChars && !current.isEmpty()) {
        chunks.add(toJsonArray(current));
        current.clear();
        size = 2;
      }
      current.add(turn);
      size += turnSize;
    }
    if (!current.isEmpty()) {
      chunks.add(toJsonArray(current));
    }
    return chunks;
  }

  private static String toJsonArray(List<String> turns) {
    return "[" + String.join(",", turns) + "]";
  }
}
