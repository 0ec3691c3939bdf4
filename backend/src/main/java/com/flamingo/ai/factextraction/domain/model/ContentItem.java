package com.flamingo.ai.factextraction.domain.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * One unit of input submitted for fact extraction: a conversation transcript or a document.
 *
 * @param text the raw text, or a JSON array of conversation turns
 * @param eventDate when the conversation or document took place; relative time expressions are
 *     resolved against it
 * @param context free-form description of where the text comes from, passed to the LLM
 * @param metadata caller-supplied key/value pairs copied onto every extracted fact
 */
public record ContentItem(
    String text, OffsetDateTime eventDate, String context, Map<String, String> metadata) {

  public ContentItem {
    Objects.requireNonNull(eventDate, "eventDate");
    text = text != null ? text : "";
    context = context != null ? context : "";
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }

  public static ContentItem of(String text, OffsetDateTime eventDate) {
    return new ContentItem(text, eventDate, "", Map.of());
  }
}
