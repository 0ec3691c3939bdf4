package com.flamingo.ai.factextraction.service.extraction;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

/**
 * JSON schema of the extraction response: {@code {"facts": [ ... ]}}.
 *
 * <p>The schema guides generation only. Responses are decoded leniently and validated entry by
 * entry in {@link FactEntryNormalizer}.
 */
final class FactExtractionSchema {

  static final JsonSchema RESPONSE = build();

  private FactExtractionSchema() {}

  private static JsonSchema build() {
    JsonObjectSchema causalRelation =
        JsonObjectSchema.builder()
            .addProperty(
                "target_fact_index",
                JsonIntegerSchema.builder()
                    .description("0-based index of an EARLIER fact in this response's facts array")
                    .build())
            .addProperty(
                "relation_type",
                JsonEnumSchema.builder()
                    .enumValues("causes", "caused_by", "enables", "prevents")
                    .build())
            .addProperty(
                "strength",
                JsonNumberSchema.builder()
                    .description("1.0 direct, 0.5 moderate, 0.3 weak or indirect")
                    .build())
            .required("target_fact_index", "relation_type")
            .build();

    JsonObjectSchema fact =
        JsonObjectSchema.builder()
            .addStringProperty("what", "What happened, with every concrete detail")
            .addStringProperty("when", "When it happened, or N/A")
            .addStringProperty("where", "Where it happened, or N/A")
            .addStringProperty("who", "Who was involved, with roles and relationships")
            .addStringProperty("why", "Why it matters: motivation, emotion, significance")
            .addProperty(
                "fact_kind", JsonEnumSchema.builder().enumValues("event", "conversation").build())
            .addProperty(
                "fact_type",
                JsonEnumSchema.builder().enumValues("world", "assistant", "opinion").build())
            .addProperty(
                "occurred_start",
                JsonStringSchema.builder()
                    .description("ISO-8601 start of the event; only for fact_kind=event")
                    .build())
            .addProperty(
                "occurred_end",
                JsonStringSchema.builder()
                    .description("ISO-8601 end of the event; only for fact_kind=event")
                    .build())
            .addProperty(
                "entities",
                JsonArraySchema.builder()
                    .items(JsonStringSchema.builder().build())
                    .description("Named entities and key concepts in the fact")
                    .build())
            .addProperty(
                "causal_relations",
                JsonArraySchema.builder()
                    .items(causalRelation)
                    .description("At most 2 links to earlier facts")
                    .build())
            .required("what", "when", "where", "who", "why", "fact_type")
            .build();

    return JsonSchema.builder()
        .name("FactExtractionResponse")
        .rootElement(
            JsonObjectSchema.builder()
                .addProperty("facts", JsonArraySchema.builder().items(fact).build())
                .required("facts")
                .build())
        .build();
  }
}
