package com.flamingo.ai.factextraction.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import java.util.List;

/**
 * A single structured-output call to the LLM.
 *
 * @param messages conversation sent to the model (system prompt first)
 * @param responseSchema JSON schema the model is asked to follow
 * @param scope tag identifying the caller, used in logs and metrics
 * @param temperature sampling temperature
 * @param maxOutputTokens output budget; exceeding it raises {@link
 *     com.flamingo.ai.factextraction.exception.OutputTooLongException}
 * @param validationMode whether the response is converted to {@code responseType}
 * @param responseType target type for {@link ValidationMode#STRICT}
 */
public record LlmRequest(
    List<ChatMessage> messages,
    JsonSchema responseSchema,
    String scope,
    double temperature,
    int maxOutputTokens,
    ValidationMode validationMode,
    Class<?> responseType) {

  public LlmRequest {
    messages = List.copyOf(messages);
  }
}
