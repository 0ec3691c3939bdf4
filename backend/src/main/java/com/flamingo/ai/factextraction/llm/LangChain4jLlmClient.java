package com.flamingo.ai.factextraction.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.factextraction.exception.LlmServiceException;
import com.flamingo.ai.factextraction.exception.OutputTooLongException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link LlmClient} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>Every call is admitted through the {@code llm} bulkhead, which caps the number of concurrent
 * outbound requests regardless of how far the extraction pipeline fans out. A call that cannot be
 * admitted within the bulkhead's wait time fails with a rate-limited {@link LlmServiceException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jLlmClient implements LlmClient {

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "fact_extraction.llm.call", description = "Time for one LLM extraction call")
  @Bulkhead(name = "llm", fallbackMethod = "callFallback")
  public Object call(LlmRequest request) {
    ChatRequest chatRequest =
        ChatRequest.builder()
            .messages(request.messages())
            .temperature(request.temperature())
            .maxOutputTokens(request.maxOutputTokens())
            .responseFormat(
                ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .jsonSchema(request.responseSchema())
                    .build())
            .build();

    ChatResponse response;
    try {
      response = chatModel.chat(chatRequest);
    } catch (RateLimitException e) {
      meterRegistry.counter("fact_extraction.llm.errors", "scope", request.scope()).increment();
      throw new LlmServiceException("LLM rate limit hit for scope " + request.scope(), e, true);
    } catch (RuntimeException e) {
      meterRegistry.counter("fact_extraction.llm.errors", "scope", request.scope()).increment();
      throw new LlmServiceException(
          "LLM call failed for scope " + request.scope() + ": " + e.getMessage(), e);
    }
    meterRegistry.counter("fact_extraction.llm.calls", "scope", request.scope()).increment();

    if (response.finishReason() == FinishReason.LENGTH) {
      log.warn(
          "LLM output truncated for scope {} at {} tokens",
          request.scope(),
          request.maxOutputTokens());
      throw new OutputTooLongException(request.scope(), request.maxOutputTokens());
    }

    String text = response.aiMessage() != null ? response.aiMessage().text() : null;
    if (text == null || text.isBlank()) {
      log.warn("LLM returned an empty response for scope {}", request.scope());
      return text;
    }

    Object decoded = decode(stripCodeFence(text), request.scope());
    if (request.validationMode() == ValidationMode.LENIENT) {
      return decoded;
    }
    return convert(decoded, request);
  }

  @SuppressWarnings("unused")
  private Object callFallback(LlmRequest request, BulkheadFullException e) {
    log.error("LLM bulkhead full for scope {}: {}", request.scope(), e.getMessage());
    meterRegistry.counter("fact_extraction.llm.errors", "scope", request.scope()).increment();
    throw new LlmServiceException(
        "LLM call rejected for scope " + request.scope() + ": too many concurrent calls", e, true);
  }

  private Object decode(String json, String scope) {
    try {
      return objectMapper.readValue(json, Object.class);
    } catch (JsonProcessingException e) {
      log.warn("LLM response for scope {} is not valid JSON: {}", scope, e.getOriginalMessage());
      return json;
    }
  }

  private Object convert(Object decoded, LlmRequest request) {
    try {
      return objectMapper.convertValue(decoded, request.responseType());
    } catch (IllegalArgumentException e) {
      throw new LlmServiceException(
          "LLM response for scope "
              + request.scope()
              + " does not match "
              + request.responseType().getSimpleName(),
          e);
    }
  }

  /** Some models wrap JSON in a Markdown code fence even when asked for a JSON response. */
  private String stripCodeFence(String text) {
    String trimmed = text.trim();
    if (!trimmed.startsWith("```")) {
      return trimmed;
    }
    int firstNewline = trimmed.indexOf('\n');
    int closingFence = trimmed.lastIndexOf("```");
    if (firstNewline < 0 || closingFence <= firstNewline) {
      return trimmed;
    }
    return trimmed.substring(firstNewline + 1, closingFence).trim();
  }
}
