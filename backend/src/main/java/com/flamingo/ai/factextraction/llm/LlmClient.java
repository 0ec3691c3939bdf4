package com.flamingo.ai.factextraction.llm;

/**
 * Boundary to the language model that performs the actual extraction.
 *
 * <p>Implementations block until the model answers. They fail with {@link
 * com.flamingo.ai.factextraction.exception.OutputTooLongException} when generation is cut off by
 * the output budget and with {@link com.flamingo.ai.factextraction.exception.LlmServiceException}
 * for any other provider failure.
 */
public interface LlmClient {

  /**
   * Sends the request and returns the response.
   *
   * @param request the call to make
   * @return for {@link ValidationMode#LENIENT}, the decoded JSON value ({@code Map}, {@code List},
   *     scalar) or the raw text when the model did not answer with JSON; for {@link
   *     ValidationMode#STRICT}, an instance of {@link LlmRequest#responseType()}
   */
  Object call(LlmRequest request);
}
