package com.flamingo.ai.factextraction.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextSanitizerTest {

  @Test
  @DisplayName("should return clean text unchanged")
  void shouldReturnCleanTextUnchanged() {
    String text = "plain text";

    assertThat(TextSanitizer.removeUnpairedSurrogates(text)).isSameAs(text);
  }

  @Test
  @DisplayName("should keep valid surrogate pairs")
  void shouldKeepValidSurrogatePairs() {
    String text = "I love it 😀!";

    assertThat(TextSanitizer.removeUnpairedSurrogates(text)).isEqualTo(text);
  }

  @Test
  @DisplayName("should drop lone high and low surrogates")
  void shouldDropLoneSurrogates() {
    assertThat(TextSanitizer.removeUnpairedSurrogates("a\uD83Db")).isEqualTo("ab");
    assertThat(TextSanitizer.removeUnpairedSurrogates("a\uDE00b")).isEqualTo("ab");
    assertThat(TextSanitizer.removeUnpairedSurrogates("x\uD83D")).isEqualTo("x");
  }

  @Test
  @DisplayName("should keep the pair that follows a dangling high surrogate")
  void shouldKeepPairAfterDanglingHighSurrogate() {
    assertThat(TextSanitizer.removeUnpairedSurrogates("\uD83D😀")).isEqualTo("😀");
  }

  @Test
  @DisplayName("should pass through null and empty input")
  void shouldPassThroughNullAndEmpty() {
    assertThat(TextSanitizer.removeUnpairedSurrogates(null)).isNull();
    assertThat(TextSanitizer.removeUnpairedSurrogates("")).isEmpty();
  }
}
