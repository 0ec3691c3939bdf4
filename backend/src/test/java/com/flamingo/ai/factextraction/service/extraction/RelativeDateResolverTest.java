package com.flamingo.ai.factextraction.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RelativeDateResolverTest {

  private static final OffsetDateTime EVENT_DATE =
      OffsetDateTime.of(2024, 6, 15, 14, 30, 0, 0, ZoneOffset.ofHours(2));

  @ParameterizedTest
  @CsvSource({
    "'We talked last night', -1",
    "'She called yesterday', -1",
    "'I finished it today', 0",
    "'He ran this morning', 0",
    "'Dinner tonight with Sam', 0",
    "'The trip starts tomorrow', 1",
    "'I moved last week', -7",
    "'The release is next week', 7",
    "'We met last month', -30",
    "'The course begins next month', 30"
  })
  @DisplayName("should resolve relative phrases to midnight of the shifted event date")
  void shouldResolveRelativePhrases(String text, int dayOffset) {
    OffsetDateTime expected =
        OffsetDateTime.of(2024, 6, 15, 0, 0, 0, 0, ZoneOffset.ofHours(2)).plusDays(dayOffset);

    assertThat(RelativeDateResolver.infer(text, EVENT_DATE)).contains(expected);
  }

  @Test
  @DisplayName("should match phrases case-insensitively")
  void shouldMatchCaseInsensitively() {
    assertThat(RelativeDateResolver.infer("Went out LAST NIGHT", EVENT_DATE))
        .contains(OffsetDateTime.of(2024, 6, 14, 0, 0, 0, 0, ZoneOffset.ofHours(2)));
  }

  @Test
  @DisplayName("should use the first phrase in table order, not in text order")
  void shouldUseTableOrder() {
    assertThat(RelativeDateResolver.infer("Planned last week and done today", EVENT_DATE))
        .contains(OffsetDateTime.of(2024, 6, 15, 0, 0, 0, 0, ZoneOffset.ofHours(2)));
  }

  @Test
  @DisplayName("should not match phrases inside other words")
  void shouldRequireWordBoundaries() {
    assertThat(RelativeDateResolver.infer("The yesterdays of old", EVENT_DATE)).isEmpty();
  }

  @Test
  @DisplayName("should return empty when no phrase matches")
  void shouldReturnEmptyWithoutMatch() {
    assertThat(RelativeDateResolver.infer("Alice likes green tea", EVENT_DATE)).isEmpty();
    assertThat(RelativeDateResolver.infer("", EVENT_DATE)).isEmpty();
    assertThat(RelativeDateResolver.infer(null, EVENT_DATE)).isEmpty();
  }
}
