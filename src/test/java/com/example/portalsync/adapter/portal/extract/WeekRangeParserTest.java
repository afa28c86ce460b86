package com.example.portalsync.adapter.portal.extract;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.IntStream;

class WeekRangeParserTest {

  @Test
  void expandsSimpleRangeAndIgnoresSectionSuffix() {
    assertThat(WeekRangeParser.parse("1-4(周)[01-02节]")).containsExactly(1, 2, 3, 4);
  }

  @Test
  void keepsOnlyOddWeeksForSingleMarker() {
    assertThat(WeekRangeParser.parse("1-9(单周)")).containsExactly(1, 3, 5, 7, 9);
  }

  @Test
  void keepsOnlyEvenWeeksForDoubleMarker() {
    assertThat(WeekRangeParser.parse("2-10(双)")).containsExactly(2, 4, 6, 8, 10);
  }

  @Test
  void mixesListsAndRanges() {
    assertThat(WeekRangeParser.parse("2,4-6,9")).containsExactly(2, 4, 5, 6, 9);
  }

  @Test
  void decodesCommonTimetableLabels() {
    assertThat(WeekRangeParser.parse("2-16")).containsExactlyElementsOf(
        IntStream.rangeClosed(2, 16).boxed().toList());
    assertThat(WeekRangeParser.parse("2-16(单)")).containsExactly(3, 5, 7, 9, 11, 13, 15);
    assertThat(WeekRangeParser.parse("[01-02节]2,4-7,9-16"))
        .containsExactly(2, 4, 5, 6, 7, 9, 10, 11, 12, 13, 14, 15, 16);
  }

  @Test
  void acceptsFullWidthSeparatorsAndEnglishLabels() {
    assertThat(WeekRangeParser.parse("1～3，5、7 weeks")).containsExactly(1, 2, 3, 5, 7);
    assertThat(WeekRangeParser.parse("Weeks 3-7 odd")).containsExactly(3, 5, 7);
  }

  @Test
  void ordinalWeekPrefixIsStripped() {
    assertThat(WeekRangeParser.parse("第1-16周")).containsExactlyElementsOf(
        IntStream.rangeClosed(1, 16).boxed().toList());
    assertThat(WeekRangeParser.parse("第3周")).containsExactly(3);
  }

  @Test
  void reversedRangeIsNormalised() {
    assertThat(WeekRangeParser.parse("6-3周")).containsExactly(3, 4, 5, 6);
  }

  @Test
  void duplicatesCollapseAndResultIsSorted() {
    assertThat(WeekRangeParser.parse("5,1-3,2")).containsExactly(1, 2, 3, 5);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "全周", "0", "[01-02节]"})
  void unparsableLabelsFallBackToTwentyWeeks(String label) {
    List<Integer> weeks = WeekRangeParser.parse(label);

    assertThat(weeks).hasSize(20).startsWith(1).endsWith(20);
    assertThat(weeks).isEqualTo(WeekRangeParser.defaultWeeks());
  }
}
