package com.example.portalsync.adapter.portal.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Decodes week-range labels such as {@code 1-16(周)[01-02节]}, {@code 2-16(单)} or
 * {@code 2,4-7,9-16} into explicit week numbers.
 */
public final class WeekRangeParser {

  public static final int DEFAULT_FIRST_WEEK = 1;
  public static final int DEFAULT_LAST_WEEK = 20;

  private static final Pattern BRACKETED = Pattern.compile("\\[[^\\]]*]|【[^】]*】");
  private static final Pattern RANGE = Pattern.compile("^(\\d{1,2})-(\\d{1,2})$");
  private static final Pattern SINGLE = Pattern.compile("^(\\d{1,2})$");
  private static final Pattern NOISE = Pattern.compile("(?i)weeks?|第|周|单|双|odd|even|[()（）\\s]");

  private WeekRangeParser() {
  }

  /**
   * Parse a label. Absent or unparsable labels yield weeks 1-20.
   */
  public static List<Integer> parse(String label) {
    if (label == null || label.isBlank()) {
      return defaultWeeks();
    }

    String text = BRACKETED.matcher(label).replaceAll("");
    String lower = text.toLowerCase(Locale.ROOT);
    boolean oddOnly = text.contains("单") || lower.contains("odd");
    boolean evenOnly = text.contains("双") || lower.contains("even");

    text = NOISE.matcher(text).replaceAll("")
        .replace('，', ',')
        .replace('、', ',')
        .replace('－', '-')
        .replace('—', '-')
        .replace('~', '-')
        .replace('～', '-');

    TreeSet<Integer> weeks = new TreeSet<>();
    for (String token : text.split(",")) {
      Matcher range = RANGE.matcher(token);
      Matcher single = SINGLE.matcher(token);
      if (range.matches()) {
        int from = Integer.parseInt(range.group(1));
        int to = Integer.parseInt(range.group(2));
        for (int week = Math.min(from, to); week <= Math.max(from, to); week++) {
          weeks.add(week);
        }
      } else if (single.matches()) {
        weeks.add(Integer.parseInt(single.group(1)));
      }
    }

    weeks.removeIf(week -> week <= 0);
    if (oddOnly && !evenOnly) {
      weeks.removeIf(week -> week % 2 == 0);
    } else if (evenOnly && !oddOnly) {
      weeks.removeIf(week -> week % 2 != 0);
    }

    return weeks.isEmpty() ? defaultWeeks() : new ArrayList<>(weeks);
  }

  public static List<Integer> defaultWeeks() {
    return IntStream.rangeClosed(DEFAULT_FIRST_WEEK, DEFAULT_LAST_WEEK).boxed().toList();
  }
}
