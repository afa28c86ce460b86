package com.example.portalsync.adapter.portal.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level rules shared by every schedule engine.
 */
final class ScheduleText {

  static final String GRID_ID = "kbtable";
  static final String CONTENT_CLASS = "kbcontent";
  static final String TERM_SELECT_ID = "xnxq01id";

  private static final Pattern REMARKS = Pattern.compile("(?i)备注|remark");
  private static final Pattern TIME_LABEL = Pattern.compile(
      "(?i)节|section|上午|下午|中午|晚上|\\bam\\b|\\bpm\\b|\\d{1,2}:\\d{2}");
  private static final Pattern FRAGMENT_DELIMITER = Pattern.compile(
      "(?i)(?:<br\\s*/?>\\s*)*-{5,}\\s*(?:<br\\s*/?>\\s*)*");
  private static final Pattern CURRENT_WEEK = Pattern.compile(
      "第\\s*(\\d{1,2})\\s*周|(?i)\\bweek\\s*(\\d{1,2})\\b");
  private static final Pattern INLINE_TERM = Pattern.compile(
      "(?i)(?:学年学期|academic\\s*term)\\s*[:：]?\\s*(\\d{4}-\\d{4}-\\d)");
  private static final Pattern QUERY_TERM = Pattern.compile(
      "(?i)(?:[?&][^=&#]*=)(\\d{4}-\\d{4}-\\d)");
  private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00a0\\u3000]+");

  private ScheduleText() {
  }

  static boolean isRemarksRow(String text) {
    return text != null && REMARKS.matcher(text).find();
  }

  static boolean isTimeLabelCell(GridRow.GridCell cell) {
    return !cell.hasContent() && cell.text() != null && TIME_LABEL.matcher(cell.text()).find();
  }

  static List<String> splitFragments(String contentHtml) {
    List<String> fragments = new ArrayList<>();
    if (contentHtml == null) {
      return fragments;
    }
    for (String fragment : FRAGMENT_DELIMITER.split(contentHtml)) {
      if (!fragment.isBlank()) {
        fragments.add(fragment.trim());
      }
    }
    return fragments;
  }

  static Integer currentWeek(String pageText) {
    if (pageText == null) {
      return null;
    }
    Matcher m = CURRENT_WEEK.matcher(pageText);
    if (!m.find()) {
      return null;
    }
    String digits = m.group(1) != null ? m.group(1) : m.group(2);
    return Integer.valueOf(digits);
  }

  static String inlineTerm(String pageText) {
    if (pageText == null) {
      return null;
    }
    Matcher m = INLINE_TERM.matcher(pageText);
    return m.find() ? m.group(1) : null;
  }

  static String queryTerm(String requestUrl) {
    if (requestUrl == null) {
      return null;
    }
    Matcher m = QUERY_TERM.matcher(requestUrl);
    return m.find() ? m.group(1) : null;
  }

  static String clean(String text) {
    if (text == null) {
      return "";
    }
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  static String blankToNull(String text) {
    String cleaned = clean(text);
    return cleaned.isEmpty() ? null : cleaned;
  }
}
