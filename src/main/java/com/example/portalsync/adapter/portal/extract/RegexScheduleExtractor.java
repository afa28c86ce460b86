package com.example.portalsync.adapter.portal.extract;

import com.example.portalsync.adapter.portal.LoginPageDetector;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Timetable engine that reads markup with regular expressions. Used when jsoup is not on
 * the classpath or when explicitly configured.
 */
public class RegexScheduleExtractor extends AbstractScheduleExtractor {

  private static final Pattern GRID = Pattern.compile(
      "(?is)<table\\b[^>]*\\bid\\s*=\\s*" + exactValue(ScheduleText.GRID_ID) + "[^>]*>(.*?)</table>");
  private static final Pattern ROW = Pattern.compile("(?is)<tr\\b[^>]*>(.*?)</tr>");
  private static final Pattern CELL = Pattern.compile("(?is)<(t[hd])\\b[^>]*>(.*?)</\\1\\s*>");
  private static final Pattern CONTENT = Pattern.compile(
      "(?is)<div\\b[^>]*\\bclass\\s*=\\s*" + classToken(ScheduleText.CONTENT_CLASS) + "[^>]*>(.*?)</div>");
  private static final Pattern TERM_SELECT = Pattern.compile(
      "(?is)<select\\b[^>]*\\bid\\s*=\\s*" + exactValue(ScheduleText.TERM_SELECT_ID) + "[^>]*>(.*?)</select>");
  private static final Pattern OPTION_TAG = Pattern.compile("(?is)<option\\b([^>]*)>");
  private static final Pattern SELECTED = Pattern.compile("(?i)\\bselected\\b");
  // attribute values may be double-quoted, single-quoted or bare
  private static final String ANY_VALUE = "(?:\"([^\"]*)\"|'([^']*)'|([^\\s>\"']+))";
  private static final Pattern VALUE = Pattern.compile("(?i)\\bvalue\\s*=\\s*" + ANY_VALUE);
  private static final Pattern STYLED = Pattern.compile("(?i)<(span|font)\\b");
  private static final Pattern TITLED = Pattern.compile(
      "(?is)<(span|font)\\b[^>]*?\\btitle\\s*=\\s*" + ANY_VALUE + "[^>]*>(.*?)</\\1\\s*>");
  private static final Pattern TOKEN = Pattern.compile("(?s)<[^>]*>|[^<]+");
  private static final Pattern BREAK = Pattern.compile("(?i)^<br\\b");
  private static final Pattern SCRIPT = Pattern.compile("(?is)<(script|style)\\b.*?</\\1\\s*>");
  private static final Pattern TAG = Pattern.compile("(?s)<[^>]*>");

  public RegexScheduleExtractor(LoginPageDetector loginPageDetector, SlotTable slotTable) {
    super(loginPageDetector, slotTable);
  }

  @Override
  public String engine() {
    return "regex";
  }

  @Override
  protected PageMarkup parse(String html) {
    List<GridRow> rows = new ArrayList<>();
    Matcher grid = GRID.matcher(html);
    if (grid.find()) {
      Matcher row = ROW.matcher(grid.group(1));
      while (row.find()) {
        rows.add(toRow(row.group(1)));
      }
    }
    return new PageMarkup(rows, text(html), selectedTerm(html));
  }

  @Override
  protected Optional<FragmentFields> readFragment(String fragmentHtml) {
    if (!STYLED.matcher(fragmentHtml).find()) {
      return Optional.empty();
    }

    String teacher = null;
    String weeks = null;
    String room = null;
    Matcher titled = TITLED.matcher(fragmentHtml);
    while (titled.find()) {
      Optional<FieldRole> role = FieldRole.fromTitle(HtmlUtils.htmlUnescape(quotedOrBare(titled, 2)));
      if (role.isEmpty()) {
        continue;
      }
      String value = ScheduleText.blankToNull(text(titled.group(5)));
      switch (role.get()) {
        case TEACHER -> teacher = teacher == null ? value : teacher;
        case WEEKS -> weeks = weeks == null ? value : weeks;
        case ROOM -> room = room == null ? value : room;
        default -> { }
      }
    }
    return Optional.of(new FragmentFields(courseName(fragmentHtml), teacher, weeks, room));
  }

  private static String courseName(String fragmentHtml) {
    boolean seenTag = false;
    boolean previousWasBreak = false;
    String afterBreak = null;
    int depth = 0;
    Matcher token = TOKEN.matcher(fragmentHtml);
    while (token.find()) {
      String t = token.group();
      if (t.startsWith("<")) {
        seenTag = true;
        previousWasBreak = depth == 0 && BREAK.matcher(t).find();
        depth += depthChange(t);
        continue;
      }
      String text = ScheduleText.clean(HtmlUtils.htmlUnescape(t));
      if (text.isEmpty()) {
        continue;
      }
      if (!seenTag) {
        return text;
      }
      if (depth == 0 && previousWasBreak && afterBreak == null) {
        afterBreak = text;
      }
      previousWasBreak = false;
    }
    return afterBreak;
  }

  /**
   * Nesting change caused by a tag, ignoring void and self-closing elements.
   */
  private static int depthChange(String tag) {
    String lower = tag.toLowerCase(Locale.ROOT);
    if (lower.startsWith("</")) {
      return -1;
    }
    if (lower.endsWith("/>") || lower.startsWith("<br") || lower.startsWith("<img")
        || lower.startsWith("<hr") || lower.startsWith("<input") || lower.startsWith("<!")) {
      return 0;
    }
    return 1;
  }

  private static GridRow toRow(String rowHtml) {
    List<GridRow.GridCell> cells = new ArrayList<>();
    boolean hasDataCell = false;
    Matcher cell = CELL.matcher(rowHtml);
    while (cell.find()) {
      hasDataCell |= "td".equalsIgnoreCase(cell.group(1));
      String inner = cell.group(2);
      Matcher content = CONTENT.matcher(inner);
      cells.add(new GridRow.GridCell(text(inner), content.find() ? content.group(1) : null));
    }
    return new GridRow(text(rowHtml), cells, !hasDataCell);
  }

  private static String selectedTerm(String html) {
    Matcher select = TERM_SELECT.matcher(html);
    if (!select.find()) {
      return null;
    }
    Matcher option = OPTION_TAG.matcher(select.group(1));
    while (option.find()) {
      String attributes = option.group(1);
      if (SELECTED.matcher(attributes).find()) {
        Matcher value = VALUE.matcher(attributes);
        return value.find() ? HtmlUtils.htmlUnescape(quotedOrBare(value, 1)) : null;
      }
    }
    return null;
  }

  /**
   * An attribute value equal to the given word, quoted or not.
   */
  private static String exactValue(String word) {
    return "(?:\"" + word + "\"|'" + word + "'|" + word + "(?=[\\s/>]))";
  }

  /**
   * A class attribute listing the given class among others, or holding it bare.
   */
  private static String classToken(String cls) {
    return "(?:\"(?:[^\"]*\\s)?" + cls + "(?:\\s[^\"]*)?\""
        + "|'(?:[^']*\\s)?" + cls + "(?:\\s[^']*)?'"
        + "|" + cls + "(?=[\\s/>]))";
  }

  /**
   * The first non-null of the three alternatives captured by an attribute value, starting at first.
   */
  private static String quotedOrBare(Matcher matcher, int first) {
    for (int group = first; group < first + 3; group++) {
      if (matcher.group(group) != null) {
        return matcher.group(group);
      }
    }
    return null;
  }

  private static String text(String html) {
    String withoutScripts = SCRIPT.matcher(html).replaceAll(" ");
    String withoutTags = TAG.matcher(withoutScripts).replaceAll(" ");
    return ScheduleText.clean(HtmlUtils.htmlUnescape(withoutTags));
  }
}
