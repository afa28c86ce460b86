package com.example.portalsync.adapter.portal.extract;

import com.example.portalsync.adapter.portal.LoginPageDetector;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.ProfileView;
import com.example.portalsync.exception.SessionInvalidException;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads label/value pairs from the student record page. Labels are either written as
 * {@code 学号：2021001} inside one cell or as a bare label cell followed by a value cell.
 */
@Component
@RequiredArgsConstructor
public class ProfileExtractor {

  private static final Pattern INLINE_PAIR = Pattern.compile("^([^：:]{1,12})[：:]\\s*(.*)$");
  private static final Pattern YEAR = Pattern.compile("^(\\d{4})");

  static final List<String> STUDENT_ID = List.of("学号");
  static final List<String> NAME = List.of("姓名");
  static final List<String> COLLEGE = List.of("院系", "学院", "所属院系");
  static final List<String> MAJOR = List.of("专业", "专业名称");
  static final List<String> CLASS_NAME = List.of("班级", "行政班");
  static final List<String> ENROLLMENT = List.of("入学年份", "入学日期", "入学时间", "年级");
  static final List<String> STUDY_LEVEL = List.of("学历层次", "培养层次", "层次");

  private static final List<List<String>> KNOWN_LABELS =
      List.of(STUDENT_ID, NAME, COLLEGE, MAJOR, CLASS_NAME, ENROLLMENT, STUDY_LEVEL);

  private final LoginPageDetector loginPageDetector;

  public Extraction<ProfileView> extract(String html) {
    if (loginPageDetector.looksLikeLoginPage(html)) {
      throw new SessionInvalidException("Profile request was answered with the login page");
    }

    Map<String, String> fields = new LinkedHashMap<>();
    for (Element cell : Jsoup.parse(html == null ? "" : html).select("td, th")) {
      if (!cell.select("td, th").stream().allMatch(e -> e == cell)) {
        continue;
      }
      String text = ScheduleText.clean(cell.text());
      Matcher pair = INLINE_PAIR.matcher(text);
      if (pair.matches()) {
        String value = pair.group(2).trim();
        if (value.isEmpty()) {
          value = nextCellText(cell);
        }
        putField(fields, pair.group(1).trim(), value);
      } else if (isKnownLabel(text)) {
        putField(fields, text, nextCellText(cell));
      }
    }

    ProfileView profile = new ProfileView(
        lookup(fields, STUDENT_ID),
        lookup(fields, NAME),
        lookup(fields, COLLEGE),
        lookup(fields, MAJOR),
        lookup(fields, CLASS_NAME),
        year(lookup(fields, ENROLLMENT)),
        lookup(fields, STUDY_LEVEL),
        fields);
    if (profile.isEmpty()) {
      return Extraction.degraded(profile, "no profile fields found");
    }
    return Extraction.of(profile);
  }

  private static void putField(Map<String, String> fields, String label, String value) {
    if (label.isEmpty() || value == null || value.isEmpty()) {
      return;
    }
    fields.putIfAbsent(label, value);
  }

  private static String nextCellText(Element cell) {
    Element next = cell.nextElementSibling();
    return next == null ? null : ScheduleText.clean(next.text());
  }

  private static boolean isKnownLabel(String text) {
    return KNOWN_LABELS.stream().anyMatch(labels -> labels.contains(text));
  }

  private static String lookup(Map<String, String> fields, List<String> labels) {
    for (String label : labels) {
      String value = fields.get(label);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private static String year(String value) {
    if (value == null) {
      return null;
    }
    Matcher m = YEAR.matcher(value);
    return m.find() ? m.group(1) : value;
  }
}
