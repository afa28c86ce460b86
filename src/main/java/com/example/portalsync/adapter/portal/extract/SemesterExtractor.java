package com.example.portalsync.adapter.portal.extract;

import com.example.portalsync.adapter.portal.LoginPageDetector;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.SemesterList;
import com.example.portalsync.domain.model.SemesterOption;
import com.example.portalsync.exception.SessionInvalidException;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the term selector of the grade query page.
 */
@Component
@RequiredArgsConstructor
public class SemesterExtractor {

  static final String SELECT_SELECTOR = "select#kksj, select#xnxq01id, select[name=kksj]";

  private final LoginPageDetector loginPageDetector;

  public Extraction<SemesterList> extract(String html) {
    if (loginPageDetector.looksLikeLoginPage(html)) {
      throw new SessionInvalidException("Semester request was answered with the login page");
    }

    Element select = Jsoup.parse(html == null ? "" : html).selectFirst(SELECT_SELECTOR);
    if (select == null) {
      return Extraction.degraded(SemesterList.empty(), "semester selector not found");
    }

    List<SemesterOption> options = new ArrayList<>();
    String current = null;
    for (Element option : select.select("option")) {
      String value = option.attr("value").trim();
      if (value.isEmpty()) {
        continue;
      }
      String label = ScheduleText.clean(option.text());
      options.add(new SemesterOption(value, label.isEmpty() ? value : label));
      if (current == null && option.hasAttr("selected")) {
        current = value;
      }
    }
    return Extraction.of(new SemesterList(options, current));
  }
}
