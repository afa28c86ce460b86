package com.example.portalsync.adapter.portal.extract;

import com.example.portalsync.adapter.portal.LoginPageDetector;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.GradeSheet;
import com.example.portalsync.exception.SessionInvalidException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the grade list table. Each data row becomes a header-to-cell map, so columns added
 * upstream flow through without code changes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GradeExtractor {

  static final String TABLE_SELECTOR = "table#dataList";

  private final LoginPageDetector loginPageDetector;

  public Extraction<GradeSheet> extract(String html) {
    if (loginPageDetector.looksLikeLoginPage(html)) {
      throw new SessionInvalidException("Grade request was answered with the login page");
    }

    Document doc = Jsoup.parse(html == null ? "" : html);
    Element table = doc.selectFirst(TABLE_SELECTOR);
    if (table == null) {
      return Extraction.degraded(GradeSheet.empty(), "grade table not found");
    }

    List<String> headers = new ArrayList<>();
    List<Map<String, String>> rows = new ArrayList<>();
    for (Element tr : table.select("tr")) {
      Elements th = tr.select("> th");
      if (headers.isEmpty() && !th.isEmpty()) {
        headers.addAll(uniqueHeaders(th.stream().map(Element::text).toList()));
        continue;
      }
      Elements cells = tr.select("> td");
      // "no data" rows are a single spanning cell
      if (cells.size() < 2 || headers.isEmpty()) {
        continue;
      }
      Map<String, String> row = new LinkedHashMap<>();
      for (int i = 0; i < Math.min(headers.size(), cells.size()); i++) {
        row.put(headers.get(i), ScheduleText.clean(cells.get(i).text()));
      }
      rows.add(row);
    }

    if (headers.isEmpty()) {
      return Extraction.degraded(GradeSheet.empty(), "grade table has no header row");
    }
    log.debug("Extracted {} grade rows with {} columns", rows.size(), headers.size());
    return Extraction.of(new GradeSheet(headers, rows));
  }

  private static List<String> uniqueHeaders(List<String> raw) {
    List<String> headers = new ArrayList<>(raw.size());
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < raw.size(); i++) {
      String header = ScheduleText.clean(raw.get(i));
      if (header.isEmpty()) {
        header = "col" + (i + 1);
      }
      String candidate = header;
      int suffix = 2;
      while (!seen.add(candidate)) {
        candidate = header + "_" + suffix++;
      }
      headers.add(candidate);
    }
    return headers;
  }
}
