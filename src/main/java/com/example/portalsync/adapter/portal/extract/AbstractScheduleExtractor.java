package com.example.portalsync.adapter.portal.extract;

import com.example.portalsync.adapter.portal.LoginPageDetector;
import com.example.portalsync.domain.model.CourseView;
import com.example.portalsync.domain.model.Extraction;
import com.example.portalsync.domain.model.ScheduleView;
import com.example.portalsync.exception.SessionInvalidException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks the timetable grid the same way for every engine. Subclasses only read markup:
 * the grid rows, single course fragments, the page text and the selected term option.
 */
@Slf4j
public abstract class AbstractScheduleExtractor implements ScheduleExtractor {

  private static final int DAYS_PER_WEEK = 7;

  private final LoginPageDetector loginPageDetector;
  private final SlotTable slotTable;

  protected AbstractScheduleExtractor(LoginPageDetector loginPageDetector, SlotTable slotTable) {
    this.loginPageDetector = loginPageDetector;
    this.slotTable = slotTable;
  }

  @Override
  public Extraction<ScheduleView> extract(ScheduleRequest request) {
    String html = request.html() == null ? "" : request.html();
    if (loginPageDetector.looksLikeLoginPage(html)) {
      throw new SessionInvalidException("Timetable request was answered with the login page");
    }

    PageMarkup page = read(html);
    List<CourseFragment> fragments = new ArrayList<>();
    List<GridRow> rows = page.gridRows();
    if (rows.isEmpty()) {
      log.debug("[{}] No timetable grid on page", engine());
    } else {
      walkGrid(rows, fragments);
    }

    List<CourseView> courses = CourseMerger.merge(fragments);
    String pageText = page.text();
    ScheduleView view = new ScheduleView(
        resolveSemester(request, pageText, page),
        ScheduleText.currentWeek(pageText),
        courses);
    log.debug("[{}] Extracted {} fragments into {} courses", engine(), fragments.size(), courses.size());
    return Extraction.of(view);
  }

  private void walkGrid(List<GridRow> rows, List<CourseFragment> out) {
    int dataRow = 0;
    for (GridRow row : rows) {
      if (row.header() || ScheduleText.isRemarksRow(row.text())) {
        continue;
      }
      Optional<int[]> slots = slotTable.slotsFor(dataRow++);
      if (slots.isEmpty()) {
        continue;
      }
      int start = slots.get()[0];
      int end = slots.get()[1];

      int weekday = 0;
      for (GridRow.GridCell cell : row.cells()) {
        if (ScheduleText.isTimeLabelCell(cell)) {
          continue;
        }
        weekday++;
        if (weekday > DAYS_PER_WEEK) {
          break;
        }
        if (!cell.hasContent()) {
          continue;
        }
        for (String fragment : ScheduleText.splitFragments(cell.contentHtml())) {
          Optional<FragmentFields> fields = readFragment(fragment);
          if (fields.isEmpty() || fields.get().name() == null) {
            continue;
          }
          FragmentFields f = fields.get();
          out.add(new CourseFragment(f.name(), f.teacher(), f.location(), weekday, start, end, f.weekRange()));
        }
      }
    }
  }

  private String resolveSemester(ScheduleRequest request, String pageText, PageMarkup page) {
    if (request.explicitSemester() != null && !request.explicitSemester().isBlank()) {
      return request.explicitSemester().trim();
    }
    String inline = ScheduleText.inlineTerm(pageText);
    if (inline != null) {
      return inline;
    }
    String selected = ScheduleText.blankToNull(page.selectedTerm());
    if (selected != null) {
      return selected;
    }
    String fromQuery = ScheduleText.queryTerm(request.requestUrl());
    return fromQuery != null ? fromQuery : "";
  }

  private PageMarkup read(String html) {
    try {
      return parse(html);
    } catch (RuntimeException e) {
      log.warn("[{}] Timetable markup could not be read: {}", engine(), e.getMessage());
      return PageMarkup.EMPTY;
    }
  }

  /**
   * Parse the page once into the pieces the grid walk needs.
   */
  protected abstract PageMarkup parse(String html);

  /**
   * Read one course fragment. Empty when the fragment carries no tagged span.
   */
  protected abstract Optional<FragmentFields> readFragment(String fragmentHtml);

  /**
   * Parsed page handed from an engine to the grid walk.
   */
  protected record PageMarkup(List<GridRow> gridRows, String text, String selectedTerm) {
    static final PageMarkup EMPTY = new PageMarkup(List.of(), "", null);
  }
}
