package com.example.portalsync.adapter.portal.extract;

import com.example.portalsync.adapter.portal.LoginPageDetector;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Timetable engine backed by jsoup.
 */
public class JsoupScheduleExtractor extends AbstractScheduleExtractor {

  public JsoupScheduleExtractor(LoginPageDetector loginPageDetector, SlotTable slotTable) {
    super(loginPageDetector, slotTable);
  }

  @Override
  public String engine() {
    return "markup";
  }

  @Override
  protected PageMarkup parse(String html) {
    Document doc = Jsoup.parse(html);
    doc.outputSettings().prettyPrint(false);

    List<GridRow> rows = new ArrayList<>();
    Element grid = doc.getElementById(ScheduleText.GRID_ID);
    if (grid != null) {
      for (Element tr : rowsOf(grid)) {
        rows.add(toRow(tr));
      }
    }

    String selectedTerm = null;
    Element option = doc.selectFirst("select#" + ScheduleText.TERM_SELECT_ID + " option[selected]");
    if (option != null) {
      selectedTerm = option.attr("value");
    }
    return new PageMarkup(rows, ScheduleText.clean(doc.text()), selectedTerm);
  }

  @Override
  protected Optional<FragmentFields> readFragment(String fragmentHtml) {
    Element body = Jsoup.parseBodyFragment(fragmentHtml).body();
    if (body.select("span, font").isEmpty()) {
      return Optional.empty();
    }

    String teacher = null;
    String weeks = null;
    String room = null;
    for (Element titled : body.select("span[title], font[title]")) {
      Optional<FieldRole> role = FieldRole.fromTitle(titled.attr("title"));
      if (role.isEmpty()) {
        continue;
      }
      String value = ScheduleText.blankToNull(titled.text());
      switch (role.get()) {
        case TEACHER -> teacher = teacher == null ? value : teacher;
        case WEEKS -> weeks = weeks == null ? value : weeks;
        case ROOM -> room = room == null ? value : room;
        default -> { }
      }
    }
    return Optional.of(new FragmentFields(courseName(body), teacher, weeks, room));
  }

  private static String courseName(Element body) {
    boolean seenTag = false;
    boolean previousWasBreak = false;
    String afterBreak = null;
    for (Node node : body.childNodes()) {
      if (node instanceof TextNode textNode) {
        String text = ScheduleText.clean(textNode.text());
        if (text.isEmpty()) {
          continue;
        }
        if (!seenTag) {
          return text;
        }
        if (previousWasBreak && afterBreak == null) {
          afterBreak = text;
        }
        previousWasBreak = false;
      } else if (node instanceof Element element) {
        seenTag = true;
        previousWasBreak = "br".equals(element.normalName());
      }
    }
    return afterBreak;
  }

  private static List<Element> rowsOf(Element table) {
    List<Element> rows = new ArrayList<>();
    for (Element child : table.children()) {
      if ("tr".equals(child.normalName())) {
        rows.add(child);
      } else if (child.normalName().matches("thead|tbody|tfoot")) {
        for (Element tr : child.children()) {
          if ("tr".equals(tr.normalName())) {
            rows.add(tr);
          }
        }
      }
    }
    return rows;
  }

  private static GridRow toRow(Element tr) {
    List<GridRow.GridCell> cells = new ArrayList<>();
    boolean hasDataCell = false;
    for (Element cell : tr.children()) {
      String tag = cell.normalName();
      if (!"td".equals(tag) && !"th".equals(tag)) {
        continue;
      }
      hasDataCell |= "td".equals(tag);
      Element content = cell.selectFirst("div." + ScheduleText.CONTENT_CLASS);
      cells.add(new GridRow.GridCell(
          ScheduleText.clean(cell.text()),
          content == null ? null : content.html()));
    }
    return new GridRow(ScheduleText.clean(tr.text()), cells, !hasDataCell);
  }
}
