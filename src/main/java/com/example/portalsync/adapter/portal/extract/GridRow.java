package com.example.portalsync.adapter.portal.extract;

import java.util.List;

/**
 * Engine-neutral view of one timetable row.
 *
 * @param text   the row's visible text
 * @param header true when the row holds no data cells at all
 */
record GridRow(String text, List<GridCell> cells, boolean header) {

  /**
   * @param text        visible text of the cell
   * @param contentHtml inner markup of the course content container, null when the cell has none
   */
  record GridCell(String text, String contentHtml) {

    boolean hasContent() {
      return contentHtml != null;
    }
  }
}
