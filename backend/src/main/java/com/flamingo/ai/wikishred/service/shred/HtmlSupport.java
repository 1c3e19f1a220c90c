package com.flamingo.ai.wikishred.service.shred;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jsoup.nodes.Element;

/** DOM helpers shared by the table, infobox and formula extractors. */
final class HtmlSupport {

  private HtmlSupport() {}

  /** Rows belonging to {@code table} itself, skipping rows of nested tables. */
  static List<Element> ownRows(Element table) {
    List<Element> rows = new ArrayList<>();
    for (Element row : table.select("tr")) {
      if (enclosingTable(row) == table) {
        rows.add(row);
      }
    }
    return rows;
  }

  /** {@code th}/{@code td} children of a row. */
  static List<Element> cells(Element row) {
    List<Element> cells = new ArrayList<>();
    for (Element child : row.children()) {
      String name = child.normalName();
      if ("th".equals(name) || "td".equals(name)) {
        cells.add(child);
      }
    }
    return cells;
  }

  /** Visible text of a cell with citation markers removed and whitespace collapsed. */
  static String cellText(Element cell) {
    Element copy = cell.clone();
    copy.select("sup.reference, .mw-ref, style, script").remove();
    return copy.text().strip();
  }

  static boolean isHidden(Element element) {
    String style = element.attr("style").toLowerCase(Locale.ROOT).replace(" ", "");
    return style.contains("display:none");
  }

  /** Parses a span attribute; anything that is not a positive number counts as 1. */
  static int span(Element cell, String attribute, int cap) {
    String value = cell.attr(attribute).strip();
    if (value.isEmpty()) {
      return 1;
    }
    try {
      int span = Integer.parseInt(value);
      return span < 1 ? 1 : Math.min(span, cap);
    } catch (NumberFormatException e) {
      return 1;
    }
  }

  private static Element enclosingTable(Element element) {
    Element parent = element.parent();
    while (parent != null && !"table".equals(parent.normalName())) {
      parent = parent.parent();
    }
    return parent;
  }
}
