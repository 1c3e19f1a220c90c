package com.flamingo.ai.wikishred.service.shred;

import com.flamingo.ai.wikishred.service.shred.model.TablePayload;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Element;

/**
 * Turns an HTML {@code <table>} into an expanded row/column grid.
 *
 * <p>{@code rowspan} and {@code colspan} are honoured by repeating the cell text in every grid
 * position it covers. Rows hidden with {@code display:none} are skipped and rows whose cells are
 * all empty are dropped.
 */
final class TableGridParser {

  private static final int MAX_COLSPAN = 100;

  private TableGridParser() {}

  static Extraction<TablePayload> parse(Element table) {
    String caption = caption(table);
    List<Element> rows = new ArrayList<>();
    for (Element row : HtmlSupport.ownRows(table)) {
      if (!HtmlSupport.isHidden(row)) {
        rows.add(row);
      }
    }

    Map<Long, String> cellMap = new HashMap<>();
    int columnCount = 0;
    for (int r = 0; r < rows.size(); r++) {
      int c = 0;
      for (Element cell : HtmlSupport.cells(rows.get(r))) {
        while (cellMap.containsKey(key(r, c))) {
          c++;
        }
        int rowSpan = HtmlSupport.span(cell, "rowspan", rows.size() - r);
        int colSpan = HtmlSupport.span(cell, "colspan", MAX_COLSPAN);
        String text = HtmlSupport.cellText(cell);
        for (int dr = 0; dr < rowSpan; dr++) {
          for (int dc = 0; dc < colSpan; dc++) {
            cellMap.put(key(r + dr, c + dc), text);
          }
        }
        c += colSpan;
        columnCount = Math.max(columnCount, c);
      }
    }

    List<List<String>> grid = new ArrayList<>();
    List<String> header = List.of();
    for (int r = 0; r < rows.size(); r++) {
      List<String> values = new ArrayList<>(columnCount);
      boolean anyValue = false;
      for (int c = 0; c < columnCount; c++) {
        String value = cellMap.getOrDefault(key(r, c), "");
        anyValue |= !value.isEmpty();
        values.add(value);
      }
      if (!anyValue) {
        continue;
      }
      if (grid.isEmpty() && r == 0 && isHeaderRow(rows.get(0))) {
        header = values;
      }
      grid.add(values);
    }

    List<String> warnings = new ArrayList<>();
    if (grid.isEmpty()) {
      String text = table.text().strip();
      warnings.add("No rows or cells recognized; table kept as a single text cell");
      grid.add(List.of(text));
      columnCount = 1;
    }

    TablePayload payload =
        new TablePayload(
            caption,
            header,
            grid,
            grid.size(),
            columnCount,
            CsvRenderer.render(grid),
            table.outerHtml());
    return new Extraction<>(payload, caption.isEmpty() ? "Data Table" : caption, warnings);
  }

  /** Renders a grid as a GitHub-flavoured pipe table; the first row becomes the header. */
  static String toPipeTable(List<List<String>> grid) {
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < grid.size(); r++) {
      sb.append('|');
      for (String value : grid.get(r)) {
        sb.append(' ').append(MarkdownText.escape(value)).append(" |");
      }
      sb.append('\n');
      if (r == 0) {
        sb.append('|');
        sb.append("---|".repeat(grid.get(0).size()));
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  private static String caption(Element table) {
    for (Element child : table.children()) {
      if ("caption".equals(child.normalName())) {
        return HtmlSupport.cellText(child);
      }
    }
    return "";
  }

  private static boolean isHeaderRow(Element row) {
    List<Element> cells = HtmlSupport.cells(row);
    return !cells.isEmpty() && cells.stream().allMatch(cell -> "th".equals(cell.normalName()));
  }

  private static long key(int row, int column) {
    return ((long) row << 32) | column;
  }
}
