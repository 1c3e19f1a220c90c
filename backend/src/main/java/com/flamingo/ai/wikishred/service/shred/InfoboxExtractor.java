package com.flamingo.ai.wikishred.service.shred;

import com.flamingo.ai.wikishred.service.shred.model.InfoboxPayload;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Element;

/**
 * Reads the label/value rows of an infobox.
 *
 * <p>The recognized layout is one header cell ({@code th}) followed by value cells ({@code td}). If
 * no row has that shape the extractor falls back to a generic reading where the first cell of each
 * multi-cell row is the key and the remaining cells are the value.
 */
final class InfoboxExtractor {

  private InfoboxExtractor() {}

  static Extraction<InfoboxPayload> extract(Element infobox) {
    String title = title(infobox);
    List<Element> rows = HtmlSupport.ownRows(infobox);
    Map<String, String> fields = new LinkedHashMap<>();

    for (Element row : rows) {
      List<Element> cells = HtmlSupport.cells(row);
      if (cells.size() < 2 || !"th".equals(cells.get(0).normalName())) {
        continue;
      }
      List<Element> values = cells.subList(1, cells.size());
      if (values.stream().allMatch(cell -> "td".equals(cell.normalName()))) {
        put(fields, HtmlSupport.cellText(cells.get(0)), joinText(values));
      }
    }

    List<String> warnings = new ArrayList<>();
    if (fields.isEmpty()) {
      warnings.add("Infobox layout not recognized; fields read generically from table rows");
      int index = 0;
      for (Element row : rows) {
        List<Element> cells = HtmlSupport.cells(row);
        index++;
        if (cells.size() >= 2) {
          put(
              fields,
              HtmlSupport.cellText(cells.get(0)),
              joinText(cells.subList(1, cells.size())));
        } else if (cells.size() == 1) {
          String text = HtmlSupport.cellText(cells.get(0));
          if (!text.isEmpty() && !text.equals(title)) {
            put(fields, "row_" + index, text);
          }
        }
      }
    }

    String label = title.isEmpty() ? "Summary of Attributes" : "Summary of " + title;
    return new Extraction<>(
        new InfoboxPayload(title, fields, infobox.outerHtml()), label, warnings);
  }

  private static String title(Element infobox) {
    Element heading = infobox.selectFirst("caption, .infobox-above, .infobox-title");
    if (heading != null) {
      return HtmlSupport.cellText(heading);
    }
    for (Element row : HtmlSupport.ownRows(infobox)) {
      List<Element> cells = HtmlSupport.cells(row);
      if (cells.size() == 1 && "th".equals(cells.get(0).normalName())) {
        return HtmlSupport.cellText(cells.get(0));
      }
    }
    return "";
  }

  private static String joinText(List<Element> cells) {
    StringBuilder sb = new StringBuilder();
    for (Element cell : cells) {
      String text = HtmlSupport.cellText(cell);
      if (!text.isEmpty()) {
        if (sb.length() > 0) {
          sb.append(' ');
        }
        sb.append(text);
      }
    }
    return sb.toString();
  }

  /** Adds a field; a repeated label gets an occurrence suffix so no value is lost. */
  private static void put(Map<String, String> fields, String key, String value) {
    if (key.isEmpty() || value.isEmpty()) {
      return;
    }
    String unique = key;
    for (int n = 2; fields.containsKey(unique); n++) {
      unique = key + " (" + n + ")";
    }
    fields.put(unique, value);
  }
}
