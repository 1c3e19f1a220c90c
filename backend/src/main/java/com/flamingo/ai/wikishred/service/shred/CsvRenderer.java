package com.flamingo.ai.wikishred.service.shred;

import java.util.List;

/** Minimal RFC 4180 writer for extracted table grids. */
final class CsvRenderer {

  private CsvRenderer() {}

  /** Renders rows with {@code \n} line endings; fields are quoted only when needed. */
  static String render(List<List<String>> rows) {
    StringBuilder sb = new StringBuilder();
    for (List<String> row : rows) {
      for (int c = 0; c < row.size(); c++) {
        if (c > 0) {
          sb.append(',');
        }
        sb.append(field(row.get(c)));
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static String field(String value) {
    if (value.indexOf(',') < 0
        && value.indexOf('"') < 0
        && value.indexOf('\n') < 0
        && value.indexOf('\r') < 0) {
      return value;
    }
    return '"' + value.replace("\"", "\"\"") + '"';
  }
}
