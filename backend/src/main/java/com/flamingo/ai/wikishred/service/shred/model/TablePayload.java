package com.flamingo.ai.wikishred.service.shred.model;

import java.util.List;

/**
 * A data table extracted from an article.
 *
 * <p>{@code rows} is the fully expanded grid: cells spanning several rows or columns are repeated
 * in every position they cover, so every row has exactly {@code columnCount} entries.
 *
 * @param caption table caption, empty if the table has none
 * @param header first grid row when it consists of header cells, otherwise empty
 * @param rows expanded row/column matrix (header row included)
 * @param rowCount number of grid rows
 * @param columnCount number of grid columns
 * @param csv RFC 4180 rendering of {@code rows}
 * @param rawMarkup original table HTML
 */
public record TablePayload(
    String caption,
    List<String> header,
    List<List<String>> rows,
    int rowCount,
    int columnCount,
    String csv,
    String rawMarkup)
    implements SidecarPayload {

  public TablePayload {
    header = List.copyOf(header);
    rows = rows.stream().<List<String>>map(List::copyOf).toList();
  }
}
