package com.dataprep.standardizer.service.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * In-memory snapshot of a dataset: an ordered column schema and field-named rows. Instances are
 * never mutated by the engine; transformations return new instances.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TabularDataset {

  private final List<String> columns;
  private final List<Map<String, Object>> rows;

  private TabularDataset(List<String> columns, List<Map<String, Object>> rows) {
    this.columns = Collections.unmodifiableList(columns);
    this.rows = Collections.unmodifiableList(rows);
  }

  /**
   * Creates a snapshot. When {@code columns} is null or empty the schema is taken from the union of
   * row keys, in first-seen order.
   */
  public static TabularDataset of(List<String> columns, List<Map<String, Object>> rows) {
    List<Map<String, Object>> rowCopy = rows == null ? new ArrayList<>() : new ArrayList<>(rows);
    List<String> schema;
    if (columns == null || columns.isEmpty()) {
      Set<String> keys = new LinkedHashSet<>();
      for (Map<String, Object> row : rowCopy) {
        if (row != null) {
          keys.addAll(row.keySet());
        }
      }
      schema = new ArrayList<>(keys);
    } else {
      schema = new ArrayList<>(columns);
    }
    return new TabularDataset(schema, rowCopy);
  }

  public boolean hasColumn(String column) {
    return column != null && columns.contains(column);
  }

  public int rowCount() {
    return rows.size();
  }

  /**
   * Non-empty, trimmed string values of one column in row order. Null cells and cells that are
   * blank after trimming are skipped.
   */
  public List<String> columnValues(String column) {
    List<String> values = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      if (row == null) {
        continue;
      }
      Object cell = row.get(column);
      if (cell == null) {
        continue;
      }
      String text = cell.toString().trim();
      if (!text.isEmpty()) {
        values.add(text);
      }
    }
    return values;
  }
}
