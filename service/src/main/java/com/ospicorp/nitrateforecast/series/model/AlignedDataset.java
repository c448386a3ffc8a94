package com.ospicorp.nitrateforecast.series.model;

import com.ospicorp.nitrateforecast.error.AlignmentException;
import com.ospicorp.nitrateforecast.error.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record AlignedDataset(TimeGrid grid, Map<String, AlignedColumn> columns) {

  public AlignedDataset {
    Objects.requireNonNull(grid, "grid");
    Map<String, AlignedColumn> copy = new LinkedHashMap<>();
    for (var e : columns.entrySet()) {
      if (e.getValue().size() != grid.size()) {
        throw new AlignmentException("Column " + e.getKey() + " has " + e.getValue().size()
            + " rows but the grid has " + grid.size());
      }
      copy.put(e.getKey(), e.getValue());
    }
    columns = Collections.unmodifiableMap(copy);
  }

  public int rowCount() {
    return grid.size();
  }

  public Set<String> names() {
    return columns.keySet();
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  public AlignedColumn column(String name) {
    AlignedColumn column = columns.get(name);
    if (column == null) {
      throw new ConfigException("Unknown variable: " + name);
    }
    return column;
  }

  public AlignedDataset withColumns(Map<String, AlignedColumn> replacement) {
    return new AlignedDataset(grid, replacement);
  }
}
