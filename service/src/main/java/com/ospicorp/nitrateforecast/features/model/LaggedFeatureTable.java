package com.ospicorp.nitrateforecast.features.model;

import com.ospicorp.nitrateforecast.error.AlignmentException;
import com.ospicorp.nitrateforecast.error.ConfigException;
import com.ospicorp.nitrateforecast.series.model.AlignedColumn;
import com.ospicorp.nitrateforecast.series.model.AlignedDataset;
import com.ospicorp.nitrateforecast.series.model.TimeGrid;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Aligned dataset plus lag columns, all on the dataset's grid. Read-only once built, so windows
 * evaluated in parallel may share one instance.
 */
public record LaggedFeatureTable(
    AlignedDataset dataset,
    Map<String, AlignedColumn> lagColumns,
    Map<String, LagSpec> lagSpecs
) {

  public LaggedFeatureTable {
    for (var e : lagColumns.entrySet()) {
      if (e.getValue().size() != dataset.rowCount()) {
        throw new AlignmentException("Lag column " + e.getKey() + " is not on the dataset grid");
      }
      if (dataset.hasColumn(e.getKey())) {
        throw new ConfigException("Lag column " + e.getKey() + " shadows an aligned variable");
      }
    }
    lagColumns = Collections.unmodifiableMap(new LinkedHashMap<>(lagColumns));
    lagSpecs = Collections.unmodifiableMap(new LinkedHashMap<>(lagSpecs));
  }

  public static LaggedFeatureTable of(AlignedDataset dataset) {
    return new LaggedFeatureTable(dataset, Map.of(), Map.of());
  }

  public TimeGrid grid() {
    return dataset.grid();
  }

  public int rowCount() {
    return dataset.rowCount();
  }

  public boolean hasColumn(String name) {
    return dataset.hasColumn(name) || lagColumns.containsKey(name);
  }

  public AlignedColumn column(String name) {
    AlignedColumn lag = lagColumns.get(name);
    return lag != null ? lag : dataset.column(name);
  }

  public Optional<LagSpec> lagSpec(String column) {
    return Optional.ofNullable(lagSpecs.get(column));
  }

  public Set<String> columnNames() {
    Set<String> names = new LinkedHashSet<>(dataset.names());
    names.addAll(lagColumns.keySet());
    return names;
  }

  /**
   * One map per grid row: {@code timestamp}, each variable, its {@code _missing} indicator, then
   * the lag columns.
   */
  public List<Map<String, Object>> toRows() {
    List<Map<String, Object>> rows = new ArrayList<>(rowCount());
    for (int i = 0; i < rowCount(); i++) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("timestamp", grid().timestampAt(i).toString());
      for (AlignedColumn column : dataset.columns().values()) {
        row.put(column.name(), column.value(i));
      }
      for (AlignedColumn column : dataset.columns().values()) {
        row.put(column.name() + "_missing", column.state(i).wasMissing() ? 1 : 0);
      }
      for (var e : lagColumns.entrySet()) {
        row.put(e.getKey(), e.getValue().value(i));
      }
      rows.add(row);
    }
    return rows;
  }
}
