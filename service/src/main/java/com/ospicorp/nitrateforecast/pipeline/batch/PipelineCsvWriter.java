package com.ospicorp.nitrateforecast.pipeline.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.ospicorp.nitrateforecast.evaluation.model.EvaluationReport;
import com.ospicorp.nitrateforecast.features.model.LaggedFeatureTable;
import com.ospicorp.nitrateforecast.pipeline.controller.CsvHttpMessageConverter;
import com.ospicorp.nitrateforecast.series.model.SeriesInspection;
import com.ospicorp.nitrateforecast.series.model.StateCount;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Writes the batch artefacts into one output directory. */
public class PipelineCsvWriter {
  public static final String SERIES_SUMMARY = "raw_series_summary.csv";
  public static final String STATE_COUNTS = "raw_series_state_counts.csv";
  public static final String FEATURES = "features.csv";
  public static final String EVALUATION_ROWS = "evaluation_rows.csv";
  public static final String EVALUATION_SUMMARY = "evaluation_summary.json";

  private final CsvMapper csvMapper = new CsvMapper();
  private final ObjectMapper jsonMapper;
  private final Path directory;

  public PipelineCsvWriter(ObjectMapper jsonMapper, Path directory) {
    this.jsonMapper = jsonMapper;
    this.directory = directory;
    csvMapper.findAndRegisterModules();
    csvMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  public Path writeInspections(List<SeriesInspection> inspections) {
    List<Map<String, Object>> summary = new ArrayList<>(inspections.size());
    List<Map<String, Object>> states = new ArrayList<>();
    for (SeriesInspection i : inspections) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("series", i.series());
      row.put("rows", i.rows());
      row.put("start_utc", i.startUtc() == null ? null : i.startUtc().toString());
      row.put("end_utc", i.endUtc() == null ? null : i.endUtc().toString());
      row.put("unique_timestamps", i.uniqueTimestamps());
      row.put("duplicate_timestamps", i.duplicateTimestamps());
      row.put("median_interval", i.medianInterval());
      row.put("median_interval_seconds", i.medianIntervalSeconds());
      row.put("value_num_nonnull", i.valueNumNonNull());
      row.put("value_num_pct", i.valueNumPct());
      row.put("value_str_nonnull", i.valueStrNonNull());
      summary.add(row);
      for (StateCount state : i.topStates()) {
        Map<String, Object> stateRow = new LinkedHashMap<>();
        stateRow.put("series", i.series());
        stateRow.put("state", state.state());
        stateRow.put("count", state.count());
        states.add(stateRow);
      }
    }
    writeCsv(STATE_COUNTS, states);
    return writeCsv(SERIES_SUMMARY, summary);
  }

  public Path writeFeatures(LaggedFeatureTable table) {
    return writeCsv(FEATURES, table.toRows());
  }

  public Path writeEvaluation(EvaluationReport report) {
    writeCsv(EVALUATION_ROWS, report.rows());
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("summary", report.summary());
    summary.put("windows", report.windows());
    summary.put("horizons", report.horizons());
    summary.put("skipped", report.skipped());
    summary.put("latestFit", report.latestFit());
    Path target = directory.resolve(EVALUATION_SUMMARY);
    try {
      Files.createDirectories(directory);
      jsonMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), summary);
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot write " + target, ex);
    }
    return target;
  }

  private Path writeCsv(String fileName, Collection<?> rows) {
    Path target = directory.resolve(fileName);
    try {
      Files.createDirectories(directory);
      try (OutputStream out = Files.newOutputStream(target)) {
        CsvHttpMessageConverter.write(csvMapper, rows, out);
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot write " + target, ex);
    }
    return target;
  }
}
