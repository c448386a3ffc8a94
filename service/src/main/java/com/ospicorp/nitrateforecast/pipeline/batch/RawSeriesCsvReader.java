package com.ospicorp.nitrateforecast.pipeline.batch;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.nitrateforecast.config.PipelineConfig;
import com.ospicorp.nitrateforecast.error.ConfigException;
import com.ospicorp.nitrateforecast.series.model.AggregationPolicy;
import com.ospicorp.nitrateforecast.series.model.RawObservation;
import com.ospicorp.nitrateforecast.series.model.RawSeries;
import com.ospicorp.nitrateforecast.series.service.ObservationNormalizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads one series per {@code <variable>.csv} file with a {@code timestamp,value} header. Values
 * go through the same normalisation as HTTP payloads.
 */
public class RawSeriesCsvReader {
  private static final String CSV_SUFFIX = ".csv";

  private final CsvMapper mapper = new CsvMapper();

  public List<RawSeries> readDirectory(Path directory, PipelineConfig config) {
    if (!Files.isDirectory(directory)) {
      throw new ConfigException("Batch input directory does not exist: " + directory);
    }
    List<Path> files;
    try (Stream<Path> listing = Files.list(directory)) {
      files = listing.filter(p -> p.getFileName().toString().endsWith(CSV_SUFFIX))
          .sorted()
          .toList();
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot list " + directory, ex);
    }
    if (files.isEmpty()) {
      throw new ConfigException("No *.csv series found in " + directory);
    }
    List<RawSeries> series = new ArrayList<>(files.size());
    for (Path file : files) {
      series.add(read(file, config));
    }
    return series;
  }

  public RawSeries read(Path file, PipelineConfig config) {
    String fileName = file.getFileName().toString();
    String name = fileName.substring(0, fileName.length() - CSV_SUFFIX.length());
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<RawObservation> observations = new ArrayList<>();
    try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
        .with(schema)
        .readValues(file.toFile())) {
      int line = 1;
      while (rows.hasNext()) {
        line++;
        Map<String, String> row = rows.next();
        String timestamp = row.get("timestamp");
        if (timestamp == null) {
          throw new ConfigException(fileName + " has no timestamp column");
        }
        try {
          observations.add(ObservationNormalizer.fromText(
              ObservationNormalizer.parseTimestamp(timestamp), row.get("value")));
        } catch (IllegalArgumentException ex) {
          throw new ConfigException(fileName + " line " + line + ": " + ex.getMessage());
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot read " + file, ex);
    }
    return new RawSeries(name, null, observations,
        config.aggregationFor(name, AggregationPolicy.MEAN), null,
        config.zeroWhenEmpty().contains(name));
  }
}
