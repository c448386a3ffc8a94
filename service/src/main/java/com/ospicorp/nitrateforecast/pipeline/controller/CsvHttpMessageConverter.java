package com.ospicorp.nitrateforecast.pipeline.controller;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes a collection of rows as {@code text/csv}. Rows are either maps, whose keys become the
 * header in first-seen order, or beans, whose property order gives the header.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV request bodies are not supported",
        inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    write(mapper, rows, outputMessage.getBody());
  }

  /** Flushes but leaves {@code out} open for the caller. */
  public static void write(CsvMapper mapper, Collection<?> rows, OutputStream out)
      throws IOException {
    var writer = mapper.writer(schemaFor(mapper, rows)).writeValues(out);
    for (Object row : rows) {
      writer.write(row);
    }
    writer.flush();
  }

  static CsvSchema schemaFor(CsvMapper mapper, Collection<?> rows) {
    Object sample = null;
    for (Object row : rows) {
      if (row != null) {
        sample = row;
        break;
      }
    }
    if (sample instanceof Map<?, ?>) {
      Set<String> columns = new LinkedHashSet<>();
      for (Object row : rows) {
        if (row instanceof Map<?, ?> map) {
          for (Object key : map.keySet()) {
            if (key != null) {
              columns.add(key.toString());
            }
          }
        }
      }
      CsvSchema.Builder builder = CsvSchema.builder();
      columns.forEach(builder::addColumn);
      return builder.setUseHeader(true).build();
    }
    if (sample != null) {
      return mapper.schemaFor(sample.getClass()).withHeader();
    }
    return CsvSchema.emptySchema().withHeader();
  }
}
