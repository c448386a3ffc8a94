package com.ospicorp.nitrateforecast.pipeline.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.nitrateforecast.config.PipelineConfig;
import com.ospicorp.nitrateforecast.evaluation.model.EvaluationReport;
import com.ospicorp.nitrateforecast.features.model.LaggedFeatureTable;
import com.ospicorp.nitrateforecast.pipeline.service.ForecastPipelineService;
import com.ospicorp.nitrateforecast.series.model.RawSeries;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * File-driven run of the whole pipeline with the service defaults. Pair with
 * {@code spring.main.web-application-type=none} for a one-shot job.
 */
@Component
@ConditionalOnProperty(prefix = "nitrate.batch", name = "enabled", havingValue = "true")
public class BatchPipelineRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(BatchPipelineRunner.class);

  private final ForecastPipelineService pipeline;
  private final ObjectMapper objectMapper;
  private final Path inputDir;
  private final Path outputDir;

  public BatchPipelineRunner(ForecastPipelineService pipeline, ObjectMapper objectMapper,
      @Value("${nitrate.batch.input-dir:data/raw}") Path inputDir,
      @Value("${nitrate.batch.output-dir:data/out}") Path outputDir) {
    this.pipeline = pipeline;
    this.objectMapper = objectMapper;
    this.inputDir = inputDir;
    this.outputDir = outputDir;
  }

  @Override
  public void run(String... args) {
    PipelineConfig config = pipeline.defaults();
    log.info("Batch run reading {} and writing {}", inputDir.toAbsolutePath(),
        outputDir.toAbsolutePath());
    List<RawSeries> series = new RawSeriesCsvReader().readDirectory(inputDir, config);
    PipelineCsvWriter writer = new PipelineCsvWriter(objectMapper, outputDir);

    writer.writeInspections(pipeline.inspect(series));
    LaggedFeatureTable table = pipeline.buildFeatures(series, config);
    writer.writeFeatures(table);
    EvaluationReport report = pipeline.evaluate(table, config);
    writer.writeEvaluation(report);
    log.info("Batch run complete: {} series, {} feature rows, {} evaluation rows, {} skipped "
            + "windows", series.size(), table.rowCount(), report.rows().size(),
        report.summary().skippedWindows());
  }
}
