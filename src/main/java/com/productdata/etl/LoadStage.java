package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the cleaned artifact and hands it to a {@link RecordSinkInterface}.
 * <p>
 * The sink is the only thing that changes when a real load target is added; upstream stages are
 * unaffected.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class LoadStage implements Stage {
    private static final Logger logger = LoggerFactory.getLogger(LoadStage.class);

    public static final String NAME = "load_products";

    private final Path transformedFile;
    private final MissingInputPolicy missingInputPolicy;
    private final CsvServiceInterface csvService;
    private final RecordSinkInterface sink;

    public LoadStage(PipelineConfig config, CsvServiceInterface csvService, RecordSinkInterface sink) {
        this.transformedFile = config.transformedFile();
        this.missingInputPolicy = config.missingInputPolicy();
        this.csvService = csvService;
        this.sink = sink;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult execute() throws Exception {
        if (!Files.exists(transformedFile)) {
            return Utils.missingInput(NAME, missingInputPolicy, transformedFile,
                "Transformed file not found at " + transformedFile + ". Cannot load.");
        }
        RecordSet records = csvService.readRecordSet(transformedFile);
        logger.info("Loaded {} rows from transformed CSV (ready for DB or analytics)", records.rowCount());
        sink.accept(records);
        return StageResult.success(NAME, records.rowCount(), "Loaded " + records.rowCount() + " rows",
            Map.of("sink", sink.describe()));
    }
}
