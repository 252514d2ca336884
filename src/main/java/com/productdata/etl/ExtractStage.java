package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the raw product export and reports how many rows it holds.
 * <p>
 * The records are not forwarded to the transform stage, which re-reads the raw file itself.
 * Callers that want the records use {@link #extract()}, which yields an empty record set when the
 * raw file is absent under {@link MissingInputPolicy#SKIP}.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class ExtractStage implements Stage {
    private static final Logger logger = LoggerFactory.getLogger(ExtractStage.class);

    public static final String NAME = "extract_products";

    private final Path rawFile;
    private final MissingInputPolicy missingInputPolicy;
    private final CsvServiceInterface csvService;

    public ExtractStage(PipelineConfig config, CsvServiceInterface csvService) {
        this.rawFile = config.rawFile();
        this.missingInputPolicy = config.missingInputPolicy();
        this.csvService = csvService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult execute() throws Exception {
        if (!Files.exists(rawFile)) {
            return Utils.missingInput(NAME, missingInputPolicy, rawFile, "Raw file not found at " + rawFile);
        }
        RecordSet records = read();
        return StageResult.success(NAME, records.rowCount(), "Extracted " + records.rowCount() + " rows",
            Map.of("columns", records.columnCount()));
    }

    /**
     * Reads the raw file into memory.
     * @return the raw records, or an empty record set when the file is absent and the policy is SKIP
     * @throws MissingInputException if the file is absent and the policy is FAIL
     */
    public RecordSet extract() throws Exception {
        if (!Files.exists(rawFile)) {
            Utils.missingInput(NAME, missingInputPolicy, rawFile, "Raw file not found at " + rawFile);
            return RecordSet.empty();
        }
        return read();
    }

    private RecordSet read() throws Exception {
        RecordSet records = csvService.readRecordSet(rawFile);
        logger.info("Extracted {} rows from raw {}", records.rowCount(), rawFile.getFileName());
        return records;
    }
}
