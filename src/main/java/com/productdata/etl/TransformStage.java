package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Cleans the raw product export with {@link CleaningPolicy} and overwrites the cleaned artifact.
 * <p>
 * Nothing is written when the raw file is absent, so the load stage then also finds no input.
 * Malformed input fails the stage before the previous cleaned artifact is touched.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class TransformStage implements Stage {
    private static final Logger logger = LoggerFactory.getLogger(TransformStage.class);

    public static final String NAME = "transform_products";

    private final Path rawFile;
    private final Path transformedFile;
    private final MissingInputPolicy missingInputPolicy;
    private final CsvServiceInterface csvService;

    public TransformStage(PipelineConfig config, CsvServiceInterface csvService) {
        this.rawFile = config.rawFile();
        this.transformedFile = config.transformedFile();
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
            return Utils.missingInput(NAME, missingInputPolicy, rawFile,
                "Raw file not found at " + rawFile + ". Cannot transform.");
        }
        RecordSet raw = csvService.readRecordSet(rawFile);
        int originalCount = raw.rowCount();
        RecordSet deduped = CleaningPolicy.dropDuplicates(raw);
        int dedupedCount = deduped.rowCount();

        RecordSet cleaned = CleaningPolicy.fillAndNormalize(deduped);
        int cleanedCount = cleaned.rowCount();
        logger.info("Transformed data: {} -> {} rows after cleaning", originalCount, cleanedCount);

        csvService.writeRecordSet(cleaned, transformedFile);
        logger.info("Transformed data saved to {}", transformedFile);
        return StageResult.success(NAME, cleanedCount, "Transformed data saved to " + transformedFile, Map.of(
            "rowsIn", originalCount,
            "rowsOut", cleanedCount,
            "duplicatesDropped", originalCount - dedupedCount));
    }
}
