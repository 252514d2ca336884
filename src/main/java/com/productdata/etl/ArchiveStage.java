package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Copies the raw product export into the archive directory before anything else touches it.
 * <p>
 * Snapshots are named {@code products_<yyyyMMdd_HHmmss>.csv}. The name has second resolution, so two
 * archives taken within the same second resolve to the same file and the later copy replaces the
 * earlier one. Archiving is best-effort: an absent raw file is logged as a warning and skipped
 * regardless of the configured {@link MissingInputPolicy}. Copy failures propagate.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class ArchiveStage implements Stage {
    private static final Logger logger = LoggerFactory.getLogger(ArchiveStage.class);

    public static final String NAME = "archive_raw_file";
    static final DateTimeFormatter SNAPSHOT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path rawFile;
    private final Path archiveDir;
    private final Clock clock;

    public ArchiveStage(PipelineConfig config, Clock clock) {
        this.rawFile = config.rawFile();
        this.archiveDir = config.archiveDir();
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult execute() throws IOException {
        if (!Files.exists(rawFile)) {
            logger.warn("No raw file to archive at {}", rawFile);
            return StageResult.skipped(NAME, "No raw file to archive at " + rawFile);
        }
        Path archivePath = archive();
        return StageResult.success(NAME, null, "Raw file archived at " + archivePath,
            Map.of("archivePath", archivePath.toString()));
    }

    /**
     * Copies the raw file into the archive directory, creating the directory when missing.
     * @return path of the snapshot written
     * @throws IOException if the directory cannot be created or the copy fails
     */
    public Path archive() throws IOException {
        if (!Files.exists(archiveDir)) Files.createDirectories(archiveDir);
        Path archivePath = archiveDir.resolve(snapshotFileName(LocalDateTime.now(clock)));
        Files.copy(rawFile, archivePath, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Raw file archived at {}", archivePath);
        return archivePath;
    }

    static String snapshotFileName(LocalDateTime capturedAt) {
        return "products_" + SNAPSHOT_TIMESTAMP.format(capturedAt) + ".csv";
    }
}
