package com.productdata.etl;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Interface for storing and reading back pipeline run reports.
 */
public interface RunHistoryServiceInterface {
    /**
     * Appends a run report to the history.
     * @param report Report of a finished run
     * @throws IOException if the history cannot be written
     */
    void append(RunReport report) throws IOException;

    /**
     * Reads every stored report, oldest first. An absent history reads as empty.
     * @throws IOException if the history cannot be read or parsed
     */
    List<RunReport> readAll() throws IOException;

    /**
     * Returns the latest logical date of the runs started by the given trigger.
     * @throws IOException if the history cannot be read or parsed
     */
    Optional<LocalDateTime> lastLogicalDate(RunTrigger trigger) throws IOException;
}
