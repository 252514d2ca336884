package com.productdata.etl;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for reading and writing product CSV files as {@link RecordSet}s.
 */
public interface CsvServiceInterface {
    /**
     * Reads a CSV file with a header row into a record set, inferring each column's type.
     * @param path CSV file to read
     * @return the parsed records
     * @throws IOException if the file cannot be read
     * @throws DataShapeException if the file has no header or a row is wider than the header
     */
    RecordSet readRecordSet(Path path) throws IOException, DataShapeException;

    /**
     * Writes a record set as CSV with a header row, replacing any existing file.
     * Parent directories are created when missing.
     * @param records Records to write
     * @param path Output CSV file
     * @throws IOException if file writing fails
     */
    void writeRecordSet(RecordSet records, Path path) throws IOException;
}
