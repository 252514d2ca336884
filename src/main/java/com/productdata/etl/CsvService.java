package com.productdata.etl;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Service for reading and writing product CSV files using OpenCSV.
 * <p>
 * Reading rules:
 * <ul>
 *   <li>The first non-blank line is the header. A blank header cell is named {@code Unnamed: <index>}.</li>
 *   <li>Blank lines are skipped. Short rows are padded with absent cells; rows wider than the header are rejected.</li>
 *   <li>Empty cells and the usual null markers ({@code NA}, {@code NaN}, {@code null}, ...) are read as absent.</li>
 *   <li>A column is {@link ColumnType#NUMERIC} when every present cell is a decimal number, or when it has no
 *       present cells at all; otherwise it is {@link ColumnType#TEXT}.</li>
 * </ul>
 * Fields are parsed per RFC 4180, so backslashes and surrounding whitespace are kept as data.
 * Writing quotes every field and replaces the target file.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    // Markers read as an absent cell, in addition to the empty string
    static final Set<String> ABSENT_TOKENS = Set.of(
        "NA", "N/A", "n/a", "NaN", "nan", "-NaN", "-nan", "null", "NULL", "None", "<NA>",
        "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "1.#IND", "1.#QNAN"
    );

    static final String UNNAMED_PREFIX = "Unnamed: ";

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Returns true when a raw CSV field represents an absent cell.
     */
    static boolean isAbsent(String field) {
        return field == null || field.isEmpty() || ABSENT_TOKENS.contains(field);
    }

    /**
     * Returns true when a present cell parses as a decimal number.
     */
    static boolean isNumeric(String cell) {
        return cell != null && NUMBER.matcher(cell.trim()).matches();
    }

    @Override
    public RecordSet readRecordSet(Path path) throws IOException, DataShapeException {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();
        try (CSVReader reader = new CSVReaderBuilder(Files.newBufferedReader(path, StandardCharsets.UTF_8))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            String[] line;
            while ((line = reader.readNext()) != null) {
                if (isBlankLine(line)) continue;
                if (header == null) {
                    header = headerFrom(line);
                    continue;
                }
                if (line.length > header.size()) {
                    throw new DataShapeException(String.format(
                        "Malformed CSV %s: line %d has %d fields, header has %d",
                        path, reader.getLinesRead(), line.length, header.size()));
                }
                List<String> row = new ArrayList<>(header.size());
                for (int i = 0; i < header.size(); i++) {
                    String field = i < line.length ? line[i] : null;
                    row.add(isAbsent(field) ? null : field);
                }
                rows.add(row);
            }
        } catch (CsvValidationException | CsvMalformedLineException e) {
            throw new DataShapeException("Malformed CSV " + path + ": " + e.getMessage(), e);
        }
        if (header == null) {
            throw new DataShapeException("No columns to parse from file " + path);
        }
        List<ColumnType> types = inferTypes(header.size(), rows);
        logger.debug("Read {} rows and {} columns from {}", rows.size(), header.size(), path);
        return new RecordSet(header, types, rows);
    }

    @Override
    public void writeRecordSet(RecordSet records, Path path) throws IOException {
        if (records == null) {
            logger.warn("Attempted to write null record set to CSV: {}", path);
            throw new IllegalArgumentException("Record set cannot be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
        try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8))) {
            writer.writeNext(records.columns().toArray(String[]::new));
            for (List<String> row : records.rows()) {
                writer.writeNext(row.stream().map(CsvService::safe).toArray(String[]::new));
            }
        }
        logger.debug("Wrote {} rows to CSV file: {}", records.rowCount(), path);
    }

    private static List<String> headerFrom(String[] line) {
        List<String> header = new ArrayList<>(Arrays.asList(line));
        if (!header.isEmpty() && header.get(0).startsWith("\uFEFF")) {
            header.set(0, header.get(0).substring(1));
        }
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).isEmpty()) header.set(i, UNNAMED_PREFIX + i);
        }
        return header;
    }

    private static List<ColumnType> inferTypes(int columnCount, List<List<String>> rows) {
        List<ColumnType> types = new ArrayList<>(columnCount);
        for (int col = 0; col < columnCount; col++) {
            ColumnType type = ColumnType.NUMERIC;
            for (List<String> row : rows) {
                String cell = row.get(col);
                if (cell != null && !isNumeric(cell)) {
                    type = ColumnType.TEXT;
                    break;
                }
            }
            types.add(type);
        }
        return types;
    }

    private static boolean isBlankLine(String[] line) {
        return line.length == 0 || (line.length == 1 && line[0].isEmpty());
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
