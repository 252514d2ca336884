package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cleaning rules applied by the transform stage.
 * <p>
 * {@link #apply(RecordSet)} runs the steps in a fixed order:
 * <ol>
 *   <li>drop fully duplicate rows, keeping the first occurrence;</li>
 *   <li>fill absent numeric cells with {@value #NUMERIC_FILL};</li>
 *   <li>fill absent text cells with {@value #TEXT_FILL};</li>
 *   <li>normalize column names (trim, lowercase, spaces to underscores).</li>
 * </ol>
 * The last three steps are also available as {@link #fillAndNormalize(RecordSet)} for callers that
 * deduplicate first and need the dropped count.
 * Duplicate detection compares typed values ({@code 9.5} equals {@code 9.50}) and treats an absent
 * cell as equal to its fill value, so no two rows are identical once the fills are applied and a
 * second pass over cleaned output changes nothing. Present cells keep their original text. Numbers
 * beyond the range of a double compare as signed infinity.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public final class CleaningPolicy {
    private static final Logger logger = LoggerFactory.getLogger(CleaningPolicy.class);

    public static final String NUMERIC_FILL = "0";
    public static final String TEXT_FILL = "Unknown";

    private CleaningPolicy() {}

    /**
     * Applies all four cleaning steps in order.
     */
    public static RecordSet apply(RecordSet records) {
        return fillAndNormalize(dropDuplicates(records));
    }

    /**
     * Applies the fill and rename steps to records that are already deduplicated.
     */
    public static RecordSet fillAndNormalize(RecordSet deduped) {
        RecordSet numericFilled = fillMissingNumeric(deduped);
        RecordSet textFilled = fillMissingText(numericFilled);
        return normalizeColumnNames(textFilled);
    }

    /**
     * Removes rows that repeat an earlier row in every cell.
     */
    public static RecordSet dropDuplicates(RecordSet records) {
        Set<List<Object>> seen = new HashSet<>();
        List<List<String>> kept = new ArrayList<>(records.rowCount());
        for (List<String> row : records.rows()) {
            if (seen.add(comparisonKey(records.types(), row))) {
                kept.add(row);
            }
        }
        return records.withRows(kept);
    }

    public static RecordSet fillMissingNumeric(RecordSet records) {
        return fill(records, ColumnType.NUMERIC, NUMERIC_FILL);
    }

    public static RecordSet fillMissingText(RecordSet records) {
        return fill(records, ColumnType.TEXT, TEXT_FILL);
    }

    /**
     * Normalizes every column name. Names that collide after normalization are kept as-is and logged.
     * A name that normalizes to nothing becomes {@code unnamed:_<index>}, the normalized form of the name
     * the reader gives a blank header cell, so cleaned output reads back under the same names.
     */
    public static RecordSet normalizeColumnNames(RecordSet records) {
        List<String> normalized = new ArrayList<>(records.columnCount());
        Set<String> collisions = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();
        List<String> columns = records.columns();
        for (int i = 0; i < columns.size(); i++) {
            String name = normalizeColumnName(columns.get(i));
            if (name.isEmpty()) name = normalizeColumnName(CsvService.UNNAMED_PREFIX + i);
            if (!seen.add(name)) collisions.add(name);
            normalized.add(name);
        }
        if (!collisions.isEmpty()) {
            logger.warn("Column names collide after normalization: {}", collisions);
        }
        return records.withColumns(normalized);
    }

    /**
     * Trims, lowercases and replaces spaces with underscores. Idempotent.
     */
    public static String normalizeColumnName(String name) {
        return name.strip().toLowerCase(Locale.ROOT).replace(" ", "_");
    }

    private static RecordSet fill(RecordSet records, ColumnType type, String value) {
        List<ColumnType> types = records.types();
        List<List<String>> filled = new ArrayList<>(records.rowCount());
        for (List<String> row : records.rows()) {
            List<String> copy = new ArrayList<>(row);
            for (int i = 0; i < copy.size(); i++) {
                if (copy.get(i) == null && types.get(i) == type) copy.set(i, value);
            }
            filled.add(copy);
        }
        return records.withRows(filled);
    }

    private static List<Object> comparisonKey(List<ColumnType> types, List<String> row) {
        List<Object> key = new ArrayList<>(row.size());
        for (int i = 0; i < row.size(); i++) {
            String cell = row.get(i);
            if (types.get(i) == ColumnType.NUMERIC) {
                key.add(canonicalNumber(cell == null ? NUMERIC_FILL : cell));
            } else {
                key.add(cell == null ? TEXT_FILL : cell);
            }
        }
        return key;
    }

    /**
     * Value-based key for a numeric cell. Magnitudes a double cannot hold collapse to signed infinity,
     * and exponents too small for a double collapse to zero.
     */
    static Object canonicalNumber(String cell) {
        String text = cell.trim();
        double approx = Double.parseDouble(text);
        if (Double.isInfinite(approx)) return approx;
        if (approx == 0.0d) return BigDecimal.ZERO;
        // finite double implies the exponent fits a BigDecimal scale
        return new BigDecimal(text).stripTrailingZeros();
    }
}
