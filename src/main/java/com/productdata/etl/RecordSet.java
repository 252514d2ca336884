package com.productdata.etl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable in-memory table read from or written to a product CSV file.
 * <p>
 * Columns are ordered and may repeat (normalized names can collide). Each row holds one cell per
 * column; an absent cell is {@code null}. Cells keep the text they were read with, and each column
 * carries the {@link ColumnType} inferred when the file was read.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public record RecordSet(List<String> columns, List<ColumnType> types, List<List<String>> rows) {

    public RecordSet {
        if (columns == null || types == null || rows == null) {
            throw new IllegalArgumentException("columns, types and rows are required");
        }
        if (columns.size() != types.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " column types but got " + types.size());
        }
        List<List<String>> copied = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " cells but there are " + columns.size() + " columns");
            }
            // cells may be null, so List.copyOf is not an option
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        columns = List.copyOf(columns);
        types = List.copyOf(types);
        rows = Collections.unmodifiableList(copied);
    }

    /**
     * Returns a record set with no columns and no rows.
     */
    public static RecordSet empty() {
        return new RecordSet(List.of(), List.of(), List.of());
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns the index of the first column with the given name, or -1.
     */
    public int columnIndex(String name) {
        return columns.indexOf(name);
    }

    /**
     * Returns the cell of the first column with the given name, or null when absent.
     * @throws IllegalArgumentException if there is no such column
     */
    public String value(int row, String column) {
        int idx = columnIndex(column);
        if (idx < 0) throw new IllegalArgumentException("No column named '" + column + "'");
        return rows.get(row).get(idx);
    }

    /**
     * Returns a row as a column-name to value map. When names repeat, the first column wins.
     */
    public Map<String, String> rowAsMap(int row) {
        Map<String, String> map = new LinkedHashMap<>();
        List<String> cells = rows.get(row);
        for (int i = 0; i < columns.size(); i++) {
            map.putIfAbsent(columns.get(i), cells.get(i));
        }
        return map;
    }

    /**
     * Returns a copy of this record set with its column names replaced.
     */
    public RecordSet withColumns(List<String> newColumns) {
        return new RecordSet(newColumns, types, rows);
    }

    /**
     * Returns a copy of this record set with the given rows and the same columns.
     */
    public RecordSet withRows(List<List<String>> newRows) {
        return new RecordSet(columns, types, newRows);
    }
}
