package com.example.demo.sheets.core;

import com.example.demo.sheets.exception.EmptyTableException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects a row sequence onto records keyed by the first row.
 * <p>
 * Every later row is zipped positionally with the header and truncated to the shorter of the two.
 * Header names are not required to be unique; a repeated name keeps the value of its last column.
 */
public final class TableProjector {

    private TableProjector() {
    }

    /**
     * Pulls the header immediately; records are produced as the returned iterator is consumed.
     *
     * @throws EmptyTableException if {@code rows} yields nothing
     */
    public static Iterator<Map<String, String>> toRecords(Iterator<List<String>> rows, String tableName) {
        if (!rows.hasNext()) {
            throw new EmptyTableException(tableName);
        }
        List<String> header = rows.next();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return rows.hasNext();
            }

            @Override
            public Map<String, String> next() {
                return zip(header, rows.next());
            }
        };
    }

    public static List<Map<String, String>> toRecords(List<List<String>> rows, String tableName) {
        List<Map<String, String>> records = new ArrayList<>(Math.max(0, rows.size() - 1));
        toRecords(rows.iterator(), tableName).forEachRemaining(records::add);
        return Collections.unmodifiableList(records);
    }

    static Map<String, String> zip(List<String> header, List<String> row) {
        int n = Math.min(header.size(), row.size());
        Map<String, String> record = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            record.put(header.get(i), row.get(i));
        }
        return record;
    }
}
