package com.voxpop.backend.services.imports;

import java.util.List;
import java.util.Map;

/**
 * Header row plus data rows keyed by header. Blank rows are already dropped; cells are trimmed and
 * empty cells are absent from the row map.
 */
public record ParsedSheet(List<String> headers, List<SheetRow> rows) {

    /**
     * @param number 1-based row (CSV line, worksheet row) the record starts on in the source file
     */
    public record SheetRow(int number, Map<String, String> values) {
    }

    public int size() {
        return rows.size();
    }
}
