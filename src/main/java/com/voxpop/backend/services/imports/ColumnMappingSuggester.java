package com.voxpop.backend.services.imports;

import com.voxpop.backend.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Best-effort header matching for the mapping screen. A header matches a field when, after folding
 * case and accents and dropping punctuation, either contains the other (against the field label or
 * its canonical name). Each field is suggested for at most one header; first header wins.
 */
@Component
public class ColumnMappingSuggester {

    public Map<String, String> suggest(List<String> headers) {
        Map<String, String> mapping = new LinkedHashMap<>();
        Set<ImportField> used = EnumSet.noneOf(ImportField.class);

        for (String header : headers) {
            String folded = compact(header);
            if (folded.isEmpty()) {
                continue;
            }
            for (ImportField field : ImportField.values()) {
                if (used.contains(field)) {
                    continue;
                }
                if (matches(folded, compact(field.getLabel())) || matches(folded, compact(field.getValue()))) {
                    mapping.put(header, field.getValue());
                    used.add(field);
                    break;
                }
            }
        }
        return mapping;
    }

    private static boolean matches(String header, String candidate) {
        return header.contains(candidate) || candidate.contains(header);
    }

    private static String compact(String text) {
        return TextNormalizer.fold(text).replaceAll("[^a-z0-9]", "");
    }
}
