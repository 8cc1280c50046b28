package com.voxpop.backend.services.audience;

import com.voxpop.backend.enums.ContactSource;
import com.voxpop.backend.enums.Gender;
import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.exceptions.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed form of a filter mapping.
 *
 * Keeps the raw mapping untouched for storage (unknown keys included) next to the typed clauses of the
 * recognised keys. A key whose value is empty (blank string, empty list, null) is present but inert:
 * {@link #activeClauses()} leaves it out. Zero is a real value.
 */
@Slf4j
public final class FilterSpecification {

    private final Map<String, Object> raw;
    private final Map<FilterKey, FilterValue> clauses;
    private final List<String> ignoredKeys;

    private FilterSpecification(Map<String, Object> raw, Map<FilterKey, FilterValue> clauses, List<String> ignoredKeys) {
        this.raw = Collections.unmodifiableMap(raw);
        this.clauses = Collections.unmodifiableMap(clauses);
        this.ignoredKeys = Collections.unmodifiableList(ignoredKeys);
    }

    public static FilterSpecification empty() {
        return new FilterSpecification(new LinkedHashMap<>(), new LinkedHashMap<>(), new ArrayList<>());
    }

    /**
     * @throws ValidationException when a recognised key carries a value of the wrong shape, an unknown
     *                             status/gender/source, a negative age, or age_min above age_max
     */
    public static FilterSpecification fromMap(Map<String, ?> filters) {
        Map<String, Object> raw = new LinkedHashMap<>();
        Map<FilterKey, FilterValue> clauses = new LinkedHashMap<>();
        List<String> ignored = new ArrayList<>();

        if (filters != null) {
            for (Map.Entry<String, ?> entry : filters.entrySet()) {
                raw.put(entry.getKey(), entry.getValue());
                Optional<FilterKey> key = FilterKey.fromWireName(entry.getKey());
                if (key.isEmpty()) {
                    log.debug("Ignoring unknown filter key '{}'", entry.getKey());
                    ignored.add(entry.getKey());
                    continue;
                }
                clauses.put(key.get(), parse(key.get(), entry.getValue()));
            }
        }

        validateAgeRange(clauses);
        return new FilterSpecification(raw, clauses, ignored);
    }

    public Map<String, Object> raw() {
        return raw;
    }

    public Map<FilterKey, FilterValue> clauses() {
        return clauses;
    }

    public Map<FilterKey, FilterValue> activeClauses() {
        Map<FilterKey, FilterValue> active = new LinkedHashMap<>();
        clauses.forEach((key, value) -> {
            if (!value.isEmpty()) {
                active.put(key, value);
            }
        });
        return active;
    }

    public boolean hasActiveClauses() {
        return clauses.values().stream().anyMatch(v -> !v.isEmpty());
    }

    public List<String> ignoredKeys() {
        return ignoredKeys;
    }

    public boolean references(FilterKey key) {
        return clauses.containsKey(key);
    }

    // ===== Parsing =====

    private static FilterValue parse(FilterKey key, Object value) {
        switch (key.getKind()) {
            case TEXT:
                return parseText(key, value);
            case NUMBER:
                return new FilterValue.Numeric(parseInteger(key, value));
            case ID_LIST:
                return new FilterValue.IdList(parseIds(key, value));
            case FLAG:
                return new FilterValue.Flag(parseFlag(key, value));
            default:
                throw new IllegalStateException("Unhandled filter kind " + key.getKind());
        }
    }

    private static FilterValue.Text parseText(FilterKey key, Object value) {
        if (value == null) {
            return new FilterValue.Text(null);
        }
        if (!(value instanceof String) && !(value instanceof Number)) {
            throw new ValidationException(key.getWireName(), key.getWireName() + " must be a string");
        }
        String text = value.toString().trim();
        if (!text.isEmpty()) {
            checkEnumerated(key, text);
        }
        return new FilterValue.Text(text);
    }

    private static void checkEnumerated(FilterKey key, String text) {
        try {
            switch (key) {
                case CONTACT_STATUS:
                    LifecycleStatus.fromValue(text);
                    break;
                case GENDER:
                    Gender.fromValue(text);
                    break;
                case SOURCE:
                    ContactSource.fromValue(text);
                    break;
                default:
                    break;
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException(key.getWireName(), e.getMessage());
        }
    }

    private static Integer parseInteger(FilterKey key, Object value) {
        if (value == null || (value instanceof String s && s.trim().isEmpty())) {
            return null;
        }
        Integer parsed;
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            try {
                parsed = Math.toIntExact(((Number) value).longValue());
            } catch (ArithmeticException e) {
                throw new ValidationException(key.getWireName(), key.getWireName() + " is out of range");
            }
        } else if (value instanceof Number n) {
            BigDecimal decimal = new BigDecimal(n.toString());
            if (decimal.stripTrailingZeros().scale() > 0) {
                throw new ValidationException(key.getWireName(), key.getWireName() + " must be a whole number");
            }
            try {
                parsed = decimal.intValueExact();
            } catch (ArithmeticException e) {
                throw new ValidationException(key.getWireName(), key.getWireName() + " is out of range");
            }
        } else if (value instanceof String s) {
            try {
                parsed = Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(key.getWireName(), key.getWireName() + " must be a whole number");
            }
        } else {
            throw new ValidationException(key.getWireName(), key.getWireName() + " must be a whole number");
        }
        if (parsed < 0) {
            throw new ValidationException(key.getWireName(), key.getWireName() + " cannot be negative");
        }
        return parsed;
    }

    private static List<Long> parseIds(FilterKey key, Object value) {
        List<Long> ids = new ArrayList<>();
        if (value == null) {
            return ids;
        }
        Collection<?> items;
        if (value instanceof Collection<?> collection) {
            items = collection;
        } else if (value instanceof Number) {
            items = List.of(value);
        } else if (value instanceof String s) {
            items = s.trim().isEmpty() ? List.of() : List.of(s.split(","));
        } else {
            throw new ValidationException(key.getWireName(), key.getWireName() + " must be a list of tag ids");
        }

        for (Object item : items) {
            if (item instanceof Number n) {
                ids.add(n.longValue());
            } else if (item instanceof String s && !s.trim().isEmpty()) {
                try {
                    ids.add(Long.parseLong(s.trim()));
                } catch (NumberFormatException e) {
                    throw new ValidationException(key.getWireName(), key.getWireName() + " must be a list of tag ids");
                }
            } else if (item != null && !(item instanceof String)) {
                throw new ValidationException(key.getWireName(), key.getWireName() + " must be a list of tag ids");
            }
        }
        return ids;
    }

    private static Boolean parseFlag(FilterKey key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String normalized = s.trim().toLowerCase();
            if (normalized.isEmpty()) {
                return null;
            }
            if (normalized.equals("true") || normalized.equals("1")) {
                return true;
            }
            if (normalized.equals("false") || normalized.equals("0")) {
                return false;
            }
        }
        throw new ValidationException(key.getWireName(), key.getWireName() + " must be true or false");
    }

    private static void validateAgeRange(Map<FilterKey, FilterValue> clauses) {
        FilterValue min = clauses.get(FilterKey.AGE_MIN);
        FilterValue max = clauses.get(FilterKey.AGE_MAX);
        if (min instanceof FilterValue.Numeric lower && max instanceof FilterValue.Numeric upper
                && lower.value() != null && upper.value() != null && lower.value() > upper.value()) {
            throw new ValidationException(FilterKey.AGE_MIN.getWireName(), "age_min cannot be greater than age_max");
        }
    }
}
