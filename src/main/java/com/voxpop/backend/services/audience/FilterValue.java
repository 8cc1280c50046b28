package com.voxpop.backend.services.audience;

import java.util.List;

/**
 * Typed value of one filter clause. An empty value keeps its key present but constrains nothing.
 */
public interface FilterValue {

    boolean isEmpty();

    record Text(String value) implements FilterValue {
        @Override
        public boolean isEmpty() {
            return value == null || value.trim().isEmpty();
        }
    }

    record Numeric(Integer value) implements FilterValue {
        @Override
        public boolean isEmpty() {
            return value == null;
        }
    }

    record IdList(List<Long> ids) implements FilterValue {
        public IdList {
            ids = ids == null ? List.of() : List.copyOf(ids);
        }

        @Override
        public boolean isEmpty() {
            return ids.isEmpty();
        }
    }

    record Flag(Boolean value) implements FilterValue {
        @Override
        public boolean isEmpty() {
            return value == null;
        }
    }
}
