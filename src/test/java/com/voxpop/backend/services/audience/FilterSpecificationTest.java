package com.voxpop.backend.services.audience;

import com.voxpop.backend.exceptions.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FilterSpecificationTest {

    @Test
    void testFromMap_ParsesEachKind() {
        // Given
        Map<String, Object> filters = Map.of(
                "city", " Campinas ",
                "tags", List.of(3, 4),
                "age_min", "18",
                "whatsapp_opt_in", true);

        // When
        FilterSpecification spec = FilterSpecification.fromMap(filters);

        // Then
        assertEquals(new FilterValue.Text("Campinas"), spec.clauses().get(FilterKey.CITY));
        assertEquals(new FilterValue.IdList(List.of(3L, 4L)), spec.clauses().get(FilterKey.TAGS_ANY));
        assertEquals(new FilterValue.Numeric(18), spec.clauses().get(FilterKey.AGE_MIN));
        assertEquals(new FilterValue.Flag(true), spec.clauses().get(FilterKey.WHATSAPP_OPT_IN));
        assertTrue(spec.hasActiveClauses());
    }

    @Test
    void testFromMap_AliasesAndSpellingVariants() {
        FilterSpecification spec = FilterSpecification.fromMap(Map.of(
                "status", "apoiador",
                "tags-any", "1,2",
                "TAGS_ALL", "5"));

        assertTrue(spec.references(FilterKey.CONTACT_STATUS));
        assertEquals(new FilterValue.IdList(List.of(1L, 2L)), spec.clauses().get(FilterKey.TAGS_ANY));
        assertEquals(new FilterValue.IdList(List.of(5L)), spec.clauses().get(FilterKey.TAGS_ALL));
    }

    @Test
    void testFromMap_UnknownKeysKeptInRawButIgnored() {
        // Given
        Map<String, Object> filters = new HashMap<>();
        filters.put("city", "Santos");
        filters.put("favourite_color", "blue");

        // When
        FilterSpecification spec = FilterSpecification.fromMap(filters);

        // Then
        assertThat(spec.raw()).containsEntry("favourite_color", "blue");
        assertThat(spec.ignoredKeys()).containsExactly("favourite_color");
        assertThat(spec.activeClauses()).containsOnlyKeys(FilterKey.CITY);
    }

    @Test
    void testFromMap_EmptyValuesAreInert() {
        Map<String, Object> filters = new HashMap<>();
        filters.put("city", "  ");
        filters.put("tags", List.of());
        filters.put("age_max", null);
        filters.put("whatsapp_opt_in", "");

        FilterSpecification spec = FilterSpecification.fromMap(filters);

        assertEquals(4, spec.clauses().size());
        assertTrue(spec.activeClauses().isEmpty());
        assertFalse(spec.hasActiveClauses());
    }

    @Test
    void testFromMap_ZeroIsARealValue() {
        FilterSpecification spec = FilterSpecification.fromMap(Map.of("age_min", 0));

        assertThat(spec.activeClauses()).containsEntry(FilterKey.AGE_MIN, new FilterValue.Numeric(0));
    }

    @Test
    void testFromMap_NullAndEmptyMaps() {
        assertFalse(FilterSpecification.fromMap(null).hasActiveClauses());
        assertTrue(FilterSpecification.fromMap(Map.of()).clauses().isEmpty());
        assertTrue(FilterSpecification.empty().raw().isEmpty());
    }

    @Test
    void testFromMap_UnknownStatusRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> FilterSpecification.fromMap(Map.of("contact_status", "vip")));

        assertEquals("contact_status", ex.getField());
    }

    @Test
    void testFromMap_UnknownGenderRejected() {
        assertThrows(ValidationException.class, () -> FilterSpecification.fromMap(Map.of("gender", "x")));
    }

    @Test
    void testFromMap_BadAgesRejected() {
        assertThrows(ValidationException.class, () -> FilterSpecification.fromMap(Map.of("age_min", "abc")));
        assertThrows(ValidationException.class, () -> FilterSpecification.fromMap(Map.of("age_min", -1)));
        assertThrows(ValidationException.class, () -> FilterSpecification.fromMap(Map.of("age_max", 30.5)));
    }

    @Test
    void testFromMap_AgeOutsideIntRangeRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> FilterSpecification.fromMap(Map.of("age_max", 4294967306L)));
        assertEquals("age_max", ex.getField());

        assertThrows(ValidationException.class,
                () -> FilterSpecification.fromMap(Map.of("age_min", new BigDecimal("4294967306"))));
    }

    @Test
    void testFromMap_LongWithinRangeAccepted() {
        FilterSpecification spec = FilterSpecification.fromMap(Map.of("age_max", 65L));

        assertThat(spec.activeClauses()).containsEntry(FilterKey.AGE_MAX, new FilterValue.Numeric(65));
    }

    @Test
    void testFromMap_AgeMinAboveAgeMaxRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> FilterSpecification.fromMap(Map.of("age_min", 60, "age_max", 18)));

        assertEquals("age_min", ex.getField());
    }

    @Test
    void testFromMap_BadTagListRejected() {
        assertThrows(ValidationException.class, () -> FilterSpecification.fromMap(Map.of("tags", "a,b")));
        assertThrows(ValidationException.class, () -> FilterSpecification.fromMap(Map.of("tags", Map.of("id", 1))));
    }

    @Test
    void testFromMap_BadFlagRejected() {
        assertThrows(ValidationException.class,
                () -> FilterSpecification.fromMap(Map.of("whatsapp_opt_in", "maybe")));
    }
}
