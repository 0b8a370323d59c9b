package dk.cloudcreate.essentials.statebased.store;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class DocumentFilterTest {
    private static Map<String, Object> order() {
        var address = new LinkedHashMap<String, Object>();
        address.put("zip_code", "8000");
        var document = new LinkedHashMap<String, Object>();
        document.put("id", "order-1");
        document.put("status", "ready");
        document.put("state_version", 2);
        document.put("total", "25.50");
        document.put("address", address);
        return document;
    }

    @Test
    void verify_that_all_matches_every_document() {
        assertThat(DocumentFilter.all().isEmpty()).isTrue();
        assertThat(DocumentFilter.all().matches(order())).isTrue();
        assertThat(DocumentFilter.all().matches(Map.of())).isTrue();
    }

    @Test
    void verify_that_all_criteria_must_match() {
        var filter = DocumentFilter.where("status", "ready")
                                   .and("state_version", 2L);
        assertThat(filter.matches(order())).isTrue();
        assertThat(filter.and("id", "order-2").matches(order())).isFalse();
    }

    @Test
    void verify_that_filters_are_immutable() {
        // Given
        var filter = DocumentFilter.where("status", "ready");

        // When
        var extended = filter.and("id", "order-2");

        // Then
        assertThat(filter.criteria()).hasSize(1);
        assertThat(extended.criteria()).hasSize(2);
        assertThatThrownBy(() -> filter.criteria().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void verify_nested_field_paths() {
        assertThat(DocumentFilter.where("address.zip_code", "8000").matches(order())).isTrue();
        assertThat(DocumentFilter.where("address.city", null).matches(order())).isTrue();
        assertThat(DocumentFilter.where("status.value", null).matches(order())).isTrue();
        assertThat(DocumentFilter.resolveFieldValue(order(), "address.zip_code")).isEqualTo("8000");
    }

    @Test
    void verify_numeric_comparison() {
        assertThat(DocumentFilter.where("state_version", 2L).matches(order())).isTrue();
        assertThat(DocumentFilter.where("state_version", 2.0d).matches(order())).isTrue();
        assertThat(DocumentFilter.where("state_version", "2").matches(order())).isFalse();
        assertThat(DocumentFilter.where("total", "25.50").matches(order())).isTrue();
        assertThat(DocumentFilter.where("total", new BigDecimal("25.50")).matches(order())).isFalse();
        assertThat(DocumentFilter.where("state_version", 3).matches(order())).isFalse();
    }

    @Test
    void verify_in_and_not_in() {
        assertThat(DocumentFilter.whereIn("status", List.of("pending", "ready")).matches(order())).isTrue();
        assertThat(DocumentFilter.whereIn("status", List.of()).matches(order())).isFalse();
        assertThat(DocumentFilter.whereNotIn("status", List.of("delivered")).matches(order())).isTrue();
        assertThat(DocumentFilter.whereNotIn("status", List.of("ready")).matches(order())).isFalse();
        assertThat(DocumentFilter.whereNotIn("missing", List.of("ready")).matches(order())).isTrue();
        assertThat(DocumentFilter.whereIn("missing", Arrays.asList("x", null)).matches(order())).isTrue();
    }

    @Test
    void verify_that_mapValues_converts_every_value_except_null() {
        // Given
        var filter = DocumentFilter.where("status", "READY")
                                   .andIn("size", Arrays.asList("LARGE", null));

        // When
        var mapped = filter.mapValues(value -> value.toString().toLowerCase());

        // Then
        assertThat(mapped.criteria().get(0).value()).isEqualTo("ready");
        assertThat(mapped.criteria().get(1).values).containsExactly("large", null);
        assertThat(filter.criteria().get(0).value()).isEqualTo("READY");
    }

    @Test
    void verify_that_a_blank_field_path_is_rejected() {
        assertThatThrownBy(() -> DocumentFilter.where(" ", "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
