package com.bidscope.cache;

import com.bidscope.filter.FilterSpec;
import com.bidscope.filter.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Fingerprints Tests")
class FingerprintsTest {

    @Test
    @DisplayName("Should ignore parameter insertion order")
    void shouldIgnoreParameterOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("page", 1);
        first.put("page_size", 20);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("page_size", 20);
        second.put("page", 1);

        assertThat(Fingerprints.key("search", FilterSpec.empty(), first))
            .isEqualTo(Fingerprints.key("search", FilterSpec.empty(), second));
    }

    @Test
    @DisplayName("Should ignore chip order and case")
    void shouldIgnoreChipOrder() {
        FilterSpec a = FilterSpec.builder().area("Cebu").area("Cagayan").build();
        FilterSpec b = FilterSpec.builder().area("CAGAYAN").area("cebu").build();

        assertThat(Fingerprints.key("aggregate", a, Map.of("top_n", 20)))
            .isEqualTo(Fingerprints.key("aggregate", b, Map.of("top_n", 20)));
    }

    @Test
    @DisplayName("Should change when any filter or parameter changes")
    void shouldDistinguishDifferentInputs() {
        FilterSpec base = FilterSpec.builder().timeRange(TimeRange.yearly(2022)).build();
        FilterSpec quarter = FilterSpec.builder().timeRange(TimeRange.quarterly(2022, 1)).build();
        FilterSpec extended = FilterSpec.builder().timeRange(TimeRange.yearly(2022)).includeExtended(true).build();

        String key = Fingerprints.key("aggregate", base, Map.of("top_n", 20));

        assertThat(Fingerprints.key("aggregate", quarter, Map.of("top_n", 20))).isNotEqualTo(key);
        assertThat(Fingerprints.key("aggregate", extended, Map.of("top_n", 20))).isNotEqualTo(key);
        assertThat(Fingerprints.key("aggregate", base, Map.of("top_n", 10))).isNotEqualTo(key);
        assertThat(Fingerprints.key("distribution", base, Map.of("top_n", 20))).isNotEqualTo(key);
    }

    @Test
    @DisplayName("Should prefix keys with the operation and a SHA-256 digest")
    void shouldFormatKey() {
        String key = Fingerprints.key("filter_options", Map.of("include_extended_dataset", false));

        assertThat(key).matches("bidscope:filter_options:[0-9a-f]{64}");
    }

    @Test
    @DisplayName("Should serialize nested maps with sorted keys")
    void shouldSortNestedKeys() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("z", 1);
        nested.put("a", Map.of("y", 2, "b", 3));

        assertThat(Fingerprints.canonicalJson(nested)).isEqualTo("{\"a\":{\"b\":3,\"y\":2},\"z\":1}");
    }
}
