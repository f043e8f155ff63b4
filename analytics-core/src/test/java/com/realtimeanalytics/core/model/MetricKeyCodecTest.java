package com.realtimeanalytics.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricKeyCodec} and {@link MetricKey}.
 */
class MetricKeyCodecTest {

    @Test
    @DisplayName("Should sort tags by key regardless of insertion order")
    void shouldSortTags() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("z", "1");
        first.put("a", "2");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("a", "2");
        second.put("z", "1");

        assertThat(MetricKeyCodec.canonicalKey("m", first)).isEqualTo("m:a:2,z:1");
        assertThat(MetricKeyCodec.canonicalKey("m", second)).isEqualTo("m:a:2,z:1");
        assertThat(MetricKey.of("m", first)).isEqualTo(MetricKey.of("m", second));
    }

    @Test
    @DisplayName("Should end an untagged key with a bare separator")
    void shouldFormatUntaggedKey() {
        assertThat(MetricKeyCodec.canonicalKey("cpu.usage", Map.of())).isEqualTo("cpu.usage:");
        assertThat(MetricKeyCodec.canonicalKey("cpu.usage", null)).isEqualTo("cpu.usage:");
        assertThat(MetricKey.of("cpu.usage").asString()).isEqualTo("cpu.usage:");
    }

    @Test
    @DisplayName("Should parse a serialized tag string back into the same map")
    void shouldParseTags() {
        Map<String, String> tags = Map.of("host", "web-1", "region", "eu-west");

        String serialized = MetricKeyCodec.serializeTags(tags);

        assertThat(serialized).isEqualTo("host:web-1,region:eu-west");
        assertThat(MetricKeyCodec.parseTags(serialized)).isEqualTo(tags);
    }

    @Test
    @DisplayName("Should escape separators inside tag keys and values")
    void shouldEscapeSeparators() {
        Map<String, String> tags = Map.of("url", "http://x:8080/a,b", "back\\slash", "v");

        String serialized = MetricKeyCodec.serializeTags(tags);

        assertThat(serialized).isEqualTo("back\\\\slash:v,url:http\\://x\\:8080/a\\,b");
        assertThat(MetricKeyCodec.parseTags(serialized)).isEqualTo(tags);
    }

    @Test
    @DisplayName("Should split a canonical key with an escaped name")
    void shouldParseKey() {
        MetricKey key = MetricKey.of("requests:total", Map.of("env", "prod"));

        MetricKey parsed = MetricKeyCodec.parseKey(key.asString());

        assertThat(parsed).isEqualTo(key);
        assertThat(parsed.getName()).isEqualTo("requests:total");
        assertThat(parsed.getTags()).containsEntry("env", "prod");
    }

    @Test
    @DisplayName("Should treat empty tag strings as no tags")
    void shouldParseEmptyTags() {
        assertThat(MetricKeyCodec.parseTags("")).isEmpty();
        assertThat(MetricKeyCodec.parseTags(null)).isEmpty();
        assertThat(MetricKeyCodec.parseKey("cpu:").getTags()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a tag pair without a separator")
    void shouldRejectMalformedPair() {
        assertThatThrownBy(() -> MetricKeyCodec.parseTags("host:a,broken"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed tag pair");
    }

    @Test
    @DisplayName("Should reject blank names and null tag values")
    void shouldRejectInvalidInput() {
        Map<String, String> nullValue = new LinkedHashMap<>();
        nullValue.put("host", null);

        assertThatThrownBy(() -> MetricKey.of(" ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MetricKey.of(null, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MetricKey.of("m", nullValue))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should match keys whose tags contain the filter")
    void shouldMatchTagSubset() {
        MetricKey key = MetricKey.of("latency", Map.of("host", "a", "region", "eu"));

        assertThat(key.hasTags(Map.of("host", "a"))).isTrue();
        assertThat(key.hasTags(Map.of())).isTrue();
        assertThat(key.hasTags(null)).isTrue();
        assertThat(key.hasTags(Map.of("host", "b"))).isFalse();
        assertThat(key.hasTags(Map.of("zone", "1"))).isFalse();
    }

    @Test
    @DisplayName("Should reject a tag filter with a null key or value")
    void shouldRejectNullTagFilterEntries() {
        MetricKey key = MetricKey.of("latency", Map.of("host", "a"));
        Map<String, String> nullKey = new HashMap<>();
        nullKey.put(null, "a");
        Map<String, String> nullValue = new HashMap<>();
        nullValue.put("host", null);

        assertThatThrownBy(() -> key.hasTags(nullKey))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> key.hasTags(nullValue))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
