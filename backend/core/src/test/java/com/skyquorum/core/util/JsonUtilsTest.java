package com.skyquorum.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyquorum.core.model.ForecastDay;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndLenientOnUnknownProperties() throws Exception {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

        Payload parsed = first.readValue(
                "{\"name\":\"ok\",\"createdAt\":\"2026-02-01T00:00:00Z\",\"ttl\":\"PT10M\",\"unknown\":1}",
                Payload.class
        );
        assertEquals("ok", parsed.name());
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), parsed.createdAt());
        assertEquals(Duration.ofMinutes(10), parsed.ttl());
    }

    @Test
    void writesJavaTimeAsIsoStringsAndSkipsNulls() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();

        JsonNode payload = mapper.readTree(mapper.writeValueAsString(
                new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z"), Duration.ofSeconds(30))));
        assertEquals("2026-02-01T00:00:00Z", payload.get("createdAt").asText());
        assertEquals("PT30S", payload.get("ttl").asText());
        assertFalse(payload.has("optional"));

        JsonNode day = mapper.readTree(mapper.writeValueAsString(
                new ForecastDay(LocalDate.parse("2026-02-02"), 5, 1, 3, 70, 0.4, "Overcast", "04d")));
        assertEquals("2026-02-02", day.get("date").asText());
    }

    private record Payload(String name, String optional, Instant createdAt, Duration ttl) {
    }
}
