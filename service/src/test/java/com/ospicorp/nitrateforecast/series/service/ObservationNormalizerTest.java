package com.ospicorp.nitrateforecast.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.ospicorp.nitrateforecast.series.model.RawObservation;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ObservationNormalizerTest {
  private static final Instant T = Instant.parse("2024-05-01T10:00:00Z");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Test
  void numbersAndNumericTextBecomeValues() {
    assertEquals(4.2, ObservationNormalizer.normalize(T, JsonNodeFactory.instance.numberNode(4.2))
        .value());
    assertEquals(7.5, ObservationNormalizer.normalize(T, JsonNodeFactory.instance.textNode(" 7.5 "))
        .value());
    assertEquals(1d, ObservationNormalizer.normalize(T, JsonNodeFactory.instance.booleanNode(true))
        .value());
  }

  @Test
  void badSystemStatesAreMissingWithTheirLabel() throws Exception {
    JsonNode timeout = MAPPER.readTree("{\"Name\": \"I/O Timeout\", \"Value\": 246}");

    RawObservation obs = ObservationNormalizer.normalize(T, timeout);

    assertNull(obs.value());
    assertEquals("I/O Timeout", obs.state());
    assertFalse(obs.hasValue());
  }

  @Test
  void digitalStatesKeepTheirNumericValue() throws Exception {
    RawObservation on = ObservationNormalizer.normalize(T,
        MAPPER.readTree("{\"Name\": \"On\", \"Value\": 1}"));
    RawObservation text = ObservationNormalizer.normalize(T,
        MAPPER.readTree("{\"Name\": \"Level\", \"Value\": \"3.5\"}"));

    assertEquals(1d, on.value());
    assertEquals("On", on.state());
    assertEquals(3.5, text.value());
  }

  @Test
  void freeTextAndNullsAreMissing() {
    RawObservation label = ObservationNormalizer.fromText(T, "Calibrating");
    assertNull(label.value());
    assertEquals("Calibrating", label.state());

    assertNull(ObservationNormalizer.normalize(T, null).value());
    assertNull(ObservationNormalizer.normalize(T, JsonNodeFactory.instance.nullNode()).state());
    assertNull(ObservationNormalizer.fromText(T, "NaN").value());
    assertNull(ObservationNormalizer.fromText(T, "  ").state());
  }

  @Test
  void timestampsMustCarryAnOffset() {
    assertEquals(Instant.parse("2024-05-01T08:00:00Z"),
        ObservationNormalizer.parseTimestamp("2024-05-01T10:00:00+02:00"));
    assertThrows(IllegalArgumentException.class,
        () -> ObservationNormalizer.parseTimestamp("2024-05-01T10:00:00"));
    assertThrows(IllegalArgumentException.class, () -> ObservationNormalizer.parseTimestamp(""));
  }
}
