package com.ospicorp.nitrateforecast.series.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.nitrateforecast.series.model.RawObservation;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Turns historian readings into numeric observations. Values arrive as numbers, numeric text,
 * free text, or {@code {"Name": ..., "Value": ...}} digital-state objects; system states such as
 * "I/O Timeout" carry no measurement and become missing values with the label kept.
 */
public final class ObservationNormalizer {
  public static final Set<String> BAD_STATE_NAMES = Set.of(
      "No Data", "Bad Input", "Configure", "Pt Created", "Shutdown", "I/O Timeout");

  private ObservationNormalizer() {
  }

  public static RawObservation normalize(Instant timestamp, JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return new RawObservation(timestamp, null, null);
    }
    if (value.isNumber()) {
      return new RawObservation(timestamp, finiteOrNull(value.doubleValue()), null);
    }
    if (value.isBoolean()) {
      return new RawObservation(timestamp, value.booleanValue() ? 1d : 0d, null);
    }
    if (value.isTextual()) {
      return fromText(timestamp, value.textValue());
    }
    if (value.isObject()) {
      JsonNode nameNode = value.get("Name");
      String name = nameNode != null && nameNode.isTextual() ? nameNode.textValue() : null;
      if (name != null && BAD_STATE_NAMES.contains(name)) {
        return new RawObservation(timestamp, null, name);
      }
      JsonNode inner = value.get("Value");
      if (inner != null && inner.isNumber()) {
        return new RawObservation(timestamp, finiteOrNull(inner.doubleValue()), name);
      }
      if (inner != null && inner.isTextual()) {
        Double parsed = parseNumber(inner.textValue());
        if (parsed != null) {
          return new RawObservation(timestamp, parsed, name);
        }
      }
      return new RawObservation(timestamp, null, name);
    }
    return new RawObservation(timestamp, null, value.toString());
  }

  public static RawObservation fromText(Instant timestamp, String text) {
    if (text == null || text.isBlank()) {
      return new RawObservation(timestamp, null, null);
    }
    Double parsed = parseNumber(text);
    return parsed != null
        ? new RawObservation(timestamp, parsed, null)
        : new RawObservation(timestamp, null, text.trim());
  }

  /** Timestamps must state their offset; local wall-clock times are ambiguous across DST. */
  public static Instant parseTimestamp(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("timestamp must be provided");
    }
    try {
      return OffsetDateTime.parse(text.trim()).toInstant();
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(
          "timestamp must be ISO-8601 with an explicit UTC offset: " + text, ex);
    }
  }

  static Double parseNumber(String text) {
    try {
      return finiteOrNull(Double.parseDouble(text.trim()));
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static Double finiteOrNull(double v) {
    return Double.isFinite(v) ? v : null;
  }
}
