package dev.henneberger.vertx.realtime.core;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Decodes trigger-produced notify payloads.
 *
 * <pre>
 * {"type":"UPDATE","schema":"public","table":"orders","seq":42,
 *  "record":{...},"old_record":{...},"commit_timestamp":"2024-01-15T10:30:00Z"}
 * </pre>
 */
public final class ChangeEventParser {

  static final String DEFAULT_SCHEMA = "public";

  private ChangeEventParser() {
  }

  public static ChangeEvent parse(String payload) {
    return parse(payload, Instant.now());
  }

  public static ChangeEvent parse(String payload, Instant ingestedAt) {
    if (payload == null || payload.isBlank()) {
      throw new MalformedChangeEventException("failed to parse change event: empty payload", payload);
    }

    JsonObject json;
    try {
      json = new JsonObject(payload);
    } catch (DecodeException e) {
      throw new MalformedChangeEventException("failed to parse change event: " + e.getMessage(), payload, e);
    }

    ChangeEvent.Operation operation = mapOperation(json.getValue("type"));
    if (operation == null) {
      throw new MalformedChangeEventException(
        "failed to parse change event: unsupported type '" + json.getValue("type") + "'", payload);
    }

    String table = stringOrNull(json.getValue("table"));
    if (table == null || table.isBlank()) {
      throw new MalformedChangeEventException("failed to parse change event: missing table", payload);
    }
    String schema = stringOrNull(json.getValue("schema"));
    if (schema == null || schema.isBlank()) {
      schema = DEFAULT_SCHEMA;
    }

    Map<String, Object> record = rowImage(json, "record", payload);
    Map<String, Object> oldRecord = rowImage(json, "old_record", payload);
    if (operation != ChangeEvent.Operation.DELETE && record == null) {
      throw new MalformedChangeEventException("failed to parse change event: missing record", payload);
    }
    if (operation == ChangeEvent.Operation.DELETE && oldRecord == null) {
      throw new MalformedChangeEventException("failed to parse change event: missing old_record", payload);
    }

    long sequence = parseSequence(json.getValue("seq"), payload);
    String dedupKey = sequence != ChangeEvent.NO_SEQUENCE ? Long.toString(sequence) : "sha256:" + digest(payload);

    return new ChangeEvent(
      schema,
      table,
      operation,
      record,
      oldRecord,
      sequence,
      dedupKey,
      parseTimestamp(stringOrNull(json.getValue("commit_timestamp"))),
      ingestedAt);
  }

  private static Map<String, Object> rowImage(JsonObject json, String field, String payload) {
    Object raw = json.getValue(field);
    if (raw == null) {
      return null;
    }
    if (!(raw instanceof JsonObject)) {
      throw new MalformedChangeEventException(
        "failed to parse change event: '" + field + "' is not an object", payload);
    }
    return ((JsonObject) raw).getMap();
  }

  private static ChangeEvent.Operation mapOperation(Object type) {
    if (!(type instanceof String)) {
      return null;
    }
    switch (((String) type).toUpperCase(Locale.ROOT)) {
      case "INSERT":
        return ChangeEvent.Operation.INSERT;
      case "UPDATE":
        return ChangeEvent.Operation.UPDATE;
      case "DELETE":
        return ChangeEvent.Operation.DELETE;
      default:
        return null;
    }
  }

  private static long parseSequence(Object raw, String payload) {
    if (raw == null) {
      return ChangeEvent.NO_SEQUENCE;
    }
    if (raw instanceof Number) {
      return ((Number) raw).longValue();
    }
    if (raw instanceof String) {
      try {
        return Long.parseLong((String) raw);
      } catch (NumberFormatException e) {
        throw new MalformedChangeEventException("failed to parse change event: invalid seq", payload, e);
      }
    }
    throw new MalformedChangeEventException("failed to parse change event: invalid seq", payload);
  }

  private static Instant parseTimestamp(String ts) {
    if (ts == null || ts.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(ts);
    } catch (DateTimeParseException ignored) {
      return null;
    }
  }

  private static String stringOrNull(Object value) {
    return value == null ? null : String.valueOf(value);
  }

  static String digest(String text) {
    try {
      MessageDigest sha = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(sha.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
