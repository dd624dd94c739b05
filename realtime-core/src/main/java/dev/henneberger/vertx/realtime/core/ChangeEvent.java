package dev.henneberger.vertx.realtime.core;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A row-level mutation decoded from a database notification.
 *
 * <p>Instances are immutable. Row images are defensive copies and are exposed read-only.
 */
public final class ChangeEvent {

  /**
   * The row operation type.
   */
  public enum Operation {
    INSERT,
    UPDATE,
    DELETE;

    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * Sentinel for payloads that did not carry a commit sequence.
   */
  public static final long NO_SEQUENCE = -1L;

  private final String schema;
  private final String table;
  private final Operation operation;
  private final Map<String, Object> newRow;
  private final Map<String, Object> oldRow;
  private final long sequence;
  private final String dedupKey;
  private final Instant commitTimestamp;
  private final Instant ingestedAt;

  public ChangeEvent(String schema,
                     String table,
                     Operation operation,
                     Map<String, Object> newRow,
                     Map<String, Object> oldRow,
                     long sequence,
                     String dedupKey,
                     Instant commitTimestamp,
                     Instant ingestedAt) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.table = Objects.requireNonNull(table, "table");
    this.operation = Objects.requireNonNull(operation, "operation");
    this.newRow = unmodifiableCopy(newRow);
    this.oldRow = operation == Operation.INSERT ? Collections.emptyMap() : unmodifiableCopy(oldRow);
    this.sequence = sequence;
    this.dedupKey = dedupKey != null ? dedupKey : Long.toString(sequence);
    this.commitTimestamp = commitTimestamp;
    this.ingestedAt = ingestedAt == null ? Instant.now() : ingestedAt;
  }

  public String getSchema() {
    return schema;
  }

  public String getTable() {
    return table;
  }

  /**
   * @return {@code schema.table}, the registry and routing key for this event
   */
  public String qualifiedTable() {
    return schema + "." + table;
  }

  public Operation getOperation() {
    return operation;
  }

  public Map<String, Object> getNewRow() {
    return newRow;
  }

  public Map<String, Object> getOldRow() {
    return oldRow;
  }

  public long getSequence() {
    return sequence;
  }

  public boolean hasSequence() {
    return sequence != NO_SEQUENCE;
  }

  /**
   * Identity used for duplicate suppression across redundant listeners. Equal to the commit
   * sequence when present, otherwise a digest of the raw payload.
   */
  public String getDedupKey() {
    return dedupKey;
  }

  public Instant getCommitTimestamp() {
    return commitTimestamp;
  }

  public Instant getIngestedAt() {
    return ingestedAt;
  }

  /**
   * The row image that filters and authorization are evaluated against: the new image, or the
   * old image for deletes.
   */
  public Map<String, Object> effectiveRow() {
    return operation == Operation.DELETE ? oldRow : newRow;
  }

  public JsonObject newRowJson() {
    return new JsonObject(new LinkedHashMap<>(newRow));
  }

  public JsonObject oldRowJson() {
    return oldRow.isEmpty() ? null : new JsonObject(new LinkedHashMap<>(oldRow));
  }

  @Override
  public String toString() {
    return "ChangeEvent{" +
      "table='" + qualifiedTable() + '\'' +
      ", operation=" + operation +
      ", sequence=" + sequence +
      ", commitTimestamp=" + commitTimestamp +
      '}';
  }

  private static Map<String, Object> unmodifiableCopy(Map<String, Object> data) {
    if (data == null || data.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
