package dev.henneberger.vertx.realtime.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A client's interest in either the changes of one table or the traffic of one named channel.
 * The target is fixed at creation.
 */
public final class Subscription {

  private static final String CHANNEL_KEY_PREFIX = "#";

  private final String id;
  private final String connectionId;
  private final String schema;
  private final String table;
  private final String channel;
  private final Set<ChangeEvent.Operation> operations;
  private final RowFilter filter;

  private Subscription(String id,
                       String connectionId,
                       String schema,
                       String table,
                       String channel,
                       Set<ChangeEvent.Operation> operations,
                       RowFilter filter) {
    this.id = Objects.requireNonNull(id, "id");
    this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    this.schema = schema;
    this.table = table;
    this.channel = channel;
    this.operations = operations == null || operations.isEmpty()
      ? Collections.unmodifiableSet(EnumSet.allOf(ChangeEvent.Operation.class))
      : Collections.unmodifiableSet(EnumSet.copyOf(operations));
    this.filter = filter == null ? RowFilter.matchAll() : filter;
  }

  public static Subscription forTable(String id,
                                      String connectionId,
                                      String schema,
                                      String table,
                                      Set<ChangeEvent.Operation> operations,
                                      RowFilter filter) {
    return new Subscription(id, connectionId,
      Objects.requireNonNull(schema, "schema"),
      Objects.requireNonNull(table, "table"),
      null, operations, filter);
  }

  public static Subscription forChannel(String id, String connectionId, String channel) {
    return new Subscription(id, connectionId, null, null,
      Objects.requireNonNull(channel, "channel"), null, null);
  }

  public static String tableKey(String schema, String table) {
    return schema + "." + table;
  }

  public static String channelKey(String channel) {
    return CHANNEL_KEY_PREFIX + channel;
  }

  public String id() {
    return id;
  }

  public String connectionId() {
    return connectionId;
  }

  public String schema() {
    return schema;
  }

  public String table() {
    return table;
  }

  public String channel() {
    return channel;
  }

  public boolean isChannel() {
    return channel != null;
  }

  public Set<ChangeEvent.Operation> operations() {
    return operations;
  }

  public RowFilter filter() {
    return filter;
  }

  /**
   * Registry key: {@code schema.table} for table subscriptions, {@code #name} for channels.
   */
  public String targetKey() {
    return isChannel() ? channelKey(channel) : tableKey(schema, table);
  }

  public boolean matches(ChangeEvent event) {
    if (isChannel() || !operations.contains(event.getOperation())) {
      return false;
    }
    return filter.test(event.effectiveRow());
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id + ", connection=" + connectionId + ", target=" + targetKey()
      + ", ops=" + operations + ", filter=" + filter + '}';
  }
}
