package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;
import java.util.Map;

/**
 * Row-level policy evaluator. Answers whether {@code caller} may see {@code row} of
 * {@code table} ({@code schema.table}).
 */
@FunctionalInterface
public interface RowAuthorizer {
  Future<Boolean> authorize(CallerIdentity caller, String table, Map<String, Object> row);

  /**
   * Variant for deleted rows, which no longer exist in the table. {@code oldRow} is the last row
   * image. Defaults to {@link #authorize}.
   */
  default Future<Boolean> authorizeDeleted(CallerIdentity caller, String table, Map<String, Object> oldRow) {
    return authorize(caller, table, oldRow);
  }
}
