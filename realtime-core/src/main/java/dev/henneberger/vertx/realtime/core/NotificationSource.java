package dev.henneberger.vertx.realtime.core;

import java.util.List;

/**
 * Database notify transport. Each call to {@link #open(String)} establishes an independent
 * subscription; the listener pool opens one per listener.
 */
public interface NotificationSource {

  NotificationSession open(String channelName) throws Exception;

  /**
   * A live subscription to a notify channel, used by exactly one listener thread.
   */
  interface NotificationSession extends AutoCloseable {

    /**
     * Blocks up to {@code timeoutMillis} for notifications and returns at most
     * {@code maxPayloads} of them. An empty list means the wait timed out; an exception means
     * the underlying connection is gone.
     */
    List<String> poll(long timeoutMillis, int maxPayloads) throws Exception;

    @Override
    void close();
  }
}
