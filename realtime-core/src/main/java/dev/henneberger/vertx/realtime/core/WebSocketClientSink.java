package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.ServerWebSocket;
import java.util.Objects;

final class WebSocketClientSink implements ClientSink {

  private static final Buffer PING_PAYLOAD = Buffer.buffer("ping");

  private final ServerWebSocket socket;

  WebSocketClientSink(ServerWebSocket socket) {
    this.socket = Objects.requireNonNull(socket, "socket");
  }

  @Override
  public boolean writeQueueFull() {
    return socket.writeQueueFull();
  }

  @Override
  public void write(String message) {
    socket.writeTextMessage(message);
  }

  @Override
  public void drainHandler(Handler<Void> handler) {
    socket.drainHandler(handler);
  }

  @Override
  public void ping() {
    socket.writePing(PING_PAYLOAD);
  }

  @Override
  public void close(short statusCode, String reason) {
    if (!socket.isClosed()) {
      socket.close(statusCode, reason);
    }
  }
}
