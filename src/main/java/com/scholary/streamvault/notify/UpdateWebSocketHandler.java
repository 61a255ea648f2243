package com.scholary.streamvault.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint for live updates.
 *
 * <p>Each connection becomes one {@link UpdateObserver}. Incoming client messages are ignored;
 * the channel is server to client only.
 */
public class UpdateWebSocketHandler extends TextWebSocketHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(UpdateWebSocketHandler.class);

  private final UpdateBroadcaster broadcaster;
  private final ObjectMapper objectMapper;
  private final int sendTimeLimitMs;
  private final int bufferSizeLimitBytes;
  private final Map<String, UpdateObserver> observers = new ConcurrentHashMap<>();

  public UpdateWebSocketHandler(
      UpdateBroadcaster broadcaster,
      ObjectMapper objectMapper,
      int sendTimeLimitMs,
      int bufferSizeLimitBytes) {
    this.broadcaster = broadcaster;
    this.objectMapper = objectMapper;
    this.sendTimeLimitMs = sendTimeLimitMs;
    this.bufferSizeLimitBytes = bufferSizeLimitBytes;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    WebSocketSession decorated =
        new ConcurrentWebSocketSessionDecorator(
            session,
            sendTimeLimitMs,
            bufferSizeLimitBytes,
            ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
    UpdateObserver observer = new WebSocketUpdateObserver(decorated, objectMapper);
    observers.put(session.getId(), observer);
    broadcaster.register(observer);
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    LOGGER.debug("Ignoring client message on session {}", session.getId());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    LOGGER.warn(
        "WebSocket transport error: session={}, error={}",
        session.getId(),
        exception.getMessage());
    detach(session);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    LOGGER.debug("WebSocket closed: session={}, status={}", session.getId(), status);
    detach(session);
  }

  private void detach(WebSocketSession session) {
    UpdateObserver observer = observers.remove(session.getId());
    if (observer != null) {
      broadcaster.unregister(observer);
    }
  }
}
