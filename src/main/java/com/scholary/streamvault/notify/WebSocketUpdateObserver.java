package com.scholary.streamvault.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

/**
 * Observer backed by a WebSocket session.
 *
 * <p>The session is expected to be a {@code ConcurrentWebSocketSessionDecorator}: it buffers
 * messages while a previous send is in flight and fails once the buffer or send-time limit is
 * exceeded, which is what makes {@link #offer} non-blocking for slow clients.
 */
class WebSocketUpdateObserver implements UpdateObserver {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketUpdateObserver.class);

  private final WebSocketSession session;
  private final ObjectMapper objectMapper;

  WebSocketUpdateObserver(WebSocketSession session, ObjectMapper objectMapper) {
    this.session = session;
    this.objectMapper = objectMapper;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public boolean offer(StatsUpdateMessage message) {
    if (!session.isOpen()) {
      return false;
    }
    String payload;
    try {
      payload = objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException e) {
      // Serialization is not the observer's fault; keep it connected.
      LOGGER.error("Failed to serialize update message", e);
      return true;
    }
    try {
      session.sendMessage(new TextMessage(payload));
      return true;
    } catch (SessionLimitExceededException e) {
      LOGGER.debug("Session {} exceeded its send limits: {}", id(), e.getMessage());
      return false;
    } catch (IOException e) {
      LOGGER.debug("Send to session {} failed: {}", id(), e.getMessage());
      return false;
    }
  }
}
