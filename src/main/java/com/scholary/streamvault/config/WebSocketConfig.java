package com.scholary.streamvault.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.streamvault.notify.UpdateBroadcaster;
import com.scholary.streamvault.notify.UpdateWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Configuration for live updates.
 *
 * <p>The WebSocket endpoint at {@code /api/ws} turns each connection into an observer of the
 * {@link UpdateBroadcaster}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final DownloadProperties properties;
  private final UpdateBroadcaster broadcaster;
  private final ObjectMapper objectMapper;

  public WebSocketConfig(
      DownloadProperties properties, UpdateBroadcaster broadcaster, ObjectMapper objectMapper) {
    this.properties = properties;
    this.broadcaster = broadcaster;
    this.objectMapper = objectMapper;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    DownloadProperties.NotifyProperties settings = properties.notifications();
    registry
        .addHandler(
            new UpdateWebSocketHandler(
                broadcaster,
                objectMapper,
                settings.sendTimeLimitMs(),
                settings.bufferSizeLimitBytes()),
            "/api/ws")
        .setAllowedOriginPatterns("*");
  }
}
