/*
 * Where: Alarm pipeline web configuration
 * What: Exposes the realtime hub over a WebSocket endpoint
 */
package com.example.alarm.config;

import com.example.alarm.realtime.AlarmWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class RealtimeConfig implements WebSocketConfigurer {

  private final AlarmWebSocketHandler alarmWebSocketHandler;
  private final RealtimeProperties properties;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(alarmWebSocketHandler, properties.path())
        .setAllowedOrigins(properties.allowedOrigins().toArray(String[]::new));
  }
}
