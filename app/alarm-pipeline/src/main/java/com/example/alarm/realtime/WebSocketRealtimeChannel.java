package com.example.alarm.realtime;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/** Adapts a Spring WebSocket session to the hub's outbound channel. */
class WebSocketRealtimeChannel implements RealtimeChannel {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketRealtimeChannel.class);

  private final WebSocketSession session;

  WebSocketRealtimeChannel(WebSocketSession session) {
    this.session = session;
  }

  @Override
  public void send(String frame) throws IOException {
    session.sendMessage(new TextMessage(frame));
  }

  @Override
  public void close() {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(CloseStatus.GOING_AWAY);
    } catch (IOException ex) {
      logger.debug("failed to close websocket session id={}", session.getId(), ex);
    }
  }
}
