/*
 * Where: Alarm pipeline realtime endpoint
 * What: Registers dashboard WebSocket sessions with the broadcast hub
 * Why: tenantId/houseId query parameters define the scope; inbound frames are ignored
 */
package com.example.alarm.realtime;

import com.example.alarm.config.RealtimeProperties;
import com.example.alarm.model.SubscriptionScope;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class AlarmWebSocketHandler extends TextWebSocketHandler {

  static final String CONNECTION_ID_ATTRIBUTE = "alarm.realtime.connectionId";

  private static final Logger logger = LoggerFactory.getLogger(AlarmWebSocketHandler.class);

  private final RealtimeBroadcastHub hub;
  private final RealtimeProperties properties;

  public AlarmWebSocketHandler(RealtimeBroadcastHub hub, RealtimeProperties properties) {
    this.hub = hub;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    final SubscriptionScope scope = resolveScope(session.getUri());
    // send limit overruns surface as SessionLimitExceededException and drop the connection
    final WebSocketSession limited =
        new ConcurrentWebSocketSessionDecorator(
            session,
            (int) properties.sendTimeout().toMillis(),
            properties.sendBufferSizeLimit());
    final String connectionId = hub.connect(scope, new WebSocketRealtimeChannel(limited));
    session.getAttributes().put(CONNECTION_ID_ATTRIBUTE, connectionId);
    logger.info(
        "realtime subscriber connected connectionId={} tenantId={} houseId={}",
        connectionId,
        scope.tenantId(),
        scope.houseId());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    logger.debug("ignoring inbound realtime frame sessionId={}", session.getId());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.warn("realtime transport error sessionId={}", session.getId(), exception);
    disconnect(session);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    disconnect(session);
  }

  static SubscriptionScope resolveScope(URI uri) {
    if (uri == null) {
      return SubscriptionScope.ALL;
    }
    final MultiValueMap<String, String> query =
        UriComponentsBuilder.fromUri(uri).build().getQueryParams();
    return SubscriptionScope.of(query.getFirst("tenantId"), query.getFirst("houseId"));
  }

  private void disconnect(WebSocketSession session) {
    final Object connectionId = session.getAttributes().get(CONNECTION_ID_ATTRIBUTE);
    if (connectionId instanceof String id) {
      hub.disconnect(id);
    }
  }
}
