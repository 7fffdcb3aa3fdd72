package com.example.alarm.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.alarm.config.RealtimeProperties;
import com.example.alarm.model.SubscriptionScope;
import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@ExtendWith(MockitoExtension.class)
class AlarmWebSocketHandlerTest {

  private static final RealtimeProperties PROPERTIES =
      new RealtimeProperties(16, 2, Duration.ofSeconds(5), 64 * 1024, "/v1/realtime", List.of());

  @Mock private RealtimeBroadcastHub hub;
  @Mock private WebSocketSession session;

  @Test
  void scopeComesFromQueryParameters() {
    assertThat(
            AlarmWebSocketHandler.resolveScope(
                URI.create("ws://localhost/v1/realtime?tenantId=t-1&houseId=h-1")))
        .isEqualTo(SubscriptionScope.of("t-1", "h-1"));
    assertThat(AlarmWebSocketHandler.resolveScope(URI.create("ws://localhost/v1/realtime")))
        .isEqualTo(SubscriptionScope.ALL);
    assertThat(AlarmWebSocketHandler.resolveScope(null)).isEqualTo(SubscriptionScope.ALL);
  }

  @Test
  void sessionIsRegisteredAndReleasedWithTheHub() throws Exception {
    final Map<String, Object> attributes = new HashMap<>();
    when(session.getUri()).thenReturn(URI.create("ws://localhost/v1/realtime?tenantId=t-1"));
    when(session.getAttributes()).thenReturn(attributes);
    when(hub.connect(eq(SubscriptionScope.of("t-1", null)), any(RealtimeChannel.class)))
        .thenReturn("conn-1");
    final AlarmWebSocketHandler handler = new AlarmWebSocketHandler(hub, PROPERTIES);

    handler.afterConnectionEstablished(session);
    handler.afterConnectionClosed(session, CloseStatus.NORMAL);

    assertThat(attributes).containsEntry(AlarmWebSocketHandler.CONNECTION_ID_ATTRIBUTE, "conn-1");
    verify(hub).disconnect("conn-1");
  }

  @Test
  void framesAreWrittenThroughTheSession() throws Exception {
    when(session.getUri()).thenReturn(URI.create("ws://localhost/v1/realtime"));
    when(session.getAttributes()).thenReturn(new HashMap<>());
    final ArgumentCaptor<RealtimeChannel> channel = ArgumentCaptor.forClass(RealtimeChannel.class);
    when(hub.connect(eq(SubscriptionScope.ALL), channel.capture())).thenReturn("conn-2");
    new AlarmWebSocketHandler(hub, PROPERTIES).afterConnectionEstablished(session);

    channel.getValue().send("{\"eventType\":\"incident.triggered\"}");

    verify(session).sendMessage(new TextMessage("{\"eventType\":\"incident.triggered\"}"));
  }
}
