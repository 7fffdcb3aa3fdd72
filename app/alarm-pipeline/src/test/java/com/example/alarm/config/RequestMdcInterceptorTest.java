/*
 * Where: Alarm pipeline operator API tests
 * What: Verifies MDC tagging and cleanup per request
 */
package com.example.alarm.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void requestAttributesArePutIntoMdc() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/incidents/x");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-User-Id", "operator-1");
    request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/incidents/x");
    assertThat(MDC.get("client_ip")).isEqualTo("203.0.113.7");
    assertThat(MDC.get("user_id")).isEqualTo("operator-1");
  }

  @Test
  void missingRequestIdIsGenerated() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/devices");
    request.setRemoteAddr("192.0.2.1");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("client_ip")).isEqualTo("192.0.2.1");
    assertThat(MDC.get("user_id")).isNull();
  }

  @Test
  void afterCompletionRemovesOnlyTheKeysItAdded() {
    MDC.put("trace_id", "trace-1");
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/devices");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());
    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("http_path")).isNull();
    assertThat(MDC.get("trace_id")).isEqualTo("trace-1");
  }

  @Test
  void alarmPathVariablesAreTagged() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/incidents/7f1c/acknowledge");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE,
        Map.of("incidentId", "7f1c", "unrelated", "ignored"));
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("incident_id")).isEqualTo("7f1c");
    assertThat(MDC.get("unrelated")).isNull();

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("incident_id")).isNull();
  }

  @Test
  void sensorPathVariableIsTaggedAsDevice() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("PUT", "/v1/sensors/smoke-7/placement");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("sensorId", "smoke-7"));

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("device_id")).isEqualTo("smoke-7");
  }
}
