/*
 * Where: Alarm pipeline operator API
 * What: Tags log lines of one HTTP request with request and alarm identifiers
 */
package com.example.alarm.config;

import com.google.common.collect.ImmutableMap;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Puts request metadata into the MDC before the handler runs and removes exactly those keys once
 * the request completes. Path variables naming an incident, sensor or recipient are copied too,
 * so an acknowledgement log line carries {@code incident_id} without the controller adding it.
 */
@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";
  static final String HEADER_USER_ID = "X-User-Id";
  static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";

  private static final String ADDED_KEYS = RequestMdcInterceptor.class.getName() + ".addedKeys";

  /** Path variable name to MDC key. */
  private static final Map<String, String> PATH_VARIABLE_KEYS =
      ImmutableMap.of(
          "incidentId", "incident_id",
          "deviceId", "device_id",
          "sensorId", "device_id",
          "recipientId", "recipient_id");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Deque<String> added = new ArrayDeque<>();
    putIfPresent(added, "request_id", requestId(request));
    putIfPresent(added, "http_method", request.getMethod());
    putIfPresent(added, "http_path", request.getRequestURI());
    putIfPresent(added, "client_ip", clientIp(request));
    putIfPresent(added, "user_id", request.getHeader(HEADER_USER_ID));
    pathVariables(request)
        .forEach(
            (name, value) -> {
              final String key = PATH_VARIABLE_KEYS.get(name);
              if (key != null) {
                putIfPresent(added, key, value);
              }
            });
    request.setAttribute(ADDED_KEYS, added);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ADDED_KEYS) instanceof Deque<?> added) {
      added.forEach(key -> MDC.remove(String.valueOf(key)));
      request.removeAttribute(ADDED_KEYS);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, String> pathVariables(HttpServletRequest request) {
    final Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return variables instanceof Map<?, ?> map ? (Map<String, String>) map : Map.of();
  }

  private static String requestId(HttpServletRequest request) {
    final String header = request.getHeader(HEADER_REQUEST_ID);
    return header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
  }

  /** First hop of X-Forwarded-For, else the socket peer. */
  private static String clientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader(HEADER_FORWARDED_FOR);
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  private static void putIfPresent(Deque<String> added, String key, String value) {
    if (value == null || value.isBlank() || added.contains(key)) {
      return;
    }
    MDC.put(key, value);
    added.push(key);
  }
}
