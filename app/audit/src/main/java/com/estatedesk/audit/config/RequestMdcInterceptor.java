/*
 * Where: audit web layer
 * What: copies request identity (id, method, path, client ip, user agent) into the MDC
 * Why: log lines carry it, and AuditRecorder falls back to it when callers omit request metadata
 */
package com.estatedesk.audit.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  public static final String REQUEST_ID = "request_id";
  public static final String HTTP_METHOD = "http_method";
  public static final String HTTP_PATH = "http_path";
  public static final String CLIENT_IP = "client_ip";
  public static final String USER_AGENT = "user_agent";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(keys, REQUEST_ID, resolveRequestId(request));
    put(keys, HTTP_METHOD, request.getMethod());
    put(keys, HTTP_PATH, request.getRequestURI());
    put(keys, CLIENT_IP, resolveClientIp(request));
    put(keys, USER_AGENT, request.getHeader("User-Agent"));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (!(request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys)) {
      return;
    }
    rawKeys.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader("X-Request-Id");
    return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
  }

  // First hop of X-Forwarded-For is the original client.
  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    final int comma = forwarded.indexOf(',');
    return (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
