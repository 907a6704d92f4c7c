package com.dataprep.standardizer;

import java.io.IOException;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
@Order(1)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final String USERNAME_MDC_KEY = "username";
  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  private static final String USERNAME_HEADER = "X-Username";
  private static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
  private static final String DEFAULT_USERNAME = "anonymous";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String username = request.getHeader(USERNAME_HEADER);
      MDC.put(
          USERNAME_MDC_KEY, username == null || username.isEmpty() ? DEFAULT_USERNAME : username);

      String correlationId = request.getHeader(CORRELATION_ID_HEADER);
      if (correlationId != null && !correlationId.isEmpty()) {
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(USERNAME_MDC_KEY);
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }
}
