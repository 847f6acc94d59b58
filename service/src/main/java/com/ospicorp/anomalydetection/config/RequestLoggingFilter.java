package com.ospicorp.anomalydetection.config;

import com.ospicorp.anomalydetection.health.LatencyTracker;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  private final LatencyTracker latencyTracker;

  public RequestLoggingFilter(LatencyTracker latencyTracker) {
    this.latencyTracker = latencyTracker;
  }

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
      @NonNull FilterChain filterChain) throws ServletException, IOException {
    long startTime = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          RequestInfo.uriWithQuery(request),
          RequestInfo.clientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      double millis = (System.nanoTime() - startTime) / 1_000_000.0;
      latencyTracker.recordRequest(request.getRequestURI(), millis);
      log.info("HTTP {} {} from {} -> {} ({} ms)",
          request.getMethod(),
          RequestInfo.uriWithQuery(request),
          RequestInfo.clientIp(request),
          response.getStatus(),
          Math.round(millis));
    }
  }
}
