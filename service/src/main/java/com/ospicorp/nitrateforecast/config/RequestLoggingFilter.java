package com.ospicorp.nitrateforecast.config;

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

/** One line per request; pipeline runs can be long, so the duration is the useful part. */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          RequestDescriptions.uriWithQuery(request),
          RequestDescriptions.clientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      log.info("HTTP {} {} from {} -> {} ({} ms)",
          request.getMethod(),
          RequestDescriptions.uriWithQuery(request),
          RequestDescriptions.clientIp(request),
          response.getStatus(),
          System.currentTimeMillis() - startTime);
    }
  }
}
