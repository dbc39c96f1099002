package io.b2mash.crmsync.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String MDC_REQUEST_ID = "requestId";
  static final String MDC_OWNER_ID = "ownerId";

  // Header values end up in log lines, so only this alphabet is trusted.
  private static final Pattern SAFE_HEADER_VALUE = Pattern.compile("[A-Za-z0-9-]{1,64}");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String requestId = request.getHeader(RequestHeaders.REQUEST_ID);
      if (requestId == null || !SAFE_HEADER_VALUE.matcher(requestId).matches()) {
        requestId = UUID.randomUUID().toString();
      }
      MDC.put(MDC_REQUEST_ID, requestId);
      response.setHeader(RequestHeaders.REQUEST_ID, requestId);

      String ownerId = request.getHeader(RequestHeaders.OWNER_ID);
      if (ownerId != null && SAFE_HEADER_VALUE.matcher(ownerId).matches()) {
        MDC.put(MDC_OWNER_ID, ownerId);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_OWNER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
