package io.b2mash.hms.hmsadmin.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a {@code requestId} (and, for tenant-addressed paths, the raw {@code tenantId} path
 * segment) into the SLF4J MDC for the duration of the request.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String MDC_REQUEST_ID = "requestId";
  static final String MDC_TENANT_ID = "tenantId";

  private static final Pattern TENANT_PATH =
      Pattern.compile("^/internal/(?:usage/)?tenants/([^/]+)(?:/.*)?$");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String tenantId = tenantSegment(request.getRequestURI());
      if (tenantId != null) {
        MDC.put(MDC_TENANT_ID, tenantId);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_TENANT_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  static String tenantSegment(String uri) {
    if (uri == null) {
      return null;
    }
    Matcher matcher = TENANT_PATH.matcher(uri);
    if (!matcher.matches() || "stats".equals(matcher.group(1))) {
      return null;
    }
    return matcher.group(1);
  }
}
