package io.b2mash.outreach.tenant;

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

/** Puts {@code requestId} and, for tenant-scoped paths, {@code tenantId} on the logging MDC. */
@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_TENANT_ID = "tenantId";
  private static final String MDC_REQUEST_ID = "requestId";
  private static final Pattern TENANT_PATH =
      Pattern.compile("^/internal/tenants/([0-9a-fA-F-]{36})(/.*)?$");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      var matcher = TENANT_PATH.matcher(request.getRequestURI());
      if (matcher.matches()) {
        MDC.put(MDC_TENANT_ID, matcher.group(1));
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_TENANT_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
