package io.intellixity.tenantdb.examples.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Resolves the tenant from the {@code tenant_id} cookie, falling back to the {@code X-Tenant-Id} header. */
@Component
public final class TenantCookieFilter extends OncePerRequestFilter {
  public static final String TENANT_COOKIE = "tenant_id";
  public static final String TENANT_HEADER = "X-Tenant-Id";
  public static final String TENANT_ATTRIBUTE = TenantCookieFilter.class.getName() + ".tenant";

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String tenantId = null;
    Cookie[] cookies = request.getCookies();
    if (cookies != null) {
      for (Cookie c : cookies) {
        if (TENANT_COOKIE.equals(c.getName())) tenantId = c.getValue();
      }
    }
    if (tenantId == null || tenantId.isBlank()) tenantId = request.getHeader(TENANT_HEADER);
    if (tenantId == null || tenantId.isBlank()) {
      response.sendError(400, "Missing tenant: set the " + TENANT_COOKIE + " cookie or " + TENANT_HEADER + " header");
      return;
    }
    request.setAttribute(TENANT_ATTRIBUTE, tenantId.trim());
    filterChain.doFilter(request, response);
  }
}
