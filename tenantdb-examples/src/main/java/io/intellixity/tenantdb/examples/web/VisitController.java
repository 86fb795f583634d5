package io.intellixity.tenantdb.examples.web;

import io.intellixity.tenantdb.examples.service.VisitService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/visits")
public final class VisitController {
  private final VisitService visits;

  public VisitController(VisitService visits) {
    this.visits = visits;
  }

  public record VisitRecorded(String tenantId, long visits) {}

  @PostMapping
  public VisitRecorded record(HttpServletRequest request, @RequestParam(value = "path", defaultValue = "/") String path) {
    String tenantId = tenant(request);
    return new VisitRecorded(tenantId, visits.record(tenantId, path));
  }

  @GetMapping
  public List<Map<String, Object>> recent(HttpServletRequest request,
                                          @RequestParam(value = "limit", defaultValue = "20") int limit) {
    return visits.recent(tenant(request), Math.max(1, Math.min(limit, 500)));
  }

  private static String tenant(HttpServletRequest request) {
    return (String) request.getAttribute(TenantCookieFilter.TENANT_ATTRIBUTE);
  }
}
