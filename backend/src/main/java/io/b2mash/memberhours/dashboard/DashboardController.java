package io.b2mash.memberhours.dashboard;

import io.b2mash.memberhours.dashboard.dto.DashboardSummary;
import io.b2mash.memberhours.security.SessionClaims;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/** Year progress of the signed-in member or their family. */
@RestController
public class DashboardController {

  private final DashboardService dashboardService;

  public DashboardController(DashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  @GetMapping("/api/dashboard/{year}")
  public ResponseEntity<DashboardSummary> getDashboard(
      @AuthenticationPrincipal SessionClaims session, @PathVariable int year) {
    return ResponseEntity.ok(dashboardService.summarize(session, year));
  }
}
