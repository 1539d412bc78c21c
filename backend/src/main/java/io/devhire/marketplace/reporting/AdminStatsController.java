package io.devhire.marketplace.reporting;

import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.security.CurrentActor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AdminStatsController {

  private final MarketplaceStatsService statsService;

  public AdminStatsController(MarketplaceStatsService statsService) {
    this.statsService = statsService;
  }

  @GetMapping("/api/admin/stats")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<MarketplaceStats> getStats(@CurrentActor Actor actor) {
    return ResponseEntity.ok(statsService.getStats(actor));
  }
}
