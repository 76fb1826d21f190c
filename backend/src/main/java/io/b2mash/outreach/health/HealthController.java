package io.b2mash.outreach.health;

import io.b2mash.outreach.resource.ResourceController.ResourceResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/resources")
public class HealthController {

  private final HealthMonitorService healthMonitorService;

  public HealthController(HealthMonitorService healthMonitorService) {
    this.healthMonitorService = healthMonitorService;
  }

  @PostMapping("/{resourceId}/send-events")
  public ResponseEntity<Void> reportSendEvent(
      @PathVariable UUID resourceId, @Valid @RequestBody SendEventRequest request) {
    healthMonitorService.reportSendEvent(
        resourceId, request.tenantId(), request.eventType(), request.occurredAt());
    return ResponseEntity.accepted().build();
  }

  @PostMapping("/{resourceId}/health/recompute")
  public ResponseEntity<ResourceResponse> recompute(@PathVariable UUID resourceId) {
    return ResponseEntity.ok(ResourceResponse.from(healthMonitorService.recompute(resourceId)));
  }

  @GetMapping("/{resourceId}/daily-limit")
  public ResponseEntity<HealthMonitorService.DailyLimitView> dailyLimit(
      @PathVariable UUID resourceId) {
    return ResponseEntity.ok(healthMonitorService.dailyLimit(resourceId));
  }

  @PutMapping("/{resourceId}/daily-limit-override")
  public ResponseEntity<ResourceResponse> changeOverride(
      @PathVariable UUID resourceId, @Valid @RequestBody OverrideRequest request) {
    return ResponseEntity.ok(
        ResourceResponse.from(
            healthMonitorService.changeDailyLimitOverride(
                resourceId, request.dailyLimitOverride())));
  }

  @GetMapping("/unhealthy")
  public ResponseEntity<List<ResourceResponse>> unhealthy() {
    return ResponseEntity.ok(
        healthMonitorService.unhealthyResources().stream().map(ResourceResponse::from).toList());
  }

  public record SendEventRequest(
      UUID tenantId,
      @NotNull(message = "eventType is required") SendEventType eventType,
      Instant occurredAt) {}

  /** A null override clears it. */
  public record OverrideRequest(
      @Min(value = 0, message = "dailyLimitOverride must not be negative")
          Integer dailyLimitOverride) {}
}
