package io.b2mash.outreach.health;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class HealthRecomputeJobTest {

  @Test
  void failureOnOneResource_doesNotStopSweep() {
    var service = mock(HealthMonitorService.class);
    var broken = UUID.randomUUID();
    var healthy = UUID.randomUUID();
    when(service.recomputableResourceIds()).thenReturn(List.of(broken, healthy));
    when(service.recompute(broken)).thenThrow(new IllegalStateException("boom"));

    new HealthRecomputeJob(service).recomputeAll();

    verify(service).recompute(broken);
    verify(service).recompute(healthy);
  }
}
