package io.b2mash.outreach.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class PoolResourceTest {

  private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

  @Test
  void newResource_startsWarmingAndEmpty() {
    var resource = new PoolResource(ResourceType.EMAIL_DOMAIN, "mail.acme.io", 3, "ses", null);

    assertThat(resource.getStatus()).isEqualTo(ResourceStatus.WARMING);
    assertThat(resource.getCurrentTenants()).isZero();
    assertThat(resource.zone()).isEqualTo(ZoneId.of("UTC"));
  }

  @Test
  void slots_neverExceedMaxTenants() {
    var resource = new PoolResource(ResourceType.EMAIL_DOMAIN, "mail.acme.io", 2, "ses", null);
    resource.completeWarmup(NOW);

    resource.grantSlot();
    resource.grantSlot();

    assertThat(resource.getStatus()).isEqualTo(ResourceStatus.ASSIGNED);
    assertThat(resource.hasSpareCapacity()).isFalse();
    assertThatThrownBy(resource::grantSlot).isInstanceOf(IllegalStateException.class);
    assertThat(resource.getCurrentTenants()).isEqualTo(2);
  }

  @Test
  void releasingSlot_reopensResource() {
    var resource = new PoolResource(ResourceType.LINKEDIN_SEAT, "seat-1", 1, "unipile", null);
    resource.grantSlot();

    resource.releaseSlot();

    assertThat(resource.getStatus()).isEqualTo(ResourceStatus.WARMING);
    assertThat(resource.hasSpareCapacity()).isTrue();
    assertThatThrownBy(resource::releaseSlot).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void completingWarmup_makesResourceAvailable() {
    var resource = new PoolResource(ResourceType.PHONE_NUMBER, "+61200000000", 1, "twilio", null);

    resource.completeWarmup(NOW);

    assertThat(resource.getStatus()).isEqualTo(ResourceStatus.AVAILABLE);
    assertThat(resource.isWarmupComplete()).isTrue();
  }

  @Test
  void heldResource_cannotRetire() {
    var resource = new PoolResource(ResourceType.LINKEDIN_SEAT, "seat-2", 1, "unipile", null);
    resource.grantSlot();

    assertThatThrownBy(resource::retire).isInstanceOf(IllegalStateException.class);

    resource.releaseSlot();
    resource.retire();
    assertThat(resource.getStatus()).isEqualTo(ResourceStatus.RETIRED);
    assertThatThrownBy(resource::grantSlot).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void bufferLevels() {
    assertThat(ResourceAllocator.level(50)).isEqualTo(ResourceAllocator.BufferLevel.OK);
    assertThat(ResourceAllocator.level(40)).isEqualTo(ResourceAllocator.BufferLevel.OK);
    assertThat(ResourceAllocator.level(39)).isEqualTo(ResourceAllocator.BufferLevel.LOW);
    assertThat(ResourceAllocator.level(19)).isEqualTo(ResourceAllocator.BufferLevel.CRITICAL);
  }
}
