package io.b2mash.outreach.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.outreach.TestcontainersConfiguration;
import io.b2mash.outreach.exception.ForbiddenException;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class TenantContextResolverIntegrationTest {

  @Autowired private TenantService tenantService;
  @Autowired private TenantContextResolver resolver;
  @Autowired private PlatformTransactionManager transactionManager;

  @Test
  void planChange_isResolvedOnceCommitted() {
    var tenant = tenantService.createTenant("Cache Co", "ignition-monthly", "UTC");
    assertThat(resolver.resolve(tenant.getId()).tier()).isEqualTo(Tier.IGNITION);

    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              tenantService.syncPlan(tenant.getId(), "dominance-monthly");
              // a request racing the uncommitted change still sees the old plan
              var racing = onOtherThread(() -> resolver.resolve(tenant.getId()));
              assertThat(racing.tier()).isEqualTo(Tier.IGNITION);
            });

    assertThat(resolver.resolve(tenant.getId()).tier()).isEqualTo(Tier.DOMINANCE);
  }

  @Test
  void rolledBackPlanChange_keepsCachedContext() {
    var tenant = tenantService.createTenant("Rollback Co", "velocity-monthly", "UTC");
    assertThat(resolver.resolve(tenant.getId()).tier()).isEqualTo(Tier.VELOCITY);

    new TransactionTemplate(transactionManager)
        .executeWithoutResult(
            status -> {
              tenantService.syncPlan(tenant.getId(), "ignition-monthly");
              status.setRollbackOnly();
            });

    assertThat(resolver.resolve(tenant.getId()).tier()).isEqualTo(Tier.VELOCITY);
  }

  @Test
  void churnedTenant_isRejectedAfterCommit() {
    var tenant = tenantService.createTenant("Churn Co", "velocity-monthly", "UTC");
    resolver.resolve(tenant.getId());

    tenantService.churn(tenant.getId());

    assertThatThrownBy(() -> resolver.resolve(tenant.getId()))
        .isInstanceOf(ForbiddenException.class);
  }

  private static <T> T onOtherThread(Callable<T> work) {
    var executor = Executors.newSingleThreadExecutor();
    try {
      return executor.submit(work).get(30, TimeUnit.SECONDS);
    } catch (Exception e) {
      throw new IllegalStateException("Background work failed", e);
    } finally {
      executor.shutdown();
    }
  }
}
