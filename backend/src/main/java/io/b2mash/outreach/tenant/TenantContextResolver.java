package io.b2mash.outreach.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.outreach.exception.ForbiddenException;
import io.b2mash.outreach.exception.ResourceNotFoundException;
import java.time.Duration;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Resolves the {@link TenantContext} for a tenant id presented by an already-authenticated caller.
 * Contexts are cached for a short time and evicted once a {@link TenantChangedEvent} commits, so a
 * concurrent lookup cannot re-cache the row as it was before the change.
 */
@Component
public class TenantContextResolver {

  private final TenantRepository tenantRepository;
  private final Cache<UUID, TenantContext> contextCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofMinutes(10)).build();

  public TenantContextResolver(TenantRepository tenantRepository) {
    this.tenantRepository = tenantRepository;
  }

  /**
   * Returns the context for an active tenant.
   *
   * @throws ResourceNotFoundException if the tenant does not exist
   * @throws ForbiddenException if the tenant has churned
   */
  public TenantContext resolve(UUID tenantId) {
    TenantContext cached = contextCache.getIfPresent(tenantId);
    if (cached != null) {
      return cached;
    }
    var tenant =
        tenantRepository
            .findById(tenantId)
            .orElseThrow(() -> new ResourceNotFoundException("Tenant", tenantId));
    if (!tenant.isActive()) {
      throw new ForbiddenException("Tenant inactive", "Tenant " + tenantId + " has churned");
    }
    var context = TenantContext.of(tenant);
    contextCache.put(tenantId, context);
    return context;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTenantChanged(TenantChangedEvent event) {
    evict(event.tenantId());
  }

  public void evict(UUID tenantId) {
    contextCache.invalidate(tenantId);
  }
}
