package com.evoila.tenantplugin.tenant;

import java.util.List;
import reactor.core.publisher.Mono;

/** Read access to the tenant configuration table; implementations are used concurrently. */
public interface TenantConfigRepository {

  /**
   * Fetch every tenant whose {@code enabled} flag is true.
   *
   * @return all enabled tenants in the order the database returned them, or a {@link
   *     TenantConfigException} if the query or the decoding of any row fails
   */
  Mono<List<TenantConfigRecord>> fetchEnabledTenants();
}
