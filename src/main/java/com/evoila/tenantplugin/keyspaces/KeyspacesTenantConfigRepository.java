package com.evoila.tenantplugin.keyspaces;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.evoila.tenantplugin.tenant.TenantConfigException;
import com.evoila.tenantplugin.tenant.TenantConfigRecord;
import com.evoila.tenantplugin.tenant.TenantConfigRepository;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Reads enabled tenants from Amazon Keyspaces through the shared {@link CqlSession}.
 *
 * <p>The enabled predicate is evaluated server-side. All result pages of the single query are
 * drained before anything is emitted, so a caller sees either the complete enabled set in server
 * order or an error. The whole set is held in memory for each request, which bounds the table to
 * control-plane sizes.
 */
@Slf4j
public class KeyspacesTenantConfigRepository implements TenantConfigRepository {

  static final String ENABLED_TENANTS_QUERY =
      "SELECT tenant_id, namespace, target_cluster, repo_url, repo_path, labels, params "
          + "FROM tenant_ops.tenant_configs "
          + "WHERE enabled = true ALLOW FILTERING";

  private final CqlSession session;
  private final TenantConfigRowMapper rowMapper;
  private final SimpleStatement statement;

  public KeyspacesTenantConfigRepository(
      CqlSession session, TenantConfigRowMapper rowMapper, int pageSize) {
    this.session = session;
    this.rowMapper = rowMapper;
    this.statement =
        SimpleStatement.builder(ENABLED_TENANTS_QUERY)
            .setPageSize(pageSize)
            .setIdempotence(true)
            .build();
  }

  @Override
  public Mono<List<TenantConfigRecord>> fetchEnabledTenants() {
    return Mono.fromCompletionStage(() -> session.executeAsync(statement))
        .expand(this::nextPage)
        .concatMapIterable(AsyncResultSet::currentPage)
        .map(rowMapper::map)
        .collectList()
        .onErrorMap(
            e -> !(e instanceof TenantConfigException),
            e -> new TenantConfigException("Tenant configuration query failed", e))
        .doOnNext(tenants -> log.debug("Fetched {} enabled tenant(s)", tenants.size()));
  }

  private Mono<AsyncResultSet> nextPage(AsyncResultSet resultSet) {
    return resultSet.hasMorePages()
        ? Mono.fromCompletionStage(resultSet::fetchNextPage)
        : Mono.empty();
  }
}
