package com.evoila.tenantplugin.tenant;

import java.util.Map;

/**
 * One enabled row of {@code tenant_ops.tenant_configs}.
 *
 * <p>The five location fields are mandatory. {@code labels} and {@code params} are null when the
 * column is null; an empty map never occurs since Cassandra stores empty collections as null.
 */
public record TenantConfigRecord(
    String tenantId,
    String namespace,
    String targetCluster,
    String repoUrl,
    String repoPath,
    Map<String, String> labels,
    Map<String, String> params) {

  public boolean hasLabels() {
    return labels != null;
  }

  public boolean hasParams() {
    return params != null;
  }
}
