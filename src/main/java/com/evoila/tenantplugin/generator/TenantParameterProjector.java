package com.evoila.tenantplugin.generator;

import com.evoila.tenantplugin.tenant.TenantConfigRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Narrows tenants by label and turns each survivor into the flat parameter map templates consume.
 *
 * <p>Keys are written in a fixed order: the location keys, then {@code labels}, then every param as
 * a top-level string, then the nested {@code params} map. Later writes win, so a param may shadow a
 * location key or {@code labels}, but never the nested {@code params} entry itself.
 */
@Slf4j
@Component
public class TenantParameterProjector {

  public static final String TENANT_ID = "tenantId";
  public static final String NAMESPACE = "namespace";
  public static final String CLUSTER = "cluster";
  public static final String REPO_URL = "repoURL";
  public static final String PATH = "path";
  public static final String LABELS = "labels";
  public static final String PARAMS = "params";

  /**
   * @param tenants enabled tenants in query order
   * @param filter label filter, {@link LabelFilter#NONE} to keep everything
   * @return one parameter map per retained tenant, in input order
   */
  public List<Map<String, Object>> project(List<TenantConfigRecord> tenants, LabelFilter filter) {
    List<Map<String, Object>> parameterSets = new ArrayList<>(tenants.size());
    for (TenantConfigRecord tenant : tenants) {
      if (!filter.matches(tenant)) {
        log.debug(
            "Skipping tenant {}: label {}={} not matched",
            tenant.tenantId(),
            filter.key(),
            filter.value());
        continue;
      }
      parameterSets.add(toParameters(tenant));
    }
    return parameterSets;
  }

  Map<String, Object> toParameters(TenantConfigRecord tenant) {
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put(TENANT_ID, tenant.tenantId());
    parameters.put(NAMESPACE, tenant.namespace());
    parameters.put(CLUSTER, tenant.targetCluster());
    parameters.put(REPO_URL, tenant.repoUrl());
    parameters.put(PATH, tenant.repoPath());

    if (tenant.hasLabels()) {
      parameters.put(LABELS, new LinkedHashMap<>(tenant.labels()));
    }
    if (tenant.hasParams()) {
      parameters.putAll(tenant.params());
      parameters.put(PARAMS, new LinkedHashMap<>(tenant.params()));
    }
    return parameters;
  }
}
