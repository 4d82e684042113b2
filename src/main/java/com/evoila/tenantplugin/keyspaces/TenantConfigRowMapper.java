package com.evoila.tenantplugin.keyspaces;

import com.datastax.oss.driver.api.core.cql.Row;
import com.evoila.tenantplugin.tenant.TenantConfigException;
import com.evoila.tenantplugin.tenant.TenantConfigRecord;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Decodes rows of the tenant configuration query into {@link TenantConfigRecord}s. */
@Component
public class TenantConfigRowMapper {

  static final String TENANT_ID = "tenant_id";
  static final String NAMESPACE = "namespace";
  static final String TARGET_CLUSTER = "target_cluster";
  static final String REPO_URL = "repo_url";
  static final String REPO_PATH = "repo_path";
  static final String LABELS = "labels";
  static final String PARAMS = "params";

  /**
   * @param row one row of the tenant configuration query
   * @return the decoded record
   * @throws TenantConfigException if a mandatory column is null or empty, or a column has an
   *     unexpected type
   */
  public TenantConfigRecord map(Row row) {
    try {
      return new TenantConfigRecord(
          requireText(row, TENANT_ID),
          requireText(row, NAMESPACE),
          requireText(row, TARGET_CLUSTER),
          requireText(row, REPO_URL),
          requireText(row, REPO_PATH),
          optionalMap(row, LABELS),
          optionalMap(row, PARAMS));
    } catch (TenantConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TenantConfigException("Failed to decode tenant configuration row", e);
    }
  }

  private String requireText(Row row, String column) {
    String value = row.getString(column);
    if (value == null || value.isEmpty()) {
      throw new TenantConfigException("Tenant configuration row has no value for " + column);
    }
    return value;
  }

  private Map<String, String> optionalMap(Row row, String column) {
    if (row.isNull(column)) {
      return null;
    }
    return row.getMap(column, String.class, String.class);
  }
}
