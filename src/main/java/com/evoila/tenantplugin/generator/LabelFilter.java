package com.evoila.tenantplugin.generator;

import com.evoila.tenantplugin.tenant.TenantConfigRecord;
import java.util.Map;

/**
 * Optional label-equality filter requested by the caller. Active only when both {@code
 * filterLabelKey} and {@code filterLabelValue} are supplied as strings; a half-specified filter is
 * treated as no filter.
 */
public record LabelFilter(String key, String value) {

  public static final String KEY_PARAMETER = "filterLabelKey";
  public static final String VALUE_PARAMETER = "filterLabelValue";

  public static final LabelFilter NONE = new LabelFilter(null, null);

  /**
   * Extracts the filter from the free-form generator parameters.
   *
   * @param parameters the {@code input.parameters} object of the request, may be null
   * @return the active filter, or {@link #NONE}
   */
  public static LabelFilter fromParameters(Map<String, Object> parameters) {
    if (parameters == null) {
      return NONE;
    }
    String key = asString(parameters.get(KEY_PARAMETER));
    String value = asString(parameters.get(VALUE_PARAMETER));
    return key != null && value != null ? new LabelFilter(key, value) : NONE;
  }

  public boolean isActive() {
    return key != null && value != null;
  }

  /** Exact, case-sensitive match; tenants without labels never match an active filter. */
  public boolean matches(TenantConfigRecord tenant) {
    if (!isActive()) {
      return true;
    }
    return tenant.hasLabels() && value.equals(tenant.labels().get(key));
  }

  private static String asString(Object parameter) {
    return parameter instanceof String text ? text : null;
  }
}
