package com.evoila.tenantplugin.generator.model;

import java.util.List;
import java.util.Map;

/**
 * Response envelope expected by the ApplicationSet controller: {@code
 * {"output":{"parameters":[...]}}}.
 */
public record PluginResponse(PluginOutput output) {

  public static PluginResponse assemble(List<Map<String, Object>> parameterSets) {
    return new PluginResponse(new PluginOutput(parameterSets));
  }
}
