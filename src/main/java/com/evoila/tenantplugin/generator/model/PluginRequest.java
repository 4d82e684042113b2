package com.evoila.tenantplugin.generator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.Map;

/** Body the ApplicationSet controller posts to {@code /api/v1/getparams.execute}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PluginRequest(String applicationSetName, PluginInput input) {

  /** The free-form generator parameters, empty when the caller sent none. */
  public Map<String, Object> parameters() {
    if (input == null || input.parameters() == null) {
      return Collections.emptyMap();
    }
    return input.parameters();
  }
}
