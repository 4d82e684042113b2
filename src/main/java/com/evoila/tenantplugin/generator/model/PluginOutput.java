package com.evoila.tenantplugin.generator.model;

import java.util.List;
import java.util.Map;

/** One parameter map per tenant. */
public record PluginOutput(List<Map<String, Object>> parameters) {}
