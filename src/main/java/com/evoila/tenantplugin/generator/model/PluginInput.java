package com.evoila.tenantplugin.generator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/** The {@code input} object of a generator call; {@code parameters} is free-form. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PluginInput(Map<String, Object> parameters) {}
