package com.evoila.tenantplugin.common.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings of the generator endpoint: bearer token location and per-call timeout. */
@Data
@ConfigurationProperties(prefix = "plugin")
public class PluginProperties {

  private String tokenFile = "/var/run/argo/token";
  private Duration requestTimeout = Duration.ofSeconds(30);
}
