package com.evoila.tenantplugin.common.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the Amazon Keyspaces cluster holding the tenant configuration table.
 * The contact point is derived from the region; there is no service discovery.
 */
@Data
@ConfigurationProperties(prefix = "keyspaces")
public class KeyspacesProperties {

  private static final String ENDPOINT_TEMPLATE = "cassandra.%s.amazonaws.com";

  private boolean enabled = true;
  private String region = "us-east-1";
  private int port = 9142;
  private String rootCertPath = "/certs/sf-class2-root.crt";
  private String username;
  private String password;
  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration queryTimeout = Duration.ofSeconds(10);
  private int pageSize = 5000;

  public String getEndpointHost() {
    return String.format(ENDPOINT_TEMPLATE, region);
  }
}
