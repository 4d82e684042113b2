package com.evoila.tenantplugin.keyspaces;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.config.DefaultDriverOption;
import com.datastax.oss.driver.api.core.config.DriverConfigLoader;
import com.evoila.tenantplugin.common.config.KeyspacesProperties;
import com.evoila.tenantplugin.security.config.CustomSslContextFactory;
import com.evoila.tenantplugin.tenant.TenantConfigRepository;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import javax.net.ssl.SSLContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Opens the one TLS-secured Keyspaces session the process uses for its whole lifetime. Any
 * failure here aborts application startup; there is no retry.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "keyspaces",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class KeyspacesSessionConfig {

  private final KeyspacesProperties properties;

  @Bean(destroyMethod = "close")
  public CqlSession keyspacesSession() {
    String username = requireCredential(properties.getUsername(), "KEYSPACES_USERNAME");
    String password = requireCredential(properties.getPassword(), "KEYSPACES_PASSWORD");
    SSLContext sslContext = loadSslContext(properties.getRootCertPath());

    InetSocketAddress contactPoint =
        new InetSocketAddress(properties.getEndpointHost(), properties.getPort());
    DriverConfigLoader configLoader =
        DriverConfigLoader.programmaticBuilder()
            .withDuration(
                DefaultDriverOption.CONNECTION_CONNECT_TIMEOUT, properties.getConnectTimeout())
            .withDuration(
                DefaultDriverOption.CONNECTION_INIT_QUERY_TIMEOUT, properties.getConnectTimeout())
            .withDuration(DefaultDriverOption.REQUEST_TIMEOUT, properties.getQueryTimeout())
            .build();

    log.info(
        "Opening Keyspaces session to {} (datacenter {})", contactPoint, properties.getRegion());
    try {
      CqlSession session =
          CqlSession.builder()
              .addContactPoint(contactPoint)
              .withLocalDatacenter(properties.getRegion())
              .withAuthCredentials(username, password)
              .withSslContext(sslContext)
              .withConfigLoader(configLoader)
              .build();
      log.info("Keyspaces session established: {}", session.getName());
      return session;
    } catch (RuntimeException e) {
      throw new IllegalStateException("Failed to open Keyspaces session to " + contactPoint, e);
    }
  }

  @Bean
  public TenantConfigRepository tenantConfigRepository(
      CqlSession keyspacesSession, TenantConfigRowMapper tenantConfigRowMapper) {
    return new KeyspacesTenantConfigRepository(
        keyspacesSession, tenantConfigRowMapper, properties.getPageSize());
  }

  private static String requireCredential(String value, String envName) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("missing env " + envName);
    }
    return value;
  }

  private static SSLContext loadSslContext(String rootCertPath) {
    if (!CustomSslContextFactory.isCustomCaAvailable(rootCertPath)) {
      throw new IllegalStateException("Keyspaces root certificate not readable: " + rootCertPath);
    }
    try {
      return CustomSslContextFactory.createSslContext(Path.of(rootCertPath));
    } catch (Exception e) {
      throw new IllegalStateException(
          "Failed to load Keyspaces root certificate from " + rootCertPath, e);
    }
  }
}
