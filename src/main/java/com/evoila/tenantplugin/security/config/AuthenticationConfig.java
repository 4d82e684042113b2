package com.evoila.tenantplugin.security.config;

import com.evoila.tenantplugin.common.config.PluginProperties;
import java.util.Collections;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.server.authentication.ServerAuthenticationConverter;
import reactor.core.publisher.Mono;

@Slf4j
@Configuration
public class AuthenticationConfig {

  static final String PLUGIN_PRINCIPAL = "applicationset-controller";

  @Bean
  public PluginTokenAuthenticator pluginTokenAuthenticator(PluginProperties pluginProperties) {
    return new PluginTokenAuthenticator(PluginTokenLoader.load(pluginProperties.getTokenFile()));
  }

  /** Passes the raw Authorization header on as credentials; requests without one stay anonymous. */
  @Bean
  public ServerAuthenticationConverter pluginTokenAuthenticationConverter() {
    return exchange ->
        Mono.justOrEmpty(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION))
            .<Authentication>map(
                header ->
                    UsernamePasswordAuthenticationToken.unauthenticated(PLUGIN_PRINCIPAL, header));
  }

  @Bean
  public ReactiveAuthenticationManager pluginTokenAuthenticationManager(
      PluginTokenAuthenticator pluginTokenAuthenticator) {
    return authentication -> {
      Object credentials = authentication.getCredentials();
      String header = credentials instanceof String value ? value : null;
      if (!pluginTokenAuthenticator.authenticate(header)) {
        log.warn("Rejected generator call with invalid bearer token");
        return Mono.error(new BadCredentialsException("Invalid plugin token"));
      }
      return Mono.just(
          UsernamePasswordAuthenticationToken.authenticated(
              PLUGIN_PRINCIPAL, null, Collections.emptyList()));
    };
  }
}
