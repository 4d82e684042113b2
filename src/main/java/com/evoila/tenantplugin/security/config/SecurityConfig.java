package com.evoila.tenantplugin.security.config;

import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.security.web.server.authentication.AuthenticationWebFilter;
import org.springframework.security.web.server.authentication.ServerAuthenticationConverter;
import org.springframework.security.web.server.authentication.ServerAuthenticationEntryPointFailureHandler;
import org.springframework.security.web.server.authorization.ServerAccessDeniedHandler;
import reactor.core.publisher.Mono;

@Slf4j
@Configuration
@EnableWebFluxSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  static final String FORBIDDEN_BODY = "forbidden";

  private final ReactiveAuthenticationManager pluginTokenAuthenticationManager;
  private final ServerAuthenticationConverter pluginTokenAuthenticationConverter;

  @Bean
  public ServerAuthenticationEntryPoint customAuthenticationEntryPoint() {
    // Any authentication failure, including a missing header, is answered with 403
    return (exchange, ex) -> writeForbidden(exchange.getResponse());
  }

  @Bean
  public ServerAccessDeniedHandler customAccessDeniedHandler() {
    return (exchange, ex) -> writeForbidden(exchange.getResponse());
  }

  @Bean
  public SecurityWebFilterChain springSecurityFilterChain(ServerHttpSecurity http) {
    AuthenticationWebFilter bearerTokenFilter =
        new AuthenticationWebFilter(pluginTokenAuthenticationManager);
    bearerTokenFilter.setServerAuthenticationConverter(pluginTokenAuthenticationConverter);
    bearerTokenFilter.setAuthenticationFailureHandler(
        new ServerAuthenticationEntryPointFailureHandler(customAuthenticationEntryPoint()));

    http.csrf(ServerHttpSecurity.CsrfSpec::disable)
        .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
        .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
        .logout(ServerHttpSecurity.LogoutSpec::disable)
        .authorizeExchange(
            auth ->
                auth.pathMatchers("/actuator/health/**")
                    .permitAll()
                    .anyExchange()
                    .authenticated())
        .addFilterAt(bearerTokenFilter, SecurityWebFiltersOrder.AUTHENTICATION)
        .exceptionHandling(
            exceptions ->
                exceptions
                    .authenticationEntryPoint(customAuthenticationEntryPoint())
                    .accessDeniedHandler(customAccessDeniedHandler()));
    return http.build();
  }

  private static Mono<Void> writeForbidden(ServerHttpResponse response) {
    response.setStatusCode(HttpStatus.FORBIDDEN);
    response.getHeaders().setContentType(MediaType.TEXT_PLAIN);
    DataBuffer buffer =
        response.bufferFactory().wrap(FORBIDDEN_BODY.getBytes(StandardCharsets.UTF_8));
    return response.writeWith(Mono.just(buffer));
  }
}
