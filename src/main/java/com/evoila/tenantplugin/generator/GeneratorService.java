package com.evoila.tenantplugin.generator;

import com.evoila.tenantplugin.common.config.PluginProperties;
import com.evoila.tenantplugin.generator.model.PluginRequest;
import com.evoila.tenantplugin.generator.model.PluginResponse;
import com.evoila.tenantplugin.tenant.TenantConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Runs one authenticated generator call: query enabled tenants, apply the caller's label filter,
 * flatten each tenant into parameters and wrap them in the response envelope.
 *
 * <p>Each call builds its own state; the repository and its session are the only shared pieces.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeneratorService {

  private final TenantConfigRepository tenantConfigRepository;
  private final TenantParameterProjector tenantParameterProjector;
  private final PluginProperties pluginProperties;

  public Mono<PluginResponse> generate(PluginRequest request) {
    LabelFilter filter = LabelFilter.fromParameters(request.parameters());
    if (filter.isActive()) {
      log.debug("Applying label filter {}={}", filter.key(), filter.value());
    }

    return tenantConfigRepository
        .fetchEnabledTenants()
        .map(tenants -> tenantParameterProjector.project(tenants, filter))
        .map(PluginResponse::assemble)
        .timeout(pluginProperties.getRequestTimeout())
        .doOnNext(
            response ->
                log.info(
                    "Generated {} parameter set(s) for ApplicationSet '{}'",
                    response.output().parameters().size(),
                    request.applicationSetName()));
  }
}
