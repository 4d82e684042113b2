package com.evoila.tenantplugin.generator;

import com.evoila.tenantplugin.generator.model.PluginRequest;
import com.evoila.tenantplugin.generator.model.PluginResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * ApplicationSet plugin generator endpoint. Authentication happens in the security filter chain
 * before this controller is reached; failures are rendered by the global exception handler.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class GeneratorController {

  public static final String GETPARAMS_PATH = "/api/v1/getparams.execute";

  private final GeneratorService generatorService;

  @PostMapping(value = GETPARAMS_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<PluginResponse> getParams(@RequestBody PluginRequest request) {
    log.debug("Generator call for ApplicationSet '{}'", request.applicationSetName());
    return generatorService.generate(request);
  }
}
