package com.evoila.tenantplugin.generator;

import static com.evoila.tenantplugin.base.TestUtils.TEST_TOKEN;
import static com.evoila.tenantplugin.base.TestUtils.tenant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.evoila.tenantplugin.app.TenantPluginApplication;
import com.evoila.tenantplugin.tenant.TenantConfigException;
import com.evoila.tenantplugin.tenant.TenantConfigRecord;
import com.evoila.tenantplugin.tenant.TenantConfigRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webtestclient.autoconfigure.AutoConfigureWebTestClient;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@Tag("integration")
@SpringBootTest(
    classes = TenantPluginApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class GeneratorEndpointIntegrationTest {

  private static final String GETPARAMS = "/api/v1/getparams.execute";

  private static final String FILTER_BODY =
      """
      {
        "applicationSetName": "tenants",
        "input": {
          "parameters": {
            "filterLabelKey": "env",
            "filterLabelValue": "prod",
            "extra": {"nested": [1, 2, 3]}
          }
        },
        "unknownTopLevel": true
      }
      """;

  private static final String EMPTY_BODY =
      """
      {"applicationSetName": "tenants", "input": {"parameters": {}}}
      """;

  private static final String NULL_INPUT_BODY =
      """
      {"applicationSetName": "tenants", "input": null}
      """;

  @Autowired private WebTestClient webTestClient;

  @MockitoBean private TenantConfigRepository tenantConfigRepository;

  private WebTestClient.ResponseSpec post(String body, String authorization) {
    WebTestClient.RequestBodySpec request =
        webTestClient.post().uri(GETPARAMS).contentType(MediaType.APPLICATION_JSON);
    if (authorization != null) {
      request.header("Authorization", authorization);
    }
    return request.bodyValue(body).exchange();
  }

  @Test
  void missingAuthorizationIsForbidden() {
    post(EMPTY_BODY, null)
        .expectStatus()
        .isForbidden()
        .expectBody(String.class)
        .isEqualTo("forbidden");

    verifyNoInteractions(tenantConfigRepository);
  }

  @Test
  void wrongTokenIsForbidden() {
    post(EMPTY_BODY, "Bearer not-the-token").expectStatus().isForbidden();
    post(EMPTY_BODY, TEST_TOKEN).expectStatus().isForbidden();

    verifyNoInteractions(tenantConfigRepository);
  }

  @Test
  void emptyBearerAndOtherSchemesAreForbidden() {
    post(EMPTY_BODY, "Bearer ")
        .expectStatus()
        .isForbidden()
        .expectBody(String.class)
        .isEqualTo("forbidden");
    post(EMPTY_BODY, "Basic " + TEST_TOKEN)
        .expectStatus()
        .isForbidden()
        .expectBody(String.class)
        .isEqualTo("forbidden");

    verifyNoInteractions(tenantConfigRepository);
  }

  @Test
  void nullInputReturnsEveryEnabledTenant() {
    when(tenantConfigRepository.fetchEnabledTenants())
        .thenReturn(Mono.just(List.of(tenant("only"))));

    post(NULL_INPUT_BODY, "Bearer " + TEST_TOKEN)
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.output.parameters.length()")
        .isEqualTo(1)
        .jsonPath("$.output.parameters[0].tenantId")
        .isEqualTo("only");
  }

  @Test
  void collidingParamsKeepWriteOrderInResponse() {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("labels", "y");
    params.put("params", "x");
    when(tenantConfigRepository.fetchEnabledTenants())
        .thenReturn(Mono.just(List.of(tenant("a", Map.of("env", "prod"), params))));

    post(FILTER_BODY, "Bearer " + TEST_TOKEN)
        .expectStatus()
        .isOk()
        .expectBody(String.class)
        .value(
            body ->
                assertThat(body)
                    .isEqualTo(
                        "{\"output\":{\"parameters\":[{\"tenantId\":\"a\","
                            + "\"namespace\":\"a-ns\","
                            + "\"cluster\":\"https://a.cluster.local\","
                            + "\"repoURL\":\"https://git.example.com/a.git\","
                            + "\"path\":\"deploy/a\","
                            + "\"labels\":\"y\","
                            + "\"params\":{\"labels\":\"y\",\"params\":\"x\"}}]}}"));
  }

  @Test
  void returnsEveryEnabledTenantInQueryOrder() {
    when(tenantConfigRepository.fetchEnabledTenants())
        .thenReturn(Mono.just(List.of(tenant("second"), tenant("first"))));

    post(EMPTY_BODY, "Bearer " + TEST_TOKEN)
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.output.parameters.length()")
        .isEqualTo(2)
        .jsonPath("$.output.parameters[0].tenantId")
        .isEqualTo("second")
        .jsonPath("$.output.parameters[1].tenantId")
        .isEqualTo("first");
  }

  @Test
  void labelFilterReturnsOnlyMatchingTenant() {
    TenantConfigRecord prod =
        new TenantConfigRecord(
            "acme",
            "acme-prod",
            "https://prod.k8s.example.com",
            "https://git.example.com/acme.git",
            "envs/prod",
            Map.of("env", "prod"),
            Map.of("replicas", "3"));
    when(tenantConfigRepository.fetchEnabledTenants())
        .thenReturn(
            Mono.just(
                List.of(tenant("globex", Map.of("env", "staging"), null), prod, tenant("bare"))));

    post(FILTER_BODY, "Bearer " + TEST_TOKEN)
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.output.parameters.length()")
        .isEqualTo(1)
        .jsonPath("$.output.parameters[0].tenantId")
        .isEqualTo("acme")
        .jsonPath("$.output.parameters[0].namespace")
        .isEqualTo("acme-prod")
        .jsonPath("$.output.parameters[0].cluster")
        .isEqualTo("https://prod.k8s.example.com")
        .jsonPath("$.output.parameters[0].repoURL")
        .isEqualTo("https://git.example.com/acme.git")
        .jsonPath("$.output.parameters[0].path")
        .isEqualTo("envs/prod")
        .jsonPath("$.output.parameters[0].labels.env")
        .isEqualTo("prod")
        .jsonPath("$.output.parameters[0].params.replicas")
        .isEqualTo("3")
        .jsonPath("$.output.parameters[0].replicas")
        .isEqualTo("3");
  }

  @Test
  void paramNamedTenantIdOverridesColumn() {
    when(tenantConfigRepository.fetchEnabledTenants())
        .thenReturn(Mono.just(List.of(tenant("real", null, Map.of("tenantId", "spoofed")))));

    post(EMPTY_BODY, "Bearer " + TEST_TOKEN)
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.output.parameters[0].tenantId")
        .isEqualTo("spoofed");
  }

  @Test
  void upstreamFailureIsInternalErrorWithoutDetail() {
    when(tenantConfigRepository.fetchEnabledTenants())
        .thenReturn(
            Mono.error(
                new TenantConfigException("Tenant configuration row has no value for repo_url")));

    post(EMPTY_BODY, "Bearer " + TEST_TOKEN)
        .expectStatus()
        .is5xxServerError()
        .expectBody(String.class)
        .isEqualTo("internal error");
  }

  @Test
  void slowQueryTimesOutAsInternalError() {
    when(tenantConfigRepository.fetchEnabledTenants()).thenReturn(Mono.never());

    post(EMPTY_BODY, "Bearer " + TEST_TOKEN).expectStatus().is5xxServerError();
  }

  @Test
  void malformedBodyIsBadRequest() {
    post("{not json", "Bearer " + TEST_TOKEN).expectStatus().isBadRequest();

    verifyNoInteractions(tenantConfigRepository);
  }

  @Test
  void healthIsReachableWithoutToken() {
    webTestClient.get().uri("/actuator/health").exchange().expectStatus().isOk();
  }
}
