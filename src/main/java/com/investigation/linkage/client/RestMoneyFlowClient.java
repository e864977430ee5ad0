package com.investigation.linkage.client;

import com.investigation.linkage.config.ExportConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

@Component
public class RestMoneyFlowClient implements MoneyFlowClient {

    private final RestClient restClient;

    @Autowired
    public RestMoneyFlowClient(ExportConfig config) {
        this(config, RestClient.builder().requestFactory(requestFactory(config)));
    }

    RestMoneyFlowClient(ExportConfig config, RestClient.Builder builder) {
        builder.baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.getApiToken() != null && !config.getApiToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiToken());
        }
        this.restClient = builder.build();
    }

    @Override
    public long createNode(long caseId, NodeCreateRequest request) {
        Map<?, ?> response = restClient.post()
                .uri("/cases/{caseId}/money-flow/nodes", caseId)
                .body(request)
                .retrieve()
                .body(Map.class);
        Object id = response != null ? response.get("id") : null;
        if (!(id instanceof Number)) {
            throw new RestClientException("Node create response for case " + caseId + " carried no id");
        }
        return ((Number) id).longValue();
    }

    @Override
    public void createEdge(long caseId, EdgeCreateRequest request) {
        restClient.post()
                .uri("/cases/{caseId}/money-flow/edges", caseId)
                .body(request)
                .retrieve()
                .toBodilessEntity();
    }

    private static SimpleClientHttpRequestFactory requestFactory(ExportConfig config) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(config.getConnectTimeoutMs());
        requestFactory.setReadTimeout(config.getReadTimeoutMs());
        return requestFactory;
    }
}
