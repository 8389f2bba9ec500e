package com.researchplatform.webresearch.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.researchplatform.common.exception.SchemaValidationException;
import com.researchplatform.common.exception.TransportException;
import com.researchplatform.common.model.EndpointKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

public class WebClientResearchTransport implements ResearchTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientResearchTransport.class);

    private static final int MAX_ERROR_BODY_CHARS = 300;

    private final WebClient webClient;

    public WebClientResearchTransport(WebClient researchWebClient) {
        this.webClient = researchWebClient;
    }

    @Override
    public Mono<JsonNode> post(EndpointKind endpoint, Map<String, Object> body) {
        return webClient.post()
            .uri(endpoint.path())
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(errorBody -> new TransportException(endpoint, response.statusCode().value(),
                    "Research API " + endpoint.label() + " returned HTTP "
                        + response.statusCode().value() + abbreviate(errorBody))))
            .bodyToMono(JsonNode.class)
            .switchIfEmpty(Mono.error(() -> new TransportException(endpoint, 200,
                "Research API " + endpoint.label() + " returned an empty body")))
            .onErrorMap(WebClientRequestException.class, e -> new TransportException(endpoint,
                "Network error calling research API " + endpoint.label() + ": " + e.getMessage(), e))
            .onErrorMap(DecodingException.class, e -> new SchemaValidationException(endpoint,
                List.of("$: body is not valid JSON (" + e.getMessage() + ")")))
            .doOnError(e -> log.debug("[ResearchTransport] Call failed. endpoint={} reason={}",
                endpoint.label(), e.getMessage()));
    }

    @Override
    public Mono<JsonNode> get(String path, Map<String, String> queryParams) {
        return webClient.get()
            .uri(uriBuilder -> {
                uriBuilder.path(path);
                queryParams.forEach((name, value) -> uriBuilder.queryParam(name, value));
                return uriBuilder.build();
            })
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(errorBody -> new TransportException(null, response.statusCode().value(),
                    "Research API GET " + path + " returned HTTP "
                        + response.statusCode().value() + abbreviate(errorBody))))
            .bodyToMono(JsonNode.class)
            .switchIfEmpty(Mono.error(() -> new TransportException(null, 200,
                "Research API GET " + path + " returned an empty body")))
            .onErrorMap(WebClientRequestException.class, e -> new TransportException(null,
                "Network error calling research API GET " + path + ": " + e.getMessage(), e))
            .doOnError(e -> log.debug("[ResearchTransport] GET failed. path={} reason={}", path, e.getMessage()));
    }

    private static String abbreviate(String errorBody) {
        if (errorBody.isBlank()) {
            return "";
        }
        String trimmed = errorBody.length() > MAX_ERROR_BODY_CHARS
            ? errorBody.substring(0, MAX_ERROR_BODY_CHARS) + "..."
            : errorBody;
        return ": " + trimmed;
    }
}
