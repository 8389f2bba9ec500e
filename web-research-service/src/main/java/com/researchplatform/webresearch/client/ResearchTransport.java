package com.researchplatform.webresearch.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.researchplatform.common.model.EndpointKind;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Raw JSON-over-HTTP access to the research API. Implementations perform exactly one
 * HTTP exchange per subscription: no retry, caching or validation of their own.
 *
 * <p>Failures surface as {@link com.researchplatform.common.exception.TransportException}
 * (network errors and non-2xx statuses) or
 * {@link com.researchplatform.common.exception.SchemaValidationException} (body is not JSON).
 */
public interface ResearchTransport {

    Mono<JsonNode> post(EndpointKind endpoint, Map<String, Object> body);

    /** Plain GET against {@code path} relative to the base URL, with query parameters. */
    Mono<JsonNode> get(String path, Map<String, String> queryParams);
}
