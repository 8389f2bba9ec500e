package com.researchplatform.webresearch.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.model.SearchTopic;
import com.researchplatform.webresearch.validation.payload.SearchApiResponse;
import com.researchplatform.webresearch.validation.payload.SearchApiResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Gate between raw upstream JSON and typed payloads. A body is decoded only after it
 * matches its {@link ResponseSchema}; otherwise every violation is reported at once.
 */
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private final ObjectMapper objectMapper;

    public SchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> ValidationResult<T> validate(ResponseSchema<T> schema, JsonNode body) {
        List<String> diagnostics = new ArrayList<>();
        if (body == null || body.isMissingNode() || body.isNull()) {
            diagnostics.add("$: expected object, got nothing");
        } else {
            schema.shape().validate(body, "", diagnostics);
        }

        if (!diagnostics.isEmpty()) {
            log.error("[SchemaValidator] Invalid {} response. diagnostics={}", schema.endpoint().label(), diagnostics);
            return ValidationResult.invalid(diagnostics);
        }

        try {
            return ValidationResult.valid(objectMapper.treeToValue(body, schema.payloadType()));
        } catch (JsonProcessingException e) {
            log.error("[SchemaValidator] Decode failed after validation. endpoint={} reason={}",
                      schema.endpoint().label(), e.getOriginalMessage());
            return ValidationResult.invalid(List.of("$: " + e.getOriginalMessage()));
        }
    }

    /**
     * Search validation plus the news rule: with topic {@code news} every result must carry
     * a non-empty {@code published_date}, and a single missing date fails the whole body.
     */
    public ValidationResult<SearchApiResponse> validateSearch(JsonNode body, SearchTopic topic) {
        ValidationResult<SearchApiResponse> base = validate(ResponseSchemas.SEARCH, body);
        if (!base.isValid() || topic != SearchTopic.NEWS) {
            return base;
        }

        List<String> diagnostics = new ArrayList<>();
        List<SearchApiResult> results = base.value().results();
        for (int i = 0; i < results.size(); i++) {
            String publishedDate = results.get(i).publishedDate();
            if (publishedDate == null || publishedDate.isBlank()) {
                diagnostics.add("results[" + i + "].published_date: required for topic \"news\"");
            }
        }
        if (diagnostics.isEmpty()) {
            return base;
        }

        diagnostics.add(0, "topic \"news\" requires published_date but "
            + diagnostics.size() + " results lack it");
        log.error("[SchemaValidator] News results missing published_date. diagnostics={}", diagnostics);
        return ValidationResult.invalid(diagnostics);
    }
}
