package com.researchplatform.webresearch.validation;

import com.researchplatform.common.model.EndpointKind;
import com.researchplatform.webresearch.validation.payload.CrawlApiResponse;
import com.researchplatform.webresearch.validation.payload.ExtractApiResponse;
import com.researchplatform.webresearch.validation.payload.MapApiResponse;
import com.researchplatform.webresearch.validation.payload.SearchApiResponse;

import static com.researchplatform.webresearch.validation.ValueTypes.anyArray;
import static com.researchplatform.webresearch.validation.ValueTypes.bool;
import static com.researchplatform.webresearch.validation.ValueTypes.number;
import static com.researchplatform.webresearch.validation.ValueTypes.objectArray;
import static com.researchplatform.webresearch.validation.ValueTypes.string;
import static com.researchplatform.webresearch.validation.ValueTypes.stringArray;
import static com.researchplatform.webresearch.validation.ValueTypes.url;

/** Expected response shapes of the four research endpoints. */
public final class ResponseSchemas {

    private ResponseSchemas() {}

    // ── search ──────────────────────────────────────────────────────────────

    private static final ObjectSchema SEARCH_RESULT = ObjectSchema.builder()
        .required("title", string())
        .required("url", url())
        .optionalNullable("content", string())
        .optionalNullable("snippet", string())
        .required("score", number(0, 1))
        .optionalNullable("published_date", string())   // only with topic news
        .optionalNullable("raw_content", string())
        .build();

    public static final ResponseSchema<SearchApiResponse> SEARCH = new ResponseSchema<>(
        EndpointKind.SEARCH,
        ObjectSchema.builder()
            .required("query", string())
            .required("results", objectArray(SEARCH_RESULT))
            .optionalNullable("answer", string())
            .optional("response_time", number())
            .optional("images", stringArray())
            .optionalNullable("follow_up_questions", stringArray())
            .build(),
        SearchApiResponse.class);

    // ── extract ─────────────────────────────────────────────────────────────

    private static final ObjectSchema EXTRACT_RESULT = ObjectSchema.builder()
        .required("url", url())
        .optional("raw_content", string())
        .optional("content", string())
        .required("success", bool())
        .optional("error", string())
        .build();

    public static final ResponseSchema<ExtractApiResponse> EXTRACT = new ResponseSchema<>(
        EndpointKind.EXTRACT,
        ObjectSchema.builder()
            .required("results", objectArray(EXTRACT_RESULT))
            .optional("failed_results", anyArray())
            .build(),
        ExtractApiResponse.class);

    // ── map ─────────────────────────────────────────────────────────────────

    private static final ObjectSchema MAP_RESULT = ObjectSchema.builder()
        .required("url", url())
        .optional("title", string())
        .build();

    public static final ResponseSchema<MapApiResponse> MAP = new ResponseSchema<>(
        EndpointKind.MAP,
        ObjectSchema.builder()
            .required("results", objectArray(MAP_RESULT))
            .build(),
        MapApiResponse.class);

    // ── crawl ───────────────────────────────────────────────────────────────

    private static final ObjectSchema CRAWL_RESULT = ObjectSchema.builder()
        .required("url", url())
        .optional("content", string())
        .optional("raw_content", string())
        .required("success", bool())
        .optional("error", string())
        .build();

    public static final ResponseSchema<CrawlApiResponse> CRAWL = new ResponseSchema<>(
        EndpointKind.CRAWL,
        ObjectSchema.builder()
            .required("results", objectArray(CRAWL_RESULT))
            .optional("failed_results", anyArray())
            .build(),
        CrawlApiResponse.class);
}
