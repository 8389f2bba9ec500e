package com.researchplatform.webresearch.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.exception.SchemaValidationException;
import com.researchplatform.common.model.EndpointKind;
import com.researchplatform.common.model.SearchTopic;
import com.researchplatform.webresearch.validation.payload.CrawlApiResponse;
import com.researchplatform.webresearch.validation.payload.ExtractApiResponse;
import com.researchplatform.webresearch.validation.payload.MapApiResponse;
import com.researchplatform.webresearch.validation.payload.SearchApiResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.researchplatform.webresearch.support.FakeResearchTransport.json;
import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator(new ObjectMapper());

    private static final String NEWS_OK = """
        {"query": "nvda guidance", "response_time": 0.84,
         "results": [
           {"title": "Nvidia raises guidance", "url": "https://www.reuters.com/a", "content": "c1",
            "score": 0.91, "published_date": "Tue, 03 Mar 2026 12:00:00 GMT"},
           {"title": "Chips rally", "url": "https://www.cnbc.com/b", "snippet": "s2",
            "score": 0.5, "published_date": "Mon, 02 Mar 2026 09:00:00 GMT", "raw_content": null}
         ],
         "answer": null, "follow_up_questions": null, "unknown_field": 42}
        """;

    // ── search ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("valid body decodes into the typed payload; unknown fields are ignored")
        void validDecodes() {
            ValidationResult<SearchApiResponse> result = validator.validate(ResponseSchemas.SEARCH, json(NEWS_OK));

            assertTrue(result.isValid(), () -> result.diagnostics().toString());
            SearchApiResponse payload = result.value();
            assertEquals("nvda guidance", payload.query());
            assertEquals(2, payload.results().size());
            assertEquals(0.91, payload.results().get(0).score());
            assertEquals("Tue, 03 Mar 2026 12:00:00 GMT", payload.results().get(0).publishedDate());
            assertNull(payload.answer());
        }

        @Test
        @DisplayName("diagnostics carry the full path of every violation")
        void pathDiagnostics() {
            ValidationResult<SearchApiResponse> result = validator.validate(ResponseSchemas.SEARCH, json("""
                {"results": [
                  {"title": "ok", "url": "https://a.com", "score": 0.2},
                  {"title": "ok", "url": "https://b.com", "score": 0.3},
                  {"title": 7, "url": "abc", "score": 1.5}
                ]}
                """));

            assertFalse(result.isValid());
            assertEquals(List.of(
                "query: required",
                "results[2].title: expected string, got number",
                "results[2].url: expected url, got \"abc\"",
                "results[2].score: expected number between 0 and 1, got 1.5"
            ), result.diagnostics());
        }

        @Test
        @DisplayName("news topic requires published_date on every result")
        void newsMissingDate() {
            ValidationResult<SearchApiResponse> result = validator.validateSearch(json("""
                {"query": "q", "results": [
                  {"title": "t1", "url": "https://a.com", "score": 0.4, "published_date": "2026-03-01"},
                  {"title": "t2", "url": "https://b.com", "score": 0.3}
                ]}
                """), SearchTopic.NEWS);

            assertFalse(result.isValid());
            assertEquals("topic \"news\" requires published_date but 1 results lack it", result.diagnostics().get(0));
            assertEquals("results[1].published_date: required for topic \"news\"", result.diagnostics().get(1));
        }

        @Test
        @DisplayName("the same body is valid for a general search")
        void generalTopicNoDateRule() {
            assertTrue(validator.validateSearch(json("""
                {"query": "q", "results": [{"title": "t", "url": "https://b.com", "score": 0.3}]}
                """), SearchTopic.GENERAL).isValid());
        }

        @Test
        @DisplayName("a blank date counts as missing")
        void blankDate() {
            assertFalse(validator.validateSearch(json("""
                {"query": "q", "results": [{"title": "t", "url": "https://b.com", "score": 0.3, "published_date": " "}]}
                """), SearchTopic.NEWS).isValid());
        }

        @Test
        @DisplayName("non-nullable optional field rejects explicit null")
        void optionalNotNullable() {
            ValidationResult<SearchApiResponse> result = validator.validate(ResponseSchemas.SEARCH,
                json("{\"query\": \"q\", \"results\": [], \"images\": null}"));

            assertEquals(List.of("images: must not be null"), result.diagnostics());
        }

        @Test
        @DisplayName("orElseThrow raises a schema exception with all diagnostics")
        void orElseThrow() {
            ValidationResult<SearchApiResponse> result = validator.validate(ResponseSchemas.SEARCH, json("[]"));

            SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> result.orElseThrow(EndpointKind.SEARCH));
            assertEquals(List.of("$: expected object, got array"), e.getDiagnostics());
        }
    }

    // ── extract / map / crawl ───────────────────────────────────────────────

    @Nested
    @DisplayName("extract, map and crawl")
    class OtherEndpoints {

        @Test
        @DisplayName("extract requires success flags and passes failed_results through")
        void extract() {
            ValidationResult<ExtractApiResponse> ok = validator.validate(ResponseSchemas.EXTRACT, json("""
                {"results": [{"url": "https://ir.example.com", "raw_content": "# Q4", "success": true}],
                 "failed_results": [{"url": "https://x.com", "error": "timeout"}]}
                """));
            assertTrue(ok.isValid());
            assertEquals(1, ok.value().failedResults().size());

            ValidationResult<ExtractApiResponse> bad = validator.validate(ResponseSchemas.EXTRACT, json("""
                {"results": [{"url": "https://ir.example.com", "success": "yes"}]}
                """));
            assertEquals(List.of("results[0].success: expected boolean, got \"yes\""), bad.diagnostics());
        }

        @Test
        @DisplayName("map results need a valid url, title is optional")
        void map() {
            ValidationResult<MapApiResponse> result = validator.validate(ResponseSchemas.MAP, json("""
                {"results": [{"url": "https://ir.example.com/a"}, {"url": "https://ir.example.com/b", "title": "B"}]}
                """));
            assertTrue(result.isValid());
            assertEquals("B", result.value().results().get(1).title());
        }

        @Test
        @DisplayName("crawl rejects a results field that is not an array")
        void crawl() {
            ValidationResult<CrawlApiResponse> result = validator.validate(ResponseSchemas.CRAWL,
                json("{\"results\": {}}"));
            assertEquals(List.of("results: expected array, got object"), result.diagnostics());
        }
    }
}
