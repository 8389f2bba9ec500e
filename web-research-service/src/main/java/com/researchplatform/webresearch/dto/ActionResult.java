package com.researchplatform.webresearch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ActionResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message
) {
    public static ActionResult ok(String message) {
        return new ActionResult(true, message);
    }
}
