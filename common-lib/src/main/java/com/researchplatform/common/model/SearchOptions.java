package com.researchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Optional knobs for a search call. Every field is nullable; {@code null} means
 * "use the upstream default".
 *
 * <p>{@code days} is only sent with {@link SearchTopic#NEWS}, {@code chunksPerSource}
 * only with {@link Depth#ADVANCED}, and {@code timeRange} only when {@code days} is absent.
 */
public record SearchOptions(
    @JsonProperty("topic") SearchTopic topic,
    @JsonProperty("depth") Depth depth,
    @JsonProperty("days") Integer days,
    @JsonProperty("timeRange") String timeRange,
    @JsonProperty("maxResults") Integer maxResults,
    @JsonProperty("includeRawContent") Boolean includeRawContent,
    @JsonProperty("chunksPerSource") Integer chunksPerSource,
    @JsonProperty("includeDomains") List<String> includeDomains,
    @JsonProperty("excludeDomains") List<String> excludeDomains
) {
    public static SearchOptions defaults() {
        return builder().build();
    }

    public static SearchOptions news(int days) {
        return builder().topic(SearchTopic.NEWS).days(days).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isNews() {
        return topic == SearchTopic.NEWS;
    }

    public static final class Builder {
        private SearchTopic topic;
        private Depth depth;
        private Integer days;
        private String timeRange;
        private Integer maxResults;
        private Boolean includeRawContent;
        private Integer chunksPerSource;
        private List<String> includeDomains;
        private List<String> excludeDomains;

        private Builder() {}

        public Builder topic(SearchTopic topic)              { this.topic = topic; return this; }
        public Builder depth(Depth depth)                    { this.depth = depth; return this; }
        public Builder days(Integer days)                    { this.days = days; return this; }
        public Builder timeRange(String timeRange)           { this.timeRange = timeRange; return this; }
        public Builder maxResults(Integer maxResults)        { this.maxResults = maxResults; return this; }
        public Builder includeRawContent(Boolean include)    { this.includeRawContent = include; return this; }
        public Builder chunksPerSource(Integer chunks)       { this.chunksPerSource = chunks; return this; }
        public Builder includeDomains(List<String> domains)  { this.includeDomains = domains; return this; }
        public Builder excludeDomains(List<String> domains)  { this.excludeDomains = domains; return this; }

        public SearchOptions build() {
            return new SearchOptions(topic, depth, days, timeRange, maxResults,
                includeRawContent, chunksPerSource, includeDomains, excludeDomains);
        }
    }
}
