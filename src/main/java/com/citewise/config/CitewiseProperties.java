package com.citewise.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for Citewise.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "citewise")
public class CitewiseProperties {

    @Valid
    private ResearchConfig research = new ResearchConfig();

    @Valid
    private SearchConfig search = new SearchConfig();

    @Valid
    private FetchConfig fetch = new FetchConfig();

    @Valid
    private QueryConfig query = new QueryConfig();

    private Map<String, ProviderConfig> providers = new HashMap<>();

    @Valid
    private LlmConfig llm = new LlmConfig();

    @Data
    public static class ResearchConfig {
        private Map<String, ModeConfig> modes = defaultModes();

        @Min(1)
        private int defaultSources = 5;

        @Min(100)
        private int defaultSnippetChars = 1200;

        @Min(1)
        private int maxAnswerChars = 4000;

        @NotBlank
        private String provider = "openai";

        /**
         * Model for the summarisation call. Blank means the research provider's own model.
         */
        private String model;

        private static Map<String, ModeConfig> defaultModes() {
            Map<String, ModeConfig> modes = new LinkedHashMap<>();
            modes.put("quick", new ModeConfig(3, 800));
            modes.put("default", new ModeConfig(5, 1200));
            modes.put("deep", new ModeConfig(8, 1500));
            return modes;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModeConfig {
        private int sources;
        private int snippetChars;
    }

    @Data
    public static class SearchConfig {
        @NotBlank
        private String endpoint = "https://html.duckduckgo.com/html/";
        private String region = "us-en";
        private Duration timeout = Duration.ofSeconds(10);

        /** Bare numbers are seconds. */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration cacheTtl = Duration.ofSeconds(180);

        @Min(1)
        private int cacheMaxEntries = 256;

        private RetryConfig retry = new RetryConfig(3, Duration.ofSeconds(1), 2.0);

        @AssertTrue(message = "citewise.search.cache-ttl must not be negative")
        public boolean isCacheTtlValid() {
            return cacheTtl != null && !cacheTtl.isNegative();
        }
    }

    @Data
    public static class FetchConfig {
        private Duration timeout = Duration.ofSeconds(10);

        @Min(1024)
        private int maxDownloadBytes = 512 * 1024;

        private RetryConfig retry = new RetryConfig(2, Duration.ofMillis(500), 2.0);
    }

    @Data
    public static class QueryConfig {
        @Min(1)
        private int maxLength = 80;
        private int andSplitMinLength = 40;
        private int andSplitMinPartLength = 10;
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String model;
    }

    @Data
    public static class LlmConfig {
        private Duration timeout = Duration.ofSeconds(60);
        private RetryConfig retry = new RetryConfig(3, Duration.ofSeconds(1), 2.0);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RetryConfig {
        @Min(1)
        private int maxAttempts;
        private Duration baseDelay;
        private double factor;
    }
}
