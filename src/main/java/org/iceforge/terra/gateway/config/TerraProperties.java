package org.iceforge.terra.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "terra")
public class TerraProperties {

    /**
     * Reported by GET /health.
     */
    @NotBlank
    private String version = "0.3.0";

    /**
     * Location of the dataset manifest (YAML or JSON), e.g. classpath:manifest.yml or file:/etc/terra/manifest.yml
     */
    @NotBlank
    private String manifest = "classpath:manifest.yml";

    /**
     * Alias tables for place-name resolution, keyed by level (country, admin1, city).
     */
    @NotBlank
    private String aliases = "classpath:entity-aliases.yml";

    /**
     * Tool schemas served by GET /tools.
     */
    @NotBlank
    private String tools = "classpath:tools.json";

    /**
     * Legacy file id -> current file id. Applied before every catalog lookup.
     */
    private Map<String, String> fileIdAliases = new LinkedHashMap<>();

    @Valid
    private Query query = new Query();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Breaker breaker = new Breaker();

    @Valid
    private Resolver resolver = new Resolver();

    @Valid
    private Llm llm = new Llm();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getManifest() {
        return manifest;
    }

    public void setManifest(String manifest) {
        this.manifest = manifest;
    }

    public String getAliases() {
        return aliases;
    }

    public void setAliases(String aliases) {
        this.aliases = aliases;
    }

    public String getTools() {
        return tools;
    }

    public void setTools(String tools) {
        this.tools = tools;
    }

    public Map<String, String> getFileIdAliases() {
        return fileIdAliases;
    }

    public void setFileIdAliases(Map<String, String> fileIdAliases) {
        this.fileIdAliases = fileIdAliases;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public void setBreaker(Breaker breaker) {
        this.breaker = breaker;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public void setResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    public Llm getLlm() {
        return llm;
    }

    public void setLlm(Llm llm) {
        this.llm = llm;
    }

    public static class Query {

        /**
         * Row limit applied when a request gives none.
         */
        @Min(1)
        private int defaultLimit = 20;

        /**
         * Upper bound for limit and top_n; larger values are clamped.
         */
        @Min(1)
        private int maxLimit = 1000;

        @Min(1)
        private int maxSelectColumns = 50;

        @Min(1)
        private int maxGroupByColumns = 50;

        /**
         * Maximum number of keys in a where map.
         */
        @Min(1)
        private int maxFilters = 20;

        @Min(1)
        private int maxListItems = 100;

        @Min(1)
        private int maxStringLength = 500;

        /**
         * Wall-clock budget for one engine call. The statement itself is not cancelled.
         */
        @NotNull
        private Duration executionTimeout = Duration.ofSeconds(30);

        /**
         * Columns summed by default when a grouped request selects them without aggregations.
         */
        private List<String> defaultMeasures = List.of("emissions_tonnes", "MtCO2");

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        public int getMaxSelectColumns() {
            return maxSelectColumns;
        }

        public void setMaxSelectColumns(int maxSelectColumns) {
            this.maxSelectColumns = maxSelectColumns;
        }

        public int getMaxGroupByColumns() {
            return maxGroupByColumns;
        }

        public void setMaxGroupByColumns(int maxGroupByColumns) {
            this.maxGroupByColumns = maxGroupByColumns;
        }

        public int getMaxFilters() {
            return maxFilters;
        }

        public void setMaxFilters(int maxFilters) {
            this.maxFilters = maxFilters;
        }

        public int getMaxListItems() {
            return maxListItems;
        }

        public void setMaxListItems(int maxListItems) {
            this.maxListItems = maxListItems;
        }

        public int getMaxStringLength() {
            return maxStringLength;
        }

        public void setMaxStringLength(int maxStringLength) {
            this.maxStringLength = maxStringLength;
        }

        public Duration getExecutionTimeout() {
            return executionTimeout;
        }

        public void setExecutionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
        }

        public List<String> getDefaultMeasures() {
            return defaultMeasures;
        }

        public void setDefaultMeasures(List<String> defaultMeasures) {
            this.defaultMeasures = defaultMeasures;
        }
    }

    public static class Cache {

        private boolean enabled = true;

        @Min(1)
        private int capacity = 1000;

        @NotNull
        private Duration ttl = Duration.ofSeconds(300);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Breaker {

        /**
         * Consecutive engine failures that open the circuit.
         */
        @Min(1)
        private int maxFailures = 5;

        /**
         * Cooldown before a half-open trial call is allowed.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        public int getMaxFailures() {
            return maxFailures;
        }

        public void setMaxFailures(int maxFailures) {
            this.maxFailures = maxFailures;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Resolver {

        /**
         * Minimum similarity for a fuzzy suggestion.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double threshold = 0.75;

        @Min(1)
        private int maxSuggestions = 5;

        /**
         * sequence (Ratcliff/Obershelp) or levenshtein.
         */
        @NotBlank
        private String scorer = "sequence";

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getMaxSuggestions() {
            return maxSuggestions;
        }

        public void setMaxSuggestions(int maxSuggestions) {
            this.maxSuggestions = maxSuggestions;
        }

        public String getScorer() {
            return scorer;
        }

        public void setScorer(String scorer) {
            this.scorer = scorer;
        }
    }

    public static class Llm {

        /**
         * Base URL of an OpenAI-compatible API, e.g. http://localhost:8000/v1
         */
        @NotBlank
        private String baseUrl = "http://localhost:8000/v1";

        @NotBlank
        private String completionsPath = "/chat/completions";

        /**
         * Sent as a bearer token when set.
         */
        private String apiKey;

        @NotBlank
        private String model = "gpt-4o-mini";

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.2;

        @Min(1)
        private int maxConcurrentCalls = 10;

        @NotNull
        private Duration acquireTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(120);

        @NotBlank
        private String systemPrompt = "classpath:assistant-prompt.txt";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCompletionsPath() {
            return completionsPath;
        }

        public void setCompletionsPath(String completionsPath) {
            this.completionsPath = completionsPath;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxConcurrentCalls() {
            return maxConcurrentCalls;
        }

        public void setMaxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = maxConcurrentCalls;
        }

        public Duration getAcquireTimeout() {
            return acquireTimeout;
        }

        public void setAcquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }
    }
}
