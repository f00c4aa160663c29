package org.iceforge.terra.gateway.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.ErrorTranslator;
import org.iceforge.terra.gateway.engine.JdbcQueryEngine;
import org.iceforge.terra.gateway.engine.QueryEngine;
import org.iceforge.terra.gateway.engine.QueryException;
import org.iceforge.terra.gateway.entity.AliasTable;
import org.iceforge.terra.gateway.entity.EntityResolver;
import org.iceforge.terra.gateway.entity.LevenshteinScorer;
import org.iceforge.terra.gateway.entity.SequenceRatioScorer;
import org.iceforge.terra.gateway.entity.SimilarityScorer;
import org.iceforge.terra.gateway.resilience.CircuitBreaker;
import org.iceforge.terra.gateway.resilience.ResultCache;
import org.iceforge.terra.gateway.service.CoverageIndexProvider;
import org.iceforge.terra.gateway.sql.ComplexityGuard;
import org.iceforge.terra.gateway.sql.FilterParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(TerraProperties.class)
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Defining the YAML mapper below would otherwise switch off Boot's JSON mapper.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.build();
    }

    @Bean
    public ObjectMapper yamlObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WebClient llmWebClient(TerraProperties props) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getLlm().getBaseUrl());
        if (StringUtils.hasText(props.getLlm().getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getLlm().getApiKey());
        }
        return builder.build();
    }

    @Bean
    public QueryEngine queryEngine(JdbcTemplate jdbcTemplate) {
        return new JdbcQueryEngine(jdbcTemplate);
    }

    @Bean
    public ResultCache<List<Map<String, Object>>> resultCache(TerraProperties props, Clock clock) {
        TerraProperties.Cache c = props.getCache();
        return new ResultCache<>(c.getCapacity(), c.getTtl(), clock);
    }

    /**
     * Caller mistakes (bad column, unknown place) say nothing about engine health.
     */
    @Bean
    public CircuitBreaker engineCircuitBreaker(TerraProperties props, Clock clock) {
        TerraProperties.Breaker b = props.getBreaker();
        return new CircuitBreaker(b.getMaxFailures(), b.getTimeout(), clock, e -> !(e instanceof QueryException qe
                && (qe.getCode() == ErrorCode.VALIDATION_ERROR || qe.getCode() == ErrorCode.NOT_FOUND)));
    }

    @Bean
    public ComplexityGuard complexityGuard(TerraProperties props) {
        TerraProperties.Query q = props.getQuery();
        return new ComplexityGuard(q.getMaxSelectColumns(), q.getMaxGroupByColumns(), q.getMaxFilters(),
                q.getMaxListItems(), q.getMaxStringLength());
    }

    @Bean
    public FilterParser filterParser(TerraProperties props) {
        return new FilterParser(props.getQuery().getMaxStringLength(), props.getQuery().getMaxListItems());
    }

    @Bean
    public SimilarityScorer similarityScorer(TerraProperties props) {
        String name = props.getResolver().getScorer().toLowerCase(Locale.ROOT);
        switch (name) {
            case "sequence":
                return new SequenceRatioScorer();
            case "levenshtein":
                return new LevenshteinScorer();
            default:
                throw new IllegalStateException("Unknown terra.resolver.scorer '" + name + "' (expected sequence or levenshtein)");
        }
    }

    @Bean
    public ErrorTranslator errorTranslator(SimilarityScorer scorer) {
        return new ErrorTranslator(scorer);
    }

    @Bean
    public AliasTable aliasTable(@Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper,
                                 ResourceLoader resourceLoader, TerraProperties props) {
        Resource resource = resourceLoader.getResource(props.getAliases());
        if (!resource.exists()) {
            log.warn("Alias resource {} not found; resolving without aliases", props.getAliases());
            return AliasTable.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            Map<String, Map<String, String>> raw = yamlObjectMapper.readValue(in, new TypeReference<>() {
            });
            AliasTable table = new AliasTable(raw);
            log.info("Loaded entity aliases from {}", props.getAliases());
            return table;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load entity aliases: " + props.getAliases(), e);
        }
    }

    @Bean
    public EntityResolver entityResolver(AliasTable aliasTable, CoverageIndexProvider coverage,
                                         SimilarityScorer scorer, TerraProperties props) {
        TerraProperties.Resolver r = props.getResolver();
        return new EntityResolver(aliasTable, coverage::coverage, scorer, r.getThreshold(), r.getMaxSuggestions());
    }
}
