package com.newsdigest.pipeline.config;

import com.newsdigest.pipeline.config.PipelineSettings.DifficultySettings;
import com.newsdigest.pipeline.config.PipelineSettings.FilterSettings;
import com.newsdigest.pipeline.config.PipelineSettings.RoutingSettings;
import com.newsdigest.pipeline.config.PipelineSettings.ScoringSettings;
import com.newsdigest.pipeline.entity.ArticleCategory;
import com.newsdigest.pipeline.entity.Difficulty;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.entity.RoutingTask;
import com.newsdigest.pipeline.exception.DigestPipelineException;
import com.newsdigest.pipeline.service.routing.ProviderRoutingTable;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Externalized configuration of the digest pipeline.
 *
 * Bound once by Spring; {@link #toSettings()} turns the current values into the immutable
 * {@link PipelineSettings} that a run actually uses.
 *
 * Credibility ranges from 0 to 100 where:
 * - 90+   : wire services and official filings
 * - 70-89 : established newspapers, curated preprint servers
 * - 50-69 : tech blogs and aggregators
 * - 10    : default for unknown sources
 */
@Configuration
@ConfigurationProperties(prefix = "digest")
@Data
public class DigestPipelineProperties {

    private Filter filter = new Filter();

    private Scoring scoring = new Scoring();

    private Routing routing = new Routing();

    /**
     * Provider connection settings, keyed by provider id (claude, openai, openrouter, ollama)
     */
    private Map<ProviderId, Provider> providers = new LinkedHashMap<>();

    private Cache cache = new Cache();

    @Data
    public static class Filter {
        private int minTitleLength = 10;

        private int minBodyLength = 50;

        private long maxAgeHours = 48;

        /** NewsAPI replaces deleted articles with "[Removed]" */
        private List<String> blockList = new ArrayList<>(List.of("[Removed]"));
    }

    static final Map<String, Integer> DEFAULT_CREDIBILITY = Map.of(
            "reuters", 90,
            "associated press", 90,
            "bloomberg", 85,
            "nikkei", 85,
            "edinet", 95,
            "arxiv", 75,
            "techcrunch", 70,
            "the verge", 65
    );

    @Data
    public static class Scoring {
        private List<String> keywords = new ArrayList<>(List.of("AI", "LLM", "OpenAI", "Claude", "生成AI"));

        private int pointsPerKeyword = 20;

        private int keywordCap = 40;

        private int unknownSourceCredibility = 10;

        /**
         * Source name to credibility. Entries override {@link #DEFAULT_CREDIBILITY}; names are
         * compared case-insensitively.
         */
        private Map<String, Integer> credibility = new LinkedHashMap<>();
    }

    @Data
    public static class Routing {
        /** Articles summarized in parallel */
        private int maxConcurrency = 4;

        /** Whole summarization stage; unfinished articles end up exhausted */
        private Duration runTimeout = Duration.ofMinutes(5);

        /** Passed to providers as the output token budget */
        private int maxOutputLength = 300;

        private Duration defaultProviderTimeout = Duration.ofSeconds(30);

        private List<ProviderId> defaultProviders = new ArrayList<>(List.of(ProviderId.CLAUDE, ProviderId.OPENAI, ProviderId.OLLAMA));

        private List<Rule> rules = new ArrayList<>();

        private DifficultyOverride difficulty = new DifficultyOverride();
    }

    @Data
    public static class Rule {
        private ArticleCategory category;

        private RoutingTask task = RoutingTask.SUMMARIZE;

        private List<ProviderId> providers = new ArrayList<>();
    }

    @Data
    public static class DifficultyOverride {
        /** Off by default: the category table decides */
        private boolean overrideEnabled = false;

        private List<String> technicalTerms = new ArrayList<>(List.of(
                "algorithm", "neural", "transformer", "theorem", "stochastic", "quantum",
                "regression", "gradient", "inference", "benchmark", "genome", "protein",
                "derivative", "arbitrage", "ebitda", "semiconductor", "lithography",
                "論文", "推論", "量子", "アルゴリズム"
        ));

        private double mediumDensity = 0.02;

        private double highDensity = 0.05;

        private Map<Difficulty, List<ProviderId>> tiers = new EnumMap<>(Difficulty.class);
    }

    @Data
    public static class Provider {
        private boolean enabled = false;

        private String apiKey;

        /** Falls back to the provider's public endpoint */
        private String baseUrl;

        private String model;

        private Duration timeout;

        /** Summary language: ja or en */
        private String language = "ja";
    }

    @Data
    public static class Cache {
        /** memory (Caffeine) or redis */
        private String type = "memory";

        private Duration ttl = Duration.ofDays(7);

        private long maximumSize = 10_000;
    }

    /**
     * Snapshot the current values into an immutable, validated settings object.
     */
    public PipelineSettings toSettings() {
        if (routing.getMaxConcurrency() < 1) {
            throw configError("digest.routing.max-concurrency must be at least 1");
        }
        if (routing.getDefaultProviders() == null || routing.getDefaultProviders().isEmpty()) {
            throw configError("digest.routing.default-providers must not be empty");
        }
        DifficultyOverride difficulty = routing.getDifficulty();
        if (difficulty.getMediumDensity() > difficulty.getHighDensity()) {
            throw configError("digest.routing.difficulty.medium-density must not exceed high-density");
        }

        FilterSettings filterSettings = new FilterSettings(
                filter.getMinTitleLength(),
                filter.getMinBodyLength(),
                filter.getMaxAgeHours(),
                filter.getBlockList());

        // defaults first so configured entries always win
        Map<String, Integer> credibility = new HashMap<>(DEFAULT_CREDIBILITY);
        scoring.getCredibility().forEach((source, value) -> credibility.put(source.toLowerCase(Locale.ROOT).strip(), value));
        ScoringSettings scoringSettings = new ScoringSettings(
                scoring.getKeywords(),
                scoring.getPointsPerKeyword(),
                scoring.getKeywordCap(),
                scoring.getUnknownSourceCredibility(),
                credibility);

        ProviderRoutingTable.Builder table = ProviderRoutingTable.builder()
                .defaultProviders(routing.getDefaultProviders())
                .difficultyOverride(difficulty.isOverrideEnabled());
        for (Rule rule : routing.getRules()) {
            if (rule.getCategory() == null || rule.getProviders().isEmpty()) {
                throw configError("digest.routing.rules entries need a category and at least one provider");
            }
            table.rule(rule.getCategory(), rule.getTask(), rule.getProviders());
        }
        difficulty.getTiers().forEach(table::tier);

        Map<ProviderId, Duration> timeouts = new EnumMap<>(ProviderId.class);
        providers.forEach((id, provider) -> {
            if (provider.getTimeout() != null) timeouts.put(id, provider.getTimeout());
        });

        RoutingSettings routingSettings = new RoutingSettings(
                table.build(),
                timeouts,
                routing.getDefaultProviderTimeout(),
                routing.getMaxConcurrency(),
                routing.getRunTimeout(),
                routing.getMaxOutputLength(),
                new DifficultySettings(
                        difficulty.getTechnicalTerms().stream()
                                .map(t -> t.toLowerCase(Locale.ROOT))
                                .collect(Collectors.toSet()),
                        difficulty.getMediumDensity(),
                        difficulty.getHighDensity()));

        return new PipelineSettings(filterSettings, scoringSettings, routingSettings);
    }

    private static DigestPipelineException configError(String message) {
        return new DigestPipelineException("CONFIGURATION_ERROR", message);
    }
}
