package com.newsdigest.pipeline.service.routing;

import com.newsdigest.pipeline.entity.ArticleCategory;
import com.newsdigest.pipeline.entity.Difficulty;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.entity.RoutingTask;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered provider lists per (category, task), with a default list and optional difficulty tiers.
 * Immutable once built; shared read-only by concurrent routing tasks.
 */
public final class ProviderRoutingTable {

    private final Map<RuleKey, List<ProviderId>> rules;
    private final List<ProviderId> defaultProviders;
    private final Map<Difficulty, List<ProviderId>> tiers;
    private final boolean difficultyOverride;

    private ProviderRoutingTable(Builder builder) {
        if (builder.defaultProviders.isEmpty()) {
            throw new IllegalArgumentException("Default provider list must not be empty");
        }
        this.rules = Map.copyOf(builder.rules);
        this.defaultProviders = builder.defaultProviders;
        this.tiers = Collections.unmodifiableMap(new EnumMap<>(builder.tiers));
        this.difficultyOverride = builder.difficultyOverride;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Provider order for an article.
     *
     * @param difficulty classified difficulty, only consulted when the override is enabled
     * @return tier list if the override applies, else the category rule, else the default list
     */
    public List<ProviderId> resolve(ArticleCategory category, RoutingTask task, Difficulty difficulty) {
        if (difficultyOverride && difficulty != null) {
            List<ProviderId> tier = tiers.get(difficulty);
            if (tier != null && !tier.isEmpty()) {
                return tier;
            }
        }
        return Optional.ofNullable(rules.get(new RuleKey(category, task))).orElse(defaultProviders);
    }

    public boolean isDifficultyOverride() {
        return difficultyOverride;
    }

    public List<ProviderId> getDefaultProviders() {
        return defaultProviders;
    }

    private record RuleKey(ArticleCategory category, RoutingTask task) {}

    public static final class Builder {
        private final Map<RuleKey, List<ProviderId>> rules = new HashMap<>();
        private final Map<Difficulty, List<ProviderId>> tiers = new EnumMap<>(Difficulty.class);
        private List<ProviderId> defaultProviders = List.of();
        private boolean difficultyOverride;

        private Builder() {
        }

        public Builder rule(ArticleCategory category, RoutingTask task, List<ProviderId> providers) {
            rules.put(new RuleKey(category, task), List.copyOf(providers));
            return this;
        }

        public Builder defaultProviders(List<ProviderId> providers) {
            this.defaultProviders = List.copyOf(providers);
            return this;
        }

        public Builder tier(Difficulty difficulty, List<ProviderId> providers) {
            tiers.put(difficulty, List.copyOf(providers));
            return this;
        }

        public Builder difficultyOverride(boolean enabled) {
            this.difficultyOverride = enabled;
            return this;
        }

        public ProviderRoutingTable build() {
            return new ProviderRoutingTable(this);
        }
    }
}
