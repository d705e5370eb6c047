package com.newsdigest.pipeline.service;

import com.newsdigest.pipeline.entity.ArticleCategory;
import com.newsdigest.pipeline.entity.CanonicalArticle;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Groups articles by category and orders each group by relevance score, then recency.
 */
@Service
public class ArticleRanker {

    static final Comparator<CanonicalArticle> RANK_ORDER = Comparator
            .comparingInt((CanonicalArticle a) -> a.getRelevanceScore() != null ? a.getRelevanceScore() : -1)
            .thenComparing(CanonicalArticle::getPublishedAt)
            .reversed();

    /**
     * @return categories in enum order; categories without articles are absent
     */
    public Map<ArticleCategory, List<CanonicalArticle>> rank(List<CanonicalArticle> articles) {
        Map<ArticleCategory, List<CanonicalArticle>> partitions = new EnumMap<>(ArticleCategory.class);
        for (CanonicalArticle article : articles) {
            partitions.computeIfAbsent(article.getCategory(), c -> new ArrayList<>()).add(article);
        }
        // List.sort is stable
        partitions.replaceAll((category, list) -> {
            list.sort(RANK_ORDER);
            return Collections.unmodifiableList(list);
        });
        return Collections.unmodifiableMap(partitions);
    }
}
