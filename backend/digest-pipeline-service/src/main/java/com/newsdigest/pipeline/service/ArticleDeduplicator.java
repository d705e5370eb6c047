package com.newsdigest.pipeline.service;

import com.newsdigest.pipeline.entity.CanonicalArticle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Collapses articles whose titles differ only in case, surrounding whitespace or numbers
 * ("Toyota profit up 20%" / "toyota profit up 35%", "トヨタ純利益２０％増" / "トヨタ純利益３５％増").
 *
 * Per group the article with the highest relevance score wins, then the earliest publish date,
 * then the one that came first. Output keeps the order in which groups first appeared.
 */
@Service
@Slf4j
public class ArticleDeduplicator {

    /** Any Unicode digit run, full-width included */
    private static final Pattern DIGITS = Pattern.compile("\\d+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Comparator<CanonicalArticle> PREFERENCE = Comparator
            .comparingInt(ArticleDeduplicator::scoreOrMinusOne).reversed()
            .thenComparing(CanonicalArticle::getPublishedAt);

    public List<CanonicalArticle> deduplicate(List<CanonicalArticle> articles) {
        Map<String, Group> groups = new LinkedHashMap<>();
        for (CanonicalArticle article : articles) {
            groups.computeIfAbsent(keyOf(article.getTitle()), k -> new Group()).offer(article);
        }

        List<CanonicalArticle> survivors = new ArrayList<>(groups.size());
        for (Map.Entry<String, Group> entry : groups.entrySet()) {
            Group group = entry.getValue();
            if (group.size > 1) {
                group.representative.setDuplicate(true);
                log.debug("Duplicate group '{}' ({} articles) kept {}", entry.getKey(), group.size, group.representative);
            }
            survivors.add(group.representative);
        }
        log.info("Deduplication removed {} of {} articles", articles.size() - survivors.size(), articles.size());
        return survivors;
    }

    static String keyOf(String title) {
        return DIGITS.matcher(title.toLowerCase(Locale.ROOT).strip()).replaceAll("0");
    }

    private static int scoreOrMinusOne(CanonicalArticle article) {
        return article.getRelevanceScore() != null ? article.getRelevanceScore() : -1;
    }

    private static final class Group {
        private CanonicalArticle representative;
        private int size;

        void offer(CanonicalArticle candidate) {
            size++;
            // strictly better only, so ties keep the earlier element
            if (representative == null || PREFERENCE.compare(candidate, representative) < 0) {
                representative = candidate;
            }
        }
    }
}
