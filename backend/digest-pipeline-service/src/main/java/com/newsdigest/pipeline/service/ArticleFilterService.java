package com.newsdigest.pipeline.service;

import com.newsdigest.pipeline.config.PipelineSettings.FilterSettings;
import com.newsdigest.pipeline.entity.CanonicalArticle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Quality gate between normalization and scoring.
 *
 * An article survives only when every check passes:
 * - title at least minTitleLength characters
 * - title free of block-list markers (case-insensitive)
 * - body text at least minBodyLength characters
 * - no older than maxAgeHours relative to asOf
 *
 * Input order is preserved and articles are never modified.
 */
@Service
@Slf4j
public class ArticleFilterService {

    public List<CanonicalArticle> filter(List<CanonicalArticle> articles, FilterSettings settings, OffsetDateTime asOf) {
        List<CanonicalArticle> survivors = new ArrayList<>(articles.size());
        for (CanonicalArticle article : articles) {
            Optional<RejectionReason> reason = evaluate(article, settings, asOf);
            if (reason.isPresent()) {
                log.debug("Filtered out {}: {}", article, reason.get());
            } else {
                survivors.add(article);
            }
        }
        log.info("Filter kept {}/{} articles", survivors.size(), articles.size());
        return survivors;
    }

    /**
     * First failed check, empty when the article passes.
     */
    public Optional<RejectionReason> evaluate(CanonicalArticle article, FilterSettings settings, OffsetDateTime asOf) {
        String title = article.getTitle();
        if (article.titleLength() < settings.minTitleLength()) {
            return Optional.of(RejectionReason.TITLE_TOO_SHORT);
        }
        if (isBlocked(title, settings.blockList())) {
            return Optional.of(RejectionReason.BLOCKED_TITLE);
        }
        if (article.bodyLength() < settings.minBodyLength()) {
            return Optional.of(RejectionReason.BODY_TOO_SHORT);
        }
        Duration age = Duration.between(article.getPublishedAt(), asOf);
        if (age.compareTo(Duration.ofHours(settings.maxAgeHours())) > 0) {
            return Optional.of(RejectionReason.TOO_OLD);
        }
        return Optional.empty();
    }

    private boolean isBlocked(String title, List<String> blockList) {
        String lower = title.toLowerCase(Locale.ROOT);
        for (String marker : blockList) {
            if (!marker.isEmpty() && lower.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
