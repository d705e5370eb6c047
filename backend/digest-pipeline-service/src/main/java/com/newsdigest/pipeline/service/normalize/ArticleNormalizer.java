package com.newsdigest.pipeline.service.normalize;

import com.newsdigest.pipeline.dto.RawRecord;
import com.newsdigest.pipeline.dto.SourceDescriptor;
import com.newsdigest.pipeline.entity.ArticleCategory;
import com.newsdigest.pipeline.entity.CanonicalArticle;
import com.newsdigest.pipeline.entity.SourceType;
import com.newsdigest.pipeline.exception.ArticleValidationException;
import com.newsdigest.pipeline.exception.DigestPipelineException;
import com.newsdigest.pipeline.exception.NormalizationException;
import com.newsdigest.pipeline.util.ArticleIds;
import com.newsdigest.pipeline.util.LanguageDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Converts source-specific records into {@link CanonicalArticle}s.
 *
 * Field extraction is delegated to the {@link RecordNormalizer} registered for the descriptor's
 * source type; id derivation, date fallback, category and language rules are shared.
 * Pure: no I/O, no clock access.
 */
@Service
@Slf4j
public class ArticleNormalizer {

    /** Publish dates up to this far ahead of fetchedAt are treated as clock skew */
    static final Duration CLOCK_SKEW_TOLERANCE = Duration.ofHours(1);

    private final Map<SourceType, RecordNormalizer> normalizers = new EnumMap<>(SourceType.class);

    public ArticleNormalizer(List<RecordNormalizer> normalizers) {
        for (RecordNormalizer normalizer : normalizers) {
            RecordNormalizer previous = this.normalizers.put(normalizer.supportedType(), normalizer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate normalizer for " + normalizer.supportedType()
                        + ": " + previous.getClass().getSimpleName() + ", " + normalizer.getClass().getSimpleName());
            }
        }
        log.info("ArticleNormalizer initialized for source types {}", this.normalizers.keySet());
    }

    /**
     * @throws NormalizationException      required field missing or payload of the wrong shape
     * @throws ArticleValidationException  the resulting article violates an invariant
     */
    public CanonicalArticle normalize(RawRecord record, SourceDescriptor source) {
        RecordNormalizer normalizer = normalizers.get(source.type());
        if (normalizer == null) {
            throw NormalizationException.noNormalizer(source.type(), source.name());
        }
        if (record.fetchedAt() == null) {
            throw NormalizationException.missingField("fetchedAt", source.name());
        }

        ExtractedArticle extracted = extract(normalizer, record, source);

        String sourceName = firstNonBlank(extracted.sourceName(), source.name());
        if (sourceName == null) {
            throw NormalizationException.missingField("sourceName", source.name());
        }
        String title = firstNonBlank(extracted.title());
        if (title == null) {
            throw NormalizationException.missingField("title", sourceName);
        }
        String url = firstNonBlank(extracted.url());
        if (url == null) {
            throw NormalizationException.missingField("url", sourceName);
        }

        OffsetDateTime fetchedAt = record.fetchedAt().withOffsetSameInstant(ZoneOffset.UTC);

        return CanonicalArticle.builder()
                .id(ArticleIds.of(title, sourceName))
                .title(title)
                .sourceUrl(url)
                .sourceName(sourceName)
                .sourceType(source.type())
                .category(resolveCategory(source))
                .publishedAt(resolvePublishedAt(extracted.publishedAt(), fetchedAt, title))
                .fetchedAt(fetchedAt)
                .description(extracted.description())
                .content(extracted.content())
                .imageUrl(extracted.imageUrl())
                .authors(extracted.authors())
                .language(LanguageDetector.detect(title, extracted.description()))
                .rawPayload(record.payload())
                .build();
    }

    private static ExtractedArticle extract(RecordNormalizer normalizer, RawRecord record, SourceDescriptor source) {
        try {
            return normalizer.extract(record, source);
        } catch (DigestPipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NormalizationException(normalizer.getClass().getSimpleName() + " failed: " + e.getMessage(),
                    source.name(), e);
        }
    }

    /**
     * FILING implies FINANCE, PREPRINT implies SCIENCE; otherwise the descriptor's category.
     */
    static ArticleCategory resolveCategory(SourceDescriptor source) {
        ArticleCategory implied = source.type().impliedCategory();
        if (implied != null) {
            return implied;
        }
        return source.category() != null ? source.category() : ArticleCategory.UNKNOWN;
    }

    private OffsetDateTime resolvePublishedAt(OffsetDateTime publishedAt, OffsetDateTime fetchedAt, String title) {
        if (publishedAt == null) {
            log.debug("No usable publish date for '{}', using fetch time", title);
            return fetchedAt;
        }
        if (publishedAt.isAfter(fetchedAt)
                && Duration.between(fetchedAt, publishedAt).compareTo(CLOCK_SKEW_TOLERANCE) <= 0) {
            return fetchedAt;
        }
        // beyond the tolerance the article constructor rejects it
        return publishedAt;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.strip();
            }
        }
        return null;
    }
}
